package org.pragmatica.gingerbread.lexer;

import org.pragmatica.gingerbread.tree.TextRange;

import java.nio.charset.StandardCharsets;

/**
 * A single lexical token: its kind and the byte range of its text within the UTF-8 encoded input.
 */
public record Token(TokenKind kind, TextRange range) {

    public static Token of(TokenKind kind, int start, int end) {
        return new Token(kind, TextRange.of(start, end));
    }

    /**
     * Text of this token, decoded from the UTF-8 encoded input it was produced from.
     */
    public String text(byte[] source) {
        return new String(source, range.start(), range.length(), StandardCharsets.UTF_8);
    }

    public boolean isTrivia() {
        return kind.isTrivia();
    }
}
