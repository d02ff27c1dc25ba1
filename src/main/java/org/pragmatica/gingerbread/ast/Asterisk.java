package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record Asterisk(SyntaxToken syntax) implements Op {

    public static Optional<Asterisk> cast(SyntaxToken token, SyntaxTree tree) {
        return token.kind(tree) == TokenKind.ASTERISK
               ? Optional.of(new Asterisk(token))
               : Optional.empty();
    }
}
