package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.lexer.Token;
import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.tree.TextRange;

import java.util.List;
import java.util.Optional;

/**
 * Cursor over the token stream that hides trivia from the grammar.
 */
final class Source {
    private final List<Token> tokens;
    private int cursor;
    private TextRange lastTokenRange;

    Source(List<Token> tokens) {
        this.tokens = tokens;
        this.cursor = 0;
        this.lastTokenRange = null;
    }

    Optional<TokenKind> peekKind() {
        skipTrivia();
        return cursor < tokens.size()
               ? Optional.of(tokens.get(cursor).kind())
               : Optional.empty();
    }

    Optional<Token> peekToken() {
        skipTrivia();
        return cursor < tokens.size()
               ? Optional.of(tokens.get(cursor))
               : Optional.empty();
    }

    Token bump() {
        skipTrivia();
        if (cursor >= tokens.size()) {
            throw new IllegalStateException("Cannot consume a token at end of input");
        }
        var token = tokens.get(cursor++);
        lastTokenRange = token.range();
        return token;
    }

    /**
     * Range of the last consumed token, if any token has been consumed.
     */
    Optional<TextRange> lastTokenRange() {
        return Optional.ofNullable(lastTokenRange);
    }

    /**
     * Index of the next token, trivia included. Identifies a position in the stream.
     */
    int position() {
        skipTrivia();
        return cursor;
    }

    private void skipTrivia() {
        while (cursor < tokens.size() && tokens.get(cursor).isTrivia()) {
            cursor++;
        }
    }
}
