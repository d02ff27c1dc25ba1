package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

/**
 * String literal token, quotes included.
 */
public record Str(SyntaxToken syntax) implements AstToken {

    public static Optional<Str> cast(SyntaxToken token, SyntaxTree tree) {
        return token.kind(tree) == TokenKind.STRING
               ? Optional.of(new Str(token))
               : Optional.empty();
    }

    /**
     * Contents of the literal without the surrounding quotes.
     */
    public String value(SyntaxTree tree) {
        var text = text(tree);
        return text.substring(1, text.length() - 1);
    }
}
