package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record Hyphen(SyntaxToken syntax) implements Op {

    public static Optional<Hyphen> cast(SyntaxToken token, SyntaxTree tree) {
        return token.kind(tree) == TokenKind.HYPHEN
               ? Optional.of(new Hyphen(token))
               : Optional.empty();
    }
}
