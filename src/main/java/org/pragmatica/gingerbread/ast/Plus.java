package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record Plus(SyntaxToken syntax) implements Op {

    public static Optional<Plus> cast(SyntaxToken token, SyntaxTree tree) {
        return token.kind(tree) == TokenKind.PLUS
               ? Optional.of(new Plus(token))
               : Optional.empty();
    }
}
