package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record Slash(SyntaxToken syntax) implements Op {

    public static Optional<Slash> cast(SyntaxToken token, SyntaxTree tree) {
        return token.kind(tree) == TokenKind.SLASH
               ? Optional.of(new Slash(token))
               : Optional.empty();
    }
}
