package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record Ident(SyntaxToken syntax) implements AstToken {

    public static Optional<Ident> cast(SyntaxToken token, SyntaxTree tree) {
        return token.kind(tree) == TokenKind.IDENT
               ? Optional.of(new Ident(token))
               : Optional.empty();
    }
}
