package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record StringLiteral(SyntaxNode syntax) implements Expr {

    public static Optional<StringLiteral> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.STRING_LITERAL
               ? Optional.of(new StringLiteral(node))
               : Optional.empty();
    }

    public Optional<Str> value(SyntaxTree tree) {
        return Children.token(syntax, tree, Str::cast);
    }
}
