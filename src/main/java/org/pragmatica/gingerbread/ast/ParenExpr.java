package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record ParenExpr(SyntaxNode syntax) implements Expr {

    public static Optional<ParenExpr> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.PAREN_EXPR
               ? Optional.of(new ParenExpr(node))
               : Optional.empty();
    }

    public Optional<Expr> inner(SyntaxTree tree) {
        return Children.node(syntax, tree, Expr::cast);
    }
}
