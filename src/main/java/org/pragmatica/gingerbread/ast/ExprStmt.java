package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record ExprStmt(SyntaxNode syntax) implements Stmt {

    public static Optional<ExprStmt> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.EXPR_STMT
               ? Optional.of(new ExprStmt(node))
               : Optional.empty();
    }

    public Optional<Expr> expr(SyntaxTree tree) {
        return Children.node(syntax, tree, Expr::cast);
    }
}
