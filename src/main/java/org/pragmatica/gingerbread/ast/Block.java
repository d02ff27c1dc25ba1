package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.List;
import java.util.Optional;

public record Block(SyntaxNode syntax) implements Expr {

    public static Optional<Block> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.BLOCK
               ? Optional.of(new Block(node))
               : Optional.empty();
    }

    public List<Stmt> stmts(SyntaxTree tree) {
        return Children.nodes(syntax, tree, Stmt::cast);
    }

    public Optional<Expr> tailExpr(SyntaxTree tree) {
        return Children.node(syntax, tree, Expr::cast);
    }
}
