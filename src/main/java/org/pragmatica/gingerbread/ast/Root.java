package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.List;
import java.util.Optional;

/**
 * Whole parsed unit.
 */
public record Root(SyntaxNode syntax) implements AstNode {

    public static Optional<Root> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.ROOT
               ? Optional.of(new Root(node))
               : Optional.empty();
    }

    public List<Def> defs(SyntaxTree tree) {
        return Children.nodes(syntax, tree, Def::cast);
    }

    public List<Stmt> stmts(SyntaxTree tree) {
        return Children.nodes(syntax, tree, Stmt::cast);
    }

    /**
     * Unterminated expression ending a REPL line.
     */
    public Optional<Expr> tailExpr(SyntaxTree tree) {
        return Children.node(syntax, tree, Expr::cast);
    }
}
