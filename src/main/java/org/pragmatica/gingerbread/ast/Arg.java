package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record Arg(SyntaxNode syntax) implements AstNode {

    public static Optional<Arg> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.ARG
               ? Optional.of(new Arg(node))
               : Optional.empty();
    }

    public Optional<Expr> value(SyntaxTree tree) {
        return Children.node(syntax, tree, Expr::cast);
    }
}
