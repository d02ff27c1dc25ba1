package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.List;
import java.util.Optional;

public record ArgList(SyntaxNode syntax) implements AstNode {

    public static Optional<ArgList> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.ARG_LIST
               ? Optional.of(new ArgList(node))
               : Optional.empty();
    }

    public List<Arg> args(SyntaxTree tree) {
        return Children.nodes(syntax, tree, Arg::cast);
    }
}
