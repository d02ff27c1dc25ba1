package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.List;
import java.util.Optional;

public record ParamList(SyntaxNode syntax) implements AstNode {

    public static Optional<ParamList> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.PARAM_LIST
               ? Optional.of(new ParamList(node))
               : Optional.empty();
    }

    public List<Param> params(SyntaxTree tree) {
        return Children.nodes(syntax, tree, Param::cast);
    }
}
