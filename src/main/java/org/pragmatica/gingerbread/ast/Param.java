package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record Param(SyntaxNode syntax) implements AstNode {

    public static Optional<Param> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.PARAM
               ? Optional.of(new Param(node))
               : Optional.empty();
    }

    public Optional<Ident> name(SyntaxTree tree) {
        return Children.token(syntax, tree, Ident::cast);
    }

    public Optional<Ty> ty(SyntaxTree tree) {
        return Children.node(syntax, tree, Ty::cast);
    }
}
