package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

/**
 * Return type annotation of a function, {@code : Ty}.
 */
public record RetTy(SyntaxNode syntax) implements AstNode {

    public static Optional<RetTy> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.RET_TY
               ? Optional.of(new RetTy(node))
               : Optional.empty();
    }

    public Optional<Ty> ty(SyntaxTree tree) {
        return Children.node(syntax, tree, Ty::cast);
    }
}
