package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

/**
 * Type reference. The name is absent when the parser had to recover.
 */
public record Ty(SyntaxNode syntax) implements AstNode {

    public static Optional<Ty> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.TY
               ? Optional.of(new Ty(node))
               : Optional.empty();
    }

    public Optional<Ident> name(SyntaxTree tree) {
        return Children.token(syntax, tree, Ident::cast);
    }
}
