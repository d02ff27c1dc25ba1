package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

/**
 * A name, optionally applied to arguments. Without arguments it may also refer to a variable.
 */
public record FncCall(SyntaxNode syntax) implements Expr {

    public static Optional<FncCall> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.FNC_CALL
               ? Optional.of(new FncCall(node))
               : Optional.empty();
    }

    public Optional<Ident> name(SyntaxTree tree) {
        return Children.token(syntax, tree, Ident::cast);
    }

    public Optional<ArgList> argList(SyntaxTree tree) {
        return Children.node(syntax, tree, ArgList::cast);
    }
}
