package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

/**
 * {@code let name = value;}
 */
public record LocalDef(SyntaxNode syntax) implements Stmt {

    public static Optional<LocalDef> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.LOCAL_DEF
               ? Optional.of(new LocalDef(node))
               : Optional.empty();
    }

    public Optional<Ident> name(SyntaxTree tree) {
        return Children.token(syntax, tree, Ident::cast);
    }

    public Optional<Expr> value(SyntaxTree tree) {
        return Children.node(syntax, tree, Expr::cast);
    }
}
