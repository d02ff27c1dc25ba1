package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record FncDef(SyntaxNode syntax) implements Def {

    public static Optional<FncDef> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.FNC_DEF
               ? Optional.of(new FncDef(node))
               : Optional.empty();
    }

    public Optional<Ident> name(SyntaxTree tree) {
        return Children.token(syntax, tree, Ident::cast);
    }

    public Optional<ParamList> paramList(SyntaxTree tree) {
        return Children.node(syntax, tree, ParamList::cast);
    }

    public Optional<RetTy> retTy(SyntaxTree tree) {
        return Children.node(syntax, tree, RetTy::cast);
    }

    public Optional<Expr> body(SyntaxTree tree) {
        return Children.node(syntax, tree, Expr::cast);
    }
}
