package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

/**
 * Top-level definition.
 */
public sealed interface Def extends AstNode permits FncDef {

    static Optional<Def> cast(SyntaxNode node, SyntaxTree tree) {
        return FncDef.cast(node, tree).map(Def.class::cast);
    }
}
