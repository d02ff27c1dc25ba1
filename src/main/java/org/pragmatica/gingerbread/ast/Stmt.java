package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public sealed interface Stmt extends AstNode permits LocalDef, ExprStmt {

    static Optional<Stmt> cast(SyntaxNode node, SyntaxTree tree) {
        return switch (node.kind(tree)) {
            case LOCAL_DEF -> Optional.of(new LocalDef(node));
            case EXPR_STMT -> Optional.of(new ExprStmt(node));
            default -> Optional.empty();
        };
    }
}
