package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

/**
 * Any expression node.
 */
public sealed interface Expr extends AstNode permits BinExpr, Block, FncCall, IntLiteral, StringLiteral, ParenExpr {

    static Optional<Expr> cast(SyntaxNode node, SyntaxTree tree) {
        return switch (node.kind(tree)) {
            case BIN_EXPR -> Optional.of(new BinExpr(node));
            case BLOCK -> Optional.of(new Block(node));
            case FNC_CALL -> Optional.of(new FncCall(node));
            case INT_LITERAL -> Optional.of(new IntLiteral(node));
            case STRING_LITERAL -> Optional.of(new StringLiteral(node));
            case PAREN_EXPR -> Optional.of(new ParenExpr(node));
            default -> Optional.empty();
        };
    }
}
