package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

/**
 * {@code lhs op rhs}.
 */
public record BinExpr(SyntaxNode syntax) implements Expr {

    public static Optional<BinExpr> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.BIN_EXPR
               ? Optional.of(new BinExpr(node))
               : Optional.empty();
    }

    public Optional<Expr> lhs(SyntaxTree tree) {
        return operand(tree, false);
    }

    /**
     * Both operands are expressions, so the right one is the expression child after the operator.
     * When the left operand parsed into an error node it is still found here.
     */
    public Optional<Expr> rhs(SyntaxTree tree) {
        return operand(tree, true);
    }

    private Optional<Expr> operand(SyntaxTree tree, boolean afterOp) {
        boolean seenOp = false;
        for (var child : syntax.childrenWithTokens(tree)) {
            if (child instanceof SyntaxToken token) {
                seenOp |= Op.cast(token, tree).isPresent();
            } else if (seenOp == afterOp) {
                var expr = Expr.cast((SyntaxNode) child, tree);
                if (expr.isPresent()) {
                    return expr;
                }
            }
        }
        return Optional.empty();
    }

    public Optional<Op> op(SyntaxTree tree) {
        return Children.token(syntax, tree, Op::cast);
    }
}
