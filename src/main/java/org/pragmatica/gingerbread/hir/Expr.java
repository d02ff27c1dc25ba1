package org.pragmatica.gingerbread.hir;

import java.util.List;
import java.util.Optional;

/**
 * Lowered expression. Subexpressions are referenced by identifier, never directly.
 */
public sealed interface Expr {

    /**
     * Stands in for an expression that could not be lowered.
     */
    record Missing() implements Expr {}

    /**
     * The operator is absent only if the source had none.
     */
    record Bin(Idx<Expr> lhs, Idx<Expr> rhs, Optional<BinOp> op) implements Expr {}

    record Block(List<Stmt> stmts, Optional<Idx<Expr>> tailExpr) implements Expr {
        public Block {
            stmts = List.copyOf(stmts);
        }
    }

    record FncCall(Idx<FncDef> def, List<Idx<Expr>> args) implements Expr {
        public FncCall {
            args = List.copyOf(args);
        }
    }

    record VarRef(VarDefId def) implements Expr {}

    /**
     * Unsigned 32-bit value.
     */
    record IntLiteral(long value) implements Expr {}

    record StringLiteral(String value) implements Expr {}
}
