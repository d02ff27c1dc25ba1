package org.pragmatica.gingerbread.hir;

public sealed interface Stmt {
    record Local(Idx<LocalDef> id) implements Stmt {}

    record ExprStmt(Idx<Expr> expr) implements Stmt {}
}
