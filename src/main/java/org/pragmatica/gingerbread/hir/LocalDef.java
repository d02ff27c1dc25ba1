package org.pragmatica.gingerbread.hir;

public record LocalDef(Idx<Expr> value) {}
