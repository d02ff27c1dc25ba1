package org.pragmatica.gingerbread.hir;

/**
 * Function definition. Parameters are a contiguous range of the program's parameter arena.
 */
public record FncDef(IdRange<Param> params, Ty retTy, Idx<Expr> body) {}
