package org.pragmatica.gingerbread.hir;

import java.util.List;
import java.util.Optional;

/**
 * Lowered unit: the arenas holding every entity plus the top-level items in source order.
 *
 * <p>Arena accessors return copies; use {@link #expr(Idx)} and friends for lookups.
 *
 * @param tailExpr trailing expression of a REPL line
 */
public record Program(Arena<LocalDef> localDefs,
                      Arena<FncDef> fncDefs,
                      Arena<Param> params,
                      Arena<Expr> exprs,
                      List<Def> defs,
                      List<Stmt> stmts,
                      Optional<Idx<Expr>> tailExpr) {

    public Program {
        localDefs = localDefs.copy();
        fncDefs = fncDefs.copy();
        params = params.copy();
        exprs = exprs.copy();
        defs = List.copyOf(defs);
        stmts = List.copyOf(stmts);
    }

    public static Program empty() {
        return new Program(Arena.create(),
                           Arena.create(),
                           Arena.create(),
                           Arena.create(),
                           List.of(),
                           List.of(),
                           Optional.empty());
    }

    @Override
    public Arena<LocalDef> localDefs() {
        return localDefs.copy();
    }

    @Override
    public Arena<FncDef> fncDefs() {
        return fncDefs.copy();
    }

    @Override
    public Arena<Param> params() {
        return params.copy();
    }

    @Override
    public Arena<Expr> exprs() {
        return exprs.copy();
    }

    public Expr expr(Idx<Expr> idx) {
        return exprs.get(idx);
    }

    public LocalDef localDef(Idx<LocalDef> idx) {
        return localDefs.get(idx);
    }

    public FncDef fncDef(Idx<FncDef> idx) {
        return fncDefs.get(idx);
    }

    public Param param(Idx<Param> idx) {
        return params.get(idx);
    }
}
