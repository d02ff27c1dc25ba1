package org.pragmatica.gingerbread.lower;

import org.pragmatica.gingerbread.ast.Asterisk;
import org.pragmatica.gingerbread.ast.BinExpr;
import org.pragmatica.gingerbread.ast.Block;
import org.pragmatica.gingerbread.ast.FncCall;
import org.pragmatica.gingerbread.ast.Hyphen;
import org.pragmatica.gingerbread.ast.IntLiteral;
import org.pragmatica.gingerbread.ast.Op;
import org.pragmatica.gingerbread.ast.ParenExpr;
import org.pragmatica.gingerbread.ast.Plus;
import org.pragmatica.gingerbread.ast.Root;
import org.pragmatica.gingerbread.ast.StringLiteral;
import org.pragmatica.gingerbread.hir.Arena;
import org.pragmatica.gingerbread.hir.BinOp;
import org.pragmatica.gingerbread.hir.Def;
import org.pragmatica.gingerbread.hir.Expr;
import org.pragmatica.gingerbread.hir.FncDef;
import org.pragmatica.gingerbread.hir.IdRange;
import org.pragmatica.gingerbread.hir.Idx;
import org.pragmatica.gingerbread.hir.LocalDef;
import org.pragmatica.gingerbread.hir.Param;
import org.pragmatica.gingerbread.hir.Program;
import org.pragmatica.gingerbread.hir.Stmt;
import org.pragmatica.gingerbread.hir.Ty;
import org.pragmatica.gingerbread.hir.VarDefId;
import org.pragmatica.gingerbread.lower.LowerErrorKind.UndefinedFnc;
import org.pragmatica.gingerbread.lower.LowerErrorKind.UndefinedTy;
import org.pragmatica.gingerbread.lower.LowerErrorKind.UndefinedVarOrFnc;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State of a single lowering call.
 */
final class LowerContext {
    private final SyntaxTree tree;
    private final Arena<LocalDef> localDefs;
    private final Arena<FncDef> fncDefs;
    private final Arena<Param> params;
    private final Arena<Expr> exprs;
    private final SourceMap sourceMap;
    private final List<LowerError> errors;
    private final Map<String, Idx<FncDef>> fncNames;
    private final Scopes scopes;

    LowerContext(SyntaxTree tree, InScope inScope) {
        var seed = inScope.program();
        this.tree = tree;
        // Program accessors hand out copies.
        this.localDefs = seed.localDefs();
        this.fncDefs = seed.fncDefs();
        this.params = seed.params();
        this.exprs = seed.exprs();
        this.sourceMap = new SourceMap();
        this.errors = new ArrayList<>();
        this.fncNames = new HashMap<>(inScope.fncNames());
        this.scopes = new Scopes(inScope.varNames());
    }

    LowerResult lowerRoot(Root root) {
        var astDefs = root.defs(tree);
        hoistFncNames(astDefs);

        var defs = new ArrayList<Def>();
        for (var def : astDefs) {
            defs.add(lowerDef(def));
        }

        var stmts = new ArrayList<Stmt>();
        for (var stmt : root.stmts(tree)) {
            stmts.add(lowerStmt(stmt));
        }

        var tailExpr = root.tailExpr(tree)
                           .map(this::lowerPresentExpr);

        var program = new Program(localDefs, fncDefs, params, exprs, defs, stmts, tailExpr);
        return new LowerResult(program, sourceMap, errors, fncNames, scopes.topLevel());
    }

    // === Definitions ===

    /**
     * Functions are allocated in definition order, so the id each definition will get is known
     * before any of them is lowered.
     */
    private void hoistFncNames(List<org.pragmatica.gingerbread.ast.Def> defs) {
        int nextId = fncDefs.size();
        for (var def : defs) {
            var id = Idx.<FncDef>of(nextId++);
            var fncDef = (org.pragmatica.gingerbread.ast.FncDef) def;
            fncDef.name(tree)
                  .ifPresent(name -> fncNames.put(name.text(tree), id));
        }
    }

    private Def lowerDef(org.pragmatica.gingerbread.ast.Def def) {
        return new Def.Fnc(lowerFncDef((org.pragmatica.gingerbread.ast.FncDef) def));
    }

    private Idx<FncDef> lowerFncDef(org.pragmatica.gingerbread.ast.FncDef fncDef) {
        scopes.push();
        try {
            var paramIds = IdRange.<Param>builder();
            fncDef.paramList(tree)
                  .ifPresent(paramList -> {
                      for (var param : paramList.params(tree)) {
                          var id = params.alloc(new Param(lowerTy(param.ty(tree))));
                          paramIds.include(id);
                          param.name(tree)
                               .ifPresent(name -> scopes.define(name.text(tree), new VarDefId.Parameter(id)));
                      }
                  });

            var retTy = fncDef.retTy(tree)
                              .map(ret -> lowerTy(ret.ty(tree)))
                              .orElse(Ty.UNIT);
            var body = lowerExpr(fncDef.body(tree));

            return fncDefs.alloc(new FncDef(paramIds.build(), retTy, body));
        } finally {
            scopes.pop();
        }
    }

    private Ty lowerTy(Optional<org.pragmatica.gingerbread.ast.Ty> ty) {
        var name = ty.flatMap(t -> t.name(tree));
        if (name.isEmpty()) {
            return Ty.UNKNOWN;
        }
        var text = name.get().text(tree);
        switch (text) {
            case "s32":
                return Ty.S32;
            case "string":
                return Ty.STRING;
            default:
                errors.add(new LowerError(name.get().range(tree), new UndefinedTy(text)));
                return Ty.UNKNOWN;
        }
    }

    // === Statements ===

    private Stmt lowerStmt(org.pragmatica.gingerbread.ast.Stmt stmt) {
        if (stmt instanceof org.pragmatica.gingerbread.ast.LocalDef localDef) {
            return new Stmt.Local(lowerLocalDef(localDef));
        }
        var exprStmt = (org.pragmatica.gingerbread.ast.ExprStmt) stmt;
        return new Stmt.ExprStmt(lowerExpr(exprStmt.expr(tree)));
    }

    /**
     * The name is bound after the value is lowered, so a definition cannot refer to itself.
     */
    private Idx<LocalDef> lowerLocalDef(org.pragmatica.gingerbread.ast.LocalDef localDef) {
        var value = lowerExpr(localDef.value(tree));
        var id = localDefs.alloc(new LocalDef(value));
        localDef.name(tree)
                .ifPresent(name -> scopes.define(name.text(tree), new VarDefId.Local(id)));
        return id;
    }

    // === Expressions ===

    private Idx<Expr> lowerExpr(Optional<org.pragmatica.gingerbread.ast.Expr> expr) {
        return expr.map(this::lowerPresentExpr)
                   .orElseGet(() -> exprs.alloc(new Expr.Missing()));
    }

    private Idx<Expr> lowerPresentExpr(org.pragmatica.gingerbread.ast.Expr expr) {
        if (expr instanceof BinExpr binExpr) {
            return lowerBinExpr(binExpr);
        }
        if (expr instanceof ParenExpr parenExpr) {
            return lowerParenExpr(parenExpr);
        }
        Expr lowered;
        if (expr instanceof Block block) {
            lowered = lowerBlock(block);
        } else if (expr instanceof FncCall fncCall) {
            lowered = lowerFncCall(fncCall);
        } else if (expr instanceof IntLiteral intLiteral) {
            lowered = lowerIntLiteral(intLiteral);
        } else {
            lowered = lowerStringLiteral((StringLiteral) expr);
        }
        return alloc(lowered, expr);
    }

    private Idx<Expr> alloc(Expr lowered, org.pragmatica.gingerbread.ast.Expr source) {
        var id = exprs.alloc(lowered);
        sourceMap.insert(id, source);
        return id;
    }

    /**
     * Chains like {@code a + b + c + ...} nest to the left without bound, so the left spine is
     * walked in a loop instead of recursively.
     */
    private Idx<Expr> lowerBinExpr(BinExpr outermost) {
        var spine = new ArrayList<BinExpr>();
        var current = outermost;
        while (true) {
            spine.add(current);
            var lhs = current.lhs(tree);
            if (lhs.isPresent() && lhs.get() instanceof BinExpr inner) {
                current = inner;
            } else {
                break;
            }
        }

        var acc = lowerExpr(current.lhs(tree));
        for (int i = spine.size() - 1; i >= 0; i--) {
            var binExpr = spine.get(i);
            var rhs = lowerExpr(binExpr.rhs(tree));
            var op = binExpr.op(tree).map(LowerContext::lowerOp);
            acc = alloc(new Expr.Bin(acc, rhs, op), binExpr);
        }
        return acc;
    }

    private static BinOp lowerOp(Op op) {
        if (op instanceof Plus) {
            return BinOp.ADD;
        }
        if (op instanceof Hyphen) {
            return BinOp.SUB;
        }
        if (op instanceof Asterisk) {
            return BinOp.MUL;
        }
        return BinOp.DIV;
    }

    /**
     * Parentheses produce no expression of their own. The inner expression is mapped back to the
     * outermost parenthesised node as well, unless it was absent and so has no mapping at all.
     */
    private Idx<Expr> lowerParenExpr(ParenExpr parenExpr) {
        var id = lowerExpr(parenExpr.inner(tree));
        if (sourceMap.expr(id).isPresent()) {
            sourceMap.insert(id, parenExpr);
        }
        return id;
    }

    private Expr lowerBlock(Block block) {
        scopes.push();
        try {
            var stmts = new ArrayList<Stmt>();
            for (var stmt : block.stmts(tree)) {
                stmts.add(lowerStmt(stmt));
            }
            var tailExpr = block.tailExpr(tree)
                                .map(this::lowerPresentExpr);
            return new Expr.Block(stmts, tailExpr);
        } finally {
            scopes.pop();
        }
    }

    /**
     * A bare name is looked up as a variable first, then as a function. A name with arguments can
     * only be a function.
     */
    private Expr lowerFncCall(FncCall fncCall) {
        var nameToken = fncCall.name(tree);
        if (nameToken.isEmpty()) {
            return new Expr.Missing();
        }
        var name = nameToken.get().text(tree);
        var range = nameToken.get().range(tree);
        var argList = fncCall.argList(tree);

        if (argList.isEmpty()) {
            var varDef = scopes.lookup(name);
            if (varDef.isPresent()) {
                return new Expr.VarRef(varDef.get());
            }
            var fncDef = fncNames.get(name);
            if (fncDef != null) {
                return new Expr.FncCall(fncDef, List.of());
            }
            errors.add(new LowerError(range, new UndefinedVarOrFnc(name)));
            return new Expr.Missing();
        }

        var fncDef = fncNames.get(name);
        if (fncDef == null) {
            errors.add(new LowerError(range, new UndefinedFnc(name)));
        }
        var args = new ArrayList<Idx<Expr>>();
        for (var arg : argList.get().args(tree)) {
            args.add(lowerExpr(arg.value(tree)));
        }
        return fncDef == null
               ? new Expr.Missing()
               : new Expr.FncCall(fncDef, args);
    }

    private Expr lowerIntLiteral(IntLiteral intLiteral) {
        var value = intLiteral.value(tree)
                              .map(token -> token.value(tree));
        if (value.isEmpty() || value.get().isEmpty()) {
            return new Expr.Missing();
        }
        return new Expr.IntLiteral(value.get().getAsLong());
    }

    private Expr lowerStringLiteral(StringLiteral stringLiteral) {
        return stringLiteral.value(tree)
                            .<Expr>map(token -> new Expr.StringLiteral(token.value(tree)))
                            .orElseGet(Expr.Missing::new);
    }
}
