package org.pragmatica.gingerbread.lower;

import org.pragmatica.gingerbread.ast.Expr;
import org.pragmatica.gingerbread.hir.Idx;
import org.pragmatica.gingerbread.tree.SyntaxTree;
import org.pragmatica.gingerbread.tree.TextRange;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Links lowered expressions with the syntax they came from, in both directions.
 *
 * <p>Expressions lowered from absent syntax have no entry.
 */
public final class SourceMap {
    private final Map<Idx<org.pragmatica.gingerbread.hir.Expr>, Expr> exprMap;
    private final Map<Expr, Idx<org.pragmatica.gingerbread.hir.Expr>> exprMapBack;

    SourceMap() {
        this.exprMap = new HashMap<>();
        this.exprMapBack = new HashMap<>();
    }

    void insert(Idx<org.pragmatica.gingerbread.hir.Expr> id, Expr ast) {
        exprMap.put(id, ast);
        exprMapBack.put(ast, id);
    }

    public Optional<Expr> expr(Idx<org.pragmatica.gingerbread.hir.Expr> id) {
        return Optional.ofNullable(exprMap.get(id));
    }

    public Optional<Idx<org.pragmatica.gingerbread.hir.Expr>> exprId(Expr ast) {
        return Optional.ofNullable(exprMapBack.get(ast));
    }

    /**
     * Source range of a lowered expression, for reporting errors found on the lowered program.
     */
    public Optional<TextRange> range(Idx<org.pragmatica.gingerbread.hir.Expr> id, SyntaxTree tree) {
        return expr(id).map(ast -> ast.range(tree));
    }

    public int size() {
        return exprMap.size();
    }

    @Override
    public String toString() {
        return "SourceMap[" + exprMap.size() + " expressions]";
    }
}
