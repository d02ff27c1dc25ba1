package org.pragmatica.gingerbread.lower;

import org.junit.jupiter.api.Test;
import org.pragmatica.gingerbread.ast.ParenExpr;
import org.pragmatica.gingerbread.ast.Root;
import org.pragmatica.gingerbread.hir.BinOp;
import org.pragmatica.gingerbread.hir.Def;
import org.pragmatica.gingerbread.hir.Expr;
import org.pragmatica.gingerbread.hir.FncDef;
import org.pragmatica.gingerbread.hir.IdRange;
import org.pragmatica.gingerbread.hir.Idx;
import org.pragmatica.gingerbread.hir.LocalDef;
import org.pragmatica.gingerbread.hir.Param;
import org.pragmatica.gingerbread.hir.Stmt;
import org.pragmatica.gingerbread.hir.Ty;
import org.pragmatica.gingerbread.hir.VarDefId;
import org.pragmatica.gingerbread.lower.LowerErrorKind.UndefinedFnc;
import org.pragmatica.gingerbread.lower.LowerErrorKind.UndefinedTy;
import org.pragmatica.gingerbread.lower.LowerErrorKind.UndefinedVarOrFnc;
import org.pragmatica.gingerbread.parser.Parse;
import org.pragmatica.gingerbread.parser.RecursiveDescentParser;
import org.pragmatica.gingerbread.tree.TextRange;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LoweringTest {
    private static final RecursiveDescentParser PARSER = RecursiveDescentParser.create();

    private static LowerResult lowerSourceFile(String input) {
        return lower(PARSER.parseSourceFile(input), InScope.empty());
    }

    private static LowerResult lowerReplLine(String input) {
        return lowerReplLine(input, InScope.empty());
    }

    private static LowerResult lowerReplLine(String input, InScope inScope) {
        return lower(PARSER.parseReplLine(input), inScope);
    }

    private static LowerResult lower(Parse parse, InScope inScope) {
        var root = Root.cast(parse.root(), parse.tree()).orElseThrow();
        return Lowering.lower(root, parse.tree(), inScope);
    }

    private static Idx<Expr> expr(int raw) {
        return Idx.of(raw);
    }

    // === Statements ===

    @Test
    void localDef_isLowered() {
        var result = lowerSourceFile("let foo = 92;");
        var program = result.program();

        assertEquals(List.of(), result.errors());
        assertEquals(List.of(new Stmt.Local(Idx.of(0))), program.stmts());
        assertEquals(new LocalDef(expr(0)), program.localDef(Idx.of(0)));
        assertEquals(new Expr.IntLiteral(92), program.expr(expr(0)));
        assertEquals(Optional.empty(), program.tailExpr());
        assertEquals(1, result.sourceMap().size());
    }

    @Test
    void shadowing_refersToPreviousDefinition() {
        var program = lowerReplLine("let a = 1; let a = a; a").program();

        assertEquals(new LocalDef(expr(1)), program.localDef(Idx.of(1)));
        assertEquals(new Expr.VarRef(new VarDefId.Local(Idx.of(0))), program.expr(expr(1)));
        assertEquals(new Expr.VarRef(new VarDefId.Local(Idx.of(1))), program.expr(expr(2)));
        assertEquals(Optional.of(expr(2)), program.tailExpr());
    }

    @Test
    void localDef_cannotReferToItself() {
        var result = lowerSourceFile("let a = a;");

        assertEquals(List.of(new LowerError(TextRange.of(8, 9), new UndefinedVarOrFnc("a"))), result.errors());
        assertEquals(new Expr.Missing(), result.program().expr(expr(0)));
    }

    @Test
    void blockScope_endsWithBlock() {
        var result = lowerSourceFile("{ let a = 1; a }; a;");

        assertEquals(List.of(new LowerError(TextRange.of(18, 19), new UndefinedVarOrFnc("a"))), result.errors());
        var block = (Expr.Block) result.program().expr(expr(2));
        assertEquals(List.of(new Stmt.Local(Idx.of(0))), block.stmts());
        assertEquals(Optional.of(expr(1)), block.tailExpr());
    }

    @Test
    void innerShadowing_endsWithBlock() {
        var result = lowerReplLine("let a = 1; a; { let a = \"s\"; a }; a");
        var program = result.program();
        var outer = new Expr.VarRef(new VarDefId.Local(Idx.of(0)));
        var inner = new Expr.VarRef(new VarDefId.Local(Idx.of(1)));

        assertEquals(List.of(), result.errors());
        assertEquals(outer, program.expr(expr(1)));
        assertEquals(inner, program.expr(expr(3)));
        assertEquals(new Expr.Block(List.of(new Stmt.Local(Idx.of(1))), Optional.of(expr(3))), program.expr(expr(4)));
        assertEquals(outer, program.expr(expr(5)));
        assertEquals(Optional.of(expr(5)), program.tailExpr());
    }

    // === Functions ===

    @Test
    void fncDef_isVisibleBeforeItsDefinition() {
        var result = lowerSourceFile("unit; fnc unit() -> {};");
        var program = result.program();

        assertEquals(List.of(), result.errors());
        assertEquals(List.of(new Def.Fnc(Idx.of(0))), program.defs());
        assertEquals(new FncDef(IdRange.empty(), Ty.UNIT, expr(0)), program.fncDef(Idx.of(0)));
        assertEquals(new Expr.Block(List.of(), Optional.empty()), program.expr(expr(0)));
        assertEquals(new Expr.FncCall(Idx.of(0), List.of()), program.expr(expr(1)));
        assertEquals(List.of(new Stmt.ExprStmt(expr(1))), program.stmts());
    }

    @Test
    void fncDefs_canCallEachOther() {
        var result = lowerSourceFile("fnc f() -> g; fnc g() -> f;");
        var program = result.program();

        assertEquals(List.of(), result.errors());
        assertEquals(List.of(new Def.Fnc(Idx.of(0)), new Def.Fnc(Idx.of(1))), program.defs());
        assertEquals(new Expr.FncCall(Idx.of(1), List.of()), program.expr(program.fncDef(Idx.of(0)).body()));
        assertEquals(new Expr.FncCall(Idx.of(0), List.of()), program.expr(program.fncDef(Idx.of(1)).body()));
    }

    @Test
    void fncDefs_canCallEachOtherWithArguments() {
        var result = lowerSourceFile("fnc f(x: s32) -> g x; fnc g(y: s32) -> f y;");
        var program = result.program();

        assertEquals(List.of(), result.errors());
        var fBody = (Expr.FncCall) program.expr(program.fncDef(Idx.of(0)).body());
        var gBody = (Expr.FncCall) program.expr(program.fncDef(Idx.of(1)).body());
        assertEquals(Idx.of(1), fBody.def());
        assertEquals(Idx.of(0), gBody.def());
        assertEquals(new Expr.VarRef(new VarDefId.Parameter(Idx.of(0))), program.expr(fBody.args().get(0)));
        assertEquals(new Expr.VarRef(new VarDefId.Parameter(Idx.of(1))), program.expr(gBody.args().get(0)));
    }

    @Test
    void fncCall_withArgumentsResolvesToFunction() {
        var result = lowerReplLine("fnc add(x: s32, y: s32): s32 -> x + y; add 1, 2");
        var program = result.program();

        assertEquals(List.of(), result.errors());
        assertEquals(new FncDef(new IdRange<>(0, 2), Ty.S32, expr(2)), program.fncDef(Idx.of(0)));
        assertEquals(new Expr.Bin(expr(0), expr(1), Optional.of(BinOp.ADD)), program.expr(expr(2)));
        assertEquals(new Expr.VarRef(new VarDefId.Parameter(Idx.of(1))), program.expr(expr(1)));
        assertEquals(new Expr.FncCall(Idx.of(0), List.of(expr(3), expr(4))), program.expr(expr(5)));
    }

    @Test
    void undefinedNames_areReported() {
        var result = lowerReplLine("foo bar, 10");

        assertEquals(List.of(new LowerError(TextRange.of(0, 3), new UndefinedFnc("foo")),
                             new LowerError(TextRange.of(4, 7), new UndefinedVarOrFnc("bar"))),
                     result.errors());
        assertEquals(List.of(new Expr.Missing(), new Expr.IntLiteral(10), new Expr.Missing()),
                     result.program().exprs().items());
        assertEquals("undefined function: `foo` has not been defined", result.errors().get(0).message());
    }

    @Test
    void parameter_isNotVisibleOutsideFunction() {
        var result = lowerReplLine("fnc f(x: s32) -> x; x");

        assertEquals(List.of(new LowerError(TextRange.of(20, 21), new UndefinedVarOrFnc("x"))), result.errors());
        assertEquals(new Expr.VarRef(new VarDefId.Parameter(Idx.of(0))), result.program().expr(expr(0)));
    }

    @Test
    void variable_winsOverFunctionOfSameName() {
        var result = lowerReplLine("fnc a() -> 1; let a = 2; a");
        var program = result.program();

        assertEquals(List.of(), result.errors());
        assertEquals(new Expr.VarRef(new VarDefId.Local(Idx.of(0))), program.expr(program.tailExpr().orElseThrow()));
    }

    @Test
    void types_areResolved() {
        var result = lowerSourceFile("fnc f(a: s32, b: string, c: foo): bar -> a;");
        var program = result.program();

        assertEquals(List.of(new Param(Ty.S32), new Param(Ty.STRING), new Param(Ty.UNKNOWN)),
                     program.params().items());
        assertEquals(Ty.UNKNOWN, program.fncDef(Idx.of(0)).retTy());
        assertEquals(List.of(new LowerError(TextRange.of(28, 31), new UndefinedTy("foo")),
                             new LowerError(TextRange.of(34, 37), new UndefinedTy("bar"))),
                     result.errors());
    }

    @Test
    void missingType_isUnknownWithoutLowerError() {
        var result = lowerSourceFile("fnc g(x:) -> 1;");

        assertEquals(List.of(), result.errors());
        assertEquals(new Param(Ty.UNKNOWN), result.program().param(Idx.of(0)));
    }

    // === Expressions ===

    @Test
    void parentheses_leaveNoTrace() {
        var parse = PARSER.parseReplLine("((1))");
        var result = lower(parse, InScope.empty());
        var program = result.program();

        assertEquals(List.of(new Expr.IntLiteral(1)), program.exprs().items());
        var source = result.sourceMap().expr(expr(0)).orElseThrow();
        assertThat(source).isInstanceOf(ParenExpr.class);
        assertEquals(TextRange.of(0, 5), source.range(parse.tree()));
        assertEquals(Optional.of(TextRange.of(0, 5)), result.sourceMap().range(expr(0), parse.tree()));
    }

    @Test
    void parenthesisedOperand_isUsedDirectly() {
        var program = lowerReplLine("(1) - 2 / 3").program();

        assertEquals(List.of(new Expr.IntLiteral(1),
                             new Expr.IntLiteral(2),
                             new Expr.IntLiteral(3),
                             new Expr.Bin(expr(1), expr(2), Optional.of(BinOp.DIV)),
                             new Expr.Bin(expr(0), expr(3), Optional.of(BinOp.SUB))),
                     program.exprs().items());
    }

    @Test
    void missingOperand_hasNoSourceMapEntry() {
        var result = lowerReplLine("1 *");
        var program = result.program();

        assertEquals(new Expr.Bin(expr(0), expr(1), Optional.of(BinOp.MUL)), program.expr(expr(2)));
        assertEquals(new Expr.Missing(), program.expr(expr(1)));
        assertTrue(result.sourceMap().expr(expr(1)).isEmpty());
        assertEquals(2, result.sourceMap().size());
    }

    @Test
    void emptyParentheses_haveNoSourceMapEntry() {
        var result = lowerReplLine("(())");
        var program = result.program();

        assertEquals(List.of(), result.errors());
        assertEquals(List.of(new Expr.Missing()), program.exprs().items());
        assertEquals(Optional.of(expr(0)), program.tailExpr());
        assertTrue(result.sourceMap().expr(expr(0)).isEmpty());
        assertEquals(0, result.sourceMap().size());
    }

    @Test
    void sourceMap_worksInBothDirections() {
        var parse = PARSER.parseReplLine("\"text\"");
        var result = lower(parse, InScope.empty());
        var root = Root.cast(parse.root(), parse.tree()).orElseThrow();
        var literal = root.tailExpr(parse.tree()).orElseThrow();

        assertEquals(Optional.of(expr(0)), result.sourceMap().exprId(literal));
        assertEquals(new Expr.StringLiteral("text"), result.program().expr(expr(0)));
    }

    @Test
    void tooBigLiteral_becomesMissing() {
        var program = lowerReplLine("4294967296").program();

        assertEquals(new Expr.Missing(), program.expr(expr(0)));
    }

    @Test
    void longOperatorChain_isLoweredWithoutRecursion() {
        int terms = 50_000;
        var input = "1" + " + 1".repeat(terms - 1);
        var result = lowerReplLine(input);
        var program = result.program();

        assertEquals(List.of(), result.errors());
        assertEquals(2 * terms - 1, program.exprs().size());
        assertEquals(new Expr.Bin(expr(2 * terms - 4), expr(2 * terms - 3), Optional.of(BinOp.ADD)),
                     program.expr(program.tailExpr().orElseThrow()));
    }

    // === Incremental lowering ===

    @Test
    void replLines_buildOnEarlierResults() {
        var first = lowerReplLine("let a = 1;");
        var second = lowerReplLine("fnc f(x: s32) -> x;", first.toInScope());
        var third = lowerReplLine("f a", second.toInScope());

        assertEquals(List.of(), third.errors());
        var program = third.program();
        assertEquals(new Expr.VarRef(new VarDefId.Local(Idx.of(0))), program.expr(expr(2)));
        assertEquals(new Expr.FncCall(Idx.of(0), List.of(expr(2))), program.expr(expr(3)));
        assertEquals(Optional.of(expr(3)), program.tailExpr());

        assertEquals(1, first.program().exprs().size());
        assertEquals(2, second.program().exprs().size());
        assertThat(third.fncNames()).containsKey("f");
        assertThat(third.varNames()).containsKey("a");
    }

    @Test
    void lowering_isDeterministic() {
        var input = "fnc f(x: s32) -> { let y = x; y * 2 }; let z = f 1; z";

        assertEquals(lowerReplLine(input).program(), lowerReplLine(input).program());
    }

    @Test
    void lowering_isDeterministicWithErrors() {
        var input = "fnc f(x: foo) -> y; z";
        var first = lowerReplLine(input);
        var second = lowerReplLine(input);

        assertEquals(List.of(new LowerError(TextRange.of(9, 12), new UndefinedTy("foo")),
                             new LowerError(TextRange.of(17, 18), new UndefinedVarOrFnc("y")),
                             new LowerError(TextRange.of(20, 21), new UndefinedVarOrFnc("z"))),
                     first.errors());
        assertEquals(first.errors(), second.errors());
        assertEquals(first.program(), second.program());
    }
}
