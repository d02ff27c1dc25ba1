package org.pragmatica.gingerbread;

import org.junit.jupiter.api.Test;
import org.pragmatica.gingerbread.hir.Expr;
import org.pragmatica.gingerbread.hir.Idx;
import org.pragmatica.gingerbread.hir.VarDefId;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplSessionTest {

    @Test
    void definitionsCarryOverToLaterLines() {
        var session = ReplSession.start();

        var first = session.feed("fnc square(x: s32): s32 -> x * x;");
        var second = first.next().feed("let n = 7;");
        var third = second.next().feed("square n");

        assertFalse(first.analysis().hasErrors());
        assertFalse(second.analysis().hasErrors());
        assertFalse(third.analysis().hasErrors(), third.analysis()::formatDiagnostics);
        assertEquals(3, third.next().linesFed());

        var program = third.analysis().lowerResult().program();
        var call = (Expr.FncCall) program.expr(program.tailExpr().orElseThrow());
        assertEquals(Idx.of(0), call.def());
    }

    @Test
    void earlierSessionIsUnaffected() {
        var start = ReplSession.start();
        var step = start.feed("let a = 1;");

        assertEquals(0, start.linesFed());
        assertTrue(start.inScope().varNames().isEmpty());
        assertTrue(step.next().inScope().varNames().containsKey("a"));

        var fromStart = start.feed("a");
        assertTrue(fromStart.analysis().hasErrors());
    }

    @Test
    void sessionStateCannotBeChangedFromOutside() {
        var step = ReplSession.start().feed("let a = 1;");
        var session = step.next();

        session.inScope().program().exprs().alloc(new Expr.IntLiteral(2));
        step.analysis().lowerResult().program().exprs().alloc(new Expr.IntLiteral(3));

        assertEquals(1, session.inScope().program().exprs().size());
        var next = session.feed("a");
        assertFalse(next.analysis().hasErrors());
        assertEquals(List.of(new Expr.IntLiteral(1), new Expr.VarRef(new VarDefId.Local(Idx.of(0)))),
                     next.analysis().lowerResult().program().exprs().items());
    }

    @Test
    void laterDefinitionShadowsEarlierOne() {
        var session = ReplSession.start()
                                 .feed("let a = 1;").next()
                                 .feed("let a = \"one\";").next();

        var step = session.feed("a");
        var program = step.analysis().lowerResult().program();
        var ref = (Expr.VarRef) program.expr(program.tailExpr().orElseThrow());
        var local = (VarDefId.Local) ref.def();

        assertEquals(Idx.of(1), local.id());
        assertEquals(new Expr.StringLiteral("one"), program.expr(program.localDef(local.id()).value()));
    }

    @Test
    void erroneousLineStillDefinesItsNames() {
        var step = ReplSession.start().feed("let broken = 1 +;");

        assertTrue(step.analysis().hasErrors());
        assertEquals(List.of("broken"), List.copyOf(step.next().inScope().varNames().keySet()));
    }

    @Test
    void customFrontendIsUsed() {
        var session = ReplSession.start(Frontend.builder().maxNestingDepth(1).build());

        var step = session.feed("((1))");

        assertTrue(step.analysis().hasErrors());
    }
}
