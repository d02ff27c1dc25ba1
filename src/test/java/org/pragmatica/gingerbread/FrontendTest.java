package org.pragmatica.gingerbread;

import org.junit.jupiter.api.Test;
import org.pragmatica.gingerbread.hir.Expr;
import org.pragmatica.gingerbread.lower.InScope;
import org.pragmatica.gingerbread.parser.EntryPoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FrontendTest {

    @Test
    void validProgram_hasNoDiagnostics() {
        var analysis = Frontend.analyzeSourceFile("""
                # doubles its argument
                fnc twice(x: s32): s32 -> x * 2;
                let greeting = "hello";
                twice (1 + 2);
                """);

        assertFalse(analysis.hasErrors(), analysis::formatDiagnostics);
        assertEquals("", analysis.formatDiagnostics());
        assertThat(analysis.root().defs(analysis.parse().tree())).hasSize(1);
        assertEquals(1, analysis.lowerResult().program().fncDefs().size());
    }

    @Test
    void everyPhaseRunsDespiteEarlierErrors() {
        var analysis = Frontend.analyzeSourceFile("let a = 4294967296 let b = c;");

        assertEquals(1, analysis.parse().errors().size());
        assertEquals(1, analysis.validationErrors().size());
        assertEquals(1, analysis.lowerResult().errors().size());
        assertThat(analysis.diagnostics()).extracting(diagnostic -> diagnostic.title())
                                          .containsExactly("syntax error",
                                                           "syntax error",
                                                           "undefined variable or zero-parameter function");
    }

    @Test
    void formatDiagnostics_concatenatesAllReports() {
        var analysis = Frontend.analyzeReplLine("a + b");

        assertEquals("""
                     undefined variable or zero-parameter function at 1:1: `a` has not been defined
                       a + b
                       ^
                     undefined variable or zero-parameter function at 1:5: `b` has not been defined
                       a + b
                           ^
                     """, analysis.formatDiagnostics());
    }

    @Test
    void replLine_allowsTrailingExpression() {
        var analysis = Frontend.analyzeReplLine("1 + 2");

        assertFalse(analysis.hasErrors());
        var program = analysis.lowerResult().program();
        assertTrue(program.expr(program.tailExpr().orElseThrow()) instanceof Expr.Bin);
    }

    @Test
    void builder_appliesNestingLimit() {
        var frontend = Frontend.builder()
                               .maxNestingDepth(4)
                               .build();
        var analysis = frontend.analyze("((((((1))))))", EntryPoint.REPL_LINE, InScope.empty());

        assertEquals(4, frontend.config().parserConfig().maxNestingDepth());
        assertEquals("nesting too deep", analysis.parse().errors().get(0).message());
        assertEquals("((((((1))))))", analysis.parse().tree().text());
    }

    @Test
    void builder_rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> Frontend.builder().maxNestingDepth(0).build());
    }

    @Test
    void defaultInstance_usesDefaultConfig() {
        assertSame(Frontend.create(), Frontend.create());
        assertEquals(FrontendConfig.DEFAULT, Frontend.create().config());
    }
}
