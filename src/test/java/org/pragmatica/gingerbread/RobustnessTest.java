package org.pragmatica.gingerbread;

import org.junit.jupiter.api.Test;
import org.pragmatica.gingerbread.tree.SyntaxNode;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Arbitrary input must always produce a lossless tree and renderable diagnostics.
 */
class RobustnessTest {
    private static final String[] FRAGMENTS = {
        "let", "fnc", "x", "foo", "s32", "string", "0", "4294967296", "\"s\"", "\"",
        "+", "-", "*", "/", "=", ":", ",", ";", "->", "(", ")", "{", "}",
        " ", "\n", "\r\n", "# c\n", "é", "~", "€"
    };

    private static String randomInput(Random random, int length) {
        var sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            sb.append(FRAGMENTS[random.nextInt(FRAGMENTS.length)]);
        }
        return sb.toString();
    }

    private static void checkAnalysis(Analysis analysis, String input) {
        var tree = analysis.parse().tree();
        assertEquals(input, tree.text());
        assertEquals(tree.textLength(), analysis.parse().root().range(tree).end());

        for (var diagnostic : analysis.diagnostics()) {
            assertTrue(diagnostic.range().end() <= tree.textLength() + 1, diagnostic::toString);
            assertFalse(diagnostic.render(input).isEmpty());
        }
    }

    @Test
    void randomFragments_neverBreakTheFrontend() {
        var random = new Random(42);
        for (int round = 0; round < 500; round++) {
            var input = randomInput(random, random.nextInt(40));

            checkAnalysis(Frontend.analyzeSourceFile(input), input);
            checkAnalysis(Frontend.analyzeReplLine(input), input);
        }
    }

    @Test
    void everyPrefixOfValidProgram_isHandled() {
        var program = "fnc f(a: s32, b: string): s32 -> { let c = a * (2 + 3); f c, b };\nf 1, \"x\";";
        for (int end = 0; end <= program.length(); end++) {
            var input = program.substring(0, end);

            checkAnalysis(Frontend.analyzeSourceFile(input), input);
        }
    }

    @Test
    void tokensAreNeverLost() {
        var random = new Random(7);
        for (int round = 0; round < 200; round++) {
            var input = randomInput(random, 25);
            var parse = Frontend.analyzeReplLine(input).parse();
            var tree = parse.tree();

            var tokens = parse.root().descendantTokens(tree);
            int expectedStart = 0;
            for (var token : tokens) {
                assertEquals(expectedStart, token.range(tree).start(), () -> parse.debugString());
                expectedStart = token.range(tree).end();
            }
            assertEquals(tree.textLength(), expectedStart);
        }
    }

    @Test
    void nodeRangesNestInsideParents() {
        var random = new Random(1234);
        for (int round = 0; round < 100; round++) {
            var input = randomInput(random, 30);
            var parse = Frontend.analyzeSourceFile(input).parse();
            var tree = parse.tree();

            for (SyntaxNode node : parse.root().descendants(tree)) {
                var range = node.range(tree);
                for (var child : node.children(tree)) {
                    var childRange = child.range(tree);
                    assertTrue(range.start() <= childRange.start() && childRange.end() <= range.end(),
                               () -> parse.debugString());
                }
            }
        }
    }
}
