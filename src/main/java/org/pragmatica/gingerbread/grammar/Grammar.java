package org.pragmatica.gingerbread.grammar;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.parser.CompletedMarker;
import org.pragmatica.gingerbread.parser.EntryPoint;
import org.pragmatica.gingerbread.parser.ParsingContext;
import org.pragmatica.gingerbread.parser.TokenSet;
import org.pragmatica.gingerbread.tree.NodeKind;

/**
 * Top-level rules of the Gingerbread grammar.
 *
 * <pre>
 * Root     = (FncDef | LocalDef | ExprStmt)* Expr?     -- trailing expression only on a REPL line
 * ExprStmt = Expr ';'
 * </pre>
 */
public final class Grammar {
    static final TokenSet STMT_FIRST = Expressions.EXPR_FIRST.union(TokenSet.of(TokenKind.LET_KW));

    private Grammar() {}

    public static void root(ParsingContext p, EntryPoint entryPoint) {
        var m = p.start();
        boolean tailAllowed = entryPoint == EntryPoint.REPL_LINE;
        while (!p.atEof()) {
            topLevelItem(p, tailAllowed);
        }
        m.complete(p, NodeKind.ROOT);
    }

    private static void topLevelItem(ParsingContext p, boolean tailAllowed) {
        if (p.at(TokenKind.FNC_KW)) {
            Definitions.fncDef(p);
        } else if (p.at(TokenKind.LET_KW)) {
            Definitions.localDef(p);
        } else if (p.atSet(Expressions.EXPR_FIRST)) {
            Expressions.expr(p)
                       .ifPresent(expr -> terminateStatement(p, expr, tailAllowed));
        } else {
            try (var ignored = p.expectedSyntaxName("statement")) {
                p.consumeAsError();
            }
        }
    }

    /**
     * Wrap an already parsed expression into an {@code ExprStmt} ending with {@code ;}.
     * At the end of input the expression is left alone when a trailing expression is allowed.
     */
    static void terminateStatement(ParsingContext p, CompletedMarker expr, boolean tailAllowed) {
        if (p.at(TokenKind.SEMICOLON)) {
            var m = expr.precede(p);
            p.bump();
            m.complete(p, NodeKind.EXPR_STMT);
            return;
        }
        if (tailAllowed && p.atEof()) {
            return;
        }
        var m = expr.precede(p);
        p.expectWithRecoverySet(TokenKind.SEMICOLON, STMT_FIRST);
        m.complete(p, NodeKind.EXPR_STMT);
    }
}
