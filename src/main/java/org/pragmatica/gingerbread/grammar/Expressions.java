package org.pragmatica.gingerbread.grammar;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.parser.CompletedMarker;
import org.pragmatica.gingerbread.parser.ParsingContext;
import org.pragmatica.gingerbread.parser.TokenSet;
import org.pragmatica.gingerbread.tree.NodeKind;

import java.util.Optional;

/**
 * Expression rules. Binary operators are parsed by precedence climbing: {@code + -} bind
 * weaker than {@code * /}, and all of them associate to the left.
 *
 * <pre>
 * Expr      = BinExpr | Block | FncCall | IntLiteral | StringLiteral | ParenExpr
 * Block     = '{' (LocalDef | ExprStmt)* Expr? '}'
 * FncCall   = IDENT ArgList?
 * ArgList   = Arg (',' Arg)*
 * ParenExpr = '(' Expr ')'
 * </pre>
 */
final class Expressions {
    static final TokenSet EXPR_FIRST = TokenSet.of(TokenKind.IDENT,
                                                   TokenKind.L_BRACE,
                                                   TokenKind.INT,
                                                   TokenKind.STRING,
                                                   TokenKind.L_PAREN);

    private Expressions() {}

    static Optional<CompletedMarker> expr(ParsingContext p) {
        return exprBp(p, 0, TokenSet.EMPTY);
    }

    private static Optional<CompletedMarker> exprWithRecoverySet(ParsingContext p, TokenSet recoverySet) {
        return exprBp(p, 0, recoverySet);
    }

    private static Optional<CompletedMarker> exprBp(ParsingContext p, int minBp, TokenSet recoverySet) {
        if (p.isNestingTooDeep()) {
            return p.errorNestingTooDeep();
        }
        try (var ignored = p.nested()) {
            var parsed = lhs(p, recoverySet);
            if (parsed.isEmpty()) {
                return parsed;
            }
            var lhs = parsed.get();
            while (true) {
                BindingPower bp;
                try (var noTracking = p.disableExpectedTracking()) {
                    bp = currentBindingPower(p);
                }
                if (bp == null || bp.left() < minBp) {
                    break;
                }
                p.bump();

                var m = lhs.precede(p);
                exprBp(p, bp.right(), recoverySet);
                lhs = m.complete(p, NodeKind.BIN_EXPR);
            }
            return Optional.of(lhs);
        }
    }

    private record BindingPower(int left, int right) {}

    private static final BindingPower ADDITIVE = new BindingPower(1, 2);
    private static final BindingPower MULTIPLICATIVE = new BindingPower(3, 4);

    private static BindingPower currentBindingPower(ParsingContext p) {
        if (p.at(TokenKind.PLUS) || p.at(TokenKind.HYPHEN)) {
            return ADDITIVE;
        }
        if (p.at(TokenKind.ASTERISK) || p.at(TokenKind.SLASH)) {
            return MULTIPLICATIVE;
        }
        return null;
    }

    private static Optional<CompletedMarker> lhs(ParsingContext p, TokenSet recoverySet) {
        try (var ignored = p.expectedSyntaxName("expression")) {
            if (p.at(TokenKind.IDENT)) {
                return Optional.of(fncCall(p));
            }
            if (p.at(TokenKind.L_BRACE)) {
                return Optional.of(block(p));
            }
            if (p.at(TokenKind.INT)) {
                return Optional.of(single(p, NodeKind.INT_LITERAL));
            }
            if (p.at(TokenKind.STRING)) {
                return Optional.of(single(p, NodeKind.STRING_LITERAL));
            }
            if (p.at(TokenKind.L_PAREN)) {
                return Optional.of(parenExpr(p));
            }
            return p.errorWithRecoverySet(recoverySet);
        }
    }

    private static CompletedMarker single(ParsingContext p, NodeKind kind) {
        var m = p.start();
        p.bump();
        return m.complete(p, kind);
    }

    private static CompletedMarker fncCall(ParsingContext p) {
        p.requireAt(TokenKind.IDENT);
        var m = p.start();
        p.bump();

        boolean hasArgs;
        try (var ignored = p.disableExpectedTracking()) {
            hasArgs = p.atSet(EXPR_FIRST);
        }
        if (hasArgs) {
            argList(p);
        }
        return m.complete(p, NodeKind.FNC_CALL);
    }

    private static void argList(ParsingContext p) {
        var m = p.start();
        var argRecoverySet = TokenSet.of(TokenKind.COMMA);
        while (true) {
            var arg = p.start();
            exprWithRecoverySet(p, argRecoverySet);
            arg.complete(p, NodeKind.ARG);

            boolean more;
            try (var ignored = p.disableExpectedTracking()) {
                more = p.at(TokenKind.COMMA);
            }
            if (!more) {
                break;
            }
            p.bump();
        }
        m.complete(p, NodeKind.ARG_LIST);
    }

    private static CompletedMarker parenExpr(ParsingContext p) {
        p.requireAt(TokenKind.L_PAREN);
        var m = p.start();
        p.bump();
        exprWithRecoverySet(p, TokenSet.of(TokenKind.R_PAREN));
        p.expect(TokenKind.R_PAREN);
        return m.complete(p, NodeKind.PAREN_EXPR);
    }

    private static CompletedMarker block(ParsingContext p) {
        p.requireAt(TokenKind.L_BRACE);
        var m = p.start();
        p.bump();

        while (!p.at(TokenKind.R_BRACE) && !p.atEof()) {
            if (p.at(TokenKind.LET_KW)) {
                Definitions.localDef(p);
            } else if (p.atSet(EXPR_FIRST)) {
                var expr = expr(p);
                if (expr.isPresent() && !p.at(TokenKind.R_BRACE)) {
                    Grammar.terminateStatement(p, expr.get(), false);
                }
            } else {
                try (var ignored = p.expectedSyntaxName("statement")) {
                    p.consumeAsError();
                }
            }
        }

        p.expect(TokenKind.R_BRACE);
        return m.complete(p, NodeKind.BLOCK);
    }
}
