package org.pragmatica.gingerbread.grammar;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.parser.CompletedMarker;
import org.pragmatica.gingerbread.parser.ParsingContext;
import org.pragmatica.gingerbread.parser.TokenSet;
import org.pragmatica.gingerbread.tree.NodeKind;

/**
 * <pre>
 * FncDef    = 'fnc' IDENT ParamList RetTy? '->' Expr ';'
 * ParamList = '(' (Param (',' Param)*)? ')'
 * Param     = IDENT ':' Ty
 * RetTy     = ':' Ty
 * LocalDef  = 'let' IDENT '=' Expr ';'
 * </pre>
 */
final class Definitions {
    private Definitions() {}

    static CompletedMarker fncDef(ParsingContext p) {
        p.requireAt(TokenKind.FNC_KW);
        var m = p.start();
        p.bump();

        p.expectWithRecoverySet(TokenKind.IDENT, TokenSet.of(TokenKind.L_PAREN, TokenKind.ARROW));

        if (p.at(TokenKind.L_PAREN)) {
            paramList(p);
        } else {
            p.errorWithRecoverySet(TokenSet.of(TokenKind.ARROW, TokenKind.COLON));
        }

        if (p.at(TokenKind.COLON)) {
            retTy(p);
        }

        p.expectWithRecoverySet(TokenKind.ARROW, Expressions.EXPR_FIRST);
        Expressions.expr(p);
        p.expect(TokenKind.SEMICOLON);

        return m.complete(p, NodeKind.FNC_DEF);
    }

    private static void paramList(ParsingContext p) {
        p.requireAt(TokenKind.L_PAREN);
        var m = p.start();
        p.bump();

        while (p.at(TokenKind.IDENT)) {
            param(p);
            if (p.at(TokenKind.R_PAREN)) {
                break;
            }
            p.expectWithRecoverySet(TokenKind.COMMA, TokenSet.of(TokenKind.R_PAREN, TokenKind.IDENT));
        }

        p.expectWithRecoverySet(TokenKind.R_PAREN, TokenSet.of(TokenKind.ARROW, TokenKind.COLON));
        m.complete(p, NodeKind.PARAM_LIST);
    }

    private static void param(ParsingContext p) {
        p.requireAt(TokenKind.IDENT);
        var m = p.start();
        p.bump();

        p.expectWithRecoverySet(TokenKind.COLON, TokenSet.of(TokenKind.R_PAREN, TokenKind.COMMA));
        Types.ty(p, TokenSet.of(TokenKind.COMMA, TokenKind.R_PAREN));

        m.complete(p, NodeKind.PARAM);
    }

    private static void retTy(ParsingContext p) {
        p.requireAt(TokenKind.COLON);
        var m = p.start();
        p.bump();
        Types.ty(p, TokenSet.of(TokenKind.ARROW));
        m.complete(p, NodeKind.RET_TY);
    }

    static CompletedMarker localDef(ParsingContext p) {
        p.requireAt(TokenKind.LET_KW);
        var m = p.start();
        p.bump();

        p.expectWithRecoverySet(TokenKind.IDENT, TokenSet.of(TokenKind.EQ));
        p.expect(TokenKind.EQ);
        Expressions.expr(p);
        p.expectWithRecoverySet(TokenKind.SEMICOLON, Grammar.STMT_FIRST);

        return m.complete(p, NodeKind.LOCAL_DEF);
    }
}
