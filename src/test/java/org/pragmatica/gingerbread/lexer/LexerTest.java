package org.pragmatica.gingerbread.lexer;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<TokenKind> kinds(String input) {
        return Lexer.lex(input)
                    .stream()
                    .map(Token::kind)
                    .toList();
    }

    private static void checkSingle(String input, TokenKind expected) {
        var tokens = Lexer.lex(input);
        assertEquals(1, tokens.size(), () -> "tokens of " + input + ": " + tokens);
        assertEquals(expected, tokens.get(0).kind());
        assertEquals(input.getBytes(StandardCharsets.UTF_8).length, tokens.get(0).range().end());
    }

    // === Single tokens ===

    @Test
    void keywords_areRecognized() {
        checkSingle("let", TokenKind.LET_KW);
        checkSingle("fnc", TokenKind.FNC_KW);
    }

    @Test
    void keywordPrefix_isIdentifier() {
        checkSingle("letter", TokenKind.IDENT);
        checkSingle("fnc_1", TokenKind.IDENT);
        checkSingle("_", TokenKind.IDENT);
    }

    @Test
    void literals_areRecognized() {
        checkSingle("0123", TokenKind.INT);
        checkSingle("\"hello, world\"", TokenKind.STRING);
        checkSingle("\"multi\nline\"", TokenKind.STRING);
    }

    @Test
    void punctuation_isRecognized() {
        assertEquals(List.of(TokenKind.PLUS, TokenKind.HYPHEN, TokenKind.ASTERISK, TokenKind.SLASH,
                             TokenKind.EQ, TokenKind.COLON, TokenKind.COMMA, TokenKind.SEMICOLON,
                             TokenKind.ARROW, TokenKind.L_PAREN, TokenKind.R_PAREN,
                             TokenKind.L_BRACE, TokenKind.R_BRACE),
                     kinds("+-*/=:,;->(){}"));
    }

    @Test
    void hyphenFollowedBySpaceAndGreater_isNotArrow() {
        assertEquals(List.of(TokenKind.HYPHEN, TokenKind.WHITESPACE, TokenKind.ERROR), kinds("- >"));
    }

    // === Trivia ===

    @Test
    void whitespaceRun_isOneToken() {
        checkSingle(" \t\r\n ", TokenKind.WHITESPACE);
        assertTrue(TokenKind.WHITESPACE.isTrivia());
    }

    @Test
    void comment_includesTrailingNewline() {
        var tokens = Lexer.lex("# note\nx");
        assertEquals(2, tokens.size());
        assertEquals(Token.of(TokenKind.COMMENT, 0, 7), tokens.get(0));
        assertEquals(Token.of(TokenKind.IDENT, 7, 8), tokens.get(1));
    }

    @Test
    void comment_atEndOfInput_endsThere() {
        checkSingle("# last", TokenKind.COMMENT);
    }

    // === Errors ===

    @Test
    void unterminatedString_isOneByteError_andScanningResumes() {
        var tokens = Lexer.lex("\"abc");
        assertEquals(Token.of(TokenKind.ERROR, 0, 1), tokens.get(0));
        assertEquals(Token.of(TokenKind.IDENT, 1, 4), tokens.get(1));
    }

    @Test
    void multiByteCharacter_staysInOneErrorToken() {
        var tokens = Lexer.lex("a€b");
        assertEquals(List.of(Token.of(TokenKind.IDENT, 0, 1),
                             Token.of(TokenKind.ERROR, 1, 4),
                             Token.of(TokenKind.IDENT, 4, 5)),
                     tokens);
    }

    @Test
    void oversizedInput_isRejected() {
        var input = new byte[Lexer.MAX_INPUT_SIZE + 1];
        assertThrows(IllegalArgumentException.class, () -> Lexer.lex(input));
    }

    // === Coverage ===

    @Test
    void tokens_coverInputWithoutGaps() {
        var input = "fnc add(x: s32, y: s32): s32 -> x + y; # sum\nlet z = add 1, \"two\" ~";
        var bytes = input.getBytes(StandardCharsets.UTF_8);
        var tokens = Lexer.lex(bytes);

        int expectedStart = 0;
        var rebuilt = new StringBuilder();
        for (var token : tokens) {
            assertEquals(expectedStart, token.range().start());
            rebuilt.append(token.text(bytes));
            expectedStart = token.range().end();
        }
        assertEquals(bytes.length, expectedStart);
        assertEquals(input, rebuilt.toString());
    }

    @Test
    void emptyInput_producesNoTokens() {
        assertTrue(Lexer.lex("").isEmpty());
    }
}
