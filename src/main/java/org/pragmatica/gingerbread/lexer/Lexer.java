package org.pragmatica.gingerbread.lexer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for Gingerbread source text.
 *
 * <p>Works directly on the UTF-8 bytes of the input, so every token range is a byte range.
 * The produced tokens cover the input without gaps or overlaps, trivia included.
 */
public final class Lexer {
    public static final int MAX_INPUT_SIZE = 16 * 1024 * 1024;
    private static final int DEFAULT_TOKEN_CAPACITY = 64;

    private final byte[] input;
    private int pos;

    private Lexer(byte[] input) {
        this.input = input;
        this.pos = 0;
    }

    public static List<Token> lex(String input) {
        return lex(input.getBytes(StandardCharsets.UTF_8));
    }

    public static List<Token> lex(byte[] input) {
        if (input.length > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Input exceeds maximum size of " + MAX_INPUT_SIZE + " bytes");
        }
        return new Lexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd()) {
            tokens.add(nextToken());
        }
        return tokens;
    }

    private Token nextToken() {
        int start = pos;
        byte c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifierOrKeyword(start);
        }
        if (isDigit(c)) {
            while (!isAtEnd() && isDigit(peek())) {
                pos++;
            }
            return Token.of(TokenKind.INT, start, pos);
        }
        if (isWhitespace(c)) {
            while (!isAtEnd() && isWhitespace(peek())) {
                pos++;
            }
            return Token.of(TokenKind.WHITESPACE, start, pos);
        }
        if (c == '#') {
            return scanComment(start);
        }
        if (c == '"') {
            return scanString(start);
        }
        return scanPunctuation(start, c);
    }

    private Token scanIdentifierOrKeyword(int start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            pos++;
        }
        var kind = switch (new String(input, start, pos - start, StandardCharsets.US_ASCII)) {
            case "let" -> TokenKind.LET_KW;
            case "fnc" -> TokenKind.FNC_KW;
            default -> TokenKind.IDENT;
        };
        return Token.of(kind, start, pos);
    }

    private Token scanComment(int start) {
        while (!isAtEnd() && peek() != '\n') {
            pos++;
        }
        if (!isAtEnd()) {
            // the newline belongs to the comment
            pos++;
        }
        return Token.of(TokenKind.COMMENT, start, pos);
    }

    private Token scanString(int start) {
        int cursor = start + 1;
        while (cursor < input.length && input[cursor] != '"') {
            cursor++;
        }
        if (cursor >= input.length) {
            // unterminated: only the quote itself is rejected, scanning resumes right after it
            pos = start + 1;
            return Token.of(TokenKind.ERROR, start, pos);
        }
        pos = cursor + 1;
        return Token.of(TokenKind.STRING, start, pos);
    }

    private Token scanPunctuation(int start, byte c) {
        pos++;
        var kind = switch ((char) c) {
            case '+' -> TokenKind.PLUS;
            case '*' -> TokenKind.ASTERISK;
            case '/' -> TokenKind.SLASH;
            case '=' -> TokenKind.EQ;
            case ':' -> TokenKind.COLON;
            case ',' -> TokenKind.COMMA;
            case ';' -> TokenKind.SEMICOLON;
            case '(' -> TokenKind.L_PAREN;
            case ')' -> TokenKind.R_PAREN;
            case '{' -> TokenKind.L_BRACE;
            case '}' -> TokenKind.R_BRACE;
            case '-' -> scanHyphenOrArrow();
            default -> {
                skipCodePointContinuation(c);
                yield TokenKind.ERROR;
            }
        };
        return Token.of(kind, start, pos);
    }

    private TokenKind scanHyphenOrArrow() {
        if (!isAtEnd() && peek() == '>') {
            pos++;
            return TokenKind.ARROW;
        }
        return TokenKind.HYPHEN;
    }

    /**
     * Keeps a multi-byte UTF-8 sequence inside one error token.
     */
    private void skipCodePointContinuation(byte lead) {
        int expected = continuationBytes(lead);
        for (int i = 0; i < expected && !isAtEnd() && isContinuation(peek()); i++) {
            pos++;
        }
    }

    private static int continuationBytes(byte lead) {
        int b = lead & 0xFF;
        if (b >= 0xF0) {
            return 3;
        }
        if (b >= 0xE0) {
            return 2;
        }
        if (b >= 0xC0) {
            return 1;
        }
        return 0;
    }

    private static boolean isContinuation(byte b) {
        return (b & 0xC0) == 0x80;
    }

    private byte peek() {
        return input[pos];
    }

    private boolean isAtEnd() {
        return pos >= input.length;
    }

    private static boolean isIdentifierStart(byte c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(byte c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(byte c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWhitespace(byte c) {
        return c == ' ' || c == '\n' || c == '\t' || c == '\r';
    }
}
