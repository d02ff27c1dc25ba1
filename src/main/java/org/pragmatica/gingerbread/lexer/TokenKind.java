package org.pragmatica.gingerbread.lexer;

/**
 * Token kinds produced by the {@link Lexer}.
 *
 * <p>The ordinal of each constant doubles as its tag byte in the packed syntax tree,
 * so constants must not be reordered casually.
 */
public enum TokenKind {
    LET_KW("`let`"),
    FNC_KW("`fnc`"),
    IDENT("identifier"),
    INT("integer literal"),
    STRING("string literal"),
    PLUS("`+`"),
    HYPHEN("`-`"),
    ASTERISK("`*`"),
    SLASH("`/`"),
    EQ("`=`"),
    COLON("`:`"),
    COMMA("`,`"),
    SEMICOLON("`;`"),
    ARROW("`->`"),
    L_PAREN("`(`"),
    R_PAREN("`)`"),
    L_BRACE("`{`"),
    R_BRACE("`}`"),
    WHITESPACE("whitespace"),
    COMMENT("comment"),
    ERROR("an unrecognized token");

    private final String display;

    TokenKind(String display) {
        this.display = display;
    }

    /**
     * Human-readable name used in diagnostics.
     */
    public String display() {
        return display;
    }

    /**
     * Whitespace and comments carry no meaning for the grammar.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }
}
