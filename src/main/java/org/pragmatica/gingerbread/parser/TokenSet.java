package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.lexer.TokenKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable set of token kinds backed by a bit mask.
 */
public final class TokenSet {
    public static final TokenSet EMPTY = new TokenSet(0L);

    private final long bits;

    private TokenSet(long bits) {
        this.bits = bits;
    }

    public static TokenSet of(TokenKind... kinds) {
        long bits = 0L;
        for (var kind : kinds) {
            bits |= mask(kind);
        }
        return new TokenSet(bits);
    }

    public TokenSet union(TokenSet other) {
        return new TokenSet(bits | other.bits);
    }

    public boolean contains(TokenKind kind) {
        return (bits & mask(kind)) != 0;
    }

    public Set<TokenKind> kinds() {
        var result = EnumSet.noneOf(TokenKind.class);
        for (var kind : TokenKind.values()) {
            if (contains(kind)) {
                result.add(kind);
            }
        }
        return result;
    }

    private static long mask(TokenKind kind) {
        return 1L << kind.ordinal();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TokenSet other && other.bits == bits;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bits);
    }

    @Override
    public String toString() {
        return "TokenSet" + kinds();
    }
}
