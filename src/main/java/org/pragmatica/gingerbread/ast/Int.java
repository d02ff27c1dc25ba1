package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Integer literal token: a run of decimal digits with no sign.
 */
public record Int(SyntaxToken syntax) implements AstToken {
    private static final String U32_MAX = "4294967295";

    public static Optional<Int> cast(SyntaxToken token, SyntaxTree tree) {
        return token.kind(tree) == TokenKind.INT
               ? Optional.of(new Int(token))
               : Optional.empty();
    }

    /**
     * Value of the literal, or empty when it does not fit an unsigned 32-bit integer.
     */
    public OptionalLong value(SyntaxTree tree) {
        return parseU32(text(tree));
    }

    /**
     * Parse decimal digits as an unsigned 32-bit value. Leading zeros are allowed.
     */
    public static OptionalLong parseU32(String digits) {
        if (digits.isEmpty()) {
            return OptionalLong.empty();
        }
        int firstSignificant = 0;
        while (firstSignificant < digits.length() - 1 && digits.charAt(firstSignificant) == '0') {
            firstSignificant++;
        }
        var significant = digits.substring(firstSignificant);
        for (int i = 0; i < significant.length(); i++) {
            char c = significant.charAt(i);
            if (c < '0' || c > '9') {
                return OptionalLong.empty();
            }
        }
        if (significant.length() > U32_MAX.length()
            || (significant.length() == U32_MAX.length() && significant.compareTo(U32_MAX) > 0)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Long.parseLong(significant));
    }
}
