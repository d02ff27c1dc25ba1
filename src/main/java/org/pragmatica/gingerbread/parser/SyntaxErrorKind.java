package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.tree.TextRange;

/**
 * How the input deviated from the grammar.
 */
public sealed interface SyntaxErrorKind {

    /**
     * Expected syntax is absent. {@code offset} is the end of the last consumed token.
     */
    record Missing(int offset) implements SyntaxErrorKind {}

    /**
     * A token of kind {@code found} stands where something else was expected.
     */
    record Unexpected(TokenKind found, TextRange range) implements SyntaxErrorKind {}

    /**
     * Expressions nest deeper than {@link ParserConfig#maxNestingDepth()} allows.
     */
    record NestingTooDeep(TextRange range) implements SyntaxErrorKind {}
}
