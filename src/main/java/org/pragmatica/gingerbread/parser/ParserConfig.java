package org.pragmatica.gingerbread.parser;

/**
 * Parser configuration options.
 *
 * @param maxNestingDepth deepest expression nesting accepted before input is rejected
 *                        with a nesting error instead of being parsed recursively
 */
public record ParserConfig(int maxNestingDepth) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    public static final ParserConfig DEFAULT = new ParserConfig(DEFAULT_MAX_NESTING_DEPTH);

    public ParserConfig {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }
}
