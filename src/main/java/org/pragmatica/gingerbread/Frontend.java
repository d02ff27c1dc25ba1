package org.pragmatica.gingerbread;

import org.pragmatica.gingerbread.ast.Root;
import org.pragmatica.gingerbread.ast.validation.Validation;
import org.pragmatica.gingerbread.lexer.Lexer;
import org.pragmatica.gingerbread.lower.InScope;
import org.pragmatica.gingerbread.lower.Lowering;
import org.pragmatica.gingerbread.parser.EntryPoint;
import org.pragmatica.gingerbread.parser.Parser;
import org.pragmatica.gingerbread.parser.ParserConfig;
import org.pragmatica.gingerbread.parser.RecursiveDescentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Entry point running the whole front end: lexing, parsing, validation and lowering.
 *
 * <p>Example usage:
 * <pre>{@code
 * var analysis = Frontend.analyzeSourceFile("fnc twice(x: s32): s32 -> x * 2;");
 * if (analysis.hasErrors()) {
 *     System.err.print(analysis.formatDiagnostics());
 * }
 * }</pre>
 *
 * <p>Instances are immutable and can be shared between threads.
 */
public final class Frontend {
    private static final Logger log = LoggerFactory.getLogger(Frontend.class);
    private static final Frontend DEFAULT = new Frontend(FrontendConfig.DEFAULT);

    private final FrontendConfig config;
    private final Parser parser;

    private Frontend(FrontendConfig config) {
        this.config = config;
        this.parser = RecursiveDescentParser.create(config.parserConfig());
    }

    public static Frontend create() {
        return DEFAULT;
    }

    public static Frontend create(FrontendConfig config) {
        return new Frontend(config);
    }

    /**
     * Analyse a complete unit with the default configuration.
     */
    public static Analysis analyzeSourceFile(String input) {
        return DEFAULT.sourceFile(input);
    }

    /**
     * Analyse a single interactive line with the default configuration and nothing in scope.
     */
    public static Analysis analyzeReplLine(String input) {
        return DEFAULT.replLine(input, InScope.empty());
    }

    public Analysis sourceFile(String input) {
        return analyze(input, EntryPoint.SOURCE_FILE, InScope.empty());
    }

    public Analysis replLine(String input, InScope inScope) {
        return analyze(input, EntryPoint.REPL_LINE, inScope);
    }

    /**
     * Run every phase on {@code input}. Later phases run even if earlier ones reported errors.
     */
    public Analysis analyze(String input, EntryPoint entryPoint, InScope inScope) {
        var text = input.getBytes(StandardCharsets.UTF_8);
        var tokens = Lexer.lex(text);
        log.debug("Lexed {} bytes into {} tokens", text.length, tokens.size());

        var parse = parser.parse(text, tokens, entryPoint);
        log.debug("Parsed {} as {}: {} syntax error(s), tree of {} bytes",
                  entryPoint, text.length, parse.errors().size(), parse.tree().byteSize());

        var validationErrors = Validation.validate(parse.root(), parse.tree());
        log.debug("Validation found {} error(s)", validationErrors.size());

        var lowerResult = Lowering.lower(new Root(parse.root()), parse.tree(), inScope);
        if (log.isDebugEnabled()) {
            log.debug("Lowered {} expression(s), {} function(s); {} lowering error(s)",
                      lowerResult.program().exprs().size(),
                      lowerResult.program().fncDefs().size(),
                      lowerResult.errors().size());
        }

        return new Analysis(input, parse, validationErrors, lowerResult);
    }

    public FrontendConfig config() {
        return config;
    }

    /**
     * Create a builder for a non-default configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxNestingDepth = ParserConfig.DEFAULT_MAX_NESTING_DEPTH;

        private Builder() {}

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the nesting depth is not positive
         */
        public Frontend build() {
            return create(new FrontendConfig(new ParserConfig(maxNestingDepth)));
        }
    }
}
