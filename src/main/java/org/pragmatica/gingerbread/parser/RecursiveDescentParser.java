package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.grammar.Grammar;
import org.pragmatica.gingerbread.lexer.Lexer;
import org.pragmatica.gingerbread.lexer.Token;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link Parser} driving the hand-written grammar rules over a {@link ParsingContext}.
 */
public final class RecursiveDescentParser implements Parser {
    private final ParserConfig config;

    private RecursiveDescentParser(ParserConfig config) {
        this.config = config;
    }

    public static RecursiveDescentParser create() {
        return new RecursiveDescentParser(ParserConfig.DEFAULT);
    }

    public static RecursiveDescentParser create(ParserConfig config) {
        return new RecursiveDescentParser(config);
    }

    @Override
    public Parse parseSourceFile(String input) {
        return parseText(input, EntryPoint.SOURCE_FILE);
    }

    @Override
    public Parse parseReplLine(String input) {
        return parseText(input, EntryPoint.REPL_LINE);
    }

    private Parse parseText(String input, EntryPoint entryPoint) {
        var text = input.getBytes(StandardCharsets.UTF_8);
        return parse(text, Lexer.lex(text), entryPoint);
    }

    @Override
    public Parse parse(byte[] text, List<Token> tokens, EntryPoint entryPoint) {
        var p = ParsingContext.create(tokens, config);
        Grammar.root(p, entryPoint);
        return p.finish(text);
    }

    public ParserConfig config() {
        return config;
    }
}
