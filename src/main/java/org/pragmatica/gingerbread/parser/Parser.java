package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.lexer.Token;

import java.util.List;

/**
 * Parser for Gingerbread source text.
 */
public interface Parser {

    /**
     * Parse a complete unit where every statement is terminated.
     */
    Parse parseSourceFile(String input);

    /**
     * Parse an interactive line, which may end with an unterminated expression.
     */
    Parse parseReplLine(String input);

    /**
     * Parse already lexed input. {@code tokens} must cover {@code text} without gaps.
     */
    Parse parse(byte[] text, List<Token> tokens, EntryPoint entryPoint);
}
