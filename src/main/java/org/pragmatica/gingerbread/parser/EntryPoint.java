package org.pragmatica.gingerbread.parser;

/**
 * Top-level grammar rule a parse starts from.
 */
public enum EntryPoint {
    /**
     * A whole unit: definitions and statements, every statement terminated.
     */
    SOURCE_FILE,

    /**
     * One interactive line: definitions and statements followed by an optional trailing expression.
     */
    REPL_LINE
}
