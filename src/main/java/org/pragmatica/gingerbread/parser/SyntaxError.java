package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.parser.SyntaxErrorKind.Missing;
import org.pragmatica.gingerbread.parser.SyntaxErrorKind.NestingTooDeep;
import org.pragmatica.gingerbread.parser.SyntaxErrorKind.Unexpected;
import org.pragmatica.gingerbread.tree.TextRange;

/**
 * Syntax error recorded by the parser. Parsing always continues after an error.
 */
public record SyntaxError(ExpectedSyntax expectedSyntax, SyntaxErrorKind kind) {

    public String message() {
        if (kind instanceof Missing) {
            return "missing " + expectedSyntax.describe();
        }
        if (kind instanceof Unexpected unexpected) {
            return "expected " + expectedSyntax.describe() + " but found " + unexpected.found().display();
        }
        return "nesting too deep";
    }

    /**
     * Source range the error refers to. A missing item has an empty range at its offset.
     */
    public TextRange range() {
        if (kind instanceof Missing missing) {
            return TextRange.empty(missing.offset());
        }
        if (kind instanceof Unexpected unexpected) {
            return unexpected.range();
        }
        return ((NestingTooDeep) kind).range();
    }

    @Override
    public String toString() {
        return "error at " + range() + ": " + message();
    }
}
