package org.pragmatica.gingerbread.ast.validation;

import org.pragmatica.gingerbread.tree.TextRange;

/**
 * Problem in syntactically valid input that the grammar cannot express.
 */
public record ValidationError(ValidationErrorKind kind, TextRange range) {

    public String message() {
        return kind.message();
    }

    @Override
    public String toString() {
        return "error at " + range + ": " + message();
    }
}
