package org.pragmatica.gingerbread.lower;

import org.pragmatica.gingerbread.tree.TextRange;

public record LowerError(TextRange range, LowerErrorKind kind) {

    public String message() {
        return kind.title() + ": " + kind.message();
    }

    @Override
    public String toString() {
        return "error at " + range + ": " + message();
    }
}
