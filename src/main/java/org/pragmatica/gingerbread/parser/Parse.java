package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.List;

/**
 * Result of parsing: a complete syntax tree plus the errors found along the way.
 */
public record Parse(SyntaxTree tree, List<SyntaxError> errors) {

    public Parse {
        errors = List.copyOf(errors);
    }

    public SyntaxNode root() {
        return tree.root();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Tree dump followed by one line per error, for tests and debugging.
     */
    public String debugString() {
        var sb = new StringBuilder(tree.debugTree());
        for (var error : errors) {
            sb.append(error).append('\n');
        }
        return sb.toString();
    }
}
