package org.pragmatica.gingerbread.ast.validation;

import org.pragmatica.gingerbread.ast.IntLiteral;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks run on the syntax tree after parsing.
 */
public final class Validation {
    private Validation() {}

    /**
     * Validate {@code node} and everything below it. Errors are reported in source order.
     */
    public static List<ValidationError> validate(SyntaxNode node, SyntaxTree tree) {
        var errors = new ArrayList<ValidationError>();
        for (var descendant : node.descendants(tree)) {
            IntLiteral.cast(descendant, tree)
                      .ifPresent(literal -> validateIntLiteral(literal, tree, errors));
        }
        return errors;
    }

    private static void validateIntLiteral(IntLiteral literal, SyntaxTree tree, List<ValidationError> errors) {
        literal.value(tree)
               .filter(value -> value.value(tree).isEmpty())
               .ifPresent(value -> errors.add(new ValidationError(ValidationErrorKind.INT_LITERAL_TOO_BIG,
                                                                  value.range(tree))));
    }
}
