package org.pragmatica.gingerbread;

import org.pragmatica.gingerbread.ast.Root;
import org.pragmatica.gingerbread.ast.validation.ValidationError;
import org.pragmatica.gingerbread.error.Diagnostic;
import org.pragmatica.gingerbread.lower.LowerResult;
import org.pragmatica.gingerbread.parser.Parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the front end produced for one input.
 *
 * @param input            the analysed text
 * @param parse            syntax tree and syntax errors
 * @param validationErrors problems found in the syntax tree after parsing
 * @param lowerResult      lowered program, source map and name resolution errors
 */
public record Analysis(String input,
                       Parse parse,
                       List<ValidationError> validationErrors,
                       LowerResult lowerResult) {

    public Analysis {
        validationErrors = List.copyOf(validationErrors);
    }

    public Root root() {
        return new Root(parse.root());
    }

    /**
     * Errors of all phases in phase order: syntax, validation, lowering.
     */
    public List<Diagnostic> diagnostics() {
        var diagnostics = new ArrayList<Diagnostic>();
        parse.errors()
             .forEach(error -> diagnostics.add(Diagnostic.syntax(error)));
        validationErrors.forEach(error -> diagnostics.add(Diagnostic.validation(error)));
        lowerResult.errors()
                   .forEach(error -> diagnostics.add(Diagnostic.lower(error)));
        return diagnostics;
    }

    public boolean hasErrors() {
        return parse.hasErrors() || !validationErrors.isEmpty() || !lowerResult.errors().isEmpty();
    }

    public String formatDiagnostics() {
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics()) {
            sb.append(diagnostic.format(input));
        }
        return sb.toString();
    }
}
