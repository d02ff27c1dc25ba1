package org.pragmatica.gingerbread.error;

import org.pragmatica.gingerbread.ast.validation.ValidationError;
import org.pragmatica.gingerbread.lower.LowerError;
import org.pragmatica.gingerbread.parser.SyntaxError;
import org.pragmatica.gingerbread.parser.SyntaxErrorKind;
import org.pragmatica.gingerbread.tree.TextRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Error of any phase, ready to be shown to a user.
 *
 * <p>Example output:
 * <pre>
 * syntax error at 1:5: expected identifier but found `*`
 *   let *
 *       ^
 * </pre>
 * A range spanning several lines is marked from above on its first line and from below on its last:
 * <pre>
 * syntax error at 1:5: expected identifier but found string literal
 *       vv
 *   let "a
 *   b"
 *   ^^
 * </pre>
 *
 * @param title  kind of problem, e.g. {@code syntax error}
 * @param detail what exactly is wrong
 * @param range  byte range of the offending input, never empty
 */
public record Diagnostic(String title, String detail, TextRange range) {
    private static final String PADDING = "  ";
    private static final String POINTER_UP = "^";
    private static final String POINTER_DOWN = "v";

    public Diagnostic {
        if (range.isEmpty()) {
            range = TextRange.of(range.start(), range.start() + 1);
        }
    }

    public static Diagnostic syntax(SyntaxError error) {
        var range = error.kind() instanceof SyntaxErrorKind.Missing missing
                    ? TextRange.of(missing.offset(), missing.offset() + 1)
                    : error.range();
        return new Diagnostic("syntax error", error.message(), range);
    }

    /**
     * Validation problems are reported as syntax errors to the user.
     */
    public static Diagnostic validation(ValidationError error) {
        return new Diagnostic("syntax error", error.message(), error.range());
    }

    public static Diagnostic lower(LowerError error) {
        return new Diagnostic(error.kind().title(), error.kind().message(), error.range());
    }

    /**
     * Header line followed by the annotated source lines.
     */
    public List<String> render(String input) {
        var text = SourceText.of(input);
        var start = text.locate(range.start());
        var end = text.locate(Math.min(range.end(), text.byteLength() + 1) - 1);

        var lines = new ArrayList<String>();
        lines.add(header(start));

        if (start.line() == end.line()) {
            lines.add(PADDING + text.line(start.line()));
            lines.add(PADDING + " ".repeat(start.column() - 1)
                      + POINTER_UP.repeat(Math.max(1, end.column() - start.column() + 1)));
            return lines;
        }

        var firstLine = text.line(start.line());
        int firstLineLength = firstLine.codePointCount(0, firstLine.length());
        lines.add(PADDING + " ".repeat(start.column() - 1)
                  + POINTER_DOWN.repeat(Math.max(1, firstLineLength - start.column() + 1)));
        for (int line = start.line(); line <= end.line(); line++) {
            lines.add(PADDING + text.line(line));
        }
        lines.add(PADDING + POINTER_UP.repeat(end.column()));
        return lines;
    }

    /**
     * {@link #render(String)} joined into one newline terminated string.
     */
    public String format(String input) {
        return String.join("\n", render(input)) + "\n";
    }

    public String header(SourceLocation location) {
        return title + " at " + location + ": " + detail;
    }
}
