package org.pragmatica.odata.error;

import org.pragmatica.odata.tree.SourceSpan;

import java.util.List;

/**
 * Compiler-style rendering of a {@link ParseError} against the token it was produced for.
 *
 * <p>Example output:
 * <pre>
 * error[E0300]: invalid date
 *   --> 1:1
 *   |
 * 1 | 2023-02-29
 *   | ^^^^^^^^^^ day 29 is out of range for 2023-02
 *   |
 * </pre>
 *
 * @param code    error code derived from the error category
 * @param message primary error message
 * @param span    source span the error refers to
 * @param label   text shown next to the underline
 * @param notes   additional notes or suggestions
 */
public record Diagnostic(
    String code,
    String message,
    SourceSpan span,
    String label,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Build a diagnostic for an error raised while parsing {@code source}.
     */
    public static Diagnostic of(ParseError error, String source) {
        var span = SourceSpan.of(source, error.location(), error.length());

        if (error instanceof ParseError.UnexpectedInput unexpected) {
            return new Diagnostic("E0100", "unexpected input", span,
                                  "found '" + unexpected.found() + "'",
                                  List.of("help: expected " + unexpected.expected()));
        }
        if (error instanceof ParseError.UnexpectedEof eof) {
            return new Diagnostic("E0101", "unexpected end of input", span,
                                  "input ends here",
                                  List.of("help: expected " + eof.expected()));
        }
        if (error instanceof ParseError.TrailingInput trailing) {
            return new Diagnostic("E0200", "unexpected trailing input", span,
                                  "not part of the " + trailing.matched(),
                                  List.of("help: remove the trailing characters or quote the value"));
        }
        var invalid = (ParseError.InvalidValue) error;
        return new Diagnostic("E0300", "invalid " + invalid.kind(), span, invalid.reason(), List.of());
    }

    /**
     * Format this diagnostic in multi-line form with the offending characters underlined.
     */
    public String format(String source) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var start = span.start();

        sb.append("error[").append(code).append("]: ").append(message).append("\n");
        sb.append("  --> ").append(start.line()).append(":").append(start.column()).append("\n");

        int gutterWidth = String.valueOf(start.line()).length();
        var gutter = " ".repeat(gutterWidth);

        sb.append(gutter).append(" |\n");
        if (start.line() <= lines.length) {
            var lineContent = lines[start.line() - 1];
            sb.append(start.line()).append(" | ").append(lineContent).append("\n");

            // Underline stops at the end of the first line for multi-line spans
            int width = span.end().line() == start.line()
                        ? span.end().column() - start.column()
                        : lineContent.length() - start.column() + 1;
            sb.append(gutter).append(" | ")
              .append(" ".repeat(start.column() - 1))
              .append("^".repeat(Math.max(1, width)));
            if (!label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
        }
        sb.append(gutter).append(" |\n");

        for (var note : notes) {
            sb.append(gutter).append(" = ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        var loc = span.start();
        return String.format("%d:%d: error[%s]: %s: %s", loc.line(), loc.column(), code, message, label);
    }
}
