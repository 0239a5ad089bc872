package org.parsercraft.peg.error;

import org.parsercraft.peg.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic message rendered in Rust style.
 *
 * <p>Example output:
 * <pre>
 * error[E0001]: unexpected input
 *   --> calc.src:1:5
 *   |
 * 1 | x = ;
 *   |     ^ found ';'
 *   |
 *   = help: while matching rule 'expr'
 * </pre>
 *
 * @param severity severity level
 * @param code     optional error code, may be {@code null}
 * @param message  primary message
 * @param span     location of the problem
 * @param labels   labels drawn under the source line
 * @param notes    trailing notes
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    List<String> labels,
    List<String> notes
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, null, message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String label) {
        return new Diagnostic(severity, code, message, span, append(labels, label), notes);
    }

    public Diagnostic withNote(String note) {
        return new Diagnostic(severity, code, message, span, labels, append(notes, note));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    private static List<String> append(List<String> list, String item) {
        var copy = new ArrayList<>(list);
        copy.add(item);
        return List.copyOf(copy);
    }

    /**
     * Format against the source text; {@code filename} may be {@code null}.
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        sb.append(severity.display());
        if (code != null) {
            sb.append('[').append(code).append(']');
        }
        sb.append(": ").append(message).append('\n');

        var start = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(':');
        }
        sb.append(start.line()).append(':').append(start.column()).append('\n');

        var lines = source.split("\n", -1);
        var gutter = " ".repeat(String.valueOf(start.line()).length());
        sb.append(gutter).append(" |\n");
        if (start.line() <= lines.length) {
            var content = stripCarriageReturn(lines[start.line() - 1]);
            sb.append(start.line()).append(" | ").append(content).append('\n');
            sb.append(gutter).append(" | ")
              .append(" ".repeat(start.column() - 1))
              .append("^".repeat(underlineLength(content)));
            if (!labels.isEmpty()) {
                sb.append(' ').append(String.join(", ", labels));
            }
            sb.append('\n');
        }
        sb.append(gutter).append(" |\n");
        for (var note : notes) {
            sb.append(gutter).append(" = ").append(note).append('\n');
        }
        return sb.toString();
    }

    private int underlineLength(String lineContent) {
        if (span.start().line() != span.end().line()) {
            return Math.max(1, lineContent.length() - span.start().column() + 1);
        }
        return Math.max(1, span.length());
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * Single-line form: {@code file:line:column: severity: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s",
                             filename == null ? "input" : filename,
                             loc.line(), loc.column(), severity.display(), message);
    }
}
