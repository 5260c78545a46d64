package org.pragmatica.latex.error;

import org.pragmatica.latex.tree.LineIndex;
import org.pragmatica.latex.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rich diagnostic message for Rust-style error reporting.
 *
 * <p>Example output:
 * <pre>
 * error: Unexpected end of input, expected '}'
 *   --> formula.tex:1:10
 *   |
 * 1 | \frac{1}{
 *   |          ^ unterminated group
 *   |
 * </pre>
 *
 * @param severity Error severity level
 * @param message  Primary error message
 * @param span     Source span where the problem was found
 * @param labels   Labeled spans for context
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String message,
    SourceSpan span,
    List<Label> labels,
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

    /**
     * A labeled span. Primary labels are underlined with {@code ^}, secondary ones with {@code -}.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public Diagnostic {
        labels = List.copyOf(labels);
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, message, span, List.of(), List.of());
    }

    /**
     * Diagnostic for a failed parse, pointing at the error location.
     */
    public static Diagnostic of(ParseError error) {
        var span = SourceSpan.at(error.location().offset());
        var diagnostic = error(error.message(), span);
        if (error instanceof ParseError.UnexpectedInput unexpected) {
            return diagnostic.withLabel("found " + unexpected.found())
                             .withHelp("expected " + unexpected.expected());
        }
        if (error instanceof ParseError.UnexpectedEof eof) {
            return diagnostic.withLabel("input ends here")
                             .withHelp("expected " + eof.expected());
        }
        return diagnostic.withLabel(error.message());
    }

    public Diagnostic withLabel(String label) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, label));
        return new Diagnostic(severity, message, span, newLabels, notes);
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String label) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, label));
        return new Diagnostic(severity, message, span, newLabels, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, span, labels, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The source text the span refers to
     * @param filename Optional filename for display, may be null
     */
    public String format(String source, String filename) {
        var index = LineIndex.of(source);
        var lines = source.split("\n", -1);
        var sb = new StringBuilder();

        sb.append(severity.display()).append(": ").append(message).append("\n");

        var loc = index.start(span);
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int minLine = loc.line();
        int maxLine = index.end(span).line();
        for (var label : labels) {
            minLine = Math.min(minLine, index.start(label.span()).line());
            maxLine = Math.max(maxLine, index.end(label.span()).line());
        }
        int gutterWidth = String.valueOf(maxLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum)).append(" | ").append(lineContent).append("\n");

            var lineLabels = labelsOnLine(index, lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth)).append(" | ");
                sb.append(underlines(index, lineNum, lineContent, lineLabels));
                sb.append("\n");
            }
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form: {@code name:line:column: severity: message}.
     */
    public String formatSimple(String source, String filename) {
        var loc = LineIndex.of(source).start(span);
        return String.format("%s:%d:%d: %s: %s",
                             filename == null ? "input" : filename,
                             loc.line(),
                             loc.column(),
                             severity.display(),
                             message);
    }

    private List<Label> labelsOnLine(LineIndex index, int lineNum) {
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && index.start(span).line() <= lineNum && index.end(span).line() >= lineNum) {
            result.add(Label.primary(span, ""));
        }
        for (var label : labels) {
            if (index.start(label.span()).line() <= lineNum && index.end(label.span()).line() >= lineNum) {
                result.add(label);
            }
        }
        return result;
    }

    private String underlines(LineIndex index, int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;
        var sorted = lineLabels.stream()
                               .sorted(Comparator.comparingInt(label -> label.span().start()))
                               .toList();
        for (var label : sorted) {
            var start = index.start(label.span());
            var end = index.end(label.span());
            int startCol = start.line() == lineNum ? start.column() : 1;
            int endCol = end.line() == lineNum ? end.column() : lineContent.length() + 1;

            while (currentCol < startCol) {
                sb.append(' ');
                currentCol++;
            }
            int underlineLen = Math.max(1, endCol - startCol);
            sb.append(String.valueOf(label.primary() ? '^' : '-').repeat(underlineLen));
            currentCol += underlineLen;

            if (!label.message().isEmpty()) {
                sb.append(' ').append(label.message());
            }
        }
        return sb.toString();
    }
}
