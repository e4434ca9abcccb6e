package org.ftlbuffer.diagnostics;

import java.util.Objects;

/**
 * A structured description of a problem found while parsing or formatting messages.
 *
 * @param code     The problem code.
 * @param message  The human-readable description.
 * @param location The source location, or {@code null} for problems that have none (most runtime errors).
 * @param hint     A suggestion for fixing the problem, or {@code null}.
 * @param helpUrl  A documentation link, or {@code null}.
 */
public record Diagnostic(
        DiagnosticCode code,
        String message,
        SourceLocation location,
        String hint,
        String helpUrl
) {

    public Diagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Creates a diagnostic without location, hint or documentation link.
     * @param code    The problem code.
     * @param message The description.
     */
    public Diagnostic(DiagnosticCode code, String message) {
        this(code, message, null, null, null);
    }

    /**
     * @param location The location to attach.
     * @return A copy of this diagnostic pointing at {@code location}.
     */
    public Diagnostic withLocation(SourceLocation location) {
        return new Diagnostic(code, message, location, hint, helpUrl);
    }

    /**
     * Renders the diagnostic in a compiler-like layout:
     * <pre>
     * error[MESSAGE_NOT_FOUND]: Message 'hello' not found
     *   --&gt; line 5, column 10
     *   = help: Check that the message is defined in the loaded resources
     *   = note: see https://projectfluent.org/fluent/guide/messages.html
     * </pre>
     *
     * @return The formatted text without trailing line break.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("error[").append(code.name()).append("]: ").append(message);
        if (location != null) {
            sb.append("\n  --> line ").append(location.line()).append(", column ").append(location.column());
        }
        appendNotes(sb);
        return sb.toString();
    }

    /**
     * Renders the diagnostic like {@link #format()} and additionally shows the offending source
     * line with the location underlined.
     *
     * @param source The source text the location refers to.
     * @return The formatted text without trailing line break.
     */
    public String format(String source) {
        if (location == null || source == null) {
            return format();
        }
        String[] lines = source.split("\r?\n|\r", -1);
        if (location.line() < 1 || location.line() > lines.length) {
            return format();
        }
        String lineContent = lines[location.line() - 1];
        String lineNumber = String.valueOf(location.line());
        String gutter = " ".repeat(lineNumber.length());

        StringBuilder sb = new StringBuilder();
        sb.append("error[").append(code.name()).append("]: ").append(message);
        sb.append('\n').append(gutter).append("--> line ").append(location.line())
                .append(", column ").append(location.column());
        sb.append('\n').append(gutter).append(" |");
        sb.append('\n').append(lineNumber).append(" | ").append(lineContent);

        int available = Math.max(1, lineContent.length() - location.column() + 1);
        int underline = Math.max(1, Math.min(location.span().length(), available));
        sb.append('\n').append(gutter).append(" | ")
                .append(" ".repeat(Math.max(0, location.column() - 1)))
                .append("^".repeat(underline));
        appendNotes(sb);
        return sb.toString();
    }

    private void appendNotes(StringBuilder sb) {
        if (hint != null) {
            sb.append("\n  = help: ").append(hint);
        }
        if (helpUrl != null) {
            sb.append("\n  = note: see ").append(helpUrl);
        }
    }

    @Override
    public String toString() {
        return format();
    }
}
