package com.wiredsl.compiler.diagnostics;

/**
 * A user-facing problem report produced by any compiler stage.
 * Line and column are 1-based; they are null when the problem has no source position.
 */
public record Diagnostic(
    String code,
    String message,
    Integer line,
    Integer column,
    Severity severity,
    String suggestion
) {

    public static Diagnostic error(String code, String message, Integer line, Integer column) {
        return new Diagnostic(code, message, line, column, Severity.ERROR, null);
    }

    public static Diagnostic warning(String code, String message, Integer line, Integer column) {
        return new Diagnostic(code, message, line, column, Severity.WARNING, null);
    }

    public Diagnostic withSuggestion(String suggestion) {
        return new Diagnostic(code, message, line, column, severity, suggestion);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public boolean hasLocation() {
        return line != null;
    }

    /**
     * Format as a single line, e.g. {@code error[PARSE] 3:14 missing '}' (hint: ...)}.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.label()).append('[').append(code).append(']');
        if (line != null) {
            sb.append(' ').append(line);
            if (column != null) {
                sb.append(':').append(column);
            }
        }
        sb.append(' ').append(message);
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append(" (hint: ").append(suggestion).append(')');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
