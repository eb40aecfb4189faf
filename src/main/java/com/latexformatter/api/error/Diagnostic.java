package com.latexformatter.api.error;

import java.util.Objects;

/**
 * A location-tagged report about a document. Diagnostics never mutate the document.
 */
public class Diagnostic {
    private final Severity severity;
    private final DiagnosticKind kind;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public Diagnostic(Severity severity, DiagnosticKind kind, String message, int line, int column) {
        this(severity, kind, message, line, column, null);
    }

    public Diagnostic(Severity severity, DiagnosticKind kind, String message, int line, int column,
                      String suggestion) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    // Getters
    public Severity getSeverity() { return severity; }
    public DiagnosticKind getKind() { return kind; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Diagnostic)) {
            return false;
        }
        Diagnostic that = (Diagnostic) o;
        return line == that.line
                && column == that.column
                && severity == that.severity
                && kind == that.kind
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, kind, message, line, column);
    }

    @Override
    public String toString() {
        return severity + " " + kind + " at " + line + ":" + column + ": " + message;
    }
}
