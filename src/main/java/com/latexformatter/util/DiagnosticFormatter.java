package com.latexformatter.util;

import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.Severity;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Utility for rendering diagnostics consistently on the console.
 */
public class DiagnosticFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors whether to use ANSI colors in the output
     */
    public DiagnosticFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats a single diagnostic as {@code SEVERITY: message (Line l, Column c)}.
     */
    public String formatDiagnostic(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (diagnostic.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ");
        sb.append(diagnostic.getMessage());
        sb.append(" (Line ").append(diagnostic.getLine())
                .append(", Column ").append(diagnostic.getColumn()).append(")");

        if (diagnostic.getSuggestion() != null && !diagnostic.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(diagnostic.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Creates a summary of diagnostics per document, keyed by document identifier.
     */
    public String formatSummary(Map<String, List<Diagnostic>> diagnosticsByDocument) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Diagnostic Summary:\n"));

        long totalFatals = 0;
        long totalErrors = 0;
        long totalWarnings = 0;
        long totalInfos = 0;

        for (Map.Entry<String, List<Diagnostic>> entry : diagnosticsByDocument.entrySet()) {
            List<Diagnostic> diagnostics = entry.getValue();
            if (diagnostics.isEmpty()) {
                continue;
            }

            Map<Severity, Long> counts = diagnostics.stream()
                    .collect(Collectors.groupingBy(Diagnostic::getSeverity, Collectors.counting()));
            long fatals = counts.getOrDefault(Severity.FATAL, 0L);
            long errors = counts.getOrDefault(Severity.ERROR, 0L);
            long warnings = counts.getOrDefault(Severity.WARNING, 0L);
            long infos = counts.getOrDefault(Severity.INFO, 0L);

            totalFatals += fatals;
            totalErrors += errors;
            totalWarnings += warnings;
            totalInfos += infos;

            sb.append(entry.getKey()).append(": ")
                    .append(_joinCounts(fatals, errors, warnings, infos))
                    .append("\n");
        }

        sb.append("\nTotal: ").append(_joinCounts(totalFatals, totalErrors, totalWarnings, totalInfos));
        return sb.toString();
    }

    /**
     * Groups diagnostics by severity.
     */
    public Map<Severity, List<Diagnostic>> groupBySeverity(List<Diagnostic> diagnostics) {
        return diagnostics.stream().collect(Collectors.groupingBy(Diagnostic::getSeverity));
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }

    private String _joinCounts(long fatals, long errors, long warnings, long infos) {
        StringBuilder sb = new StringBuilder();
        _appendCount(sb, fatals, ANSI_RED, " fatal");
        _appendCount(sb, errors, ANSI_RED, " errors");
        _appendCount(sb, warnings, ANSI_YELLOW, " warnings");
        _appendCount(sb, infos, ANSI_BLUE, " info");
        return sb.length() == 0 ? "none" : sb.toString();
    }

    private void _appendCount(StringBuilder sb, long count, String color, String label) {
        if (count <= 0) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(colorize(color, count + label));
    }
}
