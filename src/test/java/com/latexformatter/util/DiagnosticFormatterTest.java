package com.latexformatter.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.Severity;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DiagnosticFormatterTest {

    private final DiagnosticFormatter formatter = new DiagnosticFormatter(false);

    @Test
    void formatsDiagnosticWithSuggestion() {
        Diagnostic diagnostic = new Diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_BRACE,
                "Unmatched closing brace", 3, 7, "Remove the '}'");

        assertThat(formatter.formatDiagnostic(diagnostic))
                .isEqualTo("ERROR: Unmatched closing brace (Line 3, Column 7)\n  Suggestion: Remove the '}'");
    }

    @Test
    void summarizesPerDocument() {
        Map<String, List<Diagnostic>> byDocument = new LinkedHashMap<>();
        byDocument.put("a.tex", List.of(
                new Diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_BRACE, "x", 1, 1),
                new Diagnostic(Severity.INFO, DiagnosticKind.RAGGED_TABLE_ROW, "y", 2, 1)));
        byDocument.put("b.tex", List.of());

        String summary = formatter.formatSummary(byDocument);

        assertThat(summary).contains("a.tex: 1 errors, 1 info").doesNotContain("b.tex");
        assertThat(summary).endsWith("Total: 1 errors, 1 info");
    }

    @Test
    void colorsOnlyWhenEnabled() {
        assertThat(new DiagnosticFormatter(true).colorize(DiagnosticFormatter.ANSI_RED, "x"))
                .isEqualTo(DiagnosticFormatter.ANSI_RED + "x" + DiagnosticFormatter.ANSI_RESET);
        assertThat(formatter.colorize(DiagnosticFormatter.ANSI_RED, "x")).isEqualTo("x");
    }
}
