package com.latexformatter.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.Severity;
import org.junit.jupiter.api.Test;

class DiagnosticTest {

    @Test
    void equalityIgnoresSuggestion() {
        Diagnostic plain = new Diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_BRACE, "m", 1, 2);
        Diagnostic suggested = new Diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_BRACE, "m", 1, 2, "fix");

        assertThat(plain).isEqualTo(suggested).hasSameHashCodeAs(suggested);
        assertThat(plain).isNotEqualTo(new Diagnostic(Severity.WARNING, DiagnosticKind.UNBALANCED_BRACE, "m", 1, 2));
    }

    @Test
    void formatResultReportsSeverities() {
        FormatResult result = FormatResult.builder()
                .successful(true)
                .outputText("x")
                .addDiagnostic(new Diagnostic(Severity.INFO, DiagnosticKind.RAGGED_TABLE_ROW, "m", 1, 1))
                .build();

        assertThat(result.hasDiagnostics(Severity.INFO)).isTrue();
        assertThat(result.hasDiagnostics(Severity.ERROR)).isFalse();
        assertThat(result.getAppliedChanges()).isEmpty();
    }
}
