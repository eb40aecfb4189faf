package com.latexformatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.Severity;

/**
 * Result of a formatting operation.
 */
public class FormatResult {
    private final boolean successful;
    private final String outputText;
    private final boolean changed;
    private final List<Diagnostic> diagnostics;
    private final List<FormattingChange> appliedChanges;

    private FormatResult(Builder builder) {
        this.successful = builder.successful;
        this.outputText = builder.outputText;
        this.changed = builder.changed;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(builder.diagnostics));
        this.appliedChanges = Collections.unmodifiableList(new ArrayList<>(builder.appliedChanges));
    }

    /**
     * False when the document could not be formatted safely. The output text is then the
     * unmodified input.
     */
    public boolean isSuccessful() {
        return successful;
    }

    public String getOutputText() {
        return outputText;
    }

    public boolean isChanged() {
        return changed;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<FormattingChange> getAppliedChanges() {
        return appliedChanges;
    }

    public boolean hasDiagnostics(Severity severity) {
        return diagnostics.stream().anyMatch(d -> d.getSeverity() == severity);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String outputText;
        private boolean changed;
        private List<Diagnostic> diagnostics = new ArrayList<>();
        private List<FormattingChange> appliedChanges = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder outputText(String outputText) {
            this.outputText = outputText;
            return this;
        }

        public Builder changed(boolean changed) {
            this.changed = changed;
            return this;
        }

        public Builder addDiagnostic(Diagnostic diagnostic) {
            this.diagnostics.add(diagnostic);
            return this;
        }

        public Builder diagnostics(List<Diagnostic> diagnostics) {
            this.diagnostics = new ArrayList<>(diagnostics);
            return this;
        }

        public Builder addChange(FormattingChange change) {
            this.appliedChanges.add(change);
            return this;
        }

        public Builder appliedChanges(List<FormattingChange> changes) {
            this.appliedChanges = new ArrayList<>(changes);
            return this;
        }

        public FormatResult build() {
            return new FormatResult(this);
        }
    }
}
