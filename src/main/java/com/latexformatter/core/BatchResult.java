package com.latexformatter.core;

import java.util.List;
import java.util.Optional;

/**
 * Per-document outcomes of a batch run, in input order.
 */
public final class BatchResult {
    private final List<DocumentOutcome> outcomes;

    BatchResult(List<DocumentOutcome> outcomes) {
        this.outcomes = List.copyOf(outcomes);
    }

    public List<DocumentOutcome> getOutcomes() {
        return outcomes;
    }

    /**
     * Logical AND of all per-document outcomes; true for an empty batch.
     */
    public boolean isSuccessful() {
        return outcomes.stream().allMatch(DocumentOutcome::isSuccessful);
    }

    public Optional<DocumentOutcome> getOutcome(String documentId) {
        return outcomes.stream().filter(o -> o.getDocumentId().equals(documentId)).findFirst();
    }

    public long getFailureCount() {
        return outcomes.stream().filter(o -> !o.isSuccessful()).count();
    }

    public long getChangedCount() {
        return outcomes.stream().filter(DocumentOutcome::needsFormatting).count();
    }
}
