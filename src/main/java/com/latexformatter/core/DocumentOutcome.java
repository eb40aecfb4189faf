package com.latexformatter.core;

import com.latexformatter.api.DocumentDiff;
import com.latexformatter.api.FormatMode;
import com.latexformatter.api.FormatResult;

/**
 * Result of one document in a batch.
 */
public final class DocumentOutcome {
    private final String documentId;
    private final FormatMode mode;
    private final FormatResult result;
    private final DocumentDiff diff;
    private final boolean successful;

    DocumentOutcome(String documentId, FormatMode mode, FormatResult result, DocumentDiff diff, boolean successful) {
        this.documentId = documentId;
        this.mode = mode;
        this.result = result;
        this.diff = diff;
        this.successful = successful;
    }

    public String getDocumentId() { return documentId; }
    public FormatMode getMode() { return mode; }
    public FormatResult getResult() { return result; }

    /** The diff in {@link FormatMode#DIFF} mode, otherwise null. */
    public DocumentDiff getDiff() { return diff; }

    /**
     * In check mode a document succeeds only when it is already formatted; in the
     * other modes when it could be formatted.
     */
    public boolean isSuccessful() { return successful; }

    public boolean needsFormatting() {
        return result.isSuccessful() && result.isChanged();
    }
}
