package com.latexformatter.api;

import java.util.List;

/**
 * Differences between a document and its formatted form, both as edits and as
 * unified-diff text.
 */
public class DocumentDiff {
    private final String documentName;
    private final List<LineEdit> edits;
    private final String unifiedText;

    public DocumentDiff(String documentName, List<LineEdit> edits, String unifiedText) {
        this.documentName = documentName;
        this.edits = List.copyOf(edits);
        this.unifiedText = unifiedText;
    }

    public String getDocumentName() { return documentName; }
    public List<LineEdit> getEdits() { return edits; }

    /**
     * Unified diff with {@code a/} and {@code b/} headers, or an empty string when the
     * document is already formatted.
     */
    public String getUnifiedText() { return unifiedText; }

    public boolean isEmpty() {
        return edits.isEmpty();
    }
}
