package com.latexformatter.api;

/**
 * Operation requested from the formatter for a document.
 */
public enum FormatMode {
    /** Rewrite the document and return the new text. */
    FORMAT,
    /** Report whether the document is already formatted, without returning new text. */
    CHECK,
    /** Produce a unified diff between the document and its formatted form. */
    DIFF
}
