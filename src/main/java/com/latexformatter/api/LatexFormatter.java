package com.latexformatter.api;

import java.util.List;

import com.latexformatter.api.error.Diagnostic;

/**
 * The main formatter interface. Every operation works on one document held in memory.
 */
public interface LatexFormatter {
    /**
     * Formats a document. Never throws for bad input; failures are reported through the
     * result.
     */
    FormatResult format(String text);

    /**
     * True if the document is already formatted.
     */
    boolean check(String text);

    /**
     * Line-level differences between the document and its formatted form.
     */
    DocumentDiff diff(String documentName, String text);

    /**
     * Balance diagnostics for braces and environments.
     */
    List<Diagnostic> checkSyntax(String text);
}
