package com.latexformatter.api.error;

/**
 * Category of a {@link Diagnostic}.
 */
public enum DiagnosticKind {
    UNBALANCED_BRACE,
    UNBALANCED_ENVIRONMENT,
    RAGGED_TABLE_ROW,
    UNDEFINED_REFERENCE,
    UNUSED_LABEL,
    INTERNAL_CONSISTENCY
}
