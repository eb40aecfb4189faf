package com.latexformatter.syntax;

import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.Severity;

import java.util.function.IntUnaryOperator;

/**
 * Converts offsets of the checked text into line and column of the reported text.
 */
final class SourcePositions {
    private final String text;
    private final IntUnaryOperator offsetMapper;

    SourcePositions(String text, IntUnaryOperator offsetMapper) {
        this.text = text;
        this.offsetMapper = offsetMapper;
    }

    Diagnostic diagnostic(Severity severity, DiagnosticKind kind, String message, int offset, String suggestion) {
        int mapped = Math.min(offsetMapper.applyAsInt(offset), text.length());
        int line = 1;
        int column = 1;
        for (int i = 0; i < mapped; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new Diagnostic(severity, kind, message, line, column, suggestion);
    }
}
