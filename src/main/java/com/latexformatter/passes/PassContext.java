package com.latexformatter.passes;

import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.config.FormatterConfig;
import com.latexformatter.patterns.MathPatterns;
import com.latexformatter.protect.ProtectedText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Per-document context handed to every pass: configuration, math definitions, the
 * placeholder mapping and a collector for informational notes. One instance per
 * format operation.
 */
public final class PassContext {
    private final FormatterConfig config;
    private final MathPatterns mathPatterns;
    private final ProtectedText protectedText;
    private final List<Diagnostic> notes = new ArrayList<>();

    public PassContext(FormatterConfig config, MathPatterns mathPatterns, ProtectedText protectedText) {
        this.config = config;
        this.mathPatterns = mathPatterns;
        this.protectedText = protectedText;
    }

    public FormatterConfig getConfig() { return config; }
    public MathPatterns getMathPatterns() { return mathPatterns; }

    /**
     * Replaces placeholder tokens in a fragment with the text they protect.
     */
    public String reveal(String fragment) {
        return protectedText == null ? fragment : protectedText.reveal(fragment);
    }

    /**
     * Display width of a fragment as it will appear after restoration.
     */
    public int displayWidth(String fragment) {
        return LatexLines.displayWidth(reveal(fragment));
    }

    /**
     * Regex source matching one placeholder token, or a pattern that never matches when
     * nothing is protected.
     */
    public String tokenRegex() {
        if (protectedText == null || protectedText.getPlaceholders().isEmpty()) {
            return "(?!)";
        }
        return Pattern.quote(String.valueOf(protectedText.getOpenMarker())) + "\\d+"
                + Pattern.quote(String.valueOf(protectedText.getCloseMarker()));
    }

    public List<LineClassifier.LineInfo> classify(List<String> lines) {
        return LineClassifier.classify(lines, config.getOpaqueEnvironments(),
                config.getNoIndentEnvironments(), this::reveal);
    }

    public void note(Diagnostic diagnostic) {
        notes.add(diagnostic);
    }

    public List<Diagnostic> getNotes() {
        return Collections.unmodifiableList(notes);
    }
}
