package com.latexformatter.syntax;

import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.Severity;
import com.latexformatter.passes.LatexLines;
import com.latexformatter.passes.LineClassifier;
import com.latexformatter.protect.ProtectedText;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntUnaryOperator;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Advisory cross-reference check: {@code \ref}, {@code \eqref} and {@code \pageref}
 * targets that no {@code \label} defines, and labels nothing refers to.
 *
 * <p>Comments and opaque text are ignored. Keys containing {@code #} are macro
 * parameters and are never reported.
 */
public class CrossReferenceChecker {
    private static final Pattern COMMAND = Pattern.compile("\\\\(label|ref|pageref|eqref)\\s*\\{([^{}]*)\\}");
    private static final String LABEL = "label";

    private final Set<String> opaqueEnvironments;

    public CrossReferenceChecker(Set<String> opaqueEnvironments) {
        this.opaqueEnvironments = opaqueEnvironments;
    }

    public List<Diagnostic> check(String text) {
        return _check(text, UnaryOperator.identity(), IntUnaryOperator.identity(), text);
    }

    /**
     * Checks protected text, reporting positions against the original text.
     */
    public List<Diagnostic> check(ProtectedText protectedText) {
        return _check(protectedText.getText(), protectedText::reveal,
                protectedText::originalOffset, protectedText.getOriginalText());
    }

    private List<Diagnostic> _check(String text, UnaryOperator<String> nameResolver,
                                    IntUnaryOperator offsetMapper, String reportText) {
        List<String> lines = LatexLines.split(text);
        List<LineClassifier.LineInfo> infos = LineClassifier.classify(lines, opaqueEnvironments, Set.of(), nameResolver);
        SourcePositions positions = new SourcePositions(reportText, offsetMapper);

        Map<String, Integer> labels = new LinkedHashMap<>();
        List<Reference> references = new ArrayList<>();
        Set<String> referenced = new HashSet<>();

        int lineStart = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            LineClassifier.LineInfo info = infos.get(i);
            int offset = lineStart;
            lineStart += line.length() + 1;

            if (info.getKind() == LineClassifier.LineKind.OPAQUE_BODY && !info.closesOpaque()) {
                continue;
            }

            String code = info.maskedCode(line);
            Matcher matcher = COMMAND.matcher(code);
            while (matcher.find()) {
                if (LatexLines.isEscaped(code, matcher.start())) {
                    continue;
                }
                String key = nameResolver.apply(matcher.group(2)).trim();
                if (key.isEmpty() || key.indexOf('#') >= 0) {
                    continue;
                }
                int position = offset + matcher.start();
                if (LABEL.equals(matcher.group(1))) {
                    labels.putIfAbsent(key, position);
                } else {
                    references.add(new Reference(key, matcher.group(1), position));
                    referenced.add(key);
                }
            }
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Reference reference : references) {
            if (!labels.containsKey(reference.key)) {
                diagnostics.add(positions.diagnostic(Severity.WARNING, DiagnosticKind.UNDEFINED_REFERENCE,
                        "Undefined reference: " + reference.key, reference.offset,
                        "Add \\label{" + reference.key + "} or fix the \\" + reference.command));
            }
        }
        for (Map.Entry<String, Integer> label : labels.entrySet()) {
            if (!referenced.contains(label.getKey())) {
                diagnostics.add(positions.diagnostic(Severity.INFO, DiagnosticKind.UNUSED_LABEL,
                        "Unused label: " + label.getKey(), label.getValue(), null));
            }
        }
        return diagnostics;
    }

    private static final class Reference {
        private final String key;
        private final String command;
        private final int offset;

        Reference(String key, String command, int offset) {
            this.key = key;
            this.command = command;
            this.offset = offset;
        }
    }
}
