package com.latexformatter.syntax;

import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.Severity;
import com.latexformatter.passes.LatexLines;
import com.latexformatter.passes.LineClassifier;
import com.latexformatter.protect.ProtectedText;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.IntUnaryOperator;
import java.util.function.UnaryOperator;

/**
 * Advisory balance checker for braces and {@code \begin}/{@code \end} pairs. It never
 * changes the document and never stops formatting; it only reports.
 *
 * <p>Escaped braces, comments, opaque environment bodies and protected spans are not
 * inspected. On an environment mismatch the checker reports once and unwinds to the
 * matching {@code \begin}, so one mistake does not cascade into a report per line.
 */
public class SyntaxChecker {
    private static final String DOCUMENT = "document";

    private final Set<String> opaqueEnvironments;

    public SyntaxChecker(Set<String> opaqueEnvironments) {
        this.opaqueEnvironments = opaqueEnvironments;
    }

    /**
     * Checks plain text. Positions are 1-based lines and columns of {@code text}.
     */
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

        List<Diagnostic> diagnostics = new ArrayList<>();
        Deque<Integer> braces = new ArrayDeque<>();
        Deque<OpenEnvironment> environments = new ArrayDeque<>();
        boolean seenDocument = false;

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
            int unclosed = info.getUnclosedBeginColumn();
            if (unclosed >= 0 && !_closedLater(infos, i)) {
                diagnostics.add(positions.diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_ENVIRONMENT,
                        "Unmatched \\begin{" + info.getOpaqueName() + "}",
                        offset + unclosed,
                        "Add \\end{" + info.getOpaqueName() + "}"));
            }

            for (int j = 0; j < code.length(); j++) {
                char c = code.charAt(j);
                if ((c != '{' && c != '}') || LatexLines.isEscaped(code, j)) {
                    continue;
                }
                if (c == '{') {
                    braces.push(offset + j);
                } else if (braces.isEmpty()) {
                    diagnostics.add(positions.diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_BRACE,
                            "Unmatched closing brace", offset + j, "Remove the '}' or add a matching '{'"));
                } else {
                    braces.pop();
                }
            }

            for (LatexLines.EnvironmentEvent event : LatexLines.environmentEvents(code)) {
                String name = nameResolver.apply(event.getName());
                int position = offset + event.getStart();
                if (event.isBegin()) {
                    if (DOCUMENT.equals(name)) {
                        if (seenDocument) {
                            diagnostics.add(positions.diagnostic(Severity.WARNING,
                                    DiagnosticKind.UNBALANCED_ENVIRONMENT,
                                    "Multiple \\begin{document} found", position, null));
                        }
                        seenDocument = true;
                    }
                    environments.push(new OpenEnvironment(name, position));
                    continue;
                }
                _close(name, position, environments, diagnostics, positions);
            }
        }

        if (!braces.isEmpty()) {
            diagnostics.add(positions.diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_BRACE,
                    "Unmatched opening braces: " + braces.size(), braces.peekLast(),
                    "Add " + braces.size() + " closing brace(s)"));
        }
        Iterator<OpenEnvironment> unclosed = environments.descendingIterator();
        while (unclosed.hasNext()) {
            OpenEnvironment open = unclosed.next();
            diagnostics.add(positions.diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_ENVIRONMENT,
                    "Unmatched \\begin{" + open.name + "}", open.offset, "Add \\end{" + open.name + "}"));
        }
        return diagnostics;
    }

    private static void _close(String name, int position, Deque<OpenEnvironment> environments,
                               List<Diagnostic> diagnostics, SourcePositions positions) {
        if (environments.isEmpty()) {
            diagnostics.add(positions.diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_ENVIRONMENT,
                    "Unmatched \\end{" + name + "}", position, "Remove it or add \\begin{" + name + "}"));
            return;
        }
        OpenEnvironment top = environments.peek();
        if (top.name.equals(name)) {
            environments.pop();
            return;
        }

        boolean open = environments.stream().anyMatch(env -> env.name.equals(name));
        if (!open) {
            diagnostics.add(positions.diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_ENVIRONMENT,
                    "Unmatched \\end{" + name + "}", position, "Remove it or add \\begin{" + name + "}"));
            return;
        }
        diagnostics.add(positions.diagnostic(Severity.ERROR, DiagnosticKind.UNBALANCED_ENVIRONMENT,
                "Environment mismatch: expected \\end{" + top.name + "}, found \\end{" + name + "}",
                position, "Close \\begin{" + top.name + "} first"));
        OpenEnvironment unwound;
        do {
            unwound = environments.pop();
        } while (!unwound.name.equals(name));
    }

    private static boolean _closedLater(List<LineClassifier.LineInfo> infos, int startLine) {
        for (int i = startLine + 1; i < infos.size(); i++) {
            LineClassifier.LineInfo info = infos.get(i);
            if (info.getKind() != LineClassifier.LineKind.OPAQUE_BODY) {
                return false;
            }
            if (info.closesOpaque()) {
                return true;
            }
        }
        return false;
    }

    private static final class OpenEnvironment {
        private final String name;
        private final int offset;

        OpenEnvironment(String name, int offset) {
            this.name = name;
            this.offset = offset;
        }
    }
}
