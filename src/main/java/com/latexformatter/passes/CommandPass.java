package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes the space between a command name and its argument brace, trims whitespace
 * inside the arguments of structural commands and normalizes citation key lists.
 * Bibliography entries get one space between the key and the entry text, and
 * references run into adjacent words are separated by a space when
 * {@code normalize_ref_spacing} is on. Comments and opaque text are left alone; text
 * after an opaque {@code \end} on the same line is formatted again.
 */
public class CommandPass implements FormattingPass {
    private static final Pattern SPACE_BEFORE_BRACE = Pattern.compile("\\\\([a-zA-Z]+)[ \\t]+\\{");
    private static final Pattern REFERENCE = Pattern.compile("\\\\(?:ref|pageref|eqref)\\{[^{}]*\\}");

    private static final String TRIMMED_COMMANDS =
            "begin|end|usepackage|documentclass|label|ref|eqref|pageref|bibliography|bibliographystyle|bibitem";
    private static final String CITE_COMMANDS =
            "cite|citep|citet|citealt|citealp|citeauthor|citeyear";

    @Override
    public PassId getId() {
        return PassId.COMMANDS;
    }

    @Override
    public String apply(String text, PassContext context) {
        List<String> lines = LatexLines.split(text);
        List<LineClassifier.LineInfo> infos = context.classify(lines);

        String option = "(?:\\[[^\\]\\n]*\\]|" + context.tokenRegex() + ")";
        Pattern trimmedArgument = Pattern.compile(
                "\\\\(" + TRIMMED_COMMANDS + ")(?![a-zA-Z])(\\*?" + option + "?)\\{([^{}]*)\\}");
        Pattern citation = Pattern.compile(
                "\\\\(" + CITE_COMMANDS + ")(?![a-zA-Z])(\\*?" + option + "{0,2})\\{([^{}]*)\\}");

        Pattern bibitem = Pattern.compile("\\\\bibitem(?![a-zA-Z])" + option + "?\\{[^{}]*\\}(?=\\S)");
        boolean refSpacing = context.getConfig().isNormalizeRefSpacing();

        List<String> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            LineClassifier.LineInfo info = infos.get(i);
            if (info.getKind() == LineClassifier.LineKind.OPAQUE_BODY && !info.closesOpaque()) {
                result.add(line);
                continue;
            }

            int codeEnd = info.codeEnd(line);
            StringBuilder rewritten = new StringBuilder(line.length());
            int j = 0;
            while (j < codeEnd) {
                int opaqueEnd = info.opaqueEndAt(j);
                if (opaqueEnd >= 0) {
                    String opaque = line.substring(j, opaqueEnd);
                    boolean continued = j == 0 && info.getKind() == LineClassifier.LineKind.OPAQUE_BODY;
                    rewritten.append(continued ? opaque : _trimOpaqueBegin(opaque, trimmedArgument));
                    j = opaqueEnd;
                    continue;
                }
                int k = j;
                while (k < codeEnd && !info.isOpaqueAt(k)) {
                    k++;
                }
                String code = line.substring(j, k);
                code = _removeSpaceBeforeBrace(code);
                code = _rewrite(code, trimmedArgument, m -> m.group(3).trim());
                code = _rewrite(code, citation, m -> _normalizeKeys(m.group(3)));
                code = _spaceAfter(code, bibitem);
                if (refSpacing) {
                    code = _spaceAroundReferences(code);
                }
                rewritten.append(code);
                j = k;
            }
            rewritten.append(line, codeEnd, line.length());
            result.add(rewritten.toString());
        }
        return LatexLines.join(result, text.endsWith("\n"));
    }

    /**
     * Trims the name of an opaque {@code \begin} that starts the fragment; the opaque
     * content itself is kept as is.
     */
    private static String _trimOpaqueBegin(String opaque, Pattern trimmedArgument) {
        Matcher matcher = trimmedArgument.matcher(opaque);
        if (!opaque.startsWith("\\begin") || !matcher.lookingAt()) {
            return opaque;
        }
        return "\\" + matcher.group(1) + matcher.group(2) + "{" + matcher.group(3).trim() + "}"
                + opaque.substring(matcher.end());
    }

    private static String _spaceAfter(String code, Pattern command) {
        Matcher matcher = command.matcher(code);
        StringBuilder result = new StringBuilder(code.length() + 2);
        int pos = 0;
        while (matcher.find()) {
            if (LatexLines.isEscaped(code, matcher.start())) {
                continue;
            }
            result.append(code, pos, matcher.end()).append(' ');
            pos = matcher.end();
        }
        result.append(code, pos, code.length());
        return result.toString();
    }

    private static String _spaceAroundReferences(String code) {
        Matcher matcher = REFERENCE.matcher(code);
        StringBuilder result = new StringBuilder(code.length() + 4);
        int pos = 0;
        while (matcher.find()) {
            if (LatexLines.isEscaped(code, matcher.start())) {
                continue;
            }
            result.append(code, pos, matcher.start());
            if (matcher.start() > 0 && _isAsciiLetter(code.charAt(matcher.start() - 1))) {
                result.append(' ');
            }
            result.append(matcher.group());
            if (matcher.end() < code.length() && _isAsciiLetter(code.charAt(matcher.end()))) {
                result.append(' ');
            }
            pos = matcher.end();
        }
        result.append(code, pos, code.length());
        return result.toString();
    }

    private static boolean _isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static String _removeSpaceBeforeBrace(String code) {
        Matcher matcher = SPACE_BEFORE_BRACE.matcher(code);
        StringBuilder result = new StringBuilder(code.length());
        int pos = 0;
        while (matcher.find()) {
            if (LatexLines.isEscaped(code, matcher.start())) {
                continue;
            }
            result.append(code, pos, matcher.start());
            result.append('\\').append(matcher.group(1)).append('{');
            pos = matcher.end();
        }
        result.append(code, pos, code.length());
        return result.toString();
    }

    private interface ArgumentRewriter {
        String rewrite(Matcher matcher);
    }

    private static String _rewrite(String code, Pattern pattern, ArgumentRewriter rewriter) {
        Matcher matcher = pattern.matcher(code);
        StringBuilder result = new StringBuilder(code.length());
        int pos = 0;
        while (matcher.find()) {
            if (LatexLines.isEscaped(code, matcher.start())) {
                continue;
            }
            result.append(code, pos, matcher.start());
            result.append('\\').append(matcher.group(1)).append(matcher.group(2))
                    .append('{').append(rewriter.rewrite(matcher)).append('}');
            pos = matcher.end();
        }
        result.append(code, pos, code.length());
        return result.toString();
    }

    private static String _normalizeKeys(String keys) {
        List<String> parts = new ArrayList<>();
        for (String key : keys.split(",")) {
            String trimmed = key.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return String.join(", ", parts);
    }
}
