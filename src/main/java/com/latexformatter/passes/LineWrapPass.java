package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Breaks lines whose code part is wider than {@code line_length} at the last suitable
 * whitespace before the limit. A break never falls inside braces, brackets or inline
 * math, never directly after a {@code \\} and never inside the indentation. Continuation
 * lines are indented one level deeper than the line they came from. A line without a
 * suitable break point is left as it is.
 *
 * <p>Lines with environment boundaries, comment-only lines and lines inside math,
 * table or opaque environments are not wrapped.
 */
public class LineWrapPass implements FormattingPass {

    @Override
    public PassId getId() {
        return PassId.WRAP;
    }

    @Override
    public String apply(String text, PassContext context) {
        List<String> lines = LatexLines.split(text);
        List<LineClassifier.LineInfo> infos = context.classify(lines);
        boolean[] math = MathSpanScanner.mask(text, MathSpanScanner.scan(
                text, infos, context.getMathPatterns().getEnvironments(), context::reveal));

        Set<String> excluded = new HashSet<>(context.getMathPatterns().getEnvironments());
        excluded.addAll(context.getConfig().getTableEnvironments());
        int limit = context.getConfig().getLineLength();
        int indentSize = context.getConfig().getIndentSize();

        List<String> result = new ArrayList<>(lines.size());
        int lineStart = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            LineClassifier.LineInfo info = infos.get(i);
            int offset = lineStart;
            lineStart += line.length() + 1;

            if (!_isWrappable(line, info, excluded)) {
                result.add(line);
                continue;
            }
            String continuation = " ".repeat((info.getDepth() + 1) * indentSize);
            result.addAll(_wrap(line, offset, math, continuation, limit, context));
        }
        return LatexLines.join(result, text.endsWith("\n"));
    }

    private static boolean _isWrappable(String line, LineClassifier.LineInfo info, Set<String> excluded) {
        if (!info.isNormal() || line.isBlank() || LatexLines.isCommentOnly(line)) {
            return false;
        }
        if (!LatexLines.environmentEvents(LatexLines.codePart(line)).isEmpty()) {
            return false;
        }
        return !info.getStackBefore().anyOf(excluded);
    }

    private static List<String> _wrap(String line, int offset, boolean[] math, String continuation,
                                      int limit, PassContext context) {
        String code = LatexLines.stripTrailing(LatexLines.codePart(line));
        int codeEnd = code.length();
        int[] depth = _groupDepth(code);

        List<String> pieces = new ArrayList<>();
        String prefix = LatexLines.leadingWhitespace(line);
        int segmentStart = prefix.length();

        while (true) {
            int prefixWidth = LatexLines.displayWidth(prefix);
            if (prefixWidth + context.displayWidth(code.substring(segmentStart, codeEnd)) <= limit) {
                break;
            }
            int breakAt = _findBreak(code, segmentStart, codeEnd, depth, math, offset, prefixWidth, limit, context);
            if (breakAt < 0) {
                break;
            }
            pieces.add(prefix + LatexLines.stripTrailing(code.substring(segmentStart, breakAt)));
            segmentStart = breakAt;
            while (segmentStart < codeEnd && (code.charAt(segmentStart) == ' ' || code.charAt(segmentStart) == '\t')) {
                segmentStart++;
            }
            prefix = continuation;
        }
        pieces.add(prefix + line.substring(segmentStart));
        return pieces;
    }

    private static int _findBreak(String code, int segmentStart, int codeEnd, int[] depth, boolean[] math,
                                  int offset, int prefixWidth, int limit, PassContext context) {
        int best = -1;
        for (int p = segmentStart + 1; p < codeEnd; p++) {
            char c = code.charAt(p);
            if ((c != ' ' && c != '\t') || depth[p] != 0 || math[offset + p] || LatexLines.isEscaped(code, p)) {
                continue;
            }
            String head = LatexLines.stripTrailing(code.substring(segmentStart, p));
            if (head.isEmpty() || LatexLines.endsWithLineBreak(head)) {
                continue;
            }
            if (prefixWidth + context.displayWidth(head) > limit) {
                break;
            }
            best = p;
        }
        return best;
    }

    /**
     * Brace and bracket nesting depth before each character.
     */
    private static int[] _groupDepth(String code) {
        int[] depth = new int[code.length()];
        int level = 0;
        for (int i = 0; i < code.length(); i++) {
            depth[i] = level;
            char c = code.charAt(i);
            if (LatexLines.isEscaped(code, i)) {
                continue;
            }
            if (c == '{' || c == '[') {
                level++;
            } else if ((c == '}' || c == ']') && level > 0) {
                level--;
            }
        }
        return depth;
    }
}
