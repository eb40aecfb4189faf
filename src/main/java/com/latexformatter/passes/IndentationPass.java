package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites leading indentation to {@code depth * indent_size} spaces.
 *
 * <p>A line is left at one extra level when it continues the previous line: the
 * previous line is plain text (not blank, not a comment, no environment boundary, no
 * {@code \\} at its end) and the current line has no environment boundary either.
 * Continuation lines produced by line wrapping have exactly this form.
 */
public class IndentationPass implements FormattingPass {

    @Override
    public PassId getId() {
        return PassId.INDENTATION;
    }

    @Override
    public String apply(String text, PassContext context) {
        List<String> lines = LatexLines.split(text);
        List<LineClassifier.LineInfo> infos = context.classify(lines);
        int indentSize = context.getConfig().getIndentSize();

        List<String> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            LineClassifier.LineInfo info = infos.get(i);

            if (info.getKind() == LineClassifier.LineKind.OPAQUE_BODY) {
                result.add(line);
                continue;
            }
            String content = line.substring(LatexLines.leadingWhitespace(line).length());
            if (content.isEmpty()) {
                result.add("");
                continue;
            }

            int depth = info.getDepth();
            String continuation = " ".repeat((depth + 1) * indentSize);
            if (i > 0 && LatexLines.leadingWhitespace(line).equals(continuation)
                    && _isContinuation(lines.get(i - 1), infos.get(i - 1), line)) {
                result.add(line);
                continue;
            }
            result.add(" ".repeat(depth * indentSize) + content);
        }
        return LatexLines.join(result, text.endsWith("\n"));
    }

    private static boolean _isContinuation(String previous, LineClassifier.LineInfo previousInfo, String line) {
        if (!previousInfo.isNormal() || previous.isBlank() || LatexLines.isCommentOnly(previous)) {
            return false;
        }
        String previousCode = LatexLines.codePart(previous);
        if (!LatexLines.environmentEvents(previousCode).isEmpty()
                || LatexLines.endsWithLineBreak(previousCode)) {
            return false;
        }
        return LatexLines.environmentEvents(LatexLines.codePart(line)).isEmpty();
    }
}
