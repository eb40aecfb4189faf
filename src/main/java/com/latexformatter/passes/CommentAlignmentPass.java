package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.List;

/**
 * Aligns trailing comments of consecutive lines to one column: one space past the
 * widest code part of the run. Only comments already separated from their code by
 * whitespace take part; a {@code %} glued to the code is left glued.
 */
public class CommentAlignmentPass implements FormattingPass {

    @Override
    public PassId getId() {
        return PassId.COMMENTS;
    }

    @Override
    public String apply(String text, PassContext context) {
        List<String> lines = LatexLines.split(text);
        List<LineClassifier.LineInfo> infos = context.classify(lines);

        List<String> result = new ArrayList<>(lines);
        int i = 0;
        while (i < lines.size()) {
            if (!_hasTrailingComment(lines.get(i), infos.get(i))) {
                i++;
                continue;
            }
            int start = i;
            while (i < lines.size() && _hasTrailingComment(lines.get(i), infos.get(i))) {
                i++;
            }
            _alignRun(result, start, i, context);
        }
        return LatexLines.join(result, text.endsWith("\n"));
    }

    private static boolean _hasTrailingComment(String line, LineClassifier.LineInfo info) {
        if (!info.isNormal()) {
            return false;
        }
        int comment = LatexLines.commentStart(line);
        if (comment <= 0) {
            return false;
        }
        char before = line.charAt(comment - 1);
        String code = LatexLines.stripTrailing(line.substring(0, comment));
        // A control space before the comment must stay where it is
        return (before == ' ' || before == '\t') && !code.isEmpty()
                && !LatexLines.isEscaped(line, code.length());
    }

    private static void _alignRun(List<String> lines, int start, int end, PassContext context) {
        int column = 0;
        for (int i = start; i < end; i++) {
            String line = lines.get(i);
            String code = LatexLines.stripTrailing(line.substring(0, LatexLines.commentStart(line)));
            column = Math.max(column, context.displayWidth(code) + 1);
        }
        for (int i = start; i < end; i++) {
            String line = lines.get(i);
            int comment = LatexLines.commentStart(line);
            String code = LatexLines.stripTrailing(line.substring(0, comment));
            int padding = column - context.displayWidth(code);
            lines.set(i, code + " ".repeat(padding) + line.substring(comment));
        }
    }
}
