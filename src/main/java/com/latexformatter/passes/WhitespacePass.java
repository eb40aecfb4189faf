package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes line endings, strips trailing whitespace, limits runs of blank lines and
 * ends the document with exactly one newline. Lines inside opaque environments keep
 * their trailing whitespace and blank runs.
 */
public class WhitespacePass implements FormattingPass {

    @Override
    public PassId getId() {
        return PassId.WHITESPACE;
    }

    @Override
    public String apply(String text, PassContext context) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        if (normalized.isBlank()) {
            return "";
        }

        List<String> lines = LatexLines.split(normalized);
        List<LineClassifier.LineInfo> infos = context.classify(lines);
        int maxEmpty = context.getConfig().getMaxEmptyLines();

        List<String> result = new ArrayList<>(lines.size());
        int blankRun = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (infos.get(i).getKind() == LineClassifier.LineKind.OPAQUE_BODY) {
                result.add(line);
                blankRun = 0;
                continue;
            }

            String stripped = LatexLines.stripTrailing(line);
            if (stripped.isEmpty()) {
                blankRun++;
                if (blankRun > maxEmpty) {
                    continue;
                }
            } else {
                blankRun = 0;
            }
            result.add(stripped);
        }

        while (!result.isEmpty() && result.get(result.size() - 1).isBlank()) {
            result.remove(result.size() - 1);
        }
        return LatexLines.join(result, true);
    }
}
