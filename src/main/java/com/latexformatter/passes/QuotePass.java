package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Replaces straight double quotes with {@code ``} and {@code ''}, alternating. The
 * open/closed state carries across lines and resets at every blank line. Accents
 * ({@code \"o}), math, comments, opaque lines and table rows are skipped.
 */
public class QuotePass implements FormattingPass {
    private static final String OPEN_QUOTE = "``";
    private static final String CLOSE_QUOTE = "''";

    @Override
    public PassId getId() {
        return PassId.QUOTES;
    }

    @Override
    public String apply(String text, PassContext context) {
        if (text.indexOf('"') < 0) {
            return text;
        }
        List<String> lines = LatexLines.split(text);
        List<LineClassifier.LineInfo> infos = context.classify(lines);
        boolean[] math = MathSpanScanner.mask(text, MathSpanScanner.scan(
                text, infos, context.getMathPatterns().getEnvironments(), context::reveal));
        Set<String> tableEnvironments = context.getConfig().getTableEnvironments();

        List<String> result = new ArrayList<>(lines.size());
        boolean open = false;
        int lineStart = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            LineClassifier.LineInfo info = infos.get(i);
            int offset = lineStart;
            lineStart += line.length() + 1;

            if (info.getKind() == LineClassifier.LineKind.OPAQUE_BODY && !info.closesOpaque()) {
                result.add(line);
                continue;
            }
            if (line.isBlank()) {
                open = false;
                result.add(line);
                continue;
            }
            if (info.touches(tableEnvironments)) {
                result.add(line);
                continue;
            }

            int limit = info.codeEnd(line);
            StringBuilder rewritten = new StringBuilder(line.length() + 4);
            for (int j = 0; j < line.length(); j++) {
                char c = line.charAt(j);
                if (j < limit && c == '"' && !info.isOpaqueAt(j)
                        && !LatexLines.isEscaped(line, j) && !math[offset + j]) {
                    rewritten.append(open ? CLOSE_QUOTE : OPEN_QUOTE);
                    open = !open;
                } else {
                    rewritten.append(c);
                }
            }
            result.add(rewritten.toString());
        }
        return LatexLines.join(result, text.endsWith("\n"));
    }
}
