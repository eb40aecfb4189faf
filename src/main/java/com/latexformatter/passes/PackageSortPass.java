package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sorts runs of consecutive <code>&#92;usepackage</code> lines in the preamble by package name.
 * Each run is sorted in place; blank lines and any other line end a run. The sort is
 * stable, so packages with the same name keep their relative order.
 */
public class PackageSortPass implements FormattingPass {

    @Override
    public PassId getId() {
        return PassId.PACKAGES;
    }

    @Override
    public String apply(String text, PassContext context) {
        List<String> lines = LatexLines.split(text);
        List<LineClassifier.LineInfo> infos = context.classify(lines);
        Pattern usepackage = Pattern.compile("^[ \\t]*\\\\usepackage[ \\t]*(?:\\[[^\\]\\n]*\\]|"
                + context.tokenRegex() + ")?[ \\t]*\\{([^{}]*)\\}[ \\t]*(?:%.*)?$");

        int preambleEnd = _preambleEnd(lines, context);
        List<String> result = new ArrayList<>(lines);

        int i = 0;
        while (i < preambleEnd) {
            if (!_isPackageLine(lines.get(i), infos.get(i), usepackage)) {
                i++;
                continue;
            }
            int start = i;
            while (i < preambleEnd && _isPackageLine(lines.get(i), infos.get(i), usepackage)) {
                i++;
            }
            _sortBlock(result, start, i, usepackage, context);
        }
        return LatexLines.join(result, text.endsWith("\n"));
    }

    private static boolean _isPackageLine(String line, LineClassifier.LineInfo info, Pattern usepackage) {
        return info.isNormal() && usepackage.matcher(line).matches();
    }

    private static void _sortBlock(List<String> lines, int start, int end, Pattern usepackage, PassContext context) {
        if (end - start < 2) {
            return;
        }
        List<String> block = new ArrayList<>(lines.subList(start, end));
        block.sort(Comparator.comparing(line -> _sortKey(line, usepackage, context)));
        for (int i = start; i < end; i++) {
            lines.set(i, block.get(i - start));
        }
    }

    private static String _sortKey(String line, Pattern usepackage, PassContext context) {
        Matcher matcher = usepackage.matcher(line);
        if (!matcher.matches()) {
            return "";
        }
        return context.reveal(matcher.group(1)).trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Index of the {@code \begin{document}} line, or the line count when there is none.
     */
    private static int _preambleEnd(List<String> lines, PassContext context) {
        for (int i = 0; i < lines.size(); i++) {
            for (LatexLines.EnvironmentEvent event : LatexLines.environmentEvents(LatexLines.codePart(lines.get(i)))) {
                if (event.isBegin() && context.reveal(event.getName()).equals("document")) {
                    return i;
                }
            }
        }
        return lines.size();
    }
}
