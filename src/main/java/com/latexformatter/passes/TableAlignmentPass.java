package com.latexformatter.passes;

import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.Severity;
import com.latexformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Aligns the columns of table environments. A block is a run of consecutive row lines
 * (lines with a top-level {@code &}) directly inside a table environment. Rows whose
 * cell count differs from the block's most common count are left untouched and
 * reported as informational notes.
 */
public class TableAlignmentPass implements FormattingPass {
    private static final Logger logger = LoggerUtil.getLogger(TableAlignmentPass.class);

    @Override
    public PassId getId() {
        return PassId.TABLES;
    }

    @Override
    public String apply(String text, PassContext context) {
        List<String> lines = LatexLines.split(text);
        List<LineClassifier.LineInfo> infos = context.classify(lines);
        Set<String> tableEnvironments = context.getConfig().getTableEnvironments();

        List<String> result = new ArrayList<>(lines);
        int i = 0;
        while (i < lines.size()) {
            Row row = _rowAt(lines, infos, i, tableEnvironments);
            if (row == null) {
                i++;
                continue;
            }
            List<Integer> indices = new ArrayList<>();
            List<Row> rows = new ArrayList<>();
            while (row != null) {
                indices.add(i);
                rows.add(row);
                i++;
                row = i < lines.size() ? _rowAt(lines, infos, i, tableEnvironments) : null;
            }
            _alignBlock(result, indices, rows, context);
        }
        return LatexLines.join(result, text.endsWith("\n"));
    }

    private static Row _rowAt(List<String> lines, List<LineClassifier.LineInfo> infos, int index,
                              Set<String> tableEnvironments) {
        LineClassifier.LineInfo info = infos.get(index);
        String line = lines.get(index);
        if (!info.isNormal() || LatexLines.isCommentOnly(line)) {
            return null;
        }
        String top = info.getStackBefore().top();
        if (top == null || !tableEnvironments.contains(top)) {
            return null;
        }
        if (!LatexLines.environmentEvents(LatexLines.codePart(line)).isEmpty()) {
            return null;
        }
        Row row = Row.parse(line);
        return row.cells.size() > 1 ? row : null;
    }

    private void _alignBlock(List<String> lines, List<Integer> indices, List<Row> rows, PassContext context) {
        int cellCount = _mostCommonCellCount(rows);

        int[] widths = new int[cellCount];
        for (Row row : rows) {
            if (row.cells.size() != cellCount) {
                continue;
            }
            for (int c = 0; c < cellCount; c++) {
                widths[c] = Math.max(widths[c], context.displayWidth(row.cells.get(c)));
            }
        }

        for (int r = 0; r < rows.size(); r++) {
            Row row = rows.get(r);
            int lineIndex = indices.get(r);
            if (row.cells.size() != cellCount) {
                logger.fine("Ragged table row at line " + (lineIndex + 1) + ": "
                        + row.cells.size() + " cells, expected " + cellCount);
                context.note(new Diagnostic(Severity.INFO, DiagnosticKind.RAGGED_TABLE_ROW,
                        "Table row has " + row.cells.size() + " cells, expected " + cellCount
                                + "; row left unaligned",
                        lineIndex + 1, 1));
                continue;
            }
            lines.set(lineIndex, row.render(widths, context));
        }
    }

    private static int _mostCommonCellCount(List<Row> rows) {
        Map<Integer, Integer> frequencies = new LinkedHashMap<>();
        for (Row row : rows) {
            frequencies.merge(row.cells.size(), 1, Integer::sum);
        }
        int best = -1;
        int bestFrequency = 0;
        for (Map.Entry<Integer, Integer> entry : frequencies.entrySet()) {
            if (entry.getValue() > bestFrequency) {
                best = entry.getKey();
                bestFrequency = entry.getValue();
            }
        }
        return best;
    }

    /**
     * A table row split into trimmed cells, with its row terminator and trailing comment.
     */
    static final class Row {
        private final String indent;
        private final List<String> cells;
        private final String terminator;
        private final String commentGap;
        private final String comment;

        private Row(String indent, List<String> cells, String terminator, String commentGap, String comment) {
            this.indent = indent;
            this.cells = cells;
            this.terminator = terminator;
            this.commentGap = commentGap;
            this.comment = comment;
        }

        static Row parse(String line) {
            String indent = LatexLines.leadingWhitespace(line);
            int commentIndex = LatexLines.commentStart(line);
            String rawCode = commentIndex < 0
                    ? line.substring(indent.length())
                    : line.substring(indent.length(), commentIndex);
            String code = LatexLines.stripTrailing(rawCode);
            String comment = commentIndex < 0 ? null : line.substring(commentIndex);
            String gap = rawCode.substring(code.length());

            List<String> parts = new ArrayList<>();
            int depth = 0;
            int start = 0;
            for (int i = 0; i < code.length(); i++) {
                char c = code.charAt(i);
                if (LatexLines.isEscaped(code, i)) {
                    continue;
                }
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth = Math.max(0, depth - 1);
                } else if (c == '&' && depth == 0) {
                    parts.add(code.substring(start, i));
                    start = i + 1;
                }
            }
            String last = code.substring(start);

            String terminator = null;
            int terminatorIndex = _terminatorIndex(last);
            if (terminatorIndex >= 0) {
                terminator = LatexLines.stripTrailing(last.substring(terminatorIndex));
                last = last.substring(0, terminatorIndex);
            }
            parts.add(last);

            List<String> cells = new ArrayList<>(parts.size());
            for (String part : parts) {
                cells.add(part.strip());
            }
            return new Row(indent, cells, terminator, gap, comment);
        }

        private static int _terminatorIndex(String cell) {
            int depth = 0;
            for (int i = 0; i + 1 < cell.length(); i++) {
                char c = cell.charAt(i);
                if (c == '\\' && LatexLines.isEscaped(cell, i)) {
                    continue;
                }
                if (c == '{' && !LatexLines.isEscaped(cell, i)) {
                    depth++;
                } else if (c == '}' && !LatexLines.isEscaped(cell, i)) {
                    depth = Math.max(0, depth - 1);
                } else if (c == '\\' && cell.charAt(i + 1) == '\\' && depth == 0) {
                    return i;
                }
            }
            return -1;
        }

        String render(int[] widths, PassContext context) {
            StringBuilder sb = new StringBuilder(indent);
            for (int c = 0; c < cells.size(); c++) {
                String cell = cells.get(c);
                if (c > 0) {
                    sb.append(" & ");
                }
                sb.append(cell);
                boolean lastWithoutTerminator = c == cells.size() - 1 && terminator == null;
                if (!lastWithoutTerminator) {
                    sb.append(" ".repeat(Math.max(0, widths[c] - context.displayWidth(cell))));
                }
            }
            if (terminator != null) {
                sb.append(' ').append(terminator);
            }
            String rendered = LatexLines.stripTrailing(sb.toString());
            if (comment != null) {
                rendered = rendered + commentGap + comment;
            }
            return rendered;
        }
    }
}
