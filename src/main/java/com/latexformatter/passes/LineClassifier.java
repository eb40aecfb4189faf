package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks a document line by line, tracking the environment stack and marking lines that
 * belong to opaque environments. Opaque environments are never pushed on the stack.
 */
public final class LineClassifier {

    public enum LineKind {
        /** Regular line, subject to every pass. */
        NORMAL,
        /** Line holding an opaque {@code \begin}; only text outside its opaque ranges is formatted. */
        OPAQUE_START,
        /** Line inside an opaque environment, including its {@code \end} line. */
        OPAQUE_BODY
    }

    private static final Pattern END = Pattern.compile("\\\\end\\s*\\{([^{}]*)\\}");

    private LineClassifier() {
    }

    /**
     * Classifies every line.
     *
     * @param nameResolver maps an environment name as written (possibly holding
     *                     placeholder tokens) to its real name
     */
    public static List<LineInfo> classify(List<String> lines, Set<String> opaqueEnvironments,
                                          Set<String> noIndentEnvironments,
                                          UnaryOperator<String> nameResolver) {
        List<LineInfo> result = new ArrayList<>(lines.size());
        EnvironmentStack stack = EnvironmentStack.empty();
        String openOpaque = null;
        int openOpaqueLine = -1;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            EnvironmentStack current = stack;
            int minDepth = current.depth(noIndentEnvironments);
            LineKind kind = LineKind.NORMAL;
            List<Integer> ranges = new ArrayList<>();
            int opaqueColumn = -1;
            String opaqueName = null;
            boolean closesOpaque = false;
            int unclosedBegin = -1;
            int opaqueStartLine = -1;
            int from = 0;

            if (openOpaque != null) {
                kind = LineKind.OPAQUE_BODY;
                opaqueName = openOpaque;
                opaqueStartLine = openOpaqueLine;
                int end = _endOf(line, 0, openOpaque, nameResolver);
                if (end < 0) {
                    ranges.add(0);
                    ranges.add(line.length());
                    result.add(new LineInfo(kind, stack, stack, minDepth, -1, opaqueName, false,
                            opaqueStartLine, -1, ranges));
                    continue;
                }
                ranges.add(0);
                ranges.add(end);
                closesOpaque = true;
                openOpaque = null;
                openOpaqueLine = -1;
                from = end;
            }

            boolean rescan = true;
            while (rescan) {
                rescan = false;
                String region = LatexLines.codePart(line.substring(from));
                for (LatexLines.EnvironmentEvent event : LatexLines.environmentEvents(region)) {
                    String name = nameResolver.apply(event.getName());
                    if (event.isBegin() && opaqueEnvironments.contains(name)) {
                        int start = from + event.getStart();
                        if (kind == LineKind.NORMAL) {
                            kind = LineKind.OPAQUE_START;
                            opaqueColumn = start;
                            opaqueStartLine = i;
                        }
                        opaqueName = name;
                        int end = _endOf(line, from + event.getEnd(), name, nameResolver);
                        ranges.add(start);
                        if (end < 0) {
                            ranges.add(line.length());
                            closesOpaque = closesOpaque && kind == LineKind.OPAQUE_BODY;
                            unclosedBegin = start;
                            openOpaque = name;
                            openOpaqueLine = i;
                        } else {
                            ranges.add(end);
                            closesOpaque = true;
                            from = end;
                            rescan = true;
                        }
                        break;
                    }
                    current = event.isBegin() ? current.push(name) : current.close(name);
                    minDepth = Math.min(minDepth, current.depth(noIndentEnvironments));
                }
            }

            result.add(new LineInfo(kind, stack, current, minDepth, opaqueColumn, opaqueName,
                    closesOpaque, opaqueStartLine, unclosedBegin, ranges));
            stack = current;
        }
        return result;
    }

    /**
     * Column just after the first {@code \end{name}} at or after {@code from}, or -1.
     */
    private static int _endOf(String line, int from, String name, UnaryOperator<String> nameResolver) {
        Matcher matcher = END.matcher(line);
        matcher.region(from, line.length());
        while (matcher.find()) {
            if (nameResolver.apply(matcher.group(1)).trim().equals(name)) {
                return matcher.end();
            }
        }
        return -1;
    }

    /**
     * Classification of one line.
     */
    public static final class LineInfo {
        private final LineKind kind;
        private final EnvironmentStack stackBefore;
        private final EnvironmentStack stackAfter;
        private final int depth;
        private final int opaqueColumn;
        private final String opaqueName;
        private final boolean closesOpaque;
        private final int opaqueStartLine;
        private final int unclosedBeginColumn;
        private final int[] opaqueRanges;

        LineInfo(LineKind kind, EnvironmentStack stackBefore, EnvironmentStack stackAfter, int depth,
                 int opaqueColumn, String opaqueName, boolean closesOpaque, int opaqueStartLine,
                 int unclosedBeginColumn, List<Integer> opaqueRanges) {
            this.kind = kind;
            this.stackBefore = stackBefore;
            this.stackAfter = stackAfter;
            this.depth = depth;
            this.opaqueColumn = opaqueColumn;
            this.opaqueName = opaqueName;
            this.closesOpaque = closesOpaque;
            this.opaqueStartLine = opaqueStartLine;
            this.unclosedBeginColumn = unclosedBeginColumn;
            this.opaqueRanges = opaqueRanges.stream().mapToInt(Integer::intValue).toArray();
        }

        public LineKind getKind() { return kind; }
        public EnvironmentStack getStackBefore() { return stackBefore; }
        public EnvironmentStack getStackAfter() { return stackAfter; }

        /**
         * Indentation depth of the line: the lowest depth reached while processing its
         * events, so {@code \end} lines sit at the outer level and {@code \begin} lines
         * before their body.
         */
        public int getDepth() { return depth; }

        /** Column of the opaque {@code \begin} on an {@link LineKind#OPAQUE_START} line, else -1. */
        public int getOpaqueColumn() { return opaqueColumn; }
        public String getOpaqueName() { return opaqueName; }

        /**
         * True on the line that ends an opaque environment. On a body line this is the
         * environment open at its start, even if another one opens after the {@code \end}.
         */
        public boolean closesOpaque() { return closesOpaque; }

        /** Index of the line that opened the enclosing opaque environment, or -1. */
        public int getOpaqueStartLine() { return opaqueStartLine; }

        /** Column of an opaque {@code \begin} whose environment stays open past this line, else -1. */
        public int getUnclosedBeginColumn() { return unclosedBeginColumn; }

        /**
         * True if {@code column} lies inside an opaque environment. Text after an opaque
         * {@code \end} on the same line is not opaque.
         */
        public boolean isOpaqueAt(int column) {
            return opaqueEndAt(column) >= 0;
        }

        /**
         * End column of the opaque range holding {@code column}, or -1 if it is not opaque.
         * A range that runs to the end of the line ends at the line length.
         */
        public int opaqueEndAt(int column) {
            for (int r = 0; r + 1 < opaqueRanges.length; r += 2) {
                if (column >= opaqueRanges[r] && column < opaqueRanges[r + 1]) {
                    return opaqueRanges[r + 1];
                }
            }
            return -1;
        }

        /**
         * End of the formattable code of {@code line}: the first unescaped {@code %}
         * outside opaque ranges, or the line length.
         */
        public int codeEnd(String line) {
            for (int j = 0; j < line.length(); j++) {
                if (line.charAt(j) == '%' && !isOpaqueAt(j) && !LatexLines.isEscaped(line, j)) {
                    return j;
                }
            }
            return line.length();
        }

        public boolean isNormal() { return kind == LineKind.NORMAL; }

        /**
         * The code of {@code line} up to its comment, with opaque text blanked out so
         * that columns stay in place.
         */
        public String maskedCode(String line) {
            StringBuilder masked = new StringBuilder(line.substring(0, codeEnd(line)));
            for (int j = 0; j < masked.length(); j++) {
                if (isOpaqueAt(j)) {
                    masked.setCharAt(j, ' ');
                }
            }
            return masked.toString();
        }

        /** True if the line is inside, or opens or closes, one of {@code environments}. */
        public boolean touches(Set<String> environments) {
            return stackBefore.anyOf(environments) || stackAfter.anyOf(environments);
        }
    }
}
