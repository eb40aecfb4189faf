package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds math-mode content: {@code $...$}, {@code $$...$$}, {@code \[...\]},
 * {@code \(...\)} and math environments. Comments and opaque text are skipped, and a
 * span is split around any comment it contains, so the returned segments never hold
 * comment text. Segments exclude the delimiters.
 */
public final class MathSpanScanner {
    private static final Pattern BEGIN = Pattern.compile("\\\\begin\\s*\\{([^}]*)\\}");
    private static final Pattern END = Pattern.compile("\\\\end\\s*\\{([^}]*)\\}");

    private MathSpanScanner() {
    }

    /**
     * Content range {@code [start, end)} in the scanned text.
     */
    public static final class Segment {
        private final int start;
        private final int end;

        public Segment(int start, int end) {
            this.start = start;
            this.end = end;
        }

        public int getStart() { return start; }
        public int getEnd() { return end; }

        public boolean contains(int offset) {
            return offset >= start && offset < end;
        }
    }

    public static List<Segment> scan(String text, List<LineClassifier.LineInfo> lines,
                                     Set<String> mathEnvironments, UnaryOperator<String> nameResolver) {
        List<Segment> segments = new ArrayList<>();
        int[] lineStarts = _lineStarts(text, lines.size());

        String closer = null;
        boolean inline = false;
        int segmentStart = -1;
        Matcher begin = BEGIN.matcher(text);

        int lineIndex = 0;
        int i = 0;
        int n = text.length();
        while (i < n) {
            while (lineIndex + 1 < lineStarts.length && lineStarts[lineIndex + 1] <= i) {
                lineIndex++;
            }
            if (lineIndex < lines.size()) {
                LineClassifier.LineInfo info = lines.get(lineIndex);
                int opaqueEnd = info.opaqueEndAt(i - lineStarts[lineIndex]);
                if (opaqueEnd >= 0) {
                    if (closer != null) {
                        _emit(segments, segmentStart, i);
                        closer = null;
                    }
                    i = Math.min(lineStarts[lineIndex] + opaqueEnd, _nextLineStart(lineStarts, lineIndex, n));
                    continue;
                }
            }

            char c = text.charAt(i);
            if (c == '%') {
                if (closer != null) {
                    _emit(segments, segmentStart, i);
                }
                int eol = text.indexOf('\n', i);
                i = eol < 0 ? n : eol;
                segmentStart = i;
                continue;
            }

            if (c == '\n' && inline && closer != null && i + 1 < n && _restOfLineBlank(text, i + 1)) {
                // An inline span never crosses a paragraph break
                _emit(segments, segmentStart, i);
                closer = null;
                inline = false;
                i++;
                continue;
            }

            if (closer == null) {
                if (c == '\\' && i + 1 < n) {
                    char next = text.charAt(i + 1);
                    if (next == '[' || next == '(') {
                        closer = next == '[' ? "\\]" : "\\)";
                        inline = next == '(';
                        segmentStart = i + 2;
                        i += 2;
                        continue;
                    }
                    begin.region(i, n);
                    if (begin.lookingAt()) {
                        String name = nameResolver.apply(begin.group(1).trim());
                        if (mathEnvironments.contains(name)) {
                            closer = name;
                            inline = false;
                            segmentStart = begin.end();
                            i = begin.end();
                            continue;
                        }
                    }
                    i += 2;
                    continue;
                }
                if (c == '$') {
                    boolean display = i + 1 < n && text.charAt(i + 1) == '$';
                    closer = display ? "$$" : "$";
                    inline = !display;
                    segmentStart = i + closer.length();
                    i += closer.length();
                    continue;
                }
                i++;
                continue;
            }

            // Inside math
            if (c == '\\' && i + 1 < n) {
                if (text.startsWith(closer, i) && closer.startsWith("\\")) {
                    _emit(segments, segmentStart, i);
                    i += closer.length();
                    closer = null;
                    continue;
                }
                int endLength = _environmentEndLength(text, i, closer, nameResolver);
                if (endLength > 0) {
                    _emit(segments, segmentStart, i);
                    i += endLength;
                    closer = null;
                    continue;
                }
                i += 2;
                continue;
            }
            if (c == '$' && closer.startsWith("$") && text.startsWith(closer, i)) {
                _emit(segments, segmentStart, i);
                i += closer.length();
                closer = null;
                continue;
            }
            i++;
        }

        if (closer != null) {
            _emit(segments, segmentStart, n);
        }
        return segments;
    }

    /**
     * Marks every text offset that lies inside a math segment.
     */
    public static boolean[] mask(String text, List<Segment> segments) {
        boolean[] mask = new boolean[text.length()];
        for (Segment segment : segments) {
            for (int i = segment.getStart(); i < segment.getEnd(); i++) {
                mask[i] = true;
            }
        }
        return mask;
    }

    private static int _environmentEndLength(String text, int i, String environment,
                                             UnaryOperator<String> nameResolver) {
        if (!text.startsWith("\\end", i)) {
            return 0;
        }
        Matcher end = END.matcher(text);
        end.region(i, text.length());
        if (end.lookingAt() && nameResolver.apply(end.group(1).trim()).equals(environment)) {
            return end.end() - i;
        }
        return 0;
    }

    private static boolean _restOfLineBlank(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    private static void _emit(List<Segment> segments, int start, int end) {
        if (start >= 0 && end > start) {
            segments.add(new Segment(start, end));
        }
    }

    private static int[] _lineStarts(String text, int lineCount) {
        int[] starts = new int[Math.max(lineCount, 1)];
        int line = 0;
        for (int i = 0; i < text.length() && line + 1 < starts.length; i++) {
            if (text.charAt(i) == '\n') {
                starts[++line] = i + 1;
            }
        }
        return starts;
    }

    private static int _nextLineStart(int[] lineStarts, int lineIndex, int n) {
        return lineIndex + 1 < lineStarts.length ? lineStarts[lineIndex + 1] : n;
    }
}
