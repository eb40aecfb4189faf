package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level LaTeX helpers shared by the passes and the syntax checker.
 */
public final class LatexLines {
    private static final Pattern ENVIRONMENT_EVENT = Pattern.compile("\\\\(begin|end)\\s*\\{([^}]*)\\}");

    private LatexLines() {
    }

    /**
     * Splits text into lines without their terminators. A trailing newline does not
     * produce an extra empty line.
     */
    public static List<String> split(String text) {
        if (text.isEmpty()) {
            return new ArrayList<>();
        }
        String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return new ArrayList<>(Arrays.asList(body.split("\n", -1)));
    }

    /**
     * Joins lines with {@code \n}, adding a trailing newline when the source had one.
     */
    public static String join(List<String> lines, boolean trailingNewline) {
        if (lines.isEmpty()) {
            return "";
        }
        String joined = String.join("\n", lines);
        return trailingNewline ? joined + "\n" : joined;
    }

    /**
     * True if the character at {@code index} is preceded by an odd number of backslashes.
     */
    public static boolean isEscaped(CharSequence text, int index) {
        int count = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            count++;
        }
        return count % 2 == 1;
    }

    /**
     * Index of the first unescaped {@code %}, or -1.
     */
    public static int commentStart(String line) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '%' && !isEscaped(line, i)) {
                return i;
            }
        }
        return -1;
    }

    /** The line up to its comment, unchanged. */
    public static String codePart(String line) {
        int comment = commentStart(line);
        return comment < 0 ? line : line.substring(0, comment);
    }

    public static boolean isCommentOnly(String line) {
        return line.stripLeading().startsWith("%");
    }

    public static boolean isBlank(String line) {
        return line.isBlank();
    }

    public static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    public static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(0, end);
    }

    /**
     * {@code \begin} and {@code \end} events of a code fragment, in order of appearance.
     * Names are trimmed but otherwise returned as written.
     */
    public static List<EnvironmentEvent> environmentEvents(String code) {
        List<EnvironmentEvent> events = new ArrayList<>();
        Matcher matcher = ENVIRONMENT_EVENT.matcher(code);
        while (matcher.find()) {
            if (isEscaped(code, matcher.start())) {
                continue;
            }
            boolean begin = matcher.group(1).equals("begin");
            events.add(new EnvironmentEvent(begin, matcher.group(2).trim(), matcher.start(), matcher.end()));
        }
        return events;
    }

    /**
     * True if {@code code} ends with a {@code \\} row terminator, ignoring trailing whitespace.
     */
    public static boolean endsWithLineBreak(String code) {
        String trimmed = stripTrailing(code);
        if (!trimmed.endsWith("\\\\")) {
            return false;
        }
        return !isEscaped(trimmed, trimmed.length() - 2);
    }

    /**
     * Rendered width in terminal columns: combining and format characters take no
     * space, East Asian wide characters take two.
     */
    public static int displayWidth(String text) {
        int width = 0;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            int type = Character.getType(codePoint);
            if (type == Character.NON_SPACING_MARK || type == Character.ENCLOSING_MARK
                    || type == Character.FORMAT) {
                continue;
            }
            width += _isWide(codePoint) ? 2 : 1;
        }
        return width;
    }

    private static boolean _isWide(int codePoint) {
        return (codePoint >= 0x1100 && codePoint <= 0x115F)
                || (codePoint >= 0x2E80 && codePoint <= 0xA4CF)
                || (codePoint >= 0xAC00 && codePoint <= 0xD7A3)
                || (codePoint >= 0xF900 && codePoint <= 0xFAFF)
                || (codePoint >= 0xFE30 && codePoint <= 0xFE4F)
                || (codePoint >= 0xFF00 && codePoint <= 0xFF60)
                || (codePoint >= 0xFFE0 && codePoint <= 0xFFE6)
                || (codePoint >= 0x1F300 && codePoint <= 0x1F64F)
                || (codePoint >= 0x20000 && codePoint <= 0x3FFFD);
    }

    /**
     * A {@code \begin{name}} or {@code \end{name}} occurrence.
     */
    public static final class EnvironmentEvent {
        private final boolean begin;
        private final String name;
        private final int start;
        private final int end;

        public EnvironmentEvent(boolean begin, String name, int start, int end) {
            this.begin = begin;
            this.name = name;
            this.start = start;
            this.end = end;
        }

        public boolean isBegin() { return begin; }
        public String getName() { return name; }
        public int getStart() { return start; }
        public int getEnd() { return end; }
    }
}
