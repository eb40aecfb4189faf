package com.latexformatter.passes;

import com.latexformatter.patterns.MathPatterns;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Puts exactly one space on each side of binary operators inside math mode. Operators
 * in unary position (at the start of a span, after an opening delimiter, after a
 * script marker, after an alignment point or after another operator) stay attached to
 * their operand. Line breaks and indentation around operators are never changed, and
 * math on table rows is left alone so that column alignment stays stable.
 */
public class MathSpacingPass implements FormattingPass {
    private static final Set<String> UNARY_CAPABLE = Set.of("+", "-", "\\pm", "\\mp");
    private static final Set<String> VERBATIM_ARGUMENT_COMMANDS = Set.of(
            "label", "ref", "eqref", "pageref", "cref", "Cref", "cite", "mbox", "hbox",
            "operatorname", "mathrm", "begin", "end", "url", "href", "tag", "intertext");
    private static final String UNARY_CONTEXT = "([{^_&,;";

    @Override
    public PassId getId() {
        return PassId.MATH;
    }

    @Override
    public String apply(String text, PassContext context) {
        List<String> lines = LatexLines.split(text);
        List<LineClassifier.LineInfo> infos = context.classify(lines);
        MathPatterns mathPatterns = context.getMathPatterns();
        List<MathSpanScanner.Segment> segments = MathSpanScanner.scan(
                text, infos, mathPatterns.getEnvironments(), context::reveal);
        if (segments.isEmpty()) {
            return text;
        }

        int[] lineOf = _lineIndexByOffset(text);
        Set<String> tableEnvironments = context.getConfig().getTableEnvironments();
        List<String> symbolOperators = mathPatterns.getSymbolOperators();
        Set<String> commandOperators = mathPatterns.getCommandOperators();

        StringBuilder result = new StringBuilder(text);
        for (int s = segments.size() - 1; s >= 0; s--) {
            MathSpanScanner.Segment segment = segments.get(s);
            if (_touchesTable(segment, lineOf, infos, tableEnvironments)) {
                continue;
            }
            String content = text.substring(segment.getStart(), segment.getEnd());
            String spaced = space(content, symbolOperators, commandOperators);
            if (!spaced.equals(content)) {
                result.replace(segment.getStart(), segment.getEnd(), spaced);
            }
        }
        return result.toString();
    }

    /**
     * Respaces one math segment.
     */
    static String space(String content, List<String> symbolOperators, Set<String> commandOperators) {
        List<Token> tokens = _tokenize(content, symbolOperators, commandOperators);

        StringBuilder out = new StringBuilder(content.length() + 8);
        StringBuilder pendingSpace = new StringBuilder();
        Token previous = null;

        for (Token token : tokens) {
            if (token.type == TokenType.SPACE) {
                pendingSpace.append(token.text);
                continue;
            }

            boolean lineBreak = pendingSpace.indexOf("\n") >= 0;
            String before = pendingSpace.toString();

            if (previous != null && previous.type == TokenType.OPERATOR && !lineBreak) {
                before = previous.unary ? "" : " ";
            }
            if (token.type == TokenType.OPERATOR) {
                token.unary = UNARY_CAPABLE.contains(token.text)
                        && (previous == null || previous.type == TokenType.OPERATOR || _opensUnaryContext(previous));
                if (!token.unary && previous != null && !lineBreak && !previous.text.equals("&")) {
                    before = " ";
                }
            }
            if (before.isEmpty() && previous != null && previous.endsWithControlWord()
                    && Character.isLetter(token.text.charAt(0))) {
                before = " ";
            }

            out.append(before).append(token.text);
            pendingSpace.setLength(0);
            previous = token;
        }
        out.append(pendingSpace);
        return out.toString();
    }

    private static boolean _opensUnaryContext(Token token) {
        if (token.type != TokenType.ATOM) {
            return false;
        }
        if (token.text.equals("\\\\") || token.text.equals("\\{")) {
            return true;
        }
        return token.text.length() == 1 && UNARY_CONTEXT.indexOf(token.text.charAt(0)) >= 0;
    }

    private static List<Token> _tokenize(String content, List<String> symbolOperators, Set<String> commandOperators) {
        List<Token> tokens = new ArrayList<>();
        int n = content.length();
        int i = 0;
        while (i < n) {
            char c = content.charAt(i);
            if (c == ' ' || c == '\t' || c == '\n') {
                int j = i;
                while (j < n && (content.charAt(j) == ' ' || content.charAt(j) == '\t' || content.charAt(j) == '\n')) {
                    j++;
                }
                tokens.add(new Token(TokenType.SPACE, content.substring(i, j)));
                i = j;
            } else if (c == '\\') {
                if (i + 1 < n && Character.isLetter(content.charAt(i + 1))) {
                    int j = i + 1;
                    while (j < n && Character.isLetter(content.charAt(j))) {
                        j++;
                    }
                    String name = content.substring(i + 1, j);
                    if (commandOperators.contains(name)) {
                        tokens.add(new Token(TokenType.OPERATOR, content.substring(i, j)));
                    } else if (VERBATIM_ARGUMENT_COMMANDS.contains(name) || name.startsWith("text")) {
                        j = _skipArguments(content, j);
                        tokens.add(new Token(TokenType.ATOM, content.substring(i, j)));
                    } else {
                        tokens.add(new Token(TokenType.ATOM, content.substring(i, j)));
                    }
                    i = j;
                } else {
                    int j = Math.min(n, i + 2);
                    tokens.add(new Token(TokenType.ATOM, content.substring(i, j)));
                    i = j;
                }
            } else {
                String operator = _operatorAt(content, i, symbolOperators);
                if (operator != null) {
                    tokens.add(new Token(TokenType.OPERATOR, operator));
                    i += operator.length();
                } else {
                    tokens.add(new Token(TokenType.ATOM, String.valueOf(c)));
                    i++;
                }
            }
        }
        return tokens;
    }

    private static String _operatorAt(String content, int index, List<String> symbolOperators) {
        for (String operator : symbolOperators) {
            if (content.startsWith(operator, index)) {
                return operator;
            }
        }
        return null;
    }

    /**
     * Skips an optional star and the bracket and brace groups that directly follow a
     * command name.
     */
    private static int _skipArguments(String content, int index) {
        int i = index;
        if (i < content.length() && content.charAt(i) == '*') {
            i++;
        }
        while (true) {
            int k = i;
            while (k < content.length() && (content.charAt(k) == ' ' || content.charAt(k) == '\t')) {
                k++;
            }
            if (k >= content.length() || (content.charAt(k) != '{' && content.charAt(k) != '[')) {
                return i;
            }
            i = _groupEnd(content, k);
        }
    }

    private static int _groupEnd(String content, int start) {
        char open = content.charAt(start);
        char close = open == '{' ? '}' : ']';
        int depth = 0;
        for (int i = start; i < content.length(); i++) {
            char c = content.charAt(i);
            if (LatexLines.isEscaped(content, i)) {
                continue;
            }
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return content.length();
    }

    private static boolean _touchesTable(MathSpanScanner.Segment segment, int[] lineOf,
                                         List<LineClassifier.LineInfo> infos, Set<String> tableEnvironments) {
        int first = lineOf[segment.getStart()];
        int last = lineOf[Math.max(segment.getStart(), segment.getEnd() - 1)];
        for (int line = first; line <= last && line < infos.size(); line++) {
            if (infos.get(line).touches(tableEnvironments)) {
                return true;
            }
        }
        return false;
    }

    private static int[] _lineIndexByOffset(String text) {
        int[] lineOf = new int[text.length() + 1];
        int line = 0;
        for (int i = 0; i < text.length(); i++) {
            lineOf[i] = line;
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        lineOf[text.length()] = line;
        return lineOf;
    }

    private enum TokenType {
        SPACE, OPERATOR, ATOM
    }

    private static final class Token {
        private final TokenType type;
        private final String text;
        private boolean unary;

        Token(TokenType type, String text) {
            this.type = type;
            this.text = text;
        }

        boolean endsWithControlWord() {
            if (!text.startsWith("\\") || text.length() < 2) {
                return false;
            }
            for (int i = 1; i < text.length(); i++) {
                if (!Character.isLetter(text.charAt(i))) {
                    return false;
                }
            }
            return true;
        }
    }
}
