package com.latexformatter.protect;

import com.latexformatter.api.error.InternalConsistencyException;
import com.latexformatter.patterns.PatternSet;
import com.latexformatter.patterns.ProtectedPattern;
import com.latexformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.regex.Matcher;

/**
 * Replaces protected spans with placeholder tokens and restores them afterwards.
 *
 * <p>A token is an open marker, the decimal placeholder index and a close marker. The
 * markers are a pair of private-use characters that do not occur anywhere in the input,
 * so a token can never be confused with document content.
 */
public class Protector {
    private static final Logger logger = LoggerUtil.getLogger(Protector.class);

    private static final char PRIVATE_USE_START = '\uE000';
    private static final char PRIVATE_USE_END = '\uF8FF';

    private final PatternSet patternSet;

    public Protector(PatternSet patternSet) {
        this.patternSet = patternSet;
    }

    /**
     * Protects every pattern match of the pattern set. Categories are applied in
     * declaration order, patterns by descending priority; a match overlapping a span
     * that is already claimed is skipped.
     */
    public ProtectedText protect(String text) {
        char[] markers = _chooseMarkers(text);

        // start -> end of claimed spans, and claim order
        TreeMap<Integer, Integer> claimed = new TreeMap<>();
        List<int[]> claims = new ArrayList<>();

        for (ProtectedPattern pattern : patternSet.inProtectionOrder()) {
            Matcher matcher = pattern.getRegex().matcher(text);
            while (matcher.find()) {
                int start = matcher.start();
                int end = matcher.end();
                if (start == end || _overlaps(claimed, start, end)) {
                    continue;
                }
                claimed.put(start, end);
                claims.add(new int[]{start, end});
            }
        }

        List<Placeholder> placeholders = new ArrayList<>(claims.size());
        TreeMap<Integer, Placeholder> byStart = new TreeMap<>();
        for (int i = 0; i < claims.size(); i++) {
            int[] span = claims.get(i);
            String token = markers[0] + Integer.toString(i) + markers[1];
            Placeholder placeholder = new Placeholder(i, token, text.substring(span[0], span[1]), span[0]);
            placeholders.add(placeholder);
            byStart.put(span[0], placeholder);
        }

        StringBuilder result = new StringBuilder(text.length());
        int pos = 0;
        for (Placeholder placeholder : byStart.values()) {
            result.append(text, pos, placeholder.getOriginalStart());
            result.append(placeholder.getToken());
            pos = placeholder.getOriginalEnd();
        }
        result.append(text, pos, text.length());

        if (!placeholders.isEmpty()) {
            logger.fine("Protected " + placeholders.size() + " spans");
        }
        return new ProtectedText(text, result.toString(), markers[0], markers[1], placeholders);
    }

    /**
     * Restores all tokens of {@code protectedText} in {@code text}, in reverse insertion order.
     *
     * @throws InternalConsistencyException if a token is missing, duplicated or unknown
     */
    public static String restore(String text, ProtectedText protectedText) {
        List<Placeholder> placeholders = protectedText.getPlaceholders();
        String result = text;
        for (int i = placeholders.size() - 1; i >= 0; i--) {
            Placeholder placeholder = placeholders.get(i);
            String token = placeholder.getToken();
            int index = result.indexOf(token);
            if (index < 0) {
                throw new InternalConsistencyException(
                        "Placeholder " + placeholder.getIndex() + " was lost during formatting", token);
            }
            if (result.indexOf(token, index + token.length()) >= 0) {
                throw new InternalConsistencyException(
                        "Placeholder " + placeholder.getIndex() + " was duplicated during formatting", token);
            }
            result = result.substring(0, index) + placeholder.getOriginal()
                    + result.substring(index + token.length());
        }

        // Originals never contain markers, so any marker left over is a corrupted token.
        if (protectedText.containsMarker(result)) {
            throw new InternalConsistencyException("Corrupted placeholder token left in output", null);
        }
        return result;
    }

    private static boolean _overlaps(TreeMap<Integer, Integer> claimed, int start, int end) {
        Map.Entry<Integer, Integer> before = claimed.floorEntry(start);
        if (before != null && before.getValue() > start) {
            return true;
        }
        Map.Entry<Integer, Integer> after = claimed.ceilingEntry(start);
        return after != null && after.getKey() < end;
    }

    private static char[] _chooseMarkers(String text) {
        for (char open = PRIVATE_USE_START; open < PRIVATE_USE_END; open += 2) {
            char close = (char) (open + 1);
            if (text.indexOf(open) < 0 && text.indexOf(close) < 0) {
                return new char[]{open, close};
            }
        }
        throw new IllegalArgumentException("Document uses every private-use marker pair");
    }
}
