package com.latexformatter.protect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text with protected spans replaced by placeholder tokens, plus the mapping needed
 * to restore them. Created per format operation and never shared between documents.
 */
public final class ProtectedText {
    private final String originalText;
    private final String text;
    private final char openMarker;
    private final char closeMarker;
    private final List<Placeholder> placeholders;
    private final List<Placeholder> byPosition;
    private final Pattern tokenPattern;

    ProtectedText(String originalText, String text, char openMarker, char closeMarker,
                  List<Placeholder> placeholders) {
        this.originalText = originalText;
        this.text = text;
        this.openMarker = openMarker;
        this.closeMarker = closeMarker;
        this.placeholders = Collections.unmodifiableList(new ArrayList<>(placeholders));
        List<Placeholder> sorted = new ArrayList<>(placeholders);
        sorted.sort(Comparator.comparingInt(Placeholder::getOriginalStart));
        this.byPosition = Collections.unmodifiableList(sorted);
        this.tokenPattern = Pattern.compile(Pattern.quote(String.valueOf(openMarker)) + "(\\d+)"
                + Pattern.quote(String.valueOf(closeMarker)));
    }

    public String getOriginalText() { return originalText; }

    /** The text with every protected span replaced by its token. */
    public String getText() { return text; }

    /** Placeholders in insertion order. */
    public List<Placeholder> getPlaceholders() { return placeholders; }

    public char getOpenMarker() { return openMarker; }
    public char getCloseMarker() { return closeMarker; }

    /**
     * Restores every token found in a fragment of (possibly rewritten) text. Unknown
     * tokens are left as they are; use {@link Protector#restore} for strict restoration.
     */
    public String reveal(String fragment) {
        if (placeholders.isEmpty() || fragment.indexOf(openMarker) < 0) {
            return fragment;
        }
        Matcher matcher = tokenPattern.matcher(fragment);
        StringBuilder result = new StringBuilder(fragment.length());
        while (matcher.find()) {
            int index = _parseIndex(matcher.group(1));
            String replacement = index >= 0 && index < placeholders.size()
                    ? placeholders.get(index).getOriginal()
                    : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Maps an offset in {@link #getText()} to the corresponding offset in the original
     * text. Offsets inside a token map to the start of the protected span.
     */
    public int originalOffset(int protectedOffset) {
        int delta = 0;
        int protectedPos = 0;
        int originalPos = 0;
        for (Placeholder placeholder : byPosition) {
            int tokenStart = placeholder.getOriginalStart() + delta;
            if (protectedOffset < tokenStart) {
                break;
            }
            int tokenEnd = tokenStart + placeholder.getToken().length();
            if (protectedOffset < tokenEnd) {
                return placeholder.getOriginalStart();
            }
            delta += placeholder.getToken().length() - placeholder.getOriginal().length();
            protectedPos = tokenEnd;
            originalPos = placeholder.getOriginalEnd();
        }
        return originalPos + (protectedOffset - protectedPos);
    }

    String tokenFor(int index) {
        return openMarker + Integer.toString(index) + closeMarker;
    }

    boolean containsMarker(String fragment) {
        return fragment.indexOf(openMarker) >= 0 || fragment.indexOf(closeMarker) >= 0;
    }

    private static int _parseIndex(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
