package com.latexformatter.patterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, validated set of protection patterns plus math operator definitions.
 * Safe to share between concurrently formatted documents.
 */
public final class PatternSet {
    private final Map<PatternCategory, List<ProtectedPattern>> byCategory;
    private final MathPatterns mathPatterns;

    public PatternSet(Map<PatternCategory, List<ProtectedPattern>> patterns, MathPatterns mathPatterns) {
        EnumMap<PatternCategory, List<ProtectedPattern>> copy = new EnumMap<>(PatternCategory.class);
        for (PatternCategory category : PatternCategory.values()) {
            List<ProtectedPattern> list = new ArrayList<>(patterns.getOrDefault(category, List.of()));
            // Stable: equal priorities keep file order
            list.sort((a, b) -> Integer.compare(b.getPriority(), a.getPriority()));
            copy.put(category, Collections.unmodifiableList(list));
        }
        this.byCategory = Collections.unmodifiableMap(copy);
        this.mathPatterns = mathPatterns;
    }

    /**
     * Patterns of one category in descending priority.
     */
    public List<ProtectedPattern> patternsFor(PatternCategory category) {
        return byCategory.get(category);
    }

    /**
     * All patterns in protection order: category order first, then priority.
     */
    public List<ProtectedPattern> inProtectionOrder() {
        List<ProtectedPattern> result = new ArrayList<>();
        for (PatternCategory category : PatternCategory.values()) {
            result.addAll(byCategory.get(category));
        }
        return result;
    }

    public MathPatterns getMathPatterns() {
        return mathPatterns;
    }

    public int size() {
        return byCategory.values().stream().mapToInt(List::size).sum();
    }
}
