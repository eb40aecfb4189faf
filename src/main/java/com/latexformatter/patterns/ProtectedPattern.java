package com.latexformatter.patterns;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A compiled protection pattern. Higher priority patterns are applied first within
 * their category.
 */
public final class ProtectedPattern {
    private final PatternCategory category;
    private final Pattern regex;
    private final int priority;

    public ProtectedPattern(PatternCategory category, Pattern regex, int priority) {
        this.category = Objects.requireNonNull(category, "category");
        this.regex = Objects.requireNonNull(regex, "regex");
        this.priority = priority;
    }

    public PatternCategory getCategory() { return category; }
    public Pattern getRegex() { return regex; }
    public int getPriority() { return priority; }

    @Override
    public String toString() {
        return category.getConfigKey() + ":" + regex.pattern() + " (priority " + priority + ")";
    }
}
