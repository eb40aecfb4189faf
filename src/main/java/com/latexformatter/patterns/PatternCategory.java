package com.latexformatter.patterns;

import java.util.List;
import java.util.Locale;

/**
 * Categories of protected content. Declaration order is the order in which the
 * protector claims spans: earlier categories win over later ones when matches overlap.
 */
public enum PatternCategory {
    INLINE_VERBATIM("inline_verbatim"),
    CHEMICAL_FORMULA("chemical_formulas", "chemical_formula"),
    COMPOUND_TERM("compound_terms", "compound_term"),
    REFERENCE_RANGE("reference_patterns", "reference_range", "reference_ranges"),
    NUMERICAL_RANGE("numerical_ranges", "numerical_range"),
    PACKAGE_OPTION("package_options", "package_option"),
    COMMENT_DASH("comment_patterns", "comment_dash"),
    GENERAL_SCIENTIFIC("general_patterns", "general_scientific");

    private final String configKey;
    private final List<String> aliases;

    PatternCategory(String configKey, String... aliases) {
        this.configKey = configKey;
        this.aliases = List.of(aliases);
    }

    /**
     * Key used when writing pattern files.
     */
    public String getConfigKey() {
        return configKey;
    }

    /**
     * Resolves a key from a pattern file, or returns null when the key is unknown.
     */
    public static PatternCategory fromConfigKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (PatternCategory category : values()) {
            if (category.configKey.equals(normalized) || category.aliases.contains(normalized)) {
                return category;
            }
        }
        return null;
    }
}
