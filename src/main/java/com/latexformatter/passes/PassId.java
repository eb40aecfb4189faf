package com.latexformatter.passes;

import java.util.Locale;

/**
 * Identifies each rewrite pass. Declaration order is the fixed execution order.
 */
public enum PassId {
    WHITESPACE("whitespace"),
    COMMANDS("commands"),
    PACKAGES("packages"),
    INDENTATION("indentation"),
    TABLES("tables"),
    MATH("math"),
    QUOTES("quotes"),
    WRAP("wrap"),
    COMMENTS("comments");

    private final String configName;

    PassId(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static PassId fromConfigName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (PassId id : values()) {
            if (id.configName.equals(normalized)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown pass: " + name);
    }
}
