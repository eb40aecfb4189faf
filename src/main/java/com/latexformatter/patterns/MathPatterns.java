package com.latexformatter.patterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Operators and environments used by math spacing. Operators are either single
 * characters ({@code + - = < >}), short symbol runs ({@code <=}) or control words
 * ({@code \pm}).
 */
public final class MathPatterns {
    private final List<String> operators;
    private final Set<String> environments;
    private final List<String> functions;
    private final List<String> symbols;

    public MathPatterns(List<String> operators, Set<String> environments,
                        List<String> functions, List<String> symbols) {
        this.operators = List.copyOf(operators);
        this.environments = Collections.unmodifiableSet(new LinkedHashSet<>(environments));
        this.functions = List.copyOf(functions);
        this.symbols = List.copyOf(symbols);
    }

    public List<String> getOperators() { return operators; }
    public Set<String> getEnvironments() { return environments; }
    public List<String> getFunctions() { return functions; }
    public List<String> getSymbols() { return symbols; }

    /**
     * Operators written with symbol characters, longest first so that {@code <=} wins
     * over {@code <}.
     */
    public List<String> getSymbolOperators() {
        List<String> result = new ArrayList<>();
        for (String operator : operators) {
            if (!operator.startsWith("\\")) {
                result.add(operator);
            }
        }
        result.sort((a, b) -> Integer.compare(b.length(), a.length()));
        return result;
    }

    /**
     * Control-word operators without the leading backslash, e.g. {@code pm}, {@code times}.
     */
    public Set<String> getCommandOperators() {
        Set<String> result = new LinkedHashSet<>();
        for (String operator : operators) {
            if (operator.startsWith("\\") && operator.length() > 1) {
                result.add(operator.substring(1));
            }
        }
        return result;
    }
}
