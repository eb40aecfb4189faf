package com.latexformatter.passes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Immutable stack of open environment names, bottom first. Every operation returns a
 * new stack, so a line-processing step can hand its result to the next one without
 * any shared state.
 */
public final class EnvironmentStack {
    private static final EnvironmentStack EMPTY = new EnvironmentStack(List.of());

    private final List<String> names;

    private EnvironmentStack(List<String> names) {
        this.names = names;
    }

    public static EnvironmentStack empty() {
        return EMPTY;
    }

    public EnvironmentStack push(String name) {
        List<String> copy = new ArrayList<>(names);
        copy.add(name);
        return new EnvironmentStack(Collections.unmodifiableList(copy));
    }

    /**
     * Closes {@code name}: pops it if it is on top, unwinds to its innermost occurrence
     * if it is further down, and ignores it if it is not open at all.
     */
    public EnvironmentStack close(String name) {
        int index = names.lastIndexOf(name);
        if (index < 0) {
            return this;
        }
        return new EnvironmentStack(Collections.unmodifiableList(new ArrayList<>(names.subList(0, index))));
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    /** Top name, or null when empty. */
    public String top() {
        return names.isEmpty() ? null : names.get(names.size() - 1);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public int size() {
        return names.size();
    }

    public List<String> names() {
        return names;
    }

    /**
     * Indentation depth: the number of open environments that add a level.
     */
    public int depth(Set<String> noIndentEnvironments) {
        int depth = 0;
        for (String name : names) {
            if (!noIndentEnvironments.contains(name)) {
                depth++;
            }
        }
        return depth;
    }

    /**
     * True if any open environment belongs to {@code environments}.
     */
    public boolean anyOf(Set<String> environments) {
        for (String name : names) {
            if (environments.contains(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
