package com.latexformatter.core;

import java.util.Objects;

/**
 * A document handed to the batch runner: an identifier (usually a path) and its text.
 */
public final class LatexDocument {
    private final String id;
    private final String text;

    public LatexDocument(String id, String text) {
        this.id = Objects.requireNonNull(id, "id");
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getId() { return id; }
    public String getText() { return text; }

    @Override
    public String toString() {
        return "LatexDocument{" + id + "}";
    }
}
