package com.latexformatter.api;

import java.util.List;

/**
 * One line-level edit between an original and a formatted document. Line ranges are
 * 0-based and end-exclusive.
 */
public class LineEdit {
    public enum Type {
        INSERT, DELETE, REPLACE
    }

    private final Type type;
    private final int beginOriginal;
    private final int endOriginal;
    private final int beginFormatted;
    private final int endFormatted;
    private final List<String> originalLines;
    private final List<String> formattedLines;

    public LineEdit(Type type, int beginOriginal, int endOriginal, int beginFormatted, int endFormatted,
                    List<String> originalLines, List<String> formattedLines) {
        this.type = type;
        this.beginOriginal = beginOriginal;
        this.endOriginal = endOriginal;
        this.beginFormatted = beginFormatted;
        this.endFormatted = endFormatted;
        this.originalLines = List.copyOf(originalLines);
        this.formattedLines = List.copyOf(formattedLines);
    }

    // Getters
    public Type getType() { return type; }
    public int getBeginOriginal() { return beginOriginal; }
    public int getEndOriginal() { return endOriginal; }
    public int getBeginFormatted() { return beginFormatted; }
    public int getEndFormatted() { return endFormatted; }
    public List<String> getOriginalLines() { return originalLines; }
    public List<String> getFormattedLines() { return formattedLines; }

    @Override
    public String toString() {
        return type + " original[" + beginOriginal + "," + endOriginal + ") formatted["
                + beginFormatted + "," + endFormatted + ")";
    }
}
