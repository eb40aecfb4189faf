package com.latexformatter.api;

/**
 * Records that a pass rewrote part of a document.
 */
public class FormattingChange {
    private final String passName;
    private final int startLine;
    private final int endLine;
    private final String description;

    public FormattingChange(String passName, int startLine, int endLine, String description) {
        this.passName = passName;
        this.startLine = startLine;
        this.endLine = endLine;
        this.description = description;
    }

    // Getters
    public String getPassName() { return passName; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        return passName + " [" + startLine + "-" + endLine + "]: " + description;
    }
}
