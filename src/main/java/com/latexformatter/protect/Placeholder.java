package com.latexformatter.protect;

/**
 * One protected span: the token standing in for it and the text it replaced.
 */
public final class Placeholder {
    private final int index;
    private final String token;
    private final String original;
    private final int originalStart;

    Placeholder(int index, String token, String original, int originalStart) {
        this.index = index;
        this.token = token;
        this.original = original;
        this.originalStart = originalStart;
    }

    /** Insertion order, which is also the number embedded in the token. */
    public int getIndex() { return index; }
    public String getToken() { return token; }
    public String getOriginal() { return original; }
    public int getOriginalStart() { return originalStart; }
    public int getOriginalEnd() { return originalStart + original.length(); }

    @Override
    public String toString() {
        return "Placeholder{" + index + " -> '" + original + "'}";
    }
}
