package org.pragmatica.latex.tree;

/**
 * A resolved position in source text: 1-based line and column plus the absolute offset.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Long form used in error messages.
     */
    public String describe() {
        return "line " + line + ", column " + column + " (offset " + offset + ")";
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
