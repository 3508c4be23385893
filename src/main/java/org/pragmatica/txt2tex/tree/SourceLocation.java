package org.pragmatica.txt2tex.tree;

/**
 * A position in source text. Line and column are 1-based, column counts code points.
 */
public record SourceLocation(int line, int column, int offset) {

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public boolean isBefore(SourceLocation other) {
        return offset < other.offset;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
