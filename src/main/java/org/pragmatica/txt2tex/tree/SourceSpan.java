package org.pragmatica.txt2tex.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int line() {
        return start.line();
    }

    /**
     * Smallest span covering both this span and the other one.
     */
    public SourceSpan to(SourceSpan other) {
        var from = other.start.isBefore(start) ? other.start : start;
        var until = end.isBefore(other.end) ? other.end : end;
        return new SourceSpan(from, until);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
