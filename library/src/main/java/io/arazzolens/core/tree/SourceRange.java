package io.arazzolens.core.tree;

/**
 * Character offsets of a node within the document text, end exclusive.
 */
public record SourceRange(int start, int end) {

    public static final SourceRange EMPTY = new SourceRange(0, 0);

    public SourceRange {
        if (start < 0) start = 0;
        if (end < start) end = start;
    }

    public static SourceRange of(final int start, final int end) {
        return new SourceRange(start, end);
    }

    public boolean contains(final SourceRange other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public String toString() {
        return "[%d,%d]".formatted(start, end);
    }
}
