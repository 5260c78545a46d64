package org.pragmatica.latex.tree;

/**
 * A half-open range of UTF-16 offsets into the source buffer, from start (inclusive) to end (exclusive).
 * A zero-width span marks an insertion point at {@code start}.
 */
public record SourceSpan(int start, int end) {
    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(int offset) {
        return new SourceSpan(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public String extract(String source) {
        return source.substring(start, end);
    }

    public SourceSpan merge(SourceSpan other) {
        return new SourceSpan(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
