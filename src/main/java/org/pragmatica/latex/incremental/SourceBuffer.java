package org.pragmatica.latex.incremental;

import org.pragmatica.latex.tree.SourceSpan;

import java.util.Objects;

/**
 * Immutable source text of a document.
 */
public final class SourceBuffer {
    private static final SourceBuffer EMPTY = new SourceBuffer("");

    private final String text;

    private SourceBuffer(String text) {
        this.text = text;
    }

    public static SourceBuffer of(String text) {
        Objects.requireNonNull(text, "text");
        return text.isEmpty() ? EMPTY : new SourceBuffer(text);
    }

    public static SourceBuffer empty() {
        return EMPTY;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    /**
     * @throws IndexOutOfBoundsException unless {@code 0 <= start <= end <= length()}
     */
    public String slice(int start, int end) {
        checkRange(start, end);
        return text.substring(start, end);
    }

    public String slice(SourceSpan span) {
        return slice(span.start(), span.end());
    }

    /**
     * New buffer with {@code [start, end)} replaced by {@code inserted}.
     *
     * @throws IndexOutOfBoundsException unless {@code 0 <= start <= end <= length()}
     */
    public SourceBuffer replace(int start, int end, String inserted) {
        checkRange(start, end);
        Objects.requireNonNull(inserted, "inserted");
        return of(text.substring(0, start) + inserted + text.substring(end));
    }

    private void checkRange(int start, int end) {
        if (start < 0 || start > end || end > text.length()) {
            throw new IndexOutOfBoundsException("Range [" + start + ", " + end + ") outside buffer of length " + text.length());
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SourceBuffer other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "SourceBuffer[" + text.length() + " chars]";
    }
}
