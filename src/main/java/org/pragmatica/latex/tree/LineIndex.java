package org.pragmatica.latex.tree;

import java.util.Arrays;

/**
 * Line-start table for a source string. Resolves offsets to line/column in O(log n).
 */
public final class LineIndex {
    private static final int DEFAULT_CAPACITY = 16;

    private final int length;
    private final int[] lineStarts;

    private LineIndex(int length, int[] lineStarts) {
        this.length = length;
        this.lineStarts = lineStarts;
    }

    public static LineIndex of(String source) {
        var starts = new int[DEFAULT_CAPACITY];
        int count = 1;
        starts[0] = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineIndex(source.length(), Arrays.copyOf(starts, count));
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Resolve an offset. Offsets outside {@code [0, length]} are clamped.
     */
    public SourceLocation locate(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int line = lineOf(clamped);
        return SourceLocation.at(line + 1, clamped - lineStarts[line] + 1, clamped);
    }

    public SourceLocation start(SourceSpan span) {
        return locate(span.start());
    }

    public SourceLocation end(SourceSpan span) {
        return locate(span.end());
    }

    private int lineOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        // insertion point - 1 is the last line starting before offset
        return index >= 0 ? index : -index - 2;
    }
}
