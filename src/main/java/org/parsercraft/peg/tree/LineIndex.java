package org.parsercraft.peg.tree;

import java.util.Arrays;

/**
 * Maps character offsets of one source text to line/column positions.
 */
public final class LineIndex {
    private final int[] lineStarts;
    private final int length;

    private LineIndex(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineIndex of(String source) {
        var starts = new int[16];
        int count = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineIndex(Arrays.copyOf(starts, count), source.length());
    }

    public SourceLocation locate(int offset) {
        if (offset < 0 || offset > length) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0, " + length + "]");
        }
        int idx = Arrays.binarySearch(lineStarts, offset);
        int line = idx >= 0 ? idx : -idx - 2;
        return SourceLocation.at(line + 1, offset - lineStarts[line] + 1, offset);
    }

    public SourceSpan span(int start, int end) {
        return SourceSpan.of(locate(start), locate(end));
    }

    int lineCount() {
        return lineStarts.length;
    }
}
