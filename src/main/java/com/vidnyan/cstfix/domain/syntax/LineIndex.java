package com.vidnyan.cstfix.domain.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets to 1-based line and column numbers.
 */
public final class LineIndex {

    private final int[] lineStarts;

    private LineIndex(int[] lineStarts) {
        this.lineStarts = lineStarts;
    }

    public static LineIndex of(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\u2028' || c == '\u2029') {
                starts.add(i + 1);
            } else if (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n')) {
                starts.add(i + 1);
            }
        }
        return new LineIndex(starts.stream().mapToInt(Integer::intValue).toArray());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * 1-based line containing {@code offset}.
     */
    public int line(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    /**
     * 1-based column of {@code offset} within its line.
     */
    public int column(int offset) {
        return offset - lineStarts[line(offset) - 1] + 1;
    }
}
