package com.vidnyan.cstfix.domain.syntax;

/**
 * Half-open character span {@code [start, end)} into the source text.
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
    }

    public static TextRange at(int offset, int length) {
        return new TextRange(offset, offset + length);
    }

    public static TextRange empty(int offset) {
        return new TextRange(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(TextRange other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
