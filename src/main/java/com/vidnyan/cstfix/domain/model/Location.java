package com.vidnyan.cstfix.domain.model;

import com.vidnyan.cstfix.domain.syntax.LineIndex;
import com.vidnyan.cstfix.domain.syntax.TextRange;

/**
 * Source code location, 1-based.
 */
public record Location(
    String sourceName,
    int line,
    int column,
    int endLine,
    int endColumn
) {

    /**
     * Resolve a character range against the line table of the text it was taken from.
     */
    public static Location of(String sourceName, TextRange range, LineIndex lines) {
        return new Location(
                sourceName,
                lines.line(range.start()),
                lines.column(range.start()),
                lines.line(range.end()),
                lines.column(range.end()));
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return sourceName + ":" + line + ":" + column;
    }
}
