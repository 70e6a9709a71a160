package com.vidnyan.cstfix.domain.mutation;

import com.vidnyan.cstfix.domain.syntax.TextRange;

import java.util.Comparator;
import java.util.List;

/**
 * Replace the text in {@code range} of the old source with {@code replacement}.
 */
public record TextEdit(TextRange range, String replacement) {

    /**
     * Applies non-overlapping edits to {@code source}.
     */
    public static String apply(String source, List<TextEdit> edits) {
        StringBuilder sb = new StringBuilder(source);
        edits.stream()
                .sorted(Comparator.comparingInt((TextEdit e) -> e.range().start()).reversed())
                .forEach(edit -> sb.replace(edit.range().start(), edit.range().end(), edit.replacement()));
        return sb.toString();
    }
}
