package com.vidnyan.cstfix.domain.rule;

import com.vidnyan.cstfix.domain.syntax.TextRange;

/**
 * Secondary message attached to a diagnostic, optionally pointing at its own range.
 */
public record DiagnosticNote(String message, TextRange range) {

    public static DiagnosticNote of(String message) {
        return new DiagnosticNote(message, null);
    }
}
