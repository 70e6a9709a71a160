package com.vidnyan.cstfix.domain.rule;

import com.vidnyan.cstfix.domain.syntax.TextRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A finding reported by a rule.
 * Immutable; the {@code note}/{@code description}/{@code withSeverity} methods return copies.
 *
 * @param category    {@code lint/<group>/<rule>}
 * @param range       trimmed source range the finding points at
 * @param message     short title
 * @param description long form of the message, {@code null} when the title says it all
 * @param notes       secondary messages in order
 * @param severity    severity after configuration overrides
 */
public record RuleDiagnostic(
    String category,
    TextRange range,
    String message,
    String description,
    List<DiagnosticNote> notes,
    Severity severity
) {

    public RuleDiagnostic {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(message, "message");
        notes = List.copyOf(notes);
        Objects.requireNonNull(severity, "severity");
    }

    public static RuleDiagnostic of(RuleMetadata rule, TextRange range, String message) {
        return new RuleDiagnostic(rule.category(), range, message, null, List.of(), rule.severity());
    }

    public RuleDiagnostic note(String note) {
        return note(note, null);
    }

    public RuleDiagnostic note(String note, TextRange noteRange) {
        List<DiagnosticNote> extended = new ArrayList<>(notes);
        extended.add(new DiagnosticNote(note, noteRange));
        return new RuleDiagnostic(category, range, message, description, extended, severity);
    }

    public RuleDiagnostic description(String text) {
        return new RuleDiagnostic(category, range, message, text, notes, severity);
    }

    public RuleDiagnostic withSeverity(Severity newSeverity) {
        return new RuleDiagnostic(category, range, message, description, notes, newSeverity);
    }

    /**
     * Description when present, otherwise the title.
     */
    public String fullMessage() {
        return description != null ? description : message;
    }
}
