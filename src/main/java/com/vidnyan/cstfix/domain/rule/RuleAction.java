package com.vidnyan.cstfix.domain.rule;

import com.vidnyan.cstfix.domain.mutation.BatchMutation;

import java.util.Objects;

/**
 * A proposed fix. The mutation is uncommitted; the caller decides whether to commit it.
 */
public record RuleAction(
    String ruleName,
    ActionCategory category,
    Applicability applicability,
    String message,
    BatchMutation mutation
) {

    public RuleAction {
        Objects.requireNonNull(ruleName, "ruleName");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(applicability, "applicability");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(mutation, "mutation");
    }

    public boolean isSafe() {
        return applicability == Applicability.ALWAYS;
    }
}
