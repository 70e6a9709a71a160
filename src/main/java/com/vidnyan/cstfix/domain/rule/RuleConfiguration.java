package com.vidnyan.cstfix.domain.rule;

/**
 * Per-rule settings supplied by the caller.
 *
 * @param enabled  whether the rule runs
 * @param severity override for the rule's default severity, {@code null} to keep it
 */
public record RuleConfiguration(boolean enabled, Severity severity) {

    public static RuleConfiguration off() {
        return new RuleConfiguration(false, null);
    }

    public static RuleConfiguration on() {
        return new RuleConfiguration(true, null);
    }

    public static RuleConfiguration at(Severity severity) {
        return new RuleConfiguration(true, severity);
    }
}
