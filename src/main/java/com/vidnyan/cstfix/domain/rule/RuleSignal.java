package com.vidnyan.cstfix.domain.rule;

import java.util.Optional;

/**
 * One reported finding: the diagnostic and, when the rule knows a rewrite, the fix.
 *
 * @param ruleName   rule that produced the signal
 * @param diagnostic the finding
 * @param fix        proposed fix, {@code null} when none is offered
 */
public record RuleSignal(String ruleName, RuleDiagnostic diagnostic, RuleAction fix) {

    public Optional<RuleAction> action() {
        return Optional.ofNullable(fix);
    }

    public boolean hasAction() {
        return fix != null;
    }
}
