package com.vidnyan.cstfix.domain.rule;

import com.vidnyan.cstfix.domain.syntax.QuoteStyle;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller-supplied configuration for one analysis pass.
 *
 * @param preferredQuote quote style used when rules synthesize string literals
 * @param rules          per-rule settings keyed by rule name; rules not listed run when recommended
 */
public record AnalyzerOptions(QuoteStyle preferredQuote, Map<String, RuleConfiguration> rules) {

    public AnalyzerOptions {
        Objects.requireNonNull(preferredQuote, "preferredQuote");
        rules = Map.copyOf(rules);
    }

    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions(QuoteStyle.DOUBLE, Map.of());
    }

    public Optional<RuleConfiguration> ruleConfiguration(String ruleName) {
        return Optional.ofNullable(rules.get(ruleName));
    }

    public boolean isEnabled(RuleMetadata rule) {
        return ruleConfiguration(rule.name())
                .map(RuleConfiguration::enabled)
                .orElse(rule.recommended());
    }

    /**
     * Severity after applying any configured override.
     */
    public Severity severityOf(RuleMetadata rule) {
        return ruleConfiguration(rule.name())
                .map(RuleConfiguration::severity)
                .orElse(rule.severity());
    }

    public AnalyzerOptions withPreferredQuote(QuoteStyle quote) {
        return new AnalyzerOptions(quote, rules);
    }

    public AnalyzerOptions withRule(String ruleName, RuleConfiguration configuration) {
        Map<String, RuleConfiguration> updated = new HashMap<>(rules);
        updated.put(ruleName, configuration);
        return new AnalyzerOptions(preferredQuote, updated);
    }
}
