package com.vidnyan.cstfix.domain.rule;

import com.vidnyan.cstfix.domain.syntax.SyntaxTree;
import com.vidnyan.cstfix.domain.syntax.ast.AstNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs rules over one tree and collects their signals.
 * <p>
 * Signals of a rule come out in document order; rules run in the order given.
 * A failure inside a rule never aborts the pass: a throwing analysis step skips the match,
 * a throwing action step drops only the fix.
 */
@Slf4j
public class Analyzer {

    public List<RuleSignal> analyze(SyntaxTree tree, List<? extends Rule<?, ?>> rules, AnalyzerOptions options) {
        List<RuleSignal> signals = new ArrayList<>();
        for (Rule<?, ?> rule : rules) {
            if (!options.isEnabled(rule.metadata())) {
                log.debug("Skipping disabled rule {}", rule.getName());
                continue;
            }
            signals.addAll(runRule(tree, rule, options));
        }
        return signals;
    }

    public <N extends AstNode, S> List<RuleSignal> runRule(SyntaxTree tree, Rule<N, S> rule, AnalyzerOptions options) {
        List<RuleSignal> signals = new ArrayList<>();
        rule.query().matches(tree).forEach(match -> {
            RuleContext<N> ctx = new RuleContext<>(match, rule.metadata(), options);
            for (S state : analyzeMatch(rule, ctx)) {
                diagnose(rule, ctx, state).ifPresent(diagnostic ->
                        signals.add(new RuleSignal(rule.getName(), diagnostic, buildAction(rule, ctx, state))));
            }
        });
        log.debug("Rule {} produced {} signals", rule.getName(), signals.size());
        return signals;
    }

    private static <N extends AstNode, S> List<S> analyzeMatch(Rule<N, S> rule, RuleContext<N> ctx) {
        try {
            List<S> states = rule.run(ctx);
            return states == null ? List.of() : states;
        } catch (RuntimeException e) {
            log.debug("Rule {} skipped {}: {}", rule.getName(), ctx.query(), e.getMessage());
            return List.of();
        }
    }

    private static <N extends AstNode, S> Optional<RuleDiagnostic> diagnose(Rule<N, S> rule, RuleContext<N> ctx, S state) {
        try {
            return rule.diagnostic(ctx, state);
        } catch (RuntimeException e) {
            log.warn("Rule {} failed to build a diagnostic for {}: {}", rule.getName(), ctx.query(), e.getMessage());
            return Optional.empty();
        }
    }

    private static <N extends AstNode, S> RuleAction buildAction(Rule<N, S> rule, RuleContext<N> ctx, S state) {
        try {
            return rule.action(ctx, state).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Rule {} withdrew its fix for {}: {}", rule.getName(), ctx.query(), e.getMessage());
            return null;
        }
    }
}
