package com.vidnyan.cstfix.application.service;

import com.vidnyan.cstfix.AnalysisProperties;
import com.vidnyan.cstfix.application.port.in.AnalyzeSyntaxUseCase;
import com.vidnyan.cstfix.domain.model.Location;
import com.vidnyan.cstfix.domain.mutation.BatchMutationException;
import com.vidnyan.cstfix.domain.rule.Analyzer;
import com.vidnyan.cstfix.domain.rule.AnalyzerOptions;
import com.vidnyan.cstfix.domain.rule.Rule;
import com.vidnyan.cstfix.domain.rule.RuleAction;
import com.vidnyan.cstfix.domain.rule.RuleSignal;
import com.vidnyan.cstfix.domain.syntax.LineIndex;
import com.vidnyan.cstfix.domain.syntax.SyntaxTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Main application service that orchestrates analysis and fixing.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisApplicationService implements AnalyzeSyntaxUseCase {

    private final List<Rule<?, ?>> rules;
    private final Analyzer analyzer;
    private final AnalyzerOptions defaultAnalyzerOptions;
    private final AnalysisProperties properties;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting analysis of: {}", request.sourceName());

        // Step 1: Select rules
        log.info("Step 1: Selecting rules...");
        List<Rule<?, ?>> selected = selectRules(request.ruleNames());
        AnalyzerOptions options = optionsFor(request.options());
        long enabled = selected.stream().filter(r -> options.isEnabled(r.metadata())).count();
        log.info("Selected {} rules, {} enabled", selected.size(), enabled);

        // Step 2: Run rules
        log.info("Step 2: Running rules...");
        List<RuleSignal> signals = analyzer.analyze(request.tree(), selected, options);

        // Step 3: Locate findings
        log.info("Step 3: Locating findings...");
        List<Finding> findings = locate(request.sourceName(), request.tree(), signals);

        Duration totalDuration = Duration.between(startTime, Instant.now());
        int fixable = (int) findings.stream().filter(f -> f.signal().hasAction()).count();
        AnalysisStats stats = new AnalysisStats((int) enabled, findings.size(), fixable, totalDuration.toMillis());

        log.info("Analysis complete: {} findings ({} fixable) in {}ms",
                stats.findings(), stats.fixable(), stats.totalDurationMs());
        return new AnalysisResult(findings, stats);
    }

    @Override
    public FixResult fixAll(FixRequest request) {
        log.info("Fixing {} with {}", request.sourceName(), request.mode());
        AnalyzerOptions options = optionsFor(request.options());
        int maxIterations = properties.getMaxFixIterations();

        SyntaxTree current = request.tree();
        List<AppliedFix> applied = new ArrayList<>();
        List<RuleSignal> signals = analyzer.analyze(current, rules, options);
        boolean converged = false;

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            Optional<SyntaxTree> fixed = applyFirst(current, signals, request.mode(), applied);
            if (fixed.isEmpty()) {
                converged = true;
                break;
            }
            current = fixed.get();
            signals = analyzer.analyze(current, rules, options);
        }
        if (!converged) {
            converged = signals.stream().noneMatch(s -> s.action().filter(request.mode()::permits).isPresent());
            if (!converged) {
                log.warn("Stopped fixing {} after {} iterations with fixes still pending",
                        request.sourceName(), maxIterations);
            }
        }

        List<Finding> remaining = locate(request.sourceName(), current, signals);
        log.info("Fix complete: {} fixes applied, {} findings remain", applied.size(), remaining.size());
        return new FixResult(current, List.copyOf(applied), remaining, converged);
    }

    /**
     * Commits the first permitted action that applies cleanly. Actions whose commit fails are
     * dropped; the diagnostic that carried them still stands.
     */
    private Optional<SyntaxTree> applyFirst(SyntaxTree tree, List<RuleSignal> signals, FixMode mode,
                                            List<AppliedFix> applied) {
        for (RuleSignal signal : signals) {
            Optional<RuleAction> action = signal.action().filter(mode::permits);
            if (action.isEmpty()) {
                continue;
            }
            try {
                SyntaxTree next = action.get().mutation().commit();
                applied.add(new AppliedFix(signal.ruleName(), action.get().message(), action.get().mutation().textEdits()));
                log.debug("Applied {} at {}", signal.ruleName(), signal.diagnostic().range());
                return Optional.of(next);
            } catch (BatchMutationException e) {
                log.warn("Dropping fix from {}: {}", signal.ruleName(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    private List<Rule<?, ?>> selectRules(List<String> ruleNames) {
        if (ruleNames.isEmpty()) {
            return rules;
        }
        List<Rule<?, ?>> selected = new ArrayList<>();
        for (String name : ruleNames) {
            Optional<Rule<?, ?>> rule = rules.stream().filter(r -> r.getName().equals(name)).findFirst();
            if (rule.isPresent()) {
                selected.add(rule.get());
            } else {
                log.warn("No rule registered under name: {}", name);
            }
        }
        return selected;
    }

    private AnalyzerOptions optionsFor(AnalyzerOptions requested) {
        return requested != null ? requested : defaultAnalyzerOptions;
    }

    private static List<Finding> locate(String sourceName, SyntaxTree tree, List<RuleSignal> signals) {
        LineIndex lines = tree.lineIndex();
        return signals.stream()
                .map(s -> new Finding(s, Location.of(sourceName, s.diagnostic().range(), lines)))
                .toList();
    }
}
