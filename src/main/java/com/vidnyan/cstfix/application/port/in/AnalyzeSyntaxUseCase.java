package com.vidnyan.cstfix.application.port.in;

import com.vidnyan.cstfix.domain.model.Location;
import com.vidnyan.cstfix.domain.mutation.TextEdit;
import com.vidnyan.cstfix.domain.rule.AnalyzerOptions;
import com.vidnyan.cstfix.domain.rule.Applicability;
import com.vidnyan.cstfix.domain.rule.RuleAction;
import com.vidnyan.cstfix.domain.rule.RuleSignal;
import com.vidnyan.cstfix.domain.rule.Severity;
import com.vidnyan.cstfix.domain.syntax.SyntaxTree;

import java.util.List;

/**
 * Primary use case: lint a syntax tree and apply the fixes the rules propose.
 * This is the main entry point to the application.
 */
public interface AnalyzeSyntaxUseCase {

    /**
     * Run the requested rules over a tree.
     * @param request Analysis request parameters
     * @return Findings in rule order, each located in the source text
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Apply fixes one at a time until no applicable fix remains.
     * @param request Fix request parameters
     * @return The last good tree plus what was applied
     */
    FixResult fixAll(FixRequest request);

    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(
        SyntaxTree tree,
        String sourceName,
        List<String> ruleNames,    // Empty = all registered rules
        AnalyzerOptions options    // null = configured defaults
    ) {
        public AnalysisRequest {
            ruleNames = ruleNames == null ? List.of() : List.copyOf(ruleNames);
        }

        public static AnalysisRequest forTree(SyntaxTree tree, String sourceName) {
            return new AnalysisRequest(tree, sourceName, List.of(), null);
        }
    }

    /**
     * A signal resolved to a source location.
     */
    record Finding(RuleSignal signal, Location location) {

        public String ruleName() {
            return signal.ruleName();
        }

        public Severity severity() {
            return signal.diagnostic().severity();
        }

        public String format() {
            return location.format() + " " + signal.diagnostic().category() + " " + signal.diagnostic().fullMessage();
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        List<Finding> findings,
        AnalysisStats stats
    ) {
        public boolean hasErrors() {
            return findings.stream().anyMatch(f -> f.severity() == Severity.ERROR);
        }

        public int findingCount(Severity severity) {
            return (int) findings.stream()
                    .filter(f -> f.severity() == severity)
                    .count();
        }

        public long fixableCount() {
            return findings.stream().filter(f -> f.signal().hasAction()).count();
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int rulesEvaluated,
        int findings,
        int fixable,
        long totalDurationMs
    ) {}

    /**
     * Which fixes {@link #fixAll} may apply.
     */
    enum FixMode {
        SAFE_FIXES,
        SAFE_AND_UNSAFE_FIXES;

        public boolean permits(RuleAction action) {
            return this == SAFE_AND_UNSAFE_FIXES || action.applicability() == Applicability.ALWAYS;
        }
    }

    /**
     * Fix request parameters.
     */
    record FixRequest(
        SyntaxTree tree,
        String sourceName,
        FixMode mode,
        AnalyzerOptions options    // null = configured defaults
    ) {
        public static FixRequest safe(SyntaxTree tree, String sourceName) {
            return new FixRequest(tree, sourceName, FixMode.SAFE_FIXES, null);
        }
    }

    /**
     * One committed fix and the text it changed, relative to the tree it was applied to.
     */
    record AppliedFix(
        String ruleName,
        String message,
        List<TextEdit> edits
    ) {}

    /**
     * Fix result.
     * @param converged false when the iteration limit stopped the loop with fixes still pending
     */
    record FixResult(
        SyntaxTree tree,
        List<AppliedFix> applied,
        List<Finding> remaining,
        boolean converged
    ) {}
}
