package com.vidnyan.cstfix.domain.rule;

import com.vidnyan.cstfix.domain.mutation.BatchMutation;
import com.vidnyan.cstfix.domain.syntax.QuoteStyle;
import com.vidnyan.cstfix.domain.syntax.SyntaxTree;
import com.vidnyan.cstfix.domain.syntax.TextRange;
import com.vidnyan.cstfix.domain.syntax.ast.AstNode;

/**
 * Read-only context handed to a rule for one match.
 */
public record RuleContext<N extends AstNode>(
    N query,
    RuleMetadata rule,
    AnalyzerOptions options
) {

    /**
     * Tree the match belongs to; start fixes with {@code root().begin()}.
     */
    public SyntaxTree root() {
        return query.tree();
    }

    public QuoteStyle preferredQuote() {
        return options.preferredQuote();
    }

    /**
     * Diagnostic carrying this rule's category and configured severity.
     */
    public RuleDiagnostic newDiagnostic(TextRange range, String message) {
        return RuleDiagnostic.of(rule, range, message).withSeverity(options.severityOf(rule));
    }

    public RuleAction newAction(ActionCategory category, Applicability applicability, String message,
                                BatchMutation mutation) {
        return new RuleAction(rule.name(), category, applicability, message, mutation);
    }
}
