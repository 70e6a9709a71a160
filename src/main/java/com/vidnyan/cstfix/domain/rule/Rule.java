package com.vidnyan.cstfix.domain.rule;

import com.vidnyan.cstfix.domain.query.AstQuery;
import com.vidnyan.cstfix.domain.syntax.ast.AstNode;

import java.util.List;
import java.util.Optional;

/**
 * Contract every analysis implements.
 * <p>
 * For each match of {@link #query()} the engine calls {@link #run} once; for each returned
 * state it asks for a diagnostic and, only when one is reported, for an action.
 * All three steps must be free of side effects.
 *
 * @param <N> typed view of the matched node
 * @param <S> result state carried from analysis to the diagnostic and action steps
 */
public interface Rule<N extends AstNode, S> {

    RuleMetadata metadata();

    AstQuery<N> query();

    /**
     * Analyzes one match. An empty list means nothing to report; a malformed match
     * (missing children in a recovery tree) also yields an empty list.
     */
    List<S> run(RuleContext<N> ctx);

    /**
     * Diagnostic for a state, or empty to suppress it.
     */
    Optional<RuleDiagnostic> diagnostic(RuleContext<N> ctx, S state);

    /**
     * Fix for a reported state, or empty when no safe rewrite is known.
     */
    default Optional<RuleAction> action(RuleContext<N> ctx, S state) {
        return Optional.empty();
    }

    /**
     * Get the rule name for logging.
     */
    default String getName() {
        return metadata().name();
    }
}
