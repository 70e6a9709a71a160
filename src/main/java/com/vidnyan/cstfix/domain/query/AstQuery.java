package com.vidnyan.cstfix.domain.query;

import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxTree;
import com.vidnyan.cstfix.domain.syntax.ast.AstNode;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * What a rule wants matched: a set of node kinds and the typed view to wrap each match in.
 */
public record AstQuery<N extends AstNode>(Set<SyntaxKind> kinds, Function<SyntaxCursor, N> view) {

    public AstQuery {
        Objects.requireNonNull(view, "view");
        if (kinds.isEmpty()) {
            throw new IllegalArgumentException("A query needs at least one kind");
        }
        kinds = Set.copyOf(kinds);
    }

    public static <N extends AstNode> AstQuery<N> of(SyntaxKind kind, Function<SyntaxCursor, N> view) {
        return new AstQuery<>(EnumSet.of(kind), view);
    }

    public boolean matches(SyntaxCursor cursor) {
        return cursor.isNode() && kinds.contains(cursor.kind());
    }

    /**
     * Typed matches in document order.
     */
    public Stream<N> matches(SyntaxTree tree) {
        return SyntaxQueries.forEachNodeOfKind(tree, kinds).map(view);
    }
}
