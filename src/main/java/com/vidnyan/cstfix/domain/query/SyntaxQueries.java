package com.vidnyan.cstfix.domain.query;

import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxTree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy pre-order traversal over a tree.
 * Every call starts a fresh walk, so the same tree always yields the same sequence.
 */
public final class SyntaxQueries {

    private SyntaxQueries() {
    }

    /**
     * All elements, nodes and tokens, in document order.
     */
    public static Stream<SyntaxCursor> preorder(SyntaxTree tree) {
        return preorder(tree.rootCursor());
    }

    public static Stream<SyntaxCursor> preorder(SyntaxCursor start) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(new PreorderIterator(start),
                        Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Nodes whose kind is in {@code kinds}, in document order.
     */
    public static Stream<SyntaxCursor> forEachNodeOfKind(SyntaxTree tree, Set<SyntaxKind> kinds) {
        return preorder(tree).filter(cursor -> cursor.isNode() && kinds.contains(cursor.kind()));
    }

    public static Stream<SyntaxCursor> forEachNodeOfKind(SyntaxTree tree, SyntaxKind kind) {
        return forEachNodeOfKind(tree, Set.of(kind));
    }

    /**
     * Tokens in document order.
     */
    public static Stream<SyntaxCursor> tokens(SyntaxTree tree) {
        return preorder(tree).filter(SyntaxCursor::isToken);
    }

    private static final class PreorderIterator implements Iterator<SyntaxCursor> {

        private final Deque<SyntaxCursor> stack = new ArrayDeque<>();

        PreorderIterator(SyntaxCursor start) {
            stack.push(start);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public SyntaxCursor next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            SyntaxCursor current = stack.pop();
            List<SyntaxCursor> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
            return current;
        }
    }
}
