package com.vidnyan.cstfix.domain.syntax;

import com.vidnyan.cstfix.domain.mutation.BatchMutation;

import java.util.Objects;

/**
 * An immutable tree value: one root node, shared freely between readers.
 * Edits never change a tree; {@link BatchMutation#commit()} returns a new one.
 */
public final class SyntaxTree {

    private final SyntaxNode root;
    private LineIndex lineIndex;

    private SyntaxTree(SyntaxNode root) {
        this.root = root;
    }

    public static SyntaxTree of(SyntaxNode root) {
        return new SyntaxTree(Objects.requireNonNull(root, "root"));
    }

    public SyntaxNode root() {
        return root;
    }

    public SyntaxCursor rootCursor() {
        return new SyntaxCursor(this, null, root, -1, 0);
    }

    /**
     * The exact source: every token's leading trivia, text and trailing trivia in document order.
     */
    public String text() {
        return root.fullText();
    }

    public int textLength() {
        return root.textLength();
    }

    /**
     * Starts an edit batch against this tree.
     */
    public BatchMutation begin() {
        return new BatchMutation(this);
    }

    public LineIndex lineIndex() {
        LineIndex index = lineIndex;
        if (index == null) {
            index = LineIndex.of(text());
            lineIndex = index;
        }
        return index;
    }

    @Override
    public String toString() {
        return "SyntaxTree[" + root + "]";
    }
}
