package com.vidnyan.cstfix.domain.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Positioned view of an element inside a {@link SyntaxTree}.
 * Cursors are transient: parent links and offsets live here, never in the tree itself,
 * so a cursor is only meaningful together with the tree that produced it.
 */
public final class SyntaxCursor {

    private final SyntaxTree tree;
    private final SyntaxCursor parent;
    private final SyntaxElement element;
    private final int slot;
    private final int offset;

    SyntaxCursor(SyntaxTree tree, SyntaxCursor parent, SyntaxElement element, int slot, int offset) {
        this.tree = tree;
        this.parent = parent;
        this.element = element;
        this.slot = slot;
        this.offset = offset;
    }

    public SyntaxTree tree() {
        return tree;
    }

    public SyntaxElement element() {
        return element;
    }

    public SyntaxKind kind() {
        return element.kind();
    }

    public boolean isToken() {
        return element.isToken();
    }

    public boolean isNode() {
        return element.isNode();
    }

    public SyntaxNode node() {
        return element.asNode();
    }

    public SyntaxToken token() {
        return element.asToken();
    }

    public Optional<SyntaxCursor> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Index of this element in its parent's slot vector, {@code -1} for the root.
     */
    public int slot() {
        return slot;
    }

    /**
     * Slot indices from the root down to this element.
     */
    public List<Integer> path() {
        List<Integer> path = new ArrayList<>();
        for (SyntaxCursor c = this; c.parent != null; c = c.parent) {
            path.add(c.slot);
        }
        Collections.reverse(path);
        return path;
    }

    public int depth() {
        int depth = 0;
        for (SyntaxCursor c = parent; c != null; c = c.parent) {
            depth++;
        }
        return depth;
    }

    /**
     * Span including leading and trailing trivia.
     */
    public TextRange fullRange() {
        return TextRange.at(offset, element.textLength());
    }

    /**
     * Span from the first token's text to the last token's text, trivia excluded.
     * Elements without tokens yield an empty range at their offset.
     */
    public TextRange textRange() {
        if (element instanceof SyntaxToken token) {
            return TextRange.at(offset + token.leadingTrivia().length(), token.text().length());
        }
        Optional<SyntaxCursor> first = firstToken();
        Optional<SyntaxCursor> last = lastToken();
        if (first.isEmpty() || last.isEmpty()) {
            return TextRange.empty(offset);
        }
        return new TextRange(first.get().textRange().start(), last.get().textRange().end());
    }

    /**
     * Source text without the outer trivia.
     */
    public String text() {
        TextRange full = fullRange();
        TextRange trimmed = textRange();
        String fullText = element.fullText();
        return fullText.substring(trimmed.start() - full.start(), trimmed.end() - full.start());
    }

    public String fullText() {
        return element.fullText();
    }

    /**
     * Child in the given slot, empty when the slot is absent or this is a token.
     */
    public Optional<SyntaxCursor> child(int index) {
        if (!(element instanceof SyntaxNode node) || index < 0 || index >= node.slotCount()) {
            return Optional.empty();
        }
        int childOffset = offset;
        for (int i = 0; i < index; i++) {
            SyntaxElement before = node.slot(i);
            if (before != null) {
                childOffset += before.textLength();
            }
        }
        SyntaxElement child = node.slot(index);
        return child == null
                ? Optional.empty()
                : Optional.of(new SyntaxCursor(tree, this, child, index, childOffset));
    }

    /**
     * Present children in order.
     */
    public List<SyntaxCursor> children() {
        if (!(element instanceof SyntaxNode node)) {
            return List.of();
        }
        List<SyntaxCursor> children = new ArrayList<>(node.slotCount());
        int childOffset = offset;
        for (int i = 0; i < node.slotCount(); i++) {
            SyntaxElement child = node.slot(i);
            if (child != null) {
                children.add(new SyntaxCursor(tree, this, child, i, childOffset));
                childOffset += child.textLength();
            }
        }
        return children;
    }

    public Optional<SyntaxCursor> firstToken() {
        if (isToken()) {
            return Optional.of(this);
        }
        for (SyntaxCursor child : children()) {
            Optional<SyntaxCursor> token = child.firstToken();
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    public Optional<SyntaxCursor> lastToken() {
        if (isToken()) {
            return Optional.of(this);
        }
        List<SyntaxCursor> children = children();
        for (int i = children.size() - 1; i >= 0; i--) {
            Optional<SyntaxCursor> token = children.get(i).lastToken();
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    /**
     * Token immediately before this element's first token in document order.
     */
    public Optional<SyntaxCursor> previousToken() {
        for (SyntaxCursor c = this; c.parent != null; c = c.parent) {
            List<SyntaxCursor> siblings = c.parent.children();
            for (int i = siblings.size() - 1; i >= 0; i--) {
                SyntaxCursor sibling = siblings.get(i);
                if (sibling.slot >= c.slot) {
                    continue;
                }
                Optional<SyntaxCursor> token = sibling.lastToken();
                if (token.isPresent()) {
                    return token;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Token immediately after this element's last token in document order.
     */
    public Optional<SyntaxCursor> nextToken() {
        for (SyntaxCursor c = this; c.parent != null; c = c.parent) {
            for (SyntaxCursor sibling : c.parent.children()) {
                if (sibling.slot <= c.slot) {
                    continue;
                }
                Optional<SyntaxCursor> token = sibling.firstToken();
                if (token.isPresent()) {
                    return token;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Nearest ancestor (excluding this cursor) of the given kind.
     */
    public Optional<SyntaxCursor> ancestor(SyntaxKind kind) {
        for (SyntaxCursor c = parent; c != null; c = c.parent) {
            if (c.kind() == kind) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxCursor other)) return false;
        return tree == other.tree && offset == other.offset && element == other.element && path().equals(other.path());
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(element) + offset;
    }

    @Override
    public String toString() {
        return kind() + "@" + fullRange();
    }
}
