package com.vidnyan.cstfix.domain.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable interior node: a kind plus an ordered slot vector.
 * A {@code null} slot is an absent optional child, or a missing required child in a tree
 * produced by error recovery. Equality is structural.
 */
public final class SyntaxNode implements SyntaxElement {

    private final SyntaxKind kind;
    private final List<SyntaxElement> slots;
    private final int textLength;
    private int hash;

    private SyntaxNode(SyntaxKind kind, List<SyntaxElement> slots) {
        this.kind = kind;
        this.slots = slots;
        int length = 0;
        for (SyntaxElement slot : slots) {
            if (slot != null) {
                length += slot.textLength();
            }
        }
        this.textLength = length;
    }

    /**
     * Creates a node after checking every present child against the grammar.
     * Missing required children are tolerated so recovery trees can be represented.
     *
     * @throws SyntaxConstructionException if a child has a kind its slot does not allow
     */
    public static SyntaxNode create(SyntaxKind kind, List<? extends SyntaxElement> slots) {
        Objects.requireNonNull(kind, "kind");
        if (!kind.isNode()) {
            throw new SyntaxConstructionException(kind + " is not a node kind");
        }
        List<SyntaxElement> copy = Collections.unmodifiableList(new ArrayList<>(slots));
        SyntaxGrammar.shapeOf(kind).validate(kind, copy);
        return new SyntaxNode(kind, copy);
    }

    public static SyntaxNode create(SyntaxKind kind, SyntaxElement... slots) {
        return create(kind, Arrays.asList(slots));
    }

    @Override
    public SyntaxKind kind() {
        return kind;
    }

    /**
     * All slots, absent ones included as {@code null}.
     */
    public List<SyntaxElement> slots() {
        return slots;
    }

    public int slotCount() {
        return slots.size();
    }

    public SyntaxElement slot(int index) {
        return slots.get(index);
    }

    @Override
    public int textLength() {
        return textLength;
    }

    @Override
    public String fullText() {
        StringBuilder sb = new StringBuilder(textLength);
        writeTo(sb);
        return sb.toString();
    }

    @Override
    public void writeTo(StringBuilder sb) {
        for (SyntaxElement slot : slots) {
            if (slot != null) {
                slot.writeTo(sb);
            }
        }
    }

    @Override
    public boolean isToken() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxNode other)) return false;
        return kind == other.kind
                && textLength == other.textLength
                && hashCode() == other.hashCode()
                && slots.equals(other.slots);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = 31 * kind.hashCode() + slots.hashCode();
            hash = h == 0 ? 1 : h;
        }
        return hash;
    }

    @Override
    public String toString() {
        return kind + "(" + textLength + ")";
    }
}
