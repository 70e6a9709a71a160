package com.vidnyan.cstfix.domain.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable sequence of trivia pieces on one side of a token.
 */
public final class Trivia {

    public static final Trivia EMPTY = new Trivia(List.of());

    private final List<TriviaPiece> pieces;
    private final int length;

    private Trivia(List<TriviaPiece> pieces) {
        this.pieces = pieces;
        this.length = pieces.stream().mapToInt(TriviaPiece::length).sum();
    }

    public static Trivia of(TriviaPiece... pieces) {
        return of(Arrays.asList(pieces));
    }

    public static Trivia of(List<TriviaPiece> pieces) {
        if (pieces.isEmpty()) {
            return EMPTY;
        }
        return new Trivia(Collections.unmodifiableList(new ArrayList<>(pieces)));
    }

    public List<TriviaPiece> pieces() {
        return pieces;
    }

    public boolean isEmpty() {
        return pieces.isEmpty();
    }

    public int length() {
        return length;
    }

    public String text() {
        StringBuilder sb = new StringBuilder(length);
        for (TriviaPiece piece : pieces) {
            sb.append(piece.text());
        }
        return sb.toString();
    }

    public boolean hasComments() {
        return pieces.stream().anyMatch(TriviaPiece::isComment);
    }

    public boolean startsWithWhitespace() {
        return !pieces.isEmpty() && (pieces.get(0).isWhitespace() || pieces.get(0).isNewline());
    }

    public boolean endsWith(char c) {
        return !pieces.isEmpty() && pieces.get(pieces.size() - 1).text().endsWith(String.valueOf(c));
    }

    public Trivia append(Trivia other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<TriviaPiece> joined = new ArrayList<>(pieces);
        joined.addAll(other.pieces);
        return new Trivia(Collections.unmodifiableList(joined));
    }

    public Trivia prepend(TriviaPiece piece) {
        List<TriviaPiece> joined = new ArrayList<>(pieces.size() + 1);
        joined.add(piece);
        joined.addAll(pieces);
        return new Trivia(Collections.unmodifiableList(joined));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trivia other)) return false;
        return pieces.equals(other.pieces);
    }

    @Override
    public int hashCode() {
        return pieces.hashCode();
    }

    @Override
    public String toString() {
        return "Trivia" + pieces;
    }
}
