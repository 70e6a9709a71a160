package com.vidnyan.cstfix.domain.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Immutable leaf: kind, exact text, and the trivia on either side.
 */
public final class SyntaxToken implements SyntaxElement {

    private final SyntaxKind kind;
    private final String text;
    private final Trivia leadingTrivia;
    private final Trivia trailingTrivia;

    private SyntaxToken(SyntaxKind kind, String text, Trivia leadingTrivia, Trivia trailingTrivia) {
        this.kind = kind;
        this.text = text;
        this.leadingTrivia = leadingTrivia;
        this.trailingTrivia = trailingTrivia;
    }

    /**
     * Builds a token that is not yet part of any tree.
     */
    public static SyntaxToken detached(SyntaxKind kind, String text, Trivia leading, Trivia trailing) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (!kind.isToken()) {
            throw new SyntaxConstructionException(kind + " is not a token kind");
        }
        if (kind.hasFixedText() && !kind.fixedText().equals(text)) {
            throw new SyntaxConstructionException(
                    String.format("%s token must read '%s' but was '%s'", kind, kind.fixedText(), text));
        }
        return new SyntaxToken(kind, text,
                leading == null ? Trivia.EMPTY : leading,
                trailing == null ? Trivia.EMPTY : trailing);
    }

    public static SyntaxToken detached(SyntaxKind kind, String text,
                                       List<TriviaPiece> leading, List<TriviaPiece> trailing) {
        return detached(kind, text, Trivia.of(leading), Trivia.of(trailing));
    }

    @Override
    public SyntaxKind kind() {
        return kind;
    }

    /**
     * Token text without trivia.
     */
    public String text() {
        return text;
    }

    public Trivia leadingTrivia() {
        return leadingTrivia;
    }

    public Trivia trailingTrivia() {
        return trailingTrivia;
    }

    @Override
    public int textLength() {
        return leadingTrivia.length() + text.length() + trailingTrivia.length();
    }

    @Override
    public String fullText() {
        StringBuilder sb = new StringBuilder(textLength());
        writeTo(sb);
        return sb.toString();
    }

    @Override
    public void writeTo(StringBuilder sb) {
        sb.append(leadingTrivia.text()).append(text).append(trailingTrivia.text());
    }

    @Override
    public boolean isToken() {
        return true;
    }

    public SyntaxToken withLeadingTrivia(Trivia trivia) {
        return new SyntaxToken(kind, text, Objects.requireNonNull(trivia), trailingTrivia);
    }

    public SyntaxToken withTrailingTrivia(Trivia trivia) {
        return new SyntaxToken(kind, text, leadingTrivia, Objects.requireNonNull(trivia));
    }

    /**
     * Moves the leading trivia out of this token. The returned pair holds the trivia and the
     * token without it; use one or the other, never this token and the trivia together.
     */
    public TakenTrivia takeLeadingTrivia() {
        return new TakenTrivia(leadingTrivia, withLeadingTrivia(Trivia.EMPTY));
    }

    /**
     * Same as {@link #takeLeadingTrivia()} for the trailing side.
     */
    public TakenTrivia takeTrailingTrivia() {
        return new TakenTrivia(trailingTrivia, withTrailingTrivia(Trivia.EMPTY));
    }

    /**
     * Trivia detached from a token, paired with the token that no longer owns it.
     */
    public record TakenTrivia(Trivia trivia, SyntaxToken token) {
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxToken other)) return false;
        return kind == other.kind
                && text.equals(other.text)
                && leadingTrivia.equals(other.leadingTrivia)
                && trailingTrivia.equals(other.trailingTrivia);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, leadingTrivia, trailingTrivia);
    }

    @Override
    public String toString() {
        return kind + "@'" + text + "'";
    }
}
