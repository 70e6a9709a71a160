package com.vidnyan.cstfix.domain.syntax;

/**
 * A node or a token: anything that can occupy a child slot.
 * Elements carry no position; offsets are computed by {@link SyntaxCursor}.
 */
public interface SyntaxElement {

    SyntaxKind kind();

    /**
     * Length of the element including all trivia.
     */
    int textLength();

    /**
     * Exact source text including all trivia.
     */
    String fullText();

    boolean isToken();

    default boolean isNode() {
        return !isToken();
    }

    default SyntaxToken asToken() {
        return (SyntaxToken) this;
    }

    default SyntaxNode asNode() {
        return (SyntaxNode) this;
    }

    /**
     * Appends the element's exact text to {@code sb}.
     */
    void writeTo(StringBuilder sb);
}
