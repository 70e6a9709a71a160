package com.vidnyan.cstfix.domain.syntax;

/**
 * Kinds of non-semantic source text attached to tokens.
 */
public enum TriviaPieceKind {
    WHITESPACE,
    NEWLINE,
    SINGLE_LINE_COMMENT,
    MULTI_LINE_COMMENT;

    public boolean isComment() {
        return this == SINGLE_LINE_COMMENT || this == MULTI_LINE_COMMENT;
    }
}
