package com.vidnyan.cstfix.domain.syntax;

import java.util.Objects;
import java.util.Set;

/**
 * One run of whitespace, a newline, or a comment, with its exact text.
 */
public record TriviaPiece(TriviaPieceKind kind, String text) {

    private static final Set<String> LINE_BREAKS = Set.of("\n", "\r\n", "\r", "\u2028", "\u2029");

    public TriviaPiece {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new SyntaxConstructionException("Empty " + kind + " trivia piece");
        }
        switch (kind) {
            case WHITESPACE -> {
                if (!text.chars().allMatch(TriviaPiece::isBlank)) {
                    throw new SyntaxConstructionException("Whitespace trivia contains non-blank text: '" + text + "'");
                }
            }
            case NEWLINE -> {
                if (!LINE_BREAKS.contains(text)) {
                    throw new SyntaxConstructionException("Newline trivia must be a single line break");
                }
            }
            case SINGLE_LINE_COMMENT -> {
                if (!text.startsWith("//") || text.chars().anyMatch(TriviaPiece::isLineTerminator)) {
                    throw new SyntaxConstructionException("Not a single-line comment: '" + text + "'");
                }
            }
            case MULTI_LINE_COMMENT -> {
                if (!text.startsWith("/*") || !text.endsWith("*/") || text.length() < 4) {
                    throw new SyntaxConstructionException("Not a block comment: '" + text + "'");
                }
            }
        }
    }

    public static TriviaPiece whitespace(String text) {
        return new TriviaPiece(TriviaPieceKind.WHITESPACE, text);
    }

    /**
     * {@code count} spaces.
     */
    public static TriviaPiece whitespace(int count) {
        return whitespace(" ".repeat(count));
    }

    public static TriviaPiece newline() {
        return new TriviaPiece(TriviaPieceKind.NEWLINE, "\n");
    }

    public static TriviaPiece singleLineComment(String text) {
        return new TriviaPiece(TriviaPieceKind.SINGLE_LINE_COMMENT, text);
    }

    public static TriviaPiece multiLineComment(String text) {
        return new TriviaPiece(TriviaPieceKind.MULTI_LINE_COMMENT, text);
    }

    public int length() {
        return text.length();
    }

    public boolean isComment() {
        return kind.isComment();
    }

    public boolean isWhitespace() {
        return kind == TriviaPieceKind.WHITESPACE;
    }

    public boolean isNewline() {
        return kind == TriviaPieceKind.NEWLINE;
    }

    /**
     * ECMAScript white space: tab, vertical tab, form feed, BOM and every Unicode space separator.
     */
    public static boolean isBlank(int c) {
        return c == '\t' || c == '\u000B' || c == '\f' || c == '\uFEFF'
                || Character.getType(c) == Character.SPACE_SEPARATOR;
    }

    public static boolean isLineTerminator(int c) {
        return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
    }
}
