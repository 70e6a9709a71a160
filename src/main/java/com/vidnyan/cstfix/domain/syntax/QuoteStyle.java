package com.vidnyan.cstfix.domain.syntax;

/**
 * Preferred quote character for synthesized string literals.
 */
public enum QuoteStyle {
    DOUBLE('"'),
    SINGLE('\'');

    private final char quote;

    QuoteStyle(char quote) {
        this.quote = quote;
    }

    public char quote() {
        return quote;
    }

    public boolean isDouble() {
        return this == DOUBLE;
    }

    /**
     * Parses {@code "double"} or {@code "single"}, ignoring case.
     */
    public static QuoteStyle parse(String value) {
        for (QuoteStyle style : values()) {
            if (style.name().equalsIgnoreCase(value)) {
                return style;
            }
        }
        throw new IllegalArgumentException("Unknown quote style '" + value + "', expected double or single");
    }
}
