package com.vidnyan.cstfix.adapter.out.rule.suspicious;

import java.util.Locale;
import java.util.Optional;

/**
 * Every value {@code typeof} can produce.
 */
public enum JsTypeName {
    UNDEFINED("undefined"),
    OBJECT("object"),
    BOOLEAN("boolean"),
    NUMBER("number"),
    STRING("string"),
    FUNCTION("function"),
    SYMBOL("symbol"),
    BIGINT("bigint");

    /** Misspellings further away than this get no suggestion. */
    static final int MAX_SUGGESTION_DISTANCE = 2;

    private final String text;

    JsTypeName(String text) {
        this.text = text;
    }

    public String asString() {
        return text;
    }

    /**
     * Exact, case-sensitive lookup.
     */
    public static Optional<JsTypeName> fromName(String name) {
        for (JsTypeName type : values()) {
            if (type.text.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Type name {@code name} most likely meant: the lowercased form if that is a type name,
     * otherwise the single closest name within {@link #MAX_SUGGESTION_DISTANCE} edits.
     * Ties yield no suggestion.
     */
    public static Optional<JsTypeName> suggest(String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        Optional<JsTypeName> exact = fromName(lowered);
        if (exact.isPresent()) {
            return exact;
        }
        JsTypeName best = null;
        int bestDistance = Integer.MAX_VALUE;
        boolean tie = false;
        for (JsTypeName type : values()) {
            int distance = editDistance(lowered, type.text);
            if (distance < bestDistance) {
                best = type;
                bestDistance = distance;
                tie = false;
            } else if (distance == bestDistance) {
                tie = true;
            }
        }
        if (best == null || tie || bestDistance > MAX_SUGGESTION_DISTANCE) {
            return Optional.empty();
        }
        return Optional.of(best);
    }

    /**
     * Optimal string alignment distance: insertions, deletions, substitutions and
     * adjacent transpositions each cost one.
     */
    static int editDistance(String a, String b) {
        int[][] d = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) {
            d[i][0] = i;
        }
        for (int j = 0; j <= b.length(); j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1
                        && a.charAt(i - 1) == b.charAt(j - 2)
                        && a.charAt(i - 2) == b.charAt(j - 1)) {
                    d[i][j] = Math.min(d[i][j], d[i - 2][j - 2] + 1);
                }
            }
        }
        return d[a.length()][b.length()];
    }
}
