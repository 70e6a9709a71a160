package com.vidnyan.cstfix.domain.syntax.ast;

import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;

import java.util.Optional;

public final class JsStringLiteralExpression extends AstNode {

    public static final int VALUE = 0;

    public JsStringLiteralExpression(SyntaxCursor syntax) {
        super(syntax, SyntaxKind.JS_STRING_LITERAL_EXPRESSION);
    }

    public static Optional<JsStringLiteralExpression> cast(SyntaxCursor syntax) {
        return syntax.kind() == SyntaxKind.JS_STRING_LITERAL_EXPRESSION
                ? Optional.of(new JsStringLiteralExpression(syntax))
                : Optional.empty();
    }

    public Optional<SyntaxCursor> valueToken() {
        return slot(VALUE).filter(SyntaxCursor::isToken);
    }

    /**
     * Literal text with surrounding quotes removed.
     */
    public Optional<String> innerString() {
        return valueToken().map(token -> unquote(token.token().text()));
    }

    static String unquote(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isQuote(text.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
