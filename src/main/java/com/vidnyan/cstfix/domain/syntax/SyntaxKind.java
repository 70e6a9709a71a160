package com.vidnyan.cstfix.domain.syntax;

/**
 * Kind tag of every token and node in the tree.
 * Tokens with fixed text (punctuation, keywords) carry it so the factory can build them.
 */
public enum SyntaxKind {

    // Tokens
    EOF(Shape.TOKEN, ""),
    L_ANGLE(Shape.TOKEN, "<"),
    R_ANGLE(Shape.TOKEN, ">"),
    SLASH(Shape.TOKEN, "/"),
    DOT(Shape.TOKEN, "."),
    EQ(Shape.TOKEN, "="),
    COMMA(Shape.TOKEN, ","),
    SEMICOLON(Shape.TOKEN, ";"),
    L_PAREN(Shape.TOKEN, "("),
    R_PAREN(Shape.TOKEN, ")"),
    L_CURLY(Shape.TOKEN, "{"),
    R_CURLY(Shape.TOKEN, "}"),
    PLUS(Shape.TOKEN, "+"),
    MINUS(Shape.TOKEN, "-"),
    STAR(Shape.TOKEN, "*"),
    BANG(Shape.TOKEN, "!"),
    TILDE(Shape.TOKEN, "~"),
    EQ2(Shape.TOKEN, "=="),
    EQ3(Shape.TOKEN, "==="),
    NEQ(Shape.TOKEN, "!="),
    NEQ2(Shape.TOKEN, "!=="),
    LTEQ(Shape.TOKEN, "<="),
    GTEQ(Shape.TOKEN, ">="),
    AMP2(Shape.TOKEN, "&&"),
    PIPE2(Shape.TOKEN, "||"),
    TYPEOF_KW(Shape.TOKEN, "typeof"),
    VOID_KW(Shape.TOKEN, "void"),
    DELETE_KW(Shape.TOKEN, "delete"),
    TRUE_KW(Shape.TOKEN, "true"),
    FALSE_KW(Shape.TOKEN, "false"),
    NULL_KW(Shape.TOKEN, "null"),
    IDENT(Shape.TOKEN, null),
    JS_STRING_LITERAL(Shape.TOKEN, null),
    JS_NUMBER_LITERAL(Shape.TOKEN, null),
    JSX_IDENT(Shape.TOKEN, null),
    JSX_STRING_LITERAL(Shape.TOKEN, null),
    JSX_TEXT_LITERAL(Shape.TOKEN, null),
    ERROR_TOKEN(Shape.TOKEN, null),

    // Nodes
    JS_MODULE(Shape.NODE, null),
    JS_EXPRESSION_STATEMENT(Shape.NODE, null),
    JS_BINARY_EXPRESSION(Shape.NODE, null),
    JS_UNARY_EXPRESSION(Shape.NODE, null),
    JS_STRING_LITERAL_EXPRESSION(Shape.NODE, null),
    JS_NUMBER_LITERAL_EXPRESSION(Shape.NODE, null),
    JS_BOOLEAN_LITERAL_EXPRESSION(Shape.NODE, null),
    JS_NULL_LITERAL_EXPRESSION(Shape.NODE, null),
    JS_IDENTIFIER_EXPRESSION(Shape.NODE, null),
    JS_REFERENCE_IDENTIFIER(Shape.NODE, null),
    JS_PARENTHESIZED_EXPRESSION(Shape.NODE, null),
    JS_STATIC_MEMBER_EXPRESSION(Shape.NODE, null),
    JS_NAME(Shape.NODE, null),
    JSX_TAG_EXPRESSION(Shape.NODE, null),
    JSX_ELEMENT(Shape.NODE, null),
    JSX_OPENING_ELEMENT(Shape.NODE, null),
    JSX_CLOSING_ELEMENT(Shape.NODE, null),
    JSX_SELF_CLOSING_ELEMENT(Shape.NODE, null),
    JSX_NAME(Shape.NODE, null),
    JSX_REFERENCE_IDENTIFIER(Shape.NODE, null),
    JSX_MEMBER_NAME(Shape.NODE, null),
    JSX_ATTRIBUTE(Shape.NODE, null),
    JSX_ATTRIBUTE_INITIALIZER_CLAUSE(Shape.NODE, null),
    JSX_STRING(Shape.NODE, null),
    JSX_EXPRESSION_ATTRIBUTE_VALUE(Shape.NODE, null),
    JSX_TEXT(Shape.NODE, null),
    JSX_EXPRESSION_CHILD(Shape.NODE, null),
    TS_TYPE_ARGUMENTS(Shape.NODE, null),
    TS_REFERENCE_TYPE(Shape.NODE, null),

    // Lists
    JS_MODULE_ITEM_LIST(Shape.LIST, null),
    JSX_ATTRIBUTE_LIST(Shape.LIST, null),
    JSX_CHILD_LIST(Shape.LIST, null),
    TS_TYPE_ARGUMENT_LIST(Shape.LIST, null),

    // Error recovery
    JS_BOGUS(Shape.BOGUS, null),
    JS_BOGUS_EXPRESSION(Shape.BOGUS, null);

    private enum Shape { TOKEN, NODE, LIST, BOGUS }

    private final Shape shape;
    private final String fixedText;

    SyntaxKind(Shape shape, String fixedText) {
        this.shape = shape;
        this.fixedText = fixedText;
    }

    public boolean isToken() {
        return shape == Shape.TOKEN;
    }

    public boolean isNode() {
        return shape != Shape.TOKEN;
    }

    public boolean isList() {
        return shape == Shape.LIST;
    }

    public boolean isBogus() {
        return shape == Shape.BOGUS;
    }

    /**
     * The only text a token of this kind may have, or {@code null} for kinds with variable text.
     */
    public String fixedText() {
        return fixedText;
    }

    public boolean hasFixedText() {
        return fixedText != null;
    }
}
