package com.vidnyan.cstfix.domain.syntax.ast;

import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;

import java.util.Optional;

/**
 * {@code left operator right}.
 */
public final class JsBinaryExpression extends AstNode {

    public static final int LEFT = 0;
    public static final int OPERATOR = 1;
    public static final int RIGHT = 2;

    public JsBinaryExpression(SyntaxCursor syntax) {
        super(syntax, SyntaxKind.JS_BINARY_EXPRESSION);
    }

    public Optional<SyntaxCursor> left() {
        return slot(LEFT).filter(SyntaxCursor::isNode);
    }

    public Optional<JsBinaryOperator> operator() {
        return tokenSlot(OPERATOR).flatMap(token -> JsBinaryOperator.fromToken(token.kind()));
    }

    public Optional<SyntaxCursor> right() {
        return slot(RIGHT).filter(SyntaxCursor::isNode);
    }
}
