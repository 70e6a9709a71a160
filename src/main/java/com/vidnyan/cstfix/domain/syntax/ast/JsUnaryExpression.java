package com.vidnyan.cstfix.domain.syntax.ast;

import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;

import java.util.Optional;

public final class JsUnaryExpression extends AstNode {

    public static final int OPERATOR = 0;
    public static final int ARGUMENT = 1;

    public JsUnaryExpression(SyntaxCursor syntax) {
        super(syntax, SyntaxKind.JS_UNARY_EXPRESSION);
    }

    public static Optional<JsUnaryExpression> cast(SyntaxCursor syntax) {
        return syntax.kind() == SyntaxKind.JS_UNARY_EXPRESSION
                ? Optional.of(new JsUnaryExpression(syntax))
                : Optional.empty();
    }

    public Optional<JsUnaryOperator> operator() {
        return tokenSlot(OPERATOR).flatMap(token -> JsUnaryOperator.fromToken(token.kind()));
    }

    public boolean isTypeof() {
        return operator().filter(op -> op == JsUnaryOperator.TYPEOF).isPresent();
    }

    public Optional<SyntaxCursor> argument() {
        return slot(ARGUMENT);
    }
}
