package com.vidnyan.cstfix.domain.syntax.ast;

import com.vidnyan.cstfix.domain.syntax.SyntaxKind;

import java.util.Optional;

public enum JsUnaryOperator {
    TYPEOF(SyntaxKind.TYPEOF_KW),
    VOID(SyntaxKind.VOID_KW),
    DELETE(SyntaxKind.DELETE_KW),
    PLUS(SyntaxKind.PLUS),
    MINUS(SyntaxKind.MINUS),
    LOGICAL_NOT(SyntaxKind.BANG),
    BITWISE_NOT(SyntaxKind.TILDE);

    private final SyntaxKind tokenKind;

    JsUnaryOperator(SyntaxKind tokenKind) {
        this.tokenKind = tokenKind;
    }

    public SyntaxKind tokenKind() {
        return tokenKind;
    }

    public static Optional<JsUnaryOperator> fromToken(SyntaxKind kind) {
        for (JsUnaryOperator operator : values()) {
            if (operator.tokenKind == kind) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
