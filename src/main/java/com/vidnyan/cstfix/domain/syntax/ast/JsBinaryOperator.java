package com.vidnyan.cstfix.domain.syntax.ast;

import com.vidnyan.cstfix.domain.syntax.SyntaxKind;

import java.util.Optional;

public enum JsBinaryOperator {
    EQUALITY(SyntaxKind.EQ2),
    STRICT_EQUALITY(SyntaxKind.EQ3),
    INEQUALITY(SyntaxKind.NEQ),
    STRICT_INEQUALITY(SyntaxKind.NEQ2),
    LESS_THAN(SyntaxKind.L_ANGLE),
    GREATER_THAN(SyntaxKind.R_ANGLE),
    LESS_THAN_OR_EQUAL(SyntaxKind.LTEQ),
    GREATER_THAN_OR_EQUAL(SyntaxKind.GTEQ),
    PLUS(SyntaxKind.PLUS),
    MINUS(SyntaxKind.MINUS),
    TIMES(SyntaxKind.STAR),
    DIVIDE(SyntaxKind.SLASH),
    LOGICAL_AND(SyntaxKind.AMP2),
    LOGICAL_OR(SyntaxKind.PIPE2);

    private final SyntaxKind tokenKind;

    JsBinaryOperator(SyntaxKind tokenKind) {
        this.tokenKind = tokenKind;
    }

    public SyntaxKind tokenKind() {
        return tokenKind;
    }

    public boolean isEqualityCheck() {
        return this == EQUALITY || this == STRICT_EQUALITY || this == INEQUALITY || this == STRICT_INEQUALITY;
    }

    public static Optional<JsBinaryOperator> fromToken(SyntaxKind kind) {
        for (JsBinaryOperator operator : values()) {
            if (operator.tokenKind == kind) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
