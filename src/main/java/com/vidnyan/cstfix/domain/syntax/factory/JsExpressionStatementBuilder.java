package com.vidnyan.cstfix.domain.syntax.factory;

import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxNode;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;

public final class JsExpressionStatementBuilder {

    private final SyntaxNode expression;
    private SyntaxToken semicolon;

    JsExpressionStatementBuilder(SyntaxNode expression) {
        this.expression = expression;
    }

    public JsExpressionStatementBuilder withSemicolon(SyntaxToken semicolon) {
        this.semicolon = semicolon;
        return this;
    }

    public SyntaxNode build() {
        return SyntaxNode.create(SyntaxKind.JS_EXPRESSION_STATEMENT, expression, semicolon);
    }
}
