package com.vidnyan.cstfix.domain.syntax.ast;

import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;

import java.util.Optional;

public final class JsIdentifierExpression extends AstNode {

    public static final int NAME = 0;

    public JsIdentifierExpression(SyntaxCursor syntax) {
        super(syntax, SyntaxKind.JS_IDENTIFIER_EXPRESSION);
    }

    public static Optional<JsIdentifierExpression> cast(SyntaxCursor syntax) {
        return syntax.kind() == SyntaxKind.JS_IDENTIFIER_EXPRESSION
                ? Optional.of(new JsIdentifierExpression(syntax))
                : Optional.empty();
    }

    /**
     * Identifier text without trivia.
     */
    public Optional<String> name() {
        return slot(NAME)
                .flatMap(reference -> reference.child(0))
                .filter(SyntaxCursor::isToken)
                .map(token -> token.token().text());
    }
}
