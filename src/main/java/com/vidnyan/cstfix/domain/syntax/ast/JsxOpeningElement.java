package com.vidnyan.cstfix.domain.syntax.ast;

import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxNode;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;

import java.util.Optional;

public final class JsxOpeningElement extends AstNode {

    public static final int L_ANGLE = 0;
    public static final int NAME = 1;
    public static final int TYPE_ARGUMENTS = 2;
    public static final int ATTRIBUTES = 3;
    public static final int R_ANGLE = 4;

    public JsxOpeningElement(SyntaxCursor syntax) {
        super(syntax, SyntaxKind.JSX_OPENING_ELEMENT);
    }

    public Optional<SyntaxToken> lAngleToken() {
        return tokenSlot(L_ANGLE);
    }

    public Optional<SyntaxNode> name() {
        return nodeSlot(NAME);
    }

    public Optional<SyntaxNode> typeArguments() {
        return nodeSlot(TYPE_ARGUMENTS);
    }

    public Optional<SyntaxNode> attributes() {
        return nodeSlot(ATTRIBUTES);
    }

    /**
     * The closing {@code >} as a cursor, so callers can look at the token before it.
     */
    public Optional<SyntaxCursor> rAngle() {
        return slot(R_ANGLE).filter(SyntaxCursor::isToken);
    }
}
