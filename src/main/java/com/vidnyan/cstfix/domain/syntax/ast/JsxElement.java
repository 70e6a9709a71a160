package com.vidnyan.cstfix.domain.syntax.ast;

import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;

import java.util.List;
import java.util.Optional;

/**
 * {@code <name attrs>children</name>}.
 */
public final class JsxElement extends AstNode {

    public static final int OPENING_ELEMENT = 0;
    public static final int CHILDREN = 1;
    public static final int CLOSING_ELEMENT = 2;

    public JsxElement(SyntaxCursor syntax) {
        super(syntax, SyntaxKind.JSX_ELEMENT);
    }

    public Optional<JsxOpeningElement> openingElement() {
        return slot(OPENING_ELEMENT).map(JsxOpeningElement::new);
    }

    public Optional<SyntaxCursor> childList() {
        return slot(CHILDREN);
    }

    /**
     * Child entries; an absent child list reads as no children.
     */
    public List<SyntaxCursor> children() {
        return childList().map(SyntaxCursor::children).orElse(List.of());
    }

    public Optional<JsxClosingElement> closingElement() {
        return slot(CLOSING_ELEMENT).map(JsxClosingElement::new);
    }
}
