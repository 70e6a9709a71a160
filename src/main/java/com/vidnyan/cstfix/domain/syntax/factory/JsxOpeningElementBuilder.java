package com.vidnyan.cstfix.domain.syntax.factory;

import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxNode;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;

/**
 * Builder for {@code <Name<T> attr>}.
 */
public final class JsxOpeningElementBuilder {

    private final SyntaxToken lAngle;
    private final SyntaxNode name;
    private final SyntaxNode attributes;
    private final SyntaxToken rAngle;
    private SyntaxNode typeArguments;

    JsxOpeningElementBuilder(SyntaxToken lAngle, SyntaxNode name, SyntaxNode attributes, SyntaxToken rAngle) {
        this.lAngle = lAngle;
        this.name = name;
        this.attributes = attributes;
        this.rAngle = rAngle;
    }

    public JsxOpeningElementBuilder withTypeArguments(SyntaxNode typeArguments) {
        this.typeArguments = typeArguments;
        return this;
    }

    public SyntaxNode build() {
        return SyntaxNode.create(SyntaxKind.JSX_OPENING_ELEMENT, lAngle, name, typeArguments, attributes, rAngle);
    }
}
