package com.vidnyan.cstfix.domain.syntax.factory;

import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxNode;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;

/**
 * Builder for {@code <Name<T> attr />}; type arguments are optional.
 */
public final class JsxSelfClosingElementBuilder {

    private final SyntaxToken lAngle;
    private final SyntaxNode name;
    private final SyntaxNode attributes;
    private final SyntaxToken slash;
    private final SyntaxToken rAngle;
    private SyntaxNode typeArguments;

    JsxSelfClosingElementBuilder(SyntaxToken lAngle, SyntaxNode name, SyntaxNode attributes,
                                 SyntaxToken slash, SyntaxToken rAngle) {
        this.lAngle = lAngle;
        this.name = name;
        this.attributes = attributes;
        this.slash = slash;
        this.rAngle = rAngle;
    }

    public JsxSelfClosingElementBuilder withTypeArguments(SyntaxNode typeArguments) {
        this.typeArguments = typeArguments;
        return this;
    }

    public SyntaxNode build() {
        return SyntaxNode.create(SyntaxKind.JSX_SELF_CLOSING_ELEMENT,
                lAngle, name, typeArguments, attributes, slash, rAngle);
    }
}
