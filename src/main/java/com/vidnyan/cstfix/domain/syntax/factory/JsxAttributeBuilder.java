package com.vidnyan.cstfix.domain.syntax.factory;

import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxNode;

public final class JsxAttributeBuilder {

    private final SyntaxNode name;
    private SyntaxNode initializer;

    JsxAttributeBuilder(SyntaxNode name) {
        this.name = name;
    }

    public JsxAttributeBuilder withInitializer(SyntaxNode initializer) {
        this.initializer = initializer;
        return this;
    }

    public SyntaxNode build() {
        return SyntaxNode.create(SyntaxKind.JSX_ATTRIBUTE, name, initializer);
    }
}
