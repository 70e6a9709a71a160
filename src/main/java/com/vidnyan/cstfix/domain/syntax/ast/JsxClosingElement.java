package com.vidnyan.cstfix.domain.syntax.ast;

import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JsxClosingElement extends AstNode {

    public static final int L_ANGLE = 0;
    public static final int SLASH = 1;
    public static final int NAME = 2;
    public static final int R_ANGLE = 3;

    public JsxClosingElement(SyntaxCursor syntax) {
        super(syntax, SyntaxKind.JSX_CLOSING_ELEMENT);
    }

    public Optional<SyntaxToken> rAngleToken() {
        return tokenSlot(R_ANGLE);
    }

    /**
     * Every token of the closing tag in document order, name tokens included.
     */
    public List<SyntaxToken> tokens() {
        List<SyntaxToken> tokens = new ArrayList<>();
        collect(syntax(), tokens);
        return tokens;
    }

    private static void collect(SyntaxCursor cursor, List<SyntaxToken> tokens) {
        if (cursor.isToken()) {
            tokens.add(cursor.token());
            return;
        }
        for (SyntaxCursor child : cursor.children()) {
            collect(child, tokens);
        }
    }
}
