package com.vidnyan.cstfix.domain.syntax.ast;

import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxNode;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;
import com.vidnyan.cstfix.domain.syntax.SyntaxTree;
import com.vidnyan.cstfix.domain.syntax.TextRange;

import java.util.Optional;

/**
 * Typed, read-only view over a positioned node.
 * Slot accessors return {@link Optional#empty()} for missing children so rules can skip
 * matches from recovery-mode trees instead of failing.
 */
public abstract class AstNode {

    private final SyntaxCursor syntax;

    protected AstNode(SyntaxCursor syntax, SyntaxKind expected) {
        if (syntax.kind() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " but got " + syntax.kind());
        }
        this.syntax = syntax;
    }

    public SyntaxCursor syntax() {
        return syntax;
    }

    public SyntaxNode node() {
        return syntax.node();
    }

    public SyntaxTree tree() {
        return syntax.tree();
    }

    /**
     * Trimmed range: trivia before the first and after the last token is excluded.
     */
    public TextRange range() {
        return syntax.textRange();
    }

    public String text() {
        return syntax.text();
    }

    protected Optional<SyntaxCursor> slot(int index) {
        return syntax.child(index);
    }

    protected Optional<SyntaxToken> tokenSlot(int index) {
        return slot(index).filter(SyntaxCursor::isToken).map(SyntaxCursor::token);
    }

    protected Optional<SyntaxNode> nodeSlot(int index) {
        return slot(index).filter(SyntaxCursor::isNode).map(SyntaxCursor::node);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + range();
    }
}
