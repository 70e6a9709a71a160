package com.vidnyan.cstfix.domain.syntax.factory;

import com.vidnyan.cstfix.domain.syntax.QuoteStyle;
import com.vidnyan.cstfix.domain.syntax.SyntaxElement;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxNode;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;
import com.vidnyan.cstfix.domain.syntax.Trivia;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.vidnyan.cstfix.domain.syntax.SyntaxKind.*;

/**
 * Builds detached, well-formed tree fragments.
 * One method per node kind, taking exactly its slots; optional slots are attached through builders.
 * Passing a child of the wrong kind throws {@link com.vidnyan.cstfix.domain.syntax.SyntaxConstructionException}.
 */
public final class SyntaxFactory {

    private SyntaxFactory() {
    }

    // Tokens

    /**
     * Trivia-free token of a fixed-text kind.
     */
    public static SyntaxToken token(SyntaxKind kind) {
        if (!kind.hasFixedText()) {
            throw new IllegalArgumentException(kind + " has no fixed text; pass it explicitly");
        }
        return SyntaxToken.detached(kind, kind.fixedText(), Trivia.EMPTY, Trivia.EMPTY);
    }

    public static SyntaxToken token(SyntaxKind kind, String text, Trivia leading, Trivia trailing) {
        return SyntaxToken.detached(kind, text, leading, trailing);
    }

    public static SyntaxToken ident(String text) {
        return SyntaxToken.detached(IDENT, text, Trivia.EMPTY, Trivia.EMPTY);
    }

    public static SyntaxToken jsxIdent(String text) {
        return SyntaxToken.detached(JSX_IDENT, text, Trivia.EMPTY, Trivia.EMPTY);
    }

    /**
     * String literal token holding {@code value} between the given quotes.
     * The value is taken verbatim; callers escape it beforehand when needed.
     */
    public static SyntaxToken jsStringLiteral(String value, QuoteStyle quote) {
        char q = quote.quote();
        return SyntaxToken.detached(JS_STRING_LITERAL, q + value + q, Trivia.EMPTY, Trivia.EMPTY);
    }

    public static SyntaxToken jsStringLiteral(String value) {
        return jsStringLiteral(value, QuoteStyle.DOUBLE);
    }

    public static SyntaxToken jsStringLiteralSingleQuotes(String value) {
        return jsStringLiteral(value, QuoteStyle.SINGLE);
    }

    public static SyntaxToken jsNumberLiteral(String text) {
        return SyntaxToken.detached(JS_NUMBER_LITERAL, text, Trivia.EMPTY, Trivia.EMPTY);
    }

    public static SyntaxToken eof() {
        return token(EOF);
    }

    // JavaScript

    public static SyntaxNode jsModule(SyntaxNode items, SyntaxToken eof) {
        return node(JS_MODULE, items, eof);
    }

    public static SyntaxNode jsModuleItemList(List<SyntaxNode> items) {
        return list(JS_MODULE_ITEM_LIST, items);
    }

    public static JsExpressionStatementBuilder jsExpressionStatement(SyntaxNode expression) {
        return new JsExpressionStatementBuilder(require(expression, "expression"));
    }

    public static SyntaxNode jsBinaryExpression(SyntaxNode left, SyntaxToken operator, SyntaxNode right) {
        return node(JS_BINARY_EXPRESSION, left, operator, right);
    }

    public static SyntaxNode jsUnaryExpression(SyntaxToken operator, SyntaxNode argument) {
        return node(JS_UNARY_EXPRESSION, operator, argument);
    }

    public static SyntaxNode jsStringLiteralExpression(SyntaxToken value) {
        return node(JS_STRING_LITERAL_EXPRESSION, value);
    }

    public static SyntaxNode jsNumberLiteralExpression(SyntaxToken value) {
        return node(JS_NUMBER_LITERAL_EXPRESSION, value);
    }

    public static SyntaxNode jsBooleanLiteralExpression(SyntaxToken value) {
        return node(JS_BOOLEAN_LITERAL_EXPRESSION, value);
    }

    public static SyntaxNode jsNullLiteralExpression(SyntaxToken value) {
        return node(JS_NULL_LITERAL_EXPRESSION, value);
    }

    public static SyntaxNode jsIdentifierExpression(SyntaxNode name) {
        return node(JS_IDENTIFIER_EXPRESSION, name);
    }

    public static SyntaxNode jsReferenceIdentifier(SyntaxToken value) {
        return node(JS_REFERENCE_IDENTIFIER, value);
    }

    public static SyntaxNode jsParenthesizedExpression(SyntaxToken lParen, SyntaxNode expression, SyntaxToken rParen) {
        return node(JS_PARENTHESIZED_EXPRESSION, lParen, expression, rParen);
    }

    public static SyntaxNode jsStaticMemberExpression(SyntaxNode object, SyntaxToken dot, SyntaxNode member) {
        return node(JS_STATIC_MEMBER_EXPRESSION, object, dot, member);
    }

    public static SyntaxNode jsName(SyntaxToken value) {
        return node(JS_NAME, value);
    }

    // JSX

    public static SyntaxNode jsxTagExpression(SyntaxNode tag) {
        return node(JSX_TAG_EXPRESSION, tag);
    }

    public static SyntaxNode jsxElement(SyntaxNode openingElement, SyntaxNode children, SyntaxNode closingElement) {
        return node(JSX_ELEMENT, openingElement, children, closingElement);
    }

    public static JsxOpeningElementBuilder jsxOpeningElement(SyntaxToken lAngle, SyntaxNode name,
                                                             SyntaxNode attributes, SyntaxToken rAngle) {
        return new JsxOpeningElementBuilder(
                require(lAngle, "lAngle"), require(name, "name"),
                require(attributes, "attributes"), require(rAngle, "rAngle"));
    }

    public static SyntaxNode jsxClosingElement(SyntaxToken lAngle, SyntaxToken slash, SyntaxNode name, SyntaxToken rAngle) {
        return node(JSX_CLOSING_ELEMENT, lAngle, slash, name, rAngle);
    }

    public static JsxSelfClosingElementBuilder jsxSelfClosingElement(SyntaxToken lAngle, SyntaxNode name,
                                                                     SyntaxNode attributes, SyntaxToken slash,
                                                                     SyntaxToken rAngle) {
        return new JsxSelfClosingElementBuilder(
                require(lAngle, "lAngle"), require(name, "name"), require(attributes, "attributes"),
                require(slash, "slash"), require(rAngle, "rAngle"));
    }

    public static SyntaxNode jsxName(SyntaxToken value) {
        return node(JSX_NAME, value);
    }

    public static SyntaxNode jsxReferenceIdentifier(SyntaxToken value) {
        return node(JSX_REFERENCE_IDENTIFIER, value);
    }

    public static SyntaxNode jsxMemberName(SyntaxNode object, SyntaxToken dot, SyntaxNode member) {
        return node(JSX_MEMBER_NAME, object, dot, member);
    }

    public static SyntaxNode jsxAttributeList(List<SyntaxNode> attributes) {
        return list(JSX_ATTRIBUTE_LIST, attributes);
    }

    public static JsxAttributeBuilder jsxAttribute(SyntaxNode name) {
        return new JsxAttributeBuilder(require(name, "name"));
    }

    public static SyntaxNode jsxAttributeInitializerClause(SyntaxToken eq, SyntaxNode value) {
        return node(JSX_ATTRIBUTE_INITIALIZER_CLAUSE, eq, value);
    }

    public static SyntaxNode jsxString(SyntaxToken value) {
        return node(JSX_STRING, value);
    }

    public static SyntaxNode jsxExpressionAttributeValue(SyntaxToken lCurly, SyntaxNode expression, SyntaxToken rCurly) {
        return node(JSX_EXPRESSION_ATTRIBUTE_VALUE, lCurly, expression, rCurly);
    }

    public static SyntaxNode jsxChildList(List<SyntaxNode> children) {
        return list(JSX_CHILD_LIST, children);
    }

    public static SyntaxNode jsxText(SyntaxToken value) {
        return node(JSX_TEXT, value);
    }

    public static SyntaxNode jsxExpressionChild(SyntaxToken lCurly, SyntaxNode expression, SyntaxToken rCurly) {
        return SyntaxNode.create(JSX_EXPRESSION_CHILD,
                require(lCurly, "lCurly"), expression, require(rCurly, "rCurly"));
    }

    // TypeScript type arguments

    public static SyntaxNode tsTypeArguments(SyntaxToken lAngle, SyntaxNode arguments, SyntaxToken rAngle) {
        return node(TS_TYPE_ARGUMENTS, lAngle, arguments, rAngle);
    }

    /**
     * Separated list: {@code separators} must hold one comma fewer than {@code elements},
     * or exactly as many when the list has a trailing comma.
     */
    public static SyntaxNode tsTypeArgumentList(List<SyntaxNode> elements, List<SyntaxToken> separators) {
        if (separators.size() != elements.size() - 1 && separators.size() != elements.size()) {
            throw new IllegalArgumentException(
                    "Expected " + (elements.size() - 1) + " separators, got " + separators.size());
        }
        List<SyntaxElement> slots = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            slots.add(require(elements.get(i), "element"));
            if (i < separators.size()) {
                slots.add(require(separators.get(i), "separator"));
            }
        }
        return SyntaxNode.create(TS_TYPE_ARGUMENT_LIST, slots);
    }

    public static SyntaxNode tsReferenceType(SyntaxNode name) {
        return node(TS_REFERENCE_TYPE, name);
    }

    // Helpers

    private static SyntaxNode node(SyntaxKind kind, SyntaxElement... slots) {
        for (SyntaxElement slot : slots) {
            Objects.requireNonNull(slot, () -> "Missing required child of " + kind);
        }
        return SyntaxNode.create(kind, slots);
    }

    private static SyntaxNode list(SyntaxKind kind, List<SyntaxNode> elements) {
        return SyntaxNode.create(kind, elements);
    }

    static <T> T require(T value, String slot) {
        return Objects.requireNonNull(value, () -> "Missing required child '" + slot + "'");
    }
}
