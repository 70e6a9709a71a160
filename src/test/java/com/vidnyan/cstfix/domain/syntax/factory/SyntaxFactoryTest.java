package com.vidnyan.cstfix.domain.syntax.factory;

import com.vidnyan.cstfix.domain.syntax.QuoteStyle;
import com.vidnyan.cstfix.domain.syntax.SyntaxConstructionException;
import com.vidnyan.cstfix.domain.syntax.SyntaxKind;
import com.vidnyan.cstfix.domain.syntax.SyntaxNode;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;
import com.vidnyan.cstfix.domain.syntax.Trivia;
import com.vidnyan.cstfix.domain.syntax.TriviaPiece;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxFactoryTest {

    @Test
    void jsxSelfClosingElement_ShouldAssembleSlotsInOrder() {
        // Arrange
        SyntaxNode name = SyntaxFactory.jsxName(SyntaxFactory.jsxIdent("div"));
        SyntaxToken slash = SyntaxFactory.token(SyntaxKind.SLASH, "/", Trivia.of(TriviaPiece.whitespace(1)), Trivia.EMPTY);

        // Act
        SyntaxNode element = SyntaxFactory.jsxSelfClosingElement(
                SyntaxFactory.token(SyntaxKind.L_ANGLE),
                name,
                SyntaxFactory.jsxAttributeList(List.of()),
                slash,
                SyntaxFactory.token(SyntaxKind.R_ANGLE)).build();

        // Assert
        assertEquals(SyntaxKind.JSX_SELF_CLOSING_ELEMENT, element.kind());
        assertEquals(6, element.slotCount());
        assertNull(element.slot(2));
        assertEquals("<div />", element.fullText());
    }

    @Test
    void builder_ShouldAttachOptionalChildren() {
        // Arrange
        SyntaxNode typeArguments = SyntaxFactory.tsTypeArguments(
                SyntaxFactory.token(SyntaxKind.L_ANGLE),
                SyntaxFactory.tsTypeArgumentList(
                        List.of(SyntaxFactory.tsReferenceType(SyntaxFactory.jsReferenceIdentifier(SyntaxFactory.ident("T")))),
                        List.of()),
                SyntaxFactory.token(SyntaxKind.R_ANGLE));

        // Act
        SyntaxNode opening = SyntaxFactory.jsxOpeningElement(
                        SyntaxFactory.token(SyntaxKind.L_ANGLE),
                        SyntaxFactory.jsxReferenceIdentifier(SyntaxFactory.jsxIdent("Foo")),
                        SyntaxFactory.jsxAttributeList(List.of()),
                        SyntaxFactory.token(SyntaxKind.R_ANGLE))
                .withTypeArguments(typeArguments)
                .build();
        SyntaxNode statement = SyntaxFactory.jsExpressionStatement(
                        SyntaxFactory.jsNumberLiteralExpression(SyntaxFactory.jsNumberLiteral("1")))
                .withSemicolon(SyntaxFactory.token(SyntaxKind.SEMICOLON))
                .build();

        // Assert
        assertEquals("<Foo<T>>", opening.fullText());
        assertEquals("1;", statement.fullText());
    }

    @Test
    void jsStringLiteral_ShouldUseRequestedQuote() {
        assertEquals("\"a\"", SyntaxFactory.jsStringLiteral("a").text());
        assertEquals("'a'", SyntaxFactory.jsStringLiteral("a", QuoteStyle.SINGLE).text());
        assertEquals("'a'", SyntaxFactory.jsStringLiteralSingleQuotes("a").text());
    }

    @Test
    void factory_ShouldRejectChildOfWrongKind() {
        // Arrange
        SyntaxNode notAnExpression = SyntaxFactory.jsxName(SyntaxFactory.jsxIdent("div"));

        // Act & Assert
        SyntaxConstructionException e = assertThrows(SyntaxConstructionException.class,
                () -> SyntaxFactory.jsUnaryExpression(SyntaxFactory.token(SyntaxKind.TYPEOF_KW), notAnExpression));
        assertTrue(e.getMessage().contains("JS_UNARY_EXPRESSION"));
        assertInstanceOf(IllegalArgumentException.class, e);
    }

    @Test
    void factory_ShouldRejectMissingRequiredChild() {
        assertThrows(NullPointerException.class,
                () -> SyntaxFactory.jsxElement(null, SyntaxFactory.jsxChildList(List.of()), null));
    }

    @Test
    void create_ShouldTolerateMissingRequiredChildForRecoveryTrees() {
        // Act
        SyntaxNode binary = SyntaxNode.create(SyntaxKind.JS_BINARY_EXPRESSION,
                SyntaxFactory.jsNumberLiteralExpression(SyntaxFactory.jsNumberLiteral("1")),
                SyntaxFactory.token(SyntaxKind.EQ3),
                null);

        // Assert
        assertEquals("1===", binary.fullText());
        assertNull(binary.slot(2));
    }

    @Test
    void tsTypeArgumentList_ShouldInterleaveSeparators() {
        // Act
        SyntaxNode list = SyntaxFactory.tsTypeArgumentList(
                List.of(SyntaxFactory.tsReferenceType(SyntaxFactory.jsReferenceIdentifier(SyntaxFactory.ident("A"))),
                        SyntaxFactory.tsReferenceType(SyntaxFactory.jsReferenceIdentifier(SyntaxFactory.ident("B")))),
                List.of(SyntaxFactory.token(SyntaxKind.COMMA)));

        // Assert
        assertEquals(3, list.slotCount());
        assertEquals("A,B", list.fullText());
    }

    @Test
    void equalNodes_ShouldCompareStructurally() {
        SyntaxNode a = SyntaxFactory.jsStringLiteralExpression(SyntaxFactory.jsStringLiteral("x"));
        SyntaxNode b = SyntaxFactory.jsStringLiteralExpression(SyntaxFactory.jsStringLiteral("x"));

        assertEquals(a, b);
        assertNotSame(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
