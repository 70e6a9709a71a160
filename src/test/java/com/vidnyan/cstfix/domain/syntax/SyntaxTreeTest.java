package com.vidnyan.cstfix.domain.syntax;

import com.vidnyan.cstfix.support.SnippetParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreeTest {

    @Test
    void text_ShouldReproduceSourceExactly() {
        List<String> sources = List.of(
                "typeof foo === \"string\";\n",
                "  // leading comment\n<div  foo='x'\n  bar={1 + 2}>\n  hello {name}\n</div> /* tail */\n",
                "a ==  b;\r\nc\n\n",
                "<Foo.Bar<T, U> />",
                "");

        for (String source : sources) {
            assertEquals(source, SnippetParser.parse(source).text());
        }
    }

    @Test
    void trailingTrivia_ShouldStopBeforeLineBreak() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse("a // one\n// two\nb");
        SyntaxCursor a = tree.rootCursor().firstToken().orElseThrow();

        // Act
        SyntaxCursor b = a.nextToken().orElseThrow();

        // Assert
        assertEquals(" // one", a.token().trailingTrivia().text());
        assertEquals("\n// two\n", b.token().leadingTrivia().text());
        assertEquals("b", b.text());
    }

    @Test
    void textRange_ShouldExcludeOuterTrivia() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse("  x === y  ");
        SyntaxCursor statement = tree.rootCursor().child(0).orElseThrow().children().get(0);

        // Act & Assert
        assertEquals(SyntaxKind.JS_EXPRESSION_STATEMENT, statement.kind());
        assertEquals(new TextRange(0, 11), statement.fullRange());
        assertEquals(new TextRange(2, 9), statement.textRange());
        assertEquals("x === y", statement.text());
    }

    @Test
    void previousToken_ShouldWalkUpThroughAncestors() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse("<div foo=\"x\"></div>");
        SyntaxCursor opening = tree.rootCursor().firstToken().orElseThrow()
                .ancestor(SyntaxKind.JSX_OPENING_ELEMENT).orElseThrow();
        SyntaxCursor rAngle = opening.lastToken().orElseThrow();

        // Act
        SyntaxCursor previous = rAngle.previousToken().orElseThrow();

        // Assert
        assertEquals(SyntaxKind.JSX_STRING_LITERAL, previous.kind());
        assertEquals("\"x\"", previous.text());
        assertEquals(SyntaxKind.L_ANGLE, rAngle.nextToken().orElseThrow().kind());
    }

    @Test
    void firstToken_ShouldReturnEmptyWhenNoTokenExists() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse("<div></div>");
        SyntaxCursor childList = tree.rootCursor().firstToken().orElseThrow()
                .ancestor(SyntaxKind.JSX_ELEMENT).orElseThrow()
                .child(1).orElseThrow();

        // Act & Assert
        assertEquals(SyntaxKind.JSX_CHILD_LIST, childList.kind());
        assertTrue(childList.firstToken().isEmpty());
        assertEquals(TextRange.empty(5), childList.textRange());
    }

    @Test
    void path_ShouldListSlotIndexesFromRoot() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse("a === b");
        SyntaxCursor b = tree.rootCursor().lastToken().orElseThrow().previousToken().orElseThrow();

        // Act & Assert: module > items > statement > binary > right > reference > ident
        assertEquals(List.of(0, 0, 0, 2, 0, 0), b.path());
        assertEquals(6, b.depth());
    }

    @Test
    void lineIndex_ShouldResolveOneBasedPositions() {
        // Arrange
        LineIndex lines = SnippetParser.parse("a\nbb\r\nccc").lineIndex();

        // Act & Assert
        assertEquals(3, lines.lineCount());
        assertEquals(1, lines.line(0));
        assertEquals(2, lines.line(2));
        assertEquals(2, lines.column(3));
        assertEquals(3, lines.line(6));
        assertEquals(1, lines.column(6));
    }
}
