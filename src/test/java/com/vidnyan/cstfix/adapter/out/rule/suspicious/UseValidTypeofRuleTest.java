package com.vidnyan.cstfix.adapter.out.rule.suspicious;

import com.vidnyan.cstfix.domain.rule.AnalyzerOptions;
import com.vidnyan.cstfix.domain.rule.DiagnosticNote;
import com.vidnyan.cstfix.domain.rule.RuleConfiguration;
import com.vidnyan.cstfix.domain.rule.RuleDiagnostic;
import com.vidnyan.cstfix.domain.rule.RuleSignal;
import com.vidnyan.cstfix.domain.rule.Severity;
import com.vidnyan.cstfix.domain.syntax.QuoteStyle;
import com.vidnyan.cstfix.domain.syntax.TextRange;
import com.vidnyan.cstfix.support.RuleTestSupport;
import com.vidnyan.cstfix.support.SnippetParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UseValidTypeofRuleTest {

    private final UseValidTypeofRule rule = new UseValidTypeofRule();

    @Test
    void run_ShouldAcceptValidTypeNames() {
        assertTrue(RuleTestSupport.run(rule, "typeof foo === \"string\"").isEmpty());
        assertTrue(RuleTestSupport.run(rule, "typeof foo == 'undefined'").isEmpty());
        assertTrue(RuleTestSupport.run(rule, "\"bigint\" !== typeof foo").isEmpty());
    }

    @Test
    void run_ShouldAcceptComparisonOfTwoTypeofs() {
        assertTrue(RuleTestSupport.run(rule, "typeof foo === typeof bar").isEmpty());
    }

    @Test
    void run_ShouldIgnoreNonEqualityOperators() {
        assertTrue(RuleTestSupport.run(rule, "typeof foo < \"strnig\"").isEmpty());
        assertTrue(RuleTestSupport.run(rule, "typeof foo + baz").isEmpty());
    }

    @Test
    void run_ShouldIgnoreComparisonsWithoutTypeof() {
        assertTrue(RuleTestSupport.run(rule, "foo === \"strnig\"").isEmpty());
        assertTrue(RuleTestSupport.run(rule, "!foo === baz").isEmpty());
    }

    @Test
    void misspelledLiteral_ShouldReportAndSuggestClosestTypeName() {
        // Act
        List<RuleSignal> signals = RuleTestSupport.run(rule, "typeof foo === \"strnig\"");

        // Assert
        assertEquals(1, signals.size());
        RuleDiagnostic diagnostic = signals.get(0).diagnostic();
        assertEquals("lint/suspicious/useValidTypeof", diagnostic.category());
        assertEquals(UseValidTypeofRule.TITLE, diagnostic.message());
        assertEquals(new TextRange(15, 23), diagnostic.range());
        assertEquals(List.of(DiagnosticNote.of("not a valid type name")), diagnostic.notes());
        assertEquals("Invalid `typeof` comparison value: \"strnig\" is not a valid type name",
                diagnostic.fullMessage());
        assertEquals("typeof foo === \"string\"", RuleTestSupport.fixOnce(rule, "typeof foo === \"strnig\""));
    }

    @Test
    void misspelledLiteral_OnLeftSide_ShouldBeFixed() {
        assertEquals("\"number\" == typeof foo", RuleTestSupport.fixOnce(rule, "\"nunber\" == typeof foo"));
    }

    @Test
    void wrongCaseLiteral_ShouldBeLowercased() {
        assertEquals("typeof foo === \"string\"", RuleTestSupport.fixOnce(rule, "typeof foo === \"String\""));
    }

    @Test
    void unrecognizableLiteral_ShouldReportWithoutFix() {
        // Act
        List<RuleSignal> signals = RuleTestSupport.run(rule, "typeof foo === \"xyzzy\"");

        // Assert
        assertEquals(1, signals.size());
        assertFalse(signals.get(0).hasAction());
    }

    @Test
    void nonStringLiteral_ShouldReportInvalidExpression() {
        // Act
        List<RuleSignal> signals = RuleTestSupport.run(rule, "typeof foo === 12");

        // Assert
        assertEquals(1, signals.size());
        RuleDiagnostic diagnostic = signals.get(0).diagnostic();
        assertEquals("not a string literal", diagnostic.notes().get(0).message());
        assertEquals("Invalid `typeof` comparison value: this expression is not a string literal",
                diagnostic.fullMessage());
        assertFalse(signals.get(0).hasAction());
    }

    @Test
    void undefinedIdentifier_ShouldBeQuoted() {
        // Act
        List<RuleSignal> signals = RuleTestSupport.run(rule, "typeof foo === undefined");

        // Assert
        assertEquals(1, signals.size());
        assertEquals(new TextRange(15, 24), signals.get(0).diagnostic().range());
        assertEquals("typeof foo === \"undefined\"", RuleTestSupport.fixOnce(rule, "typeof foo === undefined"));
    }

    @Test
    void capitalizedIdentifier_ShouldBeQuotedInLowercase() {
        assertEquals("typeof foo !== \"object\"", RuleTestSupport.fixOnce(rule, "typeof foo !== Object"));
    }

    @Test
    void arbitraryIdentifier_ShouldReportWithoutFix() {
        // Act
        List<RuleSignal> signals = RuleTestSupport.run(rule, "typeof foo === baz");

        // Assert
        assertEquals(1, signals.size());
        assertFalse(signals.get(0).hasAction());
        assertEquals("not a string literal", signals.get(0).diagnostic().notes().get(0).message());
    }

    @Test
    void otherUnaryExpression_ShouldReportTheNonTypeofSide() {
        // Act
        List<RuleSignal> signals = RuleTestSupport.run(rule, "typeof foo === -bar");

        // Assert
        assertEquals(1, signals.size());
        assertEquals(new TextRange(15, 19), signals.get(0).diagnostic().range());
        assertFalse(signals.get(0).hasAction());
    }

    @Test
    void anyOtherExpression_ShouldReportWithoutFix() {
        // Act
        List<RuleSignal> signals = RuleTestSupport.run(rule, "typeof foo == bar.baz");

        // Assert
        assertEquals(1, signals.size());
        assertFalse(signals.get(0).hasAction());
    }

    @Test
    void fix_ShouldUseConfiguredQuoteStyle() {
        // Arrange
        AnalyzerOptions options = AnalyzerOptions.defaults().withPreferredQuote(QuoteStyle.SINGLE);

        // Act
        String fixed = RuleTestSupport.fixOnce(rule, "typeof foo === undefined", options);

        // Assert
        assertEquals("typeof foo === 'undefined'", fixed);
    }

    @Test
    void fix_ShouldKeepSurroundingTrivia() {
        assertEquals("typeof foo === \"undefined\" // check\n",
                RuleTestSupport.fixOnce(rule, "typeof foo === undefined // check\n"));
        assertEquals("typeof foo == /* t */ \"string\";",
                RuleTestSupport.fixOnce(rule, "typeof foo == /* t */ \"strinG\";"));
    }

    @Test
    void configuredSeverity_ShouldApplyToDiagnostic() {
        // Arrange
        AnalyzerOptions options = AnalyzerOptions.defaults()
                .withRule("useValidTypeof", RuleConfiguration.at(Severity.WARN));

        // Act
        List<RuleSignal> signals = RuleTestSupport.run(rule, SnippetParser.parse("typeof foo === baz"), options);

        // Assert
        assertEquals(Severity.WARN, signals.get(0).diagnostic().severity());
    }

    @Test
    void fixedOutput_ShouldNotMatchAgain() {
        String fixed = RuleTestSupport.fixOnce(rule, "typeof foo === \"fucntion\"");

        assertEquals("typeof foo === \"function\"", fixed);
        assertTrue(RuleTestSupport.run(rule, fixed).isEmpty());
    }
}
