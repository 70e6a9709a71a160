package com.vidnyan.cstfix.application.service;

import com.vidnyan.cstfix.AnalysisProperties;
import com.vidnyan.cstfix.adapter.out.rule.style.UseSelfClosingElementsRule;
import com.vidnyan.cstfix.adapter.out.rule.suspicious.UseValidTypeofRule;
import com.vidnyan.cstfix.application.port.in.AnalyzeSyntaxUseCase.AnalysisRequest;
import com.vidnyan.cstfix.application.port.in.AnalyzeSyntaxUseCase.AnalysisResult;
import com.vidnyan.cstfix.application.port.in.AnalyzeSyntaxUseCase.AppliedFix;
import com.vidnyan.cstfix.application.port.in.AnalyzeSyntaxUseCase.Finding;
import com.vidnyan.cstfix.application.port.in.AnalyzeSyntaxUseCase.FixMode;
import com.vidnyan.cstfix.application.port.in.AnalyzeSyntaxUseCase.FixRequest;
import com.vidnyan.cstfix.application.port.in.AnalyzeSyntaxUseCase.FixResult;
import com.vidnyan.cstfix.domain.model.Location;
import com.vidnyan.cstfix.domain.rule.Analyzer;
import com.vidnyan.cstfix.domain.rule.AnalyzerOptions;
import com.vidnyan.cstfix.domain.rule.RuleConfiguration;
import com.vidnyan.cstfix.domain.rule.Severity;
import com.vidnyan.cstfix.domain.syntax.QuoteStyle;
import com.vidnyan.cstfix.domain.syntax.SyntaxTree;
import com.vidnyan.cstfix.support.SnippetParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisApplicationServiceTest {

    private static final String SOURCE = "<div></div>;\ntypeof x === undefined;\n";

    private AnalysisProperties properties;
    private AnalysisApplicationService service;

    @BeforeEach
    void setUp() {
        properties = new AnalysisProperties();
        service = new AnalysisApplicationService(
                List.of(new UseSelfClosingElementsRule(), new UseValidTypeofRule()),
                new Analyzer(),
                AnalyzerOptions.defaults(),
                properties);
    }

    @Test
    void analyze_ShouldLocateFindingsOfAllRules() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse(SOURCE);

        // Act
        AnalysisResult result = service.analyze(AnalysisRequest.forTree(tree, "app.jsx"));

        // Assert
        assertEquals(2, result.findings().size());
        Finding selfClosing = result.findings().get(0);
        Finding typeof = result.findings().get(1);
        assertEquals("useSelfClosingElements", selfClosing.ruleName());
        assertEquals(new Location("app.jsx", 1, 1, 1, 12), selfClosing.location());
        assertEquals("useValidTypeof", typeof.ruleName());
        assertEquals(new Location("app.jsx", 2, 14, 2, 23), typeof.location());
        assertTrue(typeof.format().startsWith("app.jsx:2:14 lint/suspicious/useValidTypeof "));

        assertEquals(2, result.stats().rulesEvaluated());
        assertEquals(2, result.stats().fixable());
        assertEquals(2, result.fixableCount());
        assertTrue(result.hasErrors());
    }

    @Test
    void analyze_ShouldRunOnlyRequestedRules() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse(SOURCE);

        // Act
        AnalysisResult typeofOnly = service.analyze(new AnalysisRequest(tree, "app.jsx", List.of("useValidTypeof"), null));
        AnalysisResult unknown = service.analyze(new AnalysisRequest(tree, "app.jsx", List.of("noSuchRule"), null));

        // Assert
        assertEquals(List.of("useValidTypeof"), typeofOnly.findings().stream().map(Finding::ruleName).toList());
        assertTrue(unknown.findings().isEmpty());
        assertEquals(0, unknown.stats().rulesEvaluated());
    }

    @Test
    void analyze_ShouldUseRequestOptions() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse(SOURCE);
        AnalyzerOptions options = AnalyzerOptions.defaults()
                .withRule("useSelfClosingElements", RuleConfiguration.off())
                .withRule("useValidTypeof", RuleConfiguration.at(Severity.WARN));

        // Act
        AnalysisResult result = service.analyze(new AnalysisRequest(tree, "app.jsx", null, options));

        // Assert
        assertEquals(1, result.findings().size());
        assertEquals(1, result.findingCount(Severity.WARN));
        assertFalse(result.hasErrors());
    }

    @Test
    void fixAll_ShouldApplyNothingInSafeMode() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse(SOURCE);

        // Act
        FixResult result = service.fixAll(FixRequest.safe(tree, "app.jsx"));

        // Assert
        assertSame(tree, result.tree());
        assertTrue(result.applied().isEmpty());
        assertEquals(2, result.remaining().size());
        assertTrue(result.converged());
    }

    @Test
    void fixAll_ShouldApplyUnsafeFixesUntilConverged() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse(SOURCE);

        // Act
        FixResult result = service.fixAll(new FixRequest(tree, "app.jsx", FixMode.SAFE_AND_UNSAFE_FIXES, null));

        // Assert
        assertEquals("<div />;\ntypeof x === \"undefined\";\n", result.tree().text());
        assertEquals(List.of("useSelfClosingElements", "useValidTypeof"),
                result.applied().stream().map(AppliedFix::ruleName).toList());
        assertFalse(result.applied().get(0).edits().isEmpty());
        assertTrue(result.remaining().isEmpty());
        assertTrue(result.converged());
        assertEquals(SOURCE, tree.text());
    }

    @Test
    void fixAll_ShouldReportPendingFixesWhenIterationLimitIsHit() {
        // Arrange
        properties.setMaxFixIterations(1);
        SyntaxTree tree = SnippetParser.parse(SOURCE);

        // Act
        FixResult result = service.fixAll(new FixRequest(tree, "app.jsx", FixMode.SAFE_AND_UNSAFE_FIXES, null));

        // Assert
        assertEquals("<div />;\ntypeof x === undefined;\n", result.tree().text());
        assertEquals(1, result.applied().size());
        assertEquals(1, result.remaining().size());
        assertFalse(result.converged());
    }

    @Test
    void fixAll_ShouldHonourPreferredQuote() {
        // Arrange
        SyntaxTree tree = SnippetParser.parse("typeof x == 'strnig';");
        AnalyzerOptions options = AnalyzerOptions.defaults()
                .withPreferredQuote(QuoteStyle.SINGLE);

        // Act
        FixResult result = service.fixAll(new FixRequest(tree, "a.js", FixMode.SAFE_AND_UNSAFE_FIXES, options));

        // Assert
        assertEquals("typeof x == 'string';", result.tree().text());
        assertTrue(result.converged());
    }
}
