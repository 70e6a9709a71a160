package com.vidnyan.cstfix;

import com.vidnyan.cstfix.application.port.in.AnalyzeSyntaxUseCase;
import com.vidnyan.cstfix.application.port.in.AnalyzeSyntaxUseCase.AnalysisRequest;
import com.vidnyan.cstfix.domain.rule.AnalyzerOptions;
import com.vidnyan.cstfix.domain.rule.Rule;
import com.vidnyan.cstfix.domain.rule.RuleConfiguration;
import com.vidnyan.cstfix.domain.syntax.QuoteStyle;
import com.vidnyan.cstfix.support.SnippetParser;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "cstfix.analysis.quote-style=single",
        "cstfix.analysis.rules[useSelfClosingElements].enabled=false"
})
class CstFixApplicationTest {

    @Autowired
    private List<Rule<?, ?>> rules;

    @Autowired
    private AnalyzerOptions defaultAnalyzerOptions;

    @Autowired
    private AnalyzeSyntaxUseCase analyzeSyntaxUseCase;

    @Test
    void context_ShouldRegisterRulesInOrder() {
        // Assert
        assertEquals(List.of("useSelfClosingElements", "useValidTypeof"),
                rules.stream().map(Rule::getName).toList());
    }

    @Test
    void context_ShouldBuildDefaultOptionsFromProperties() {
        // Assert
        assertEquals(QuoteStyle.SINGLE, defaultAnalyzerOptions.preferredQuote());
        assertEquals(new RuleConfiguration(false, null),
                defaultAnalyzerOptions.ruleConfiguration("useSelfClosingElements").orElseThrow());
    }

    @Test
    void analyze_ShouldUseConfiguredDefaults() {
        // Act
        var result = analyzeSyntaxUseCase.analyze(
                AnalysisRequest.forTree(SnippetParser.parse("<a></a>; typeof x == 'nmuber';"), "wired.jsx"));

        // Assert
        assertEquals(List.of("useValidTypeof"),
                result.findings().stream().map(AnalyzeSyntaxUseCase.Finding::ruleName).toList());
    }
}
