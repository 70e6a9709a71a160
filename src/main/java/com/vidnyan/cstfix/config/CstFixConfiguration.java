package com.vidnyan.cstfix.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.cstfix.AnalysisProperties;
import com.vidnyan.cstfix.adapter.out.config.JsonAnalyzerConfigurationLoader;
import com.vidnyan.cstfix.domain.rule.Analyzer;
import com.vidnyan.cstfix.domain.rule.AnalyzerOptions;
import com.vidnyan.cstfix.domain.rule.Rule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring configuration for CstFix components.
 * Wires together the clean architecture components.
 */
@Slf4j
@Configuration
public class CstFixConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public Analyzer analyzer() {
        return new Analyzer();
    }

    /**
     * Options used when a request does not bring its own: properties first, then the JSON file if one is set.
     */
    @Bean
    public AnalyzerOptions defaultAnalyzerOptions(AnalysisProperties properties, JsonAnalyzerConfigurationLoader loader) {
        AnalyzerOptions options = loader.fromProperties(properties);
        if (properties.getConfigFile() != null && !properties.getConfigFile().isBlank()) {
            options = loader.load(Path.of(properties.getConfigFile()), options);
        }
        log.info("Default analyzer options: quote={}, {} rule overrides",
                options.preferredQuote(), options.rules().size());
        return options;
    }

    /**
     * Log available rules on startup.
     */
    @Bean
    public String logRules(List<Rule<?, ?>> rules) {
        log.info("Registered {} rules:", rules.size());
        rules.forEach(r -> log.info("  - {} ({})", r.getName(), r.metadata().category()));
        return "rules-logged";
    }
}
