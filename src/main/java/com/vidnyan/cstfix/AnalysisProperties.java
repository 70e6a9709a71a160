package com.vidnyan.cstfix;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the analysis engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "cstfix.analysis")
public class AnalysisProperties {

    /**
     * Quote used when a fix writes a new string literal: double or single.
     */
    private String quoteStyle = "double";

    /**
     * Upper bound on fixes committed by one fix-all run.
     */
    private int maxFixIterations = 50;

    /**
     * Optional JSON configuration file layered on top of these properties.
     */
    private String configFile;

    /**
     * Per-rule overrides keyed by rule name.
     */
    private Map<String, RuleSettings> rules = new LinkedHashMap<>();

    @Data
    public static class RuleSettings {

        private boolean enabled = true;

        /**
         * error, warn or info; unset keeps the rule's default.
         */
        private String severity;
    }
}
