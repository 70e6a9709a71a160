package com.vidnyan.cstfix.adapter.out.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.vidnyan.cstfix.AnalysisProperties;
import com.vidnyan.cstfix.domain.rule.AnalyzerOptions;
import com.vidnyan.cstfix.domain.rule.Rule;
import com.vidnyan.cstfix.domain.rule.RuleConfiguration;
import com.vidnyan.cstfix.domain.rule.RuleMetadata;
import com.vidnyan.cstfix.domain.rule.Severity;
import com.vidnyan.cstfix.domain.syntax.QuoteStyle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link AnalyzerOptions} from Spring properties and from a JSON configuration file.
 * <p>
 * File layout:
 * <pre>
 * {
 *   "javascript": { "formatter": { "quoteStyle": "single" } },
 *   "linter": { "rules": { "style": { "useSelfClosingElements": "off" } } }
 * }
 * </pre>
 * A rule value is {@code "off"}, {@code "on"}, a severity, or {@code {"level": ...}}.
 * Unknown keys, groups, rules and values are rejected.
 */
@Slf4j
@Component
public class JsonAnalyzerConfigurationLoader {

    private final ObjectReader reader;
    private final Map<String, RuleMetadata> knownRules = new LinkedHashMap<>();

    public JsonAnalyzerConfigurationLoader(ObjectMapper objectMapper, List<Rule<?, ?>> rules) {
        this.reader = objectMapper.readerFor(ConfigurationDto.class)
                .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        rules.forEach(rule -> knownRules.put(rule.metadata().name(), rule.metadata()));
    }

    /**
     * Options described by {@code cstfix.analysis.*} properties.
     */
    public AnalyzerOptions fromProperties(AnalysisProperties properties) {
        AnalyzerOptions options = AnalyzerOptions.defaults()
                .withPreferredQuote(parseQuote(properties.getQuoteStyle()));
        for (Map.Entry<String, AnalysisProperties.RuleSettings> entry : properties.getRules().entrySet()) {
            String name = entry.getKey();
            requireKnownRule(name);
            AnalysisProperties.RuleSettings settings = entry.getValue();
            Severity severity = settings.getSeverity() == null ? null : parseSeverity(name, settings.getSeverity());
            options = options.withRule(name, new RuleConfiguration(settings.isEnabled(), severity));
        }
        return options;
    }

    public AnalyzerOptions load(Path file, AnalyzerOptions base) {
        log.info("Loading analyzer configuration from {}", file);
        try {
            return read(Files.readString(file), base);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Layers the settings of a JSON document over {@code base}.
     */
    public AnalyzerOptions read(String json, AnalyzerOptions base) {
        ConfigurationDto dto;
        try {
            dto = reader.readValue(json);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
        if (dto == null) {
            return base;
        }

        AnalyzerOptions options = base;
        if (dto.javascript != null && dto.javascript.formatter != null && dto.javascript.formatter.quoteStyle != null) {
            options = options.withPreferredQuote(parseQuote(dto.javascript.formatter.quoteStyle));
        }
        if (dto.linter != null && dto.linter.rules != null) {
            for (Map.Entry<String, JsonNode> group : dto.linter.rules.entrySet()) {
                options = applyGroup(options, group.getKey(), group.getValue());
            }
        }
        log.debug("Configuration resolved to {}", options);
        return options;
    }

    private AnalyzerOptions applyGroup(AnalyzerOptions options, String group, JsonNode rules) {
        if (!rules.isObject()) {
            throw new InvalidConfigurationException("Rule group '" + group + "' must be an object");
        }
        AnalyzerOptions result = options;
        Iterator<Map.Entry<String, JsonNode>> fields = rules.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            RuleMetadata rule = requireKnownRule(field.getKey());
            if (!rule.group().equals(group)) {
                throw new InvalidConfigurationException("Rule '" + rule.name() + "' belongs to group '"
                        + rule.group() + "', not '" + group + "'");
            }
            result = result.withRule(rule.name(), parseRuleValue(rule.name(), field.getValue()));
        }
        return result;
    }

    private RuleConfiguration parseRuleValue(String ruleName, JsonNode value) {
        if (value.isTextual()) {
            return parseLevel(ruleName, value.asText());
        }
        if (value.isObject()) {
            JsonNode level = value.get("level");
            if (level == null || !level.isTextual()) {
                throw new InvalidConfigurationException("Rule '" + ruleName + "' needs a string 'level'");
            }
            Iterator<String> names = value.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (name.equals("level")) {
                    continue;
                }
                JsonNode option = value.get(name);
                if (!name.equals("options") || !(option.isNull() || (option.isObject() && option.isEmpty()))) {
                    throw new InvalidConfigurationException("Rule '" + ruleName + "' does not accept '" + name + "'");
                }
            }
            return parseLevel(ruleName, level.asText());
        }
        throw new InvalidConfigurationException("Rule '" + ruleName + "' has an unsupported value: " + value);
    }

    private static RuleConfiguration parseLevel(String ruleName, String level) {
        return switch (level) {
            case "off" -> RuleConfiguration.off();
            case "on" -> RuleConfiguration.on();
            default -> RuleConfiguration.at(parseSeverity(ruleName, level));
        };
    }

    private static Severity parseSeverity(String ruleName, String level) {
        try {
            return Severity.parse(level);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Rule '" + ruleName + "' has an unknown level '" + level + "'", e);
        }
    }

    private static QuoteStyle parseQuote(String value) {
        try {
            return QuoteStyle.parse(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Unknown quote style '" + value + "'", e);
        }
    }

    private RuleMetadata requireKnownRule(String name) {
        RuleMetadata rule = knownRules.get(name);
        if (rule == null) {
            throw new InvalidConfigurationException("Unknown rule '" + name + "'; known rules: " + knownRules.keySet());
        }
        return rule;
    }

    // DTO classes for JSON deserialization

    static class ConfigurationDto {
        @JsonProperty("$schema")
        public String schema;
        public JavascriptDto javascript;
        public LinterDto linter;
    }

    static class JavascriptDto {
        public FormatterDto formatter;
    }

    static class FormatterDto {
        public String quoteStyle;
    }

    static class LinterDto {
        public Map<String, JsonNode> rules;
    }
}
