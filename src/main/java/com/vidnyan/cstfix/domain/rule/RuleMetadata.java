package com.vidnyan.cstfix.domain.rule;

import java.util.Objects;

/**
 * Static description of a rule.
 */
public record RuleMetadata(
    String name,
    String group,
    String description,
    String version,
    boolean recommended,
    Severity severity,
    FixKind fixKind,
    String source
) {

    public RuleMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(fixKind, "fixKind");
    }

    /**
     * Diagnostic category, e.g. {@code lint/style/useSelfClosingElements}.
     */
    public String category() {
        return "lint/" + group + "/" + name;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String group;
        private String description = "";
        private String version = "1.0.0";
        private boolean recommended = true;
        private Severity severity = Severity.ERROR;
        private FixKind fixKind = FixKind.NONE;
        private String source;

        public Builder name(String name) { this.name = name; return this; }
        public Builder group(String group) { this.group = group; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder version(String version) { this.version = version; return this; }
        public Builder recommended(boolean recommended) { this.recommended = recommended; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder fixKind(FixKind kind) { this.fixKind = kind; return this; }
        public Builder source(String source) { this.source = source; return this; }

        public RuleMetadata build() {
            return new RuleMetadata(name, group, description, version, recommended, severity, fixKind, source);
        }
    }
}
