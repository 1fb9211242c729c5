package io.opscan.rules;

import java.util.Set;

/**
 * Immutable identity and presentation of one rule.
 *
 * @param id               Stable rule id (e.g., "CA5359")
 * @param title            Short title
 * @param messageFormat    {@link String#format} pattern for diagnostic messages
 * @param category         Rule category
 * @param defaultSeverity  Severity used unless configuration overrides it
 * @param enabledByDefault Whether the rule runs without explicit configuration
 * @param description      Longer explanation of the rule
 * @param helpLinkUri      Documentation link, may be null
 * @param customTags       Classification tags (e.g., "Telemetry")
 */
public record RuleDescriptor(
        String id,
        String title,
        String messageFormat,
        RuleCategory category,
        Severity defaultSeverity,
        boolean enabledByDefault,
        String description,
        String helpLinkUri,
        Set<String> customTags
) {
    public static final String TAG_TELEMETRY = "Telemetry";
    public static final String TAG_PORTED_FROM_FXCOP = "PortedFromFxCop";

    /**
     * Compact constructor with validation.
     */
    public RuleDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (messageFormat == null || messageFormat.isBlank()) {
            throw new IllegalArgumentException("messageFormat cannot be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (defaultSeverity == null) {
            defaultSeverity = Severity.WARNING;
        }
        if (description == null) {
            description = "";
        }
        customTags = customTags != null ? Set.copyOf(customTags) : Set.of();
    }

    /**
     * Formats the diagnostic message with the given arguments.
     */
    public String formatMessage(Object... args) {
        if (args == null || args.length == 0) {
            return messageFormat;
        }
        return String.format(messageFormat, args);
    }

    public RuleDescriptor withSeverity(Severity severity) {
        return new RuleDescriptor(id, title, messageFormat, category, severity, enabledByDefault,
                description, helpLinkUri, customTags);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String title;
        private String messageFormat;
        private RuleCategory category;
        private Severity defaultSeverity = Severity.WARNING;
        private boolean enabledByDefault = true;
        private String description;
        private String helpLinkUri;
        private Set<String> customTags = Set.of();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder messageFormat(String messageFormat) {
            this.messageFormat = messageFormat;
            return this;
        }

        public Builder category(RuleCategory category) {
            this.category = category;
            return this;
        }

        public Builder defaultSeverity(Severity defaultSeverity) {
            this.defaultSeverity = defaultSeverity;
            return this;
        }

        public Builder enabledByDefault(boolean enabledByDefault) {
            this.enabledByDefault = enabledByDefault;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder helpLinkUri(String helpLinkUri) {
            this.helpLinkUri = helpLinkUri;
            return this;
        }

        public Builder customTags(String... tags) {
            this.customTags = Set.of(tags);
            return this;
        }

        /**
         * Copies title, message, description and help link from catalog text.
         */
        public Builder text(RuleCatalog.RuleText text) {
            this.title = text.title();
            this.messageFormat = text.messageFormat();
            this.description = text.description();
            this.helpLinkUri = text.helpLinkUri();
            return this;
        }

        public RuleDescriptor build() {
            return new RuleDescriptor(id, title, messageFormat, category, defaultSeverity, enabledByDefault,
                    description, helpLinkUri, customTags);
        }
    }
}
