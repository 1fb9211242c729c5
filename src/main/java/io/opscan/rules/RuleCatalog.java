package io.opscan.rules;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * User-facing rule texts (title, message, description, help link), keyed by rule id.
 * The default catalog is loaded from {@code /rule-catalog.yaml} on the classpath.
 */
public class RuleCatalog {

    private static final String DEFAULT_CATALOG = "/rule-catalog.yaml";

    /**
     * Text of one rule.
     */
    public record RuleText(String title, String messageFormat, String description, String helpLinkUri) {
        public RuleText {
            if (title == null || title.isBlank()) {
                throw new IllegalArgumentException("title cannot be null or blank");
            }
            if (messageFormat == null || messageFormat.isBlank()) {
                messageFormat = title;
            }
            if (description == null) {
                description = "";
            }
        }
    }

    private final Map<String, RuleText> texts;

    private RuleCatalog(Map<String, RuleText> texts) {
        this.texts = Map.copyOf(texts);
    }

    /**
     * Loads the catalog bundled with op-scan.
     */
    public static RuleCatalog loadDefault() {
        try (InputStream is = RuleCatalog.class.getResourceAsStream(DEFAULT_CATALOG)) {
            if (is == null) {
                throw new IllegalStateException("Rule catalog not found: " + DEFAULT_CATALOG);
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load rule catalog", e);
        }
    }

    /**
     * Loads a catalog from YAML: a map of rule id to {@code title}, {@code message},
     * {@code description} and {@code helpLink}.
     */
    public static RuleCatalog load(InputStream is) {
        Yaml yaml = new Yaml();
        Map<String, Object> raw = yaml.load(is);
        Map<String, RuleText> texts = new HashMap<>();
        if (raw != null) {
            for (Map.Entry<String, Object> entry : raw.entrySet()) {
                if (entry.getValue() instanceof Map<?, ?> fields) {
                    texts.put(entry.getKey(), new RuleText(
                            asString(fields.get("title")),
                            asString(fields.get("message")),
                            asString(fields.get("description")),
                            asString(fields.get("helpLink"))
                    ));
                }
            }
        }
        return new RuleCatalog(texts);
    }

    private static String asString(Object value) {
        return value != null ? value.toString().trim() : null;
    }

    public Optional<RuleText> find(String ruleId) {
        return Optional.ofNullable(texts.get(ruleId));
    }

    /**
     * Returns the text of a rule the catalog is required to describe.
     */
    public RuleText get(String ruleId) {
        return find(ruleId).orElseThrow(() ->
                new IllegalArgumentException("No catalog entry for rule " + ruleId));
    }

    public Set<String> ruleIds() {
        return texts.keySet();
    }
}
