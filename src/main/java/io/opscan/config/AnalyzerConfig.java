package io.opscan.config;

import io.opscan.rules.RuleDescriptor;
import io.opscan.rules.Severity;
import org.yaml.snakeyaml.Yaml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Analyzer configuration loaded from YAML.
 * <p>
 * Example:
 * <pre>
 * ideExtensionBuild: false
 * parallelism: 4
 * excludePaths:
 *   - "^build/generated/.+"
 * rules:
 *   CA5359:
 *     severity: error
 *   CA2216:
 *     enabled: false
 * </pre>
 */
public class AnalyzerConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

    private static final String DEFAULT_CONFIG = "/op-scan.yaml";

    /**
     * Per-rule overrides; null fields keep the descriptor's defaults.
     */
    public record RuleOverride(Boolean enabled, Severity severity) {

        static final RuleOverride NONE = new RuleOverride(null, null);

        RuleOverride mergedWith(RuleOverride other) {
            return new RuleOverride(
                    other.enabled != null ? other.enabled : enabled,
                    other.severity != null ? other.severity : severity);
        }
    }

    private final Boolean ideExtensionBuild;
    private final Integer parallelism;
    private final List<Pattern> excludePaths;
    private final Map<String, RuleOverride> ruleOverrides;

    private AnalyzerConfig(Boolean ideExtensionBuild, Integer parallelism,
                           List<Pattern> excludePaths, Map<String, RuleOverride> ruleOverrides) {
        this.ideExtensionBuild = ideExtensionBuild;
        this.parallelism = parallelism;
        this.excludePaths = List.copyOf(excludePaths);
        this.ruleOverrides = Map.copyOf(ruleOverrides);
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static AnalyzerConfig loadDefault() {
        try (InputStream is = AnalyzerConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads configuration from a file path.
     */
    public static AnalyzerConfig loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    /**
     * Loads configuration from an input stream.
     *
     * @throws IllegalArgumentException if a value has the wrong shape
     */
    public static AnalyzerConfig load(InputStream is) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(is);
        if (loaded == null) {
            return fromMap(Map.of());
        }
        if (!(loaded instanceof Map<?, ?> config)) {
            throw new IllegalArgumentException("configuration must be a map");
        }
        return fromMap(config);
    }

    private static AnalyzerConfig fromMap(Map<?, ?> config) {
        Boolean ideExtensionBuild = null;
        Object ide = config.get("ideExtensionBuild");
        if (ide instanceof Boolean b) {
            ideExtensionBuild = b;
        } else if (ide != null) {
            throw new IllegalArgumentException("ideExtensionBuild must be true or false, got: " + ide);
        }

        Integer parallelism = null;
        Object threads = config.get("parallelism");
        if (threads instanceof Integer i) {
            if (i < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1, got: " + i);
            }
            parallelism = i;
        } else if (threads != null) {
            throw new IllegalArgumentException("parallelism must be an integer, got: " + threads);
        }

        return new AnalyzerConfig(
                ideExtensionBuild,
                parallelism,
                compilePatterns(getStringList(config, "excludePaths")),
                parseRules(config.get("rules")));
    }

    private static List<String> getStringList(Map<?, ?> config, String key) {
        Object value = config.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String s && !s.isBlank()) {
                    result.add(s.trim());
                }
            }
        }
        return result;
    }

    /**
     * Compiles regex patterns. Invalid patterns are logged and skipped.
     */
    private static List<Pattern> compilePatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : patterns) {
            try {
                compiled.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                log.warn("Invalid exclude pattern '{}': {}", regex, e.getMessage());
            }
        }
        return compiled;
    }

    private static Map<String, RuleOverride> parseRules(Object rules) {
        Map<String, RuleOverride> overrides = new HashMap<>();
        if (rules == null) {
            return overrides;
        }
        if (!(rules instanceof Map<?, ?> ruleMap)) {
            throw new IllegalArgumentException("rules must be a map of rule id to settings");
        }

        for (Map.Entry<?, ?> entry : ruleMap.entrySet()) {
            String ruleId = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map<?, ?> settings)) {
                throw new IllegalArgumentException("Settings for rule " + ruleId + " must be a map");
            }

            Boolean enabled = null;
            Object enabledValue = settings.get("enabled");
            if (enabledValue instanceof Boolean b) {
                enabled = b;
            } else if (enabledValue != null) {
                throw new IllegalArgumentException("rules." + ruleId + ".enabled must be true or false");
            }

            Severity severity = null;
            Object severityValue = settings.get("severity");
            if (severityValue != null) {
                severity = Severity.parse(severityValue.toString()).orElseThrow(() ->
                        new IllegalArgumentException("rules." + ruleId + ".severity must be one of "
                                + "hidden, info, warning, error; got: " + severityValue));
            }

            overrides.put(ruleId, new RuleOverride(enabled, severity));
        }
        return overrides;
    }

    /**
     * Merges this configuration with another, with the other taking precedence.
     */
    public AnalyzerConfig merge(AnalyzerConfig other) {
        Set<String> patterns = new LinkedHashSet<>();
        for (Pattern p : excludePaths) {
            patterns.add(p.pattern());
        }
        for (Pattern p : other.excludePaths) {
            patterns.add(p.pattern());
        }

        Map<String, RuleOverride> mergedRules = new HashMap<>(ruleOverrides);
        other.ruleOverrides.forEach((id, override) ->
                mergedRules.merge(id, override, RuleOverride::mergedWith));

        return new AnalyzerConfig(
                other.ideExtensionBuild != null ? other.ideExtensionBuild : ideExtensionBuild,
                other.parallelism != null ? other.parallelism : parallelism,
                compilePatterns(new ArrayList<>(patterns)),
                mergedRules);
    }

    /**
     * Returns a copy with the build switch forced to the given value.
     */
    public AnalyzerConfig withIdeExtensionBuild(boolean value) {
        return new AnalyzerConfig(value, parallelism, excludePaths, ruleOverrides);
    }

    public AnalyzerConfig withParallelism(int value) {
        if (value < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got: " + value);
        }
        return new AnalyzerConfig(ideExtensionBuild, value, excludePaths, ruleOverrides);
    }

    // ---- Query methods ----

    public boolean isIdeExtensionBuild() {
        return ideExtensionBuild != null && ideExtensionBuild;
    }

    public int parallelism() {
        return parallelism != null ? parallelism : 1;
    }

    /**
     * Checks whether a compilation unit path matches any configured exclude pattern.
     */
    public boolean shouldExcludePath(String path) {
        if (path == null) return false;
        for (Pattern pattern : excludePaths) {
            if (pattern.matcher(path).matches()) {
                return true;
            }
        }
        return false;
    }

    public Optional<RuleOverride> overrideFor(String ruleId) {
        return Optional.ofNullable(ruleOverrides.get(ruleId));
    }

    /**
     * Whether a rule runs: an explicit override wins over the descriptor's default.
     */
    public boolean isRuleEnabled(RuleDescriptor descriptor) {
        RuleOverride override = ruleOverrides.getOrDefault(descriptor.id(), RuleOverride.NONE);
        return override.enabled() != null ? override.enabled() : descriptor.enabledByDefault();
    }

    /**
     * Returns the descriptor with the configured severity applied.
     */
    public RuleDescriptor effectiveDescriptor(RuleDescriptor descriptor) {
        RuleOverride override = ruleOverrides.getOrDefault(descriptor.id(), RuleOverride.NONE);
        return override.severity() != null ? descriptor.withSeverity(override.severity()) : descriptor;
    }

    public List<String> excludePathPatterns() {
        return excludePaths.stream().map(Pattern::pattern).toList();
    }
}
