package io.opscan.rules;

import io.opscan.rules.runtime.DisposableTypesShouldDeclareFinalizerRule;
import io.opscan.rules.security.DoNotDisableCertificateValidationRule;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Registry of all available rules.
 */
public class RuleRegistry {

    private final List<AnalysisRule> rules;

    private RuleRegistry(List<AnalysisRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Creates a registry with all built-in rules.
     *
     * @param catalog           Source of rule texts
     * @param ideExtensionBuild Build switch; when set, rules are disabled by default
     */
    public static RuleRegistry createDefault(RuleCatalog catalog, boolean ideExtensionBuild) {
        return new RuleRegistry(List.of(
                new DoNotDisableCertificateValidationRule(catalog, ideExtensionBuild),
                new DisposableTypesShouldDeclareFinalizerRule(catalog, ideExtensionBuild)
        ));
    }

    public static RuleRegistry of(AnalysisRule... rules) {
        return new RuleRegistry(Arrays.asList(rules));
    }

    public List<AnalysisRule> allRules() {
        return rules;
    }

    public Optional<AnalysisRule> getById(String id) {
        return rules.stream()
                .filter(r -> r.descriptor().id().equals(id))
                .findFirst();
    }
}
