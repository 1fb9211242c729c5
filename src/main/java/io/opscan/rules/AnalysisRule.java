package io.opscan.rules;

import io.opscan.operation.OperationKind;
import io.opscan.semantics.SemanticModel;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base interface for all rules.
 * <p>
 * The engine calls {@link #onCompilationStart(SemanticModel)} once per compilation and then
 * hands every operation whose kind is in {@link #interestedInKinds()} to the returned evaluator.
 */
public interface AnalysisRule {

    /**
     * Descriptor of the diagnostic this rule reports.
     */
    RuleDescriptor descriptor();

    /**
     * Diagnostics this rule can report. A rule that returns an empty list is never run.
     */
    default List<RuleDescriptor> supportedDiagnostics() {
        return List.of(descriptor());
    }

    /**
     * Operation kinds that trigger an evaluation.
     */
    Set<OperationKind> interestedInKinds();

    default GeneratedCodeMode generatedCodeMode() {
        return GeneratedCodeMode.SKIP;
    }

    /**
     * Resolves whatever the rule needs from the compilation.
     *
     * @return the evaluator for this compilation, or empty if the rule is inert for it
     */
    Optional<RuleEvaluator> onCompilationStart(SemanticModel model);
}
