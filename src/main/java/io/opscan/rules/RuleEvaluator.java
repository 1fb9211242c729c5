package io.opscan.rules;

import io.opscan.operation.Operation;

import java.util.Optional;

/**
 * Evaluates one triggering node. Implementations hold only state resolved at compilation
 * start and must be safe to call from several threads.
 */
@FunctionalInterface
public interface RuleEvaluator {

    Optional<Diagnostic> evaluate(Operation node, EvaluationContext context);
}
