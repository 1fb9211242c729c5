package io.opscan.rules;

import io.opscan.model.Location;
import io.opscan.operation.Operation;
import io.opscan.semantics.CompilationUnit;
import io.opscan.semantics.OperationBlock;
import io.opscan.semantics.SemanticModel;

import java.util.List;

/**
 * What a rule evaluator sees about the node it is evaluating.
 *
 * @param model      Semantic model of the compilation
 * @param unit       Source file containing the node
 * @param block      Method body or field initializer containing the node
 * @param descriptor Effective descriptor (configured severity applied)
 */
public record EvaluationContext(
        SemanticModel model,
        CompilationUnit unit,
        OperationBlock block,
        RuleDescriptor descriptor
) {
    /**
     * Diagnostic located at {@code node}.
     */
    public Diagnostic createDiagnostic(Operation node, Object... messageArgs) {
        return createDiagnostic(locate(node.location()), List.of(), messageArgs);
    }

    public Diagnostic createDiagnostic(Location location, List<Location> additionalLocations, Object... messageArgs) {
        return Diagnostic.create(descriptor, locate(location), additionalLocations, messageArgs);
    }

    /**
     * Attaches the unit path to spans the host reported without one.
     */
    public Location locate(Location location) {
        if (location.path().isEmpty()) {
            return location.withPath(unit.path());
        }
        return location;
    }
}
