package io.opscan.rules.runtime;

import io.opscan.model.FieldSymbol;
import io.opscan.model.Location;
import io.opscan.model.TypeSymbol;
import io.opscan.operation.Operation;
import io.opscan.operation.OperationKind;
import io.opscan.rules.AnalysisRule;
import io.opscan.rules.Diagnostic;
import io.opscan.rules.EvaluationContext;
import io.opscan.rules.RuleCatalog;
import io.opscan.rules.RuleCategory;
import io.opscan.rules.RuleDescriptor;
import io.opscan.rules.RuleEvaluator;
import io.opscan.rules.Severity;
import io.opscan.semantics.SemanticModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static io.opscan.semantics.WellKnownTypeNames.SYSTEM_IDISPOSABLE;
import static io.opscan.semantics.WellKnownTypeNames.SYSTEM_INTPTR;
import static io.opscan.semantics.WellKnownTypeNames.SYSTEM_RUNTIME_INTEROPSERVICES_HANDLEREF;
import static io.opscan.semantics.WellKnownTypeNames.SYSTEM_UINTPTR;

/**
 * CA2216: Disposable types should declare finalizer.
 * <p>
 * Flags a disposable reference type that stores the result of a native-interop call in an
 * instance field of a native handle type ({@code IntPtr}, {@code UIntPtr}, {@code HandleRef})
 * without declaring a finalizer. If the owner forgets to call {@code Dispose}, the handle leaks.
 * <p>
 * The check is purely structural at the assignment site; no body is traversed.
 */
public class DisposableTypesShouldDeclareFinalizerRule implements AnalysisRule {

    public static final String RULE_ID = "CA2216";

    private static final Logger log = LoggerFactory.getLogger(DisposableTypesShouldDeclareFinalizerRule.class);

    private final RuleDescriptor descriptor;
    private final boolean ideExtensionBuild;

    public DisposableTypesShouldDeclareFinalizerRule(RuleCatalog catalog, boolean ideExtensionBuild) {
        this.ideExtensionBuild = ideExtensionBuild;
        this.descriptor = RuleDescriptor.builder()
                .id(RULE_ID)
                .text(catalog.get(RULE_ID))
                .category(RuleCategory.USAGE)
                .defaultSeverity(Severity.WARNING)
                .enabledByDefault(!ideExtensionBuild)
                .customTags(RuleDescriptor.TAG_PORTED_FROM_FXCOP, RuleDescriptor.TAG_TELEMETRY)
                .build();
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Not offered at all in IDE extension builds.
     */
    @Override
    public List<RuleDescriptor> supportedDiagnostics() {
        return ideExtensionBuild ? List.of() : List.of(descriptor);
    }

    @Override
    public Set<OperationKind> interestedInKinds() {
        return Set.of(OperationKind.SIMPLE_ASSIGNMENT);
    }

    @Override
    public Optional<RuleEvaluator> onCompilationStart(SemanticModel model) {
        Optional<List<TypeSymbol>> nativeResourceTypes =
                model.resolveAll(SYSTEM_INTPTR, SYSTEM_UINTPTR, SYSTEM_RUNTIME_INTEROPSERVICES_HANDLEREF);
        Optional<TypeSymbol> disposableType = model.resolveType(SYSTEM_IDISPOSABLE);

        if (nativeResourceTypes.isEmpty() || disposableType.isEmpty()) {
            log.debug("{} inert for compilation '{}': native handle or IDisposable types not available",
                    RULE_ID, model.compilation().name());
            return Optional.empty();
        }

        List<TypeSymbol> handleTypes = nativeResourceTypes.get();
        TypeSymbol disposable = disposableType.get();
        return Optional.of((node, context) -> evaluate(node, context, handleTypes, disposable));
    }

    private Optional<Diagnostic> evaluate(Operation node, EvaluationContext context,
                                          List<TypeSymbol> handleTypes, TypeSymbol disposable) {
        if (!(node instanceof Operation.SimpleAssignment assignment)) {
            return Optional.empty();
        }

        // Null when the left-hand side is an undefined symbol.
        Operation target = assignment.target();
        if (target == null || target.kind() != OperationKind.FIELD_REFERENCE) {
            return Optional.empty();
        }

        FieldSymbol field = ((Operation.FieldReference) target).field();
        if (field == null || field.isStatic()) {
            return Optional.empty();
        }

        SemanticModel model = context.model();
        if (handleTypes.stream().noneMatch(handle -> model.typesEqual(handle, field.type()))) {
            return Optional.empty();
        }

        TypeSymbol containingType = field.containingType();
        if (containingType == null || model.isValueType(containingType)) {
            return Optional.empty();
        }

        if (!model.implementsInterface(containingType, disposable)) {
            return Optional.empty();
        }

        if (model.hasFinalizer(containingType)) {
            return Optional.empty();
        }

        Operation value = assignment.value();
        if (value == null || value.kind() != OperationKind.INVOCATION) {
            return Optional.empty();
        }

        if (model.interopMarker(((Operation.Invocation) value).targetMethod()).isEmpty()) {
            return Optional.empty();
        }

        Location assignmentLocation = context.locate(assignment.location());
        Location typeLocation = containingType.location().isKnown()
                ? containingType.location()
                : assignmentLocation;
        return Optional.of(context.createDiagnostic(typeLocation, List.of(assignmentLocation),
                containingType.simpleName()));
    }
}
