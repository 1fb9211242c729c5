package io.opscan.rules.security;

import io.opscan.model.MethodSymbol;
import io.opscan.model.ParameterSymbol;
import io.opscan.model.TypeSymbol;
import io.opscan.operation.Operation;
import io.opscan.operation.OperationKind;
import io.opscan.operation.Operations;
import io.opscan.rules.AnalysisRule;
import io.opscan.rules.Diagnostic;
import io.opscan.rules.EvaluationContext;
import io.opscan.rules.GeneratedCodeMode;
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

import static io.opscan.semantics.WellKnownTypeNames.SYSTEM_NET_SECURITY_REMOTE_CERTIFICATE_VALIDATION_CALLBACK;
import static io.opscan.semantics.WellKnownTypeNames.SYSTEM_NET_SECURITY_SSL_POLICY_ERRORS;
import static io.opscan.semantics.WellKnownTypeNames.SYSTEM_OBJECT;
import static io.opscan.semantics.WellKnownTypeNames.SYSTEM_SECURITY_CRYPTOGRAPHY_X509_CERTIFICATE;
import static io.opscan.semantics.WellKnownTypeNames.SYSTEM_SECURITY_CRYPTOGRAPHY_X509_CHAIN;

/**
 * CA5359: Do not disable certificate validation.
 * <p>
 * Flags delegate creations of the remote certificate validation callback type whose target
 * (a lambda or a named method) returns the constant {@code true} on every return path.
 * Such a callback accepts any server certificate.
 * <p>
 * Generated code is analyzed as well, since a disabled check is just as exploitable there.
 */
public class DoNotDisableCertificateValidationRule implements AnalysisRule {

    public static final String RULE_ID = "CA5359";

    private static final Logger log = LoggerFactory.getLogger(DoNotDisableCertificateValidationRule.class);

    private final RuleDescriptor descriptor;

    public DoNotDisableCertificateValidationRule(RuleCatalog catalog, boolean ideExtensionBuild) {
        this.descriptor = RuleDescriptor.builder()
                .id(RULE_ID)
                .text(catalog.get(RULE_ID))
                .category(RuleCategory.SECURITY)
                .defaultSeverity(Severity.WARNING)
                .enabledByDefault(!ideExtensionBuild)
                .customTags(RuleDescriptor.TAG_TELEMETRY)
                .build();
    }

    @Override
    public RuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Set<OperationKind> interestedInKinds() {
        return Set.of(OperationKind.DELEGATE_CREATION);
    }

    @Override
    public GeneratedCodeMode generatedCodeMode() {
        return GeneratedCodeMode.ANALYZE;
    }

    @Override
    public Optional<RuleEvaluator> onCompilationStart(SemanticModel model) {
        Optional<List<TypeSymbol>> resolved = model.resolveAll(
                SYSTEM_NET_SECURITY_REMOTE_CERTIFICATE_VALIDATION_CALLBACK,
                SYSTEM_OBJECT,
                SYSTEM_SECURITY_CRYPTOGRAPHY_X509_CERTIFICATE,
                SYSTEM_SECURITY_CRYPTOGRAPHY_X509_CHAIN,
                SYSTEM_NET_SECURITY_SSL_POLICY_ERRORS);
        if (resolved.isEmpty()) {
            log.debug("{} inert for compilation '{}': certificate validation types not available",
                    RULE_ID, model.compilation().name());
            return Optional.empty();
        }

        List<TypeSymbol> types = resolved.get();
        CallbackTypes callbackTypes = new CallbackTypes(types.get(0), types.get(1), types.get(2), types.get(3), types.get(4));
        return Optional.of((node, context) -> evaluate(node, context, callbackTypes));
    }

    /**
     * Well-known types resolved at compilation start.
     */
    private record CallbackTypes(
            TypeSymbol callback,
            TypeSymbol object,
            TypeSymbol certificate,
            TypeSymbol chain,
            TypeSymbol policyErrors
    ) {}

    private Optional<Diagnostic> evaluate(Operation node, EvaluationContext context, CallbackTypes types) {
        if (!(node instanceof Operation.DelegateCreation delegateCreation)) {
            return Optional.empty();
        }

        SemanticModel model = context.model();
        if (!model.typesEqual(types.callback(), delegateCreation.type())) {
            return Optional.empty();
        }

        Operation target = delegateCreation.target();
        if (target == null) {
            return Optional.empty();
        }

        boolean alwaysReturnsTrue = switch (target.kind()) {
            case ANONYMOUS_FUNCTION -> {
                Operation.AnonymousFunction lambda = (Operation.AnonymousFunction) target;
                yield isCertificateValidationFunction(model, lambda.symbol(), types)
                        && alwaysReturnsTrue(Operations.descendants(lambda));
            }
            case METHOD_REFERENCE -> {
                MethodSymbol method = ((Operation.MethodReference) target).method();
                if (!isCertificateValidationFunction(model, method, types)) {
                    yield false;
                }
                // Bodies obtained from the symbol carry host-inserted wrappers; match only user code.
                yield model.operationBlock(method)
                        .map(body -> alwaysReturnsTrue(Operations.withoutSynthesized(Operations.descendants(body))))
                        .orElse(false);
            }
            default -> false;
        };

        if (!alwaysReturnsTrue) {
            return Optional.empty();
        }
        return Optional.of(context.createDiagnostic(delegateCreation));
    }

    /**
     * True if {@code method} has the callback signature:
     * {@code bool (object, X509Certificate, X509Chain, SslPolicyErrors)}.
     */
    private static boolean isCertificateValidationFunction(SemanticModel model, MethodSymbol method, CallbackTypes types) {
        if (method == null || !model.isBoolean(model.returnTypeOf(method))) {
            return false;
        }

        List<ParameterSymbol> parameters = model.parametersOf(method);
        if (parameters.size() != 4) {
            return false;
        }

        return model.typesEqual(parameters.get(0).type(), types.object())
                && model.typesEqual(parameters.get(1).type(), types.certificate())
                && model.typesEqual(parameters.get(2).type(), types.chain())
                && model.typesEqual(parameters.get(3).type(), types.policyErrors());
    }

    /**
     * Checks every return in {@code operations}: each must return the constant {@code true}
     * and at least one return must exist.
     */
    static boolean alwaysReturnsTrue(Iterable<Operation> operations) {
        boolean hasReturn = false;

        for (Operation operation : operations) {
            if (operation.kind() != OperationKind.RETURN) {
                continue;
            }

            Operation returnedValue = ((Operation.Return) operation).returnedValue();
            if (returnedValue == null) {
                return false;
            }

            hasReturn = true;
            if (!Boolean.TRUE.equals(returnedValue.constantValue().orElse(null))) {
                return false;
            }
        }

        return hasReturn;
    }
}
