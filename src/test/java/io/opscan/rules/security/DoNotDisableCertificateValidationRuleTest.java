package io.opscan.rules.security;

import io.opscan.config.AnalyzerConfig;
import io.opscan.engine.AnalysisEngine;
import io.opscan.engine.AnalysisResult;
import io.opscan.model.FieldSymbol;
import io.opscan.model.Location;
import io.opscan.model.MethodKind;
import io.opscan.model.MethodSymbol;
import io.opscan.model.ParameterSymbol;
import io.opscan.model.TypeSymbol;
import io.opscan.operation.Operation;
import io.opscan.rules.Diagnostic;
import io.opscan.rules.RuleCatalog;
import io.opscan.rules.RuleCategory;
import io.opscan.rules.RuleDescriptor;
import io.opscan.rules.RuleRegistry;
import io.opscan.rules.Severity;
import io.opscan.semantics.Compilation;
import io.opscan.semantics.CompilationUnit;
import io.opscan.testing.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.opscan.testing.Fixtures.BOOLEAN;
import static io.opscan.testing.Fixtures.CALLBACK;
import static io.opscan.testing.Fixtures.CERTIFICATE;
import static io.opscan.testing.Fixtures.CHAIN;
import static io.opscan.testing.Fixtures.INT32;
import static io.opscan.testing.Fixtures.OBJECT;
import static io.opscan.testing.Fixtures.POLICY_ERRORS;
import static io.opscan.testing.Fixtures.VOID;
import static io.opscan.testing.Fixtures.at;
import static io.opscan.testing.Fixtures.implicitReturn;
import static io.opscan.testing.Fixtures.lambdaSymbol;
import static io.opscan.testing.Fixtures.literal;
import static io.opscan.testing.Fixtures.parameter;
import static io.opscan.testing.Fixtures.returns;
import static io.opscan.testing.Fixtures.sourceClass;
import static io.opscan.testing.Fixtures.trueLiteral;
import static io.opscan.testing.Fixtures.validator;
import static org.assertj.core.api.Assertions.assertThat;

class DoNotDisableCertificateValidationRuleTest {

    private static final String PATH = "src/Client.cs";

    private DoNotDisableCertificateValidationRule rule;
    private TypeSymbol client;
    private MethodSymbol configure;

    @BeforeEach
    void setUp() {
        rule = new DoNotDisableCertificateValidationRule(RuleCatalog.loadDefault(), false);
        client = sourceClass("Sample.Client", at(PATH, 3, 14), false);
        configure = new MethodSymbol("Configure", client, VOID, List.of(), false, MethodKind.ORDINARY, null);
    }

    private AnalysisResult analyze(Compilation compilation) {
        return new AnalysisEngine(RuleRegistry.of(rule), AnalyzerConfig.loadDefault()).analyze(compilation);
    }

    private Operation.DelegateCreation callbackCreation(Operation target, Location location) {
        return new Operation.DelegateCreation(target, CALLBACK, false, location);
    }

    private Operation.AnonymousFunction lambda(Operation... statements) {
        return new Operation.AnonymousFunction(lambdaSymbol(client), Operation.Block.of(statements), false,
                at(PATH, 10, 45));
    }

    /**
     * Compilation whose Configure() method creates {@code creation}. {@code extra} is declared on the
     * client type and gets {@code extraBody} as its source body when one is given.
     */
    private Compilation compilationWith(Operation.DelegateCreation creation, MethodSymbol extra,
                                        Operation.Block extraBody) {
        CompilationUnit.Builder unit = CompilationUnit.builder(PATH)
                .method(configure, Operation.Block.of(
                        new Operation.ExpressionStatement(creation, false, at(PATH, 10, 9))));
        Compilation.Builder builder = Fixtures.compilation("app")
                .addType(client)
                .addMethod(configure);
        if (extra != null) {
            builder.addMethod(extra);
            if (extraBody != null) {
                unit.method(extra, extraBody);
            }
        }
        return builder.addUnit(unit.build()).build();
    }

    private Compilation compilationWith(Operation.DelegateCreation creation) {
        return compilationWith(creation, null, null);
    }

    @Test
    void descriptor_matchesRuleMetadata() {
        RuleDescriptor descriptor = rule.descriptor();

        assertThat(descriptor.id()).isEqualTo("CA5359");
        assertThat(descriptor.title()).isEqualTo("Do Not Disable Certificate Validation");
        assertThat(descriptor.category()).isEqualTo(RuleCategory.SECURITY);
        assertThat(descriptor.defaultSeverity()).isEqualTo(Severity.WARNING);
        assertThat(descriptor.enabledByDefault()).isTrue();
        assertThat(descriptor.customTags()).containsExactly(RuleDescriptor.TAG_TELEMETRY);
    }

    @Test
    void descriptor_disabledByDefaultInIdeExtensionBuild() {
        DoNotDisableCertificateValidationRule ideRule =
                new DoNotDisableCertificateValidationRule(RuleCatalog.loadDefault(), true);

        assertThat(ideRule.descriptor().enabledByDefault()).isFalse();
        assertThat(ideRule.supportedDiagnostics()).containsExactly(ideRule.descriptor());
    }

    @Test
    void analyze_reportsLambdaReturningTrue() {
        Location creationAt = at(PATH, 10, 45);
        Compilation compilation = compilationWith(callbackCreation(lambda(returns(trueLiteral())), creationAt));

        AnalysisResult result = analyze(compilation);

        assertThat(result.diagnostics()).hasSize(1);
        Diagnostic diagnostic = result.diagnostics().get(0);
        assertThat(diagnostic.ruleId()).isEqualTo("CA5359");
        assertThat(diagnostic.severity()).isEqualTo(Severity.WARNING);
        assertThat(diagnostic.location()).isEqualTo(creationAt);
        assertThat(diagnostic.additionalLocations()).isEmpty();
        assertThat(diagnostic.message()).contains("always returning true");
    }

    @Test
    void analyze_reportsExpressionBodiedLambda() {
        Compilation compilation = compilationWith(
                callbackCreation(lambda(implicitReturn(trueLiteral())), at(PATH, 10, 45)));

        assertThat(analyze(compilation).diagnostics()).hasSize(1);
    }

    @Test
    void analyze_ignoresLambdaWithAnyFalseReturn() {
        Operation.Conditional check = new Operation.Conditional(
                parameter(3), returns(literal(false, BOOLEAN)), null, null, false, Location.NONE);
        Compilation compilation = compilationWith(
                callbackCreation(lambda(check, returns(trueLiteral())), at(PATH, 10, 45)));

        assertThat(analyze(compilation).diagnostics()).isEmpty();
    }

    @Test
    void analyze_reportsWhenEveryNestedReturnIsTrue() {
        Operation.Conditional check = new Operation.Conditional(
                parameter(3), returns(trueLiteral()), null, null, false, Location.NONE);
        Compilation compilation = compilationWith(
                callbackCreation(lambda(check, returns(trueLiteral())), at(PATH, 10, 45)));

        assertThat(analyze(compilation).diagnostics()).hasSize(1);
    }

    @Test
    void analyze_ignoresLambdaReturningComputedValue() {
        Operation.Binary noErrors = new Operation.Binary("==", parameter(3), literal(0, INT32), BOOLEAN, null,
                false, Location.NONE);
        Compilation compilation = compilationWith(
                callbackCreation(lambda(returns(noErrors)), at(PATH, 10, 45)));

        assertThat(analyze(compilation).diagnostics()).isEmpty();
    }

    @Test
    void analyze_ignoresLambdaWithoutReturn() {
        Operation.Throw fail = new Operation.Throw(literal("no", Fixtures.STRING), false, Location.NONE);
        Compilation compilation = compilationWith(callbackCreation(lambda(fail), at(PATH, 10, 45)));

        assertThat(analyze(compilation).diagnostics()).isEmpty();
    }

    @Test
    void analyze_ignoresReturnWithoutValue() {
        Compilation compilation = compilationWith(
                callbackCreation(lambda(returns(trueLiteral()), returns(null)), at(PATH, 10, 45)));

        assertThat(analyze(compilation).diagnostics()).isEmpty();
    }

    @Test
    void analyze_treatsTrueConstantFieldAsTrue() {
        FieldSymbol accept = new FieldSymbol("AcceptAll", client, BOOLEAN, true, true);
        Operation.FieldReference reference = new Operation.FieldReference(accept, null, false, Location.NONE);
        Compilation compilation = compilationWith(callbackCreation(lambda(returns(reference)), at(PATH, 10, 45)));

        assertThat(analyze(compilation).diagnostics()).hasSize(1);
    }

    @Test
    void analyze_ignoresLambdaWithWrongSignature() {
        MethodSymbol threeParameters = new MethodSymbol("lambda", client, BOOLEAN,
                List.of(new ParameterSymbol("sender", OBJECT, 0),
                        new ParameterSymbol("certificate", CERTIFICATE, 1),
                        new ParameterSymbol("chain", CHAIN, 2)),
                false, MethodKind.ANONYMOUS_FUNCTION, null);
        Operation.AnonymousFunction function = new Operation.AnonymousFunction(threeParameters,
                Operation.Block.of(returns(trueLiteral())), false, Location.NONE);

        assertThat(analyze(compilationWith(callbackCreation(function, at(PATH, 10, 45)))).diagnostics()).isEmpty();
    }

    @Test
    void analyze_ignoresMethodReferenceWithWrongSignature() {
        MethodSymbol swapped = new MethodSymbol("Swapped", client, BOOLEAN,
                List.of(new ParameterSymbol("certificate", CERTIFICATE, 0),
                        new ParameterSymbol("sender", OBJECT, 1),
                        new ParameterSymbol("chain", CHAIN, 2),
                        new ParameterSymbol("errors", POLICY_ERRORS, 3)),
                true, MethodKind.ORDINARY, null);
        Operation.MethodReference reference = new Operation.MethodReference(swapped, null, CALLBACK, false,
                at(PATH, 10, 45));
        Compilation compilation = compilationWith(callbackCreation(reference, at(PATH, 10, 40)),
                swapped, Operation.Block.of(returns(trueLiteral())));

        AnalysisResult result = analyze(compilation);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.failedEvaluations()).isZero();
    }

    @Test
    void analyze_ignoresMethodReferenceWithNonBooleanReturn() {
        MethodSymbol intReturn = new MethodSymbol("IntRet", client, INT32, Fixtures.callbackParameters(),
                true, MethodKind.ORDINARY, null);
        Operation.MethodReference reference = new Operation.MethodReference(intReturn, null, CALLBACK, false,
                at(PATH, 10, 45));
        Compilation compilation = compilationWith(callbackCreation(reference, at(PATH, 10, 40)),
                intReturn, Operation.Block.of(returns(trueLiteral())));

        AnalysisResult result = analyze(compilation);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.failedEvaluations()).isZero();
    }

    @Test
    void analyze_ignoresOtherDelegateTypes() {
        Operation.DelegateCreation other = new Operation.DelegateCreation(lambda(returns(trueLiteral())),
                TypeSymbol.error("Sample.Validator"), false, at(PATH, 10, 45));

        assertThat(analyze(compilationWith(other)).diagnostics()).isEmpty();
    }

    @Test
    void analyze_reportsMethodReferenceReturningTrue() {
        MethodSymbol acceptAll = validator(client, "AcceptAll");
        Operation.MethodReference reference = new Operation.MethodReference(acceptAll, null, CALLBACK, false,
                at(PATH, 10, 45));
        Location creationAt = at(PATH, 10, 40);
        Compilation compilation = compilationWith(callbackCreation(reference, creationAt),
                acceptAll, Operation.Block.of(returns(trueLiteral())));

        AnalysisResult result = analyze(compilation);

        assertThat(result.diagnostics()).extracting(Diagnostic::location).containsExactly(creationAt);
    }

    @Test
    void analyze_ignoresMethodReferenceWithoutBody() {
        MethodSymbol external = validator(client, "Validate");
        Operation.MethodReference reference = new Operation.MethodReference(external, null, CALLBACK, false,
                Location.NONE);

        assertThat(analyze(compilationWith(callbackCreation(reference, at(PATH, 10, 40)), external, null))
                .diagnostics()).isEmpty();
    }

    @Test
    void analyze_ignoresSynthesizedReturnsInReferencedMethod() {
        MethodSymbol expressionBodied = validator(client, "AcceptAll");
        Operation.MethodReference reference = new Operation.MethodReference(expressionBodied, null, CALLBACK,
                false, Location.NONE);
        Compilation compilation = compilationWith(callbackCreation(reference, at(PATH, 10, 40)),
                expressionBodied, Operation.Block.of(implicitReturn(trueLiteral())));

        assertThat(analyze(compilation).diagnostics()).isEmpty();
    }

    @Test
    void analyze_ignoresReferencedMethodReturningFalse() {
        MethodSymbol strict = validator(client, "Strict");
        Operation.MethodReference reference = new Operation.MethodReference(strict, null, CALLBACK, false,
                Location.NONE);
        Compilation compilation = compilationWith(callbackCreation(reference, at(PATH, 10, 40)),
                strict, Operation.Block.of(returns(literal(false, BOOLEAN))));

        assertThat(analyze(compilation).diagnostics()).isEmpty();
    }

    @Test
    void analyze_analyzesGeneratedCode() {
        Operation.DelegateCreation creation = callbackCreation(lambda(returns(trueLiteral())), at(PATH, 10, 45));
        Compilation compilation = Fixtures.compilation("app")
                .addType(client)
                .addMethod(configure)
                .addUnit(CompilationUnit.builder("obj/Client.g.cs")
                        .generated(true)
                        .method(configure, Operation.Block.of(
                                new Operation.ExpressionStatement(creation, false, Location.NONE)))
                        .build())
                .build();

        assertThat(analyze(compilation).diagnostics()).hasSize(1);
    }

    @Test
    void analyze_inertWhenCertificateTypesMissing() {
        Operation.DelegateCreation creation = callbackCreation(lambda(returns(trueLiteral())), at(PATH, 10, 45));
        Compilation compilation = Compilation.builder("netstandard-lite")
                .addTypes(OBJECT, BOOLEAN, VOID, CALLBACK, CERTIFICATE, POLICY_ERRORS)
                .addType(client)
                .addUnit(CompilationUnit.builder(PATH)
                        .method(configure, Operation.Block.of(
                                new Operation.ExpressionStatement(creation, false, Location.NONE)))
                        .build())
                .build();

        AnalysisResult result = analyze(compilation);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.inertRules()).containsExactly("CA5359");
        assertThat(result.activeRules()).isEmpty();
    }

    @Test
    void alwaysReturnsTrue_requiresAtLeastOneReturn() {
        assertThat(DoNotDisableCertificateValidationRule.alwaysReturnsTrue(List.of())).isFalse();
        assertThat(DoNotDisableCertificateValidationRule.alwaysReturnsTrue(List.<Operation>of(trueLiteral()))).isFalse();
        assertThat(DoNotDisableCertificateValidationRule.alwaysReturnsTrue(
                List.<Operation>of(returns(trueLiteral()), returns(trueLiteral())))).isTrue();
    }

    @Test
    void alwaysReturnsTrue_rejectsTruthyNonBooleanConstants() {
        assertThat(DoNotDisableCertificateValidationRule.alwaysReturnsTrue(
                List.<Operation>of(returns(literal(1, INT32))))).isFalse();
        assertThat(DoNotDisableCertificateValidationRule.alwaysReturnsTrue(
                List.<Operation>of(returns(literal("true", Fixtures.STRING))))).isFalse();
    }
}
