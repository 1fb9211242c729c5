package io.opscan.testing;

import io.opscan.model.Location;
import io.opscan.model.MethodKind;
import io.opscan.model.MethodSymbol;
import io.opscan.model.NativeImport;
import io.opscan.model.ParameterSymbol;
import io.opscan.model.SpecialType;
import io.opscan.model.TypeKind;
import io.opscan.model.TypeSymbol;
import io.opscan.operation.Operation;
import io.opscan.semantics.Compilation;

import java.util.List;

import static io.opscan.semantics.WellKnownTypeNames.*;

/**
 * Well-known symbols and small operation factories shared by tests.
 */
public final class Fixtures {

    public static final TypeSymbol OBJECT = type(SYSTEM_OBJECT, TypeKind.CLASS, SpecialType.OBJECT);
    public static final TypeSymbol BOOLEAN = type(SYSTEM_BOOLEAN, TypeKind.STRUCT, SpecialType.BOOLEAN);
    public static final TypeSymbol VOID = type("System.Void", TypeKind.STRUCT, SpecialType.VOID);
    public static final TypeSymbol INT32 = type("System.Int32", TypeKind.STRUCT, SpecialType.INT32);
    public static final TypeSymbol STRING = type("System.String", TypeKind.CLASS, SpecialType.STRING);

    public static final TypeSymbol CALLBACK =
            type(SYSTEM_NET_SECURITY_REMOTE_CERTIFICATE_VALIDATION_CALLBACK, TypeKind.DELEGATE, SpecialType.NONE);
    public static final TypeSymbol CERTIFICATE =
            type(SYSTEM_SECURITY_CRYPTOGRAPHY_X509_CERTIFICATE, TypeKind.CLASS, SpecialType.NONE);
    public static final TypeSymbol CHAIN =
            type(SYSTEM_SECURITY_CRYPTOGRAPHY_X509_CHAIN, TypeKind.CLASS, SpecialType.NONE);
    public static final TypeSymbol POLICY_ERRORS =
            type(SYSTEM_NET_SECURITY_SSL_POLICY_ERRORS, TypeKind.ENUM, SpecialType.NONE);

    public static final TypeSymbol INTPTR = type(SYSTEM_INTPTR, TypeKind.STRUCT, SpecialType.INTPTR);
    public static final TypeSymbol UINTPTR = type(SYSTEM_UINTPTR, TypeKind.STRUCT, SpecialType.UINTPTR);
    public static final TypeSymbol HANDLEREF =
            type(SYSTEM_RUNTIME_INTEROPSERVICES_HANDLEREF, TypeKind.STRUCT, SpecialType.NONE);
    public static final TypeSymbol IDISPOSABLE = type(SYSTEM_IDISPOSABLE, TypeKind.INTERFACE, SpecialType.NONE);

    private Fixtures() {
    }

    private static TypeSymbol type(String name, TypeKind kind, SpecialType special) {
        return new TypeSymbol(name, kind, special, null, List.of(), false, Location.NONE);
    }

    /**
     * Builder pre-populated with core, certificate and interop types.
     */
    public static Compilation.Builder compilation(String name) {
        return Compilation.builder(name)
                .addTypes(OBJECT, BOOLEAN, VOID, INT32, STRING)
                .addTypes(CALLBACK, CERTIFICATE, CHAIN, POLICY_ERRORS)
                .addTypes(INTPTR, UINTPTR, HANDLEREF, IDISPOSABLE);
    }

    public static TypeSymbol sourceClass(String name, Location location, boolean hasFinalizer, String... interfaces) {
        return new TypeSymbol(name, TypeKind.CLASS, SpecialType.NONE, SYSTEM_OBJECT, List.of(interfaces),
                hasFinalizer, location);
    }

    public static Location at(String path, int line, int column) {
        return new Location(path, line, column, line, column + 1);
    }

    /**
     * Parameters of the certificate validation callback, in declaration order.
     */
    public static List<ParameterSymbol> callbackParameters() {
        return List.of(
                new ParameterSymbol("sender", OBJECT, 0),
                new ParameterSymbol("certificate", CERTIFICATE, 1),
                new ParameterSymbol("chain", CHAIN, 2),
                new ParameterSymbol("errors", POLICY_ERRORS, 3));
    }

    public static MethodSymbol validator(TypeSymbol owner, String name) {
        return new MethodSymbol(name, owner, BOOLEAN, callbackParameters(), true, MethodKind.ORDINARY, null);
    }

    public static MethodSymbol lambdaSymbol(TypeSymbol owner) {
        return new MethodSymbol("lambda", owner, BOOLEAN, callbackParameters(), false,
                MethodKind.ANONYMOUS_FUNCTION, null);
    }

    public static MethodSymbol nativeMethod(TypeSymbol owner, String name, TypeSymbol returnType) {
        return new MethodSymbol(name, owner, returnType, List.of(), true, MethodKind.ORDINARY,
                new NativeImport("kernel32.dll", name));
    }

    public static MethodSymbol managedMethod(TypeSymbol owner, String name, TypeSymbol returnType) {
        return new MethodSymbol(name, owner, returnType, List.of(), true, MethodKind.ORDINARY, null);
    }

    public static Operation.Literal literal(Object value, TypeSymbol type) {
        return new Operation.Literal(value, type, false, Location.NONE);
    }

    public static Operation.Literal trueLiteral() {
        return literal(true, BOOLEAN);
    }

    public static Operation.Return returns(Operation value) {
        return new Operation.Return(value, false, Location.NONE);
    }

    /**
     * Return synthesized by the host, as for an expression-bodied member.
     */
    public static Operation.Return implicitReturn(Operation value) {
        return new Operation.Return(value, true, Location.NONE);
    }

    public static Operation.ParameterReference parameter(int ordinal) {
        return new Operation.ParameterReference(callbackParameters().get(ordinal), false, Location.NONE);
    }
}
