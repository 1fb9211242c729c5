package io.opscan.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A method, constructor, finalizer or anonymous function.
 *
 * @param name           Method name ("lambda" style names for anonymous functions)
 * @param containingType Declaring type, null for anonymous functions the host did not attach
 * @param returnType     Declared return type
 * @param parameters     Ordered parameter list
 * @param isStatic       Whether the method is static
 * @param methodKind     Kind of method
 * @param nativeImport   Native-interop marker, null for managed methods
 */
public record MethodSymbol(
        String name,
        TypeSymbol containingType,
        TypeSymbol returnType,
        List<ParameterSymbol> parameters,
        boolean isStatic,
        MethodKind methodKind,
        NativeImport nativeImport
) {
    public MethodSymbol {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (returnType == null) {
            throw new IllegalArgumentException("returnType cannot be null");
        }
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        if (methodKind == null) {
            methodKind = MethodKind.ORDINARY;
        }
    }

    public Optional<NativeImport> nativeImportData() {
        return Optional.ofNullable(nativeImport);
    }

    /**
     * Returns the signature key, e.g. {@code Sample.Client.Validate(System.Object,System.Int32)}.
     */
    public String signature() {
        String params = parameters.stream()
                .map(p -> p.type().metadataName())
                .collect(Collectors.joining(","));
        String owner = containingType != null ? containingType.metadataName() + "." : "";
        return owner + name + "(" + params + ")";
    }

    @Override
    public String toString() {
        return signature();
    }
}
