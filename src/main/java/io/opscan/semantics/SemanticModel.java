package io.opscan.semantics;

import io.opscan.model.MethodSymbol;
import io.opscan.model.NativeImport;
import io.opscan.model.ParameterSymbol;
import io.opscan.model.SpecialType;
import io.opscan.model.TypeSymbol;
import io.opscan.operation.Operation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Typed queries over a {@link Compilation}.
 * <p>
 * Every query is a pure function of the compilation snapshot, so one model can serve
 * concurrent rule evaluations.
 */
public class SemanticModel {

    private final Compilation compilation;

    public SemanticModel(Compilation compilation) {
        if (compilation == null) {
            throw new IllegalArgumentException("compilation cannot be null");
        }
        this.compilation = compilation;
    }

    public Compilation compilation() {
        return compilation;
    }

    /**
     * Resolves a type by fully qualified metadata name.
     * Empty when the type is absent from the compilation (e.g., the target runtime lacks the API).
     */
    public Optional<TypeSymbol> resolveType(String metadataName) {
        return compilation.getTypeByMetadataName(metadataName);
    }

    /**
     * Resolves all given names, or returns empty if any of them is missing.
     */
    public Optional<List<TypeSymbol>> resolveAll(String... metadataNames) {
        List<TypeSymbol> resolved = new ArrayList<>(metadataNames.length);
        for (String name : metadataNames) {
            Optional<TypeSymbol> type = resolveType(name);
            if (type.isEmpty()) {
                return Optional.empty();
            }
            resolved.add(type.get());
        }
        return Optional.of(List.copyOf(resolved));
    }

    /**
     * Type identity. Error types are never equal to anything, including themselves.
     */
    public boolean typesEqual(TypeSymbol a, TypeSymbol b) {
        if (a == null || b == null || a.isError() || b.isError()) {
            return false;
        }
        return a.metadataName().equals(b.metadataName());
    }

    /**
     * All interfaces implemented by {@code type}: its own, those of its base types, and the
     * interfaces those extend. Ordered by first discovery; unresolvable names are skipped.
     */
    public Set<TypeSymbol> interfacesOf(TypeSymbol type) {
        Set<TypeSymbol> result = new LinkedHashSet<>();
        if (type == null) {
            return result;
        }

        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        TypeSymbol current = type;
        while (current != null && visited.add("class:" + current.metadataName())) {
            pending.addAll(current.interfaceNames());
            current = current.baseTypeName() != null
                    ? resolveType(current.baseTypeName()).orElse(null)
                    : null;
        }

        while (!pending.isEmpty()) {
            String name = pending.poll();
            if (!visited.add(name)) {
                continue;
            }
            resolveType(name).ifPresent(iface -> {
                result.add(iface);
                pending.addAll(iface.interfaceNames());
            });
        }
        return result;
    }

    /**
     * Returns true if {@code type} implements {@code iface}, directly or transitively.
     */
    public boolean implementsInterface(TypeSymbol type, TypeSymbol iface) {
        return interfacesOf(type).stream().anyMatch(candidate -> typesEqual(candidate, iface));
    }

    /**
     * Whether the type itself declares a finalizer. Inherited finalizers do not count.
     */
    public boolean hasFinalizer(TypeSymbol type) {
        return type != null && type.hasFinalizer();
    }

    public boolean isValueType(TypeSymbol type) {
        return type != null && type.isValueType();
    }

    public boolean isBoolean(TypeSymbol type) {
        return type != null && type.specialType() == SpecialType.BOOLEAN;
    }

    /**
     * Native-interop marker of a method, empty for managed methods.
     */
    public Optional<NativeImport> interopMarker(MethodSymbol method) {
        return method != null ? method.nativeImportData() : Optional.empty();
    }

    public List<ParameterSymbol> parametersOf(MethodSymbol method) {
        return method.parameters();
    }

    public TypeSymbol returnTypeOf(MethodSymbol method) {
        return method.returnType();
    }

    /**
     * Top-level body of a source method; empty when the host has none (metadata, abstract, extern).
     */
    public Optional<Operation.Block> operationBlock(MethodSymbol method) {
        return compilation.operationBlock(method);
    }
}
