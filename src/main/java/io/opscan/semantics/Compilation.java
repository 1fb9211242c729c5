package io.opscan.semantics;

import io.opscan.model.FieldSymbol;
import io.opscan.model.MethodSymbol;
import io.opscan.model.TypeSymbol;
import io.opscan.operation.Operation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of one compilation: its named types, their members and the
 * operation trees of its source files.
 * <p>
 * Instances are safe to share between threads once built.
 */
public final class Compilation {

    private final String name;
    private final Map<String, TypeSymbol> types;
    private final Map<String, List<FieldSymbol>> fieldsByType;
    private final Map<String, List<MethodSymbol>> methodsByType;
    private final Map<String, Operation.Block> bodiesBySignature;
    private final List<CompilationUnit> units;

    private Compilation(Builder builder) {
        this.name = builder.name;
        this.types = Map.copyOf(builder.types);
        this.fieldsByType = copyMembers(builder.fieldsByType);
        this.methodsByType = copyMembers(builder.methodsByType);
        this.bodiesBySignature = Map.copyOf(builder.bodiesBySignature);
        this.units = List.copyOf(builder.units);
    }

    private static <T> Map<String, List<T>> copyMembers(Map<String, List<T>> members) {
        Map<String, List<T>> copy = new HashMap<>();
        members.forEach((type, list) -> copy.put(type, List.copyOf(list)));
        return Map.copyOf(copy);
    }

    public String name() {
        return name;
    }

    /**
     * Looks up a named type. Error types are never returned.
     */
    public Optional<TypeSymbol> getTypeByMetadataName(String metadataName) {
        if (metadataName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get(metadataName));
    }

    public Collection<TypeSymbol> allTypes() {
        return types.values();
    }

    public List<FieldSymbol> fieldsOf(TypeSymbol type) {
        return type != null ? fieldsByType.getOrDefault(type.metadataName(), List.of()) : List.of();
    }

    public List<MethodSymbol> methodsOf(TypeSymbol type) {
        return type != null ? methodsByType.getOrDefault(type.metadataName(), List.of()) : List.of();
    }

    /**
     * Returns the body of a source method, empty for metadata-only or abstract methods.
     */
    public Optional<Operation.Block> operationBlock(MethodSymbol method) {
        if (method == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bodiesBySignature.get(method.signature()));
    }

    public List<CompilationUnit> units() {
        return units;
    }

    /**
     * Total number of operation blocks across all units.
     */
    public int blockCount() {
        return units.stream().mapToInt(u -> u.blocks().size()).sum();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private final Map<String, TypeSymbol> types = new LinkedHashMap<>();
        private final Map<String, List<FieldSymbol>> fieldsByType = new HashMap<>();
        private final Map<String, List<MethodSymbol>> methodsByType = new HashMap<>();
        private final Map<String, Operation.Block> bodiesBySignature = new HashMap<>();
        private final List<CompilationUnit> units = new ArrayList<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
        }

        public Builder addType(TypeSymbol type) {
            if (type.isError()) {
                throw new IllegalArgumentException("error types cannot be declared: " + type.metadataName());
            }
            if (types.putIfAbsent(type.metadataName(), type) != null) {
                throw new IllegalArgumentException("duplicate type: " + type.metadataName());
            }
            return this;
        }

        public Builder addTypes(TypeSymbol... symbols) {
            for (TypeSymbol type : symbols) {
                addType(type);
            }
            return this;
        }

        public Builder addField(FieldSymbol field) {
            String owner = field.containingType() != null ? field.containingType().metadataName() : "";
            fieldsByType.computeIfAbsent(owner, k -> new ArrayList<>()).add(field);
            return this;
        }

        public Builder addMethod(MethodSymbol method) {
            String owner = method.containingType() != null ? method.containingType().metadataName() : "";
            methodsByType.computeIfAbsent(owner, k -> new ArrayList<>()).add(method);
            return this;
        }

        /**
         * Adds a source file. Method bodies declared in it become available through
         * {@link Compilation#operationBlock(MethodSymbol)}.
         */
        public Builder addUnit(CompilationUnit unit) {
            for (OperationBlock block : unit.blocks()) {
                if (block.ownerMethod() != null && block.root() instanceof Operation.Block body) {
                    bodiesBySignature.put(block.ownerMethod().signature(), body);
                }
            }
            units.add(unit);
            return this;
        }

        public Compilation build() {
            return new Compilation(this);
        }
    }
}
