package io.opscan.model;

import java.util.List;

/**
 * A named type in a compilation.
 * <p>
 * Base type and interfaces are kept as metadata names; the semantic model resolves them
 * against the compilation so that symbols stay acyclic and cheap to compare.
 *
 * @param metadataName   Fully qualified metadata name (e.g., "System.Net.Security.SslPolicyErrors")
 * @param kind           Declaration kind
 * @param specialType    Special-type classification, {@link SpecialType#NONE} for ordinary types
 * @param baseTypeName   Metadata name of the base type, null for interfaces and the root object type
 * @param interfaceNames Interfaces directly implemented or extended by this type
 * @param hasFinalizer   Whether this type itself declares a finalizer
 * @param location       Declaration location, {@link Location#NONE} for metadata-only types
 */
public record TypeSymbol(
        String metadataName,
        TypeKind kind,
        SpecialType specialType,
        String baseTypeName,
        List<String> interfaceNames,
        boolean hasFinalizer,
        Location location
) {
    /**
     * Compact constructor with validation.
     */
    public TypeSymbol {
        if (metadataName == null || metadataName.isBlank()) {
            throw new IllegalArgumentException("metadataName cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (specialType == null) {
            specialType = SpecialType.NONE;
        }
        interfaceNames = interfaceNames != null ? List.copyOf(interfaceNames) : List.of();
        if (location == null) {
            location = Location.NONE;
        }
    }

    /**
     * Creates the placeholder symbol the host uses for a type it could not bind.
     */
    public static TypeSymbol error(String metadataName) {
        return new TypeSymbol(metadataName, TypeKind.ERROR, SpecialType.NONE, null, List.of(), false, Location.NONE);
    }

    public boolean isValueType() {
        return kind.isValueType();
    }

    public boolean isError() {
        return kind == TypeKind.ERROR;
    }

    /**
     * Returns the simple name (e.g., "SslPolicyErrors" from "System.Net.Security.SslPolicyErrors").
     */
    public String simpleName() {
        int lastDot = metadataName.lastIndexOf('.');
        return lastDot >= 0 ? metadataName.substring(lastDot + 1) : metadataName;
    }

    @Override
    public String toString() {
        return metadataName;
    }
}
