package io.opscan.model;

import java.util.Optional;

/**
 * A field declared on a type.
 *
 * @param name           Field name
 * @param containingType Type declaring the field
 * @param type           Declared field type
 * @param isStatic       Whether the field is static
 * @param constantValue  Value of a compile-time constant field, null otherwise
 */
public record FieldSymbol(
        String name,
        TypeSymbol containingType,
        TypeSymbol type,
        boolean isStatic,
        Object constantValue
) {
    public FieldSymbol {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    public Optional<Object> constant() {
        return Optional.ofNullable(constantValue);
    }

    /**
     * Returns "Type.name", or just the name when the containing type is unknown.
     */
    public String qualifiedName() {
        return containingType != null ? containingType.metadataName() + "." + name : name;
    }
}
