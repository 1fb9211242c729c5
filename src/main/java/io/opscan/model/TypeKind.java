package io.opscan.model;

/**
 * Declaration kind of a named type.
 */
public enum TypeKind {
    CLASS,
    STRUCT,
    ENUM,
    INTERFACE,
    DELEGATE,

    /**
     * A type the host could not resolve. Error types never resolve by name.
     */
    ERROR;

    /**
     * Returns true for kinds with value semantics.
     */
    public boolean isValueType() {
        return this == STRUCT || this == ENUM;
    }
}
