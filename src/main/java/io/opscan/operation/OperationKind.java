package io.opscan.operation;

/**
 * Closed set of operation kinds produced by the host.
 * Each kind has exactly one {@link Operation} record.
 */
public enum OperationKind {
    BLOCK,
    EXPRESSION_STATEMENT,
    VARIABLE_DECLARATION,
    RETURN,
    THROW,
    CONDITIONAL,
    LITERAL,
    CONVERSION,
    BINARY,
    LOCAL_REFERENCE,
    PARAMETER_REFERENCE,
    INSTANCE_REFERENCE,
    FIELD_REFERENCE,
    SIMPLE_ASSIGNMENT,
    INVOCATION,
    OBJECT_CREATION,
    DELEGATE_CREATION,
    ANONYMOUS_FUNCTION,
    METHOD_REFERENCE,

    /**
     * Erroneous code the host could not bind.
     */
    INVALID
}
