package io.opscan.model;

public enum MethodKind {
    ORDINARY,
    CONSTRUCTOR,
    FINALIZER,
    ANONYMOUS_FUNCTION
}
