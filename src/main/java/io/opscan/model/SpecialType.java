package io.opscan.model;

/**
 * Classification of types the runtime treats specially.
 */
public enum SpecialType {
    NONE,
    OBJECT,
    BOOLEAN,
    INT32,
    INT64,
    STRING,
    VOID,
    INTPTR,
    UINTPTR
}
