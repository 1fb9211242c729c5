package io.opscan.model;

/**
 * A method parameter.
 *
 * @param name    Parameter name
 * @param type    Declared type
 * @param ordinal Zero-based position in the parameter list
 */
public record ParameterSymbol(String name, TypeSymbol type, int ordinal) {

    public ParameterSymbol {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal cannot be negative");
        }
    }
}
