package io.opscan.rules;

/**
 * How a rule treats compilation units the host marked as generated.
 */
public enum GeneratedCodeMode {
    /**
     * Generated units are visited and diagnostics in them are reported.
     */
    ANALYZE,

    /**
     * Generated units are never handed to the rule.
     */
    SKIP
}
