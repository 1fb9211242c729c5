package io.opscan.rules;

/**
 * Categories rules are grouped under in reports.
 */
public enum RuleCategory {
    SECURITY("Security"),
    USAGE("Usage"),
    RELIABILITY("Reliability"),
    DESIGN("Design");

    private final String displayName;

    RuleCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
