package io.opscan.rules;

import java.util.Locale;
import java.util.Optional;

/**
 * Diagnostic severities, from least to most severe.
 */
public enum Severity {
    /**
     * Not shown to the user, only visible to tooling.
     */
    HIDDEN(0, "hidden"),

    INFO(1, "info"),

    WARNING(2, "warning"),

    /**
     * Fails the build when reported by the host.
     */
    ERROR(3, "error");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank >= threshold.rank;
    }

    /**
     * Parses a case-insensitive severity name ("warning", "Error", ...).
     */
    public static Optional<Severity> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.label.equals(normalized)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
