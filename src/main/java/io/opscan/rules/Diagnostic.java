package io.opscan.rules;

import io.opscan.model.Location;

import java.util.Comparator;
import java.util.List;

/**
 * A confirmed rule violation.
 *
 * @param ruleId              Id of the rule that reported it
 * @param category            Category of that rule
 * @param severity            Effective severity
 * @param message             Formatted message
 * @param location            Primary source location
 * @param additionalLocations Related locations (e.g., the assignment behind a type-level diagnostic)
 */
public record Diagnostic(
        String ruleId,
        RuleCategory category,
        Severity severity,
        String message,
        Location location,
        List<Location> additionalLocations
) {
    /**
     * Stable order used for reports: path, position, then rule id and message.
     */
    public static final Comparator<Diagnostic> SOURCE_ORDER = Comparator
            .comparing((Diagnostic d) -> d.location().path())
            .thenComparingInt(d -> d.location().startLine())
            .thenComparingInt(d -> d.location().startColumn())
            .thenComparing(Diagnostic::ruleId)
            .thenComparing(Diagnostic::message);

    public Diagnostic {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId cannot be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        if (message == null) {
            message = "";
        }
        additionalLocations = additionalLocations != null ? List.copyOf(additionalLocations) : List.of();
    }

    /**
     * Creates a diagnostic for {@code descriptor} at {@code location}.
     */
    public static Diagnostic create(RuleDescriptor descriptor, Location location,
                                    List<Location> additionalLocations, Object... messageArgs) {
        return new Diagnostic(
                descriptor.id(),
                descriptor.category(),
                descriptor.defaultSeverity(),
                descriptor.formatMessage(messageArgs),
                location,
                additionalLocations
        );
    }

    public static Diagnostic create(RuleDescriptor descriptor, Location location, Object... messageArgs) {
        return create(descriptor, location, List.of(), messageArgs);
    }
}
