package io.opscan.engine;

import io.opscan.rules.Diagnostic;
import io.opscan.rules.Severity;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of analyzing one compilation.
 *
 * @param compilationName   Name of the analyzed compilation
 * @param diagnostics       Reported diagnostics in {@link Diagnostic#SOURCE_ORDER}
 * @param activeRules       Ids of rules that ran
 * @param inertRules        Ids of enabled rules that were inert for this compilation
 * @param unitsAnalyzed     Number of compilation units visited
 * @param nodesVisited      Number of operation nodes visited
 * @param failedEvaluations Number of node evaluations that failed and were skipped
 * @param duration          Wall-clock analysis time
 */
public record AnalysisResult(
        String compilationName,
        List<Diagnostic> diagnostics,
        List<String> activeRules,
        List<String> inertRules,
        int unitsAnalyzed,
        long nodesVisited,
        int failedEvaluations,
        Duration duration
) {
    public AnalysisResult {
        if (compilationName == null || compilationName.isBlank()) {
            throw new IllegalArgumentException("compilationName cannot be null or blank");
        }
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        activeRules = activeRules != null ? List.copyOf(activeRules) : List.of();
        inertRules = inertRules != null ? List.copyOf(inertRules) : List.of();
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    public List<Diagnostic> diagnosticsFor(String ruleId) {
        return diagnostics.stream()
                .filter(d -> d.ruleId().equals(ruleId))
                .toList();
    }

    public Map<Severity, Long> countsBySeverity() {
        return diagnostics.stream()
                .collect(Collectors.groupingBy(Diagnostic::severity, Collectors.counting()));
    }

    /**
     * Returns true if there are any diagnostics at or above the given severity.
     */
    public boolean hasDiagnosticsAtLeast(Severity severity) {
        return diagnostics.stream().anyMatch(d -> d.severity().isAtLeast(severity));
    }
}
