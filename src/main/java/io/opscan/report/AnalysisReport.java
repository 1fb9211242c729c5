package io.opscan.report;

import io.opscan.engine.AnalysisResult;
import io.opscan.rules.Diagnostic;
import io.opscan.rules.Severity;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Complete report of one op-scan run over one or more compilations.
 *
 * @param results       Per-compilation results, in input order
 * @param startTime     When the run started
 * @param duration      How long the run took
 * @param configuration Configuration used for the run
 */
public record AnalysisReport(
        List<AnalysisResult> results,
        Instant startTime,
        Duration duration,
        RunConfiguration configuration
) {
    /**
     * Configuration snapshot used for the run.
     */
    public record RunConfiguration(
            Severity minimumSeverity,
            boolean ideExtensionBuild,
            int parallelism,
            List<String> excludePaths
    ) {
        public RunConfiguration {
            if (minimumSeverity == null) {
                minimumSeverity = Severity.HIDDEN;
            }
            excludePaths = excludePaths != null ? List.copyOf(excludePaths) : List.of();
        }
    }

    /**
     * Compact constructor with validation.
     */
    public AnalysisReport {
        results = results != null ? List.copyOf(results) : List.of();
        if (startTime == null) {
            startTime = Instant.now();
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
        if (configuration == null) {
            configuration = new RunConfiguration(Severity.HIDDEN, false, 1, List.of());
        }
    }

    /**
     * All diagnostics at or above the configured minimum severity, compilation by compilation.
     */
    public List<Diagnostic> diagnostics() {
        return results.stream()
                .flatMap(r -> r.diagnostics().stream())
                .filter(d -> d.severity().isAtLeast(configuration.minimumSeverity()))
                .toList();
    }

    public int totalDiagnostics() {
        return diagnostics().size();
    }

    /**
     * Returns count of reported diagnostics per rule id, ordered by id.
     */
    public Map<String, Long> countsByRule() {
        return diagnostics().stream()
                .collect(Collectors.groupingBy(Diagnostic::ruleId, TreeMap::new, Collectors.counting()));
    }

    public long countBySeverity(Severity severity) {
        return diagnostics().stream()
                .filter(d -> d.severity() == severity)
                .count();
    }

    /**
     * Returns true if there are any reported diagnostics at or above the given severity.
     */
    public boolean hasDiagnosticsAtLeast(Severity severity) {
        return diagnostics().stream().anyMatch(d -> d.severity().isAtLeast(severity));
    }

    public int unitsAnalyzed() {
        return results.stream().mapToInt(AnalysisResult::unitsAnalyzed).sum();
    }

    public long nodesVisited() {
        return results.stream().mapToLong(AnalysisResult::nodesVisited).sum();
    }

    public int failedEvaluations() {
        return results.stream().mapToInt(AnalysisResult::failedEvaluations).sum();
    }

    public LocalDateTime startDate() {
        return LocalDateTime.ofInstant(startTime, ZoneId.systemDefault());
    }

    public long durationMs() {
        return duration.toMillis();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<AnalysisResult> results = List.of();
        private Instant startTime;
        private Duration duration;
        private RunConfiguration configuration;

        public Builder results(List<AnalysisResult> results) {
            this.results = results;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder configuration(RunConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public AnalysisReport build() {
            return new AnalysisReport(results, startTime, duration, configuration);
        }
    }
}
