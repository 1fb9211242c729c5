package io.opscan.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.opscan.engine.AnalysisResult;
import io.opscan.model.Location;
import io.opscan.rules.Diagnostic;
import io.opscan.rules.Severity;

import java.io.IOException;
import java.io.Writer;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Formats analysis results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Writer belongs to the caller (e.g., System.out).
        m.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
        writer.flush();
    }

    private JsonReport toJsonReport(AnalysisReport report) {
        Severity minimum = report.configuration().minimumSeverity();
        return new JsonReport(
                new JsonReport.Metadata(
                        report.startDate(),
                        report.durationMs(),
                        report.results().size(),
                        report.unitsAnalyzed(),
                        report.nodesVisited(),
                        report.failedEvaluations(),
                        minimum.label()
                ),
                new JsonReport.Summary(
                        report.countBySeverity(Severity.ERROR),
                        report.countBySeverity(Severity.WARNING),
                        report.countBySeverity(Severity.INFO),
                        report.countBySeverity(Severity.HIDDEN),
                        report.totalDiagnostics(),
                        report.countsByRule()
                ),
                report.results().stream()
                        .map(result -> toJsonCompilation(result, minimum))
                        .toList()
        );
    }

    private JsonReport.Compilation toJsonCompilation(AnalysisResult result, Severity minimum) {
        return new JsonReport.Compilation(
                result.compilationName(),
                result.activeRules(),
                result.inertRules().isEmpty() ? null : result.inertRules(),
                result.diagnostics().stream()
                        .filter(d -> d.severity().isAtLeast(minimum))
                        .map(this::toJsonDiagnostic)
                        .toList()
        );
    }

    private JsonReport.Diagnostic toJsonDiagnostic(Diagnostic diagnostic) {
        return new JsonReport.Diagnostic(
                diagnostic.ruleId(),
                diagnostic.category().displayName(),
                diagnostic.severity().label(),
                diagnostic.message(),
                toJsonLocation(diagnostic.location()),
                diagnostic.additionalLocations().isEmpty()
                        ? null
                        : diagnostic.additionalLocations().stream().map(this::toJsonLocation).toList()
        );
    }

    private JsonReport.Location toJsonLocation(Location location) {
        if (!location.isKnown()) {
            return new JsonReport.Location(location.path(), null, null, null, null);
        }
        return new JsonReport.Location(location.path(), location.startLine(), location.startColumn(),
                location.endLine(), location.endColumn());
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            Metadata metadata,
            Summary summary,
            List<Compilation> compilations
    ) {
        public record Metadata(
                LocalDateTime runDate,
                long durationMs,
                int compilations,
                int unitsAnalyzed,
                long nodesVisited,
                int failedEvaluations,
                String minimumSeverity
        ) {}

        public record Summary(
                long error,
                long warning,
                long info,
                long hidden,
                int total,
                Map<String, Long> byRule
        ) {}

        public record Compilation(
                String name,
                List<String> activeRules,
                List<String> inertRules,
                List<Diagnostic> diagnostics
        ) {}

        public record Diagnostic(
                String ruleId,
                String category,
                String severity,
                String message,
                Location location,
                List<Location> additionalLocations
        ) {}

        public record Location(
                String path,
                Integer startLine,
                Integer startColumn,
                Integer endLine,
                Integer endColumn
        ) {}
    }
}
