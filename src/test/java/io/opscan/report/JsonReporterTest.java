package io.opscan.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opscan.rules.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReporterTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
    }

    @Test
    void format_isJson() {
        assertThat(new JsonReporter().format()).isEqualTo("json");
    }

    @Test
    void write_producesSummaryAndCompilations() throws IOException {
        String json = new JsonReporter().toString(ReportFixtures.report(Severity.INFO));
        JsonNode root = mapper.readTree(json);

        assertThat(root.path("metadata").path("compilations").asInt()).isEqualTo(2);
        assertThat(root.path("metadata").path("minimumSeverity").asText()).isEqualTo("info");
        assertThat(root.path("metadata").path("runDate").isTextual()).isTrue();
        assertThat(root.path("summary").path("error").asLong()).isEqualTo(1);
        assertThat(root.path("summary").path("warning").asLong()).isEqualTo(2);
        assertThat(root.path("summary").path("byRule").path("CA5359").asLong()).isEqualTo(2);

        JsonNode net = root.path("compilations").get(0);
        assertThat(net.path("name").asText()).isEqualTo("Sample.Net");
        assertThat(net.path("inertRules").get(0).asText()).isEqualTo("CA2216");
        assertThat(net.path("diagnostics")).hasSize(2);
        assertThat(net.path("diagnostics").get(0).path("location").path("startLine").asInt()).isEqualTo(12);
    }

    @Test
    void write_omitsEmptyOptionalFields() throws IOException {
        JsonNode root = mapper.readTree(new JsonReporter().toString(ReportFixtures.report(Severity.INFO)));

        JsonNode interop = root.path("compilations").get(1);
        assertThat(interop.has("inertRules")).isFalse();

        JsonNode finalizer = interop.path("diagnostics").get(0);
        assertThat(finalizer.path("category").asText()).isEqualTo("Usage");
        assertThat(finalizer.path("additionalLocations").get(0).path("startLine").asInt()).isEqualTo(12);

        JsonNode certificate = root.path("compilations").get(0).path("diagnostics").get(0);
        assertThat(certificate.has("additionalLocations")).isFalse();
    }

    @Test
    void write_toFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("report.json");

        new JsonReporter(false).write(ReportFixtures.report(Severity.ERROR), file);

        JsonNode root = mapper.readTree(file.toFile());
        assertThat(root.path("summary").path("total").asInt()).isEqualTo(1);
    }
}
