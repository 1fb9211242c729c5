package io.opscan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class OpScanCliTest {

    @TempDir
    Path dir;

    private Path certificates;
    private Path handles;
    private Path report;

    @BeforeEach
    void setUp() throws IOException, URISyntaxException {
        certificates = copyFixture("certificate-callbacks.yaml");
        handles = copyFixture("native-handles.yaml");
        report = dir.resolve("report.json");
    }

    private Path copyFixture(String name) throws IOException, URISyntaxException {
        Path source = Path.of(OpScanCliTest.class.getResource("/snapshots/" + name).toURI());
        return Files.copy(source, dir.resolve(name));
    }

    private static int run(String... args) {
        return new CommandLine(new OpScanCli()).execute(args);
    }

    private JsonNode readReport() throws IOException {
        return new ObjectMapper().readTree(report.toFile());
    }

    @Test
    void run_writesJsonReportAndSucceedsOnWarnings() throws IOException {
        int exitCode = run(certificates.toString(), "-o", "json", "-f", report.toString());

        assertThat(exitCode).isZero();
        JsonNode root = readReport();
        assertThat(root.path("summary").path("warning").asInt()).isEqualTo(2);
        assertThat(root.path("compilations").get(0).path("name").asText()).isEqualTo("Sample.Net");
    }

    @Test
    void run_failsOnConfiguredSeverity() {
        int exitCode = run(certificates.toString(), "-o", "json", "-f", report.toString(), "--fail-on", "warning");

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void run_analyzesEverySnapshot() throws IOException {
        int exitCode = run(certificates.toString(), handles.toString(), "-o", "json", "-f", report.toString(),
                "--threads", "2");

        assertThat(exitCode).isZero();
        JsonNode root = readReport();
        assertThat(root.path("compilations")).hasSize(2);
        assertThat(root.path("summary").path("byRule").path("CA2216").asInt()).isEqualTo(1);
        assertThat(root.path("metadata").path("unitsAnalyzed").asInt()).isEqualTo(3);
    }

    @Test
    void run_picksUpConfigNextToSnapshot() throws IOException {
        Files.writeString(dir.resolve("op-scan.yaml"), "rules:\n  CA5359:\n    enabled: false\n");

        int exitCode = run(certificates.toString(), "-o", "json", "-f", report.toString(), "--fail-on", "warning");

        assertThat(exitCode).isZero();
        assertThat(readReport().path("summary").path("total").asInt()).isZero();
    }

    @Test
    void run_explicitConfigRaisesSeverity() throws IOException {
        Path config = dir.resolve("strict.yaml");
        Files.writeString(config, "rules:\n  CA2216:\n    severity: error\n");

        int exitCode = run(handles.toString(), "-c", config.toString(), "-o", "json", "-f", report.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(readReport().path("summary").path("error").asInt()).isEqualTo(1);
    }

    @Test
    void run_ideExtensionBuildReportsNothing() throws IOException {
        int exitCode = run(certificates.toString(), handles.toString(), "--ide-extension-build",
                "-o", "json", "-f", report.toString(), "--fail-on", "hidden");

        assertThat(exitCode).isZero();
        assertThat(readReport().path("summary").path("total").asInt()).isZero();
    }

    @Test
    void run_severityThresholdFiltersReport() throws IOException {
        int exitCode = run(certificates.toString(), "-o", "json", "-f", report.toString(), "-s", "error");

        assertThat(exitCode).isZero();
        assertThat(readReport().path("summary").path("total").asInt()).isZero();
    }

    @Test
    void run_consoleReportToFile() throws IOException {
        Path text = dir.resolve("report.txt");

        int exitCode = run(handles.toString(), "--no-color", "-f", text.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(text)).contains("src/FileHandle.cs(4,18): warning CA2216");
    }

    @Test
    void run_rejectsMissingSnapshot() {
        assertThat(run(dir.resolve("absent.yaml").toString())).isEqualTo(1);
    }

    @Test
    void run_rejectsInvalidSeverity() {
        assertThat(run(certificates.toString(), "--fail-on", "catastrophic")).isEqualTo(1);
    }

    @Test
    void run_rejectsNonPositiveThreads() {
        assertThat(run(certificates.toString(), "-t", "0")).isEqualTo(1);
    }

    @Test
    void run_reportsMalformedSnapshot() throws IOException {
        Path broken = dir.resolve("broken.yaml");
        Files.writeString(broken, "units:\n  - path: a.cs\n    types:\n      - name: A\n        span: nope\n");

        assertThat(run(broken.toString(), "-o", "json", "-f", report.toString())).isEqualTo(1);
        assertThat(report).doesNotExist();
    }

    @Test
    void run_rejectsMissingExplicitConfig() {
        assertThat(run(certificates.toString(), "-c", dir.resolve("nope.yaml").toString())).isEqualTo(1);
    }
}
