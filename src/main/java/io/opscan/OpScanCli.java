package io.opscan;

import io.opscan.config.AnalyzerConfig;
import io.opscan.engine.AnalysisEngine;
import io.opscan.engine.AnalysisResult;
import io.opscan.report.AnalysisReport;
import io.opscan.report.ConsoleReporter;
import io.opscan.report.JsonReporter;
import io.opscan.report.Reporter;
import io.opscan.rules.RuleCatalog;
import io.opscan.rules.RuleRegistry;
import io.opscan.rules.Severity;
import io.opscan.semantics.Compilation;
import io.opscan.snapshot.SnapshotException;
import io.opscan.snapshot.SnapshotLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * CLI entry point for the op-scan tool.
 */
@Command(
        name = "op-scan",
        mixinStandardHelpOptions = true,
        version = "op-scan 1.0.0",
        description = "Runs operation-tree rules (CA5359, CA2216) over compilation snapshots exported by a compiler host.",
        footer = {
                "",
                "Examples:",
                "  op-scan build/snapshots/app.yaml",
                "  op-scan app.yaml lib.yaml --output-format json --output-file report.json",
                "  op-scan app.yaml --severity-threshold warning --fail-on warning",
                "  op-scan app.yaml --config op-scan.yaml --threads 4"
        }
)
public class OpScanCli implements Callable<Integer> {

    static final String PROJECT_CONFIG_FILE = "op-scan.yaml";

    @Parameters(
            arity = "1..*",
            description = "Compilation snapshot file(s) to analyze (YAML or JSON)"
    )
    private List<Path> snapshotPaths;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file (defaults to op-scan.yaml next to the first snapshot)"
    )
    private Path configFile;

    @Option(
            names = {"-s", "--severity-threshold"},
            description = "Minimum severity to report: error, warning, info, hidden",
            defaultValue = "info"
    )
    private String severityThreshold;

    @Option(
            names = {"--fail-on"},
            description = "Exit with code 2 if diagnostics at this severity or higher: error, warning, info, hidden",
            defaultValue = "error"
    )
    private String failOnSeverity;

    @Option(
            names = {"-t", "--threads"},
            description = "Number of units analyzed concurrently (overrides configuration)"
    )
    private Integer threads;

    @Option(
            names = {"--ide-extension-build"},
            description = "Analyze as the IDE extension build does (CA2216 unsupported, CA5359 off by default)"
    )
    private boolean ideExtensionBuild;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        Instant startTime = Instant.now();

        try {
            for (Path snapshot : snapshotPaths) {
                if (!Files.isRegularFile(snapshot)) {
                    System.err.println("Error: Snapshot file does not exist: " + snapshot);
                    return 1;
                }
            }

            Severity minSeverity = parseSeverity(severityThreshold, "severity-threshold");
            if (minSeverity == null) return 1;

            Severity failSeverity = parseSeverity(failOnSeverity, "fail-on");
            if (failSeverity == null) return 1;

            if (threads != null && threads < 1) {
                System.err.println("Error: --threads must be at least 1");
                return 1;
            }

            AnalyzerConfig config = loadConfig();
            log("  IDE extension build: " + config.isIdeExtensionBuild() + ", parallelism: " + config.parallelism());

            RuleRegistry registry = RuleRegistry.createDefault(RuleCatalog.loadDefault(), config.isIdeExtensionBuild());
            AnalysisEngine engine = new AnalysisEngine(registry, config);

            List<AnalysisResult> results = new ArrayList<>();
            for (Path snapshot : snapshotPaths) {
                log("Loading snapshot " + snapshot + "...");
                Compilation compilation = SnapshotLoader.load(snapshot);
                log("  " + compilation.units().size() + " units, " + compilation.blockCount() + " operation blocks");

                AnalysisResult result = engine.analyze(compilation);
                log("  " + result.diagnostics().size() + " diagnostics from " + result.activeRules().size()
                        + " active rule(s)"
                        + (result.inertRules().isEmpty() ? "" : ", inert: " + String.join(", ", result.inertRules())));
                results.add(result);
            }

            AnalysisReport report = AnalysisReport.builder()
                    .results(results)
                    .startTime(startTime)
                    .duration(Duration.between(startTime, Instant.now()))
                    .configuration(new AnalysisReport.RunConfiguration(
                            minSeverity,
                            config.isIdeExtensionBuild(),
                            config.parallelism(),
                            config.excludePathPatterns()
                    ))
                    .build();

            writeReport(report, createReporter());

            if (report.hasDiagnosticsAtLeast(failSeverity)) {
                if (outputFormat == OutputFormat.console) {
                    System.err.println();
                    System.err.println("Failing due to diagnostics at " + failSeverity.label() + " level or higher.");
                }
                return 2;
            }

            return 0;

        } catch (SnapshotException e) {
            System.err.println("Error reading snapshot: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (CancellationException e) {
            System.err.println("Error: Analysis cancelled");
            return 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private AnalyzerConfig loadConfig() throws IOException {
        AnalyzerConfig config = AnalyzerConfig.loadDefault();

        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Configuration file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            config = config.merge(AnalyzerConfig.loadFromFile(configFile));
        } else {
            Path parent = snapshotPaths.get(0).toAbsolutePath().getParent();
            Path projectConfig = parent != null ? parent.resolve(PROJECT_CONFIG_FILE) : null;
            if (projectConfig != null && Files.exists(projectConfig)) {
                log("Loading configuration from: " + projectConfig);
                config = config.merge(AnalyzerConfig.loadFromFile(projectConfig));
            }
        }

        if (ideExtensionBuild) {
            config = config.withIdeExtensionBuild(true);
        }
        if (threads != null) {
            config = config.withParallelism(threads);
        }
        return config;
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor);
            case json -> new JsonReporter(true);
        };
    }

    private void writeReport(AnalysisReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            reporter.write(report, new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        }
    }

    private void log(String message) {
        if (verbose && outputFormat != OutputFormat.json) {
            System.out.println(message);
        }
    }

    private Severity parseSeverity(String value, String optionName) {
        return Severity.parse(value).orElseGet(() -> {
            System.err.println("Error: Invalid value for --" + optionName + ": " + value);
            System.err.println("Valid values: error, warning, info, hidden");
            return null;
        });
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OpScanCli()).execute(args);
        System.exit(exitCode);
    }
}
