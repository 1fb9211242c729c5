package io.opscan.report;

import io.opscan.engine.AnalysisResult;
import io.opscan.model.Location;
import io.opscan.rules.Diagnostic;
import io.opscan.rules.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * Formats analysis results for console output with ANSI colors.
 * <p>
 * Layout: header, one-line summary, per-rule counts, then diagnostics grouped by compilation
 * in compiler-style {@code path(line,col): severity ID: message} lines.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private final boolean useColors;

    public ConsoleReporter() {
        this(true);
    }

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, report);
        printSummary(out, report);
        printRuleBreakdown(out, report);
        printDiagnostics(out, report);
        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out, AnalysisReport report) {
        out.println();
        out.println(line('=', 70));
        out.println(center("OP-SCAN REPORT", 70));
        out.println(line('=', 70));
        out.println();
        out.println("Run Date: " + report.startDate());
        out.println();
    }

    private void printSummary(PrintWriter out, AnalysisReport report) {
        out.println(bold("SUMMARY"));
        out.println(line('-', 70));

        out.println(String.format("Analyzed: %d compilation(s) | %,d units | %,d nodes | %.1fs",
                report.results().size(),
                report.unitsAnalyzed(),
                report.nodesVisited(),
                report.durationMs() / 1000.0));

        long errors = report.countBySeverity(Severity.ERROR);
        long warnings = report.countBySeverity(Severity.WARNING);
        StringBuilder counts = new StringBuilder("Diagnostics: ");
        counts.append(errors > 0 ? color(RED, errors + " error") : "0 error").append(" | ");
        counts.append(warnings > 0 ? color(YELLOW, warnings + " warning") : "0 warning").append(" | ");
        counts.append(report.countBySeverity(Severity.INFO)).append(" info | ");
        counts.append(report.countBySeverity(Severity.HIDDEN)).append(" hidden");
        out.println(counts);

        if (report.failedEvaluations() > 0) {
            out.println(color(YELLOW, report.failedEvaluations() + " node evaluation(s) failed and were skipped"));
        }
        out.println();
    }

    private void printRuleBreakdown(PrintWriter out, AnalysisReport report) {
        Map<String, Long> byRule = report.countsByRule();
        if (byRule.isEmpty()) {
            return;
        }

        out.println(bold("RULES"));
        out.println(line('-', 70));
        byRule.forEach((ruleId, count) -> out.println(String.format("  %-8s %5d", ruleId, count)));
        out.println();
    }

    private void printDiagnostics(PrintWriter out, AnalysisReport report) {
        Severity minimum = report.configuration().minimumSeverity();
        for (AnalysisResult result : report.results()) {
            List<Diagnostic> shown = result.diagnostics().stream()
                    .filter(d -> d.severity().isAtLeast(minimum))
                    .toList();

            out.println(bold(result.compilationName()) + color(CYAN, " [" + shown.size() + " diagnostics]"));
            if (!result.inertRules().isEmpty()) {
                out.println("  inert: " + String.join(", ", result.inertRules())
                        + " (required types not available)");
            }
            for (Diagnostic diagnostic : shown) {
                printDiagnostic(out, diagnostic);
            }
            out.println();
        }
    }

    private void printDiagnostic(PrintWriter out, Diagnostic diagnostic) {
        out.println("  " + diagnostic.location().display() + ": "
                + severityIndicator(diagnostic.severity()) + " "
                + bold(diagnostic.ruleId()) + ": " + diagnostic.message());
        for (Location related : diagnostic.additionalLocations()) {
            out.println("      related: " + related.display());
        }
    }

    private void printFooter(PrintWriter out, AnalysisReport report) {
        out.println(line('=', 70));

        long errors = report.countBySeverity(Severity.ERROR);
        long warnings = report.countBySeverity(Severity.WARNING);
        if (errors > 0) {
            out.println(color(RED, bold("ACTION REQUIRED: " + errors + " error(s) reported.")));
        } else if (warnings > 0) {
            out.println(color(YELLOW, "ATTENTION: " + warnings + " warning(s) should be reviewed."));
        } else {
            out.println(color(GREEN, "No issues found."));
        }
        out.println();
    }

    private String severityIndicator(Severity severity) {
        return switch (severity) {
            case ERROR -> color(RED, "error");
            case WARNING -> color(YELLOW, "warning");
            case INFO -> color(CYAN, "info");
            case HIDDEN -> "hidden";
        };
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
