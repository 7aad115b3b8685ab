package com.codeharness.dispatch.cli;

import com.codeharness.core.compilation.CompilationReport;
import com.codeharness.core.events.HarnessEvent;
import com.codeharness.core.testing.MismatchAnalysis;
import com.codeharness.core.testing.TestRecord;
import com.codeharness.core.testing.TestRunSummary;
import com.codeharness.core.testing.TestStatistics;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the harness CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CODE HARNESS v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HARNESS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** Prints a compile progress event with the color of its severity. */
    public static void progress(HarnessEvent event) {
        String message = event.message();
        if (message == null) {
            return;
        }
        switch (event.severity()) {
            case SUCCESS -> success(message);
            case ERROR -> error(message);
            case INFO -> info(message);
        }
    }

    public static void compilation(CompilationReport report) {
        String line = String.format(Locale.ROOT, "Compilation %s in %s (%d built, %d up to date)",
                report.success() ? "succeeded" : "failed",
                formatDuration(Math.round(report.elapsedSeconds() * 1000)),
                report.outcomes().size(), report.upToDateRoles().size());
        if (report.success()) {
            success(line);
        } else {
            error(line);
        }
    }

    public static void testRecord(TestRecord record, int previewLength) {
        String status = record.passed() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        String timing = formatDuration(Math.round(record.totalSeconds() * 1000));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [TEST " + record.testNumber() + "]|@ " + status + " "
                        + (record.errorDetail() == null ? "" : record.errorDetail()) + " (" + timing + ")"));
        if (!record.passed() && record.input() != null) {
            System.out.println("    input: " + TestRecord.preview(record.input().strip(), previewLength));
        }
        MismatchAnalysis mismatch = record.mismatchAnalysis();
        if (mismatch != null) {
            for (MismatchAnalysis.LineDifference diff : mismatch.lineDifferences().stream().limit(5).toList()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    @|fg(red) line " + diff.lineNumber() + " (" + diff.type() + ")|@ expected '"
                                + TestRecord.preview(diff.expected(), previewLength) + "' got '"
                                + TestRecord.preview(diff.actual(), previewLength) + "'"));
            }
        }
    }

    public static void summary(TestRunSummary summary) {
        TestStatistics stats = summary.statistics();
        System.out.println("──────────────────────────────────");
        String line = String.format(Locale.ROOT,
                "%s run %s: %d/%d passed (%.1f%%), avg %s, max %s, total %s",
                summary.kind(), summary.state(), stats.passed(), summary.requestedTests(), stats.passRate(),
                formatDuration(Math.round(stats.averageSeconds() * 1000)),
                formatDuration(Math.round(stats.maxSeconds() * 1000)),
                formatDuration(Math.round(summary.elapsedSeconds() * 1000)));
        if (summary.allPassed()) {
            success(line);
        } else {
            error(line);
        }
    }

    public static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
