package com.codeharness.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs a one-line summary of every finished run.
 */
public class LoggingTestRunSink implements TestRunSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingTestRunSink.class);

    @Override
    public void accept(TestRunReport report) {
        var summary = report.summary();
        var stats = summary.statistics();
        log.info("Run {} [{}] {}: {} passed, {} failed of {} ({}% pass rate, {} files)",
                summary.sessionId(), summary.kind(), summary.state(), stats.passed(), stats.failed(),
                summary.requestedTests(), Math.round(stats.passRate()), report.filesSnapshot().files().size());
    }
}
