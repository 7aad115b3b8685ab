package com.codeharness.core.persistence;

import com.codeharness.core.testing.TestRecord;
import com.codeharness.core.testing.TestRunSummary;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a sink needs to persist one finished run.
 */
public record TestRunReport(TestRunSummary summary, FilesSnapshot filesSnapshot) {

    /**
     * Mismatch details keyed by test number, plus the run-level analysis under {@code run}.
     */
    public Map<String, Object> mismatchAnalysis() {
        Map<String, Object> analysis = new LinkedHashMap<>();
        for (TestRecord record : summary.recordsByTestNumber()) {
            if (record.mismatchAnalysis() != null) {
                analysis.put("test_" + record.testNumber(), record.mismatchAnalysis());
            }
        }
        if (!summary.analysis().isEmpty()) {
            analysis.put("run", summary.analysis());
        }
        return analysis;
    }
}
