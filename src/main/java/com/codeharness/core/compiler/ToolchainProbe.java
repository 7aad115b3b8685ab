package com.codeharness.core.compiler;

import com.codeharness.core.health.HealthStatus;
import com.codeharness.core.process.ExecutionRequest;
import com.codeharness.core.process.ExecutionResult;
import com.codeharness.core.process.ProcessExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs a tool's version flag to see whether it is installed.
 */
final class ToolchainProbe {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    private ToolchainProbe() {}

    static HealthStatus probe(ProcessExecutor executor, String component, String tool, String versionFlag)
            throws InterruptedException {
        if (tool == null || tool.isBlank()) {
            return new HealthStatus(component, HealthStatus.Status.DOWN, "No toolchain configured", Map.of());
        }
        ExecutionResult result = executor.run(ExecutionRequest.of(List.of(tool, versionFlag), null, PROBE_TIMEOUT));
        if (result.launchFailed()) {
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    "'" + tool + "' not found", Map.of("tool", tool));
        }
        String version = firstLine(result.stdout().isBlank() ? result.stderr() : result.stdout());
        if (result.returnCode() != 0) {
            return new HealthStatus(component, HealthStatus.Status.DEGRADED,
                    "'" + tool + "' exited with code " + result.returnCode(), Map.of("tool", tool));
        }
        return new HealthStatus(component, HealthStatus.Status.UP, version, Map.of("tool", tool));
    }

    private static String firstLine(String text) {
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        return newline >= 0 ? trimmed.substring(0, newline).strip() : trimmed;
    }
}
