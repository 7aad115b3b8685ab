package com.codeharness.core.process;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Outcome of one external process run. Failures are data, not exceptions.
 *
 * @param returnCode     exit code, or {@code -1} when the process could not be started
 * @param stdout         captured standard output
 * @param stderr         captured standard error (or the launch error message)
 * @param elapsedSeconds wall-clock time from launch to exit or kill
 * @param peakMemoryMb   largest sampled resident memory, {@code 0} when not monitored
 * @param timedOut       the process was killed for exceeding its timeout
 * @param canceled       the process was killed because its owner was cancelled
 * @param launchFailed   the process never started
 * @param command        the command that was run
 */
public record ExecutionResult(
        int returnCode,
        String stdout,
        String stderr,
        double elapsedSeconds,
        double peakMemoryMb,
        boolean timedOut,
        boolean canceled,
        boolean launchFailed,
        List<String> command
) {

    public ExecutionResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        command = command == null ? List.of() : List.copyOf(command);
    }

    public static ExecutionResult launchFailure(List<String> command, String message, double elapsedSeconds) {
        return new ExecutionResult(-1, "", message, elapsedSeconds, 0.0, false, false, true, command);
    }

    public boolean succeeded() {
        return returnCode == 0 && !timedOut && !canceled && !launchFailed;
    }

    public long elapsedMillis() {
        return Math.round(elapsedSeconds * 1000);
    }

    /**
     * Classifies a failed run; empty when the run succeeded.
     */
    public Optional<FailureKind> failure() {
        if (canceled) {
            return Optional.of(FailureKind.CANCELED);
        }
        if (launchFailed) {
            return Optional.of(FailureKind.LAUNCH_FAILURE);
        }
        if (timedOut) {
            return Optional.of(FailureKind.TIMEOUT);
        }
        if (returnCode == 0) {
            return Optional.empty();
        }
        return Optional.of(isCrash(returnCode) ? FailureKind.CRASH_EXIT : FailureKind.RUNTIME_ERROR);
    }

    /**
     * On Unix the JDK reports death by signal N as {@code 128 + N}; on Windows access violations
     * surface as large negative NTSTATUS values.
     */
    static boolean isCrash(int returnCode) {
        return (returnCode > 128 && returnCode <= 128 + 64) || returnCode < -1;
    }

    /**
     * Multi-line human-readable summary of this run.
     */
    public String summary() {
        String status = timedOut ? "TIMEOUT" : canceled ? "CANCELED" : succeeded() ? "SUCCESS" : "FAILED";
        StringBuilder sb = new StringBuilder();
        sb.append("Command: ").append(String.join(" ", command)).append('\n');
        sb.append("Status: ").append(status).append('\n');
        sb.append("Return code: ").append(returnCode).append('\n');
        sb.append(String.format(Locale.ROOT, "Execution time: %.3fs%n", elapsedSeconds));
        if (peakMemoryMb > 0) {
            sb.append(String.format(Locale.ROOT, "Peak memory: %.1fMB%n", peakMemoryMb));
        }
        sb.append("Output length: ").append(stdout.length()).append(" chars\n");
        if (!stderr.isEmpty()) {
            sb.append("Error output length: ").append(stderr.length()).append(" chars\n");
        }
        return sb.toString();
    }
}
