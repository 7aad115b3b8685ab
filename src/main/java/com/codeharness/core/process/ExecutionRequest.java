package com.codeharness.core.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Everything needed to launch one process.
 *
 * @param command          program and arguments
 * @param input            text written to stdin and then closed; {@code null} closes stdin immediately
 * @param timeout          wall-clock limit after which the process tree is killed
 * @param monitorMemory    whether to sample resident memory while polling
 * @param workingDirectory working directory, or {@code null} to inherit
 * @param cancellation     polled while waiting; a cancelled run is killed
 */
public record ExecutionRequest(
        List<String> command,
        String input,
        Duration timeout,
        boolean monitorMemory,
        Path workingDirectory,
        CancellationToken cancellation
) {

    public ExecutionRequest {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
        timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        cancellation = cancellation == null ? CancellationToken.NONE : cancellation;
    }

    public static ExecutionRequest of(List<String> command, String input, Duration timeout) {
        return new ExecutionRequest(command, input, timeout, false, null, CancellationToken.NONE);
    }

    public ExecutionRequest withMemoryMonitoring(boolean monitor) {
        return new ExecutionRequest(command, input, timeout, monitor, workingDirectory, cancellation);
    }

    public ExecutionRequest withWorkingDirectory(Path directory) {
        return new ExecutionRequest(command, input, timeout, monitorMemory, directory, cancellation);
    }

    public ExecutionRequest withCancellation(CancellationToken token) {
        return new ExecutionRequest(command, input, timeout, monitorMemory, workingDirectory, token);
    }
}
