package com.codeharness.core.compiler;

import com.codeharness.core.process.ExecutionResult;
import com.codeharness.core.process.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Helpers shared by the compiled strategies.
 */
final class CompilerRuns {

    private static final Logger log = LoggerFactory.getLogger(CompilerRuns.class);

    private CompilerRuns() {}

    /**
     * Maps a failed compiler run to an outcome. Returns {@code null} when the run succeeded.
     */
    static BuildOutcome failureOf(ExecutionResult result, String tool, Path source, Duration timeout) {
        String fileName = source.getFileName().toString();
        if (result.launchFailed()) {
            return BuildOutcome.failed(FailureKind.LAUNCH_FAILURE,
                    "Compiler '" + tool + "' not found. Please install it or add it to PATH. (" + result.stderr() + ")",
                    result.elapsedSeconds());
        }
        if (result.timedOut()) {
            return BuildOutcome.failed(FailureKind.TIMEOUT,
                    "Compilation timeout (" + timeout.toSeconds() + "s) for " + fileName, result.elapsedSeconds());
        }
        if (result.canceled()) {
            return BuildOutcome.failed(FailureKind.CANCELED, "Compilation canceled for " + fileName,
                    result.elapsedSeconds());
        }
        if (result.returnCode() != 0) {
            String diagnostic = result.stderr().isBlank() ? result.stdout() : result.stderr();
            return BuildOutcome.failed(FailureKind.COMPILATION_FAILURE, diagnostic.strip(), result.elapsedSeconds());
        }
        return null;
    }

    static BuildOutcome missingSource(Path source) {
        return BuildOutcome.failed(FailureKind.COMPILATION_FAILURE, "Source file not found: " + source, 0.0);
    }

    /** Replaces {@code target} with {@code staged}, atomically where the file system allows it. */
    static void publish(Path staged, Path target) throws IOException {
        try {
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static void deleteIfPresent(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove staging file {}: {}", path, e.getMessage());
        }
    }
}
