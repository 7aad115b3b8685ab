package com.codeharness.core.compiler;

import com.codeharness.core.process.FailureKind;

/**
 * Result of building (or pre-flight checking) one source file.
 *
 * @param ok             whether the artifact is ready to run
 * @param message        human-readable status or compiler diagnostic
 * @param failureKind    why the build failed, {@code null} when {@code ok}
 * @param elapsedSeconds time spent in the toolchain
 */
public record BuildOutcome(boolean ok, String message, FailureKind failureKind, double elapsedSeconds) {

    public static BuildOutcome succeeded(String message, double elapsedSeconds) {
        return new BuildOutcome(true, message, null, elapsedSeconds);
    }

    public static BuildOutcome failed(FailureKind kind, String message, double elapsedSeconds) {
        return new BuildOutcome(false, message, kind, elapsedSeconds);
    }
}
