package com.codeharness.core.process;

/**
 * Why a build, a process or a test did not succeed.
 */
public enum FailureKind {
    CONFIGURATION_ERROR,
    COMPILATION_FAILURE,
    LAUNCH_FAILURE,
    TIMEOUT,
    /** Killed by a signal or an access violation. */
    CRASH_EXIT,
    /** Ordinary non-zero exit. */
    RUNTIME_ERROR,
    MEMORY_LIMIT_EXCEEDED,
    OUTPUT_MISMATCH,
    INVALID_OUTPUT,
    VALIDATION_ERROR,
    CANCELED
}
