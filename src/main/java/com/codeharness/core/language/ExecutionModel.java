package com.codeharness.core.language;

/**
 * How a language turns source into something runnable.
 */
public enum ExecutionModel {
    /** Compiled ahead of time to a native executable. */
    NATIVE_COMPILED,
    /** Compiled to bytecode that a runtime loads from a classpath directory. */
    BYTECODE_COMPILED,
    /** Run directly from source by an interpreter. */
    INTERPRETED,
    UNKNOWN
}
