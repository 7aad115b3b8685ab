package com.codeharness.core.process;

/**
 * Polled by long-running work to learn that its owner wants it stopped.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();
}
