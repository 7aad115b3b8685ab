package com.codeharness.core.persistence;

/**
 * Receives each finished run. Implementations decide where (and whether) it is stored.
 */
@FunctionalInterface
public interface TestRunSink {

    void accept(TestRunReport report);
}
