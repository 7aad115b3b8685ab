package com.codeharness.core.process;

/**
 * Samples the resident memory of a running process tree.
 */
@FunctionalInterface
public interface MemorySampler {

    MemorySampler NONE = pid -> 0.0;

    /**
     * @return resident set size in megabytes, or {@code 0} when it cannot be read
     */
    double sampleMegabytes(long pid);
}
