package com.codeharness.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Micrometer meters for compilation and test runs.
 */
public class HarnessMetrics {

    private final MeterRegistry registry;

    public HarnessMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** Metrics backed by a private registry, for embedding without Spring. */
    public static HarnessMetrics standalone() {
        return new HarnessMetrics(new SimpleMeterRegistry());
    }

    public void recordCompilation(String language, boolean success, long ms) {
        Timer.builder("harness.compile.duration")
                .tag("language", language)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSkippedCompilation(String language) {
        Counter.builder("harness.compile.skipped")
                .description("Roles whose artifacts were already up to date")
                .tag("language", language)
                .register(registry)
                .increment();
    }

    public void recordTest(String kind, boolean passed, long ms) {
        Timer.builder("harness.test.duration")
                .tag("kind", kind)
                .register(registry)
                .record(Duration.ofMillis(ms));
        Counter.builder("harness.test.outcomes")
                .tag("kind", kind)
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordRun(String kind, String state) {
        Counter.builder("harness.runs.total")
                .tag("kind", kind)
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordTimeout(String stage) {
        Counter.builder("harness.process.timeouts")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
