package com.codeharness.core.testing;

import com.codeharness.core.events.EventTypes;
import com.codeharness.core.events.HarnessEvent;
import com.codeharness.core.logging.MdcContext;
import com.codeharness.core.manifest.TestKind;
import com.codeharness.core.process.CancellationToken;
import com.codeharness.core.process.ExecutionRequest;
import com.codeharness.core.process.ExecutionResult;
import com.codeharness.core.process.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tests {@code 1..N} on a bounded worker pool and collects one {@link TestRecord} per test.
 * <p>
 * Subclasses implement {@link #runOne(int, CancellationToken)}. The scheduler owns the result list
 * and the cancel flag, both guarded by one lock: a record is appended only while the scheduler has
 * not yet observed cancellation, so test numbers are never duplicated and late results from a
 * cancelled run are dropped. {@link EventTypes#RUN_COMPLETED} fires exactly once per run.
 * <p>
 * On cancellation, tests not yet started are skipped and tests still running see the cancellation
 * token, which kills their processes before the worker pool is torn down.
 */
public abstract class AbstractTestRunner {

    private static final Logger log = LoggerFactory.getLogger(AbstractTestRunner.class);

    private static final long SCHEDULER_POLL_MS = 20;
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(30);

    protected final TestRunContext context;
    protected final int testCount;

    private final Object lock = new Object();
    private final List<TestRecord> records = new ArrayList<>();
    private TestRunState state = TestRunState.PENDING;
    private boolean cancelRequested;
    private volatile boolean stopScheduling;

    protected AbstractTestRunner(TestRunContext context, int testCount) {
        if (testCount < 1) {
            throw new IllegalArgumentException("testCount must be at least 1");
        }
        this.context = context;
        this.testCount = testCount;
    }

    public abstract TestKind kind();

    /**
     * Executes test {@code testNumber}. Failures are returned as records; only interruption escapes.
     * Long-running work must pass {@code cancellation} to every process it starts.
     */
    protected abstract TestRecord runOne(int testNumber, CancellationToken cancellation) throws InterruptedException;

    /** Aggregate data attached to the summary; empty by default. */
    protected Map<String, Object> analyze(List<TestRecord> finalRecords) {
        return Map.of();
    }

    protected boolean shouldStopOnFailure(TestRecord failed) {
        return context.options().stopOnFirstFailure();
    }

    /**
     * Runs the whole batch on the calling thread and returns when every accepted result is in.
     *
     * @throws IllegalStateException if this runner was already started
     * @throws InterruptedException  if the calling thread is interrupted; running processes are
     *                               killed and the run is finalized as cancelled first
     */
    public final TestRunSummary run() throws InterruptedException {
        synchronized (lock) {
            if (state != TestRunState.PENDING) {
                throw new IllegalStateException("Test run already started (state " + state + ")");
            }
            state = TestRunState.RUNNING;
        }
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        int workers = Math.min(context.options().effectiveWorkers(), testCount);
        log.info("Starting {} run: {} tests on {} workers", kind(), testCount, workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        CompletionService<TestRecord> completion = new ExecutorCompletionService<>(pool);
        Map<Future<TestRecord>, Integer> futures = new HashMap<>();
        for (int n = 1; n <= testCount; n++) {
            final int testNumber = n;
            futures.put(completion.submit(() -> runOneSafely(testNumber)), testNumber);
        }

        InterruptedException interruption = null;
        try {
            schedule(completion, futures);
        } catch (InterruptedException e) {
            log.warn("{} run interrupted, cancelling", kind());
            cancel();
            interruption = e;
        } finally {
            futures.keySet().forEach(f -> f.cancel(false));
            drain(pool);
        }

        TestRunSummary summary = finish(startedAt, start);
        if (interruption != null) {
            Thread.currentThread().interrupt();
            throw interruption;
        }
        return summary;
    }

    private void schedule(CompletionService<TestRecord> completion, Map<Future<TestRecord>, Integer> futures)
            throws InterruptedException {
        int received = 0;
        while (received < testCount && !isCancelRequested() && !stopScheduling) {
            Future<TestRecord> done = completion.poll(SCHEDULER_POLL_MS, TimeUnit.MILLISECONDS);
            if (done == null) {
                continue;
            }
            received++;
            TestRecord record = resultOf(done, futures.get(done));
            if (record == null) {
                continue;
            }
            int completed;
            synchronized (lock) {
                if (cancelRequested) {
                    log.debug("Dropping result of test {} after cancellation", record.testNumber());
                    return;
                }
                records.add(record);
                completed = records.size();
            }
            context.metrics().recordTest(kind().name(), record.passed(), Math.round(record.totalSeconds() * 1000));
            publish(EventTypes.TEST_COMPLETED, String.valueOf(record.testNumber()),
                    Map.of("testNumber", record.testNumber(), "passed", record.passed(), "record", record));
            publish(EventTypes.RUN_PROGRESS, null, Map.of("completed", completed, "total", testCount));
            if (!record.passed() && shouldStopOnFailure(record)) {
                log.info("Test {} failed, stopping run early", record.testNumber());
                stopScheduling = true;
            }
        }
    }

    private TestRecord resultOf(Future<TestRecord> done, int testNumber) throws InterruptedException {
        try {
            return done.get();
        } catch (CancellationException e) {
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            if (isCancelRequested() || stopScheduling) {
                return null;
            }
            log.warn("Worker for test {} failed: {}", testNumber, cause.toString());
            return TestRecord.error(testNumber, FailureKind.LAUNCH_FAILURE, "Execution error: " + cause.getMessage());
        }
    }

    private TestRecord runOneSafely(int testNumber) throws InterruptedException {
        if (isCancelRequested() || stopScheduling) {
            return null;
        }
        MdcContext.setTest(context.sessionId(), testNumber, kind().name());
        try {
            publish(EventTypes.TEST_STARTED, String.valueOf(testNumber), Map.of("testNumber", testNumber));
            TestRecord record = runOne(testNumber, this::isCancelRequested);
            if (record != null && record.passed()) {
                log.debug("Test {} passed", testNumber);
            } else if (record != null) {
                log.debug("Test {} failed: {}", testNumber, record.errorDetail());
            }
            return record;
        } catch (RuntimeException e) {
            log.warn("Test {} raised {}", testNumber, e.toString(), e);
            return TestRecord.error(testNumber, FailureKind.LAUNCH_FAILURE, "Execution error: " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private void drain(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still busy after {}s, interrupting them", DRAIN_TIMEOUT.toSeconds());
                pool.shutdownNow();
                pool.awaitTermination(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private TestRunSummary finish(Instant startedAt, long startNanos) {
        List<TestRecord> snapshot;
        TestRunState finalState;
        synchronized (lock) {
            finalState = cancelRequested ? TestRunState.CANCELED : TestRunState.COMPLETED;
            state = finalState;
            snapshot = List.copyOf(records);
        }
        TestRunSummary summary = new TestRunSummary(context.sessionId(), kind(), finalState, testCount, snapshot,
                startedAt, Instant.now(), (System.nanoTime() - startNanos) / 1_000_000_000.0, analyze(snapshot));
        context.metrics().recordRun(kind().name(), finalState.name());
        log.info("{} run {}: {}/{} recorded, {} passed", kind(), finalState, snapshot.size(), testCount,
                summary.passed());
        publish(EventTypes.RUN_COMPLETED, null, Map.of("allPassed", summary.allPassed(), "summary", summary));
        return summary;
    }

    /**
     * Requests cancellation. Effective only while the run is {@link TestRunState#RUNNING}.
     *
     * @return whether this call moved the run towards {@link TestRunState#CANCELED}
     */
    public boolean cancel() {
        synchronized (lock) {
            if (state != TestRunState.RUNNING || cancelRequested) {
                return false;
            }
            cancelRequested = true;
        }
        log.info("Cancellation requested for {} run", kind());
        return true;
    }

    public boolean isCancelRequested() {
        synchronized (lock) {
            return cancelRequested;
        }
    }

    public TestRunState state() {
        synchronized (lock) {
            return state;
        }
    }

    /** Snapshot of the records accepted so far, in completion order. */
    public List<TestRecord> records() {
        synchronized (lock) {
            return List.copyOf(records);
        }
    }

    // -- helpers for subclasses -------------------------------------------------

    protected ExecutionResult execute(String role, String input, Duration timeout, boolean monitorMemory,
                                      CancellationToken cancellation) throws InterruptedException {
        ExecutionResult result = context.executor().run(new ExecutionRequest(context.command(role), input, timeout,
                monitorMemory, null, cancellation));
        if (!result.succeeded() && log.isDebugEnabled()) {
            log.debug("Stage {} did not succeed:\n{}", role, result.summary());
        }
        return result;
    }

    /**
     * Marks {@code builder} failed for a stage that did not succeed.
     *
     * @param stageLabel e.g. {@code Generator}, {@code Test solution}
     */
    protected static TestRecord.Builder stageFailure(TestRecord.Builder builder, String stageLabel,
                                                     ExecutionResult result, Duration timeout) {
        FailureKind kind = result.failure().orElse(FailureKind.RUNTIME_ERROR);
        String detail = switch (kind) {
            case TIMEOUT -> "Timeout in " + stageLabel + " after " + timeout.toMillis() / 1000.0 + "s";
            case CANCELED -> stageLabel + " canceled";
            case CRASH_EXIT -> stageLabel + " failed: crashed (exit code " + result.returnCode() + ")"
                    + stderrSuffix(result);
            default -> stageLabel + " failed: " + (result.stderr().isBlank()
                    ? "exit code " + result.returnCode()
                    : result.stderr().strip());
        };
        return builder.failed(kind, detail);
    }

    private static String stderrSuffix(ExecutionResult result) {
        return result.stderr().isBlank() ? "" : ": " + result.stderr().strip();
    }

    protected void archive(TestRecord record) {
        context.archive().save(kind(), record.testNumber(), record.input(), record.outputs());
    }

    private void publish(String type, String subject, Map<String, Object> payload) {
        context.eventBus().publish(HarnessEvent.of(type, context.sessionId(), subject, payload));
    }

    private java.util.concurrent.ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "harness-" + kind().name().toLowerCase() + "-";
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
