package com.codeharness.core.session;

import com.codeharness.core.compilation.CompilationOrchestrator;
import com.codeharness.core.compilation.CompilationReport;
import com.codeharness.core.logging.MdcContext;
import com.codeharness.core.manifest.TestKind;
import com.codeharness.core.manifest.WorkspaceManifest;
import com.codeharness.core.persistence.FilesSnapshotService;
import com.codeharness.core.persistence.TestRunReport;
import com.codeharness.core.persistence.TestRunSink;
import com.codeharness.core.testing.AbstractTestRunner;
import com.codeharness.core.testing.TestRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * One workspace bound to one test kind: compile its roles, run its tests once, hand the result to
 * the sinks. Obtain instances from {@link HarnessEngine#open}.
 */
public class TestSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TestSession.class);

    private final String sessionId;
    private final WorkspaceManifest manifest;
    private final TestKind kind;
    private final CompilationOrchestrator orchestrator;
    private final Supplier<AbstractTestRunner> runnerFactory;
    private final FilesSnapshotService snapshots;
    private final List<TestRunSink> sinks;
    private final ExecutorService runThread;

    private AbstractTestRunner runner;

    TestSession(String sessionId, WorkspaceManifest manifest, TestKind kind, CompilationOrchestrator orchestrator,
                Supplier<AbstractTestRunner> runnerFactory, FilesSnapshotService snapshots, List<TestRunSink> sinks) {
        this.sessionId = sessionId;
        this.manifest = manifest;
        this.kind = kind;
        this.orchestrator = orchestrator;
        this.runnerFactory = runnerFactory;
        this.snapshots = snapshots;
        this.sinks = List.copyOf(sinks);
        this.runThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "harness-run-" + sessionId);
            t.setDaemon(true);
            return t;
        });
    }

    public String sessionId() {
        return sessionId;
    }

    public TestKind kind() {
        return kind;
    }

    public WorkspaceManifest manifest() {
        return manifest;
    }

    public CompilationOrchestrator orchestrator() {
        return orchestrator;
    }

    public CompletableFuture<CompilationReport> compile() {
        return orchestrator.compileAll();
    }

    /**
     * Starts the test run on a background thread. A session runs its tests at most once.
     *
     * @throws IllegalStateException if the session has no test kind or was already started
     */
    public synchronized CompletableFuture<TestRunSummary> runTests() {
        if (kind == null) {
            throw new IllegalStateException("Session " + sessionId + " was opened for compilation only");
        }
        if (runner != null) {
            throw new IllegalStateException("Tests already started for session " + sessionId);
        }
        AbstractTestRunner created = runnerFactory.get();
        runner = created;
        return CompletableFuture.supplyAsync(() -> {
            MdcContext.setSession(sessionId);
            try {
                TestRunSummary summary = created.run();
                publish(summary);
                return summary;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            } finally {
                MdcContext.clear();
            }
        }, runThread);
    }

    /**
     * Requests cancellation of a running test batch.
     *
     * @return whether a running batch accepted the request
     */
    public synchronized boolean cancel() {
        return runner != null && runner.cancel();
    }

    public synchronized AbstractTestRunner runner() {
        return runner;
    }

    private void publish(TestRunSummary summary) {
        TestRunReport report = new TestRunReport(summary, snapshots.capture(kind, orchestrator.units()));
        for (TestRunSink sink : sinks) {
            try {
                sink.accept(report);
            } catch (RuntimeException e) {
                log.warn("Sink {} failed to store run {}: {}", sink.getClass().getSimpleName(), sessionId,
                        e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        cancel();
        runThread.shutdown();
        orchestrator.shutdown();
    }
}
