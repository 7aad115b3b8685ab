package com.codeharness.dispatch.cli;

import com.codeharness.core.compilation.CompilationReport;
import com.codeharness.core.config.HarnessProperties;
import com.codeharness.core.events.EventBus;
import com.codeharness.core.events.EventTypes;
import com.codeharness.core.events.HarnessEvent;
import com.codeharness.core.language.ConfigurationException;
import com.codeharness.core.manifest.TestKind;
import com.codeharness.core.manifest.WorkspaceManifest;
import com.codeharness.core.persistence.JsonReportWriter;
import com.codeharness.core.persistence.TestRunSink;
import com.codeharness.core.session.HarnessEngine;
import com.codeharness.core.session.TestSession;
import com.codeharness.core.testing.TestRecord;
import com.codeharness.core.testing.TestRunOptions;
import com.codeharness.core.testing.TestRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * Compile-then-test flow shared by {@code stress}, {@code tle} and {@code validate}.
 * Exit codes: 0 all tests passed, 1 a build or test failed, 2 bad configuration.
 */
abstract class AbstractRunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractRunCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    @Mixin
    WorkspaceOptions workspace = new WorkspaceOptions();

    protected final HarnessEngine engine;
    protected final HarnessProperties properties;
    protected final JsonReportWriter reportWriter;

    protected AbstractRunCommand(HarnessEngine engine, HarnessProperties properties, JsonReportWriter reportWriter) {
        this.engine = engine;
        this.properties = properties;
        this.reportWriter = reportWriter;
    }

    protected abstract TestKind kind();

    /** Adds kind-specific settings to the manifest. */
    protected void configure(WorkspaceManifest.Builder manifest) {
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        WorkspaceManifest.Builder builder = workspace.manifest();
        configure(builder);

        List<TestRunSink> extraSinks = new ArrayList<>();
        if (workspace.report != null) {
            extraSinks.add(report -> reportWriter.writeTo(workspace.report, report));
        }
        TestRunOptions options = properties.toRunOptions().withMaxWorkers(workspace.threads);
        int previewLength = properties.getTesting().getPreviewLength();

        TestSession session;
        try {
            session = engine.open(builder.build(), kind(), options, extraSinks);
        } catch (ConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_CONFIG;
        }

        EventBus bus = engine.eventBus();
        EventBus.Subscription subscription = bus.subscribe(session.sessionId(), event -> onEvent(event, previewLength));
        Thread cancelHook = new Thread(session::cancel, "harness-cancel-" + session.sessionId());
        Runtime.getRuntime().addShutdownHook(cancelHook);
        try (session) {
            CompilationReport compilation = session.compile().join();
            ConsoleOutput.compilation(compilation);
            if (!compilation.success()) {
                return EXIT_FAILED;
            }
            TestRunSummary summary = session.runTests().join();
            ConsoleOutput.summary(summary);
            if (workspace.report != null) {
                ConsoleOutput.info("Report written to " + workspace.report.toAbsolutePath());
            }
            return summary.allPassed() ? EXIT_OK : EXIT_FAILED;
        } catch (CompletionException e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
            removeHook(cancelHook);
        }
    }

    private void onEvent(HarnessEvent event, int previewLength) {
        switch (event.eventType()) {
            case EventTypes.COMPILE_PROGRESS -> ConsoleOutput.progress(event);
            case EventTypes.TEST_COMPLETED -> {
                if (event.payload().get("record") instanceof TestRecord record) {
                    ConsoleOutput.testRecord(record, previewLength);
                }
            }
            default -> {
                // other events are not shown
            }
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress, cancel hook left registered");
        }
    }

    static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
