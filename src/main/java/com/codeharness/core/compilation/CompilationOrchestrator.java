package com.codeharness.core.compilation;

import com.codeharness.core.compiler.BuildOutcome;
import com.codeharness.core.compiler.LanguageStrategy;
import com.codeharness.core.compiler.LanguageStrategyFactory;
import com.codeharness.core.events.EventBus;
import com.codeharness.core.events.EventTypes;
import com.codeharness.core.events.HarnessEvent;
import com.codeharness.core.events.ProgressSeverity;
import com.codeharness.core.language.ConfigurationException;
import com.codeharness.core.language.Language;
import com.codeharness.core.logging.MdcContext;
import com.codeharness.core.manifest.Roles;
import com.codeharness.core.metrics.HarnessMetrics;
import com.codeharness.core.process.CancellationToken;
import com.codeharness.core.process.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds every stale role of a workspace in parallel.
 * <p>
 * A pass emits {@link EventTypes#COMPILE_PROGRESS} events while it runs and exactly one
 * {@link EventTypes#COMPILE_COMPLETED} event at the end. Every dispatched build runs to completion;
 * overall success is the AND of their outcomes. Languages without a build step are never stale.
 * A validator in no known language is accepted when the file itself is executable; it is run as-is.
 */
public class CompilationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CompilationOrchestrator.class);

    private final String sessionId;
    private final LanguageStrategyFactory strategies;
    private final EventBus eventBus;
    private final HarnessMetrics metrics;
    private final Duration buildTimeout;
    private final boolean syntaxCheckInterpreted;
    private final ArtifactLocks artifactLocks;
    private final Map<String, CompilationUnit> units = new LinkedHashMap<>();
    private final Map<String, LanguageStrategy> strategyByRole = new LinkedHashMap<>();
    private final ExecutorService coordinator;

    /**
     * Orchestrator with its own artifact locks, for callers that never run two passes over the same files.
     */
    public CompilationOrchestrator(String sessionId,
                                   Map<String, Path> roles,
                                   LanguageStrategyFactory strategies,
                                   EventBus eventBus,
                                   HarnessMetrics metrics,
                                   Duration buildTimeout,
                                   boolean syntaxCheckInterpreted) {
        this(sessionId, roles, strategies, eventBus, metrics, buildTimeout, syntaxCheckInterpreted, new ArtifactLocks());
    }

    /**
     * @param roles         role name to absolute source path
     * @param artifactLocks locks shared with every other orchestrator that may build the same artifacts
     * @throws ConfigurationException if a role's language cannot be determined
     */
    public CompilationOrchestrator(String sessionId,
                                   Map<String, Path> roles,
                                   LanguageStrategyFactory strategies,
                                   EventBus eventBus,
                                   HarnessMetrics metrics,
                                   Duration buildTimeout,
                                   boolean syntaxCheckInterpreted,
                                   ArtifactLocks artifactLocks) {
        this.sessionId = sessionId;
        this.strategies = strategies;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.buildTimeout = buildTimeout;
        this.syntaxCheckInterpreted = syntaxCheckInterpreted;
        this.artifactLocks = artifactLocks;
        this.coordinator = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "harness-compile-" + sessionId);
            t.setDaemon(true);
            return t;
        });
        roles.forEach(this::bind);
    }

    private void bind(String role, Path source) {
        Language language = strategies.resolver().detect(source, readForDetection(source));
        LanguageStrategy strategy;
        if (language.isKnown()) {
            strategy = strategies.create(language);
        } else if (Roles.VALIDATOR.equals(role) && Files.isRegularFile(source) && Files.isExecutable(source)) {
            log.debug("Validator {} has no known language, running it as an executable", source);
            strategy = strategies.prebuilt();
        } else {
            throw new ConfigurationException("Cannot determine the language of " + source + " (role " + role + ")");
        }
        strategyByRole.put(role, strategy);
        units.put(role, CompilationUnit.observe(role, source, language, strategy.artifactPath(source)));
    }

    private static String readForDetection(Path source) {
        if (!Files.isRegularFile(source)) {
            return null;
        }
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.debug("{} is not UTF-8 text, detecting by name only", source);
            return null;
        } catch (IOException e) {
            log.warn("Could not read {} for language detection: {}", source, e.getMessage());
            return null;
        }
    }

    public Map<String, CompilationUnit> units() {
        Map<String, CompilationUnit> current = new LinkedHashMap<>();
        units.forEach((role, unit) -> current.put(role, unit.refresh()));
        return current;
    }

    public CompilationUnit unit(String role) {
        CompilationUnit unit = units.get(role);
        if (unit == null) {
            throw new ConfigurationException("Unknown role: " + role);
        }
        return unit.refresh();
    }

    public Language languageOf(String role) {
        return unit(role).language();
    }

    /** Whether {@code role} would be rebuilt by the next {@link #compileAll()}, judged from disk now. */
    public boolean needsRebuild(String role) {
        return unit(role).isStale(strategyByRole.get(role).needsBuild());
    }

    /** Command that runs {@code role}'s artifact. */
    public List<String> runCommand(String role) {
        return strategyByRole.get(role).runCommand(unit(role).artifact(), null);
    }

    /**
     * Starts a compilation pass on a background thread.
     *
     * @return a future completed with the report once every dispatched build finished
     */
    public CompletableFuture<CompilationReport> compileAll() {
        return CompletableFuture.supplyAsync(() -> {
            MdcContext.setSession(sessionId);
            try {
                return compileBlocking();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            } finally {
                MdcContext.clear();
            }
        }, coordinator);
    }

    /**
     * Runs a compilation pass on the calling thread.
     */
    public CompilationReport compileBlocking() throws InterruptedException {
        long start = System.nanoTime();
        AtomicBoolean completed = new AtomicBoolean(false);
        progress(null, "Starting optimized parallel compilation...", ProgressSeverity.INFO);

        List<CompilationUnit> dispatch = new ArrayList<>();
        List<String> upToDate = new ArrayList<>();
        for (CompilationUnit unit : units().values()) {
            LanguageStrategy strategy = strategyByRole.get(unit.role());
            boolean syntaxCheck = !strategy.needsBuild() && syntaxCheckInterpreted && unit.language().isKnown();
            if (unit.isStale(strategy.needsBuild()) || syntaxCheck) {
                dispatch.add(unit);
            } else {
                upToDate.add(unit.role());
                metrics.recordSkippedCompilation(unit.language().key());
                String note;
                if (strategy.needsBuild()) {
                    note = unit.fileName() + " is up-to-date, skipping compilation";
                } else if (unit.language().isKnown()) {
                    note = unit.fileName() + " is interpreted, no build required";
                } else {
                    note = unit.fileName() + " is a prebuilt executable, no build required";
                }
                progress(unit.role(), note, ProgressSeverity.INFO);
            }
        }

        if (dispatch.isEmpty()) {
            progress(null, "All files are up-to-date! No compilation needed.", ProgressSeverity.SUCCESS);
            finish(completed, true);
            return new CompilationReport(true, Map.of(), upToDate, secondsSince(start));
        }

        int poolSize = Math.min(dispatch.size(), Math.max(1, Runtime.getRuntime().availableProcessors()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, namedThreads("harness-build-" + sessionId));
        Map<String, BuildOutcome> outcomes = new LinkedHashMap<>();
        boolean success = true;
        try {
            CompletionService<Map.Entry<CompilationUnit, BuildOutcome>> completion = new ExecutorCompletionService<>(pool);
            for (CompilationUnit unit : dispatch) {
                completion.submit(() -> Map.entry(unit, buildSafely(unit)));
            }
            for (int i = 0; i < dispatch.size(); i++) {
                Map.Entry<CompilationUnit, BuildOutcome> done = takeResult(completion);
                CompilationUnit unit = done.getKey();
                BuildOutcome outcome = done.getValue();
                outcomes.put(unit.role(), outcome);
                metrics.recordCompilation(unit.language().key(), outcome.ok(), Math.round(outcome.elapsedSeconds() * 1000));
                if (outcome.ok()) {
                    progress(unit.role(), outcome.message(), ProgressSeverity.SUCCESS);
                } else {
                    success = false;
                    progress(unit.role(), "Failed (" + unit.language() + "): " + unit.fileName() + "\n"
                            + outcome.message(), ProgressSeverity.ERROR);
                }
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            finish(completed, false);
            throw e;
        } catch (RuntimeException | Error e) {
            finish(completed, false);
            throw e;
        } finally {
            pool.shutdown();
        }

        if (success) {
            progress(null, "All files compiled successfully", ProgressSeverity.SUCCESS);
        } else {
            progress(null, "Some files failed to compile.", ProgressSeverity.ERROR);
        }
        finish(completed, success);
        log.info("Compilation finished: {} built, {} up to date, success={}", outcomes.size(), upToDate.size(), success);
        return new CompilationReport(success, outcomes, upToDate, secondsSince(start));
    }

    private Map.Entry<CompilationUnit, BuildOutcome> takeResult(
            CompletionService<Map.Entry<CompilationUnit, BuildOutcome>> completion) throws InterruptedException {
        try {
            return completion.take().get();
        } catch (ExecutionException e) {
            // buildSafely turns everything except Errors and interrupts into outcomes
            Throwable cause = e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            if (cause instanceof InterruptedException interrupted) {
                throw interrupted;
            }
            throw new IllegalStateException("Build task failed unexpectedly", cause);
        }
    }

    private BuildOutcome buildSafely(CompilationUnit unit) throws InterruptedException {
        MdcContext.setRole(sessionId, unit.role());
        ArtifactLocks.Lease lease = artifactLocks.acquire(unit.artifact());
        try {
            LanguageStrategy strategy = strategyByRole.get(unit.role());
            CompilationUnit current = unit.refresh();
            if (strategy.needsBuild() && !current.isStale(true)) {
                // built by a concurrent pass while this one waited for the lock
                return BuildOutcome.succeeded(unit.fileName() + " is up-to-date", 0.0);
            }
            log.debug("Building {} ({})", unit.fileName(), unit.language());
            return strategy.build(unit.source(), unit.artifact(), List.of(), buildTimeout, CancellationToken.NONE);
        } catch (RuntimeException e) {
            log.warn("Build of {} failed: {}", unit.fileName(), e.getMessage(), e);
            return BuildOutcome.failed(FailureKind.COMPILATION_FAILURE, e.getMessage(), 0.0);
        } finally {
            lease.close();
            MdcContext.clear();
        }
    }

    private void progress(String role, String message, ProgressSeverity severity) {
        eventBus.publish(HarnessEvent.progress(sessionId, role, message, severity));
    }

    private void finish(AtomicBoolean completed, boolean success) {
        if (completed.compareAndSet(false, true)) {
            eventBus.publish(HarnessEvent.of(EventTypes.COMPILE_COMPLETED, sessionId, null, Map.of("success", success)));
        }
    }

    /** Stops the background coordinator thread. Builds already running finish. */
    public void shutdown() {
        coordinator.shutdown();
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    static java.util.concurrent.ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
