package com.codeharness.core.session;

import com.codeharness.core.compilation.ArtifactLocks;
import com.codeharness.core.compilation.CompilationOrchestrator;
import com.codeharness.core.compiler.LanguageStrategyFactory;
import com.codeharness.core.config.HarnessProperties;
import com.codeharness.core.events.EventBus;
import com.codeharness.core.language.LanguageProfileResolver;
import com.codeharness.core.manifest.TestKind;
import com.codeharness.core.manifest.WorkspaceManifest;
import com.codeharness.core.metrics.HarnessMetrics;
import com.codeharness.core.persistence.FilesSnapshotService;
import com.codeharness.core.persistence.TestIoArchive;
import com.codeharness.core.persistence.TestRunSink;
import com.codeharness.core.testing.AbstractTestRunner;
import com.codeharness.core.testing.DifferentialTestRunner;
import com.codeharness.core.testing.TestRunContext;
import com.codeharness.core.testing.TestRunOptions;
import com.codeharness.core.testing.TimeLimitTestRunner;
import com.codeharness.core.testing.ValidationTestRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for callers: turns a manifest into a {@link TestSession}.
 */
@Service
public class HarnessEngine {

    private static final Logger log = LoggerFactory.getLogger(HarnessEngine.class);

    private final LanguageStrategyFactory strategies;
    private final EventBus eventBus;
    private final HarnessMetrics metrics;
    private final HarnessProperties properties;
    private final FilesSnapshotService snapshots;
    private final List<TestRunSink> sinks;
    private final ArtifactLocks artifactLocks = new ArtifactLocks();

    public HarnessEngine(LanguageStrategyFactory strategies, EventBus eventBus, HarnessMetrics metrics,
                         HarnessProperties properties, FilesSnapshotService snapshots, List<TestRunSink> sinks) {
        this.strategies = strategies;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.snapshots = snapshots;
        this.sinks = sinks;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    /**
     * Opens a session for {@code kind}, or a compile-only session over every declared role when
     * {@code kind} is {@code null}.
     *
     * @throws com.codeharness.core.language.ConfigurationException on missing roles or unknown languages
     */
    public TestSession open(WorkspaceManifest manifest, TestKind kind) {
        return open(manifest, kind, properties.toRunOptions(), List.of());
    }

    /**
     * @param options    run options for this session
     * @param extraSinks sinks that receive this session's report in addition to the configured ones
     */
    public TestSession open(WorkspaceManifest manifest, TestKind kind, TestRunOptions options,
                            List<TestRunSink> extraSinks) {
        if (kind != null) {
            manifest.requireRolesFor(kind);
        }
        String sessionId = "HS-" + UUID.randomUUID().toString().substring(0, 8);
        LanguageProfileResolver resolver = strategies.resolver().withOverrides(manifest.languageOverrides());
        LanguageStrategyFactory sessionStrategies = new LanguageStrategyFactory(resolver, strategies.executor());

        Map<String, Path> sources = new LinkedHashMap<>();
        List<String> roles = kind != null ? kind.requiredRoles() : List.copyOf(manifest.roles().keySet());
        for (String role : roles) {
            sources.put(role, manifest.sourceOf(role));
        }
        CompilationOrchestrator orchestrator = new CompilationOrchestrator(sessionId, sources, sessionStrategies,
                eventBus, metrics, properties.getCompileTimeout(),
                properties.getCompilation().isSyntaxCheckInterpreted(), artifactLocks);

        List<TestRunSink> allSinks = new ArrayList<>(sinks);
        allSinks.addAll(extraSinks);
        log.info("Opened session {} for {} with roles {}", sessionId, kind == null ? "compilation" : kind, roles);
        return new TestSession(sessionId, manifest, kind, orchestrator,
                () -> createRunner(sessionId, manifest, kind, orchestrator, options), snapshots, allSinks);
    }

    private AbstractTestRunner createRunner(String sessionId, WorkspaceManifest manifest, TestKind kind,
                                            CompilationOrchestrator orchestrator, TestRunOptions options) {
        Map<String, List<String>> commands = new LinkedHashMap<>();
        for (String role : kind.requiredRoles()) {
            commands.put(role, orchestrator.runCommand(role));
        }
        TestRunContext context = new TestRunContext(sessionId, commands, strategies.executor(), eventBus, metrics,
                new TestIoArchive(manifest.workspaceRoot(), properties.getTesting().isSaveTestIo()), options);
        return switch (kind) {
            case DIFFERENTIAL -> new DifferentialTestRunner(context, manifest.testCount());
            case TIME_LIMIT -> new TimeLimitTestRunner(context, manifest.testCount(), manifest.timeLimit(),
                    manifest.memoryLimitMb());
            case VALIDATION -> new ValidationTestRunner(context, manifest.testCount());
        };
    }
}
