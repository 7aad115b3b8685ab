package com.codeharness.core.compiler;

import com.codeharness.core.health.HealthStatus;
import com.codeharness.core.language.Language;
import com.codeharness.core.language.LanguageProfile;
import com.codeharness.core.language.LanguageProfileResolver;
import com.codeharness.core.process.CancellationToken;
import com.codeharness.core.process.ExecutionRequest;
import com.codeharness.core.process.ExecutionResult;
import com.codeharness.core.process.FailureKind;
import com.codeharness.core.process.ProcessExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Ahead-of-time compilation to a native executable (C++ via {@code g++} by default).
 * The compiler writes to a staging file next to the artifact, which is then moved into place.
 */
public class NativeCompiledStrategy implements LanguageStrategy {

    private static final Logger log = LoggerFactory.getLogger(NativeCompiledStrategy.class);

    private final Language language;
    private final LanguageProfileResolver resolver;
    private final ProcessExecutor executor;

    public NativeCompiledStrategy(Language language, LanguageProfileResolver resolver, ProcessExecutor executor) {
        this.language = language;
        this.resolver = resolver;
        this.executor = executor;
    }

    @Override
    public Language language() {
        return language;
    }

    @Override
    public boolean needsBuild() {
        return true;
    }

    @Override
    public BuildOutcome build(Path source, Path artifact, List<String> extraFlags, Duration timeout,
                              CancellationToken cancellation) throws InterruptedException {
        if (!Files.isRegularFile(source)) {
            return CompilerRuns.missingSource(source);
        }
        LanguageProfile profile = resolver.resolve(language);
        Path staged = artifact.resolveSibling(
                artifact.getFileName() + ".tmp-" + UUID.randomUUID().toString().substring(0, 8) + profile.artifactSuffix());
        try {
            List<String> command = resolver.buildCommand(language, source, staged, extraFlags);
            ExecutionResult result = executor.run(new ExecutionRequest(command, null, timeout, false,
                    source.toAbsolutePath().getParent(), cancellation));
            BuildOutcome failure = CompilerRuns.failureOf(result, profile.compiler(), source, timeout);
            if (failure != null) {
                log.debug("Compilation of {} failed: {}", source.getFileName(), failure.failureKind());
                return failure;
            }
            CompilerRuns.publish(staged, artifact);
            return BuildOutcome.succeeded("Successfully compiled " + source.getFileName(), result.elapsedSeconds());
        } catch (IOException e) {
            log.warn("Could not install artifact {}: {}", artifact, e.getMessage());
            return BuildOutcome.failed(FailureKind.COMPILATION_FAILURE,
                    "Could not write artifact " + artifact + ": " + e.getMessage(), 0.0);
        } finally {
            CompilerRuns.deleteIfPresent(staged);
        }
    }

    @Override
    public List<String> runCommand(Path artifact, String entryPoint) {
        return resolver.runCommand(language, artifact, entryPoint);
    }

    @Override
    public String artifactSuffix() {
        return resolver.resolve(language).artifactSuffix();
    }

    @Override
    public Path artifactPath(Path source) {
        return resolver.artifactPath(language, source);
    }

    @Override
    public HealthStatus checkToolchain() throws InterruptedException {
        return ToolchainProbe.probe(executor, language.key(), resolver.resolve(language).compiler(), "--version");
    }
}
