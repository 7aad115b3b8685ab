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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Compilation to class files (Java via {@code javac}). Classes are compiled into a private
 * staging directory and then moved next to the source, whose directory is the classpath entry
 * used at run time. The primary class file is moved last so its timestamp marks a complete build.
 */
public class BytecodeCompiledStrategy implements LanguageStrategy {

    private static final Logger log = LoggerFactory.getLogger(BytecodeCompiledStrategy.class);

    private final Language language;
    private final LanguageProfileResolver resolver;
    private final ProcessExecutor executor;

    public BytecodeCompiledStrategy(Language language, LanguageProfileResolver resolver, ProcessExecutor executor) {
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
        Path classDirectory = artifact.toAbsolutePath().getParent();
        Path staging = null;
        try {
            staging = Files.createTempDirectory(classDirectory, ".build-");
            List<String> command = resolver.buildCommand(language, source, staging, extraFlags);
            ExecutionResult result = executor.run(new ExecutionRequest(command, null, timeout, false,
                    source.toAbsolutePath().getParent(), cancellation));
            BuildOutcome failure = CompilerRuns.failureOf(result, profile.compiler(), source, timeout);
            if (failure != null) {
                return failure;
            }
            installClasses(staging, classDirectory, artifact.getFileName().toString());
            return BuildOutcome.succeeded("Successfully compiled " + source.getFileName(), result.elapsedSeconds());
        } catch (IOException e) {
            log.warn("Could not install classes for {}: {}", source, e.getMessage());
            return BuildOutcome.failed(FailureKind.COMPILATION_FAILURE,
                    "Could not write classes to " + classDirectory + ": " + e.getMessage(), 0.0);
        } finally {
            deleteTree(staging);
        }
    }

    private void installClasses(Path staging, Path classDirectory, String primaryName) throws IOException {
        List<Path> classFiles;
        try (Stream<Path> files = Files.walk(staging)) {
            classFiles = new ArrayList<>(files.filter(Files::isRegularFile).toList());
        }
        // primary class last
        classFiles.sort(Comparator.comparing((Path p) -> p.getFileName().toString().equals(primaryName)));
        for (Path staged : classFiles) {
            Path target = classDirectory.resolve(staging.relativize(staged).toString());
            Files.createDirectories(target.getParent());
            CompilerRuns.publish(staged, target);
        }
    }

    private static void deleteTree(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(CompilerRuns::deleteIfPresent);
        } catch (IOException e) {
            log.warn("Could not clean staging directory {}: {}", root, e.getMessage());
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
        return ToolchainProbe.probe(executor, language.key(), resolver.resolve(language).compiler(), "-version");
    }
}
