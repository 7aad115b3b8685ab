package com.codeharness.core.compiler;

import com.codeharness.core.health.HealthStatus;
import com.codeharness.core.language.Language;
import com.codeharness.core.process.CancellationToken;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * What the harness needs from a language: whether it builds, how to build, how to run.
 * One implementation per execution model.
 */
public interface LanguageStrategy {

    Language language();

    /** Whether sources must be built before they can run. */
    boolean needsBuild();

    /**
     * Builds {@code source} into {@code artifact}. Implementations never leave a partially written
     * artifact behind: the artifact is either the previous one or the complete new one.
     * For languages without a build step this is a syntax check that writes nothing.
     */
    BuildOutcome build(Path source, Path artifact, List<String> extraFlags, Duration timeout,
                       CancellationToken cancellation) throws InterruptedException;

    default BuildOutcome build(Path source, Path artifact, Duration timeout) throws InterruptedException {
        return build(source, artifact, List.of(), timeout, CancellationToken.NONE);
    }

    /**
     * Command that runs {@code artifact}.
     *
     * @param entryPoint class name for bytecode languages, otherwise ignored; may be {@code null}
     */
    List<String> runCommand(Path artifact, String entryPoint);

    /** Suffix that turns a source base name into an artifact name. */
    String artifactSuffix();

    /** Artifact location for {@code source}; the source itself when nothing is built. */
    Path artifactPath(Path source);

    /** Probes whether the language's toolchain can be launched. */
    HealthStatus checkToolchain() throws InterruptedException;
}
