package com.codeharness.core.compiler;

import com.codeharness.core.health.HealthStatus;
import com.codeharness.core.language.Language;
import com.codeharness.core.process.CancellationToken;
import com.codeharness.core.process.FailureKind;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A file that is already executable, such as a checker binary or a script with a shebang line.
 * It is run as-is and never built.
 */
public class PrebuiltExecutableStrategy implements LanguageStrategy {

    @Override
    public Language language() {
        return Language.UNKNOWN;
    }

    @Override
    public boolean needsBuild() {
        return false;
    }

    @Override
    public BuildOutcome build(Path source, Path artifact, List<String> extraFlags, Duration timeout,
                              CancellationToken cancellation) {
        if (!Files.isRegularFile(source)) {
            return CompilerRuns.missingSource(source);
        }
        if (!Files.isExecutable(source)) {
            return BuildOutcome.failed(FailureKind.LAUNCH_FAILURE, source.getFileName() + " is not executable", 0.0);
        }
        return BuildOutcome.succeeded(source.getFileName() + " is a prebuilt executable", 0.0);
    }

    @Override
    public List<String> runCommand(Path artifact, String entryPoint) {
        return List.of(artifact.toAbsolutePath().normalize().toString());
    }

    @Override
    public String artifactSuffix() {
        return "";
    }

    @Override
    public Path artifactPath(Path source) {
        return source;
    }

    @Override
    public HealthStatus checkToolchain() {
        return new HealthStatus("prebuilt", HealthStatus.Status.UP, "no toolchain required", Map.of());
    }
}
