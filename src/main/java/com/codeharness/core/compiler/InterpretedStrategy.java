package com.codeharness.core.compiler;

import com.codeharness.core.health.HealthStatus;
import com.codeharness.core.language.Language;
import com.codeharness.core.language.LanguageProfileResolver;
import com.codeharness.core.process.CancellationToken;
import com.codeharness.core.process.ExecutionRequest;
import com.codeharness.core.process.ExecutionResult;
import com.codeharness.core.process.FailureKind;
import com.codeharness.core.process.ProcessExecutor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Languages run straight from source (Python). Nothing is ever built; {@link #build} only asks
 * the interpreter to parse the file.
 */
public class InterpretedStrategy implements LanguageStrategy {

    static final String SYNTAX_CHECK =
            "import ast,sys; ast.parse(open(sys.argv[1], encoding='utf-8').read(), sys.argv[1])";

    private final Language language;
    private final LanguageProfileResolver resolver;
    private final ProcessExecutor executor;

    public InterpretedStrategy(Language language, LanguageProfileResolver resolver, ProcessExecutor executor) {
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
        return false;
    }

    @Override
    public BuildOutcome build(Path source, Path artifact, List<String> extraFlags, Duration timeout,
                              CancellationToken cancellation) throws InterruptedException {
        if (!Files.isRegularFile(source)) {
            return CompilerRuns.missingSource(source);
        }
        String interpreter = resolver.resolve(language).runtime();
        List<String> command = List.of(interpreter, "-c", SYNTAX_CHECK, source.toAbsolutePath().toString());
        ExecutionResult result = executor.run(new ExecutionRequest(command, null, timeout, false, null, cancellation));
        String fileName = source.getFileName().toString();
        if (result.launchFailed()) {
            return BuildOutcome.failed(FailureKind.LAUNCH_FAILURE,
                    "Interpreter '" + interpreter + "' not found. Please install it or add it to PATH.",
                    result.elapsedSeconds());
        }
        if (result.timedOut()) {
            return BuildOutcome.failed(FailureKind.TIMEOUT,
                    "Syntax check timeout (" + timeout.toSeconds() + "s) for " + fileName, result.elapsedSeconds());
        }
        if (!result.succeeded()) {
            return BuildOutcome.failed(FailureKind.COMPILATION_FAILURE,
                    "Syntax error in " + fileName + ":\n" + result.stderr().strip(), result.elapsedSeconds());
        }
        return BuildOutcome.succeeded(fileName + " has no syntax errors", result.elapsedSeconds());
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
        return source;
    }

    @Override
    public HealthStatus checkToolchain() throws InterruptedException {
        return ToolchainProbe.probe(executor, language.key(), resolver.resolve(language).runtime(), "--version");
    }
}
