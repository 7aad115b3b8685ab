package com.codeharness.dispatch.cli;

import com.codeharness.core.compilation.CompilationReport;
import com.codeharness.core.events.EventBus;
import com.codeharness.core.events.EventTypes;
import com.codeharness.core.language.ConfigurationException;
import com.codeharness.core.session.HarnessEngine;
import com.codeharness.core.session.TestSession;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * CLI command: code-harness compile -r generator=gen.cpp -r test=sol.cpp
 * <p>
 * Builds every declared role whose artifact is missing or older than its source.
 */
@Command(name = "compile", mixinStandardHelpOptions = true, description = "Build stale roles in parallel")
@Component
public class CompileCommand implements Callable<Integer> {

    @Mixin
    WorkspaceOptions workspace = new WorkspaceOptions();

    private final HarnessEngine engine;

    public CompileCommand(HarnessEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (workspace.roles.isEmpty()) {
            ConsoleOutput.error("No roles given. Use -r <role>=<source>.");
            return AbstractRunCommand.EXIT_CONFIG;
        }
        TestSession session;
        try {
            session = engine.open(workspace.manifest().build(), null);
        } catch (ConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return AbstractRunCommand.EXIT_CONFIG;
        }
        EventBus.Subscription subscription = engine.eventBus().subscribe(session.sessionId(), event -> {
            if (EventTypes.COMPILE_PROGRESS.equals(event.eventType())) {
                ConsoleOutput.progress(event);
            }
        });
        try (session) {
            CompilationReport report = session.compile().join();
            ConsoleOutput.compilation(report);
            return report.success() ? AbstractRunCommand.EXIT_OK : AbstractRunCommand.EXIT_FAILED;
        } catch (CompletionException e) {
            ConsoleOutput.error("Compilation failed: " + AbstractRunCommand.rootCauseMessage(e));
            return AbstractRunCommand.EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
        }
    }
}
