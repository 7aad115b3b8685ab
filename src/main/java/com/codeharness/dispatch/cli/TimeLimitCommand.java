package com.codeharness.dispatch.cli;

import com.codeharness.core.config.HarnessProperties;
import com.codeharness.core.manifest.TestKind;
import com.codeharness.core.manifest.WorkspaceManifest;
import com.codeharness.core.persistence.JsonReportWriter;
import com.codeharness.core.session.HarnessEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;

/**
 * CLI command: code-harness tle -r generator=gen.py -r test=sol.cpp --time-limit 1000
 */
@Command(name = "tle", mixinStandardHelpOptions = true,
        description = "Check that the solution under test finishes within a time limit")
@Component
public class TimeLimitCommand extends AbstractRunCommand {

    @Option(names = {"--time-limit", "-l"}, description = "Time limit in milliseconds (default: ${DEFAULT-VALUE})",
            defaultValue = "1000")
    long timeLimitMs;

    @Option(names = {"--memory-limit", "-m"}, description = "Memory limit in MB")
    Integer memoryLimitMb;

    public TimeLimitCommand(HarnessEngine engine, HarnessProperties properties, JsonReportWriter reportWriter) {
        super(engine, properties, reportWriter);
    }

    @Override
    protected TestKind kind() {
        return TestKind.TIME_LIMIT;
    }

    @Override
    protected void configure(WorkspaceManifest.Builder manifest) {
        manifest.timeLimit(Duration.ofMillis(timeLimitMs)).memoryLimitMb(memoryLimitMb);
    }
}
