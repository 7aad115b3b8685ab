package com.codeharness.dispatch.cli;

import com.codeharness.core.config.HarnessProperties;
import com.codeharness.core.manifest.TestKind;
import com.codeharness.core.persistence.JsonReportWriter;
import com.codeharness.core.session.HarnessEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: code-harness stress -r generator=gen.py -r correct=brute.cpp -r test=fast.cpp -n 100
 */
@Command(name = "stress", mixinStandardHelpOptions = true,
        description = "Compare the solution under test against a reference solution on generated inputs")
@Component
public class StressCommand extends AbstractRunCommand {

    public StressCommand(HarnessEngine engine, HarnessProperties properties, JsonReportWriter reportWriter) {
        super(engine, properties, reportWriter);
    }

    @Override
    protected TestKind kind() {
        return TestKind.DIFFERENTIAL;
    }
}
