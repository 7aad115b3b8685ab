package com.codeharness.dispatch.cli;

import com.codeharness.core.config.HarnessProperties;
import com.codeharness.core.manifest.TestKind;
import com.codeharness.core.manifest.WorkspaceManifest;
import com.codeharness.core.persistence.JsonReportWriter;
import com.codeharness.core.session.HarnessEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * CLI command: code-harness validate -r generator=gen.py -r test=sol.cpp --validator check.cpp
 * <p>
 * The validator receives the input and output file paths and exits 1 for a valid output,
 * 0 for an invalid one.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Judge the solution under test with a validator program")
@Component
public class ValidateCommand extends AbstractRunCommand {

    @Option(names = {"--validator", "-v"}, description = "Validator source (alternative to -r validator=...)")
    Path validator;

    public ValidateCommand(HarnessEngine engine, HarnessProperties properties, JsonReportWriter reportWriter) {
        super(engine, properties, reportWriter);
    }

    @Override
    protected TestKind kind() {
        return TestKind.VALIDATION;
    }

    @Override
    protected void configure(WorkspaceManifest.Builder manifest) {
        manifest.validatorPath(validator);
    }
}
