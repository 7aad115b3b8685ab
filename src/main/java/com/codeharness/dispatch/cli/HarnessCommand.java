package com.codeharness.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: compile, stress, tle, validate, health, detect.
 */
@Command(
        name = "code-harness",
        mixinStandardHelpOptions = true,
        version = "code-harness 0.1.0",
        description = "Parallel compile and stress-test harness for competitive programming solutions",
        subcommands = {
                CompileCommand.class,
                StressCommand.class,
                TimeLimitCommand.class,
                ValidateCommand.class,
                HealthCommand.class,
                DetectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HarnessCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // no subcommand given
        spec.commandLine().usage(System.out);
    }
}
