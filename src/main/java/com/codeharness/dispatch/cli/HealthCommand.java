package com.codeharness.dispatch.cli;

import com.codeharness.core.health.HealthStatus;
import com.codeharness.core.health.ToolchainHealthService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: code-harness health
 * <p>
 * Checks that the compilers and interpreters of every supported language can be launched.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check toolchain availability")
@Component
public class HealthCommand implements Runnable {

    private final ToolchainHealthService healthService;

    public HealthCommand(ToolchainHealthService healthService) {
        this.healthService = healthService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks = healthService.checkAll();
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.info(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all toolchains available");
        } else {
            ConsoleOutput.error("Overall: one or more toolchains missing");
        }
    }
}
