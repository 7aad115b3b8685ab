package com.codeharness.dispatch.cli;

import com.codeharness.core.compiler.LanguageStrategyFactory;
import com.codeharness.core.config.HarnessProperties;
import com.codeharness.core.events.EventBus;
import com.codeharness.core.health.HealthStatus;
import com.codeharness.core.health.ToolchainHealthService;
import com.codeharness.core.language.ConfigurationException;
import com.codeharness.core.language.LanguageOverride;
import com.codeharness.core.language.LanguageProfileResolver;
import com.codeharness.core.metrics.HarnessMetrics;
import com.codeharness.core.persistence.FilesSnapshotService;
import com.codeharness.core.persistence.JsonReportWriter;
import com.codeharness.core.process.ProcessExecutor;
import com.codeharness.core.session.HarnessEngine;
import com.codeharness.support.FakeToolchain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Exercises picocli parsing and command output without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final HarnessProperties properties = new HarnessProperties();

    private ToolchainHealthService mockHealth() {
        ToolchainHealthService health = mock(ToolchainHealthService.class);
        when(health.checkAll()).thenReturn(List.of(
                new HealthStatus("cpp", HealthStatus.Status.UP, "g++ (GCC) 13.2.0", Map.of()),
                new HealthStatus("java", HealthStatus.Status.UP, "javac 17.0.9", Map.of()),
                new HealthStatus("py", HealthStatus.Status.DOWN, "'python3' not found", Map.of())));
        return health;
    }

    private CommandLine.IFactory createFactory(HarnessEngine engine) {
        JsonReportWriter writer = new JsonReportWriter();
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == CompileCommand.class) {
                    return (K) new CompileCommand(engine);
                }
                if (cls == StressCommand.class) {
                    return (K) new StressCommand(engine, properties, writer);
                }
                if (cls == TimeLimitCommand.class) {
                    return (K) new TimeLimitCommand(engine, properties, writer);
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(engine, properties, writer);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(mockHealth());
                }
                if (cls == DetectCommand.class) {
                    return (K) new DetectCommand(new LanguageProfileResolver());
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(mock(HarnessEngine.class), args);
    }

    private CliResult execute(HarnessEngine engine, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new HarnessCommand(), createFactory(engine));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String name : List.of("compile", "stress", "tle", "validate", "health", "detect", "help")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("code-harness 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints usage")
        void noSubcommand() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: code-harness"));
        }

        @Test
        @DisplayName("stress --help shows workspace options")
        void stressHelp() {
            CliResult result = execute("stress", "--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--role"));
            assertTrue(result.output().contains("--tests"));
            assertTrue(result.output().contains("--threads"));
            assertTrue(result.output().contains("--report"));
        }

        @Test
        @DisplayName("tle --help shows the limit options")
        void tleHelp() {
            CliResult result = execute("tle", "--help");

            assertTrue(result.output().contains("--time-limit"));
            assertTrue(result.output().contains("--memory-limit"));
        }
    }

    @Nested
    @DisplayName("Commands")
    class CommandTests {

        @Test
        @DisplayName("health prints each toolchain and an overall verdict")
        void health() {
            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("cpp: g++ (GCC) 13.2.0"));
            assertTrue(result.output().contains("py: 'python3' not found"));
            assertTrue(result.output().contains("Overall: one or more toolchains missing"));
        }

        @Test
        @DisplayName("detect names the language of each file")
        void detect(@TempDir Path dir) throws Exception {
            Path cpp = Files.writeString(dir.resolve("sol.cpp"), "int main() {}");
            Path script = Files.writeString(dir.resolve("gen"), "import random\nprint(random.randint(1, 9))\n");
            Path text = Files.writeString(dir.resolve("notes.txt"), "nothing to see");

            CliResult result = execute("detect", cpp.toString(), script.toString(), text.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("sol.cpp: CPP"));
            assertTrue(result.output().contains("gen: PYTHON"));
            assertTrue(result.output().contains("notes.txt: unknown language"));
        }

        @Test
        @DisplayName("compile without roles is a usage error")
        void compileWithoutRoles() {
            CliResult result = execute("compile");

            assertEquals(AbstractRunCommand.EXIT_CONFIG, result.exitCode());
            assertTrue(result.output().contains("No roles given"));
        }

        @Test
        @DisplayName("configuration errors from the engine exit with code 2")
        void configurationError() {
            HarnessEngine engine = mock(HarnessEngine.class);
            when(engine.open(any(), any(), any(), any()))
                    .thenThrow(new ConfigurationException("Missing required roles for DIFFERENTIAL: [correct]"));

            CliResult result = execute(engine, "stress", "-r", "test=sol.cpp");

            assertEquals(AbstractRunCommand.EXIT_CONFIG, result.exitCode());
            assertTrue(result.output().contains("Missing required roles for DIFFERENTIAL: [correct]"));
        }

        @Test
        @DisplayName("stress runs end to end and writes the JSON report")
        void stressEndToEnd(@TempDir Path workspace) throws Exception {
            assumeTrue(FakeToolchain.shellAvailable(), "needs /bin/sh");
            Path compiler = FakeToolchain.installCompiler(workspace);
            FakeToolchain.source(workspace, "gen.cpp", "echo 2 1");
            FakeToolchain.source(workspace, "brute.cpp", "tr ' ' '\\n' | sort -n");
            FakeToolchain.source(workspace, "sol.cpp", "tr ' ' '\\n' | sort -n");
            LanguageOverride cpp = FakeToolchain.cppOverride(compiler);
            properties.setLanguages(Map.of("cpp", cpp));
            Path report = workspace.resolve("out/report.json");
            CliResult result;
            try (ProcessExecutor executor = new ProcessExecutor()) {
                HarnessEngine engine = new HarnessEngine(
                        new LanguageStrategyFactory(new LanguageProfileResolver(properties.languageOverrides()),
                                executor),
                        new EventBus(), HarnessMetrics.standalone(), properties, new FilesSnapshotService(), List.of());

                result = execute(engine, "stress", "-w", workspace.toString(),
                        "-r", "generator=gen.cpp", "-r", "correct=brute.cpp", "-r", "test=sol.cpp",
                        "-n", "3", "-t", "2", "--report", report.toString());
            }

            assertEquals(AbstractRunCommand.EXIT_OK, result.exitCode(), result.output());
            assertTrue(result.output().contains("All files compiled successfully"));
            assertTrue(Files.readString(report).contains("\"allPassed\" : true"));
        }
    }

    @Test
    @DisplayName("root cause message unwraps nested exceptions")
    void rootCause() {
        Exception nested = new RuntimeException("outer", new IllegalStateException("inner"));

        assertEquals("inner", AbstractRunCommand.rootCauseMessage(nested));
        assertEquals("NullPointerException", AbstractRunCommand.rootCauseMessage(new NullPointerException()));
    }

    @Test
    @DisplayName("durations format as minutes, seconds or milliseconds")
    void formatDuration() {
        assertFalse(ConsoleOutput.formatDuration(500).isBlank());
        assertNotEquals(ConsoleOutput.formatDuration(500), ConsoleOutput.formatDuration(65_000));
    }
}
