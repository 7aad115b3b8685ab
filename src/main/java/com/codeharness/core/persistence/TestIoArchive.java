package com.codeharness.core.persistence;

import com.codeharness.core.manifest.Roles;
import com.codeharness.core.manifest.TestKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes each test's input and outputs under {@code <workspace>/<kind-dir>/inputs} and {@code outputs}.
 * Archiving is best effort: failures are logged and never fail a test.
 */
public class TestIoArchive {

    private static final Logger log = LoggerFactory.getLogger(TestIoArchive.class);

    private final Path workspaceRoot;
    private final boolean enabled;

    public TestIoArchive(Path workspaceRoot, boolean enabled) {
        this.workspaceRoot = workspaceRoot;
        this.enabled = enabled && workspaceRoot != null;
    }

    public static TestIoArchive disabled() {
        return new TestIoArchive(null, false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @param outputs stage name to stdout; {@code test} becomes {@code output_N.txt},
     *                {@code correct} becomes {@code correct_output_N.txt}
     */
    public void save(TestKind kind, int testNumber, String input, Map<String, String> outputs) {
        if (!enabled) {
            return;
        }
        Path base = workspaceRoot.resolve(kind.directoryName());
        try {
            Path inputs = Files.createDirectories(base.resolve("inputs"));
            Path outputDir = Files.createDirectories(base.resolve("outputs"));
            if (input != null) {
                Files.writeString(inputs.resolve("input_" + testNumber + ".txt"), input, StandardCharsets.UTF_8);
            }
            String testOutput = outputs.get(Roles.TEST);
            if (testOutput != null) {
                Files.writeString(outputDir.resolve("output_" + testNumber + ".txt"), testOutput, StandardCharsets.UTF_8);
            }
            String correctOutput = outputs.get(Roles.CORRECT);
            if (correctOutput != null) {
                Files.writeString(outputDir.resolve("correct_output_" + testNumber + ".txt"), correctOutput,
                        StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            log.warn("Could not archive I/O for test {}: {}", testNumber, e.getMessage());
        }
    }
}
