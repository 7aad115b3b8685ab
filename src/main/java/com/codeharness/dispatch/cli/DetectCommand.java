package com.codeharness.dispatch.cli;

import com.codeharness.core.language.Language;
import com.codeharness.core.language.LanguageProfileResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: code-harness detect file...
 */
@Command(name = "detect", mixinStandardHelpOptions = true, description = "Show the detected language of source files")
@Component
public class DetectCommand implements Runnable {

    @Parameters(arity = "1..*", description = "Source files")
    List<Path> files;

    private final LanguageProfileResolver resolver;

    public DetectCommand(LanguageProfileResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void run() {
        for (Path file : files) {
            String content = null;
            if (Files.isRegularFile(file)) {
                try {
                    content = Files.readString(file, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
                    continue;
                }
            }
            Language language = resolver.detect(file, content);
            if (language.isKnown()) {
                ConsoleOutput.success(file + ": " + language.name() + " (" + language.executionModel() + ")");
            } else {
                ConsoleOutput.error(file + ": unknown language");
            }
        }
    }
}
