package com.codeharness.core.config;

import com.codeharness.core.language.Language;
import com.codeharness.core.language.LanguageOverride;
import com.codeharness.core.testing.ComparisonMode;
import com.codeharness.core.testing.TestRunOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "harness")
public class HarnessProperties {

    private Compilation compilation = new Compilation();
    private Execution execution = new Execution();
    private Testing testing = new Testing();
    private Map<String, LanguageOverride> languages = new LinkedHashMap<>();

    /**
     * Per-language overrides keyed by {@link Language}. The compilation optimization level applies
     * to C++ unless {@code harness.languages.cpp.optimization} sets its own.
     */
    public Map<Language, LanguageOverride> languageOverrides() {
        Map<Language, LanguageOverride> result = new EnumMap<>(Language.class);
        languages.forEach((key, override) -> result.merge(Language.fromKey(key), override, LanguageOverride::overlay));
        if (compilation.optimization != null) {
            LanguageOverride optimization = new LanguageOverride();
            optimization.setOptimization(compilation.optimization);
            LanguageOverride cpp = result.get(Language.CPP);
            result.put(Language.CPP, cpp == null ? optimization : optimization.overlay(cpp));
        }
        return result;
    }

    public TestRunOptions toRunOptions() {
        return new TestRunOptions(
                testing.maxWorkers,
                testing.stopOnFirstFailure,
                Duration.ofSeconds(execution.generatorTimeoutSeconds),
                Duration.ofSeconds(execution.solutionTimeoutSeconds),
                Duration.ofSeconds(execution.validatorTimeoutSeconds),
                testing.comparisonMode,
                testing.timeLimitHardKillFactor);
    }

    public Duration getCompileTimeout() { return Duration.ofSeconds(compilation.timeoutSeconds); }
    public Duration getPollInterval() { return Duration.ofMillis(execution.pollIntervalMillis); }
    public Path getScratchDirectory() {
        return execution.scratchDirectory == null || execution.scratchDirectory.isBlank()
                ? null : Path.of(execution.scratchDirectory);
    }

    public Compilation getCompilation() { return compilation; }
    public void setCompilation(Compilation compilation) { this.compilation = compilation; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Testing getTesting() { return testing; }
    public void setTesting(Testing testing) { this.testing = testing; }
    public Map<String, LanguageOverride> getLanguages() { return languages; }
    public void setLanguages(Map<String, LanguageOverride> languages) { this.languages = languages; }

    public static class Compilation {
        private int timeoutSeconds = 30;
        private String optimization = "O2";
        private boolean syntaxCheckInterpreted = false;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public String getOptimization() { return optimization; }
        public void setOptimization(String optimization) { this.optimization = optimization; }
        public boolean isSyntaxCheckInterpreted() { return syntaxCheckInterpreted; }
        public void setSyntaxCheckInterpreted(boolean syntaxCheckInterpreted) { this.syntaxCheckInterpreted = syntaxCheckInterpreted; }
    }

    public static class Execution {
        private int generatorTimeoutSeconds = 10;
        private int solutionTimeoutSeconds = 30;
        private int validatorTimeoutSeconds = 10;
        private int pollIntervalMillis = 5;
        private String scratchDirectory;

        public int getGeneratorTimeoutSeconds() { return generatorTimeoutSeconds; }
        public void setGeneratorTimeoutSeconds(int generatorTimeoutSeconds) { this.generatorTimeoutSeconds = generatorTimeoutSeconds; }
        public int getSolutionTimeoutSeconds() { return solutionTimeoutSeconds; }
        public void setSolutionTimeoutSeconds(int solutionTimeoutSeconds) { this.solutionTimeoutSeconds = solutionTimeoutSeconds; }
        public int getValidatorTimeoutSeconds() { return validatorTimeoutSeconds; }
        public void setValidatorTimeoutSeconds(int validatorTimeoutSeconds) { this.validatorTimeoutSeconds = validatorTimeoutSeconds; }
        public int getPollIntervalMillis() { return pollIntervalMillis; }
        public void setPollIntervalMillis(int pollIntervalMillis) { this.pollIntervalMillis = pollIntervalMillis; }
        public String getScratchDirectory() { return scratchDirectory; }
        public void setScratchDirectory(String scratchDirectory) { this.scratchDirectory = scratchDirectory; }
    }

    public static class Testing {
        private int maxWorkers = 0;
        private boolean saveTestIo = true;
        private ComparisonMode comparisonMode = ComparisonMode.TRIMMED;
        private double timeLimitHardKillFactor = 10.0;
        private int previewLength = 300;
        private boolean stopOnFirstFailure = false;

        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
        public boolean isSaveTestIo() { return saveTestIo; }
        public void setSaveTestIo(boolean saveTestIo) { this.saveTestIo = saveTestIo; }
        public ComparisonMode getComparisonMode() { return comparisonMode; }
        public void setComparisonMode(ComparisonMode comparisonMode) { this.comparisonMode = comparisonMode; }
        public double getTimeLimitHardKillFactor() { return timeLimitHardKillFactor; }
        public void setTimeLimitHardKillFactor(double timeLimitHardKillFactor) { this.timeLimitHardKillFactor = timeLimitHardKillFactor; }
        public int getPreviewLength() { return previewLength; }
        public void setPreviewLength(int previewLength) { this.previewLength = previewLength; }
        public boolean isStopOnFirstFailure() { return stopOnFirstFailure; }
        public void setStopOnFirstFailure(boolean stopOnFirstFailure) { this.stopOnFirstFailure = stopOnFirstFailure; }
    }
}
