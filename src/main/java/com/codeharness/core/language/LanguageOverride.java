package com.codeharness.core.language;

import java.util.List;

/**
 * Partial language settings layered over the built-in defaults.
 * Every field is optional; {@code null} keeps the underlying value.
 * Bound from {@code harness.languages.<key>} and from manifest-level overrides.
 */
public class LanguageOverride {

    private String compiler;
    private String runtime;
    private String interpreter;
    private List<String> flags;
    private String optimization;
    private String stdVersion;
    private String artifactSuffix;

    public LanguageOverride() {
    }

    /**
     * Layers {@code other} on top of this override and returns the combined result.
     */
    public LanguageOverride overlay(LanguageOverride other) {
        LanguageOverride result = new LanguageOverride();
        result.compiler = pick(other == null ? null : other.compiler, compiler);
        result.runtime = pick(other == null ? null : other.runtime, runtime);
        result.interpreter = pick(other == null ? null : other.interpreter, interpreter);
        result.flags = pick(other == null ? null : other.flags, flags);
        result.optimization = pick(other == null ? null : other.optimization, optimization);
        result.stdVersion = pick(other == null ? null : other.stdVersion, stdVersion);
        result.artifactSuffix = pick(other == null ? null : other.artifactSuffix, artifactSuffix);
        return result;
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    public String getCompiler() { return compiler; }
    public void setCompiler(String compiler) { this.compiler = compiler; }
    public String getRuntime() { return runtime; }
    public void setRuntime(String runtime) { this.runtime = runtime; }
    public String getInterpreter() { return interpreter; }
    public void setInterpreter(String interpreter) { this.interpreter = interpreter; }
    public List<String> getFlags() { return flags; }
    public void setFlags(List<String> flags) { this.flags = flags; }
    public String getOptimization() { return optimization; }
    public void setOptimization(String optimization) { this.optimization = optimization; }
    public String getStdVersion() { return stdVersion; }
    public void setStdVersion(String stdVersion) { this.stdVersion = stdVersion; }
    public String getArtifactSuffix() { return artifactSuffix; }
    public void setArtifactSuffix(String artifactSuffix) { this.artifactSuffix = artifactSuffix; }
}
