package com.codeharness.core.language;

import java.util.List;

/**
 * Effective toolchain settings for one language.
 * <p>
 * Instances are immutable, so every profile handed out by the resolver is an independent value
 * and cannot leak mutations back into the resolver's cache.
 *
 * @param language        the language this profile describes
 * @param compiler        build tool ({@code g++}, {@code javac}); {@code null} when no build step exists
 * @param runtime         launcher used to run artifacts ({@code java}, {@code python3}); {@code null} for native code
 * @param flags           extra flags passed to the compiler, or to the interpreter for interpreted languages
 * @param optimization    optimization level without the leading dash, e.g. {@code O2}
 * @param standardVersion language standard, e.g. {@code c++17}
 * @param buildRequired   whether the language has a build step
 * @param artifactSuffix  suffix appended to the source base name to form the artifact name
 * @param outputFlag      compiler flag that names the output file or directory
 */
public record LanguageProfile(
        Language language,
        String compiler,
        String runtime,
        List<String> flags,
        String optimization,
        String standardVersion,
        boolean buildRequired,
        String artifactSuffix,
        String outputFlag
) {

    public LanguageProfile {
        flags = flags == null ? List.of() : List.copyOf(flags);
        artifactSuffix = artifactSuffix == null ? "" : artifactSuffix;
    }

    /** The executable whose presence decides whether this language is usable. */
    public String toolchain() {
        return buildRequired ? compiler : runtime;
    }

    /**
     * Returns a copy with every non-null field of the override applied.
     */
    public LanguageProfile merge(LanguageOverride override) {
        if (override == null) {
            return this;
        }
        String mergedRuntime = runtime;
        if (override.getRuntime() != null) {
            mergedRuntime = override.getRuntime();
        }
        if (override.getInterpreter() != null && language.executionModel() == ExecutionModel.INTERPRETED) {
            mergedRuntime = override.getInterpreter();
        }
        return new LanguageProfile(
                language,
                override.getCompiler() != null ? override.getCompiler() : compiler,
                mergedRuntime,
                override.getFlags() != null ? override.getFlags() : flags,
                override.getOptimization() != null ? stripDash(override.getOptimization()) : optimization,
                override.getStdVersion() != null ? override.getStdVersion() : standardVersion,
                buildRequired,
                override.getArtifactSuffix() != null ? override.getArtifactSuffix() : artifactSuffix,
                outputFlag);
    }

    private static String stripDash(String value) {
        return value.startsWith("-") ? value.substring(1) : value;
    }

    // -- Built-in defaults --------------------------------------------------

    static LanguageProfile defaultFor(Language language) {
        return switch (language) {
            case CPP -> new LanguageProfile(Language.CPP, "g++", null,
                    List.of("-march=native", "-mtune=native", "-pipe", "-Wall"),
                    "O2", "c++17", true, isWindows() ? ".exe" : "", "-o");
            case JAVA -> new LanguageProfile(Language.JAVA, "javac", "java",
                    List.of(), null, null, true, ".class", "-d");
            case PYTHON -> new LanguageProfile(Language.PYTHON, null,
                    isWindows() ? "python" : "python3",
                    List.of("-u"), null, null, false, ".py", null);
            case UNKNOWN -> throw new ConfigurationException("No profile exists for an unknown language");
        };
    }

    static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().startsWith("windows");
    }
}
