package com.codeharness.core.language;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves per-language toolchain profiles (built-in defaults merged with overrides) and turns them
 * into concrete build and run commands.
 * <p>
 * Resolved profiles are cached. {@link #refresh(Map)} swaps overrides and cache together, so a
 * concurrent {@link #resolve(Language)} sees either the old or the new configuration, never a mix.
 */
public class LanguageProfileResolver {

    private static final Logger log = LoggerFactory.getLogger(LanguageProfileResolver.class);

    private final LanguageDetector detector = new LanguageDetector();

    private volatile Snapshot snapshot;

    public LanguageProfileResolver() {
        this(Map.of());
    }

    public LanguageProfileResolver(Map<Language, LanguageOverride> overrides) {
        this.snapshot = new Snapshot(overrides);
    }

    /**
     * Returns the effective profile for {@code language}.
     *
     * @throws ConfigurationException for {@link Language#UNKNOWN}
     */
    public LanguageProfile resolve(Language language) {
        if (language == null || !language.isKnown()) {
            throw new ConfigurationException("Unsupported language: " + language);
        }
        Snapshot current = snapshot;
        return current.cache.computeIfAbsent(language,
                lang -> LanguageProfile.defaultFor(lang).merge(current.overrides.get(lang)));
    }

    /**
     * Replaces the override set and drops every cached profile.
     */
    public void refresh(Map<Language, LanguageOverride> overrides) {
        snapshot = new Snapshot(overrides);
        log.debug("Language profiles refreshed with overrides for {}", snapshot.overrides.keySet());
    }

    /** Drops cached profiles, keeping the current overrides. */
    public void refresh() {
        refresh(snapshot.overrides);
    }

    /**
     * Returns a new resolver whose overrides are this resolver's overrides with {@code extra} layered on top.
     */
    public LanguageProfileResolver withOverrides(Map<Language, LanguageOverride> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<Language, LanguageOverride> merged = new EnumMap<>(Language.class);
        merged.putAll(snapshot.overrides);
        extra.forEach((language, override) -> merged.merge(language, override, LanguageOverride::overlay));
        return new LanguageProfileResolver(merged);
    }

    public Language detect(Path path, String content) {
        return detector.detect(path, content);
    }

    public LanguageDetector detector() {
        return detector;
    }

    /**
     * Where the build artifact for {@code source} lives. For languages without a build step this is
     * the source itself.
     */
    public Path artifactPath(Language language, Path source) {
        LanguageProfile profile = resolve(language);
        if (!profile.buildRequired()) {
            return source;
        }
        Path parent = source.toAbsolutePath().getParent();
        return parent.resolve(baseName(source) + profile.artifactSuffix());
    }

    /**
     * Build command for a compiled language.
     *
     * @param output for native code the executable to write; for bytecode the class output directory
     */
    public List<String> buildCommand(Language language, Path source, Path output, List<String> extraFlags) {
        LanguageProfile profile = resolve(language);
        if (!profile.buildRequired()) {
            throw new ConfigurationException(language + " has no build step");
        }
        List<String> command = new ArrayList<>();
        command.add(profile.compiler());
        if (language.executionModel() == ExecutionModel.NATIVE_COMPILED) {
            if (profile.optimization() != null && !profile.optimization().isBlank()) {
                command.add("-" + profile.optimization());
            }
            if (profile.standardVersion() != null && !profile.standardVersion().isBlank()) {
                command.add("-std=" + profile.standardVersion());
            }
            command.addAll(profile.flags());
            command.addAll(extraFlags == null ? List.of() : extraFlags);
            command.add(source.toString());
            command.add(profile.outputFlag());
            command.add(output.toString());
        } else {
            command.addAll(profile.flags());
            command.addAll(extraFlags == null ? List.of() : extraFlags);
            command.add(profile.outputFlag());
            command.add(output.toString());
            command.add(source.toString());
        }
        return command;
    }

    /**
     * Command that runs a built artifact (or an interpreted source).
     *
     * @param entryPoint class name for bytecode languages; defaults to the artifact's base name when {@code null}
     */
    public List<String> runCommand(Language language, Path artifact, String entryPoint) {
        LanguageProfile profile = resolve(language);
        return switch (language.executionModel()) {
            case NATIVE_COMPILED -> List.of(artifact.toAbsolutePath().toString());
            case BYTECODE_COMPILED -> List.of(
                    profile.runtime(),
                    "-cp", artifact.toAbsolutePath().getParent().toString(),
                    entryPoint != null ? entryPoint : baseName(artifact));
            case INTERPRETED -> {
                List<String> command = new ArrayList<>();
                command.add(profile.runtime());
                command.addAll(profile.flags());
                command.add(artifact.toAbsolutePath().toString());
                yield command;
            }
            case UNKNOWN -> throw new ConfigurationException("Unsupported language: " + language);
        };
    }

    static String baseName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static final class Snapshot {
        private final Map<Language, LanguageOverride> overrides;
        private final ConcurrentHashMap<Language, LanguageProfile> cache = new ConcurrentHashMap<>();

        private Snapshot(Map<Language, LanguageOverride> overrides) {
            Map<Language, LanguageOverride> copy = new EnumMap<>(Language.class);
            if (overrides != null) {
                copy.putAll(overrides);
            }
            this.overrides = Map.copyOf(copy);
        }
    }
}
