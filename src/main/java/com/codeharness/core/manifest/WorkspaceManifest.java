package com.codeharness.core.manifest;

import com.codeharness.core.language.ConfigurationException;
import com.codeharness.core.language.Language;
import com.codeharness.core.language.LanguageOverride;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the caller hands the harness: where the workspace is, which file plays which role,
 * and how many tests or what limits to apply.
 *
 * @param workspaceRoot     directory against which relative role paths are resolved
 * @param roles             role name to source path, in declaration order
 * @param languageOverrides per-language settings layered over configuration
 * @param testCount         number of tests to run
 * @param timeLimit         wall-clock limit for time-limit runs, may be {@code null}
 * @param memoryLimitMb     memory limit for time-limit runs, may be {@code null}
 * @param validatorPath     validator source; becomes the {@code validator} role when set
 */
public record WorkspaceManifest(
        Path workspaceRoot,
        Map<String, Path> roles,
        Map<Language, LanguageOverride> languageOverrides,
        int testCount,
        Duration timeLimit,
        Integer memoryLimitMb,
        Path validatorPath
) {

    public WorkspaceManifest {
        if (workspaceRoot == null) {
            throw new ConfigurationException("workspace root is required");
        }
        if (testCount < 1) {
            throw new ConfigurationException("test count must be at least 1, got " + testCount);
        }
        Map<String, Path> orderedRoles = new LinkedHashMap<>(roles == null ? Map.of() : roles);
        if (validatorPath != null) {
            orderedRoles.putIfAbsent(Roles.VALIDATOR, validatorPath);
        }
        roles = Collections.unmodifiableMap(orderedRoles);
        Map<Language, LanguageOverride> overrides = new EnumMap<>(Language.class);
        if (languageOverrides != null) {
            overrides.putAll(languageOverrides);
        }
        languageOverrides = Collections.unmodifiableMap(overrides);
    }

    /**
     * Absolute, normalized path of {@code role}'s source.
     *
     * @throws ConfigurationException when the role is not declared
     */
    public Path sourceOf(String role) {
        Path path = roles.get(role);
        if (path == null) {
            throw new ConfigurationException("Role '" + role + "' is not declared in the manifest");
        }
        return workspaceRoot.resolve(path).toAbsolutePath().normalize();
    }

    /**
     * @throws ConfigurationException listing every role {@code kind} needs that is missing
     */
    public void requireRolesFor(TestKind kind) {
        var missing = kind.requiredRoles().stream().filter(r -> !roles.containsKey(r)).toList();
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required roles for " + kind + ": " + missing);
        }
        if (kind == TestKind.TIME_LIMIT && (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero())) {
            throw new ConfigurationException("A positive time limit is required for " + kind);
        }
    }

    public static Builder builder(Path workspaceRoot) {
        return new Builder(workspaceRoot);
    }

    public static final class Builder {
        private final Path workspaceRoot;
        private final Map<String, Path> roles = new LinkedHashMap<>();
        private final Map<Language, LanguageOverride> overrides = new EnumMap<>(Language.class);
        private int testCount = 1;
        private Duration timeLimit;
        private Integer memoryLimitMb;
        private Path validatorPath;

        private Builder(Path workspaceRoot) {
            this.workspaceRoot = workspaceRoot;
        }

        public Builder role(String role, String path) {
            return role(role, Path.of(path));
        }

        public Builder role(String role, Path path) {
            roles.put(role, path);
            return this;
        }

        public Builder override(Language language, LanguageOverride override) {
            overrides.put(language, override);
            return this;
        }

        public Builder testCount(int testCount) {
            this.testCount = testCount;
            return this;
        }

        public Builder timeLimit(Duration timeLimit) {
            this.timeLimit = timeLimit;
            return this;
        }

        public Builder memoryLimitMb(Integer memoryLimitMb) {
            this.memoryLimitMb = memoryLimitMb;
            return this;
        }

        public Builder validatorPath(Path validatorPath) {
            this.validatorPath = validatorPath;
            return this;
        }

        public WorkspaceManifest build() {
            return new WorkspaceManifest(workspaceRoot, roles, overrides, testCount, timeLimit,
                    memoryLimitMb, validatorPath);
        }
    }
}
