package com.codeharness.core.language;

import java.util.Locale;

/**
 * Languages the harness knows how to build and run.
 */
public enum Language {

    CPP("cpp", ExecutionModel.NATIVE_COMPILED),
    JAVA("java", ExecutionModel.BYTECODE_COMPILED),
    PYTHON("py", ExecutionModel.INTERPRETED),
    UNKNOWN("unknown", ExecutionModel.UNKNOWN);

    private final String key;
    private final ExecutionModel executionModel;

    Language(String key, ExecutionModel executionModel) {
        this.key = key;
        this.executionModel = executionModel;
    }

    /** Short key used in configuration and persisted snapshots. */
    public String key() {
        return key;
    }

    public ExecutionModel executionModel() {
        return executionModel;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Parses a configuration key or enum name ({@code cpp}, {@code CPP}, {@code python}, {@code py}).
     *
     * @throws ConfigurationException if the value names no supported language
     */
    public static Language fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Language must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language != UNKNOWN
                    && (language.key.equals(normalized) || language.name().toLowerCase(Locale.ROOT).equals(normalized))) {
                return language;
            }
        }
        if ("c++".equals(normalized)) {
            return CPP;
        }
        throw new ConfigurationException("Unsupported language: " + value);
    }
}
