package com.codeharness.core.compiler;

import com.codeharness.core.language.ConfigurationException;
import com.codeharness.core.language.Language;
import com.codeharness.core.language.LanguageProfileResolver;
import com.codeharness.core.process.ProcessExecutor;

/**
 * Picks the strategy for a language based on its execution model.
 */
public class LanguageStrategyFactory {

    private final LanguageProfileResolver resolver;
    private final ProcessExecutor executor;

    public LanguageStrategyFactory(LanguageProfileResolver resolver, ProcessExecutor executor) {
        this.resolver = resolver;
        this.executor = executor;
    }

    /**
     * @throws ConfigurationException when the language is unknown
     */
    public LanguageStrategy create(Language language) {
        if (language == null) {
            throw new ConfigurationException("Language must not be null");
        }
        return switch (language.executionModel()) {
            case NATIVE_COMPILED -> new NativeCompiledStrategy(language, resolver, executor);
            case BYTECODE_COMPILED -> new BytecodeCompiledStrategy(language, resolver, executor);
            case INTERPRETED -> new InterpretedStrategy(language, resolver, executor);
            case UNKNOWN -> throw new ConfigurationException("Unsupported language: " + language);
        };
    }

    /** Strategy for a file that runs as it is, whatever language it was written in. */
    public LanguageStrategy prebuilt() {
        return new PrebuiltExecutableStrategy();
    }

    public LanguageProfileResolver resolver() {
        return resolver;
    }

    public ProcessExecutor executor() {
        return executor;
    }
}
