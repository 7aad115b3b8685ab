package com.codeharness.core.config;

import com.codeharness.core.compiler.LanguageStrategyFactory;
import com.codeharness.core.events.EventBus;
import com.codeharness.core.language.LanguageProfileResolver;
import com.codeharness.core.metrics.HarnessMetrics;
import com.codeharness.core.persistence.FilesSnapshotService;
import com.codeharness.core.persistence.JsonReportWriter;
import com.codeharness.core.persistence.LoggingTestRunSink;
import com.codeharness.core.persistence.TestRunSink;
import com.codeharness.core.process.ProcessExecutor;
import com.codeharness.core.process.ProcfsMemorySampler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine's plain classes as Spring beans.
 */
@Configuration
public class HarnessConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public HarnessMetrics harnessMetrics(MeterRegistry registry) {
        return new HarnessMetrics(registry);
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public LanguageProfileResolver languageProfileResolver(HarnessProperties properties) {
        return new LanguageProfileResolver(properties.languageOverrides());
    }

    @Bean
    public ProcessExecutor processExecutor(HarnessProperties properties) {
        return new ProcessExecutor(new ProcfsMemorySampler(), properties.getPollInterval(),
                properties.getScratchDirectory());
    }

    @Bean
    public LanguageStrategyFactory languageStrategyFactory(LanguageProfileResolver resolver, ProcessExecutor executor) {
        return new LanguageStrategyFactory(resolver, executor);
    }

    @Bean
    public FilesSnapshotService filesSnapshotService() {
        return new FilesSnapshotService();
    }

    @Bean
    public JsonReportWriter jsonReportWriter() {
        return new JsonReportWriter();
    }

    @Bean
    public TestRunSink loggingTestRunSink() {
        return new LoggingTestRunSink();
    }
}
