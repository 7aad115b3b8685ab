package com.codeharness.core.health;

import com.codeharness.core.compiler.LanguageStrategyFactory;
import com.codeharness.core.language.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports whether each supported language's toolchain can be launched.
 */
@Service
public class ToolchainHealthService {

    private static final Logger log = LoggerFactory.getLogger(ToolchainHealthService.class);

    private final LanguageStrategyFactory strategies;

    public ToolchainHealthService(LanguageStrategyFactory strategies) {
        this.strategies = strategies;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        for (Language language : Language.values()) {
            if (language.isKnown()) {
                results.add(check(language));
            }
        }
        return results;
    }

    public HealthStatus check(Language language) {
        try {
            return strategies.create(language).checkToolchain();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HealthStatus(language.key(), HealthStatus.Status.DOWN, "Check interrupted", Map.of());
        } catch (RuntimeException e) {
            log.warn("Toolchain check for {} failed: {}", language, e.getMessage());
            return new HealthStatus(language.key(), HealthStatus.Status.DOWN,
                    "Check failed: " + e.getMessage(), Map.of());
        }
    }
}
