package com.codeharness.core.compilation;

import com.codeharness.core.compiler.BuildOutcome;

import java.util.List;
import java.util.Map;

/**
 * Result of one {@code compileAll()}.
 *
 * @param success         logical AND of every dispatched build; {@code true} when nothing was stale
 * @param outcomes        role to outcome, for dispatched roles only
 * @param upToDateRoles   roles that were skipped
 * @param elapsedSeconds  wall-clock time of the whole pass
 */
public record CompilationReport(
        boolean success,
        Map<String, BuildOutcome> outcomes,
        List<String> upToDateRoles,
        double elapsedSeconds
) {

    public CompilationReport {
        outcomes = Map.copyOf(outcomes);
        upToDateRoles = List.copyOf(upToDateRoles);
    }

    public List<String> failedRoles() {
        return outcomes.entrySet().stream()
                .filter(e -> !e.getValue().ok())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
