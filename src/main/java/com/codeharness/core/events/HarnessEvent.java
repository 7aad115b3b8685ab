package com.codeharness.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while compiling or testing, consumed by the CLI and by embedding editors.
 *
 * @param eventType one of the constants in {@link EventTypes}
 * @param sessionId the session this event belongs to
 * @param subject   the role or test number the event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record HarnessEvent(
    String eventType,
    String sessionId,
    String subject,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static HarnessEvent of(String eventType, String sessionId, String subject, Map<String, Object> payload) {
        return new HarnessEvent(eventType, sessionId, subject, payload == null ? Map.of() : payload, Instant.now());
    }

    public static HarnessEvent progress(String sessionId, String subject, String message, ProgressSeverity severity) {
        return of(EventTypes.COMPILE_PROGRESS, sessionId, subject,
                Map.of("message", message, "severity", severity.name()));
    }

    /** Convenience accessor for the {@code message} payload entry. */
    public String message() {
        Object message = payload.get("message");
        return message == null ? null : message.toString();
    }

    public ProgressSeverity severity() {
        Object severity = payload.get("severity");
        return severity == null ? ProgressSeverity.INFO : ProgressSeverity.valueOf(severity.toString());
    }
}
