package io.github.drompincen.taskclaw.protocol.event;

import java.time.Instant;
import java.util.Map;

/**
 * One append-only audit log line.
 */
public record AuditEvent(
        String id,
        Instant timestamp,
        String sessionId,
        AuditAction action,
        Actor actor,
        String taskId,
        Map<String, Object> details
) {
    public AuditEvent {
        details = details != null ? Map.copyOf(details) : Map.of();
    }
}
