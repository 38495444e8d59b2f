package io.github.drompincen.taskclaw.persistence.audit;

import io.github.drompincen.taskclaw.protocol.event.AuditAction;

import java.util.Map;

/**
 * Sink for audit events. Implementations must never fail the operation that emits an event.
 */
public interface AuditLog {

    AuditLog NOOP = (sessionId, action, taskId, details) -> { };

    void emit(String sessionId, AuditAction action, String taskId, Map<String, Object> details);

    default void emit(String sessionId, AuditAction action, String taskId) {
        emit(sessionId, action, taskId, Map.of());
    }
}
