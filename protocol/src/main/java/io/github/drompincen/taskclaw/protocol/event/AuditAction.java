package io.github.drompincen.taskclaw.protocol.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditAction {
    // Session lifecycle
    SESSION_STARTED,
    SESSION_SUSPENDED,
    SESSION_RESUMED,
    SESSION_ENDED,
    FOCUS_CHANGED,
    NOTE_UPDATED,

    // Tasks
    TASK_CREATED,
    TASK_COMPLETED,
    STATUS_CHANGED,

    // Storage
    BACKUP_CREATED,
    BACKUP_RESTORED,
    ERROR_OCCURRED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
