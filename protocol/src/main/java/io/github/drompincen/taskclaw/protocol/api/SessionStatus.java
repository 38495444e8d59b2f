package io.github.drompincen.taskclaw.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    ACTIVE("active"),
    SUSPENDED("suspended");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    @JsonCreator
    public static SessionStatus fromValue(String value) {
        for (SessionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }
}
