package io.github.drompincen.taskclaw.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overlap classification between a candidate scope and a live session's scope.
 * Declared in increasing severity.
 */
public enum ConflictType {
    NONE("none"),
    NESTED("nested"),
    PARTIAL("partial"),
    IDENTICAL("identical"),
    HARD("hard");

    private final String value;

    ConflictType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    public boolean isMoreSevereThan(ConflictType other) {
        return ordinal() > other.ordinal();
    }
}
