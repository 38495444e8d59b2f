package io.github.drompincen.taskclaw.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ScopeType {
    /** The root task only. */
    TASK("task"),
    /** The root task and its direct children. */
    TASK_GROUP("taskGroup"),
    /** The root task and all descendants up to maxDepth. */
    SUBTREE("subtree"),
    /** A subtree filtered to one phase. */
    EPIC_PHASE("epicPhase"),
    /** A whole epic tree. */
    EPIC("epic"),
    /** An explicit list of task ids. */
    CUSTOM("custom");

    private final String value;

    ScopeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    public boolean requiresRoot() {
        return this != CUSTOM;
    }

    @JsonCreator
    public static ScopeType fromValue(String value) {
        for (ScopeType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown scope type: " + value);
    }
}
