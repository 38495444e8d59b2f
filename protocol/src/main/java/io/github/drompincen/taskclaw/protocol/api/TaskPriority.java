package io.github.drompincen.taskclaw.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Task priority. {@link #rank()} orders priorities for focus selection, higher first.
 */
public enum TaskPriority {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String value;
    private final int rank;

    TaskPriority(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String value() { return value; }

    public int rank() { return rank; }

    @JsonCreator
    public static TaskPriority fromValue(String value) {
        for (TaskPriority priority : values()) {
            if (priority.value.equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown task priority: " + value);
    }
}
