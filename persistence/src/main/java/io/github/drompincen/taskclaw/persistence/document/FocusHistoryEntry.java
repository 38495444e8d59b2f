package io.github.drompincen.taskclaw.persistence.document;

import java.time.Instant;

public class FocusHistoryEntry {

    public static final String FOCUSED = "focused";
    public static final String COMPLETED = "completed";

    private String taskId;
    private Instant timestamp;
    private String action;

    public FocusHistoryEntry() {}

    public FocusHistoryEntry(String taskId, Instant timestamp, String action) {
        this.taskId = taskId;
        this.timestamp = timestamp;
        this.action = action;
    }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }
}
