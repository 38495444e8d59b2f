package io.github.drompincen.taskclaw.persistence.document;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.drompincen.taskclaw.protocol.api.TaskPriority;
import io.github.drompincen.taskclaw.protocol.api.TaskStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A task record in {@code todo.json}. Fields this model does not know about are kept in
 * {@link #getExtra()} and written back unchanged.
 */
@JsonPropertyOrder({"id", "type", "parentId", "title", "description", "status", "priority", "phase",
        "createdAt", "updatedAt"})
public class TaskDocument {

    private String id;
    private String type;
    private String parentId;
    private String title;
    private String description;
    private TaskStatus status;
    private TaskPriority priority;
    private String phase;
    private Instant createdAt;
    private Instant updatedAt;
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public TaskDocument() {}

    public TaskDocument(String id, String title, TaskStatus status) {
        this.id = id;
        this.title = title;
        this.status = status;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getParentId() { return parentId; }
    public void setParentId(String parentId) { this.parentId = parentId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public TaskStatus getStatus() { return status; }
    public void setStatus(TaskStatus status) { this.status = status; }

    public TaskPriority getPriority() { return priority; }
    public void setPriority(TaskPriority priority) { this.priority = priority; }

    public String getPhase() { return phase; }
    public void setPhase(String phase) { this.phase = phase; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @JsonAnyGetter
    public Map<String, Object> getExtra() { return extra; }

    @JsonAnySetter
    public void putExtra(String key, Object value) { extra.put(key, value); }

    public boolean hasStatus(TaskStatus expected) {
        return status == expected;
    }

    /** Sets the status and stamps {@code updatedAt}; returns whether anything changed. */
    public boolean transitionTo(TaskStatus next, Instant now) {
        if (status == next) {
            return false;
        }
        status = next;
        updatedAt = now;
        return true;
    }
}
