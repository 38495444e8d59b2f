package io.github.drompincen.taskclaw.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Root of {@code todo.json}.
 */
@JsonPropertyOrder({"version", "project", "_meta", "tasks"})
public class TaskStoreDocument implements ChecksummedDocument {

    public static final String CURRENT_VERSION = "1.0.0";

    private String version = CURRENT_VERSION;
    private String project;
    @JsonProperty("_meta")
    private TaskStoreMeta meta = new TaskStoreMeta();
    private List<TaskDocument> tasks = new ArrayList<>();

    public TaskStoreDocument() {}

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public String getProject() { return project; }
    public void setProject(String project) { this.project = project; }

    public TaskStoreMeta getMeta() { return meta; }
    public void setMeta(TaskStoreMeta meta) { this.meta = meta != null ? meta : new TaskStoreMeta(); }

    public List<TaskDocument> getTasks() { return tasks; }
    public void setTasks(List<TaskDocument> tasks) { this.tasks = tasks != null ? new ArrayList<>(tasks) : new ArrayList<>(); }

    public Optional<TaskDocument> findTask(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return tasks.stream().filter(t -> taskId.equals(t.getId())).findFirst();
    }

    public boolean containsTask(String taskId) {
        return findTask(taskId).isPresent();
    }

    @Override
    @JsonIgnore
    public Object checksumPayload() { return tasks; }

    @Override
    @JsonIgnore
    public String storedChecksum() { return meta.getChecksum(); }

    @Override
    public void stamp(String checksum, Instant now) {
        meta.setChecksum(checksum);
        meta.setLastModified(now);
    }
}
