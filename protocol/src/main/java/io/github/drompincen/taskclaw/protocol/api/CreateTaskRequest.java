package io.github.drompincen.taskclaw.protocol.api;

public record CreateTaskRequest(
        String title,
        String description,
        String parentId,
        TaskPriority priority,
        String phase
) {
    public static CreateTaskRequest of(String title) {
        return new CreateTaskRequest(title, null, null, TaskPriority.MEDIUM, null);
    }
}
