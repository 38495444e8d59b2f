package io.github.drompincen.taskclaw.protocol.api;

import java.time.Instant;

public record TaskDto(
        String id,
        String title,
        String parentId,
        TaskStatus status,
        TaskPriority priority,
        String phase,
        Instant createdAt,
        Instant updatedAt
) {}
