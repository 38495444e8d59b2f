package io.github.drompincen.taskclaw.protocol.api;

import java.time.Instant;
import java.util.List;

public record SessionDto(
        String sessionId,
        String name,
        String agentId,
        SessionStatus status,
        ScopeType scopeType,
        String rootTaskId,
        List<String> computedTaskIds,
        String currentTask,
        String previousTask,
        String sessionNote,
        SessionStats stats,
        Instant startedAt,
        Instant lastActivity,
        Instant suspendedAt
) {}
