package io.github.drompincen.taskclaw.protocol.api;

import java.time.Instant;

public record SessionHistoryDto(
        String sessionId,
        String name,
        String agentId,
        ScopeType scopeType,
        String rootTaskId,
        String finalFocus,
        Instant startedAt,
        Instant endedAt,
        SessionStats stats,
        String endNote
) {}
