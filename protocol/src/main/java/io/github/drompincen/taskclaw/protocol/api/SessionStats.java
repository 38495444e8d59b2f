package io.github.drompincen.taskclaw.protocol.api;

public record SessionStats(
        int tasksCompleted,
        int focusChanges,
        int suspendCount,
        int resumeCount
) {}
