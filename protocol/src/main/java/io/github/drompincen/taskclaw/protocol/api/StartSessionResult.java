package io.github.drompincen.taskclaw.protocol.api;

import java.util.List;

/**
 * Outcome of an accepted session start.
 *
 * @param autoFocused whether the focus task was inferred rather than supplied
 * @param conflict    the overlap verdict that was tolerated, {@link ConflictType#NONE} when clean
 * @param warnings    policy warnings, e.g. a nested scope
 */
public record StartSessionResult(
        String sessionId,
        String focusTaskId,
        boolean autoFocused,
        List<String> computedTaskIds,
        ConflictType conflict,
        String conflictingSessionId,
        List<String> warnings
) {}
