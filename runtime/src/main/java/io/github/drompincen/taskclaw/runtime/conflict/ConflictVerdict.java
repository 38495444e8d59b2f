package io.github.drompincen.taskclaw.runtime.conflict;

import io.github.drompincen.taskclaw.protocol.api.ConflictType;

import java.util.List;

/**
 * @param sessionId the live session the candidate collides with, {@code null} for {@link ConflictType#NONE}
 * @param overlap   task ids claimed by both sides
 */
public record ConflictVerdict(ConflictType type, String sessionId, List<String> overlap, String message) {

    public ConflictVerdict {
        overlap = overlap != null ? List.copyOf(overlap) : List.of();
    }

    public static ConflictVerdict none() {
        return new ConflictVerdict(ConflictType.NONE, null, List.of(), "no conflict");
    }

    public boolean isConflict() {
        return type != ConflictType.NONE;
    }
}
