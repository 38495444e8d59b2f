package io.github.drompincen.taskclaw.protocol.error;

public enum ErrorCategory {
    /** Locks, parsing, writes and backups. */
    STRUCTURAL,
    /** Conflicts, hierarchy limits, empty scopes: the request itself must change. */
    POLICY,
    /** Missing sessions, wrong lifecycle state, missing or foreign focus. */
    PRECONDITION
}
