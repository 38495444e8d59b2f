package io.github.drompincen.taskclaw.protocol.error;

/**
 * Which documents a failed operation left durably changed.
 */
public enum DurableUpdate {
    NONE,
    SESSION_REGISTRY,
    TASK_STORE,
    BOTH
}
