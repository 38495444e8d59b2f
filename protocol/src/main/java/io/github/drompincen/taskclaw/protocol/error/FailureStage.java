package io.github.drompincen.taskclaw.protocol.error;

public enum FailureStage {
    /** Rejected while validating; nothing was written. */
    PRE_WRITE,
    /** Failed while writing one of the documents. */
    IN_WRITE
}
