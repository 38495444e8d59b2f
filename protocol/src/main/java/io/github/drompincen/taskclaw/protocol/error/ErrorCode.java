package io.github.drompincen.taskclaw.protocol.error;

/**
 * Stable error identities with their process exit codes.
 * Session errors occupy the 30-39 range.
 */
public enum ErrorCode {
    INVALID_ARGS(1, ErrorCategory.PRECONDITION, false),
    FILE_NOT_FOUND(2, ErrorCategory.STRUCTURAL, false),
    WRITE_FAILED(3, ErrorCategory.STRUCTURAL, false),
    BACKUP_FAILED(4, ErrorCategory.STRUCTURAL, false),
    VALIDATION_FAILED(5, ErrorCategory.STRUCTURAL, false),
    RESTORE_FAILED(6, ErrorCategory.STRUCTURAL, false),
    PARSE_FAILED(7, ErrorCategory.STRUCTURAL, false),
    LOCK_TIMEOUT(8, ErrorCategory.STRUCTURAL, true),
    CHECKSUM_MISMATCH(9, ErrorCategory.STRUCTURAL, true),
    PARENT_NOT_FOUND(10, ErrorCategory.POLICY, false),
    DEPTH_EXCEEDED(11, ErrorCategory.POLICY, false),
    SIBLING_LIMIT(12, ErrorCategory.POLICY, false),
    TASK_NOT_FOUND(13, ErrorCategory.PRECONDITION, false),

    SESSION_EXISTS(30, ErrorCategory.STRUCTURAL, true),
    SESSION_NOT_FOUND(31, ErrorCategory.PRECONDITION, false),
    SCOPE_CONFLICT(32, ErrorCategory.POLICY, false),
    SCOPE_INVALID(33, ErrorCategory.POLICY, false),
    TASK_NOT_IN_SCOPE(34, ErrorCategory.PRECONDITION, false),
    TASK_CLAIMED(35, ErrorCategory.POLICY, false),
    SESSION_WRONG_STATE(36, ErrorCategory.PRECONDITION, false),
    MAX_SESSIONS(37, ErrorCategory.POLICY, false),
    FOCUS_REQUIRED(38, ErrorCategory.PRECONDITION, false);

    private final int exitCode;
    private final ErrorCategory category;
    private final boolean retryable;

    ErrorCode(int exitCode, ErrorCategory category, boolean retryable) {
        this.exitCode = exitCode;
        this.category = category;
        this.retryable = retryable;
    }

    public int exitCode() { return exitCode; }
    public ErrorCategory category() { return category; }
    public boolean retryable() { return retryable; }
}
