package io.github.drompincen.taskclaw.protocol.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for every failure the store surfaces to callers.
 * Carries a stable {@link ErrorCode}, whether retrying the whole operation may succeed,
 * and which documents (if any) were durably updated before the failure.
 */
public class TaskClawException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> context = new LinkedHashMap<>();
    private FailureStage stage = FailureStage.PRE_WRITE;
    private DurableUpdate durableUpdate = DurableUpdate.NONE;

    public TaskClawException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TaskClawException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() { return errorCode; }

    public ErrorCategory getCategory() { return errorCode.category(); }

    public boolean isRetryable() { return errorCode.retryable(); }

    public FailureStage getStage() { return stage; }

    public DurableUpdate getDurableUpdate() { return durableUpdate; }

    public Map<String, Object> getContext() { return Collections.unmodifiableMap(context); }

    public TaskClawException addContext(String key, Object value) {
        context.put(key, value);
        return this;
    }

    public TaskClawException inWrite(DurableUpdate durableUpdate) {
        this.stage = FailureStage.IN_WRITE;
        this.durableUpdate = durableUpdate;
        return this;
    }
}
