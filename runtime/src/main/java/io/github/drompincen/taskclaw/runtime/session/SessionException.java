package io.github.drompincen.taskclaw.runtime.session;

import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;

/**
 * A lifecycle request refused by a precondition or by the conflict policy.
 */
public class SessionException extends TaskClawException {

    public SessionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static SessionException notFound(String sessionId) {
        SessionException e = new SessionException(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId);
        e.addContext("sessionId", String.valueOf(sessionId));
        return e;
    }

    public static SessionException wrongState(String sessionId, String expected, Object actual) {
        SessionException e = new SessionException(ErrorCode.SESSION_WRONG_STATE,
                "Session " + sessionId + " is " + actual + ", expected " + expected);
        e.addContext("sessionId", sessionId);
        return e;
    }

    public static SessionException notInScope(String sessionId, String taskId) {
        SessionException e = new SessionException(ErrorCode.TASK_NOT_IN_SCOPE,
                "Task " + taskId + " is not in the scope of session " + (sessionId != null ? sessionId : "being started"));
        e.addContext("taskId", taskId);
        return e;
    }

    public static SessionException claimed(String taskId, String holderSessionId) {
        SessionException e = new SessionException(ErrorCode.TASK_CLAIMED,
                "Task " + taskId + " is already the focus of session " + holderSessionId);
        e.addContext("taskId", taskId);
        e.addContext("conflictingSessionId", holderSessionId);
        return e;
    }
}
