package io.github.drompincen.taskclaw.persistence.file;

import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;

import java.nio.file.Path;
import java.time.Duration;

public class LockTimeoutException extends TaskClawException {

    public LockTimeoutException(Path file, Duration timeout) {
        super(ErrorCode.LOCK_TIMEOUT, "Timed out after " + timeout.toMillis() + "ms waiting for lock on " + file);
        addContext("file", file.toString());
    }

    public LockTimeoutException(Path file, Duration timeout, Throwable cause) {
        super(ErrorCode.LOCK_TIMEOUT, "Interrupted while waiting " + timeout.toMillis() + "ms for lock on " + file, cause);
        addContext("file", file.toString());
    }
}
