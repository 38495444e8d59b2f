package io.github.drompincen.taskclaw.persistence.file;

import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;

import java.nio.file.Path;
import java.util.List;

/**
 * An atomic write failed. Unless {@link #getPhase()} is {@link WritePhase#REPLACE} the
 * target was never touched.
 */
public class DocumentWriteException extends TaskClawException {

    private final Path target;
    private final WritePhase phase;

    public DocumentWriteException(Path target, WritePhase phase, String message, Throwable cause) {
        super(codeFor(phase), message, cause);
        this.target = target;
        this.phase = phase;
        addContext("file", target.toString());
        addContext("phase", phase.name());
    }

    public static DocumentWriteException rejected(Path target, List<String> reasons) {
        return new DocumentWriteException(target, WritePhase.VALIDATE,
                "Refusing to write " + target.getFileName() + ": " + String.join("; ", reasons), null);
    }

    public Path getTarget() { return target; }

    public WritePhase getPhase() { return phase; }

    private static ErrorCode codeFor(WritePhase phase) {
        return switch (phase) {
            case VALIDATE -> ErrorCode.VALIDATION_FAILED;
            case BACKUP -> ErrorCode.BACKUP_FAILED;
            case STAGE, REPLACE -> ErrorCode.WRITE_FAILED;
        };
    }
}
