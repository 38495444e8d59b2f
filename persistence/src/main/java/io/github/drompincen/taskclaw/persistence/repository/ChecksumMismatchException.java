package io.github.drompincen.taskclaw.persistence.repository;

import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;

import java.nio.file.Path;

/**
 * The file changed on disk since it was loaded, so someone wrote it without holding the lock.
 */
public class ChecksumMismatchException extends TaskClawException {

    public ChecksumMismatchException(Path file, String expected, String actual) {
        super(ErrorCode.CHECKSUM_MISMATCH, file.getFileName() + " was modified concurrently");
        addContext("file", file.toString());
        addContext("expected", String.valueOf(expected));
        addContext("actual", String.valueOf(actual));
    }
}
