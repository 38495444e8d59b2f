package io.github.drompincen.taskclaw.persistence.repository;

import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;

import java.nio.file.Path;

public class DocumentParseException extends TaskClawException {

    public DocumentParseException(Path file, Throwable cause) {
        super(ErrorCode.PARSE_FAILED, "Cannot read " + file.getFileName() + ": " + cause.getMessage(), cause);
        addContext("file", file.toString());
    }
}
