package io.github.drompincen.taskclaw.persistence.file;

import java.nio.file.Path;

/**
 * @param backup the rollback point taken before the replace, {@code null} for a new file
 */
public record WriteReceipt(Path target, Path backup, int bytesWritten) {}
