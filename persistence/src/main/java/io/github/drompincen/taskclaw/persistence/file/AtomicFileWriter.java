package io.github.drompincen.taskclaw.persistence.file;

import io.github.drompincen.taskclaw.persistence.backup.BackupService;
import io.github.drompincen.taskclaw.persistence.validation.DocumentValidator;
import io.github.drompincen.taskclaw.persistence.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Stage, validate, back up, swap.
 * <p>
 * Content is staged in a temp file next to the target, validated from disk, the current
 * target is copied to a numbered backup, and the temp file is renamed over the target.
 * A failure before the rename leaves the target untouched. A failed rename puts the
 * backup back on a best-effort basis. Callers are expected to hold the target's lock.
 */
public class AtomicFileWriter {

    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    private final BackupService backupService;

    public AtomicFileWriter(BackupService backupService) {
        this.backupService = backupService;
    }

    public WriteReceipt write(Path target, byte[] content, DocumentValidator validator) {
        Path parent = target.toAbsolutePath().getParent();
        Path staged = null;
        try {
            try {
                Files.createDirectories(parent);
                staged = Files.createTempFile(parent, "." + target.getFileName() + ".", ".tmp");
                writeFully(staged, content);
            } catch (IOException e) {
                throw new DocumentWriteException(target, WritePhase.STAGE,
                        "Failed to stage " + target.getFileName() + ": " + e.getMessage(), e);
            }

            validateStaged(target, staged, validator);

            Path backup = null;
            if (Files.exists(target)) {
                try {
                    backup = backupService.createRollbackPoint(target);
                    backupService.enforceRetention(target);
                } catch (IOException e) {
                    throw new DocumentWriteException(target, WritePhase.BACKUP,
                            "Failed to back up " + target.getFileName() + ": " + e.getMessage(), e);
                }
            }

            try {
                moveIntoPlace(staged, target);
            } catch (IOException e) {
                if (backup != null) {
                    rollBack(backup, target);
                }
                throw new DocumentWriteException(target, WritePhase.REPLACE,
                        "Failed to replace " + target.getFileName() + ": " + e.getMessage(), e);
            }
            log.debug("Wrote {} bytes to {}", content.length, target);
            return new WriteReceipt(target, backup, content.length);
        } finally {
            discard(staged);
        }
    }

    protected void moveIntoPlace(Path staged, Path target) throws IOException {
        try {
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void validateStaged(Path target, Path staged, DocumentValidator validator) {
        byte[] written;
        try {
            written = Files.readAllBytes(staged);
        } catch (IOException e) {
            throw new DocumentWriteException(target, WritePhase.STAGE,
                    "Failed to read back staged " + target.getFileName() + ": " + e.getMessage(), e);
        }
        if (written.length == 0) {
            throw DocumentWriteException.rejected(target, List.of("document is empty"));
        }
        ValidationResult result = validator.validate(written);
        if (!result.valid()) {
            throw DocumentWriteException.rejected(target, result.reasons());
        }
    }

    private void rollBack(Path backup, Path target) {
        try {
            Files.copy(backup, target, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Restored {} from {} after failed replace", target, backup);
        } catch (IOException e) {
            log.error("Rollback of {} from {} failed: {}", target, backup, e.getMessage(), e);
        }
    }

    private static void writeFully(Path file, byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void discard(Path staged) {
        if (staged == null) {
            return;
        }
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", staged, e.getMessage());
        }
    }
}
