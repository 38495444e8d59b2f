package io.github.drompincen.taskclaw.persistence.backup;

import io.github.drompincen.taskclaw.persistence.audit.AuditLog;
import io.github.drompincen.taskclaw.persistence.file.FileLockHandle;
import io.github.drompincen.taskclaw.persistence.repository.JsonDocumentRepository;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import io.github.drompincen.taskclaw.protocol.event.AuditAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Puts a document back to one of its numbered backups. The restore goes through the
 * atomic writer, so the content being replaced is itself backed up first.
 */
public class DocumentRestoreService {

    private static final Logger log = LoggerFactory.getLogger(DocumentRestoreService.class);

    private final BackupService backupService;
    private final AuditLog auditLog;

    public DocumentRestoreService(BackupService backupService, AuditLog auditLog) {
        this.backupService = backupService;
        this.auditLog = auditLog;
    }

    public List<BackupEntry> list(JsonDocumentRepository<?> repository) {
        try {
            return backupService.list(repository.file());
        } catch (IOException e) {
            throw new TaskClawException(ErrorCode.FILE_NOT_FOUND, "Cannot list backups of "
                    + repository.file().getFileName(), e);
        }
    }

    /**
     * @param number backup number, or {@code null} for the latest
     */
    public BackupEntry restore(JsonDocumentRepository<?> repository, Integer number) {
        Path target = repository.file();
        try (FileLockHandle ignored = repository.lock()) {
            BackupEntry entry = locate(target, number);
            byte[] content;
            try {
                content = Files.readAllBytes(entry.path());
            } catch (IOException e) {
                throw new TaskClawException(ErrorCode.RESTORE_FAILED, "Cannot read backup " + entry.path(), e);
            }
            repository.writeRaw(content);
            log.info("Restored {} from backup #{}", target.getFileName(), entry.number());
            auditLog.emit(null, AuditAction.BACKUP_RESTORED, null,
                    Map.of("file", target.getFileName().toString(), "backup", entry.number()));
            return entry;
        }
    }

    private BackupEntry locate(Path target, Integer number) {
        Optional<BackupEntry> entry;
        try {
            entry = number == null ? backupService.latest(target) : backupService.find(target, number);
        } catch (IOException e) {
            throw new TaskClawException(ErrorCode.RESTORE_FAILED, "Cannot list backups of " + target.getFileName(), e);
        }
        return entry.orElseThrow(() -> new TaskClawException(ErrorCode.FILE_NOT_FOUND,
                number == null
                        ? "No backups of " + target.getFileName()
                        : "No backup #" + number + " of " + target.getFileName())
                .addContext("file", target.toString()));
    }
}
