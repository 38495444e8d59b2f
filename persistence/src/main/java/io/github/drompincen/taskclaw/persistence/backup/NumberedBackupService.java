package io.github.drompincen.taskclaw.persistence.backup;

import io.github.drompincen.taskclaw.persistence.audit.AuditLog;
import io.github.drompincen.taskclaw.protocol.event.AuditAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Keeps {@code <dir>/.backups/<name>.<n>} copies; a higher number is a newer backup.
 */
public class NumberedBackupService implements BackupService {

    private static final Logger log = LoggerFactory.getLogger(NumberedBackupService.class);

    public static final String DEFAULT_DIRECTORY = ".backups";
    public static final int DEFAULT_MAX_BACKUPS = 10;

    private final String directoryName;
    private final int maxBackups;
    private final AuditLog auditLog;

    public NumberedBackupService(String directoryName, int maxBackups, AuditLog auditLog) {
        if (maxBackups < 1) {
            throw new IllegalArgumentException("maxBackups must be at least 1, got " + maxBackups);
        }
        this.directoryName = directoryName;
        this.maxBackups = maxBackups;
        this.auditLog = auditLog;
    }

    public NumberedBackupService(AuditLog auditLog) {
        this(DEFAULT_DIRECTORY, DEFAULT_MAX_BACKUPS, auditLog);
    }

    @Override
    public Path createRollbackPoint(Path file) throws IOException {
        Path dir = backupDirectory(file);
        Files.createDirectories(dir);
        int next = list(file).stream().mapToInt(BackupEntry::number).max().orElse(0) + 1;
        Path backup = dir.resolve(file.getFileName() + "." + next);
        Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        log.debug("Backed up {} to {}", file, backup);
        auditLog.emit(null, AuditAction.BACKUP_CREATED, null,
                Map.of("file", file.getFileName().toString(), "backup", backup.getFileName().toString()));
        return backup;
    }

    @Override
    public void enforceRetention(Path file) throws IOException {
        List<BackupEntry> entries = list(file);
        int excess = entries.size() - maxBackups;
        for (int i = 0; i < excess; i++) {
            Path old = entries.get(i).path();
            Files.deleteIfExists(old);
            log.debug("Rotated out backup {}", old);
        }
    }

    @Override
    public List<BackupEntry> list(Path file) throws IOException {
        Path dir = backupDirectory(file);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        String prefix = file.getFileName() + ".";
        List<BackupEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, prefix + "*")) {
            for (Path candidate : stream) {
                String suffix = candidate.getFileName().toString().substring(prefix.length());
                if (!suffix.matches("\\d{1,9}")) {
                    continue;
                }
                entries.add(new BackupEntry(candidate, Integer.parseInt(suffix),
                        Files.getLastModifiedTime(candidate).toInstant(), Files.size(candidate)));
            }
        }
        entries.sort(Comparator.comparingInt(BackupEntry::number));
        return entries;
    }

    public Path backupDirectory(Path file) {
        return file.toAbsolutePath().getParent().resolve(directoryName);
    }

    public int maxBackups() { return maxBackups; }
}
