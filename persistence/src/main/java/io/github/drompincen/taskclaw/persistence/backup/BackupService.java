package io.github.drompincen.taskclaw.persistence.backup;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface BackupService {

    /** Copies the current content of {@code file} to a new backup and returns its path. */
    Path createRollbackPoint(Path file) throws IOException;

    /** Deletes the oldest backups of {@code file} beyond the retention count. */
    void enforceRetention(Path file) throws IOException;

    /** Backups of {@code file}, oldest first. */
    List<BackupEntry> list(Path file) throws IOException;

    default Optional<BackupEntry> latest(Path file) throws IOException {
        List<BackupEntry> entries = list(file);
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    default Optional<BackupEntry> find(Path file, int number) throws IOException {
        return list(file).stream().filter(e -> e.number() == number).findFirst();
    }
}
