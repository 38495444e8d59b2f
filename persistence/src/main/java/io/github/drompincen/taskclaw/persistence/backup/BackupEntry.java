package io.github.drompincen.taskclaw.persistence.backup;

import java.nio.file.Path;
import java.time.Instant;

public record BackupEntry(Path path, int number, Instant modifiedAt, long size) {}
