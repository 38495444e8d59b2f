package io.github.drompincen.taskclaw.persistence.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskclaw.persistence.audit.AuditLog;
import io.github.drompincen.taskclaw.persistence.backup.BackupEntry;
import io.github.drompincen.taskclaw.persistence.backup.NumberedBackupService;
import io.github.drompincen.taskclaw.persistence.json.TaskClawJson;
import io.github.drompincen.taskclaw.persistence.validation.DocumentValidator;
import io.github.drompincen.taskclaw.persistence.validation.JsonSyntaxValidator;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtomicFileWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = TaskClawJson.newObjectMapper();
    private NumberedBackupService backupService;
    private AtomicFileWriter writer;
    private DocumentValidator validator;
    private Path target;

    @BeforeEach
    void setUp() {
        backupService = new NumberedBackupService(".backups", 3, AuditLog.NOOP);
        writer = new AtomicFileWriter(backupService);
        validator = new JsonSyntaxValidator(mapper);
        target = tempDir.resolve("todo.json");
    }

    @Test
    void writesNewFileWithoutBackup() throws IOException {
        WriteReceipt receipt = writer.write(target, bytes("{\"tasks\":[]}"), validator);

        assertThat(read(target)).isEqualTo("{\"tasks\":[]}");
        assertThat(receipt.backup()).isNull();
        assertThat(tempFiles()).isEmpty();
    }

    @Test
    void replacingKeepsPreviousContentAsBackup() throws IOException {
        writer.write(target, bytes("{\"v\":1}"), validator);

        WriteReceipt receipt = writer.write(target, bytes("{\"v\":2}"), validator);

        assertThat(read(target)).isEqualTo("{\"v\":2}");
        assertThat(receipt.backup()).isEqualTo(tempDir.resolve(".backups").resolve("todo.json.1"));
        assertThat(read(receipt.backup())).isEqualTo("{\"v\":1}");
    }

    @Test
    void emptyContentIsRejectedAndOriginalKept() throws IOException {
        writer.write(target, bytes("{\"v\":1}"), validator);

        assertThatThrownBy(() -> writer.write(target, new byte[0], DocumentValidator.acceptAll()))
                .isInstanceOfSatisfying(DocumentWriteException.class, dwe -> {
                    assertThat(dwe.getPhase()).isEqualTo(WritePhase.VALIDATE);
                    assertThat(dwe.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_FAILED);
                    assertThat(dwe.isRetryable()).isFalse();
                });
        assertThat(read(target)).isEqualTo("{\"v\":1}");
        assertThat(tempFiles()).isEmpty();
    }

    @Test
    void invalidContentIsRejectedBeforeAnyBackup() throws IOException {
        writer.write(target, bytes("{\"v\":1}"), validator);

        assertThatThrownBy(() -> writer.write(target, bytes("{\"v\":"), validator))
                .isInstanceOf(DocumentWriteException.class)
                .hasMessageContaining("invalid JSON");

        assertThat(read(target)).isEqualTo("{\"v\":1}");
        assertThat(backupService.list(target)).isEmpty();
        assertThat(tempFiles()).isEmpty();
    }

    @Test
    void failedReplaceRestoresOriginalFromBackup() throws IOException {
        writer.write(target, bytes("{\"v\":1}"), validator);
        AtomicFileWriter failing = new AtomicFileWriter(backupService) {
            @Override
            protected void moveIntoPlace(Path staged, Path destination) throws IOException {
                Files.writeString(destination, "{\"v\":", StandardCharsets.UTF_8);
                throw new IOException("device full");
            }
        };

        assertThatThrownBy(() -> failing.write(target, bytes("{\"v\":2}"), validator))
                .isInstanceOfSatisfying(DocumentWriteException.class,
                        e -> assertThat(e.getPhase()).isEqualTo(WritePhase.REPLACE));

        assertThat(read(target)).isEqualTo("{\"v\":1}");
        assertThat(read(backupService.latest(target).orElseThrow().path())).isEqualTo("{\"v\":1}");
        assertThat(tempFiles()).isEmpty();
    }

    @Test
    void backupsRotateBeyondRetention() throws IOException {
        for (int i = 1; i <= 6; i++) {
            writer.write(target, bytes("{\"v\":" + i + "}"), validator);
        }

        List<BackupEntry> backups = backupService.list(target);
        assertThat(backups).extracting(BackupEntry::number).containsExactly(3, 4, 5);
        assertThat(read(backups.get(2).path())).isEqualTo("{\"v\":5}");
    }

    private List<Path> tempFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".tmp")).toList();
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String read(Path p) throws IOException {
        return Files.readString(p, StandardCharsets.UTF_8);
    }
}
