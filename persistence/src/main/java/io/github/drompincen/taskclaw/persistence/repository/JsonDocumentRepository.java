package io.github.drompincen.taskclaw.persistence.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskclaw.persistence.document.ChecksummedDocument;
import io.github.drompincen.taskclaw.persistence.file.AtomicFileWriter;
import io.github.drompincen.taskclaw.persistence.file.FileLockHandle;
import io.github.drompincen.taskclaw.persistence.file.FileLockService;
import io.github.drompincen.taskclaw.persistence.file.WriteReceipt;
import io.github.drompincen.taskclaw.persistence.json.TaskClawJson;
import io.github.drompincen.taskclaw.persistence.validation.DocumentValidator;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Loads and saves one JSON document file.
 * <p>
 * Saving recomputes {@code _meta.checksum} and {@code _meta.lastModified}, then refuses to
 * write if the file on disk no longer matches the snapshot it was loaded from. Callers hold
 * {@link #lock()} across load and save.
 */
public abstract class JsonDocumentRepository<T extends ChecksummedDocument> {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentRepository.class);

    protected final Path file;
    protected final ObjectMapper mapper;
    private final Class<T> type;
    private final AtomicFileWriter writer;
    private final FileLockService lockService;
    private final Duration lockTimeout;
    private final DocumentValidator validator;
    private final Clock clock;

    protected JsonDocumentRepository(Path file, Class<T> type, ObjectMapper mapper, AtomicFileWriter writer,
                                     FileLockService lockService, Duration lockTimeout,
                                     DocumentValidator validator, Clock clock) {
        this.file = file;
        this.type = type;
        this.mapper = mapper;
        this.writer = writer;
        this.lockService = lockService;
        this.lockTimeout = lockTimeout;
        this.validator = validator;
        this.clock = clock;
    }

    protected abstract T newDocument(String project);

    public Path file() { return file; }

    public boolean exists() { return Files.exists(file); }

    public FileLockHandle lock() {
        return lockService.acquire(file, lockTimeout);
    }

    public Snapshot<T> load() {
        byte[] raw = readRaw();
        T document;
        try {
            document = mapper.readValue(raw, type);
        } catch (IOException e) {
            throw new DocumentParseException(file, e);
        }
        if (document == null) {
            throw new DocumentParseException(file, new IllegalStateException("document is null"));
        }
        String stored = document.storedChecksum();
        if (stored != null && !stored.isEmpty()) {
            String computed = TaskClawJson.checksum(mapper, document.checksumPayload());
            if (!stored.equals(computed)) {
                log.warn("Stored checksum of {} is {} but content hashes to {}; file was edited outside taskclaw",
                        file.getFileName(), stored, computed);
            }
        }
        return new Snapshot<>(document, raw, TaskClawJson.sha256(raw));
    }

    public WriteReceipt save(Snapshot<T> snapshot) {
        return save(snapshot.document(), snapshot.fingerprint());
    }

    /**
     * @param expectedFingerprint fingerprint of the bytes the document was loaded from,
     *                            {@code null} when the file is expected not to exist
     */
    public WriteReceipt save(T document, String expectedFingerprint) {
        String current = currentFingerprint();
        if (!Objects.equals(current, expectedFingerprint)) {
            throw new ChecksumMismatchException(file, expectedFingerprint, current);
        }
        document.stamp(TaskClawJson.checksum(mapper, document.checksumPayload()), clock.instant());
        return writer.write(file, serialize(document), validator);
    }

    /** Writes bytes verbatim through the atomic writer, used to put back a previous state. */
    public WriteReceipt writeRaw(byte[] content) {
        return writer.write(file, content, validator);
    }

    public byte[] readRaw() {
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new TaskClawException(ErrorCode.FILE_NOT_FOUND, file.getFileName() + " does not exist; run init first", e)
                    .addContext("file", file.toString());
        } catch (IOException e) {
            throw new DocumentParseException(file, e);
        }
    }

    /** Creates the file with default content unless it exists. Returns whether it was created. */
    public boolean initializeIfAbsent(String project) {
        try (FileLockHandle ignored = lock()) {
            if (exists()) {
                return false;
            }
            T document = newDocument(project);
            save(document, null);
            log.info("Initialized {}", file);
            return true;
        }
    }

    protected byte[] serialize(T document) {
        try {
            return mapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new TaskClawException(ErrorCode.WRITE_FAILED, "Cannot serialize " + file.getFileName(), e);
        }
    }

    private String currentFingerprint() {
        if (!Files.exists(file)) {
            return null;
        }
        return TaskClawJson.sha256(readRaw());
    }
}
