package io.github.drompincen.taskclaw.persistence.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.taskclaw.persistence.file.FileLockHandle;
import io.github.drompincen.taskclaw.persistence.file.FileLockService;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import io.github.drompincen.taskclaw.protocol.event.Actor;
import io.github.drompincen.taskclaw.protocol.event.AuditAction;
import io.github.drompincen.taskclaw.protocol.event.AuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends one JSON object per line to {@code todo-log.jsonl}, under the log file's own lock.
 */
public class JsonLinesAuditLog implements AuditLog {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesAuditLog.class);

    private final Path logFile;
    private final FileLockService lockService;
    private final Duration lockTimeout;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Actor actor;
    private final SecureRandom random = new SecureRandom();

    public JsonLinesAuditLog(Path logFile, FileLockService lockService, Duration lockTimeout,
                             ObjectMapper mapper, Clock clock, Actor actor) {
        this.logFile = logFile;
        this.lockService = lockService;
        this.lockTimeout = lockTimeout;
        this.mapper = mapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
        this.actor = actor;
    }

    @Override
    public void emit(String sessionId, AuditAction action, String taskId, Map<String, Object> details) {
        AuditEvent event = new AuditEvent(nextId(), clock.instant(), sessionId, action, actor, taskId,
                withoutNulls(details));
        try {
            byte[] line = (mapper.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
            try (FileLockHandle ignored = lockService.acquire(logFile, lockTimeout)) {
                Files.createDirectories(logFile.toAbsolutePath().getParent());
                Files.write(logFile, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException | TaskClawException e) {
            log.error("Failed to append audit event {} for session {}: {}", action, sessionId, e.getMessage());
        }
    }

    public List<AuditEvent> readAll() throws IOException {
        if (!Files.exists(logFile)) {
            return List.of();
        }
        List<AuditEvent> events = new ArrayList<>();
        for (String line : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(mapper.readValue(line, AuditEvent.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable audit line in {}: {}", logFile, e.getOriginalMessage());
            }
        }
        return events;
    }

    public Path logFile() { return logFile; }

    private String nextId() {
        byte[] bytes = new byte[6];
        random.nextBytes(bytes);
        return "log_" + HexFormat.of().formatHex(bytes);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> details) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (details != null) {
            details.forEach((k, v) -> {
                if (v != null) {
                    copy.put(k, v);
                }
            });
        }
        return copy;
    }
}
