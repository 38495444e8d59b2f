package io.github.drompincen.taskclaw.cli.command;

import io.github.drompincen.taskclaw.persistence.StoreLayout;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.UnaryOperator;

/**
 * Works out which session a command targets: an explicit id, then {@value #ENV_VAR},
 * then the {@code .current-session} file written by the last {@code session start}.
 */
@Component
public class CurrentSessionResolver {

    private static final Logger log = LoggerFactory.getLogger(CurrentSessionResolver.class);

    public static final String ENV_VAR = "TASKCLAW_SESSION";

    private final Path currentSessionFile;
    private final UnaryOperator<String> environment;

    @Autowired
    public CurrentSessionResolver(StoreLayout layout) {
        this(layout.currentSessionPath(), System::getenv);
    }

    CurrentSessionResolver(Path currentSessionFile, UnaryOperator<String> environment) {
        this.currentSessionFile = currentSessionFile;
        this.environment = environment;
    }

    public String resolve(String explicitId) {
        if (explicitId != null && !explicitId.isBlank()) {
            return explicitId;
        }
        String fromEnv = environment.apply(ENV_VAR);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        String fromFile = readCurrent();
        if (fromFile != null) {
            return fromFile;
        }
        throw new TaskClawException(ErrorCode.SESSION_NOT_FOUND,
                "No session given; pass an id, set " + ENV_VAR + " or start a session first");
    }

    public void remember(String sessionId) {
        try {
            Files.createDirectories(currentSessionFile.toAbsolutePath().getParent());
            Files.writeString(currentSessionFile, sessionId + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not record current session in {}: {}", currentSessionFile, e.getMessage());
        }
    }

    public void forget(String sessionId) {
        if (!sessionId.equals(readCurrent())) {
            return;
        }
        try {
            Files.deleteIfExists(currentSessionFile);
        } catch (IOException e) {
            log.warn("Could not clear {}: {}", currentSessionFile, e.getMessage());
        }
    }

    private String readCurrent() {
        if (!Files.exists(currentSessionFile)) {
            return null;
        }
        try {
            String content = Files.readString(currentSessionFile, StandardCharsets.UTF_8).trim();
            return content.isEmpty() ? null : content;
        } catch (IOException e) {
            log.warn("Could not read {}: {}", currentSessionFile, e.getMessage());
            return null;
        }
    }
}
