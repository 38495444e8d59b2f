package io.github.drompincen.taskclaw.persistence;

import java.nio.file.Path;

/**
 * Where the store's files live inside the data directory.
 */
public record StoreLayout(Path dataDir, String todoFile, String sessionsFile, String logFile) {

    public static final String CURRENT_SESSION_FILE = ".current-session";

    public static StoreLayout defaults(Path dataDir) {
        return new StoreLayout(dataDir, "todo.json", "sessions.json", "todo-log.jsonl");
    }

    public Path todoPath() { return dataDir.resolve(todoFile); }

    public Path sessionsPath() { return dataDir.resolve(sessionsFile); }

    public Path logPath() { return dataDir.resolve(logFile); }

    public Path currentSessionPath() { return dataDir.resolve(CURRENT_SESSION_FILE); }
}
