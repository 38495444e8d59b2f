package io.github.drompincen.taskclaw.runtime.config;

import io.github.drompincen.taskclaw.protocol.event.Actor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "taskclaw")
public class TaskClawProperties {

    private String dataDir = ".claude";
    private String project;
    private String todoFile = "todo.json";
    private String sessionsFile = "sessions.json";
    private String logFile = "todo-log.jsonl";
    private Duration lockTimeout = Duration.ofSeconds(30);
    private Actor actor = Actor.AGENT;
    private Backup backup = new Backup();
    private Retry retry = new Retry();
    private Hierarchy hierarchy = new Hierarchy();

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }

    public String getProject() { return project; }
    public void setProject(String project) { this.project = project; }

    public String getTodoFile() { return todoFile; }
    public void setTodoFile(String todoFile) { this.todoFile = todoFile; }

    public String getSessionsFile() { return sessionsFile; }
    public void setSessionsFile(String sessionsFile) { this.sessionsFile = sessionsFile; }

    public String getLogFile() { return logFile; }
    public void setLogFile(String logFile) { this.logFile = logFile; }

    public Duration getLockTimeout() { return lockTimeout; }
    public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }

    public Actor getActor() { return actor; }
    public void setActor(Actor actor) { this.actor = actor; }

    public Backup getBackup() { return backup; }
    public void setBackup(Backup backup) { this.backup = backup; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Hierarchy getHierarchy() { return hierarchy; }
    public void setHierarchy(Hierarchy hierarchy) { this.hierarchy = hierarchy; }

    public static class Backup {
        private int maxBackups = 10;
        private String directoryName = ".backups";

        public int getMaxBackups() { return maxBackups; }
        public void setMaxBackups(int maxBackups) { this.maxBackups = maxBackups; }

        public String getDirectoryName() { return directoryName; }
        public void setDirectoryName(String directoryName) { this.directoryName = directoryName; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(100);
        private double multiplier = 2.0;
        private Duration maxElapsed = Duration.ofSeconds(5);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public Duration getMaxElapsed() { return maxElapsed; }
        public void setMaxElapsed(Duration maxElapsed) { this.maxElapsed = maxElapsed; }
    }

    public static class Hierarchy {
        private int maxDepth = 3;
        private int maxSiblings = 20;
        private boolean countDoneInLimit = false;
        private int maxActiveSiblings = 8;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

        public int getMaxSiblings() { return maxSiblings; }
        public void setMaxSiblings(int maxSiblings) { this.maxSiblings = maxSiblings; }

        public boolean isCountDoneInLimit() { return countDoneInLimit; }
        public void setCountDoneInLimit(boolean countDoneInLimit) { this.countDoneInLimit = countDoneInLimit; }

        public int getMaxActiveSiblings() { return maxActiveSiblings; }
        public void setMaxActiveSiblings(int maxActiveSiblings) { this.maxActiveSiblings = maxActiveSiblings; }
    }
}
