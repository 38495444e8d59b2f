package io.github.drompincen.taskclaw.persistence.document;

import java.time.Instant;

public class TaskStoreMeta {

    private String checksum = "";
    private Instant lastModified;
    private int activeSessionCount;
    private boolean multiSessionEnabled;
    private int lastTaskNumber;

    public TaskStoreMeta() {}

    public String getChecksum() { return checksum; }
    public void setChecksum(String checksum) { this.checksum = checksum; }

    public Instant getLastModified() { return lastModified; }
    public void setLastModified(Instant lastModified) { this.lastModified = lastModified; }

    public int getActiveSessionCount() { return activeSessionCount; }
    public void setActiveSessionCount(int activeSessionCount) { this.activeSessionCount = activeSessionCount; }

    public boolean isMultiSessionEnabled() { return multiSessionEnabled; }
    public void setMultiSessionEnabled(boolean multiSessionEnabled) { this.multiSessionEnabled = multiSessionEnabled; }

    public int getLastTaskNumber() { return lastTaskNumber; }
    public void setLastTaskNumber(int lastTaskNumber) { this.lastTaskNumber = lastTaskNumber; }
}
