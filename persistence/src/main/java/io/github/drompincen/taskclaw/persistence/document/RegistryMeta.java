package io.github.drompincen.taskclaw.persistence.document;

import java.time.Instant;

public class RegistryMeta {

    private String checksum = "";
    private Instant lastModified;
    private long totalSessionsCreated;

    public RegistryMeta() {}

    public String getChecksum() { return checksum; }
    public void setChecksum(String checksum) { this.checksum = checksum; }

    public Instant getLastModified() { return lastModified; }
    public void setLastModified(Instant lastModified) { this.lastModified = lastModified; }

    public long getTotalSessionsCreated() { return totalSessionsCreated; }
    public void setTotalSessionsCreated(long totalSessionsCreated) { this.totalSessionsCreated = totalSessionsCreated; }
}
