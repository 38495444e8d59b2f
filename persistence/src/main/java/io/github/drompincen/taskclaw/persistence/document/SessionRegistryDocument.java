package io.github.drompincen.taskclaw.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Root of {@code sessions.json}: policy, live sessions and the append-only history.
 */
@JsonPropertyOrder({"version", "project", "_meta", "config", "sessions", "sessionHistory"})
public class SessionRegistryDocument implements ChecksummedDocument {

    public static final String CURRENT_VERSION = "1.0.0";

    private String version = CURRENT_VERSION;
    private String project;
    @JsonProperty("_meta")
    private RegistryMeta meta = new RegistryMeta();
    private SessionConfigDocument config = new SessionConfigDocument();
    private List<SessionDocument> sessions = new ArrayList<>();
    private List<SessionHistoryDocument> sessionHistory = new ArrayList<>();

    public SessionRegistryDocument() {}

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public String getProject() { return project; }
    public void setProject(String project) { this.project = project; }

    public RegistryMeta getMeta() { return meta; }
    public void setMeta(RegistryMeta meta) { this.meta = meta != null ? meta : new RegistryMeta(); }

    public SessionConfigDocument getConfig() { return config; }
    public void setConfig(SessionConfigDocument config) { this.config = config != null ? config : new SessionConfigDocument(); }

    public List<SessionDocument> getSessions() { return sessions; }
    public void setSessions(List<SessionDocument> sessions) {
        this.sessions = sessions != null ? new ArrayList<>(sessions) : new ArrayList<>();
    }

    public List<SessionHistoryDocument> getSessionHistory() { return sessionHistory; }
    public void setSessionHistory(List<SessionHistoryDocument> sessionHistory) {
        this.sessionHistory = sessionHistory != null ? new ArrayList<>(sessionHistory) : new ArrayList<>();
    }

    public Optional<SessionDocument> findSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return sessions.stream().filter(s -> sessionId.equals(s.getId())).findFirst();
    }

    /** Whether the id was ever used, live or ended. */
    public boolean isKnownSessionId(String sessionId) {
        return findSession(sessionId).isPresent()
                || sessionHistory.stream().anyMatch(h -> sessionId.equals(h.getId()));
    }

    @Override
    @JsonIgnore
    public Object checksumPayload() { return sessions; }

    @Override
    @JsonIgnore
    public String storedChecksum() { return meta.getChecksum(); }

    @Override
    public void stamp(String checksum, Instant now) {
        meta.setChecksum(checksum);
        meta.setLastModified(now);
    }
}
