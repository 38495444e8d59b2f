package io.github.drompincen.taskclaw.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.drompincen.taskclaw.protocol.api.SessionStatus;

import java.time.Instant;

/**
 * A live session in {@code sessions.json}.
 */
@JsonPropertyOrder({"id", "status", "name", "agentId", "scope", "focus", "startedAt", "lastActivity",
        "suspendedAt", "stats"})
public class SessionDocument {

    private String id;
    private SessionStatus status;
    private String name;
    private String agentId;
    private ScopeDocument scope = new ScopeDocument();
    private FocusDocument focus = new FocusDocument();
    private Instant startedAt;
    private Instant lastActivity;
    private Instant suspendedAt;
    private SessionStatsDocument stats = new SessionStatsDocument();

    public SessionDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }

    public ScopeDocument getScope() { return scope; }
    public void setScope(ScopeDocument scope) { this.scope = scope != null ? scope : new ScopeDocument(); }

    public FocusDocument getFocus() { return focus; }
    public void setFocus(FocusDocument focus) { this.focus = focus != null ? focus : new FocusDocument(); }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getLastActivity() { return lastActivity; }
    public void setLastActivity(Instant lastActivity) { this.lastActivity = lastActivity; }

    public Instant getSuspendedAt() { return suspendedAt; }
    public void setSuspendedAt(Instant suspendedAt) { this.suspendedAt = suspendedAt; }

    public SessionStatsDocument getStats() { return stats; }
    public void setStats(SessionStatsDocument stats) { this.stats = stats != null ? stats : new SessionStatsDocument(); }

    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public String currentTask() {
        return focus.getCurrentTask();
    }
}
