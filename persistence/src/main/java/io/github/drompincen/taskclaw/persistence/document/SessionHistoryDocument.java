package io.github.drompincen.taskclaw.persistence.document;

import io.github.drompincen.taskclaw.protocol.api.ScopeType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable record of an ended session, appended to {@code sessionHistory}.
 */
public class SessionHistoryDocument {

    private String id;
    private String name;
    private String agentId;
    private ScopeType scopeType;
    private String rootTaskId;
    private List<String> computedTaskIds = new ArrayList<>();
    private String finalFocus;
    private Instant startedAt;
    private Instant endedAt;
    private SessionStatsDocument stats = new SessionStatsDocument();
    private String endNote;
    private boolean resumable;

    public SessionHistoryDocument() {}

    public static SessionHistoryDocument endedFrom(SessionDocument session, Instant endedAt, String note) {
        SessionHistoryDocument h = new SessionHistoryDocument();
        h.setId(session.getId());
        h.setName(session.getName());
        h.setAgentId(session.getAgentId());
        h.setScopeType(session.getScope().getType());
        h.setRootTaskId(session.getScope().getRootTaskId());
        h.setComputedTaskIds(session.getScope().getComputedTaskIds());
        h.setFinalFocus(session.currentTask());
        h.setStartedAt(session.getStartedAt());
        h.setEndedAt(endedAt);
        h.setStats(session.getStats().copy());
        h.setEndNote(note);
        h.setResumable(true);
        return h;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getAgentId() { return agentId; }
    public void setAgentId(String agentId) { this.agentId = agentId; }

    public ScopeType getScopeType() { return scopeType; }
    public void setScopeType(ScopeType scopeType) { this.scopeType = scopeType; }

    public String getRootTaskId() { return rootTaskId; }
    public void setRootTaskId(String rootTaskId) { this.rootTaskId = rootTaskId; }

    public List<String> getComputedTaskIds() { return computedTaskIds; }
    public void setComputedTaskIds(List<String> computedTaskIds) {
        this.computedTaskIds = computedTaskIds != null ? new ArrayList<>(computedTaskIds) : new ArrayList<>();
    }

    public String getFinalFocus() { return finalFocus; }
    public void setFinalFocus(String finalFocus) { this.finalFocus = finalFocus; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }

    public SessionStatsDocument getStats() { return stats; }
    public void setStats(SessionStatsDocument stats) { this.stats = stats != null ? stats : new SessionStatsDocument(); }

    public String getEndNote() { return endNote; }
    public void setEndNote(String endNote) { this.endNote = endNote; }

    public boolean isResumable() { return resumable; }
    public void setResumable(boolean resumable) { this.resumable = resumable; }
}
