package io.github.drompincen.taskclaw.persistence.document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class FocusDocument {

    private String currentTask;
    private String currentPhase;
    private String previousTask;
    private String sessionNote;
    private String nextAction;
    private List<FocusHistoryEntry> focusHistory = new ArrayList<>();

    public FocusDocument() {}

    public String getCurrentTask() { return currentTask; }
    public void setCurrentTask(String currentTask) { this.currentTask = currentTask; }

    public String getCurrentPhase() { return currentPhase; }
    public void setCurrentPhase(String currentPhase) { this.currentPhase = currentPhase; }

    public String getPreviousTask() { return previousTask; }
    public void setPreviousTask(String previousTask) { this.previousTask = previousTask; }

    public String getSessionNote() { return sessionNote; }
    public void setSessionNote(String sessionNote) { this.sessionNote = sessionNote; }

    public String getNextAction() { return nextAction; }
    public void setNextAction(String nextAction) { this.nextAction = nextAction; }

    public List<FocusHistoryEntry> getFocusHistory() { return focusHistory; }
    public void setFocusHistory(List<FocusHistoryEntry> focusHistory) {
        this.focusHistory = focusHistory != null ? new ArrayList<>(focusHistory) : new ArrayList<>();
    }

    public void record(String taskId, Instant at, String action) {
        focusHistory.add(new FocusHistoryEntry(taskId, at, action));
    }
}
