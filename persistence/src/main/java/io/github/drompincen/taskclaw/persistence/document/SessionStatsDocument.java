package io.github.drompincen.taskclaw.persistence.document;

import io.github.drompincen.taskclaw.protocol.api.SessionStats;

public class SessionStatsDocument {

    private int tasksCompleted;
    private int focusChanges;
    private int suspendCount;
    private int resumeCount;

    public SessionStatsDocument() {}

    public int getTasksCompleted() { return tasksCompleted; }
    public void setTasksCompleted(int tasksCompleted) { this.tasksCompleted = tasksCompleted; }

    public int getFocusChanges() { return focusChanges; }
    public void setFocusChanges(int focusChanges) { this.focusChanges = focusChanges; }

    public int getSuspendCount() { return suspendCount; }
    public void setSuspendCount(int suspendCount) { this.suspendCount = suspendCount; }

    public int getResumeCount() { return resumeCount; }
    public void setResumeCount(int resumeCount) { this.resumeCount = resumeCount; }

    public SessionStats toStats() {
        return new SessionStats(tasksCompleted, focusChanges, suspendCount, resumeCount);
    }

    public SessionStatsDocument copy() {
        SessionStatsDocument copy = new SessionStatsDocument();
        copy.tasksCompleted = tasksCompleted;
        copy.focusChanges = focusChanges;
        copy.suspendCount = suspendCount;
        copy.resumeCount = resumeCount;
        return copy;
    }
}
