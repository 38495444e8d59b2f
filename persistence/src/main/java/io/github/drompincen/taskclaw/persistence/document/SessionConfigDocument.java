package io.github.drompincen.taskclaw.persistence.document;

/**
 * Multi-session policy stored in the {@code config} block of {@code sessions.json}.
 * {@code maxActiveTasksPerScope} and {@code scopeValidation} are kept for existing files
 * but nothing enforces them.
 */
public class SessionConfigDocument {

    private int maxConcurrentSessions = 5;
    private int maxActiveTasksPerScope = 1;
    private String scopeValidation = "strict";
    private boolean allowNestedScopes = true;
    private boolean allowScopeOverlap = false;

    public SessionConfigDocument() {}

    public int getMaxConcurrentSessions() { return maxConcurrentSessions; }
    public void setMaxConcurrentSessions(int maxConcurrentSessions) { this.maxConcurrentSessions = maxConcurrentSessions; }

    public int getMaxActiveTasksPerScope() { return maxActiveTasksPerScope; }
    public void setMaxActiveTasksPerScope(int maxActiveTasksPerScope) { this.maxActiveTasksPerScope = maxActiveTasksPerScope; }

    public String getScopeValidation() { return scopeValidation; }
    public void setScopeValidation(String scopeValidation) { this.scopeValidation = scopeValidation; }

    public boolean isAllowNestedScopes() { return allowNestedScopes; }
    public void setAllowNestedScopes(boolean allowNestedScopes) { this.allowNestedScopes = allowNestedScopes; }

    public boolean isAllowScopeOverlap() { return allowScopeOverlap; }
    public void setAllowScopeOverlap(boolean allowScopeOverlap) { this.allowScopeOverlap = allowScopeOverlap; }
}
