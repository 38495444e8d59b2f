package io.github.drompincen.taskclaw.protocol.api;

/**
 * Request to open a new session. A {@code null} focusTaskId asks for auto-focus.
 */
public record StartSessionRequest(
        ScopeDeclaration scope,
        String focusTaskId,
        String name,
        String agentId
) {
    public static StartSessionRequest of(ScopeDeclaration scope, String focusTaskId) {
        return new StartSessionRequest(scope, focusTaskId, null, null);
    }
}
