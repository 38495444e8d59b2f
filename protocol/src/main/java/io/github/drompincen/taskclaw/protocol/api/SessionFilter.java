package io.github.drompincen.taskclaw.protocol.api;

public enum SessionFilter {
    ACTIVE, SUSPENDED, ALL;

    public boolean matches(SessionStatus status) {
        return switch (this) {
            case ACTIVE -> status == SessionStatus.ACTIVE;
            case SUSPENDED -> status == SessionStatus.SUSPENDED;
            case ALL -> true;
        };
    }
}
