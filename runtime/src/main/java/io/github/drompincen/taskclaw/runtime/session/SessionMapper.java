package io.github.drompincen.taskclaw.runtime.session;

import io.github.drompincen.taskclaw.persistence.document.SessionDocument;
import io.github.drompincen.taskclaw.persistence.document.SessionHistoryDocument;
import io.github.drompincen.taskclaw.protocol.api.SessionDto;
import io.github.drompincen.taskclaw.protocol.api.SessionHistoryDto;

final class SessionMapper {

    private SessionMapper() {}

    static SessionDto toDto(SessionDocument s) {
        return new SessionDto(
                s.getId(),
                s.getName(),
                s.getAgentId(),
                s.getStatus(),
                s.getScope().getType(),
                s.getScope().getRootTaskId(),
                s.getScope().getComputedTaskIds(),
                s.getFocus().getCurrentTask(),
                s.getFocus().getPreviousTask(),
                s.getFocus().getSessionNote(),
                s.getStats().toStats(),
                s.getStartedAt(),
                s.getLastActivity(),
                s.getSuspendedAt());
    }

    static SessionHistoryDto toDto(SessionHistoryDocument h) {
        return new SessionHistoryDto(
                h.getId(),
                h.getName(),
                h.getAgentId(),
                h.getScopeType(),
                h.getRootTaskId(),
                h.getFinalFocus(),
                h.getStartedAt(),
                h.getEndedAt(),
                h.getStats().toStats(),
                h.getEndNote());
    }
}
