package io.github.drompincen.taskclaw.runtime.conflict;

import io.github.drompincen.taskclaw.persistence.document.SessionDocument;
import io.github.drompincen.taskclaw.protocol.api.ConflictType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies how a candidate claim collides with the claims of active sessions.
 * <p>
 * A focus collision with any active session wins over every overlap verdict. Otherwise the
 * most severe overlap across all active sessions is reported. Suspended sessions hold no
 * claim here.
 */
@Component
public class ConflictDetector {

    public ConflictVerdict detect(List<SessionDocument> sessions, Collection<String> candidateIds,
                                  String candidateFocusId, String ignoreSessionId) {
        List<ConflictVerdict> verdicts = detectAll(sessions, candidateIds, candidateFocusId, ignoreSessionId);
        return verdicts.isEmpty() ? ConflictVerdict.none() : verdicts.get(0);
    }

    /** Every conflicting verdict, most severe first. Empty when the claim collides with nothing. */
    public List<ConflictVerdict> detectAll(List<SessionDocument> sessions, Collection<String> candidateIds,
                                           String candidateFocusId, String ignoreSessionId) {
        Optional<SessionDocument> holder = findFocusHolder(sessions, candidateFocusId, ignoreSessionId);
        if (holder.isPresent()) {
            return List.of(new ConflictVerdict(ConflictType.HARD, holder.get().getId(), List.of(candidateFocusId),
                    "task " + candidateFocusId + " is the focus of session " + holder.get().getId()));
        }

        Set<String> candidate = new LinkedHashSet<>(candidateIds);
        List<ConflictVerdict> verdicts = new ArrayList<>();
        for (SessionDocument other : sessions) {
            if (!isRival(other, ignoreSessionId)) {
                continue;
            }
            ConflictVerdict verdict = classify(candidate, other);
            if (verdict.isConflict()) {
                verdicts.add(verdict);
            }
        }
        verdicts.sort(Comparator.comparing(ConflictVerdict::type).reversed());
        return verdicts;
    }

    /** The active session, other than {@code ignoreSessionId}, whose current focus is {@code taskId}. */
    public Optional<SessionDocument> findFocusHolder(List<SessionDocument> sessions, String taskId,
                                                    String ignoreSessionId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return sessions.stream()
                .filter(s -> isRival(s, ignoreSessionId))
                .filter(s -> taskId.equals(s.currentTask()))
                .findFirst();
    }

    private ConflictVerdict classify(Set<String> candidate, SessionDocument other) {
        Set<String> theirs = new LinkedHashSet<>(other.getScope().getComputedTaskIds());
        Set<String> overlap = new LinkedHashSet<>(candidate);
        overlap.retainAll(theirs);
        if (overlap.isEmpty()) {
            return ConflictVerdict.none();
        }

        List<String> shared = List.copyOf(overlap);
        String id = other.getId();
        if (overlap.size() == candidate.size() && overlap.size() == theirs.size()) {
            return new ConflictVerdict(ConflictType.IDENTICAL, id, shared, "scope is identical to session " + id);
        }
        if (overlap.size() == candidate.size() || overlap.size() == theirs.size()) {
            return new ConflictVerdict(ConflictType.NESTED, id, shared,
                    "scope is nested with session " + id + " (" + shared.size() + " shared tasks)");
        }
        return new ConflictVerdict(ConflictType.PARTIAL, id, shared,
                "scope partially overlaps session " + id + " on " + shared);
    }

    private static boolean isRival(SessionDocument session, String ignoreSessionId) {
        return session.isActive() && !session.getId().equals(ignoreSessionId);
    }
}
