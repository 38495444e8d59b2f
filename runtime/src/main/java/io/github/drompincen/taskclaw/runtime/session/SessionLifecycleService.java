package io.github.drompincen.taskclaw.runtime.session;

import io.github.drompincen.taskclaw.persistence.audit.AuditLog;
import io.github.drompincen.taskclaw.persistence.document.FocusHistoryEntry;
import io.github.drompincen.taskclaw.persistence.document.ScopeDocument;
import io.github.drompincen.taskclaw.persistence.document.SessionConfigDocument;
import io.github.drompincen.taskclaw.persistence.document.SessionDocument;
import io.github.drompincen.taskclaw.persistence.document.SessionHistoryDocument;
import io.github.drompincen.taskclaw.persistence.document.SessionRegistryDocument;
import io.github.drompincen.taskclaw.persistence.document.TaskDocument;
import io.github.drompincen.taskclaw.persistence.document.TaskStoreDocument;
import io.github.drompincen.taskclaw.persistence.document.TaskStoreMeta;
import io.github.drompincen.taskclaw.persistence.file.FileLockHandle;
import io.github.drompincen.taskclaw.persistence.repository.SessionRegistryRepository;
import io.github.drompincen.taskclaw.persistence.repository.TaskStoreRepository;
import io.github.drompincen.taskclaw.protocol.api.ConflictType;
import io.github.drompincen.taskclaw.protocol.api.SessionDto;
import io.github.drompincen.taskclaw.protocol.api.SessionFilter;
import io.github.drompincen.taskclaw.protocol.api.SessionHistoryDto;
import io.github.drompincen.taskclaw.protocol.api.SessionStatus;
import io.github.drompincen.taskclaw.protocol.api.StartSessionRequest;
import io.github.drompincen.taskclaw.protocol.api.StartSessionResult;
import io.github.drompincen.taskclaw.protocol.api.TaskStatus;
import io.github.drompincen.taskclaw.protocol.error.DurableUpdate;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import io.github.drompincen.taskclaw.protocol.event.AuditAction;
import io.github.drompincen.taskclaw.runtime.conflict.ConflictDetector;
import io.github.drompincen.taskclaw.runtime.conflict.ConflictPolicy;
import io.github.drompincen.taskclaw.runtime.conflict.ConflictVerdict;
import io.github.drompincen.taskclaw.runtime.conflict.PolicyDecision;
import io.github.drompincen.taskclaw.runtime.retry.RetryExecutor;
import io.github.drompincen.taskclaw.runtime.scope.ResolvedScope;
import io.github.drompincen.taskclaw.runtime.scope.ScopeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Session state machine over the session registry and the task store.
 * <p>
 * Every mutation locks the registry, then the task store, loads both, checks its
 * preconditions, edits the documents in memory and writes the registry before the store.
 * A refused request writes nothing. If the store write fails after the registry was
 * written, the registry is put back to the bytes it was loaded from.
 */
@Service
public class SessionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);

    private final SessionRegistryRepository registryRepository;
    private final TaskStoreRepository taskStoreRepository;
    private final ScopeResolver scopeResolver;
    private final ConflictDetector conflictDetector;
    private final ConflictPolicy conflictPolicy;
    private final AutoFocusSelector autoFocusSelector;
    private final SessionIdGenerator idGenerator;
    private final AuditLog auditLog;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    public SessionLifecycleService(SessionRegistryRepository registryRepository,
                                   TaskStoreRepository taskStoreRepository,
                                   ScopeResolver scopeResolver,
                                   ConflictDetector conflictDetector,
                                   ConflictPolicy conflictPolicy,
                                   AutoFocusSelector autoFocusSelector,
                                   SessionIdGenerator idGenerator,
                                   AuditLog auditLog,
                                   RetryExecutor retryExecutor,
                                   Clock clock) {
        this.registryRepository = registryRepository;
        this.taskStoreRepository = taskStoreRepository;
        this.scopeResolver = scopeResolver;
        this.conflictDetector = conflictDetector;
        this.conflictPolicy = conflictPolicy;
        this.autoFocusSelector = autoFocusSelector;
        this.idGenerator = idGenerator;
        this.auditLog = auditLog;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    // --- transitions ---

    public StartSessionResult start(StartSessionRequest request) {
        return transact("session start", tx -> doStart(tx, request));
    }

    public SessionDto suspend(String sessionId, String note) {
        return transact("session suspend", tx -> doSuspend(tx, sessionId, note));
    }

    public SessionDto resume(String sessionId) {
        return transact("session resume", tx -> doResume(tx, sessionId));
    }

    public SessionHistoryDto end(String sessionId, String note) {
        return transact("session end", tx -> doEnd(tx, sessionId, note));
    }

    public SessionDto focus(String sessionId, String taskId) {
        return transact("session focus", tx -> doFocus(tx, sessionId, taskId));
    }

    public SessionDto note(String sessionId, String note, String nextAction) {
        return transact("session note", tx -> doNote(tx, sessionId, note, nextAction));
    }

    public SessionDto complete(String sessionId, String taskId) {
        return transact("session complete", tx -> doComplete(tx, sessionId, taskId));
    }

    // --- queries, lock-free ---

    public List<SessionDto> list(SessionFilter filter) {
        SessionFilter effective = filter != null ? filter : SessionFilter.ALL;
        return registryRepository.load().document().getSessions().stream()
                .filter(s -> effective.matches(s.getStatus()))
                .map(SessionMapper::toDto)
                .toList();
    }

    public SessionDto get(String sessionId) {
        return registryRepository.load().document().findSession(sessionId)
                .map(SessionMapper::toDto)
                .orElseThrow(() -> SessionException.notFound(sessionId));
    }

    public List<SessionHistoryDto> history() {
        return registryRepository.load().document().getSessionHistory().stream()
                .map(SessionMapper::toDto)
                .toList();
    }

    // --- operation bodies ---

    private StartSessionResult doStart(SessionTransaction tx, StartSessionRequest request) {
        SessionRegistryDocument registry = tx.registry();
        TaskStoreDocument store = tx.store();
        SessionConfigDocument config = registry.getConfig();

        int live = registry.getSessions().size();
        if (live >= config.getMaxConcurrentSessions()) {
            throw new SessionException(ErrorCode.MAX_SESSIONS,
                    "Maximum of " + config.getMaxConcurrentSessions() + " concurrent sessions reached");
        }
        if (request == null) {
            throw new TaskClawException(ErrorCode.SCOPE_INVALID, "Invalid scope: scope is required");
        }

        ResolvedScope scope = scopeResolver.resolve(store, request.scope());

        String focusId = blankToNull(request.focusTaskId());
        boolean autoFocused = false;
        if (focusId == null) {
            Optional<String> picked = autoFocusSelector.select(store, scope);
            if (picked.isEmpty()) {
                // nothing pending: a rival holding a task in scope is the real reason
                for (String id : scope.taskIds()) {
                    if (conflictDetector.findFocusHolder(registry.getSessions(), id, null).isPresent()) {
                        ConflictVerdict hard = conflictDetector.detect(registry.getSessions(), scope.taskIds(), id, null);
                        throw refusal(ErrorCode.TASK_CLAIMED, hard);
                    }
                }
                throw new SessionException(ErrorCode.FOCUS_REQUIRED,
                        "Focus required and none could be inferred: no pending task in scope");
            }
            focusId = picked.get();
            autoFocused = true;
        } else if (!scope.contains(focusId)) {
            throw SessionException.notInScope(null, focusId);
        }

        List<ConflictVerdict> verdicts = conflictDetector.detectAll(registry.getSessions(), scope.taskIds(), focusId, null);
        List<PolicyDecision> decisions = conflictPolicy.evaluateAll(verdicts, config);
        Optional<PolicyDecision> refused = decisions.stream().filter(d -> !d.allowed()).findFirst();
        if (refused.isPresent()) {
            throw refusal(refused.get().errorCode(), refused.get().verdict());
        }
        List<String> warnings = decisions.stream()
                .map(PolicyDecision::warning)
                .filter(Objects::nonNull)
                .toList();
        warnings.forEach(w -> log.warn("Starting session despite overlap: {}", w));

        String sessionId = idGenerator.next();
        if (registry.isKnownSessionId(sessionId)) {
            SessionException e = new SessionException(ErrorCode.SESSION_EXISTS, "Session id collision: " + sessionId);
            e.addContext("sessionId", sessionId);
            throw e;
        }

        Instant now = clock.instant();
        TaskDocument focusTask = requireTask(store, focusId);
        SessionDocument session = new SessionDocument();
        session.setId(sessionId);
        session.setStatus(SessionStatus.ACTIVE);
        session.setName(request.name());
        session.setAgentId(request.agentId());
        session.setScope(ScopeDocument.of(request.scope(), scope.taskIds()));
        session.getFocus().setCurrentTask(focusId);
        session.getFocus().setCurrentPhase(focusTask.getPhase());
        session.getFocus().record(focusId, now, FocusHistoryEntry.FOCUSED);
        session.setStartedAt(now);
        session.setLastActivity(now);

        Set<String> heldElsewhere = registry.getSessions().stream()
                .map(SessionDocument::currentTask)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        registry.getSessions().add(session);
        registry.getMeta().setTotalSessionsCreated(registry.getMeta().getTotalSessionsCreated() + 1);
        tx.registryChanged();

        for (String id : scope.taskIds()) {
            if (id.equals(focusId) || heldElsewhere.contains(id)) {
                continue;
            }
            store.findTask(id)
                    .filter(t -> t.hasStatus(TaskStatus.ACTIVE))
                    .ifPresent(t -> {
                        t.transitionTo(TaskStatus.PENDING, now);
                        log.debug("Demoted stale active task {} to pending", id);
                    });
        }
        focusTask.transitionTo(TaskStatus.ACTIVE, now);
        TaskStoreMeta meta = store.getMeta();
        meta.setMultiSessionEnabled(true);
        meta.setActiveSessionCount(meta.getActiveSessionCount() + 1);
        tx.storeChanged();

        ConflictVerdict tolerated = verdicts.isEmpty() ? ConflictVerdict.none() : verdicts.get(0);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scopeType", session.getScope().getType().value());
        details.put("rootTaskId", session.getScope().getRootTaskId());
        details.put("taskCount", scope.size());
        details.put("autoFocused", autoFocused);
        details.put("conflict", tolerated.type().value());
        tx.audit(sessionId, AuditAction.SESSION_STARTED, focusId, details);

        log.info("Started session {} on {} task(s), focus {}{}", sessionId, scope.size(), focusId,
                autoFocused ? " (auto)" : "");
        return new StartSessionResult(sessionId, focusId, autoFocused, scope.taskIds(),
                tolerated.type(), tolerated.type() == ConflictType.NONE ? null : tolerated.sessionId(), warnings);
    }

    private SessionDto doSuspend(SessionTransaction tx, String sessionId, String note) {
        SessionDocument session = requireSession(tx, sessionId);
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw SessionException.wrongState(sessionId, "active", session.getStatus().value());
        }
        Instant now = clock.instant();
        session.setStatus(SessionStatus.SUSPENDED);
        session.setSuspendedAt(now);
        session.setLastActivity(now);
        session.getStats().setSuspendCount(session.getStats().getSuspendCount() + 1);
        if (note != null) {
            session.getFocus().setSessionNote(note);
        }
        tx.registryChanged();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("note", note);
        tx.audit(sessionId, AuditAction.SESSION_SUSPENDED, session.currentTask(), details);
        log.info("Suspended session {}", sessionId);
        return SessionMapper.toDto(session);
    }

    private SessionDto doResume(SessionTransaction tx, String sessionId) {
        SessionDocument session = requireSession(tx, sessionId);
        if (session.getStatus() != SessionStatus.SUSPENDED) {
            throw SessionException.wrongState(sessionId, "suspended", session.getStatus().value());
        }
        String focusId = session.currentTask();
        conflictDetector.findFocusHolder(tx.sessions(), focusId, sessionId).ifPresent(holder -> {
            throw SessionException.claimed(focusId, holder.getId());
        });

        Instant now = clock.instant();
        session.setStatus(SessionStatus.ACTIVE);
        session.setSuspendedAt(null);
        session.setLastActivity(now);
        session.getStats().setResumeCount(session.getStats().getResumeCount() + 1);
        tx.registryChanged();

        if (focusId != null) {
            Optional<TaskDocument> focusTask = tx.store().findTask(focusId);
            if (focusTask.isEmpty()) {
                log.warn("Focus task {} of session {} no longer exists", focusId, sessionId);
            } else if (focusTask.get().hasStatus(TaskStatus.DONE)) {
                log.warn("Focus task {} of session {} was completed while suspended; leaving it done",
                        focusId, sessionId);
            } else if (focusTask.get().transitionTo(TaskStatus.ACTIVE, now)) {
                tx.storeChanged();
            }
        }

        tx.audit(sessionId, AuditAction.SESSION_RESUMED, focusId, Map.of());
        log.info("Resumed session {}, focus {}", sessionId, focusId);
        return SessionMapper.toDto(session);
    }

    private SessionHistoryDto doEnd(SessionTransaction tx, String sessionId, String note) {
        SessionDocument session = requireSession(tx, sessionId);
        SessionRegistryDocument registry = tx.registry();
        Instant now = clock.instant();

        registry.getSessions().remove(session);
        SessionHistoryDocument record = SessionHistoryDocument.endedFrom(session, now, note);
        registry.getSessionHistory().add(record);
        tx.registryChanged();

        String focusId = session.currentTask();
        boolean heldElsewhere = focusId != null && registry.getSessions().stream()
                .anyMatch(s -> focusId.equals(s.currentTask()));
        if (focusId != null && !heldElsewhere) {
            tx.store().findTask(focusId)
                    .filter(t -> t.hasStatus(TaskStatus.ACTIVE))
                    .ifPresent(t -> t.transitionTo(TaskStatus.PENDING, now));
        }
        // every start counted one session, whatever became of its focus
        TaskStoreMeta meta = tx.store().getMeta();
        meta.setActiveSessionCount(Math.max(0, meta.getActiveSessionCount() - 1));
        tx.storeChanged();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("note", note);
        details.put("previousStatus", session.getStatus().value());
        details.put("tasksCompleted", session.getStats().getTasksCompleted());
        tx.audit(sessionId, AuditAction.SESSION_ENDED, focusId, details);
        log.info("Ended session {}", sessionId);
        return SessionMapper.toDto(record);
    }

    private SessionDto doFocus(SessionTransaction tx, String sessionId, String taskId) {
        SessionDocument session = requireSession(tx, sessionId);
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw SessionException.wrongState(sessionId, "active", session.getStatus().value());
        }
        if (!session.getScope().covers(taskId)) {
            throw SessionException.notInScope(sessionId, taskId);
        }
        conflictDetector.findFocusHolder(tx.sessions(), taskId, sessionId).ifPresent(holder -> {
            throw SessionException.claimed(taskId, holder.getId());
        });
        String previous = session.currentTask();
        if (taskId.equals(previous)) {
            return SessionMapper.toDto(session);
        }
        TaskDocument next = requireTask(tx.store(), taskId);

        Instant now = clock.instant();
        if (previous != null && !isFocusOfOtherSession(tx, previous, sessionId)) {
            tx.store().findTask(previous)
                    .filter(t -> t.hasStatus(TaskStatus.ACTIVE))
                    .ifPresent(t -> t.transitionTo(TaskStatus.PENDING, now));
        }
        next.transitionTo(TaskStatus.ACTIVE, now);
        tx.storeChanged();

        session.getFocus().setPreviousTask(previous);
        session.getFocus().setCurrentTask(taskId);
        session.getFocus().setCurrentPhase(next.getPhase());
        session.getFocus().record(taskId, now, FocusHistoryEntry.FOCUSED);
        session.getStats().setFocusChanges(session.getStats().getFocusChanges() + 1);
        session.setLastActivity(now);
        tx.registryChanged();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", previous);
        details.put("to", taskId);
        tx.audit(sessionId, AuditAction.FOCUS_CHANGED, taskId, details);
        log.info("Session {} focus {} -> {}", sessionId, previous, taskId);
        return SessionMapper.toDto(session);
    }

    private SessionDto doNote(SessionTransaction tx, String sessionId, String note, String nextAction) {
        SessionDocument session = requireSession(tx, sessionId);
        if (note == null && nextAction == null) {
            throw new TaskClawException(ErrorCode.INVALID_ARGS, "A note or a next action is required");
        }
        if (note != null) {
            session.getFocus().setSessionNote(note);
        }
        if (nextAction != null) {
            session.getFocus().setNextAction(nextAction);
        }
        session.setLastActivity(clock.instant());
        tx.registryChanged();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("note", note);
        details.put("nextAction", nextAction);
        tx.audit(sessionId, AuditAction.NOTE_UPDATED, session.currentTask(), details);
        return SessionMapper.toDto(session);
    }

    private SessionDto doComplete(SessionTransaction tx, String sessionId, String taskId) {
        SessionDocument session = requireSession(tx, sessionId);
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw SessionException.wrongState(sessionId, "active", session.getStatus().value());
        }
        if (!session.getScope().covers(taskId)) {
            throw SessionException.notInScope(sessionId, taskId);
        }
        conflictDetector.findFocusHolder(tx.sessions(), taskId, sessionId).ifPresent(holder -> {
            throw SessionException.claimed(taskId, holder.getId());
        });
        TaskDocument task = requireTask(tx.store(), taskId);
        if (task.hasStatus(TaskStatus.DONE)) {
            log.info("Task {} is already done", taskId);
            return SessionMapper.toDto(session);
        }

        Instant now = clock.instant();
        task.transitionTo(TaskStatus.DONE, now);
        tx.storeChanged();

        session.getStats().setTasksCompleted(session.getStats().getTasksCompleted() + 1);
        if (taskId.equals(session.currentTask())) {
            session.getFocus().setPreviousTask(taskId);
            session.getFocus().setCurrentTask(null);
            session.getFocus().setCurrentPhase(null);
            session.getFocus().record(taskId, now, FocusHistoryEntry.COMPLETED);
        }
        session.setLastActivity(now);
        tx.registryChanged();

        tx.audit(sessionId, AuditAction.TASK_COMPLETED, taskId, Map.of("title", String.valueOf(task.getTitle())));
        log.info("Session {} completed {}", sessionId, taskId);
        return SessionMapper.toDto(session);
    }

    // --- transaction plumbing ---

    private <T> T transact(String operation, Function<SessionTransaction, T> body) {
        return retryExecutor.execute(operation, () -> {
            try (FileLockHandle registryLock = registryRepository.lock();
                 FileLockHandle storeLock = taskStoreRepository.lock()) {
                SessionTransaction tx = new SessionTransaction(registryRepository.load(), taskStoreRepository.load());
                T result = body.apply(tx);
                commit(tx);
                tx.events().forEach(e -> auditLog.emit(e.sessionId(), e.action(), e.taskId(), e.details()));
                return result;
            }
        });
    }

    private void commit(SessionTransaction tx) {
        if (tx.isRegistryChanged()) {
            try {
                registryRepository.save(tx.registrySnapshot());
            } catch (TaskClawException e) {
                throw e.inWrite(DurableUpdate.NONE);
            }
        }
        if (!tx.isStoreChanged()) {
            return;
        }
        try {
            taskStoreRepository.save(tx.storeSnapshot());
        } catch (TaskClawException e) {
            if (!tx.isRegistryChanged()) {
                throw e.inWrite(DurableUpdate.NONE);
            }
            throw compensate(tx, e);
        }
    }

    private TaskClawException compensate(SessionTransaction tx, TaskClawException cause) {
        try {
            registryRepository.writeRaw(tx.registrySnapshot().raw());
            log.warn("Task store write failed ({}); session registry rolled back", cause.getMessage());
            return cause.inWrite(DurableUpdate.NONE);
        } catch (TaskClawException rollbackFailure) {
            log.error("Task store write failed and the session registry could not be rolled back: {}",
                    rollbackFailure.getMessage(), rollbackFailure);
            cause.addSuppressed(rollbackFailure);
            return cause.inWrite(DurableUpdate.SESSION_REGISTRY);
        }
    }

    private static SessionException refusal(ErrorCode code, ConflictVerdict verdict) {
        SessionException e = new SessionException(code, "Cannot start session: " + verdict.message());
        e.addContext("conflictType", verdict.type().value());
        e.addContext("conflictingSessionId", verdict.sessionId());
        return e;
    }

    private static SessionDocument requireSession(SessionTransaction tx, String sessionId) {
        return tx.registry().findSession(sessionId).orElseThrow(() -> SessionException.notFound(sessionId));
    }

    private static TaskDocument requireTask(TaskStoreDocument store, String taskId) {
        return store.findTask(taskId).orElseThrow(() ->
                new TaskClawException(ErrorCode.TASK_NOT_FOUND, "Task not found: " + taskId).addContext("taskId", taskId));
    }

    private static boolean isFocusOfOtherSession(SessionTransaction tx, String taskId, String sessionId) {
        return tx.sessions().stream()
                .anyMatch(s -> !s.getId().equals(sessionId) && taskId.equals(s.currentTask()));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
