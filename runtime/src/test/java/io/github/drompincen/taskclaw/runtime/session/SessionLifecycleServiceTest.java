package io.github.drompincen.taskclaw.runtime.session;

import io.github.drompincen.taskclaw.persistence.audit.AuditLog;
import io.github.drompincen.taskclaw.persistence.document.SessionConfigDocument;
import io.github.drompincen.taskclaw.persistence.document.SessionRegistryDocument;
import io.github.drompincen.taskclaw.protocol.api.ConflictType;
import io.github.drompincen.taskclaw.protocol.api.ScopeDeclaration;
import io.github.drompincen.taskclaw.protocol.api.SessionDto;
import io.github.drompincen.taskclaw.protocol.api.SessionFilter;
import io.github.drompincen.taskclaw.protocol.api.SessionHistoryDto;
import io.github.drompincen.taskclaw.protocol.api.SessionStatus;
import io.github.drompincen.taskclaw.protocol.api.StartSessionRequest;
import io.github.drompincen.taskclaw.protocol.api.StartSessionResult;
import io.github.drompincen.taskclaw.protocol.api.TaskPriority;
import io.github.drompincen.taskclaw.protocol.api.TaskStatus;
import io.github.drompincen.taskclaw.protocol.error.DurableUpdate;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.FailureStage;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import io.github.drompincen.taskclaw.protocol.event.AuditAction;
import io.github.drompincen.taskclaw.runtime.StoreFixture;
import io.github.drompincen.taskclaw.runtime.conflict.ConflictDetector;
import io.github.drompincen.taskclaw.runtime.conflict.ConflictPolicy;
import io.github.drompincen.taskclaw.runtime.retry.RetryExecutor;
import io.github.drompincen.taskclaw.runtime.retry.RetryPolicy;
import io.github.drompincen.taskclaw.runtime.retry.Sleeper;
import io.github.drompincen.taskclaw.runtime.scope.ScopeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private AuditLog auditLog;

    private StoreFixture fixture;
    private SessionLifecycleService service;

    @BeforeEach
    void setUp() {
        fixture = new StoreFixture(tempDir);
        service = new SessionLifecycleService(fixture.registry(), fixture.taskStore(), new ScopeResolver(),
                new ConflictDetector(), new ConflictPolicy(), new AutoFocusSelector(),
                new SessionIdGenerator(StoreFixture.CLOCK), auditLog,
                new RetryExecutor(RetryPolicy.noRetry(), Sleeper.THREAD, StoreFixture.CLOCK), StoreFixture.CLOCK);
    }

    @Test
    void startOnSingleTaskAutoFocusesIt() {
        fixture.seed("T010", null);

        StartSessionResult result = service.start(StartSessionRequest.of(ScopeDeclaration.task("T010"), null));

        assertThat(result.sessionId()).matches("session_\\d{8}_\\d{6}_[0-9a-f]{6}");
        assertThat(result.focusTaskId()).isEqualTo("T010");
        assertThat(result.autoFocused()).isTrue();
        assertThat(result.conflict()).isEqualTo(ConflictType.NONE);
        assertThat(fixture.task("T010").getStatus()).isEqualTo(TaskStatus.ACTIVE);
        assertThat(fixture.taskStore().load().document().getMeta().getActiveSessionCount()).isEqualTo(1);
        assertThat(fixture.registry().load().document().getMeta().getTotalSessionsCreated()).isEqualTo(1);
        verify(auditLog).emit(eq(result.sessionId()), eq(AuditAction.SESSION_STARTED), eq("T010"), anyMap());
    }

    @Test
    void secondClaimOnSameTaskIsHardConflict() {
        fixture.seed("T020", null);
        String first = start(ScopeDeclaration.task("T020"), null);
        byte[] registryBefore = fixture.registry().readRaw();
        byte[] storeBefore = fixture.taskStore().readRaw();

        for (String focus : new String[]{null, "T020"}) {
            assertThatThrownBy(() -> service.start(StartSessionRequest.of(ScopeDeclaration.task("T020"), focus)))
                    .isInstanceOfSatisfying(TaskClawException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.TASK_CLAIMED);
                        assertThat(e.getContext()).containsEntry("conflictType", "hard")
                                .containsEntry("conflictingSessionId", first);
                    });
        }

        assertThat(fixture.registry().readRaw()).isEqualTo(registryBefore);
        assertThat(fixture.taskStore().readRaw()).isEqualTo(storeBefore);
    }

    @Test
    void nestedScopeIsToleratedWithWarning() {
        fixture.seed("T001", null);
        fixture.seed("T002", "T001");
        fixture.seed("T003", "T001");
        String a = start(ScopeDeclaration.taskGroup("T001"), "T001");

        StartSessionResult b = service.start(StartSessionRequest.of(ScopeDeclaration.task("T002"), null));

        assertThat(b.conflict()).isEqualTo(ConflictType.NESTED);
        assertThat(b.conflictingSessionId()).isEqualTo(a);
        assertThat(b.warnings()).hasSize(1);
        assertThat(service.list(SessionFilter.ACTIVE)).hasSize(2);
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.ACTIVE);
        assertThat(fixture.task("T002").getStatus()).isEqualTo(TaskStatus.ACTIVE);
    }

    @Test
    void partialOverlapIsRejectedWithoutTouchingEitherDocument() {
        fixture.seed("T001", null);
        fixture.seed("T002", null);
        fixture.seed("T003", null);
        start(ScopeDeclaration.custom(List.of("T001", "T002")), "T001");
        byte[] registryBefore = fixture.registry().readRaw();
        byte[] storeBefore = fixture.taskStore().readRaw();

        assertErrorCode(() -> service.start(
                StartSessionRequest.of(ScopeDeclaration.custom(List.of("T002", "T003")), "T003")),
                ErrorCode.SCOPE_CONFLICT);

        assertThat(fixture.registry().readRaw()).isEqualTo(registryBefore);
        assertThat(fixture.taskStore().readRaw()).isEqualTo(storeBefore);
    }

    @Test
    void subtreeOnLeafResolvesToTheLeafAndMissingRootFails() {
        fixture.seed("T005", null);

        StartSessionResult result = service.start(StartSessionRequest.of(ScopeDeclaration.subtree("T005", 10), null));
        assertThat(result.computedTaskIds()).containsExactly("T005");

        assertErrorCode(() -> service.start(StartSessionRequest.of(ScopeDeclaration.subtree("T999", 10), null)),
                ErrorCode.SCOPE_INVALID);
        assertThat(service.list(SessionFilter.ALL)).hasSize(1);
    }

    @Test
    void suspendThenEndRevertsFocusOnce() {
        fixture.seed("T001", null);
        String id = start(ScopeDeclaration.task("T001"), null);

        SessionDto suspended = service.suspend(id, "lunch");
        assertThat(suspended.status()).isEqualTo(SessionStatus.SUSPENDED);
        assertThat(suspended.sessionNote()).isEqualTo("lunch");
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.ACTIVE);

        SessionHistoryDto ended = service.end(id, "done for today");
        assertThat(ended.finalFocus()).isEqualTo("T001");
        assertThat(ended.endNote()).isEqualTo("done for today");
        assertThat(ended.stats().suspendCount()).isEqualTo(1);
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(fixture.taskStore().load().document().getMeta().getActiveSessionCount()).isZero();
        assertThat(service.history()).extracting(SessionHistoryDto::sessionId).containsExactly(id);

        assertErrorCode(() -> service.end(id, null), ErrorCode.SESSION_NOT_FOUND);
        assertThat(fixture.taskStore().load().document().getMeta().getActiveSessionCount()).isZero();
    }

    @Test
    void resumeRestoresFocusTask() {
        fixture.seed("T001", null);
        String id = start(ScopeDeclaration.task("T001"), null);
        service.suspend(id, null);
        fixture.editStore(store -> store.findTask("T001").orElseThrow().setStatus(TaskStatus.PENDING));

        SessionDto resumed = service.resume(id);

        assertThat(resumed.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(resumed.suspendedAt()).isNull();
        assertThat(resumed.stats().resumeCount()).isEqualTo(1);
        assertThat(resumed.currentTask()).isEqualTo("T001");
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.ACTIVE);
    }

    @Test
    void transitionsFromTheWrongStateAreRefused() {
        fixture.seed("T001", null);
        String id = start(ScopeDeclaration.task("T001"), null);

        assertErrorCode(() -> service.resume(id), ErrorCode.SESSION_WRONG_STATE);
        service.suspend(id, null);
        assertErrorCode(() -> service.suspend(id, null), ErrorCode.SESSION_WRONG_STATE);
        assertErrorCode(() -> service.focus(id, "T001"), ErrorCode.SESSION_WRONG_STATE);
        assertErrorCode(() -> service.resume("session_missing"), ErrorCode.SESSION_NOT_FOUND);
    }

    @Test
    void resumeIsBlockedWhileAnotherSessionHoldsTheFocus() {
        fixture.seed("T001", null);
        fixture.seed("T002", null);
        String a = start(ScopeDeclaration.custom(List.of("T001", "T002")), "T001");
        service.suspend(a, null);
        String b = start(ScopeDeclaration.task("T001"), "T001");

        assertThatThrownBy(() -> service.resume(a))
                .isInstanceOfSatisfying(TaskClawException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.TASK_CLAIMED);
                    assertThat(e.getContext()).containsEntry("conflictingSessionId", b);
                });
    }

    @Test
    void scopeIsNotRecomputedAfterStart() {
        fixture.seed("E1", null);
        fixture.seed("T1", "E1");
        String id = start(ScopeDeclaration.epic("E1"), "E1");
        fixture.seed("T2", "E1");

        assertThat(service.get(id).computedTaskIds()).containsExactly("E1", "T1");
        assertErrorCode(() -> service.focus(id, "T2"), ErrorCode.TASK_NOT_IN_SCOPE);
    }

    @Test
    void liveSessionCountIsCapped() {
        fixture.seed("T001", null);
        fixture.seed("T002", null);
        fixture.editConfig(config -> config.setMaxConcurrentSessions(1));
        String first = start(ScopeDeclaration.task("T001"), null);
        service.suspend(first, null);

        assertErrorCode(() -> service.start(StartSessionRequest.of(ScopeDeclaration.task("T002"), null)),
                ErrorCode.MAX_SESSIONS);
    }

    @Test
    void startNeedsAPendingOrExplicitFocusInScope() {
        fixture.seed("T001", null, TaskStatus.DONE, TaskPriority.HIGH);
        fixture.seed("T002", null);

        assertErrorCode(() -> service.start(StartSessionRequest.of(ScopeDeclaration.task("T001"), null)),
                ErrorCode.FOCUS_REQUIRED);
        assertErrorCode(() -> service.start(StartSessionRequest.of(ScopeDeclaration.task("T001"), "T002")),
                ErrorCode.TASK_NOT_IN_SCOPE);
        assertThat(service.list(SessionFilter.ALL)).isEmpty();
    }

    @Test
    void startDemotesStaleActiveTasksInScope() {
        fixture.seed("T001", null);
        fixture.seed("T002", null, TaskStatus.ACTIVE, TaskPriority.LOW);

        start(ScopeDeclaration.custom(List.of("T001", "T002")), "T001");

        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.ACTIVE);
        assertThat(fixture.task("T002").getStatus()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void focusMovesTheActiveMarker() {
        fixture.seed("T001", null);
        fixture.seed("T002", null);
        String id = start(ScopeDeclaration.custom(List.of("T001", "T002")), "T001");

        SessionDto moved = service.focus(id, "T002");

        assertThat(moved.currentTask()).isEqualTo("T002");
        assertThat(moved.previousTask()).isEqualTo("T001");
        assertThat(moved.stats().focusChanges()).isEqualTo(1);
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(fixture.task("T002").getStatus()).isEqualTo(TaskStatus.ACTIVE);
        verify(auditLog).emit(eq(id), eq(AuditAction.FOCUS_CHANGED), eq("T002"), anyMap());

        assertThat(service.focus(id, "T002").stats().focusChanges()).isEqualTo(1);
    }

    @Test
    void focusOnAnotherSessionsTaskIsRefused() {
        fixture.seed("T001", null);
        fixture.seed("T002", null);
        fixture.seed("T003", null);
        String a = start(ScopeDeclaration.custom(List.of("T001", "T002")), "T001");
        String b = start(ScopeDeclaration.custom(List.of("T001", "T002", "T003")), "T003");

        assertErrorCode(() -> service.focus(b, "T001"), ErrorCode.TASK_CLAIMED);
        assertErrorCode(() -> service.complete(b, "T001"), ErrorCode.TASK_CLAIMED);
        assertThat(service.get(a).currentTask()).isEqualTo("T001");
    }

    @Test
    void completingTheFocusClearsIt() {
        fixture.seed("T001", null);
        String id = start(ScopeDeclaration.task("T001"), null);

        SessionDto done = service.complete(id, "T001");

        assertThat(done.currentTask()).isNull();
        assertThat(done.previousTask()).isEqualTo("T001");
        assertThat(done.stats().tasksCompleted()).isEqualTo(1);
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.DONE);
        verify(auditLog).emit(eq(id), eq(AuditAction.TASK_COMPLETED), eq("T001"), anyMap());

        assertThat(service.complete(id, "T001").stats().tasksCompleted()).isEqualTo(1);
    }

    @Test
    void endingAfterCompletingTheFocusReleasesTheSessionCount() {
        fixture.seed("T001", null);
        String id = start(ScopeDeclaration.task("T001"), null);
        service.complete(id, "T001");

        service.end(id, null);

        assertThat(service.list(SessionFilter.ALL)).isEmpty();
        assertThat(fixture.taskStore().load().document().getMeta().getActiveSessionCount()).isZero();
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.DONE);
    }

    @Test
    void sharedFocusStaysActiveUntilTheLastHolderEnds() {
        fixture.seed("T001", null);
        fixture.seed("T002", null);
        String a = start(ScopeDeclaration.custom(List.of("T001", "T002")), "T001");
        service.suspend(a, null);
        String b = start(ScopeDeclaration.task("T001"), "T001");
        assertThat(fixture.taskStore().load().document().getMeta().getActiveSessionCount()).isEqualTo(2);

        service.end(b, null);
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.ACTIVE);
        assertThat(fixture.taskStore().load().document().getMeta().getActiveSessionCount()).isEqualTo(1);

        service.end(a, null);
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(fixture.taskStore().load().document().getMeta().getActiveSessionCount()).isZero();
    }

    @Test
    void resumeLeavesAFocusCompletedElsewhereDone() {
        fixture.seed("T001", null);
        fixture.seed("T002", null);
        String a = start(ScopeDeclaration.custom(List.of("T001", "T002")), "T001");
        service.suspend(a, null);
        String b = start(ScopeDeclaration.task("T001"), "T001");
        service.complete(b, "T001");
        service.end(b, null);

        SessionDto resumed = service.resume(a);

        assertThat(resumed.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.DONE);
    }

    @Test
    void informationalConfigIsCarriedButNotEnforced() {
        fixture.seed("T001", null);
        fixture.seed("T002", null);
        fixture.editConfig(config -> {
            config.setMaxActiveTasksPerScope(0);
            config.setScopeValidation("lenient");
        });

        start(ScopeDeclaration.task("T001"), null);
        start(ScopeDeclaration.task("T002"), null);

        SessionConfigDocument config = fixture.registry().load().document().getConfig();
        assertThat(config.getMaxActiveTasksPerScope()).isZero();
        assertThat(config.getScopeValidation()).isEqualTo("lenient");
        assertErrorCode(() -> start(ScopeDeclaration.task("T404"), null), ErrorCode.SCOPE_INVALID);
    }

    @Test
    void notesNeedContentButNotAnActiveSession() {
        fixture.seed("T001", null);
        String id = start(ScopeDeclaration.task("T001"), null);
        service.suspend(id, null);

        assertErrorCode(() -> service.note(id, null, null), ErrorCode.INVALID_ARGS);
        SessionDto noted = service.note(id, "halfway", "write tests");

        assertThat(noted.sessionNote()).isEqualTo("halfway");
        assertThat(fixture.registry().load().document().findSession(id).orElseThrow()
                .getFocus().getNextAction()).isEqualTo("write tests");
    }

    @Test
    void failedStoreWriteRollsBackTheRegistry() {
        fixture.seed("T001", null);
        byte[] registryBefore = fixture.registry().readRaw();
        fixture.writer().failTaskStore(false);

        assertThatThrownBy(() -> service.start(StartSessionRequest.of(ScopeDeclaration.task("T001"), null)))
                .isInstanceOfSatisfying(TaskClawException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.WRITE_FAILED);
                    assertThat(e.getStage()).isEqualTo(FailureStage.IN_WRITE);
                    assertThat(e.getDurableUpdate()).isEqualTo(DurableUpdate.NONE);
                });

        assertThat(fixture.registry().readRaw()).isEqualTo(registryBefore);
        assertThat(fixture.task("T001").getStatus()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void failedRollbackReportsTheRegistryAsDurablyUpdated() {
        fixture.seed("T001", null);
        fixture.writer().failTaskStore(true);

        assertThatThrownBy(() -> service.start(StartSessionRequest.of(ScopeDeclaration.task("T001"), null)))
                .isInstanceOfSatisfying(TaskClawException.class, e -> {
                    assertThat(e.getDurableUpdate()).isEqualTo(DurableUpdate.SESSION_REGISTRY);
                    assertThat(e.getSuppressed()).hasSize(1);
                });

        SessionRegistryDocument registry = fixture.registry().load().document();
        assertThat(registry.getSessions()).hasSize(1);
    }

    @Test
    void concurrentStartsNeverShareAFocus() throws Exception {
        fixture.seed("T001", null);
        int workers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<StartSessionResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                Callable<StartSessionResult> attempt = () -> {
                    go.await();
                    return service.start(StartSessionRequest.of(ScopeDeclaration.task("T001"), null));
                };
                futures.add(pool.submit(attempt));
            }
            go.countDown();

            int started = 0;
            int claimed = 0;
            for (Future<StartSessionResult> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    started++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOfSatisfying(TaskClawException.class,
                            t -> assertThat(t.getErrorCode()).isEqualTo(ErrorCode.TASK_CLAIMED));
                    claimed++;
                }
            }
            assertThat(started).isEqualTo(1);
            assertThat(claimed).isEqualTo(workers - 1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(fixture.registry().load().document().getSessions()).hasSize(1);
    }

    private String start(ScopeDeclaration scope, String focus) {
        return service.start(StartSessionRequest.of(scope, focus)).sessionId();
    }

    private static void assertErrorCode(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call).isInstanceOfSatisfying(TaskClawException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(expected));
    }
}
