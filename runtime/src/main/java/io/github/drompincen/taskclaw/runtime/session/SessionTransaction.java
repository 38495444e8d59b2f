package io.github.drompincen.taskclaw.runtime.session;

import io.github.drompincen.taskclaw.persistence.document.SessionDocument;
import io.github.drompincen.taskclaw.persistence.document.SessionRegistryDocument;
import io.github.drompincen.taskclaw.persistence.document.TaskStoreDocument;
import io.github.drompincen.taskclaw.persistence.repository.Snapshot;
import io.github.drompincen.taskclaw.protocol.event.AuditAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * In-memory working copy of both documents for one lifecycle operation, loaded under both
 * locks. Audit events are queued and only emitted once the writes succeed.
 */
final class SessionTransaction {

    record PendingEvent(String sessionId, AuditAction action, String taskId, Map<String, Object> details) {}

    private final Snapshot<SessionRegistryDocument> registry;
    private final Snapshot<TaskStoreDocument> store;
    private final List<PendingEvent> events = new ArrayList<>();
    private boolean registryChanged;
    private boolean storeChanged;

    SessionTransaction(Snapshot<SessionRegistryDocument> registry, Snapshot<TaskStoreDocument> store) {
        this.registry = registry;
        this.store = store;
    }

    Snapshot<SessionRegistryDocument> registrySnapshot() { return registry; }

    Snapshot<TaskStoreDocument> storeSnapshot() { return store; }

    SessionRegistryDocument registry() { return registry.document(); }

    TaskStoreDocument store() { return store.document(); }

    List<SessionDocument> sessions() { return registry.document().getSessions(); }

    void registryChanged() { registryChanged = true; }

    void storeChanged() { storeChanged = true; }

    boolean isRegistryChanged() { return registryChanged; }

    boolean isStoreChanged() { return storeChanged; }

    void audit(String sessionId, AuditAction action, String taskId, Map<String, Object> details) {
        events.add(new PendingEvent(sessionId, action, taskId, details));
    }

    List<PendingEvent> events() { return events; }
}
