package io.github.drompincen.taskclaw.runtime.scope;

import io.github.drompincen.taskclaw.persistence.document.TaskDocument;
import io.github.drompincen.taskclaw.persistence.document.TaskStoreDocument;
import io.github.drompincen.taskclaw.protocol.api.ScopeDeclaration;
import io.github.drompincen.taskclaw.protocol.api.ScopeType;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a scope declaration into the concrete set of task ids it covers.
 * Deterministic for an unchanged task store; touches nothing on disk.
 */
@Component
public class ScopeResolver {

    public ResolvedScope resolve(TaskStoreDocument store, ScopeDeclaration declaration) {
        if (declaration == null || declaration.type() == null) {
            throw invalid("scope type is required");
        }
        if (declaration.maxDepth() != null && declaration.maxDepth() < 0) {
            throw invalid("maxDepth must not be negative: " + declaration.maxDepth());
        }

        Set<String> ids = declaration.type() == ScopeType.CUSTOM
                ? resolveCustom(store, declaration)
                : resolveRooted(store, declaration);
        ids.removeAll(declaration.excludeTaskIds());

        if (ids.isEmpty()) {
            throw invalid("scope " + declaration.type().value() + " resolved to no tasks");
        }
        return new ResolvedScope(new ArrayList<>(ids));
    }

    private Set<String> resolveCustom(TaskStoreDocument store, ScopeDeclaration declaration) {
        if (declaration.taskIds().isEmpty()) {
            throw invalid("custom scope requires task ids");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String id : declaration.taskIds()) {
            if (!store.containsTask(id)) {
                throw invalid("task " + id + " does not exist").addContext("taskId", id);
            }
            ids.add(id);
        }
        return ids;
    }

    private Set<String> resolveRooted(TaskStoreDocument store, ScopeDeclaration declaration) {
        String root = declaration.rootTaskId();
        if (root == null || root.isBlank()) {
            throw invalid("scope " + declaration.type().value() + " requires a root task");
        }
        if (!store.containsTask(root)) {
            throw invalid("root task " + root + " does not exist").addContext("taskId", root);
        }

        return switch (declaration.type()) {
            case TASK -> new LinkedHashSet<>(List.of(root));
            case TASK_GROUP -> descendants(childIndex(store), root, 1);
            case SUBTREE, EPIC -> descendants(childIndex(store), root, declaration.effectiveMaxDepth());
            case EPIC_PHASE -> {
                String phase = declaration.phaseFilter();
                if (phase == null || phase.isBlank()) {
                    throw invalid("epicPhase scope requires a phase filter");
                }
                Map<String, String> phases = new HashMap<>();
                store.getTasks().forEach(t -> phases.put(t.getId(), t.getPhase()));
                Set<String> ids = descendants(childIndex(store), root, declaration.effectiveMaxDepth());
                ids.removeIf(id -> !Objects.equals(phase, phases.get(id)));
                yield ids;
            }
            case CUSTOM -> throw new IllegalStateException("custom scopes are not rooted");
        };
    }

    /** Breadth-first walk from {@code root}, at most {@code maxDepth} levels below it. */
    private Set<String> descendants(Map<String, List<String>> children, String root, int maxDepth) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> level = new ArrayDeque<>();
        visited.add(root);
        level.add(root);
        for (int depth = 0; depth < maxDepth && !level.isEmpty(); depth++) {
            Deque<String> next = new ArrayDeque<>();
            for (String parent : level) {
                for (String child : children.getOrDefault(parent, List.of())) {
                    if (visited.add(child)) {
                        next.add(child);
                    }
                }
            }
            level = next;
        }
        return visited;
    }

    private Map<String, List<String>> childIndex(TaskStoreDocument store) {
        Map<String, List<String>> index = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (TaskDocument task : store.getTasks()) {
            if (task.getParentId() != null && seen.add(task.getId())) {
                index.computeIfAbsent(task.getParentId(), k -> new ArrayList<>()).add(task.getId());
            }
        }
        return index;
    }

    private static TaskClawException invalid(String message) {
        return new TaskClawException(ErrorCode.SCOPE_INVALID, "Invalid scope: " + message);
    }
}
