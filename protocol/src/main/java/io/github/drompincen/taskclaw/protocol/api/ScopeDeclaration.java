package io.github.drompincen.taskclaw.protocol.api;

import java.util.List;

/**
 * Declarative description of the tasks a session may claim.
 *
 * @param type           how the scope is resolved
 * @param rootTaskId     anchor task, ignored for {@link ScopeType#CUSTOM}
 * @param phaseFilter    phase to keep, only for {@link ScopeType#EPIC_PHASE}
 * @param maxDepth       descendant recursion bound, {@code null} means {@link #DEFAULT_MAX_DEPTH}
 * @param excludeTaskIds ids subtracted after resolution
 * @param taskIds        explicit ids for {@link ScopeType#CUSTOM}
 */
public record ScopeDeclaration(
        ScopeType type,
        String rootTaskId,
        String phaseFilter,
        Integer maxDepth,
        List<String> excludeTaskIds,
        List<String> taskIds
) {
    public static final int DEFAULT_MAX_DEPTH = 10;

    public ScopeDeclaration {
        excludeTaskIds = excludeTaskIds != null ? List.copyOf(excludeTaskIds) : List.of();
        taskIds = taskIds != null ? List.copyOf(taskIds) : List.of();
    }

    public static ScopeDeclaration task(String rootTaskId) {
        return new ScopeDeclaration(ScopeType.TASK, rootTaskId, null, null, null, null);
    }

    public static ScopeDeclaration taskGroup(String rootTaskId) {
        return new ScopeDeclaration(ScopeType.TASK_GROUP, rootTaskId, null, null, null, null);
    }

    public static ScopeDeclaration subtree(String rootTaskId, int maxDepth) {
        return new ScopeDeclaration(ScopeType.SUBTREE, rootTaskId, null, maxDepth, null, null);
    }

    public static ScopeDeclaration epic(String rootTaskId) {
        return new ScopeDeclaration(ScopeType.EPIC, rootTaskId, null, null, null, null);
    }

    public static ScopeDeclaration epicPhase(String rootTaskId, String phase) {
        return new ScopeDeclaration(ScopeType.EPIC_PHASE, rootTaskId, phase, null, null, null);
    }

    public static ScopeDeclaration custom(List<String> taskIds) {
        return new ScopeDeclaration(ScopeType.CUSTOM, null, null, null, null, taskIds);
    }

    public ScopeDeclaration excluding(List<String> ids) {
        return new ScopeDeclaration(type, rootTaskId, phaseFilter, maxDepth, ids, taskIds);
    }

    public int effectiveMaxDepth() {
        return maxDepth != null ? maxDepth : DEFAULT_MAX_DEPTH;
    }
}
