package io.github.drompincen.taskclaw.runtime.hierarchy;

import io.github.drompincen.taskclaw.persistence.document.TaskDocument;
import io.github.drompincen.taskclaw.persistence.document.TaskStoreDocument;
import io.github.drompincen.taskclaw.protocol.api.TaskStatus;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Depth and sibling limits for the task tree. Root tasks are depth 0 and are not subject
 * to sibling limits.
 */
public class ConfigurableHierarchyPolicy implements HierarchyPolicy {

    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final int DEFAULT_MAX_SIBLINGS = 20;
    public static final int DEFAULT_MAX_ACTIVE_SIBLINGS = 8;

    private final int maxDepth;
    private final int maxSiblings;
    private final boolean countDoneInLimit;
    private final int maxActiveSiblings;

    public ConfigurableHierarchyPolicy(int maxDepth, int maxSiblings, boolean countDoneInLimit, int maxActiveSiblings) {
        this.maxDepth = maxDepth;
        this.maxSiblings = maxSiblings;
        this.countDoneInLimit = countDoneInLimit;
        this.maxActiveSiblings = maxActiveSiblings;
    }

    public ConfigurableHierarchyPolicy() {
        this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_SIBLINGS, false, DEFAULT_MAX_ACTIVE_SIBLINGS);
    }

    @Override
    public HierarchyCheck canAcceptChild(TaskStoreDocument store, String parentId) {
        if (parentId == null) {
            return HierarchyCheck.ok(0);
        }
        if (!store.containsTask(parentId)) {
            return HierarchyCheck.rejected(ErrorCode.PARENT_NOT_FOUND, "Parent task " + parentId + " does not exist");
        }

        int childDepth = depthOf(store, parentId) + 1;
        if (childDepth >= maxDepth) {
            return HierarchyCheck.rejected(ErrorCode.DEPTH_EXCEEDED,
                    "Task under " + parentId + " would be at depth " + childDepth + ", limit is " + (maxDepth - 1));
        }

        long siblings = store.getTasks().stream()
                .filter(t -> parentId.equals(t.getParentId()))
                .filter(t -> countDoneInLimit || !t.hasStatus(TaskStatus.DONE))
                .count();
        if (maxSiblings > 0 && siblings >= maxSiblings) {
            return HierarchyCheck.rejected(ErrorCode.SIBLING_LIMIT,
                    parentId + " already has " + siblings + " children (limit " + maxSiblings + ")");
        }

        long open = store.getTasks().stream()
                .filter(t -> parentId.equals(t.getParentId()))
                .filter(t -> !t.hasStatus(TaskStatus.DONE))
                .count();
        if (maxActiveSiblings > 0 && open >= maxActiveSiblings) {
            return HierarchyCheck.rejected(ErrorCode.SIBLING_LIMIT,
                    parentId + " already has " + open + " open children (limit " + maxActiveSiblings + ")");
        }
        return HierarchyCheck.ok(childDepth);
    }

    @Override
    public int depthOf(TaskStoreDocument store, String taskId) {
        int depth = 0;
        Set<String> visited = new HashSet<>();
        Optional<TaskDocument> current = store.findTask(taskId);
        while (current.isPresent() && current.get().getParentId() != null && visited.add(current.get().getId())) {
            depth++;
            current = store.findTask(current.get().getParentId());
        }
        return depth;
    }
}
