package io.github.drompincen.taskclaw.runtime.scope;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Task ids a scope resolved to, in resolution order.
 */
public record ResolvedScope(List<String> taskIds) {

    public ResolvedScope {
        taskIds = List.copyOf(taskIds);
    }

    public boolean contains(String taskId) {
        return taskId != null && taskIds.contains(taskId);
    }

    public Set<String> asSet() {
        return new LinkedHashSet<>(taskIds);
    }

    public int size() {
        return taskIds.size();
    }
}
