package io.github.drompincen.taskclaw.runtime.hierarchy;

import io.github.drompincen.taskclaw.persistence.document.TaskStoreDocument;

public interface HierarchyPolicy {

    /** Whether a new task may be created under {@code parentId} ({@code null} for a root task). */
    HierarchyCheck canAcceptChild(TaskStoreDocument store, String parentId);

    /** Number of ancestors of {@code taskId}. */
    int depthOf(TaskStoreDocument store, String taskId);
}
