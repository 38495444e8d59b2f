package io.github.drompincen.taskclaw.persistence.document;

import io.github.drompincen.taskclaw.protocol.api.ScopeDeclaration;
import io.github.drompincen.taskclaw.protocol.api.ScopeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A session's scope as persisted: the declaration plus the ids it resolved to when the
 * session started. The resolved ids are never recomputed.
 */
public class ScopeDocument {

    private ScopeType type;
    private String rootTaskId;
    private String phaseFilter;
    private Integer maxDepth;
    private List<String> excludeTaskIds = new ArrayList<>();
    private List<String> taskIds = new ArrayList<>();
    private List<String> computedTaskIds = List.of();

    public ScopeDocument() {}

    public static ScopeDocument of(ScopeDeclaration declaration, List<String> computedTaskIds) {
        ScopeDocument doc = new ScopeDocument();
        doc.setType(declaration.type());
        doc.setRootTaskId(declaration.rootTaskId());
        doc.setPhaseFilter(declaration.phaseFilter());
        doc.setMaxDepth(declaration.maxDepth());
        doc.setExcludeTaskIds(declaration.excludeTaskIds());
        doc.setTaskIds(declaration.taskIds());
        doc.setComputedTaskIds(computedTaskIds);
        return doc;
    }

    public ScopeDeclaration toDeclaration() {
        return new ScopeDeclaration(type, rootTaskId, phaseFilter, maxDepth, excludeTaskIds, taskIds);
    }

    public ScopeType getType() { return type; }
    public void setType(ScopeType type) { this.type = type; }

    public String getRootTaskId() { return rootTaskId; }
    public void setRootTaskId(String rootTaskId) { this.rootTaskId = rootTaskId; }

    public String getPhaseFilter() { return phaseFilter; }
    public void setPhaseFilter(String phaseFilter) { this.phaseFilter = phaseFilter; }

    public Integer getMaxDepth() { return maxDepth; }
    public void setMaxDepth(Integer maxDepth) { this.maxDepth = maxDepth; }

    public List<String> getExcludeTaskIds() { return excludeTaskIds; }
    public void setExcludeTaskIds(List<String> excludeTaskIds) {
        this.excludeTaskIds = excludeTaskIds != null ? new ArrayList<>(excludeTaskIds) : new ArrayList<>();
    }

    public List<String> getTaskIds() { return taskIds; }
    public void setTaskIds(List<String> taskIds) {
        this.taskIds = taskIds != null ? new ArrayList<>(taskIds) : new ArrayList<>();
    }

    public List<String> getComputedTaskIds() { return computedTaskIds; }
    public void setComputedTaskIds(List<String> computedTaskIds) {
        this.computedTaskIds = computedTaskIds != null
                ? Collections.unmodifiableList(new ArrayList<>(computedTaskIds))
                : List.of();
    }

    public boolean covers(String taskId) {
        return taskId != null && computedTaskIds.contains(taskId);
    }
}
