package io.github.drompincen.taskclaw.runtime.hierarchy;

import io.github.drompincen.taskclaw.persistence.document.TaskDocument;
import io.github.drompincen.taskclaw.persistence.document.TaskStoreDocument;
import io.github.drompincen.taskclaw.protocol.api.TaskStatus;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurableHierarchyPolicyTest {

    private TaskStoreDocument store;

    @BeforeEach
    void setUp() {
        store = new TaskStoreDocument();
        add("E1", null, TaskStatus.PENDING);
        add("T1", "E1", TaskStatus.PENDING);
        add("S1", "T1", TaskStatus.PENDING);
    }

    @Test
    void rootTasksAreAlwaysAccepted() {
        ConfigurableHierarchyPolicy policy = new ConfigurableHierarchyPolicy(3, 1, false, 1);

        assertThat(policy.canAcceptChild(store, null)).isEqualTo(HierarchyCheck.ok(0));
    }

    @Test
    void depthIsBounded() {
        ConfigurableHierarchyPolicy policy = new ConfigurableHierarchyPolicy();

        assertThat(policy.depthOf(store, "S1")).isEqualTo(2);
        assertThat(policy.canAcceptChild(store, "T1").depth()).isEqualTo(2);
        assertThat(policy.canAcceptChild(store, "S1").errorCode()).isEqualTo(ErrorCode.DEPTH_EXCEEDED);
    }

    @Test
    void unknownParentIsRejected() {
        assertThat(new ConfigurableHierarchyPolicy().canAcceptChild(store, "NOPE").errorCode())
                .isEqualTo(ErrorCode.PARENT_NOT_FOUND);
    }

    @Test
    void siblingLimitIgnoresDoneChildrenByDefault() {
        add("T2", "E1", TaskStatus.DONE);
        ConfigurableHierarchyPolicy lenient = new ConfigurableHierarchyPolicy(3, 2, false, 0);
        ConfigurableHierarchyPolicy countingDone = new ConfigurableHierarchyPolicy(3, 2, true, 0);

        assertThat(lenient.canAcceptChild(store, "E1").allowed()).isTrue();
        assertThat(countingDone.canAcceptChild(store, "E1").errorCode()).isEqualTo(ErrorCode.SIBLING_LIMIT);
    }

    @Test
    void openChildrenAreCappedSeparately() {
        add("T2", "E1", TaskStatus.ACTIVE);
        ConfigurableHierarchyPolicy policy = new ConfigurableHierarchyPolicy(3, 0, false, 2);

        HierarchyCheck check = policy.canAcceptChild(store, "E1");

        assertThat(check.allowed()).isFalse();
        assertThat(check.errorCode()).isEqualTo(ErrorCode.SIBLING_LIMIT);
        assertThat(check.message()).contains("open children");
    }

    @Test
    void cyclicParentsDoNotLoop() {
        TaskStoreDocument cyclic = new TaskStoreDocument();
        TaskDocument a = new TaskDocument("A", "a", TaskStatus.PENDING);
        a.setParentId("B");
        TaskDocument b = new TaskDocument("B", "b", TaskStatus.PENDING);
        b.setParentId("A");
        cyclic.getTasks().add(a);
        cyclic.getTasks().add(b);

        assertThat(new ConfigurableHierarchyPolicy().depthOf(cyclic, "A")).isEqualTo(2);
    }

    private void add(String id, String parentId, TaskStatus status) {
        TaskDocument task = new TaskDocument(id, id, status);
        task.setParentId(parentId);
        store.getTasks().add(task);
    }
}
