package io.github.drompincen.taskclaw.runtime.task;

import io.github.drompincen.taskclaw.persistence.audit.AuditLog;
import io.github.drompincen.taskclaw.persistence.document.TaskDocument;
import io.github.drompincen.taskclaw.persistence.document.TaskStoreDocument;
import io.github.drompincen.taskclaw.persistence.file.FileLockHandle;
import io.github.drompincen.taskclaw.persistence.repository.Snapshot;
import io.github.drompincen.taskclaw.persistence.repository.TaskStoreRepository;
import io.github.drompincen.taskclaw.protocol.api.CreateTaskRequest;
import io.github.drompincen.taskclaw.protocol.api.TaskDto;
import io.github.drompincen.taskclaw.protocol.api.TaskPriority;
import io.github.drompincen.taskclaw.protocol.api.TaskStatus;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import io.github.drompincen.taskclaw.protocol.event.AuditAction;
import io.github.drompincen.taskclaw.runtime.hierarchy.HierarchyCheck;
import io.github.drompincen.taskclaw.runtime.hierarchy.HierarchyPolicy;
import io.github.drompincen.taskclaw.runtime.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);
    private static final Pattern TASK_ID = Pattern.compile("T(\\d{1,9})");

    private final TaskStoreRepository taskStoreRepository;
    private final HierarchyPolicy hierarchyPolicy;
    private final AuditLog auditLog;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    public TaskService(TaskStoreRepository taskStoreRepository, HierarchyPolicy hierarchyPolicy,
                       AuditLog auditLog, RetryExecutor retryExecutor, Clock clock) {
        this.taskStoreRepository = taskStoreRepository;
        this.hierarchyPolicy = hierarchyPolicy;
        this.auditLog = auditLog;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    public TaskDto create(CreateTaskRequest request) {
        if (request == null || request.title() == null || request.title().isBlank()) {
            throw new TaskClawException(ErrorCode.INVALID_ARGS, "Task title is required");
        }
        return retryExecutor.execute("task create", () -> doCreate(request));
    }

    public List<TaskDto> list() {
        return taskStoreRepository.load().document().getTasks().stream()
                .map(TaskService::toDto)
                .toList();
    }

    public Optional<TaskDto> find(String taskId) {
        return taskStoreRepository.load().document().findTask(taskId).map(TaskService::toDto);
    }

    private TaskDto doCreate(CreateTaskRequest request) {
        TaskDocument task;
        try (FileLockHandle ignored = taskStoreRepository.lock()) {
            Snapshot<TaskStoreDocument> snapshot = taskStoreRepository.load();
            TaskStoreDocument store = snapshot.document();

            HierarchyCheck check = hierarchyPolicy.canAcceptChild(store, request.parentId());
            if (!check.allowed()) {
                throw new TaskClawException(check.errorCode(), check.message())
                        .addContext("parentId", String.valueOf(request.parentId()));
            }

            int number = nextTaskNumber(store);
            Instant now = clock.instant();
            task = new TaskDocument(String.format("T%03d", number), request.title().trim(), TaskStatus.PENDING);
            task.setType(check.depth() >= 2 ? "subtask" : "task");
            task.setParentId(request.parentId());
            task.setDescription(request.description());
            task.setPriority(request.priority() != null ? request.priority() : TaskPriority.MEDIUM);
            task.setPhase(request.phase());
            task.setCreatedAt(now);
            task.setUpdatedAt(now);
            store.getTasks().add(task);
            store.getMeta().setLastTaskNumber(number);

            taskStoreRepository.save(snapshot);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("title", task.getTitle());
        details.put("parentId", task.getParentId());
        auditLog.emit(null, AuditAction.TASK_CREATED, task.getId(), details);
        log.info("Created task {} '{}'", task.getId(), task.getTitle());
        return toDto(task);
    }

    /** Ids are never reused, even when the highest-numbered task was removed by hand. */
    private static int nextTaskNumber(TaskStoreDocument store) {
        int highest = store.getMeta().getLastTaskNumber();
        for (TaskDocument t : store.getTasks()) {
            Matcher m = TASK_ID.matcher(t.getId() != null ? t.getId() : "");
            if (m.matches()) {
                highest = Math.max(highest, Integer.parseInt(m.group(1)));
            }
        }
        return highest + 1;
    }

    static TaskDto toDto(TaskDocument t) {
        return new TaskDto(t.getId(), t.getTitle(), t.getParentId(), t.getStatus(), t.getPriority(),
                t.getPhase(), t.getCreatedAt(), t.getUpdatedAt());
    }
}
