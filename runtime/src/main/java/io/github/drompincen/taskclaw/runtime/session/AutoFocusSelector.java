package io.github.drompincen.taskclaw.runtime.session;

import io.github.drompincen.taskclaw.persistence.document.TaskDocument;
import io.github.drompincen.taskclaw.persistence.document.TaskStoreDocument;
import io.github.drompincen.taskclaw.protocol.api.TaskPriority;
import io.github.drompincen.taskclaw.protocol.api.TaskStatus;
import io.github.drompincen.taskclaw.runtime.scope.ResolvedScope;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks a focus task when a session starts without one: the highest-priority pending task
 * in scope, oldest first, then scope order.
 */
@Component
public class AutoFocusSelector {

    private static final Comparator<TaskDocument> BY_PRIORITY =
            Comparator.comparingInt((TaskDocument t) -> rank(t.getPriority())).reversed();

    private static final Comparator<TaskDocument> BY_CREATED =
            Comparator.comparing(TaskDocument::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    public Optional<String> select(TaskStoreDocument store, ResolvedScope scope) {
        return scope.taskIds().stream()
                .map(store::findTask)
                .flatMap(Optional::stream)
                .filter(t -> t.hasStatus(TaskStatus.PENDING))
                .sorted(BY_PRIORITY.thenComparing(BY_CREATED))
                .map(TaskDocument::getId)
                .filter(Objects::nonNull)
                .findFirst();
    }

    private static int rank(TaskPriority priority) {
        return priority != null ? priority.rank() : TaskPriority.LOW.rank();
    }
}
