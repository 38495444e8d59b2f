package io.github.drompincen.taskclaw.persistence.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskclaw.protocol.api.TaskStatus;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks for {@code todo.json}: a tasks array, unique ids, known statuses and
 * no task parented to itself. Expects syntactically valid JSON.
 */
public class TaskStoreValidator implements DocumentValidator {

    private final ObjectMapper mapper;

    public TaskStoreValidator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ValidationResult validate(byte[] content) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (IOException e) {
            return ValidationResult.invalid("invalid JSON: " + e.getMessage());
        }
        JsonNode tasks = root.path("tasks");
        if (!tasks.isArray()) {
            return ValidationResult.invalid("'tasks' must be an array");
        }

        List<String> reasons = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode task : tasks) {
            String id = task.path("id").asText("");
            if (id.isBlank()) {
                reasons.add("task without id");
                continue;
            }
            if (!seen.add(id)) {
                reasons.add("duplicate task id " + id);
            }
            String status = task.path("status").asText("");
            try {
                TaskStatus.fromValue(status);
            } catch (IllegalArgumentException e) {
                reasons.add("task " + id + " has unknown status '" + status + "'");
            }
            if (id.equals(task.path("parentId").asText(null))) {
                reasons.add("task " + id + " is its own parent");
            }
        }
        return ValidationResult.of(reasons);
    }
}
