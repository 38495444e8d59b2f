package io.github.drompincen.taskclaw.persistence.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks for {@code sessions.json}.
 */
public class SessionRegistryValidator implements DocumentValidator {

    private final ObjectMapper mapper;

    public SessionRegistryValidator(ObjectMapper mapper) {
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
        JsonNode sessions = root.path("sessions");
        JsonNode history = root.path("sessionHistory");
        if (!sessions.isArray()) {
            return ValidationResult.invalid("'sessions' must be an array");
        }
        if (!history.isMissingNode() && !history.isArray()) {
            return ValidationResult.invalid("'sessionHistory' must be an array");
        }

        List<String> reasons = new ArrayList<>();
        Set<String> live = new HashSet<>();
        for (JsonNode session : sessions) {
            String id = session.path("id").asText("");
            if (id.isBlank()) {
                reasons.add("session without id");
                continue;
            }
            if (!live.add(id)) {
                reasons.add("duplicate session id " + id);
            }
            JsonNode computed = session.path("scope").path("computedTaskIds");
            if (!computed.isArray() || computed.isEmpty()) {
                reasons.add("session " + id + " claims no tasks");
            }
        }
        for (JsonNode ended : history) {
            String id = ended.path("id").asText("");
            if (live.contains(id)) {
                reasons.add("session " + id + " is both live and ended");
            }
        }
        return ValidationResult.of(reasons);
    }
}
