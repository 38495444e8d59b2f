package io.github.drompincen.taskclaw.persistence.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Accepts only non-empty content that parses as a JSON object.
 */
public class JsonSyntaxValidator implements DocumentValidator {

    private final ObjectMapper mapper;

    public JsonSyntaxValidator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ValidationResult validate(byte[] content) {
        if (content == null || content.length == 0) {
            return ValidationResult.invalid("document is empty");
        }
        try {
            JsonNode root = mapper.readTree(content);
            if (root == null || root.isMissingNode()) {
                return ValidationResult.invalid("document is empty");
            }
            if (!root.isObject()) {
                return ValidationResult.invalid("top-level JSON value must be an object");
            }
            return ValidationResult.ok();
        } catch (JsonProcessingException e) {
            return ValidationResult.invalid("invalid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            return ValidationResult.invalid("unreadable JSON: " + e.getMessage());
        }
    }
}
