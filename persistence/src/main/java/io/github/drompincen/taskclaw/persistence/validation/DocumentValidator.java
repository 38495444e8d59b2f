package io.github.drompincen.taskclaw.persistence.validation;

/**
 * Checks a candidate document body before it replaces the file on disk.
 */
@FunctionalInterface
public interface DocumentValidator {

    ValidationResult validate(byte[] content);

    /** Runs {@code next} only when this validator accepts the content. */
    default DocumentValidator and(DocumentValidator next) {
        return content -> {
            ValidationResult first = validate(content);
            return first.valid() ? next.validate(content) : first;
        };
    }

    static DocumentValidator acceptAll() {
        return content -> ValidationResult.ok();
    }
}
