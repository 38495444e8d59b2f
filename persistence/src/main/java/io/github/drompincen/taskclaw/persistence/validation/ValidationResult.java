package io.github.drompincen.taskclaw.persistence.validation;

import java.util.ArrayList;
import java.util.List;

public record ValidationResult(boolean valid, List<String> reasons) {

    public ValidationResult {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, List.of(reason));
    }

    public static ValidationResult of(List<String> reasons) {
        return new ValidationResult(reasons.isEmpty(), reasons);
    }

    public ValidationResult merge(ValidationResult other) {
        List<String> all = new ArrayList<>(reasons);
        all.addAll(other.reasons());
        return new ValidationResult(valid && other.valid(), all);
    }
}
