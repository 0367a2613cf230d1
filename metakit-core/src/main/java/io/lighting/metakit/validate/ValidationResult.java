package io.lighting.metakit.validate;

import java.util.List;
import java.util.Objects;

public record ValidationResult(List<ValidationError> errors) {
    private static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        Objects.requireNonNull(errors, "errors");
        errors = List.copyOf(errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasError(ErrorCode code) {
        for (ValidationError error : errors) {
            if (error.code() == code) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : errors.toString();
    }
}
