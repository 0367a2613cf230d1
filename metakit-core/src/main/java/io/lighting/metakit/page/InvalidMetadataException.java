package io.lighting.metakit.page;

import io.lighting.metakit.validate.ValidationResult;
import java.util.Objects;

/**
 * Thrown when pagination is requested with metadata that fails validation. Carries
 * every violation, not just the first.
 */
public class InvalidMetadataException extends IllegalArgumentException {
    private final ValidationResult result;

    public InvalidMetadataException(ValidationResult result) {
        super("invalid metadata: " + Objects.requireNonNull(result, "result").errors());
        this.result = result;
    }

    public ValidationResult result() {
        return result;
    }
}
