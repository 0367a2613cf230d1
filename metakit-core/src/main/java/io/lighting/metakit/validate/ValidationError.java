package io.lighting.metakit.validate;

import java.util.Objects;

/**
 * One violated constraint.
 *
 * @param field   request field name as it appears on the wire, for example {@code page_size}
 * @param message human-readable explanation
 * @param code    stable machine-readable code
 */
public record ValidationError(String field, String message, ErrorCode code) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(code, "code");
    }

    @Override
    public String toString() {
        return field + ": " + message + " (" + code + ")";
    }
}
