package io.lighting.metakit.cursor;

/**
 * What a paginator does with a cursor token that cannot be decoded.
 */
public enum InvalidCursorPolicy {
    /**
     * Run the page query without the cursor condition.
     */
    IGNORE,
    /**
     * Throw {@link InvalidCursorException} before any page query runs.
     */
    FAIL
}
