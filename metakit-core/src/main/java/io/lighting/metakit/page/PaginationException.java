package io.lighting.metakit.page;

/**
 * A pagination failure that is neither invalid metadata nor a database error.
 */
public class PaginationException extends RuntimeException {
    private final PaginationStage stage;

    public PaginationException(PaginationStage stage, String message, Throwable cause) {
        super(message + " (stage " + stage + ")", cause);
        this.stage = stage;
    }

    /**
     * The last stage that completed before the failure.
     */
    public PaginationStage stage() {
        return stage;
    }
}
