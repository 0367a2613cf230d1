package io.lighting.metakit.page;

/**
 * Stages a paginated fetch completes, in order. A {@link PaginationException} names the
 * last one reached before the failure.
 */
public enum PaginationStage {
    /**
     * Metadata passed validation; the count query runs next.
     */
    VALIDATED,
    /**
     * The row total is known; the page query runs next.
     */
    COUNTED,
    /**
     * The page rows were fetched; normalization and the next cursor follow.
     */
    PAGINATED
}
