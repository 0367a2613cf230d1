package io.lighting.metakit.db;

import io.lighting.metakit.page.PageMetadata;
import io.lighting.metakit.sql.RenderedSql;

/**
 * Observes the queries a paginator issues.
 * <p>
 * Callbacks have empty defaults; override what you need. Normal order for one
 * request:
 * <ol>
 *   <li>{@link #beforeExecute} / {@link #afterExecute} for the count query (skipped by
 *   the raw SQL entry point)</li>
 *   <li>{@link #beforeExecute} / {@link #afterExecute} for the page query</li>
 *   <li>{@link #afterPaginate} once the metadata has been finalized</li>
 * </ol>
 * A failing query triggers {@link #onExecuteError} instead of {@link #afterExecute}.
 * Observers must not throw and must not mutate the metadata they receive.
 */
public interface PaginationObserver {
    /**
     * Called before a query is executed.
     *
     * @param operation count or fetch
     * @param rendered  SQL and binds about to run
     */
    default void beforeExecute(QueryOperation operation, RenderedSql rendered) {
    }

    /**
     * Called after a query completed.
     *
     * @param operation    count or fetch
     * @param rendered     SQL and binds that ran
     * @param elapsedNanos execution time
     * @param rowCount     rows returned
     */
    default void afterExecute(QueryOperation operation, RenderedSql rendered, long elapsedNanos, int rowCount) {
    }

    /**
     * Called when a query failed; the error is rethrown to the caller afterwards.
     */
    default void onExecuteError(
        QueryOperation operation,
        RenderedSql rendered,
        long elapsedNanos,
        Exception error
    ) {
    }

    /**
     * Called once per successful pagination with the finalized metadata.
     *
     * @param metadata     final pagination state
     * @param elapsedNanos wall time since the paginator started the request
     */
    default void afterPaginate(PageMetadata metadata, long elapsedNanos) {
    }
}
