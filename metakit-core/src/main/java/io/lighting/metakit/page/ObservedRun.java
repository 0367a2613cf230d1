package io.lighting.metakit.page;

import io.lighting.metakit.db.PaginationObserver;
import io.lighting.metakit.db.QueryOperation;
import io.lighting.metakit.db.SqlLog;
import io.lighting.metakit.sql.RenderedSql;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Observer fan-out for one pagination request.
 */
final class ObservedRun {
    private final List<PaginationObserver> observers;
    private final long start;

    private ObservedRun(List<PaginationObserver> observers) {
        this.observers = observers;
        this.start = System.nanoTime();
    }

    /**
     * Starts a run; the debug log joins the observers only when the metadata asks for it.
     */
    static ObservedRun start(List<PaginationObserver> observers, SqlLog debugLog, PageMetadata metadata) {
        if (!metadata.isDebug()) {
            return new ObservedRun(observers);
        }
        List<PaginationObserver> active = new ArrayList<>(observers.size() + 1);
        active.addAll(observers);
        active.add(debugLog);
        return new ObservedRun(active);
    }

    /**
     * Runs one statement between observer callbacks. {@code SQLException} is rethrown as
     * is; any other failure becomes a {@link PaginationException} naming {@code reached},
     * the last stage completed before the statement.
     */
    <R> R execute(
        QueryOperation operation,
        PaginationStage reached,
        RenderedSql rendered,
        SqlCall<R> call,
        RowCounter<R> counter
    ) throws SQLException {
        for (PaginationObserver observer : observers) {
            observer.beforeExecute(operation, rendered);
        }
        long begin = System.nanoTime();
        try {
            R result = call.run();
            long elapsed = System.nanoTime() - begin;
            int rows = counter.rows(result);
            for (PaginationObserver observer : observers) {
                observer.afterExecute(operation, rendered, elapsed, rows);
            }
            return result;
        } catch (SQLException ex) {
            notifyError(operation, rendered, begin, ex);
            throw ex;
        } catch (RuntimeException ex) {
            notifyError(operation, rendered, begin, ex);
            throw new PaginationException(reached, operation + " failed", ex);
        }
    }

    private void notifyError(QueryOperation operation, RenderedSql rendered, long begin, Exception error) {
        long elapsed = System.nanoTime() - begin;
        for (PaginationObserver observer : observers) {
            observer.onExecuteError(operation, rendered, elapsed, error);
        }
    }

    void finish(PageMetadata metadata) {
        long elapsed = System.nanoTime() - start;
        for (PaginationObserver observer : observers) {
            observer.afterPaginate(metadata, elapsed);
        }
    }

    @FunctionalInterface
    interface SqlCall<R> {
        R run() throws SQLException;
    }

    @FunctionalInterface
    interface RowCounter<R> {
        int rows(R result);
    }
}
