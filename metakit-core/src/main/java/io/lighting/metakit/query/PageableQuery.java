package io.lighting.metakit.query;

import io.lighting.metakit.page.SortDirection;
import io.lighting.metakit.sql.RenderedSql;
import java.sql.SQLException;
import java.util.List;

/**
 * What a paginator needs from the data layer.
 * <p>
 * Implementations are immutable: every modifier returns a new query and leaves the
 * receiver untouched, so a paginator can count with the original query and fetch with
 * a derived one.
 *
 * @param <T> row type
 */
public interface PageableQuery<T> {
    /**
     * Counts the rows matching this query's own filters, ignoring selection, order and
     * paging.
     */
    long count() throws SQLException;

    PageableQuery<T> select(List<String> fields);

    PageableQuery<T> orderBy(String field, SortDirection direction);

    PageableQuery<T> offsetLimit(long offset, int limit);

    PageableQuery<T> limit(int limit);

    /**
     * Adds {@code field <operator> value} with the value bound as a parameter. A
     * {@link io.lighting.metakit.sql.Bind} value is used as given, JDBC type included.
     */
    PageableQuery<T> where(String field, ComparisonOperator operator, Object value);

    List<T> fetch() throws SQLException;

    /**
     * SQL that {@link #fetch()} would run.
     */
    RenderedSql render();

    /**
     * SQL that {@link #count()} would run.
     */
    RenderedSql renderCount();
}
