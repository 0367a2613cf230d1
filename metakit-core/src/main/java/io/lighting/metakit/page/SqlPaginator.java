package io.lighting.metakit.page;

import io.lighting.metakit.cursor.CursorCodec;
import io.lighting.metakit.cursor.InvalidCursorException;
import io.lighting.metakit.cursor.InvalidCursorPolicy;
import io.lighting.metakit.db.PaginationObserver;
import io.lighting.metakit.db.QueryOperation;
import io.lighting.metakit.db.SqlLog;
import io.lighting.metakit.jdbc.JdbcExecutor;
import io.lighting.metakit.jdbc.RowMapper;
import io.lighting.metakit.jdbc.StatementOptions;
import io.lighting.metakit.query.ComparisonOperator;
import io.lighting.metakit.query.SqlIdentifiers;
import io.lighting.metakit.sql.Bind;
import io.lighting.metakit.sql.Dialect;
import io.lighting.metakit.sql.RenderedSql;
import io.lighting.metakit.sql.SqlScanner;
import io.lighting.metakit.validate.ValidationResult;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Paginates caller-written SQL.
 * <pre>{@code
 * SqlPaginator paginator = SqlPaginator.builder(executor).build();
 * List<User> users = paginator.queryPaginate(
 *     Dialect.POSTGRESQL, "SELECT * FROM users WHERE age > $1", metadata, mapper, 18);
 * }</pre>
 * Paging clauses are appended to the query with the dialect's placeholders, numbered
 * after the caller's arguments for PostgreSQL. The caller's query must not end with its
 * own {@code ORDER BY} or {@code LIMIT}.
 * <p>
 * {@link #queryPaginate} does not count: {@code totalRows} is taken from the metadata as
 * supplied and only {@code totalPages} is recomputed. {@link #queryPaginateWithCount}
 * counts first and fills every derived field. Cursors that cannot be decoded fail with
 * {@link InvalidCursorException} unless the policy says otherwise. A query that already
 * has a top-level {@code WHERE} is wrapped as {@code SELECT * FROM (...) cursor_src}
 * before the cursor condition is added, so the cursor field must be a column of its
 * result.
 */
public final class SqlPaginator {
    private static final String WHERE = "WHERE";
    private static final String CURSOR_SOURCE = "cursor_src";

    private final JdbcExecutor executor;
    private final List<PaginationObserver> observers;
    private final SqlLog debugLog;
    private final InvalidCursorPolicy invalidCursorPolicy;

    private SqlPaginator(Builder builder) {
        this.executor = builder.executor;
        this.observers = List.copyOf(builder.observers);
        this.debugLog = builder.debugLog;
        this.invalidCursorPolicy = builder.invalidCursorPolicy;
    }

    public static Builder builder(JdbcExecutor executor) {
        return new Builder(executor);
    }

    public InvalidCursorPolicy invalidCursorPolicy() {
        return invalidCursorPolicy;
    }

    public <T> List<T> queryPaginate(
        Dialect dialect,
        String query,
        PageMetadata metadata,
        RowMapper<T> mapper,
        Object... args
    ) throws SQLException {
        Objects.requireNonNull(mapper, "mapper");
        ObservedRun run = ObservedRun.start(observers, debugLog, Objects.requireNonNull(metadata, "metadata"));
        requireValid(metadata);
        metadata.setTotalPages(PageSql.totalPages(metadata.getTotalRows(), metadata.getPageSize()));
        List<T> items = fetch(run, PaginationStage.VALIDATED, render(dialect, query, metadata, args), mapper);
        run.finish(metadata);
        return items;
    }

    /**
     * Counts the rows of {@code query} first, then paginates it. The metadata receives the
     * total and every derived field.
     */
    public <T> List<T> queryPaginateWithCount(
        Dialect dialect,
        String query,
        PageMetadata metadata,
        RowMapper<T> mapper,
        Object... args
    ) throws SQLException {
        Objects.requireNonNull(mapper, "mapper");
        ObservedRun run = ObservedRun.start(observers, debugLog, Objects.requireNonNull(metadata, "metadata"));
        requireValid(metadata);
        RenderedSql countSql = PageSql.wrapCount(RenderedSql.of(baseQuery(query), args));
        long total = run.execute(
            QueryOperation.COUNT,
            PaginationStage.VALIDATED,
            countSql,
            () -> executor.count(countSql, StatementOptions.defaults()),
            count -> 1
        );
        metadata.withTotalRows(total).normalize();
        List<T> items = fetch(run, PaginationStage.COUNTED, render(dialect, query, metadata, args), mapper);
        run.finish(metadata);
        return items;
    }

    /**
     * Renders the paged query without running it.
     *
     * @throws InvalidCursorException when the cursor cannot be decoded and the policy is
     *                                {@link InvalidCursorPolicy#FAIL}
     */
    public RenderedSql render(Dialect dialect, String query, PageMetadata metadata, Object... args) {
        Objects.requireNonNull(dialect, "dialect");
        Objects.requireNonNull(metadata, "metadata");
        String base = baseQuery(query);
        List<Bind> binds = new ArrayList<>(RenderedSql.of(base, args).binds());
        StringBuilder sql = new StringBuilder(base);
        if (metadata.isCursorBased()) {
            appendCursor(sql, binds, dialect, metadata);
        } else {
            if (!metadata.getSort().isEmpty()) {
                SqlIdentifiers.requireIdentifier(metadata.getSort(), "sort field");
                sql.append(" ORDER BY ").append(metadata.getSort())
                    .append(' ').append(metadata.sortDirectionValue().keyword());
            }
            binds.add(Bind.of(metadata.limit()));
            sql.append(" LIMIT ").append(dialect.placeholder(binds.size()));
            binds.add(Bind.of(metadata.offset()));
            sql.append(" OFFSET ").append(dialect.placeholder(binds.size()));
        }
        return new RenderedSql(sql.toString(), binds);
    }

    private void appendCursor(StringBuilder sql, List<Bind> binds, Dialect dialect, PageMetadata metadata) {
        String cursorField = SqlIdentifiers.requireIdentifier(metadata.getCursorField(), "cursor field");
        SortDirection order = metadata.cursorOrderValue();
        String value = metadata.getCursor().isEmpty() ? null : decodeCursor(metadata);
        if (value != null) {
            // The cursor bound applies to every row of the caller's filter, OR branches included.
            if (SqlScanner.findTopLevelKeyword(sql.toString(), WHERE) >= 0) {
                sql.insert(0, "SELECT * FROM (").append(") ").append(CURSOR_SOURCE);
            }
            binds.add(dialect.cursorBind(value));
            sql.append(" WHERE ")
                .append(cursorField).append(' ')
                .append(ComparisonOperator.after(order).symbol()).append(' ')
                .append(dialect.placeholder(binds.size()));
        }
        sql.append(" ORDER BY ").append(cursorField).append(' ').append(order.keyword());
        binds.add(Bind.of(metadata.limit()));
        sql.append(" LIMIT ").append(dialect.placeholder(binds.size()));
    }

    private String decodeCursor(PageMetadata metadata) {
        try {
            return CursorCodec.comparisonValue(metadata.getCursor(), metadata.getCursorField());
        } catch (InvalidCursorException ex) {
            if (invalidCursorPolicy == InvalidCursorPolicy.FAIL) {
                throw ex;
            }
            return null;
        }
    }

    private <T> List<T> fetch(
        ObservedRun run,
        PaginationStage reached,
        RenderedSql rendered,
        RowMapper<T> mapper
    ) throws SQLException {
        return run.execute(QueryOperation.FETCH, reached, rendered, () -> executor.fetch(rendered, mapper), List::size);
    }

    private static void requireValid(PageMetadata metadata) {
        ValidationResult validation = metadata.validate();
        if (!validation.isValid()) {
            throw new InvalidMetadataException(validation);
        }
    }

    private static String baseQuery(String query) {
        Objects.requireNonNull(query, "query");
        String trimmed = query.trim();
        if (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        return trimmed;
    }

    public static final class Builder {
        private final JdbcExecutor executor;
        private final List<PaginationObserver> observers = new ArrayList<>();
        private SqlLog debugLog = SqlLog.debug(System.out::println);
        private InvalidCursorPolicy invalidCursorPolicy = InvalidCursorPolicy.FAIL;

        private Builder(JdbcExecutor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
        }

        public Builder observer(PaginationObserver observer) {
            observers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        public Builder observers(List<? extends PaginationObserver> values) {
            Objects.requireNonNull(values, "observers");
            for (PaginationObserver observer : values) {
                observer(observer);
            }
            return this;
        }

        public Builder debugLog(SqlLog debugLog) {
            this.debugLog = Objects.requireNonNull(debugLog, "debugLog");
            return this;
        }

        public Builder invalidCursorPolicy(InvalidCursorPolicy policy) {
            this.invalidCursorPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public SqlPaginator build() {
            return new SqlPaginator(this);
        }
    }
}
