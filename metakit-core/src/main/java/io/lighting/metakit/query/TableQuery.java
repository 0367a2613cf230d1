package io.lighting.metakit.query;

import io.lighting.metakit.jdbc.JdbcExecutor;
import io.lighting.metakit.jdbc.RowMapper;
import io.lighting.metakit.jdbc.RowMappers;
import io.lighting.metakit.jdbc.StatementOptions;
import io.lighting.metakit.page.SortDirection;
import io.lighting.metakit.sql.Bind;
import io.lighting.metakit.sql.Dialect;
import io.lighting.metakit.sql.RenderedSql;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-backed {@link PageableQuery} over a single table.
 * <pre>{@code
 * TableQuery<User> users = TableQuery.from(executor, "users", User.class)
 *     .where("age > ?", 30);
 * }</pre>
 * Renders {@code SELECT <fields> FROM <table> [WHERE ...] [ORDER BY ...] [LIMIT ?] [OFFSET ?]}
 * with {@code ?} markers.
 *
 * @param <T> row type
 */
public final class TableQuery<T> implements PageableQuery<T> {
    private final JdbcExecutor executor;
    private final String table;
    private final RowMapper<T> mapper;
    private final List<RenderedSql> conditions;
    private final List<String> fields;
    private final List<String> orderItems;
    private final Long offset;
    private final Integer limit;
    private final String indexHint;
    private final Dialect.HintPlacement hintPlacement;
    private final StatementOptions options;

    private TableQuery(
        JdbcExecutor executor,
        String table,
        RowMapper<T> mapper,
        List<RenderedSql> conditions,
        List<String> fields,
        List<String> orderItems,
        Long offset,
        Integer limit,
        String indexHint,
        Dialect.HintPlacement hintPlacement,
        StatementOptions options
    ) {
        this.executor = executor;
        this.table = table;
        this.mapper = mapper;
        this.conditions = List.copyOf(conditions);
        this.fields = List.copyOf(fields);
        this.orderItems = List.copyOf(orderItems);
        this.offset = offset;
        this.limit = limit;
        this.indexHint = indexHint;
        this.hintPlacement = hintPlacement;
        this.options = options;
    }

    public static <T> TableQuery<T> from(JdbcExecutor executor, String table, RowMapper<T> mapper) {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(mapper, "mapper");
        SqlIdentifiers.requireIdentifier(table, "table");
        return new TableQuery<>(
            executor,
            table,
            mapper,
            List.of(),
            List.of(),
            List.of(),
            null,
            null,
            "",
            Dialect.HintPlacement.NONE,
            StatementOptions.defaults()
        );
    }

    public static <T> TableQuery<T> from(JdbcExecutor executor, String table, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return from(executor, table, RowMappers.auto(type));
    }

    /**
     * Adds a caller filter such as {@code "age > ?"}; conditions are joined with {@code AND}.
     */
    public TableQuery<T> where(String condition, Object... args) {
        Objects.requireNonNull(condition, "condition");
        if (condition.isBlank()) {
            throw new IllegalArgumentException("condition must not be blank");
        }
        List<RenderedSql> merged = new ArrayList<>(conditions);
        merged.add(RenderedSql.of(condition, args));
        return copy(merged, fields, orderItems, offset, limit, indexHint, hintPlacement, options);
    }

    @Override
    public TableQuery<T> where(String field, ComparisonOperator operator, Object value) {
        SqlIdentifiers.requireIdentifier(field, "field");
        Objects.requireNonNull(operator, "operator");
        List<RenderedSql> merged = new ArrayList<>(conditions);
        Bind bind = value instanceof Bind typed ? typed : Bind.of(value);
        merged.add(new RenderedSql(field + " " + operator.symbol() + " ?", List.of(bind)));
        return copy(merged, fields, orderItems, offset, limit, indexHint, hintPlacement, options);
    }

    /**
     * Replaces the selected columns. {@code *} may only appear on its own.
     */
    @Override
    public TableQuery<T> select(List<String> selected) {
        Objects.requireNonNull(selected, "selected");
        List<String> checked = new ArrayList<>(selected.size());
        for (String field : selected) {
            checked.add(SqlIdentifiers.requireSelectable(field));
        }
        if (checked.size() > 1 && checked.contains("*")) {
            throw new IllegalArgumentException("'*' cannot be combined with named fields: " + checked);
        }
        return copy(conditions, checked, orderItems, offset, limit, indexHint, hintPlacement, options);
    }

    @Override
    public TableQuery<T> orderBy(String field, SortDirection direction) {
        SqlIdentifiers.requireIdentifier(field, "sort field");
        Objects.requireNonNull(direction, "direction");
        List<String> merged = new ArrayList<>(orderItems);
        merged.add(field + " " + direction.keyword());
        return copy(conditions, fields, merged, offset, limit, indexHint, hintPlacement, options);
    }

    @Override
    public TableQuery<T> offsetLimit(long newOffset, int newLimit) {
        if (newOffset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        checkLimit(newLimit);
        return copy(conditions, fields, orderItems, newOffset, newLimit, indexHint, hintPlacement, options);
    }

    @Override
    public TableQuery<T> limit(int newLimit) {
        checkLimit(newLimit);
        return copy(conditions, fields, orderItems, offset, newLimit, indexHint, hintPlacement, options);
    }

    /**
     * Adds the dialect's index hint: MySQL puts it after the table name, PostgreSQL right
     * after the {@code WHERE} keyword (nothing is added when there is no condition).
     */
    public TableQuery<T> withIndexHint(Dialect dialect) {
        Objects.requireNonNull(dialect, "dialect");
        return copy(
            conditions,
            fields,
            orderItems,
            offset,
            limit,
            dialect.tableIndexHint(),
            dialect.hintPlacement(),
            options
        );
    }

    public TableQuery<T> withOptions(StatementOptions newOptions) {
        Objects.requireNonNull(newOptions, "options");
        return copy(conditions, fields, orderItems, offset, limit, indexHint, hintPlacement, newOptions);
    }

    public StatementOptions options() {
        return options;
    }

    @Override
    public long count() throws SQLException {
        StatementOptions countOptions = new StatementOptions(options.queryTimeoutSeconds(), 0, 0);
        return executor.count(renderCount(), countOptions);
    }

    @Override
    public List<T> fetch() throws SQLException {
        return executor.fetch(render(), mapper, options);
    }

    @Override
    public RenderedSql render() {
        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(fields.isEmpty() ? "*" : String.join(", ", fields));
        List<Bind> binds = new ArrayList<>();
        appendFromWhere(sql, binds);
        if (!orderItems.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderItems));
        }
        if (limit != null) {
            sql.append(" LIMIT ?");
            binds.add(Bind.of(limit));
        }
        if (offset != null) {
            sql.append(" OFFSET ?");
            binds.add(Bind.of(offset));
        }
        return new RenderedSql(sql.toString(), binds);
    }

    @Override
    public RenderedSql renderCount() {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*)");
        List<Bind> binds = new ArrayList<>();
        appendFromWhere(sql, binds);
        return new RenderedSql(sql.toString(), binds);
    }

    private void appendFromWhere(StringBuilder sql, List<Bind> binds) {
        sql.append(" FROM ").append(table);
        if (hintPlacement == Dialect.HintPlacement.BEFORE_WHERE) {
            sql.append(' ').append(indexHint);
        }
        if (conditions.isEmpty()) {
            return;
        }
        sql.append(" WHERE ");
        if (hintPlacement == Dialect.HintPlacement.AFTER_WHERE) {
            sql.append(indexHint).append(' ');
        }
        boolean wrap = conditions.size() > 1;
        for (int i = 0; i < conditions.size(); i++) {
            if (i > 0) {
                sql.append(" AND ");
            }
            RenderedSql condition = conditions.get(i);
            if (wrap) {
                sql.append('(').append(condition.sql()).append(')');
            } else {
                sql.append(condition.sql());
            }
            binds.addAll(condition.binds());
        }
    }

    private static void checkLimit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
    }

    private TableQuery<T> copy(
        List<RenderedSql> newConditions,
        List<String> newFields,
        List<String> newOrderItems,
        Long newOffset,
        Integer newLimit,
        String newIndexHint,
        Dialect.HintPlacement newHintPlacement,
        StatementOptions newOptions
    ) {
        return new TableQuery<>(
            executor,
            table,
            mapper,
            newConditions,
            newFields,
            newOrderItems,
            newOffset,
            newLimit,
            newIndexHint,
            newHintPlacement,
            newOptions
        );
    }
}
