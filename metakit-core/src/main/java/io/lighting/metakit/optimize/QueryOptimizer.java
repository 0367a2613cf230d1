package io.lighting.metakit.optimize;

import io.lighting.metakit.jdbc.StatementOptions;
import io.lighting.metakit.query.TableQuery;
import io.lighting.metakit.sql.Dialect;
import io.lighting.metakit.sql.SqlScanner;
import java.util.Objects;

/**
 * Best-effort query hints per dialect.
 * <p>
 * {@link #optimize(String, Dialect)} rewrites raw SQL text:
 * <ul>
 *   <li>index hint: MySQL gets {@code FORCE INDEX (idx_created_at)} before the first
 *   top-level {@code WHERE}, PostgreSQL gets an {@code IndexScan} hint comment right after
 *   it; queries without a top-level {@code WHERE} are left alone;</li>
 *   <li>materialization: PostgreSQL is prefixed with {@code WITH MATERIALIZED}, MySQL with
 *   {@code WITH RECURSIVE};</li>
 *   <li>row limit: {@code LIMIT <maxRows>} is appended when {@code maxRows > 0}.</li>
 * </ul>
 * The index name is fixed. This is a hint layer, not a query compiler: it does not
 * check that the result is valid SQL.
 */
public final class QueryOptimizer {
    private static final String WHERE = "WHERE";

    private final OptimizerConfig config;

    public QueryOptimizer(OptimizerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public static QueryOptimizer create() {
        return new QueryOptimizer(OptimizerConfig.defaults());
    }

    public OptimizerConfig config() {
        return config;
    }

    public String optimize(String query, Dialect dialect) {
        return plan(query, dialect).sql();
    }

    public OptimizedQuery plan(String query, Dialect dialect) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(dialect, "dialect");
        OptimizedQuery optimized = OptimizedQuery.of(query);
        if (config.useIndexHint()) {
            optimized = addIndexHint(optimized, query, dialect);
        }
        if (config.useMaterializedView() && !dialect.materializedPrefix().isEmpty()) {
            optimized = optimized.withPrefix(dialect.materializedPrefix() + " ");
        }
        if (config.maxRows() > 0) {
            optimized = optimized.withSuffix(" LIMIT " + config.maxRows());
        }
        return optimized;
    }

    /**
     * Applies the same settings to a table query: index hint, and the timeout, batch size
     * and row limit as JDBC statement options.
     */
    public <T> TableQuery<T> applyTo(TableQuery<T> query, Dialect dialect) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(dialect, "dialect");
        TableQuery<T> optimized = query;
        if (config.useIndexHint() && dialect.hintPlacement() != Dialect.HintPlacement.NONE) {
            optimized = optimized.withIndexHint(dialect);
        }
        return optimized.withOptions(statementOptions());
    }

    public StatementOptions statementOptions() {
        return new StatementOptions(config.timeoutSeconds(), config.batchSize(), config.maxRows());
    }

    private static OptimizedQuery addIndexHint(OptimizedQuery optimized, String query, Dialect dialect) {
        int where = SqlScanner.findTopLevelKeyword(query, WHERE);
        if (where < 0) {
            return optimized;
        }
        return switch (dialect.hintPlacement()) {
            case BEFORE_WHERE -> optimized.withHintAt(where, dialect.queryIndexHint() + " ");
            case AFTER_WHERE -> optimized.withHintAt(where + WHERE.length(), " " + dialect.queryIndexHint());
            case NONE -> optimized;
        };
    }
}
