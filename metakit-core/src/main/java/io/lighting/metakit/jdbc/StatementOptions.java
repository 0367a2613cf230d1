package io.lighting.metakit.jdbc;

/**
 * JDBC statement limits applied before a query runs. A value of {@code 0} leaves the
 * driver default in place.
 *
 * @param queryTimeoutSeconds {@link java.sql.Statement#setQueryTimeout(int)}
 * @param fetchSize           {@link java.sql.Statement#setFetchSize(int)}
 * @param maxRows             {@link java.sql.Statement#setMaxRows(int)}
 */
public record StatementOptions(int queryTimeoutSeconds, int fetchSize, int maxRows) {
    private static final StatementOptions DEFAULTS = new StatementOptions(0, 0, 0);

    public StatementOptions {
        if (queryTimeoutSeconds < 0) {
            throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
        }
        if (fetchSize < 0) {
            throw new IllegalArgumentException("fetchSize must be >= 0");
        }
        if (maxRows < 0) {
            throw new IllegalArgumentException("maxRows must be >= 0");
        }
    }

    public static StatementOptions defaults() {
        return DEFAULTS;
    }

    public boolean isDefault() {
        return queryTimeoutSeconds == 0 && fetchSize == 0 && maxRows == 0;
    }
}
