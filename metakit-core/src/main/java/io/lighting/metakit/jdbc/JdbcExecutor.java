package io.lighting.metakit.jdbc;

import io.lighting.metakit.sql.Bind;
import io.lighting.metakit.sql.RenderedSql;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;

public final class JdbcExecutor {
    private final DataSource dataSource;
    private final Connection connection;

    public JdbcExecutor(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.connection = null;
    }

    public JdbcExecutor(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.dataSource = null;
    }

    public <T> List<T> fetch(RenderedSql renderedSql, RowMapper<T> mapper) throws SQLException {
        return fetch(renderedSql, mapper, StatementOptions.defaults());
    }

    public <T> List<T> fetch(RenderedSql renderedSql, RowMapper<T> mapper, StatementOptions options)
        throws SQLException {
        Objects.requireNonNull(renderedSql, "renderedSql");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(options, "options");
        RenderedSql jdbcSql = toJdbc(renderedSql);
        Connection conn = acquireConnection();
        try (PreparedStatement statement = conn.prepareStatement(jdbcSql.sql())) {
            applyOptions(statement, options);
            bind(statement, jdbcSql.binds());
            try (ResultSet resultSet = statement.executeQuery()) {
                List<T> results = new ArrayList<>();
                while (resultSet.next()) {
                    results.add(mapper.map(resultSet));
                }
                return results;
            }
        } finally {
            releaseConnection(conn);
        }
    }

    /**
     * Runs a single-value count query.
     *
     * @throws SQLException when the query fails or returns no row
     */
    public long count(RenderedSql renderedSql, StatementOptions options) throws SQLException {
        List<Long> counts = fetch(renderedSql, rs -> rs.getLong(1), options);
        if (counts.isEmpty()) {
            throw new SQLException("Count query returned no rows: " + renderedSql.sql());
        }
        return counts.get(0);
    }

    /**
     * Rewrites numbered {@code $n} placeholders into positional JDBC markers.
     * <p>
     * Binds are reordered to follow the placeholders as they appear, so {@code $2 ... $1}
     * and repeated numbers bind correctly. Text inside single quotes, double quotes and
     * comments is left untouched. SQL that already uses {@code ?} is returned as is.
     */
    static RenderedSql toJdbc(RenderedSql renderedSql) {
        String sql = renderedSql.sql();
        if (sql.indexOf('$') < 0) {
            return renderedSql;
        }
        List<Bind> binds = renderedSql.binds();
        StringBuilder out = new StringBuilder(sql.length());
        List<Bind> ordered = new ArrayList<>();
        boolean numbered = false;
        int i = 0;
        while (i < sql.length()) {
            char ch = sql.charAt(i);
            if (ch == '\'' || ch == '"') {
                int end = skipQuoted(sql, i, ch);
                out.append(sql, i, end);
                i = end;
                continue;
            }
            if (ch == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? sql.length() : end;
                out.append(sql, i, end);
                i = end;
                continue;
            }
            if (ch == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end < 0 ? sql.length() : end + 2;
                out.append(sql, i, end);
                i = end;
                continue;
            }
            if (ch == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
                int end = i + 1;
                while (end < sql.length() && Character.isDigit(sql.charAt(end))) {
                    end++;
                }
                int position = Integer.parseInt(sql.substring(i + 1, end));
                if (position < 1 || position > binds.size()) {
                    throw new IllegalArgumentException(
                        "Placeholder $" + position + " has no bind (binds=" + binds.size() + ")"
                    );
                }
                out.append('?');
                ordered.add(binds.get(position - 1));
                numbered = true;
                i = end;
                continue;
            }
            out.append(ch);
            i++;
        }
        if (!numbered) {
            return renderedSql;
        }
        return new RenderedSql(out.toString(), ordered);
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private void applyOptions(PreparedStatement statement, StatementOptions options) throws SQLException {
        if (options.queryTimeoutSeconds() > 0) {
            statement.setQueryTimeout(options.queryTimeoutSeconds());
        }
        if (options.fetchSize() > 0) {
            statement.setFetchSize(options.fetchSize());
        }
        if (options.maxRows() > 0) {
            statement.setMaxRows(options.maxRows());
        }
    }

    private Connection acquireConnection() throws SQLException {
        if (connection != null) {
            return connection;
        }
        return dataSource.getConnection();
    }

    private void releaseConnection(Connection conn) throws SQLException {
        if (connection == null && conn != null) {
            conn.close();
        }
    }

    private void bind(PreparedStatement statement, List<Bind> binds) throws SQLException {
        for (int i = 0; i < binds.size(); i++) {
            int index = i + 1;
            Bind bind = binds.get(i);
            if (bind instanceof Bind.Value value) {
                if (value.jdbcType() == 0) {
                    statement.setObject(index, value.value());
                } else {
                    statement.setObject(index, value.value(), value.jdbcType());
                }
            } else if (bind instanceof Bind.NullValue nullValue) {
                int jdbcType = nullValue.jdbcType();
                if (jdbcType == 0) {
                    statement.setNull(index, Types.NULL);
                } else {
                    statement.setNull(index, jdbcType);
                }
            } else {
                throw new IllegalArgumentException("Unsupported bind: " + bind.getClass().getSimpleName());
            }
        }
    }
}
