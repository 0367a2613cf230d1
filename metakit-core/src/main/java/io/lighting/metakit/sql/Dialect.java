package io.lighting.metakit.sql;

import java.sql.Types;

/**
 * Target SQL dialects.
 * <p>
 * Each constant carries the dialect's placeholder style and the syntax of the
 * optimizer hints it understands. {@link #SQLITE} has no index hint and no
 * materialization prefix.
 */
public enum Dialect {
    MYSQL(
        false,
        HintPlacement.BEFORE_WHERE,
        "FORCE INDEX (idx_created_at)",
        "USE INDEX (idx_created_at)",
        "WITH RECURSIVE",
        0
    ),
    POSTGRESQL(
        true,
        HintPlacement.AFTER_WHERE,
        "/*+ IndexScan(table_name idx_created_at) */",
        "/*+ IndexScan(table_name idx_created_at) */",
        "WITH MATERIALIZED",
        Types.OTHER
    ),
    SQLITE(false, HintPlacement.NONE, "", "", "", 0);

    /**
     * Where a query-level index hint goes relative to the first top-level {@code WHERE}.
     */
    public enum HintPlacement {
        BEFORE_WHERE,
        AFTER_WHERE,
        NONE
    }

    private final boolean numberedPlaceholders;
    private final HintPlacement hintPlacement;
    private final String queryIndexHint;
    private final String tableIndexHint;
    private final String materializedPrefix;
    private final int cursorValueType;

    Dialect(
        boolean numberedPlaceholders,
        HintPlacement hintPlacement,
        String queryIndexHint,
        String tableIndexHint,
        String materializedPrefix,
        int cursorValueType
    ) {
        this.numberedPlaceholders = numberedPlaceholders;
        this.hintPlacement = hintPlacement;
        this.queryIndexHint = queryIndexHint;
        this.tableIndexHint = tableIndexHint;
        this.materializedPrefix = materializedPrefix;
        this.cursorValueType = cursorValueType;
    }

    /**
     * Renders the placeholder for the bind at the given 1-based position.
     */
    public String placeholder(int position) {
        if (position < 1) {
            throw new IllegalArgumentException("position must be >= 1");
        }
        return numberedPlaceholders ? "$" + position : "?";
    }

    public boolean numberedPlaceholders() {
        return numberedPlaceholders;
    }

    public HintPlacement hintPlacement() {
        return hintPlacement;
    }

    public String queryIndexHint() {
        return queryIndexHint;
    }

    public String tableIndexHint() {
        return tableIndexHint;
    }

    /**
     * Prefix used when materialized-view wrapping is enabled.
     * <p>
     * MySQL renders {@code WITH RECURSIVE}, which does not materialize anything;
     * the text is kept because existing callers depend on it.
     */
    public String materializedPrefix() {
        return materializedPrefix;
    }

    /**
     * Bind for a decoded cursor value. Cursor values are text; PostgreSQL receives them
     * untyped so the server resolves them against the compared column's type.
     */
    public Bind cursorBind(String value) {
        if (value == null) {
            return Bind.of(null);
        }
        return new Bind.Value(value, cursorValueType);
    }
}
