package io.lighting.metakit.db;

import io.lighting.metakit.page.PageMetadata;
import io.lighting.metakit.sql.Bind;
import io.lighting.metakit.sql.RenderedSql;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Readable log output for the queries a paginator runs.
 * <p>
 * Typical uses:
 * <ul>
 *   <li>checking the SQL produced for offset and cursor pages;</li>
 *   <li>watching execution time and row counts;</li>
 *   <li>printing the final page numbers of a request in debug mode.</li>
 * </ul>
 * Built through {@link Builder}; instances are immutable and thread-safe. Two output
 * modes exist: SQL and binds side by side, or binds inlined into the SQL text. Inline
 * output is for display only and never changes what is executed.
 */
public final class SqlLog implements PaginationObserver {
    /**
     * Output mode.
     */
    public enum Mode {
        /**
         * SQL followed by its bind list, for example {@code SQL | binds=[...]}.
         */
        SEPARATE,
        /**
         * Placeholders ({@code ?} or {@code $n}) replaced by the formatted bind values.
         */
        INLINE
    }

    private final boolean enabled;
    private final boolean logOnExecute;
    private final boolean logPageStats;
    private final boolean includeElapsed;
    private final boolean includeRowCount;
    private final boolean includeOperation;
    private final Mode mode;
    private final String prefix;
    private final Consumer<String> sink;

    private SqlLog(Builder builder) {
        this.enabled = builder.enabled;
        this.logOnExecute = builder.logOnExecute;
        this.logPageStats = builder.logPageStats;
        this.includeElapsed = builder.includeElapsed;
        this.includeRowCount = builder.includeRowCount;
        this.includeOperation = builder.includeOperation;
        this.mode = builder.mode;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The log used for requests with the debug flag set: query text, elapsed time and
     * final page numbers, written to the given sink.
     */
    public static SqlLog debug(Consumer<String> sink) {
        return builder()
            .includeElapsed(true)
            .includeRowCount(true)
            .logPageStats(true)
            .prefix("DEBUG:")
            .sink(sink)
            .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void beforeExecute(QueryOperation operation, RenderedSql rendered) {
        if (!enabled || !logOnExecute) {
            return;
        }
        sink.accept(format(operation, rendered));
    }

    @Override
    public void afterExecute(QueryOperation operation, RenderedSql rendered, long elapsedNanos, int rowCount) {
        if (!enabled || !logOnExecute) {
            return;
        }
        if (includeRowCount || includeElapsed) {
            sink.accept(formatStats(operation.name(), elapsedNanos, rowCount));
        }
    }

    @Override
    public void onExecuteError(
        QueryOperation operation,
        RenderedSql rendered,
        long elapsedNanos,
        Exception error
    ) {
        if (!enabled || !logOnExecute) {
            return;
        }
        sink.accept(head(operation.name()) + "failed: " + error.getMessage());
    }

    @Override
    public void afterPaginate(PageMetadata metadata, long elapsedNanos) {
        if (!enabled || !logPageStats) {
            return;
        }
        StringBuilder out = new StringBuilder(head("PAGE"));
        out.append("page=").append(metadata.getPage())
            .append(", page_size=").append(metadata.getPageSize())
            .append(", total_rows=").append(metadata.getTotalRows())
            .append(", total_pages=").append(metadata.getTotalPages());
        if (!metadata.getCursor().isEmpty()) {
            out.append(", next_cursor=").append(metadata.getCursor());
        }
        if (includeElapsed) {
            out.append(", elapsed=").append(elapsedNanos).append("ns");
        }
        sink.accept(out.toString());
    }

    private String format(QueryOperation operation, RenderedSql rendered) {
        String content = mode == Mode.INLINE ? inlineSql(rendered) : separateSql(rendered);
        return head(operation.name()) + content;
    }

    private String head(String operation) {
        if (!includeOperation) {
            return prefix + " ";
        }
        return prefix + " [" + operation + "] ";
    }

    private String separateSql(RenderedSql rendered) {
        return rendered.sql() + " | binds=" + formatBinds(rendered.binds(), 0);
    }

    /**
     * Replaces {@code ?} markers in order and {@code $n} markers by position. Binds left
     * over after the last marker are appended as a comment.
     */
    private String inlineSql(RenderedSql rendered) {
        List<Bind> binds = rendered.binds();
        if (binds.isEmpty()) {
            return rendered.sql();
        }
        String sql = rendered.sql();
        StringBuilder out = new StringBuilder(sql.length() + binds.size() * 8);
        int bindIndex = 0;
        int i = 0;
        while (i < sql.length()) {
            char ch = sql.charAt(i);
            if (ch == '?' && bindIndex < binds.size()) {
                out.append(formatBind(binds.get(bindIndex++)));
                i++;
                continue;
            }
            if (ch == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
                int end = i + 1;
                while (end < sql.length() && Character.isDigit(sql.charAt(end))) {
                    end++;
                }
                int position = Integer.parseInt(sql.substring(i + 1, end));
                if (position >= 1 && position <= binds.size()) {
                    out.append(formatBind(binds.get(position - 1)));
                    bindIndex = Math.max(bindIndex, position);
                    i = end;
                    continue;
                }
            }
            out.append(ch);
            i++;
        }
        if (bindIndex < binds.size()) {
            out.append(" /* extra binds: ").append(formatBinds(binds, bindIndex)).append(" */");
        }
        return out.toString();
    }

    private String formatStats(String operation, long elapsedNanos, int rowCount) {
        List<String> parts = new ArrayList<>();
        if (includeRowCount) {
            parts.add("rows=" + rowCount);
        }
        if (includeElapsed) {
            parts.add("elapsed=" + elapsedNanos + "ns");
        }
        return head(operation) + String.join(", ", parts);
    }

    private String formatBinds(List<Bind> binds, int offset) {
        StringBuilder out = new StringBuilder();
        out.append('[');
        for (int i = offset; i < binds.size(); i++) {
            if (i > offset) {
                out.append(", ");
            }
            out.append(formatBind(binds.get(i)));
        }
        out.append(']');
        return out.toString();
    }

    private String formatBind(Bind bind) {
        if (bind instanceof Bind.NullValue) {
            return "NULL";
        }
        return formatValue(((Bind.Value) bind).value());
    }

    private String formatValue(Object value) {
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Boolean bool) {
            return bool ? "TRUE" : "FALSE";
        }
        if (value instanceof Enum<?> enumValue) {
            return "'" + escape(enumValue.name()) + "'";
        }
        if (value instanceof TemporalAccessor || value instanceof java.util.Date) {
            return "'" + escape(value.toString()) + "'";
        }
        return "'" + escape(String.valueOf(value)) + "'";
    }

    private String escape(String value) {
        return value.replace("'", "''");
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean logOnExecute = true;
        private boolean logPageStats = false;
        private boolean includeElapsed = false;
        private boolean includeRowCount = false;
        private boolean includeOperation = true;
        private Mode mode = Mode.SEPARATE;
        private String prefix = "SQL:";
        private Consumer<String> sink = System.out::println;

        /**
         * Master switch; nothing is written when disabled.
         */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * Log each count and fetch query.
         */
        public Builder logOnExecute(boolean enabled) {
            this.logOnExecute = enabled;
            return this;
        }

        /**
         * Log the final page numbers of each request.
         */
        public Builder logPageStats(boolean enabled) {
            this.logPageStats = enabled;
            return this;
        }

        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        public Builder includeRowCount(boolean enabled) {
            this.includeRowCount = enabled;
            return this;
        }

        public Builder includeOperation(boolean enabled) {
            this.includeOperation = enabled;
            return this;
        }

        public Builder mode(Mode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder prefix(String prefix) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            this.prefix = prefix;
            return this;
        }

        /**
         * Where lines go, for example an SLF4J logger method reference.
         */
        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * Builds the log. At least one of execute or page-stat logging must be on.
         */
        public SqlLog build() {
            if (!logOnExecute && !logPageStats) {
                throw new IllegalStateException("At least one of logOnExecute/logPageStats must be enabled");
            }
            return new SqlLog(this);
        }
    }
}
