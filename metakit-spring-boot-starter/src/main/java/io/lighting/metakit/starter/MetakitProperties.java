package io.lighting.metakit.starter;

import io.lighting.metakit.cursor.InvalidCursorPolicy;
import io.lighting.metakit.db.SqlLog;
import io.lighting.metakit.optimize.OptimizerConfig;
import java.time.Duration;
import java.util.function.Consumer;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for metakit.
 * <p>
 * Configure these properties under the "metakit" prefix in application.yml:
 * <pre>{@code
 * metakit:
 *   dialect: postgresql
 *   optimizer:
 *     max-rows: 500
 *     timeout: 5s
 *   sql:
 *     log:
 *       enabled: true
 *       mode: INLINE
 *   cursor:
 *     invalid-policy: FAIL
 * }</pre>
 */
@ConfigurationProperties(prefix = "metakit")
public class MetakitProperties {

    /**
     * Dialect name; resolved from the DataSource when empty.
     */
    private String dialect;

    private OptimizerProperties optimizer = new OptimizerProperties();

    private SqlProperties sql = new SqlProperties();

    private CursorProperties cursor = new CursorProperties();

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public OptimizerProperties getOptimizer() {
        return optimizer;
    }

    public void setOptimizer(OptimizerProperties optimizer) {
        this.optimizer = optimizer;
    }

    public SqlProperties getSql() {
        return sql;
    }

    public void setSql(SqlProperties sql) {
        this.sql = sql;
    }

    public CursorProperties getCursor() {
        return cursor;
    }

    public void setCursor(CursorProperties cursor) {
        this.cursor = cursor;
    }

    public static class OptimizerProperties {
        private boolean useIndexHint = OptimizerConfig.defaults().useIndexHint();
        private boolean useQueryCache = OptimizerConfig.defaults().useQueryCache();
        private int batchSize = OptimizerConfig.defaults().batchSize();
        private Duration timeout = OptimizerConfig.defaults().timeout();
        private int maxRows = OptimizerConfig.defaults().maxRows();
        private boolean useMaterializedView = OptimizerConfig.defaults().useMaterializedView();

        public boolean isUseIndexHint() {
            return useIndexHint;
        }

        public void setUseIndexHint(boolean useIndexHint) {
            this.useIndexHint = useIndexHint;
        }

        public boolean isUseQueryCache() {
            return useQueryCache;
        }

        public void setUseQueryCache(boolean useQueryCache) {
            this.useQueryCache = useQueryCache;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = maxRows;
        }

        public boolean isUseMaterializedView() {
            return useMaterializedView;
        }

        public void setUseMaterializedView(boolean useMaterializedView) {
            this.useMaterializedView = useMaterializedView;
        }

        public OptimizerConfig build() {
            return OptimizerConfig.builder()
                .useIndexHint(useIndexHint)
                .useQueryCache(useQueryCache)
                .batchSize(batchSize)
                .timeout(timeout)
                .maxRows(maxRows)
                .useMaterializedView(useMaterializedView)
                .build();
        }
    }

    public static class SqlProperties {
        private SqlLogProperties log = new SqlLogProperties();

        public SqlLogProperties getLog() {
            return log;
        }

        public void setLog(SqlLogProperties log) {
            this.log = log;
        }
    }

    public static class SqlLogProperties {
        private boolean enabled = true;
        private boolean logOnExecute = true;
        private boolean logPageStats = false;
        private boolean includeElapsed = false;
        private boolean includeRowCount = false;
        private boolean includeOperation = true;
        private SqlLog.Mode mode = SqlLog.Mode.SEPARATE;
        private String prefix = "SQL:";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isLogOnExecute() {
            return logOnExecute;
        }

        public void setLogOnExecute(boolean logOnExecute) {
            this.logOnExecute = logOnExecute;
        }

        public boolean isLogPageStats() {
            return logPageStats;
        }

        public void setLogPageStats(boolean logPageStats) {
            this.logPageStats = logPageStats;
        }

        public boolean isIncludeElapsed() {
            return includeElapsed;
        }

        public void setIncludeElapsed(boolean includeElapsed) {
            this.includeElapsed = includeElapsed;
        }

        public boolean isIncludeRowCount() {
            return includeRowCount;
        }

        public void setIncludeRowCount(boolean includeRowCount) {
            this.includeRowCount = includeRowCount;
        }

        public boolean isIncludeOperation() {
            return includeOperation;
        }

        public void setIncludeOperation(boolean includeOperation) {
            this.includeOperation = includeOperation;
        }

        public SqlLog.Mode getMode() {
            return mode;
        }

        public void setMode(SqlLog.Mode mode) {
            this.mode = mode;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        /**
         * @return the configured log, or {@code null} when disabled
         */
        public SqlLog build(Consumer<String> logger) {
            if (!enabled) {
                return null;
            }
            return SqlLog.builder()
                .mode(mode)
                .logOnExecute(logOnExecute)
                .logPageStats(logPageStats)
                .includeElapsed(includeElapsed)
                .includeRowCount(includeRowCount)
                .includeOperation(includeOperation)
                .prefix(prefix)
                .sink(logger)
                .build();
        }
    }

    public static class CursorProperties {
        private InvalidCursorPolicy invalidPolicy = InvalidCursorPolicy.IGNORE;

        public InvalidCursorPolicy getInvalidPolicy() {
            return invalidPolicy;
        }

        public void setInvalidPolicy(InvalidCursorPolicy invalidPolicy) {
            this.invalidPolicy = invalidPolicy;
        }
    }
}
