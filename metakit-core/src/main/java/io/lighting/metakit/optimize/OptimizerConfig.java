package io.lighting.metakit.optimize;

import java.time.Duration;
import java.util.Objects;

/**
 * Optimizer settings. Every {@code withX} returns a new value.
 *
 * @param useIndexHint        add the dialect's index hint
 * @param useQueryCache       advisory flag; no cache is implemented
 * @param batchSize           advisory batch size, used as the JDBC fetch size
 * @param timeout             query timeout advised to the execution layer; zero disables it
 * @param maxRows             row limit appended to queries; zero disables it
 * @param useMaterializedView prefix queries with the dialect's materialization keyword
 */
public record OptimizerConfig(
    boolean useIndexHint,
    boolean useQueryCache,
    int batchSize,
    Duration timeout,
    int maxRows,
    boolean useMaterializedView
) {
    private static final OptimizerConfig DEFAULTS = new OptimizerConfig(
        true,
        true,
        1000,
        Duration.ofSeconds(30),
        10000,
        false
    );

    public OptimizerConfig {
        Objects.requireNonNull(timeout, "timeout");
        if (batchSize < 0) {
            throw new IllegalArgumentException("batchSize must be >= 0");
        }
        if (maxRows < 0) {
            throw new IllegalArgumentException("maxRows must be >= 0");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    public static OptimizerConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Builder seeded with {@link #defaults()}.
     */
    public static Builder builder() {
        return new Builder();
    }

    public OptimizerConfig withIndexHint(boolean use) {
        return new OptimizerConfig(use, useQueryCache, batchSize, timeout, maxRows, useMaterializedView);
    }

    public OptimizerConfig withQueryCache(boolean use) {
        return new OptimizerConfig(useIndexHint, use, batchSize, timeout, maxRows, useMaterializedView);
    }

    public OptimizerConfig withBatchSize(int size) {
        return new OptimizerConfig(useIndexHint, useQueryCache, size, timeout, maxRows, useMaterializedView);
    }

    public OptimizerConfig withTimeout(Duration newTimeout) {
        return new OptimizerConfig(useIndexHint, useQueryCache, batchSize, newTimeout, maxRows, useMaterializedView);
    }

    public OptimizerConfig withMaxRows(int max) {
        return new OptimizerConfig(useIndexHint, useQueryCache, batchSize, timeout, max, useMaterializedView);
    }

    public OptimizerConfig withMaterialized(boolean use) {
        return new OptimizerConfig(useIndexHint, useQueryCache, batchSize, timeout, maxRows, use);
    }

    /**
     * Timeout in whole seconds for {@link java.sql.Statement#setQueryTimeout(int)}, rounded
     * up so that a sub-second timeout is not lost.
     */
    public int timeoutSeconds() {
        if (timeout.isZero()) {
            return 0;
        }
        long seconds = timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
        return (int) Math.min(Integer.MAX_VALUE, seconds);
    }

    public static final class Builder {
        private boolean useIndexHint = DEFAULTS.useIndexHint;
        private boolean useQueryCache = DEFAULTS.useQueryCache;
        private int batchSize = DEFAULTS.batchSize;
        private Duration timeout = DEFAULTS.timeout;
        private int maxRows = DEFAULTS.maxRows;
        private boolean useMaterializedView = DEFAULTS.useMaterializedView;

        private Builder() {
        }

        public Builder useIndexHint(boolean use) {
            this.useIndexHint = use;
            return this;
        }

        public Builder useQueryCache(boolean use) {
            this.useQueryCache = use;
            return this;
        }

        public Builder batchSize(int size) {
            this.batchSize = size;
            return this;
        }

        public Builder timeout(Duration value) {
            this.timeout = value;
            return this;
        }

        public Builder maxRows(int max) {
            this.maxRows = max;
            return this;
        }

        public Builder useMaterializedView(boolean use) {
            this.useMaterializedView = use;
            return this;
        }

        public OptimizerConfig build() {
            return new OptimizerConfig(useIndexHint, useQueryCache, batchSize, timeout, maxRows, useMaterializedView);
        }
    }
}
