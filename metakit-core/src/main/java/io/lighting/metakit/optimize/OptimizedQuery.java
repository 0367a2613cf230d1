package io.lighting.metakit.optimize;

import java.util.Objects;

/**
 * An optimized query kept as fragments: the materialization prefix, the original
 * query split around the index hint, and the row-limit suffix. {@link #sql()} joins
 * them; unused fragments are empty.
 */
public record OptimizedQuery(String prefix, String head, String hint, String tail, String suffix) {
    public OptimizedQuery {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(head, "head");
        Objects.requireNonNull(hint, "hint");
        Objects.requireNonNull(tail, "tail");
        Objects.requireNonNull(suffix, "suffix");
    }

    static OptimizedQuery of(String query) {
        return new OptimizedQuery("", query, "", "", "");
    }

    public boolean hinted() {
        return !hint.isEmpty();
    }

    public String sql() {
        return prefix + head + hint + tail + suffix;
    }

    OptimizedQuery withHintAt(int splitIndex, String hintText) {
        String original = head + tail;
        return new OptimizedQuery(prefix, original.substring(0, splitIndex), hintText, original.substring(splitIndex), suffix);
    }

    OptimizedQuery withPrefix(String newPrefix) {
        return new OptimizedQuery(newPrefix, head, hint, tail, suffix);
    }

    OptimizedQuery withSuffix(String newSuffix) {
        return new OptimizedQuery(prefix, head, hint, tail, newSuffix);
    }

    @Override
    public String toString() {
        return sql();
    }
}
