package io.lighting.metakit.page;

import io.lighting.metakit.sql.RenderedSql;
import java.util.Objects;

/**
 * Pagination SQL helpers.
 */
public final class PageSql {
    private PageSql() {
    }

    /**
     * Wrap base SQL as a COUNT query while keeping bind parameters intact.
     *
     * @param rendered base rendered SQL
     * @return count query SQL
     */
    public static RenderedSql wrapCount(RenderedSql rendered) {
        Objects.requireNonNull(rendered, "rendered");
        String trimmed = rendered.sql().trim();
        if (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return new RenderedSql("SELECT COUNT(*) FROM (" + trimmed + ") count_src", rendered.binds());
    }

    /**
     * {@code ceil(totalRows / pageSize)}, or {@code 1} when the page size is not positive.
     */
    public static long totalPages(long totalRows, int pageSize) {
        if (pageSize <= 0) {
            return 1;
        }
        return (totalRows + pageSize - 1) / pageSize;
    }
}
