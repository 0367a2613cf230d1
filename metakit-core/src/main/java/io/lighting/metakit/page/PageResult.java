package io.lighting.metakit.page;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one page and its numbers.
 *
 * @param items       current page items
 * @param page        1-based page index
 * @param pageSize    page size
 * @param totalRows   rows matching the query
 * @param totalPages  pages at this page size
 * @param hasNext     a later page exists
 * @param hasPrevious an earlier page exists
 * @param nextCursor  cursor for the following page, empty outside cursor mode
 * @param <T>         element type
 */
public record PageResult<T>(
    List<T> items,
    int page,
    int pageSize,
    long totalRows,
    long totalPages,
    boolean hasNext,
    boolean hasPrevious,
    String nextCursor
) {
    public PageResult {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(nextCursor, "nextCursor");
        items = List.copyOf(items);
    }

    public static <T> PageResult<T> of(List<T> items, PageMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        String next = metadata.isCursorBased() ? metadata.getCursor() : "";
        return new PageResult<>(
            items,
            metadata.getPage(),
            metadata.getPageSize(),
            metadata.getTotalRows(),
            metadata.getTotalPages(),
            metadata.isHasNext(),
            metadata.isHasPrevious(),
            next
        );
    }
}
