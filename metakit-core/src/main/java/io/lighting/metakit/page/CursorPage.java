package io.lighting.metakit.page;

import java.util.List;
import java.util.Objects;

/**
 * Cursor-style view of a page.
 *
 * @param items      current page items
 * @param nextCursor token for the next page, empty when there is none
 * @param prevCursor token for the previous page; backwards cursors are not produced, so
 *                   this stays empty unless the caller supplies one
 * @param hasMore    a next page exists
 * @param <T>        element type
 */
public record CursorPage<T>(List<T> items, String nextCursor, String prevCursor, boolean hasMore) {
    public CursorPage {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(nextCursor, "nextCursor");
        Objects.requireNonNull(prevCursor, "prevCursor");
        items = List.copyOf(items);
    }

    public static <T> CursorPage<T> of(List<T> items, PageMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        String next = metadata.getCursor();
        return new CursorPage<>(items, next, "", !next.isEmpty());
    }
}
