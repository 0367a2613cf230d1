package io.lighting.metakit.page;

public enum PaginationMode {
    /**
     * Skip-count plus row limit.
     */
    OFFSET,
    /**
     * Keyset comparison on a cursor field plus row limit.
     */
    CURSOR
}
