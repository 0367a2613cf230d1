package io.lighting.metakit.validate;

public enum ErrorCode {
    INVALID_PAGE,
    INVALID_PAGE_SIZE,
    PAGE_SIZE_TOO_LARGE,
    INVALID_SORT_DIRECTION,
    MISSING_CURSOR_FIELD,
    INVALID_CURSOR_ORDER,
    PAGE_SIZE_EXCEEDS_MAX,
    PAGE_SIZE_BELOW_MIN,
    INVALID_SORT_FIELD,
    INVALID_SELECTED_FIELD,
    INVALID_VALIDATION_RULE
}
