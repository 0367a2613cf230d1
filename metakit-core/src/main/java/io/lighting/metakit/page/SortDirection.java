package io.lighting.metakit.page;

public enum SortDirection {
    ASC("asc"),
    DESC("desc");

    private final String keyword;

    SortDirection(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Lower-case form used in rendered SQL and in {@link PageMetadata}.
     */
    public String keyword() {
        return keyword;
    }

    public static boolean isValid(String value) {
        return parse(value) != null;
    }

    /**
     * Parses exactly {@code asc} or {@code desc}. Other spellings such as {@code DESC}
     * or {@code " asc"} are not directions.
     *
     * @return the direction, or {@code null} when the value is not one of the two keywords
     */
    public static SortDirection parse(String value) {
        if (ASC.keyword.equals(value)) {
            return ASC;
        }
        if (DESC.keyword.equals(value)) {
            return DESC;
        }
        return null;
    }

    public static SortDirection parse(String value, SortDirection fallback) {
        SortDirection parsed = parse(value);
        return parsed == null ? fallback : parsed;
    }
}
