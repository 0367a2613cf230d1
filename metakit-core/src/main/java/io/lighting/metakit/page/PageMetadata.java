package io.lighting.metakit.page;

import io.lighting.metakit.validate.MetadataValidator;
import io.lighting.metakit.validate.ValidationResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pagination, sorting and field-selection state of one request.
 * <p>
 * Callers fill the request fields ({@code page}, {@code pageSize}, sort, cursor,
 * selected fields, validation rules); the paginator fills the derived fields
 * ({@code totalRows}, {@code totalPages}, {@code hasNext}, {@code hasPrevious},
 * {@code fromRow}, {@code toRow}) and the next cursor. Derived fields are only
 * meaningful after {@code totalRows} has been set and {@link #normalize()} ran.
 * <p>
 * Instances are mutable and belong to a single request; they are not thread-safe.
 */
public final class PageMetadata {
    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int MAX_PAGE_SIZE = 100;
    public static final String ALL_FIELDS = "*";

    private int page;
    private int pageSize;
    private String sort = "";
    private String sortDirection = "";
    private String cursor = "";
    private String cursorField = "";
    private String cursorOrder = "";
    private final Set<String> selectedFields = new LinkedHashSet<>();
    private final Map<String, String> validationRules = new LinkedHashMap<>();
    private boolean debug;

    private long totalRows;
    private long totalPages;
    private boolean hasNext;
    private boolean hasPrevious;
    private long fromRow;
    private long toRow;

    /**
     * Metadata with zero values, as produced by binding an empty request.
     * Use {@link #create()} for the usual defaults.
     */
    public PageMetadata() {
    }

    /**
     * Metadata with page 1, page size 10 and ascending sort.
     */
    public static PageMetadata create() {
        return new PageMetadata()
            .withPage(1)
            .withPageSize(DEFAULT_PAGE_SIZE)
            .withSortDirection(SortDirection.ASC.keyword());
    }

    public PageMetadata withPage(int page) {
        this.page = page;
        return this;
    }

    public PageMetadata withPageSize(int pageSize) {
        this.pageSize = pageSize;
        return this;
    }

    public PageMetadata withSort(String sort) {
        this.sort = emptyIfNull(sort);
        return this;
    }

    public PageMetadata withSortDirection(String sortDirection) {
        this.sortDirection = emptyIfNull(sortDirection);
        return this;
    }

    public PageMetadata withSortDirection(SortDirection sortDirection) {
        Objects.requireNonNull(sortDirection, "sortDirection");
        return withSortDirection(sortDirection.keyword());
    }

    public PageMetadata withCursor(String cursor) {
        this.cursor = emptyIfNull(cursor);
        return this;
    }

    public PageMetadata withCursorField(String cursorField) {
        this.cursorField = emptyIfNull(cursorField);
        return this;
    }

    public PageMetadata withCursorOrder(String cursorOrder) {
        this.cursorOrder = emptyIfNull(cursorOrder);
        return this;
    }

    public PageMetadata withCursorOrder(SortDirection cursorOrder) {
        Objects.requireNonNull(cursorOrder, "cursorOrder");
        return withCursorOrder(cursorOrder.keyword());
    }

    /**
     * Replaces the selected fields, keeping their order and dropping duplicates.
     */
    public PageMetadata withFields(String... fields) {
        selectedFields.clear();
        if (fields != null) {
            for (String field : fields) {
                if (field != null && !field.isBlank()) {
                    selectedFields.add(field.trim());
                }
            }
        }
        return this;
    }

    /**
     * Adds a declarative rule such as {@code max:50} or {@code in:name,email} for
     * {@code page_size}, {@code sort} or {@code fields}. A later rule for the same field
     * replaces the earlier one.
     */
    public PageMetadata withValidationRule(String field, String rule) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(rule, "rule");
        validationRules.put(field, rule);
        return this;
    }

    public PageMetadata withDebug(boolean debug) {
        this.debug = debug;
        return this;
    }

    /**
     * Sets the row total. Treated as untrusted until a count query set it.
     */
    public PageMetadata withTotalRows(long totalRows) {
        this.totalRows = totalRows;
        return this;
    }

    /**
     * Clamps the request fields into range and recomputes the derived fields.
     * <p>
     * Page below 1 becomes 1; page size below 1 becomes 10 and above 100 becomes 100;
     * a blank or unknown sort direction becomes {@code asc}; an unknown cursor order is
     * cleared. Derived fields are computed only when {@code totalRows > 0}, otherwise
     * they are reset to zero. Calling it twice has no further effect.
     */
    public PageMetadata normalize() {
        if (page < 1) {
            page = 1;
        }
        if (pageSize < 1) {
            pageSize = DEFAULT_PAGE_SIZE;
        } else if (pageSize > MAX_PAGE_SIZE) {
            pageSize = MAX_PAGE_SIZE;
        }
        sortDirection = SortDirection.parse(sortDirection, SortDirection.ASC).keyword();
        SortDirection order = SortDirection.parse(cursorOrder);
        cursorOrder = order == null ? "" : order.keyword();

        if (totalRows > 0) {
            totalPages = PageSql.totalPages(totalRows, pageSize);
            hasNext = page < totalPages;
            hasPrevious = page > 1;
            fromRow = (long) (page - 1) * pageSize + 1;
            toRow = Math.min((long) page * pageSize, totalRows);
        } else {
            totalPages = 0;
            hasNext = false;
            hasPrevious = false;
            fromRow = 0;
            toRow = 0;
        }
        return this;
    }

    /**
     * Checks the built-in constraints and the declarative rules without changing state.
     */
    public ValidationResult validate() {
        return MetadataValidator.validate(this);
    }

    public PaginationMode paginationMode() {
        if (!cursor.isEmpty() || !cursorField.isEmpty()) {
            return PaginationMode.CURSOR;
        }
        return PaginationMode.OFFSET;
    }

    public boolean isCursorBased() {
        return paginationMode() == PaginationMode.CURSOR;
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    public int limit() {
        return pageSize;
    }

    /**
     * {@code "<field> <direction>"}, or an empty string when no sort field is set.
     */
    public String sortClause() {
        if (sort.isEmpty()) {
            return "";
        }
        return sort + " " + sortDirection;
    }

    /**
     * The selected fields, or {@code ["*"]} when none were selected.
     */
    public List<String> selectedFieldsOrAll() {
        if (selectedFields.isEmpty()) {
            return List.of(ALL_FIELDS);
        }
        return List.copyOf(selectedFields);
    }

    public boolean selectsAllFields() {
        return selectedFields.isEmpty() || selectedFields.contains(ALL_FIELDS);
    }

    public SortDirection sortDirectionValue() {
        return SortDirection.parse(sortDirection, SortDirection.ASC);
    }

    public SortDirection cursorOrderValue() {
        return SortDirection.parse(cursorOrder, SortDirection.ASC);
    }

    public int getPage() {
        return page;
    }

    public int getPageSize() {
        return pageSize;
    }

    public String getSort() {
        return sort;
    }

    public String getSortDirection() {
        return sortDirection;
    }

    public String getCursor() {
        return cursor;
    }

    public String getCursorField() {
        return cursorField;
    }

    public String getCursorOrder() {
        return cursorOrder;
    }

    public Set<String> getSelectedFields() {
        return Collections.unmodifiableSet(selectedFields);
    }

    public Map<String, String> getValidationRules() {
        return Collections.unmodifiableMap(validationRules);
    }

    public boolean isDebug() {
        return debug;
    }

    public long getTotalRows() {
        return totalRows;
    }

    public long getTotalPages() {
        return totalPages;
    }

    public boolean isHasNext() {
        return hasNext;
    }

    public boolean isHasPrevious() {
        return hasPrevious;
    }

    public long getFromRow() {
        return fromRow;
    }

    public long getToRow() {
        return toRow;
    }

    void setTotalPages(long totalPages) {
        this.totalPages = totalPages;
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        parts.add("page=" + page);
        parts.add("pageSize=" + pageSize);
        if (!sort.isEmpty()) {
            parts.add("sort=" + sortClause());
        }
        if (isCursorBased()) {
            parts.add("cursorField=" + cursorField);
            parts.add("cursorOrder=" + cursorOrder);
            parts.add("cursor=" + cursor);
        }
        parts.add("totalRows=" + totalRows);
        parts.add("totalPages=" + totalPages);
        return "PageMetadata{" + String.join(", ", parts) + "}";
    }

    private static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }
}
