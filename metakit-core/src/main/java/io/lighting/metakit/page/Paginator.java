package io.lighting.metakit.page;

import io.lighting.metakit.cursor.CursorCodec;
import io.lighting.metakit.cursor.CursorKeyExtractor;
import io.lighting.metakit.cursor.InvalidCursorException;
import io.lighting.metakit.cursor.InvalidCursorPolicy;
import io.lighting.metakit.db.PaginationObserver;
import io.lighting.metakit.db.QueryOperation;
import io.lighting.metakit.db.SqlLog;
import io.lighting.metakit.optimize.QueryOptimizer;
import io.lighting.metakit.query.ComparisonOperator;
import io.lighting.metakit.query.PageableQuery;
import io.lighting.metakit.query.TableQuery;
import io.lighting.metakit.sql.Dialect;
import io.lighting.metakit.validate.ValidationResult;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one paginated fetch against a {@link PageableQuery}.
 * <p>
 * Each call walks validate, count, page and finalize:
 * <ol>
 *   <li>invalid metadata fails with {@link InvalidMetadataException} before any query;</li>
 *   <li>the row total comes from the query itself or from a separate count query;</li>
 *   <li>offset mode orders by the sort field and applies offset and limit; cursor mode
 *   orders by the cursor field and, past the first page, filters on the decoded cursor
 *   value;</li>
 *   <li>the metadata is normalized against the total and, in cursor mode, receives the
 *   cursor of the next page.</li>
 * </ol>
 * Database errors are rethrown unchanged. A cursor that cannot be decoded is handled
 * by the configured {@link InvalidCursorPolicy}, {@code IGNORE} by default.
 * <p>
 * Instances are immutable and can be shared; the metadata passed in belongs to the
 * calling request and is updated in place.
 */
public final class Paginator {
    private final List<PaginationObserver> observers;
    private final SqlLog debugLog;
    private final InvalidCursorPolicy invalidCursorPolicy;
    private final Dialect dialect;

    private Paginator(Builder builder) {
        this.observers = List.copyOf(builder.observers);
        this.debugLog = builder.debugLog;
        this.invalidCursorPolicy = builder.invalidCursorPolicy;
        this.dialect = builder.dialect;
    }

    public static Paginator create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public InvalidCursorPolicy invalidCursorPolicy() {
        return invalidCursorPolicy;
    }

    /**
     * @return the configured dialect, or {@code null} when none was set
     */
    public Dialect dialect() {
        return dialect;
    }

    public <T> List<T> paginate(PageableQuery<T> query, PageMetadata metadata) throws SQLException {
        return paginateWithCount(query, query, metadata, CursorKeyExtractor.reflective());
    }

    public <T> List<T> paginate(
        PageableQuery<T> query,
        PageMetadata metadata,
        CursorKeyExtractor<? super T> extractor
    ) throws SQLException {
        return paginateWithCount(query, query, metadata, extractor);
    }

    /**
     * Like {@link #paginate(PageableQuery, PageMetadata)}, with the total taken from
     * {@code countQuery}. Useful when the fetched rows and the rows that should be counted
     * differ, for example when a join fans rows out.
     */
    public <T> List<T> paginateWithCount(
        PageableQuery<T> query,
        PageableQuery<?> countQuery,
        PageMetadata metadata
    ) throws SQLException {
        return paginateWithCount(query, countQuery, metadata, CursorKeyExtractor.reflective());
    }

    public <T> List<T> paginateWithCount(
        PageableQuery<T> query,
        PageableQuery<?> countQuery,
        PageMetadata metadata,
        CursorKeyExtractor<? super T> extractor
    ) throws SQLException {
        return doPaginate(query, countQuery, metadata, extractor, dialect);
    }

    private <T> List<T> doPaginate(
        PageableQuery<T> query,
        PageableQuery<?> countQuery,
        PageMetadata metadata,
        CursorKeyExtractor<? super T> extractor,
        Dialect target
    ) throws SQLException {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(countQuery, "countQuery");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(extractor, "extractor");
        ObservedRun run = ObservedRun.start(observers, debugLog, metadata);

        ValidationResult validation = metadata.validate();
        if (!validation.isValid()) {
            throw new InvalidMetadataException(validation);
        }

        long total = run.execute(
            QueryOperation.COUNT,
            PaginationStage.VALIDATED,
            countQuery.renderCount(),
            countQuery::count,
            count -> 1
        );
        metadata.withTotalRows(total);

        PageableQuery<T> paged = apply(query, metadata, target);
        List<T> items = run.execute(
            QueryOperation.FETCH,
            PaginationStage.COUNTED,
            paged.render(),
            paged::fetch,
            List::size
        );

        metadata.normalize();
        if (metadata.isCursorBased()) {
            metadata.withCursor(nextCursor(items, metadata, extractor));
        }
        run.finish(metadata);
        return items;
    }

    /**
     * Paginates and returns the items together with the final page numbers.
     */
    public <T> PageResult<T> page(PageableQuery<T> query, PageMetadata metadata) throws SQLException {
        List<T> items = paginate(query, metadata);
        return PageResult.of(items, metadata);
    }

    /**
     * Applies the optimizer's index hint and statement limits, then paginates.
     */
    public <T> List<T> optimizedPaginate(
        TableQuery<T> query,
        Dialect dialect,
        PageMetadata metadata,
        QueryOptimizer optimizer
    ) throws SQLException {
        Objects.requireNonNull(optimizer, "optimizer");
        Objects.requireNonNull(dialect, "dialect");
        TableQuery<T> optimized = optimizer.applyTo(query, dialect);
        return doPaginate(optimized, optimized, metadata, CursorKeyExtractor.reflective(), dialect);
    }

    /**
     * Normalizes the metadata and derives the page query without running it: field
     * selection, then the offset or cursor strategy. Validation and counting are left to
     * the caller.
     *
     * @throws InvalidCursorException when the cursor cannot be decoded and the policy is
     *                                {@link InvalidCursorPolicy#FAIL}
     */
    public <T> PageableQuery<T> apply(PageableQuery<T> query, PageMetadata metadata) {
        return apply(query, metadata, dialect);
    }

    private <T> PageableQuery<T> apply(PageableQuery<T> query, PageMetadata metadata, Dialect target) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(metadata, "metadata");
        metadata.normalize();
        PageableQuery<T> paged = query;
        if (!metadata.selectsAllFields()) {
            paged = paged.select(metadata.selectedFieldsOrAll());
        }
        if (metadata.isCursorBased()) {
            return applyCursor(paged, metadata, target);
        }
        if (!metadata.getSort().isEmpty()) {
            paged = paged.orderBy(metadata.getSort(), metadata.sortDirectionValue());
        }
        return paged.offsetLimit(metadata.offset(), metadata.limit());
    }

    private <T> PageableQuery<T> applyCursor(PageableQuery<T> query, PageMetadata metadata, Dialect target) {
        String cursorField = metadata.getCursorField();
        SortDirection order = metadata.cursorOrderValue();
        PageableQuery<T> paged = query;
        if (!metadata.getCursor().isEmpty()) {
            String value = decodeCursor(metadata);
            if (value != null) {
                Object bound = target == null ? value : target.cursorBind(value);
                paged = paged.where(cursorField, ComparisonOperator.after(order), bound);
            }
        }
        return paged.orderBy(cursorField, order).limit(metadata.limit());
    }

    /**
     * @return the comparison value, or {@code null} to run without a cursor condition
     */
    private String decodeCursor(PageMetadata metadata) {
        String cursor = metadata.getCursor();
        try {
            Map<String, String> values = CursorCodec.decodeValues(cursor);
            restorePage(metadata, values.get(CursorKeyExtractor.KEY_PAGE));
            return CursorCodec.comparisonValue(cursor, metadata.getCursorField());
        } catch (InvalidCursorException ex) {
            if (invalidCursorPolicy == InvalidCursorPolicy.FAIL) {
                throw ex;
            }
            return null;
        }
    }

    // The token records the page it was issued on; the page it leads to is the next one.
    private static void restorePage(PageMetadata metadata, String issuedOn) {
        if (issuedOn == null) {
            return;
        }
        try {
            int page = Integer.parseInt(issuedOn);
            if (page >= 1 && page < Integer.MAX_VALUE) {
                metadata.withPage(page + 1);
            }
        } catch (NumberFormatException ex) {
            throw new InvalidCursorException("cursor page is not a number: " + issuedOn, ex);
        }
    }

    private static <T> String nextCursor(
        List<T> items,
        PageMetadata metadata,
        CursorKeyExtractor<? super T> extractor
    ) {
        if (!metadata.isHasNext() || items.isEmpty() || items.size() < metadata.limit()) {
            return "";
        }
        T last = items.get(items.size() - 1);
        try {
            return CursorCodec.encode(extractor.extract(last, metadata));
        } catch (IllegalArgumentException ex) {
            throw new PaginationException(PaginationStage.PAGINATED, "Failed to build next cursor", ex);
        }
    }

    public static final class Builder {
        private final List<PaginationObserver> observers = new ArrayList<>();
        private SqlLog debugLog = SqlLog.debug(System.out::println);
        private InvalidCursorPolicy invalidCursorPolicy = InvalidCursorPolicy.IGNORE;
        private Dialect dialect;

        public Builder observer(PaginationObserver observer) {
            observers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        public Builder observers(List<? extends PaginationObserver> values) {
            Objects.requireNonNull(values, "observers");
            for (PaginationObserver observer : values) {
                observer(observer);
            }
            return this;
        }

        /**
         * Log used for requests whose metadata has the debug flag set.
         */
        public Builder debugLog(SqlLog debugLog) {
            this.debugLog = Objects.requireNonNull(debugLog, "debugLog");
            return this;
        }

        public Builder invalidCursorPolicy(InvalidCursorPolicy policy) {
            this.invalidCursorPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        /**
         * Dialect of the queries this paginator runs; decides how cursor values are bound.
         * Unset means plain text binds. {@code optimizedPaginate} uses its own argument.
         */
        public Builder dialect(Dialect dialect) {
            this.dialect = Objects.requireNonNull(dialect, "dialect");
            return this;
        }

        public Paginator build() {
            return new Paginator(this);
        }
    }
}
