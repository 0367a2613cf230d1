package io.lighting.metakit.page;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.metakit.cursor.CursorCodec;
import io.lighting.metakit.cursor.InvalidCursorException;
import io.lighting.metakit.cursor.InvalidCursorPolicy;
import io.lighting.metakit.db.PaginationObserver;
import io.lighting.metakit.db.QueryOperation;
import io.lighting.metakit.db.SqlLog;
import io.lighting.metakit.jdbc.JdbcExecutor;
import io.lighting.metakit.jdbc.RowMappers;
import io.lighting.metakit.optimize.OptimizerConfig;
import io.lighting.metakit.optimize.QueryOptimizer;
import io.lighting.metakit.page.UserFixtures.User;
import io.lighting.metakit.query.PageableQuery;
import io.lighting.metakit.query.TableQuery;
import io.lighting.metakit.sql.Bind;
import io.lighting.metakit.sql.Dialect;
import io.lighting.metakit.sql.RenderedSql;
import io.lighting.metakit.validate.ErrorCode;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PaginatorH2Test {

    private JdbcExecutor executor;
    private TableQuery<User> users;

    @BeforeEach
    void setUp() throws SQLException {
        executor = new JdbcExecutor(UserFixtures.seededDataSource());
        users = TableQuery.from(executor, "users", User.class);
    }

    @Test
    void firstPageSortedByName() throws SQLException {
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withSort("name");

        List<User> page = Paginator.create().paginate(users, metadata);

        assertEquals(List.of("Alice Brown", "Bob Johnson"), names(page));
        assertEquals(5, metadata.getTotalRows());
        assertEquals(3, metadata.getTotalPages());
        assertTrue(metadata.isHasNext());
        assertFalse(metadata.isHasPrevious());
        assertEquals(1, metadata.getFromRow());
        assertEquals(2, metadata.getToRow());
        assertEquals("", metadata.getCursor());
    }

    @Test
    void lastPartialPage() throws SQLException {
        PageMetadata metadata = PageMetadata.create().withPage(2).withPageSize(3).withSort("name");

        List<User> page = Paginator.create().paginate(users, metadata);

        assertEquals(List.of("Jane Smith", "John Doe"), names(page));
        assertFalse(metadata.isHasNext());
        assertTrue(metadata.isHasPrevious());
        assertEquals(4, metadata.getFromRow());
        assertEquals(5, metadata.getToRow());
    }

    @Test
    void descendingSort() throws SQLException {
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withSort("age").withSortDirection("desc");

        List<User> page = Paginator.create().paginate(users, metadata);

        assertEquals(List.of("Bob Johnson", "Charlie Wilson"), names(page));
    }

    @Test
    void customCountQuery() throws SQLException {
        TableQuery<User> older = users.where("age > ?", 30);
        PageMetadata metadata = PageMetadata.create().withSort("age");

        List<User> page = Paginator.create().paginateWithCount(older, older, metadata);

        assertEquals(2, metadata.getTotalRows());
        assertEquals(List.of("Charlie Wilson", "Bob Johnson"), names(page));
    }

    @Test
    void countQueryMayDifferFromFetchedRows() throws SQLException {
        TableQuery<User> older = users.where("age > ?", 30);
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withSort("name");

        List<User> page = Paginator.create().paginateWithCount(users, older, metadata);

        assertEquals(2, metadata.getTotalRows());
        assertEquals(1, metadata.getTotalPages());
        assertEquals(List.of("Alice Brown", "Bob Johnson"), names(page));
    }

    @Test
    void selectedFieldsLeaveOthersUnset() throws SQLException {
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withSort("name").withFields("name", "email");

        List<User> page = Paginator.create().paginate(users, metadata);

        assertEquals(2, page.size());
        for (User user : page) {
            assertEquals(0L, user.id());
            assertEquals(0, user.age());
            assertFalse(user.email().isEmpty());
        }
    }

    @Test
    void invalidMetadataFailsBeforeAnyQuery() {
        RecordingObserver observer = new RecordingObserver();
        Paginator paginator = Paginator.builder().observer(observer).build();
        PageMetadata metadata = PageMetadata.create()
            .withPageSize(30)
            .withSort("invalid_field")
            .withValidationRule("page_size", "max:20")
            .withValidationRule("sort", "in:name,email,age");

        InvalidMetadataException ex = assertThrows(InvalidMetadataException.class, () -> paginator.paginate(users, metadata));

        assertTrue(ex.result().hasError(ErrorCode.PAGE_SIZE_EXCEEDS_MAX));
        assertTrue(ex.result().hasError(ErrorCode.INVALID_SORT_FIELD));
        assertTrue(observer.events.isEmpty());
    }

    @Test
    void disallowedSelectedFieldIsRejected() {
        PageMetadata metadata = PageMetadata.create()
            .withFields("id", "invalid_field")
            .withValidationRule("fields", "in:id,name,email,age");

        InvalidMetadataException ex = assertThrows(
            InvalidMetadataException.class,
            () -> Paginator.create().paginate(users, metadata)
        );

        assertTrue(ex.result().hasError(ErrorCode.INVALID_SELECTED_FIELD));
    }

    @Test
    void debugModeLogsWithoutChangingResults() throws SQLException {
        List<String> lines = new ArrayList<>();
        Paginator paginator = Paginator.builder().debugLog(SqlLog.debug(lines::add)).build();
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withSort("name").withDebug(true);

        List<User> page = paginator.paginate(users, metadata);

        assertEquals(2, page.size());
        assertTrue(lines.stream().anyMatch(line -> line.startsWith("DEBUG: [FETCH] SELECT * FROM users ORDER BY name asc")));
        assertTrue(lines.stream().anyMatch(line -> line.startsWith("DEBUG: [PAGE] page=1, page_size=2, total_rows=5, total_pages=3")));
    }

    @Test
    void debugLogStaysQuietWithoutFlag() throws SQLException {
        List<String> lines = new ArrayList<>();
        Paginator paginator = Paginator.builder().debugLog(SqlLog.debug(lines::add)).build();

        paginator.paginate(users, PageMetadata.create());

        assertTrue(lines.isEmpty());
    }

    @Test
    void observersSeeCountThenFetch() throws SQLException {
        RecordingObserver observer = new RecordingObserver();
        Paginator paginator = Paginator.builder().observer(observer).build();

        paginator.paginate(users, PageMetadata.create().withPageSize(2));

        assertEquals(
            List.of("before COUNT", "after COUNT 1", "before FETCH", "after FETCH 2", "page 1/3"),
            observer.events
        );
    }

    @Test
    void cursorPagesWalkForward() throws SQLException {
        Paginator paginator = Paginator.create();
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withCursorField("id").withCursorOrder("asc");

        List<User> first = paginator.paginate(users, metadata);
        String firstCursor = metadata.getCursor();
        List<User> second = paginator.paginate(users, metadata);
        String secondCursor = metadata.getCursor();
        List<User> third = paginator.paginate(users, metadata);

        assertEquals(List.of(1L, 2L), ids(first));
        assertEquals(List.of(3L, 4L), ids(second));
        assertEquals(List.of(5L), ids(third));
        assertEquals("2", CursorCodec.decodeValues(firstCursor).get("id"));
        assertEquals("1", CursorCodec.decodeValues(firstCursor).get("page"));
        assertNotEquals(firstCursor, secondCursor);
        assertEquals(3, metadata.getPage());
        assertFalse(metadata.isHasNext());
        assertEquals("", metadata.getCursor());
    }

    @Test
    void descendingCursorUsesLessThan() throws SQLException {
        Paginator paginator = Paginator.create();
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withCursorField("age").withCursorOrder("desc");

        List<User> first = paginator.paginate(users, metadata);
        List<User> second = paginator.paginate(users, metadata);

        assertEquals(List.of("Bob Johnson", "Charlie Wilson"), names(first));
        assertEquals(List.of("John Doe", "Alice Brown"), names(second));
        assertEquals("28", CursorCodec.decodeValues(metadata.getCursor()).get("age"));
    }

    @Test
    void cursorPageView() throws SQLException {
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withCursorField("id");

        List<User> items = Paginator.create().paginate(users, metadata);
        CursorPage<User> view = CursorPage.of(items, metadata);

        assertEquals(items, view.items());
        assertTrue(view.hasMore());
        assertEquals(metadata.getCursor(), view.nextCursor());
        assertEquals("", view.prevCursor());
    }

    @Test
    void mapRowsCarryCursorKeys() throws SQLException {
        TableQuery<Map<String, Object>> rows = TableQuery.from(executor, "users", RowMappers.asMap());
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withCursorField("created_at");

        List<Map<String, Object>> first = Paginator.create().paginate(rows, metadata);

        assertEquals(2, first.size());
        Map<String, String> cursor = CursorCodec.decodeValues(metadata.getCursor());
        assertEquals("2", cursor.get("id"));
        assertTrue(cursor.get("created_at").startsWith("2024-01-02"));
    }

    @Test
    void unreadableCursorIsIgnoredByDefault() throws SQLException {
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withCursorField("id").withCursor("%%not-base64%%");

        List<User> page = Paginator.create().paginate(users, metadata);

        assertEquals(List.of(1L, 2L), ids(page));
    }

    @Test
    void unreadableCursorFailsWhenConfigured() {
        Paginator paginator = Paginator.builder().invalidCursorPolicy(InvalidCursorPolicy.FAIL).build();
        PageMetadata metadata = PageMetadata.create().withCursorField("id").withCursor("%%not-base64%%");

        assertThrows(InvalidCursorException.class, () -> paginator.paginate(users, metadata));
    }

    @Test
    void extractorFailureIsReportedWithStage() {
        PageMetadata metadata = PageMetadata.create().withPageSize(2).withCursorField("id");

        PaginationException ex = assertThrows(
            PaginationException.class,
            () -> Paginator.create().paginate(users, metadata, (row, meta) -> {
                throw new IllegalArgumentException("no key");
            })
        );

        assertEquals(PaginationStage.PAGINATED, ex.stage());
        assertEquals("no key", ex.getCause().getMessage());
    }

    @Test
    void rowMappingFailureReportsCountedStage() {
        RecordingObserver observer = new RecordingObserver();
        Paginator paginator = Paginator.builder().observer(observer).build();
        TableQuery<User> broken = TableQuery.<User>from(executor, "users", rs -> {
            throw new IllegalStateException("unmappable row");
        });

        PaginationException ex = assertThrows(
            PaginationException.class,
            () -> paginator.paginate(broken, PageMetadata.create())
        );

        assertEquals(PaginationStage.COUNTED, ex.stage());
        assertEquals("unmappable row", ex.getCause().getMessage());
        assertEquals(List.of("before COUNT", "after COUNT 1", "before FETCH", "error FETCH"), observer.events);
    }

    @Test
    void countFailureReportsValidatedStage() {
        PageableQuery<?> failingCount = (PageableQuery<?>) Proxy.newProxyInstance(
            PageableQuery.class.getClassLoader(),
            new Class<?>[] { PageableQuery.class },
            new FailingCountHandler()
        );

        PaginationException ex = assertThrows(
            PaginationException.class,
            () -> Paginator.create().paginateWithCount(users, failingCount, PageMetadata.create())
        );

        assertEquals(PaginationStage.VALIDATED, ex.stage());
    }

    @Test
    void databaseErrorsPropagateAfterNotifyingObservers() {
        RecordingObserver observer = new RecordingObserver();
        Paginator paginator = Paginator.builder().observer(observer).build();
        TableQuery<User> missing = TableQuery.from(executor, "no_such_table", User.class);

        assertThrows(SQLException.class, () -> paginator.paginate(missing, PageMetadata.create()));
        assertEquals(List.of("before COUNT", "error COUNT"), observer.events);
    }

    @Test
    void pageResultSnapshot() throws SQLException {
        PageResult<User> result = Paginator.create().page(users, PageMetadata.create().withPage(3).withPageSize(2));

        assertEquals(1, result.items().size());
        assertEquals(3, result.page());
        assertEquals(5, result.totalRows());
        assertEquals(3, result.totalPages());
        assertFalse(result.hasNext());
        assertTrue(result.hasPrevious());
        assertEquals("", result.nextCursor());
    }

    @Test
    void optimizedPaginateAppliesHintAndLimits() throws SQLException {
        RecordingObserver observer = new RecordingObserver();
        Paginator paginator = Paginator.builder().observer(observer).build();
        QueryOptimizer optimizer = new QueryOptimizer(OptimizerConfig.defaults().withMaxRows(1));
        PageMetadata metadata = PageMetadata.create().withPageSize(3).withSort("name");

        List<User> page = paginator.optimizedPaginate(users.where("age > ?", 20), Dialect.POSTGRESQL, metadata, optimizer);

        assertEquals(1, page.size());
        assertEquals(5, metadata.getTotalRows());
        assertTrue(observer.fetchSql.contains("WHERE /*+ IndexScan(table_name idx_created_at) */ age > ?"));
    }

    @Test
    void applyBuildsQueryWithoutRunningIt() {
        PageMetadata metadata = PageMetadata.create().withCursorField("created_at").withCursorOrder("desc");

        RenderedSql rendered = Paginator.create().apply(users, metadata).render();

        assertEquals("SELECT * FROM users ORDER BY created_at desc LIMIT ?", rendered.sql());
    }

    @Test
    void applyAddsCursorCondition() {
        String cursor = CursorCodec.encode(Map.of("id", 4));
        PageMetadata metadata = PageMetadata.create().withPageSize(5).withCursorField("id").withCursor(cursor);

        RenderedSql rendered = Paginator.create().apply(users, metadata).render();

        assertEquals("SELECT * FROM users WHERE id > ? ORDER BY id asc LIMIT ?", rendered.sql());
        assertEquals(List.of(Bind.of("4"), Bind.of(5)), rendered.binds());
    }

    @Test
    void postgresCursorValueIsBoundUntyped() {
        String cursor = CursorCodec.encode(Map.of("id", 4));
        PageMetadata metadata = PageMetadata.create().withPageSize(5).withCursorField("id").withCursor(cursor);
        Paginator paginator = Paginator.builder().dialect(Dialect.POSTGRESQL).build();

        RenderedSql rendered = paginator.apply(users, metadata).render();

        assertEquals(Dialect.POSTGRESQL, paginator.dialect());
        assertEquals(List.of(new Bind.Value("4", Types.OTHER), Bind.of(5)), rendered.binds());
    }

    private static List<String> names(List<User> page) {
        return page.stream().map(User::name).toList();
    }

    private static List<Long> ids(List<User> page) {
        return page.stream().map(User::id).toList();
    }

    private static final class FailingCountHandler implements InvocationHandler {
        @Override
        public Object invoke(Object proxy, Method method, Object[] args) {
            return switch (method.getName()) {
                case "renderCount" -> RenderedSql.of("SELECT COUNT(*) FROM remote");
                case "count" -> throw new IllegalStateException("count backend unavailable");
                case "toString" -> "FailingCountQuery";
                case "hashCode" -> System.identityHashCode(proxy);
                case "equals" -> proxy == args[0];
                default -> throw new UnsupportedOperationException(method.getName());
            };
        }
    }

    private static final class RecordingObserver implements PaginationObserver {
        private final List<String> events = new ArrayList<>();
        private String fetchSql = "";

        @Override
        public void beforeExecute(QueryOperation operation, RenderedSql rendered) {
            events.add("before " + operation);
            if (operation == QueryOperation.FETCH) {
                fetchSql = rendered.sql();
            }
        }

        @Override
        public void afterExecute(QueryOperation operation, RenderedSql rendered, long elapsedNanos, int rowCount) {
            events.add("after " + operation + " " + rowCount);
        }

        @Override
        public void onExecuteError(QueryOperation operation, RenderedSql rendered, long elapsedNanos, Exception error) {
            events.add("error " + operation);
        }

        @Override
        public void afterPaginate(PageMetadata metadata, long elapsedNanos) {
            events.add("page " + metadata.getPage() + "/" + metadata.getTotalPages());
        }
    }
}
