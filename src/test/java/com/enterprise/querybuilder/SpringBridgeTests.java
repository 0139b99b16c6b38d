package com.enterprise.querybuilder;

import com.enterprise.querybuilder.builder.Placeholder;
import com.enterprise.querybuilder.builder.QueryBuilder;
import com.enterprise.querybuilder.builder.Separated;
import com.enterprise.querybuilder.builder.SqlResult;
import com.enterprise.querybuilder.core.Dialects;
import com.enterprise.querybuilder.spring.BatchQueryProvider;
import com.enterprise.querybuilder.spring.BatchReaderFactory;
import com.enterprise.querybuilder.spring.QueryProviderRegistry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.database.JdbcCursorItemReader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Built statements executed against an in-memory H2 database through
 * {@link JdbcTemplate} and Spring Batch's cursor reader.
 */
public class SpringBridgeTests {

    record Order(long id, String status, BigDecimal total) {}

    private static final RowMapper<Order> ORDER_MAPPER = (rs, i) -> new Order(
            rs.getLong("id"), rs.getString("status"), rs.getBigDecimal("total"));

    private EmbeddedDatabase db;
    private JdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        db = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build();
        jdbc = new JdbcTemplate(db);
        jdbc.execute("CREATE TABLE orders (id BIGINT PRIMARY KEY, status VARCHAR(20),"
                + " total DECIMAL(10, 2))");

        List<Order> seed = List.of(
                new Order(1, "PENDING", new BigDecimal("10.00")),
                new Order(2, "SHIPPED", new BigDecimal("25.50")),
                new Order(3, "PENDING", new BigDecimal("99.99")),
                new Order(4, "CANCELLED", new BigDecimal("5.00")));

        QueryBuilder insert = QueryBuilder.query(Dialects.ANSI, "INSERT INTO orders(id, status, total) ");
        insert.pushValues(seed, (row, o) -> row.pushBind(o.id()).pushBind(o.status()).pushBind(o.total()));
        SqlResult r = insert.build();

        int rows = jdbc.update(r.sql(), BatchReaderFactory.preparedStatementSetter(r));
        assertThat(rows).isEqualTo(4);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    // ==================== JdbcTemplate ====================

    @Test
    void testInListQuery() {
        QueryBuilder qb = QueryBuilder.query(Dialects.ANSI, "SELECT * FROM orders WHERE id IN (");
        Separated ids = qb.separated(", ");
        for (long id : new long[] {1, 3, 4}) {
            ids.pushBind(id);
        }
        ids.pushUnseparated(") ORDER BY id");
        SqlResult r = qb.build();

        List<Order> found = jdbc.query(r.sql(), BatchReaderFactory.preparedStatementSetter(r), ORDER_MAPPER);

        assertThat(found).extracting(Order::id).containsExactly(1L, 3L, 4L);
    }

    @Test
    void testNullBind() {
        QueryBuilder update = QueryBuilder.query(Dialects.ANSI, "UPDATE orders SET status = ");
        update.pushBind(null).push(" WHERE id = ").pushBind(4L);
        SqlResult r = update.build();
        jdbc.update(r.sql(), BatchReaderFactory.preparedStatementSetter(r));

        Integer nulls = jdbc.queryForObject("SELECT COUNT(*) FROM orders WHERE status IS NULL", Integer.class);
        assertThat(nulls).isEqualTo(1);
    }

    @Test
    void testMergedFragmentExecutes() {
        QueryBuilder filter = QueryBuilder.query(Dialects.ANSI, " AND total > ");
        filter.pushBind(new BigDecimal("50"));

        QueryBuilder qb = QueryBuilder.query(Dialects.ANSI, "SELECT * FROM orders WHERE status = ");
        qb.pushBind("PENDING").pushFragment(filter);
        SqlResult r = qb.build();

        List<Order> found = jdbc.query(r.sql(), BatchReaderFactory.preparedStatementSetter(r), ORDER_MAPPER);

        assertThat(found).extracting(Order::id).containsExactly(3L);
    }

    // ==================== Batch reader ====================

    @Test
    void testCursorReaderReadsBoundQuery() throws Exception {
        BatchReaderFactory factory = new BatchReaderFactory(db);
        factory.setFetchSize(2);

        BatchQueryProvider pending = params -> {
            QueryBuilder qb = QueryBuilder.query(Dialects.ANSI, "SELECT * FROM orders WHERE status = ");
            qb.pushBind(params.get("status")).push(" ORDER BY id");
            return qb.build();
        };

        JdbcCursorItemReader<Order> reader =
                factory.cursorReader("pendingReader", pending, ORDER_MAPPER, Map.of("status", "PENDING"));
        reader.afterPropertiesSet();
        reader.open(new ExecutionContext());

        List<Order> read = new ArrayList<>();
        try {
            Order o;
            while ((o = reader.read()) != null) {
                read.add(o);
            }
        } finally {
            reader.close();
        }

        assertThat(read).extracting(Order::id).containsExactly(1L, 3L);
        assertThat(reader.getSql()).isEqualTo("SELECT * FROM orders WHERE status = ? ORDER BY id");
    }

    @Test
    void testResolveQueryRejectsBrokenResult() {
        BatchReaderFactory factory = new BatchReaderFactory(db);
        BatchQueryProvider broken = params -> new SqlResult("SELECT * FROM orders WHERE id = $1",
                List.of(), List.of(new Placeholder(31, 33, 1)),
                Dialects.POSTGRES);

        assertThatThrownBy(() -> factory.resolveQuery(broken, Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("only 0");
    }

    @Test
    void testProviderBuildsFreshQueryEachCall() {
        BatchQueryProvider byStatus = params -> {
            QueryBuilder qb = QueryBuilder.query(Dialects.ANSI, "SELECT id FROM orders WHERE status = ");
            qb.pushBind(params.get("status"));
            return qb.build();
        };

        SqlResult a = byStatus.buildQuery(Map.of("status", "A"));
        SqlResult b = byStatus.buildQuery(Map.of("status", "B"));

        assertThat(a.toDebugString()).endsWith("'A'");
        assertThat(b.toDebugString()).endsWith("'B'");
    }

    // ==================== Registry ====================

    @Test
    void testRegistryRoundtrip() {
        QueryProviderRegistry registry = new QueryProviderRegistry();
        BatchQueryProvider all = params -> QueryBuilder.query(Dialects.ANSI, "SELECT * FROM orders").build();
        registry.register("allOrders", all);

        assertThat(registry.get("allOrders")).isSameAs(all);
        assertThat(registry.all()).containsOnlyKeys("allOrders");
        assertThatThrownBy(() -> registry.all().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testRegistryUnknownThrows() {
        QueryProviderRegistry registry = new QueryProviderRegistry();
        assertThatThrownBy(() -> registry.get("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void testRegistryLaterRegistrationWins() {
        QueryProviderRegistry registry = new QueryProviderRegistry();
        BatchQueryProvider first = params -> QueryBuilder.query(Dialects.ANSI, "SELECT 1").build();
        BatchQueryProvider second = params -> QueryBuilder.query(Dialects.ANSI, "SELECT 2").build();

        registry.register("q", first);
        registry.register("q", second);

        assertThat(registry.get("q")).isSameAs(second);
    }
}
