import io.github.flameyossnowy.querycraft.api.aggregate.Aggregate;
import io.github.flameyossnowy.querycraft.api.expression.Expression;
import io.github.flameyossnowy.querycraft.api.filter.Q;
import io.github.flameyossnowy.querycraft.api.utils.Logging;
import io.github.flameyossnowy.querycraft.sql.internals.QueryEngine;
import io.github.flameyossnowy.querycraft.sql.internals.query.ParameterizedSql;
import io.github.flameyossnowy.querycraft.sql.internals.query.QueryModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs compiled statements against an in-memory SQLite database.
 *
 * <p>Three orders: order 1 (PAID, 100, customer Ann, payment 20, two items),
 * order 2 (PAID, 40, no customer, payment 30, one item) and order 3 (NEW, 10,
 * customer Ann, no payment, no items).</p>
 */
class SqliteConditionalAggregateTest {
    QueryEngine engine = ShopSchema.engine(QueryEngine.SQLType.SQLITE);
    Connection connection;

    @BeforeAll
    static void enableLogging() {
        Logging.ENABLED = true;
    }

    @BeforeEach
    void createDatabase() throws SQLException {
        connection = DriverManager.getConnection("jdbc:sqlite::memory:");
        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE regions (id INTEGER PRIMARY KEY, name TEXT)");
            statement.execute("CREATE TABLE customers (id INTEGER PRIMARY KEY, name TEXT, region_id INTEGER)");
            statement.execute("CREATE TABLE payments (id INTEGER PRIMARY KEY, amount INTEGER)");
            statement.execute("CREATE TABLE orders (order_id INTEGER PRIMARY KEY, status TEXT, amount INTEGER, "
                + "created TEXT, customer_id INTEGER, payment_id INTEGER)");
            statement.execute("CREATE TABLE order_items (id INTEGER PRIMARY KEY, order_id INTEGER NOT NULL, sku TEXT, quantity INTEGER)");

            statement.execute("INSERT INTO customers VALUES (1, 'Ann', NULL)");
            statement.execute("INSERT INTO payments VALUES (1, 20), (2, 30)");
            statement.execute("INSERT INTO orders VALUES (1, 'PAID', 100, '2024-01-01 10:00:00', 1, 1), "
                + "(2, 'PAID', 40, NULL, NULL, 2), (3, 'NEW', 10, '2024-01-03 10:00:00', 1, NULL)");
            statement.execute("INSERT INTO order_items VALUES (1, 1, 'a', 1), (2, 1, 'b', 2), (3, 2, 'a', 5)");
        }
    }

    @AfterEach
    void closeDatabase() throws SQLException {
        connection.close();
    }

    @Test
    void nullable_relation_sum_keeps_rows_without_match() throws SQLException {
        QueryModel query = engine.query("orders");
        engine.addAggregate(query, Aggregate.sum("payment__amount"), "total", true);

        List<Object> row = single(engine.compileAggregation(query));

        assertEquals(50L, ((Number) row.get(0)).longValue());
    }

    @Test
    void conditional_count() throws SQLException {
        QueryModel query = engine.query("orders");
        engine.addAggregate(query, Aggregate.count("pk").only(Q.where("status", "PAID")), "paid", true);
        engine.addAggregate(query, Aggregate.countAll(), "orders_count", true);

        List<Object> row = single(engine.compileAggregation(query));

        assertEquals(2L, ((Number) row.get(0)).longValue());
        assertEquals(3L, ((Number) row.get(1)).longValue());
    }

    @Test
    void condition_through_relation_does_not_drop_other_rows() throws SQLException {
        QueryModel query = engine.query("orders");
        engine.addAggregate(query, Aggregate.countAll(), "orders_count", true);
        engine.addAggregate(query, Aggregate.sum("amount").only(Q.where("customer__name", "Ann")), "ann_total", true);

        List<Object> row = single(engine.compileAggregation(query));

        assertEquals(3L, ((Number) row.get(0)).longValue());
        assertEquals(110L, ((Number) row.get(1)).longValue());
    }

    @Test
    void condition_never_matching_gives_null() throws SQLException {
        QueryModel query = engine.query("orders");
        engine.addAggregate(query, Aggregate.sum("amount").only(Q.where("status", "REFUNDED")), "refunded", true);

        List<Object> row = single(engine.compileAggregation(query));

        assertNull(row.get(0));
    }

    @Test
    void summary_over_grouped_annotation() throws SQLException {
        QueryModel query = engine.query("orders");
        engine.addAggregate(query, Aggregate.count("items"), "item_count", false);
        engine.addAggregate(query, Aggregate.sum("item_count"), "items_total", true);

        List<Object> row = single(engine.compileAggregation(query));

        assertEquals(3L, ((Number) row.get(0)).longValue());
    }

    @Test
    void filtered_and_limited_query() throws SQLException {
        QueryModel query = engine.query("orders");
        query.addFilter("status__iexact", "paid");
        query.addOrdering("-amount");
        query.setLimits(null, 1);
        engine.addAggregate(query, Aggregate.sum("amount"), "top_total", true);

        List<Object> row = single(engine.compileAggregation(query));

        assertEquals(100L, ((Number) row.get(0)).longValue());
    }

    @Test
    void having_filters_groups() throws SQLException {
        QueryModel query = engine.query("orders");
        query.addSelect("order_id");
        engine.addAggregate(query, Aggregate.count("items"), "item_count", false);
        query.addFilter("item_count__gte", 1);
        query.addOrdering("order_id");

        List<List<Object>> rows = run(engine.compile(query));

        assertEquals(2, rows.size());
        assertEquals(1L, ((Number) rows.get(0).get(0)).longValue());
        assertEquals(2L, ((Number) rows.get(0).get(1)).longValue());
        assertEquals(2L, ((Number) rows.get(1).get(0)).longValue());
    }

    @Test
    void negative_durations_shift_backwards() throws SQLException {
        QueryModel hourEarlier = engine.query("orders");
        hourEarlier.addFilter("created__gte", Expression.of("2024-01-01 11:00:00").plus(Duration.ofHours(-1)));
        engine.addAggregate(hourEarlier, Aggregate.countAll(), "matching", true);
        QueryModel fractional = engine.query("orders");
        fractional.addFilter("created__gt", Expression.of("2024-01-01 10:00:01").plus(Duration.ofMillis(-1500)));
        engine.addAggregate(fractional, Aggregate.countAll(), "matching", true);

        assertEquals(2L, ((Number) single(engine.compileAggregation(hourEarlier)).get(0)).longValue());
        assertEquals(2L, ((Number) single(engine.compileAggregation(fractional)).get(0)).longValue());
    }

    @Test
    void demoting_keeps_rows_an_isnull_filter_needs() throws SQLException {
        QueryModel query = engine.query("orders");
        query.addFilter("customer__name__isnull", true);
        engine.addAggregate(query, Aggregate.countAll(), "without_customer", true);

        query.demoteJoins(List.of("customers"));

        assertEquals(1L, ((Number) single(engine.compileAggregation(query)).get(0)).longValue());
    }

    private List<Object> single(ParameterizedSql sql) throws SQLException {
        List<List<Object>> rows = run(sql);
        assertEquals(1, rows.size());
        return rows.get(0);
    }

    private List<List<Object>> run(ParameterizedSql sql) throws SQLException {
        assertEquals(ShopSchema.placeholders(sql.sql(), "?"), sql.params().size());
        try (PreparedStatement statement = connection.prepareStatement(sql.sql())) {
            for (int i = 0; i < sql.params().size(); i++) {
                statement.setObject(i + 1, sql.params().get(i));
            }
            List<List<Object>> rows = new ArrayList<>();
            try (ResultSet result = statement.executeQuery()) {
                int columns = result.getMetaData().getColumnCount();
                while (result.next()) {
                    List<Object> row = new ArrayList<>(columns);
                    for (int i = 1; i <= columns; i++) {
                        row.add(result.getObject(i));
                    }
                    rows.add(row);
                }
            }
            return rows;
        }
    }
}
