import io.github.flameyossnowy.querycraft.api.aggregate.Aggregate;
import io.github.flameyossnowy.querycraft.api.exceptions.QueryCompilationException;
import io.github.flameyossnowy.querycraft.api.filter.Q;
import io.github.flameyossnowy.querycraft.api.utils.Logging;
import io.github.flameyossnowy.querycraft.sql.internals.QueryEngine;
import io.github.flameyossnowy.querycraft.sql.internals.query.ParameterizedSql;
import io.github.flameyossnowy.querycraft.sql.internals.query.QueryModel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectSqlBuilderTest {
    static final String ORDER_COLUMNS = "order_id, status, amount, created, customer_id, payment_id";

    QueryEngine engine = ShopSchema.generic();

    @BeforeAll
    static void setup() {
        Logging.ENABLED = true;
    }

    @Test
    void default_columns() {
        ParameterizedSql sql = engine.compile(engine.query("orders"));

        assertEquals("SELECT " + ORDER_COLUMNS + " FROM orders", sql.sql());
        assertTrue(sql.params().isEmpty());
    }

    @Test
    void ordering_and_window() {
        QueryModel query = engine.query("orders");
        query.addOrdering("-amount", "status");
        query.setLimits(5, 15);

        assertEquals("SELECT " + ORDER_COLUMNS + " FROM orders ORDER BY amount DESC, status ASC LIMIT 10 OFFSET 5",
            engine.compile(query).sql());
    }

    @Test
    void windows_narrow_each_other() {
        QueryModel query = engine.query("orders");
        query.setLimits(10, 30);
        query.setLimits(5, 50);

        assertEquals(15, query.lowMark());
        assertEquals(30, query.highMark());
        assertTrue(engine.compile(query).sql().endsWith(" LIMIT 15 OFFSET 15"));

        query.clearLimits();
        assertFalse(query.hasLimits());
    }

    @Test
    void offset_without_limit_uses_dialect_sentinel() {
        QueryModel sqlite = ShopSchema.engine(QueryEngine.SQLType.SQLITE).query("orders");
        sqlite.setLimits(5, null);
        QueryModel postgres = ShopSchema.engine(QueryEngine.SQLType.POSTGRESQL).query("orders");
        postgres.setLimits(5, null);
        QueryModel mysql = ShopSchema.engine(QueryEngine.SQLType.MYSQL).query("orders");
        mysql.setLimits(5, null);

        assertTrue(ShopSchema.engine(QueryEngine.SQLType.SQLITE).compile(sqlite).sql().endsWith(" LIMIT -1 OFFSET 5"));
        assertTrue(ShopSchema.engine(QueryEngine.SQLType.POSTGRESQL).compile(postgres).sql().endsWith("\"orders\" OFFSET 5"));
        assertTrue(ShopSchema.engine(QueryEngine.SQLType.MYSQL).compile(mysql).sql()
            .endsWith(" LIMIT 18446744073709551615 OFFSET 5"));
    }

    @Test
    void compiling_twice_gives_the_same_result() {
        QueryModel query = engine.query("orders");
        query.addFilter("customer__name__icontains", "ann");
        engine.addAggregate(query, Aggregate.count("order_id").only(Q.where("status", "PAID")), "paid", true);
        query.addOrdering("-created");

        ParameterizedSql first = engine.compile(query);
        ParameterizedSql second = engine.compile(query);
        ParameterizedSql aggregation = engine.compileAggregation(query);

        assertEquals(first, second);
        assertEquals(aggregation, engine.compileAggregation(query));
        assertEquals(first, engine.compile(query));
    }

    @Test
    void empty_select_is_rejected() {
        QueryModel query = engine.query("orders");
        query.addSelect();

        assertThrows(QueryCompilationException.class, () -> engine.compile(query));
    }

    @Test
    void single_phase_aggregation_drops_columns_and_ordering() {
        QueryModel query = engine.query("orders");
        query.addFilter("status", "PAID");
        query.addOrdering("amount");
        engine.addAggregate(query, Aggregate.sum("amount"), "total", true);

        ParameterizedSql sql = engine.compileAggregation(query);

        assertEquals("SELECT SUM(amount) AS total FROM orders WHERE status = %s", sql.sql());
        assertEquals(List.of("PAID"), sql.params());
        assertEquals(1, query.orderBy().size());
    }

    @Test
    void aggregation_without_summary_is_rejected() {
        QueryModel query = engine.query("orders");
        engine.addAggregate(query, Aggregate.count("items"), "item_count", false);

        assertThrows(IllegalArgumentException.class, () -> engine.compileAggregation(query));
    }

    @Test
    void distinct_query_aggregates_over_subquery() {
        QueryModel query = engine.query("orders");
        query.setDistinct(true);
        engine.addAggregate(query, Aggregate.sum("amount"), "total", true);

        ParameterizedSql sql = engine.compileAggregation(query);

        assertEquals("SELECT SUM(subquery.amount) AS total FROM (SELECT DISTINCT " + ORDER_COLUMNS
            + " FROM orders) subquery", sql.sql());
    }

    @Test
    void limited_query_keeps_ordering_in_subquery() {
        QueryModel query = engine.query("orders");
        query.addOrdering("-amount");
        query.setLimits(null, 3);
        engine.addAggregate(query, Aggregate.sum("amount").only(Q.where("status", "PAID")), "paid_total", true);

        ParameterizedSql sql = engine.compileAggregation(query);

        assertEquals("SELECT SUM(CASE WHEN subquery.status = %s THEN subquery.amount ELSE NULL END) AS paid_total FROM (SELECT "
            + ORDER_COLUMNS + " FROM orders ORDER BY amount DESC LIMIT 3) subquery", sql.sql());
        assertEquals(List.of("PAID"), sql.params());
    }

    @Test
    void subquery_must_output_aggregated_columns() {
        QueryModel query = engine.query("orders");
        query.setDistinct(true);
        engine.addAggregate(query, Aggregate.sum("payment__amount"), "total", true);

        assertThrows(QueryCompilationException.class, () -> engine.compileAggregation(query));
    }

    @Test
    void grouped_query_aggregates_annotation() {
        QueryModel query = engine.query("orders");
        engine.addAggregate(query, Aggregate.count("items"), "item_count", false);
        engine.addAggregate(query, Aggregate.sum("item_count"), "items_total", true);

        ParameterizedSql sql = engine.compileAggregation(query);

        assertTrue(sql.sql().startsWith("SELECT SUM(item_count) AS items_total FROM (SELECT "));
        assertTrue(sql.sql().contains("COUNT(order_items.id) AS item_count"));
        assertTrue(sql.sql().contains(" GROUP BY orders.order_id, "));
        assertTrue(sql.sql().endsWith(") subquery"));
    }

    @Test
    void select_list_becomes_grouping() {
        QueryModel query = engine.query("orders");
        query.addSelect("status");
        engine.addAggregate(query, Aggregate.count("items"), "item_count", false);

        ParameterizedSql sql = engine.compile(query);

        assertTrue(sql.sql().startsWith("SELECT orders.status, COUNT(order_items.id) AS item_count FROM orders LEFT OUTER JOIN order_items ON ("));
        assertTrue(sql.sql().endsWith(" GROUP BY orders.status"));
    }

    @Test
    void parameters_follow_clause_order() {
        QueryModel query = engine.query("orders");
        query.addExtraSelect("big", "amount > %s", 100);
        engine.addAggregate(query, Aggregate.countAll(), "n", false);
        query.addFilter("status", "PAID");
        query.addFilter("n__gt", 1);

        ParameterizedSql sql = engine.compile(query);

        assertTrue(sql.sql().startsWith("SELECT (amount > %s) AS big, " + ORDER_COLUMNS + ", COUNT(*) AS n FROM orders"));
        assertTrue(sql.sql().contains(" GROUP BY (amount > %s), order_id, "));
        assertTrue(sql.sql().endsWith(" HAVING COUNT(*) > %s"));
        assertEquals(List.of(100, "PAID", 100, 1), sql.params());
        assertEquals(ShopSchema.placeholders(sql.sql(), "%s"), sql.params().size());
    }

    @Test
    void ordering_by_aggregate_alias() {
        QueryModel query = engine.query("orders");
        engine.addAggregate(query, Aggregate.count("items"), "item_count", false);
        query.addOrdering("-item_count");

        assertTrue(engine.compile(query).sql().endsWith(" ORDER BY item_count DESC"));
    }

    @Test
    void mysql_quotes_with_backticks() {
        QueryEngine mysql = ShopSchema.engine(QueryEngine.SQLType.MYSQL);
        QueryModel query = mysql.query("orders");
        query.addSelect("status");
        query.addFilter("customer__name", "Ann");

        ParameterizedSql sql = mysql.compile(query);

        assertEquals("SELECT `orders`.`status` FROM `orders` INNER JOIN `customers` ON (`orders`.`customer_id` = `customers`.`id`) "
            + "WHERE `customers`.`name` = ?", sql.sql());
        assertEquals(List.of("Ann"), sql.params());
    }

    @Test
    void related_select_adds_target_columns() {
        QueryModel query = engine.query("orders");
        query.addSelect("order_id");
        query.addRelatedSelect("customer");

        assertEquals("SELECT orders.order_id, customers.id, customers.name, customers.region_id FROM orders "
            + "LEFT OUTER JOIN customers ON (orders.customer_id = customers.id)", engine.compile(query).sql());
        assertThrows(IllegalArgumentException.class, () -> query.addRelatedSelect("status"));
    }
}
