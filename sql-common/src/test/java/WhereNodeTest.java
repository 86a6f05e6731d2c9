import io.github.flameyossnowy.querycraft.api.aggregate.Aggregate;
import io.github.flameyossnowy.querycraft.api.expression.F;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;
import io.github.flameyossnowy.querycraft.api.filter.Q;
import io.github.flameyossnowy.querycraft.sql.internals.QueryEngine;
import io.github.flameyossnowy.querycraft.sql.internals.query.Col;
import io.github.flameyossnowy.querycraft.sql.internals.query.CompileContext;
import io.github.flameyossnowy.querycraft.sql.internals.query.Constraint;
import io.github.flameyossnowy.querycraft.sql.internals.query.ParameterizedSql;
import io.github.flameyossnowy.querycraft.sql.internals.query.QueryModel;
import io.github.flameyossnowy.querycraft.sql.internals.query.WhereNode;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WhereNodeTest {
    QueryEngine engine = ShopSchema.generic();

    private ParameterizedSql where(QueryModel query) {
        return query.where().asSql(new CompileContext(engine.getSqlType(), query.hasJoins()));
    }

    @Test
    void empty_tree_renders_nothing() {
        QueryModel query = engine.query("orders");

        assertTrue(query.where().isEmpty());
        assertTrue(where(query).isEmpty());
    }

    @Test
    void and_terms_are_flattened_and_parenthesised() {
        QueryModel query = engine.query("orders");

        query.addFilter("status", "PAID");
        query.addFilter("amount__lte", 100L);

        ParameterizedSql sql = where(query);
        assertEquals("(status = %s AND amount <= %s)", sql.sql());
        assertEquals(List.of("PAID", 100L), sql.params());
    }

    @Test
    void or_and_not() {
        QueryModel query = engine.query("orders");

        query.addQ(Q.where("status", "NEW").or(Q.where("amount__gt", 100L)));
        query.addQ(Q.where("status", "CANCELLED").not());

        assertEquals("((status = %s OR amount > %s) AND NOT (status = %s))", where(query).sql());
        assertEquals(List.of("NEW", 100L, "CANCELLED"), where(query).params());
    }

    @Test
    void null_value_becomes_is_null() {
        QueryModel query = engine.query("orders");

        query.addFilter("customer", null);
        query.addFilter("created__isnull", false);

        ParameterizedSql sql = where(query);
        assertEquals("(customer_id IS NULL AND created IS NOT NULL)", sql.sql());
        assertTrue(sql.params().isEmpty());
    }

    @Test
    void empty_in_list_matches_nothing() {
        QueryModel query = engine.query("orders");

        query.addFilter("status__in", List.of());

        assertEquals("1 = 0", where(query).sql());
        assertTrue(where(query).params().isEmpty());
    }

    @Test
    void in_accepts_arrays_and_range_takes_two_bounds() {
        QueryModel query = engine.query("orders");

        query.addFilter("status__in", new String[] {"NEW", "PAID"});
        query.addFilter("amount__range", List.of(10L, 20L));

        assertEquals("(status IN (%s, %s) AND amount BETWEEN %s AND %s)", where(query).sql());
        assertEquals(List.of("NEW", "PAID", 10L, 20L), where(query).params());

        assertThrows(IllegalArgumentException.class, () -> query.addFilter("amount__range", List.of(1L)));
        assertThrows(IllegalArgumentException.class, () -> query.addFilter("created__isnull", "yes"));
    }

    @Test
    void pattern_lookups_escape_their_value() {
        QueryModel query = engine.query("orders");

        query.addFilter("status__contains", "50%_off");
        query.addFilter("status__istartswith", "pa");

        ParameterizedSql sql = where(query);
        assertEquals("(status LIKE %s ESCAPE '\\' AND UPPER(status) LIKE UPPER(%s) ESCAPE '\\')", sql.sql());
        assertEquals(List.of("%50\\%\\_off%", "pa%"), sql.params());
    }

    @Test
    void postgres_casts_text_lookups() {
        QueryEngine postgres = ShopSchema.engine(QueryEngine.SQLType.POSTGRESQL);
        QueryModel query = postgres.query("orders");

        query.addFilter("status__icontains", "paid");
        query.addFilter("status__iexact", "New");

        ParameterizedSql sql = query.where().asSql(new CompileContext(postgres.getSqlType(), false));
        assertEquals("(UPPER(\"status\"::text) LIKE UPPER(?) AND UPPER(\"status\"::text) = UPPER(?))", sql.sql());
        assertEquals(List.of("%paid%", "New"), sql.params());
    }

    @Test
    void temporal_values_are_cast_on_sqlite() {
        QueryEngine sqlite = ShopSchema.engine(QueryEngine.SQLType.SQLITE);
        QueryModel query = sqlite.query("orders");
        LocalDateTime since = LocalDateTime.of(2024, 1, 1, 0, 0);

        query.addFilter("created__gte", since);

        ParameterizedSql sql = query.where().asSql(new CompileContext(sqlite.getSqlType(), false));
        assertEquals("\"created\" >= datetime(?)", sql.sql());
        assertEquals(List.of(since), sql.params());
    }

    @Test
    void expression_right_hand_side_is_not_cast() {
        QueryEngine sqlite = ShopSchema.engine(QueryEngine.SQLType.SQLITE);
        QueryModel query = sqlite.query("orders");

        query.addFilter("amount__gt", F.of("payment__amount"));

        ParameterizedSql sql = query.where().asSql(new CompileContext(sqlite.getSqlType(), query.hasJoins()));
        assertEquals("\"orders\".\"amount\" > \"payments\".\"amount\"", sql.sql());
        assertTrue(sql.params().isEmpty());
    }

    @Test
    void aggregate_filters_go_to_having() {
        QueryModel query = engine.query("orders");
        query.addAggregate(Aggregate.count("items"), "item_count", false);

        query.addQ(Q.where("item_count__gt", 1).or(Q.where("status", "NEW")));
        query.addFilter("amount__gt", 5L);

        ParameterizedSql having = query.having().asSql(new CompileContext(engine.getSqlType(), true));
        assertEquals("(COUNT(order_items.id) > %s OR orders.status = %s)", having.sql());
        assertEquals(List.of(1, "NEW"), having.params());
        assertEquals("orders.amount > %s", query.where().asSql(new CompileContext(engine.getSqlType(), true)).sql());
    }

    @Test
    void subquery_value_is_relabelled() {
        QueryModel customers = engine.query("customers");
        customers.addFilter("name__startswith", "B");
        QueryModel query = engine.query("orders");

        query.addFilter("customer__in", customers);

        ParameterizedSql sql = where(query);
        assertEquals("customer_id IN (SELECT id FROM customers \"U0\" WHERE name LIKE %s ESCAPE '\\')", sql.sql());
        assertEquals(List.of("B%"), sql.params());
        assertEquals(List.of("customers"), customers.tables());
    }

    @Test
    void copies_and_relabels_are_structural() {
        QueryModel query = engine.query("orders");
        query.addQ(Q.where("customer__name", "Bob").or(Q.where("status", "NEW")).not());

        WhereNode copy = query.where().copy();
        assertEquals(query.where(), copy);
        assertEquals(query.where().hashCode(), copy.hashCode());

        WhereNode relabeled = query.where().relabeledClone(Map.of("customers", "c2"));
        assertNotEquals(query.where(), relabeled);
        assertTrue(relabeled.getCols().contains(new Col("c2", "name")));
        assertTrue(query.where().getCols().contains(new Col("customers", "name")));
    }

    @Test
    void constraint_normalises_null_to_isnull() {
        Constraint constraint = Constraint.of(new Col(null, "status"), LookupType.EXACT, null);

        assertEquals(LookupType.ISNULL, constraint.lookupType());
        assertEquals(Boolean.TRUE, constraint.value());
        assertEquals(Arrays.asList(1L, null), Constraint.of(new Col(null, "amount"), LookupType.IN, new Long[] {1L, null}).value());
    }
}
