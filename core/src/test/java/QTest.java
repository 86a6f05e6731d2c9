import io.github.flameyossnowy.querycraft.api.filter.FilterNode;
import io.github.flameyossnowy.querycraft.api.filter.Lookup;
import io.github.flameyossnowy.querycraft.api.filter.LookupPath;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;
import io.github.flameyossnowy.querycraft.api.filter.Q;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QTest {

    @Test
    void and_chain_is_flat() {
        Q filter = Q.where("status", "PAID").and(Q.where("amount__gt", 10)).and(Q.where("customer__name", "Ann"));

        assertEquals(Q.Connector.AND, filter.connector());
        assertEquals(3, filter.children().size());
        assertEquals(List.of("status", "amount__gt", "customer__name"),
            filter.lookups().stream().map(Lookup::expression).toList());
    }

    @Test
    void switching_connector_nests() {
        Q filter = Q.where("status", "PAID").and(Q.where("amount__gt", 10)).or(Q.where("status", "NEW"));

        assertEquals(Q.Connector.OR, filter.connector());
        assertEquals(2, filter.children().size());
        FilterNode first = filter.children().get(0);
        assertTrue(first instanceof Q);
        assertEquals(Q.Connector.AND, ((Q) first).connector());
    }

    @Test
    void negated_tree_is_not_merged() {
        Q negated = Q.where("status", "PAID").not();
        Q filter = negated.and(Q.where("amount", 1));

        assertTrue(negated.negated());
        assertEquals(2, filter.children().size());
        assertSame(negated, filter.children().get(0));
        assertEquals("(AND: NOT (AND: (AND: status=PAID)), (AND: amount=1))", filter.toString());
    }

    @Test
    void empty_side_is_dropped() {
        Q filter = Q.where("status", "PAID");

        assertSame(filter, filter.and(Q.all()));
        assertSame(filter, Q.any().or(filter));
        assertTrue(Q.all().isEmpty());
    }

    @Test
    void structural_equality() {
        assertEquals(Q.where("a", 1).or(Q.where("b", 2)), Q.where("a", 1).or(Q.where("b", 2)));
        assertNotEquals(Q.where("a", 1), Q.where("a", 1).not());
        assertNotEquals(Q.where("a", 1).or(Q.where("b", 2)), Q.where("a", 1).and(Q.where("b", 2)));
        assertEquals(Q.where("a", 1).hashCode(), Q.where("a", 1).hashCode());
    }

    @Test
    void lookup_suffix_is_parsed() {
        LookupPath path = LookupPath.parse("customer__name__icontains");

        assertEquals(List.of("customer", "name"), path.segments());
        assertEquals(LookupType.ICONTAINS, path.lookupType());
        assertEquals("customer__name", path.joined());
        assertEquals("customer", path.first());
    }

    @Test
    void dotted_paths_are_accepted() {
        assertEquals(LookupPath.parse("customer__name__gte"), LookupPath.parse("customer.name__gte"));
        assertEquals(List.of("a", "b", "c"), LookupPath.split("a.b__c"));
    }

    @Test
    void bare_field_is_exact() {
        assertEquals(LookupType.EXACT, LookupPath.parse("status").lookupType());
        // a single segment is always a field, even when it spells a comparison
        assertEquals(List.of("in"), LookupPath.parse("in").segments());
        assertEquals(LookupType.ISNULL, new Lookup("payment__isnull", true).path().lookupType());
    }

    @Test
    void malformed_paths_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> LookupPath.split("customer____name"));
        assertThrows(IllegalArgumentException.class, () -> LookupPath.parse("name__"));
        assertThrows(IllegalArgumentException.class, () -> new LookupPath(List.of(), LookupType.EXACT));
        assertThrows(NullPointerException.class, () -> new Lookup(null, 1));
    }

    @Test
    void pattern_lookups() {
        assertTrue(LookupType.ISTARTSWITH.isPatternMatch());
        assertFalse(LookupType.IEXACT.isPatternMatch());
        assertEquals(LookupType.RANGE, LookupType.byKeyword("range"));
        assertNull(LookupType.byKeyword("regex"));
    }
}
