import io.github.flameyossnowy.querycraft.api.meta.Schema;
import io.github.flameyossnowy.querycraft.api.meta.SimpleSchema;
import io.github.flameyossnowy.querycraft.sql.internals.QueryEngine;

import java.time.LocalDateTime;

/**
 * orders -> customers (nullable), orders -> payments (nullable, to-one),
 * orders <- order_items (to-many), customers -> regions (nullable).
 */
final class ShopSchema {
    static final Schema SCHEMA = SimpleSchema.builder()
        .table("orders", t -> t
            .id("order_id", Long.class)
            .column("status", String.class)
            .column("amount", Long.class)
            .column("created", LocalDateTime.class, true)
            .manyToOne("customer", "customer_id", "customers", true)
            .oneToOne("payment", "payment_id", "payments", true)
            .oneToMany("items", "order_items", "order_id"))
        .table("customers", t -> t
            .id("id", Long.class)
            .column("name", String.class)
            .manyToOne("region", "region_id", "regions", true))
        .table("regions", t -> t
            .id("id", Long.class)
            .column("name", String.class))
        .table("payments", t -> t
            .id("id", Long.class)
            .column("amount", Long.class))
        .table("order_items", t -> t
            .id("id", Long.class)
            .manyToOne("order", "order_id", "orders", false)
            .column("sku", String.class)
            .column("quantity", Long.class))
        .build();

    private ShopSchema() {}

    static QueryEngine engine(QueryEngine.SQLType sqlType) {
        return QueryEngine.builder(SCHEMA).withDialect(sqlType).build();
    }

    static QueryEngine generic() {
        return engine(QueryEngine.SQLType.GENERIC);
    }

    static int placeholders(String sql, String placeholder) {
        int count = 0;
        int index = sql.indexOf(placeholder);
        while (index >= 0) {
            count++;
            index = sql.indexOf(placeholder, index + placeholder.length());
        }
        return count;
    }
}
