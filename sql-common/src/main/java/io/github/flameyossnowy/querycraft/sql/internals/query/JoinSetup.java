package io.github.flameyossnowy.querycraft.sql.internals.query;

import io.github.flameyossnowy.querycraft.api.meta.FieldModel;
import io.github.flameyossnowy.querycraft.api.meta.TableModel;

import java.util.List;

/**
 * Result of walking a field path: the final field, the table it lives on and
 * every alias visited, starting with the alias the walk started from.
 */
public record JoinSetup(FieldModel field, TableModel table, List<String> joins, boolean multiValued) {
    public JoinSetup {
        joins = List.copyOf(joins);
    }

    public String lastAlias() {
        return joins.get(joins.size() - 1);
    }
}
