package io.github.flameyossnowy.querycraft.sql.internals.query;

import java.util.List;

/**
 * A resolved column after redundant trailing joins were dropped.
 */
public record TrimmedJoin(String alias, String column, List<String> joins) {
    public TrimmedJoin {
        joins = List.copyOf(joins);
    }

    public Col toCol() {
        return new Col(alias, column);
    }
}
