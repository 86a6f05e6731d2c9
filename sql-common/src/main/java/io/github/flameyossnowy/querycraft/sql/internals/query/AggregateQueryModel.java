package io.github.flameyossnowy.querycraft.sql.internals.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outer query of a two-phase aggregation: summary aggregates computed over the
 * rows of an already compiled inner query.
 */
public final class AggregateQueryModel {
    private final Map<String, SqlAggregate> aggregates = new LinkedHashMap<>();
    private ParameterizedSql subquery;

    public void addAggregate(String alias, SqlAggregate aggregate) {
        aggregates.put(alias, aggregate);
    }

    public Map<String, SqlAggregate> aggregates() {
        return Collections.unmodifiableMap(aggregates);
    }

    public void setSubquery(ParameterizedSql subquery) {
        this.subquery = Objects.requireNonNull(subquery, "subquery");
    }

    public ParameterizedSql subquery() {
        if (subquery == null) {
            throw new IllegalStateException("No subquery was set");
        }
        return subquery;
    }
}
