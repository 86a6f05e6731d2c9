package io.github.flameyossnowy.querycraft.sql.internals.query;

import io.github.flameyossnowy.querycraft.sql.DatabaseOperations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders an {@link AggregateQueryModel} as {@code SELECT <aggregates> FROM (<inner>) subquery}.
 * Parameters of the aggregates come before those of the inner query.
 */
public final class AggregationSqlBuilder {
    private final DatabaseOperations operations;

    public AggregationSqlBuilder(DatabaseOperations operations) {
        this.operations = operations;
    }

    public ParameterizedSql compile(AggregateQueryModel query) {
        CompileContext context = new CompileContext(operations, true);
        StringJoiner columns = new StringJoiner(", ");
        List<Object> params = new ArrayList<>();

        for (Map.Entry<String, SqlAggregate> aggregate : query.aggregates().entrySet()) {
            ParameterizedSql compiled = aggregate.getValue().asSql(context);
            columns.add(compiled.sql() + " AS " + context.quote(aggregate.getKey()));
            params.addAll(compiled.params());
        }

        ParameterizedSql subquery = query.subquery();
        params.addAll(subquery.params());
        String sql = "SELECT " + columns + " FROM (" + subquery.sql() + ") " + context.quote(SelectSqlBuilder.SUBQUERY_ALIAS);
        return new ParameterizedSql(sql, params);
    }
}
