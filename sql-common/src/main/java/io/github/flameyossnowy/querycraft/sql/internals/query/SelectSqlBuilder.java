package io.github.flameyossnowy.querycraft.sql.internals.query;

import io.github.flameyossnowy.querycraft.api.exceptions.QueryCompilationException;
import io.github.flameyossnowy.querycraft.sql.DatabaseOperations;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Renders a {@link QueryModel} to SQL. Compiling never mutates the query, so the
 * same query compiles to the same SQL and parameters every time.
 */
public final class SelectSqlBuilder {
    public static final String SUBQUERY_ALIAS = "subquery";

    private final DatabaseOperations operations;

    public SelectSqlBuilder(DatabaseOperations operations) {
        this.operations = operations;
    }

    public ParameterizedSql compile(QueryModel query) {
        CompileContext context = new CompileContext(operations, query.hasJoins());
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ");
        if (query.isDistinct()) {
            sql.append("DISTINCT ");
        }

        appendColumns(query, context, sql, params);
        appendFrom(query, context, sql);

        ParameterizedSql where = query.where().asSql(context);
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(where.sql());
            params.addAll(where.params());
        }

        appendGrouping(query, context, sql, params);

        ParameterizedSql having = query.having().asSql(context);
        if (!having.isEmpty()) {
            sql.append(" HAVING ").append(having.sql());
            params.addAll(having.params());
        }

        appendOrdering(query, context, sql, params);
        appendLimits(query, sql);
        return new ParameterizedSql(sql.toString(), params);
    }

    /**
     * Compiles the summary aggregates of {@code query} into a statement returning one row.
     *
     * <p>A grouped, distinct or limited query is first compiled as an inner query
     * without its summary aggregates, and the aggregates are computed over its rows:
     * {@code SELECT <aggregates> FROM (<inner>) subquery}.</p>
     *
     * @throws IllegalArgumentException if the query has no summary aggregate
     * @throws QueryCompilationException if a summary aggregate reads a column the inner query does not output
     */
    public ParameterizedSql compileAggregation(QueryModel query) {
        List<String> summary = new ArrayList<>();
        for (Map.Entry<String, SqlAggregate> entry : query.aggregates().entrySet()) {
            if (entry.getValue().isSummary()) {
                summary.add(entry.getKey());
            }
        }
        if (summary.isEmpty()) {
            throw new IllegalArgumentException("Query on '" + query.model().tableName() + "' has no summary aggregates");
        }

        if (query.groupBy() == null && !query.isDistinct() && !query.hasLimits()) {
            QueryModel single = query.copy();
            single.clearSelectClause();
            single.clearOrdering();
            return compile(single);
        }

        QueryModel inner = query.copy();
        for (String alias : summary) {
            inner.removeAggregate(alias);
        }
        if (!inner.hasLimits()) {
            inner.clearOrdering();
        }

        AggregateQueryModel outer = new AggregateQueryModel();
        Set<String> outputs = outputColumns(inner);
        Map<String, String> changeMap = Map.of(inner.baseAlias(), SUBQUERY_ALIAS);
        for (String alias : summary) {
            SqlAggregate moved = query.aggregates().get(alias).forSubquery(Map.of());
            for (Col col : moved.getCols()) {
                if (!inner.baseAlias().equals(col.alias()) || !outputs.contains(col.column())) {
                    throw new QueryCompilationException("Summary aggregate '" + alias + "' reads " + col
                        + ", which the grouped subquery does not output");
                }
            }
            outer.addAggregate(alias, moved.relabeledClone(changeMap));
        }
        outer.setSubquery(compile(inner));
        return new AggregationSqlBuilder(operations).compile(outer);
    }

    private static Set<String> outputColumns(QueryModel inner) {
        Set<String> outputs = new HashSet<>();
        List<Col> cols = inner.defaultCols() ? inner.defaultColumns() : inner.select();
        for (Col col : cols) {
            if (inner.baseAlias().equals(col.alias())) {
                outputs.add(col.column());
            }
        }
        return outputs;
    }

    private void appendColumns(QueryModel query, CompileContext context, StringBuilder sql, List<Object> params) {
        StringJoiner columns = new StringJoiner(", ");

        for (Map.Entry<String, ParameterizedSql> extra : query.extraSelect().entrySet()) {
            columns.add("(" + extra.getValue().sql() + ") AS " + context.quote(extra.getKey()));
            params.addAll(extra.getValue().params());
        }

        List<Col> cols = query.defaultCols() ? query.defaultColumns() : query.select();
        for (Col col : cols) {
            columns.add(col.asSql(context).sql());
        }

        for (Map.Entry<String, SqlAggregate> aggregate : query.aggregates().entrySet()) {
            ParameterizedSql compiled = aggregate.getValue().asSql(context);
            columns.add(compiled.sql() + " AS " + context.quote(aggregate.getKey()));
            params.addAll(compiled.params());
        }

        for (Col col : query.relatedSelectCols()) {
            columns.add(col.asSql(context).sql());
        }

        if (columns.length() == 0) {
            throw new QueryCompilationException("Query on '" + query.model().tableName() + "' selects nothing");
        }
        sql.append(columns);
    }

    private void appendFrom(QueryModel query, CompileContext context, StringBuilder sql) {
        sql.append(" FROM ");
        for (String alias : query.tables()) {
            JoinInfo join = query.aliasMap().get(alias);
            if (join.isBase()) {
                sql.append(tableWithAlias(join, context));
                continue;
            }
            if (query.refCount(alias) <= 0) {
                continue;
            }

            sql.append(' ').append(join.joinType().sql()).append(' ')
                .append(tableWithAlias(join, context))
                .append(" ON (")
                .append(context.quote(join.lhsAlias())).append('.').append(context.quote(join.lhsColumn()))
                .append(" = ")
                .append(context.quote(alias)).append('.').append(context.quote(join.column()))
                .append(')');
        }
    }

    private static String tableWithAlias(JoinInfo join, CompileContext context) {
        String table = context.quote(join.tableName());
        if (join.alias().equals(join.tableName())) {
            return table;
        }
        return table + " " + context.quote(join.alias());
    }

    private void appendGrouping(QueryModel query, CompileContext context, StringBuilder sql, List<Object> params) {
        List<Col> groupBy = query.groupBy();
        if (groupBy == null) {
            return;
        }

        StringJoiner grouping = new StringJoiner(", ");
        for (ParameterizedSql extra : query.extraSelect().values()) {
            grouping.add("(" + extra.sql() + ")");
            params.addAll(extra.params());
        }
        for (Col col : groupBy) {
            grouping.add(col.asSql(context).sql());
        }
        for (Col col : query.relatedSelectCols()) {
            grouping.add(col.asSql(context).sql());
        }
        if (grouping.length() > 0) {
            sql.append(" GROUP BY ").append(grouping);
        }
    }

    private void appendOrdering(QueryModel query, CompileContext context, StringBuilder sql, List<Object> params) {
        if (query.orderBy().isEmpty()) {
            return;
        }

        StringJoiner ordering = new StringJoiner(", ");
        for (OrderTerm term : query.orderBy()) {
            ParameterizedSql compiled = term.expression().asSql(context);
            ordering.add(compiled.sql() + (term.descending() ? " DESC" : " ASC"));
            params.addAll(compiled.params());
        }
        sql.append(" ORDER BY ").append(ordering);
    }

    private void appendLimits(QueryModel query, StringBuilder sql) {
        Integer high = query.highMark();
        int low = query.lowMark();
        if (high != null) {
            sql.append(" LIMIT ").append(high - low);
        } else if (low > 0) {
            String noLimit = operations.noLimitValue();
            if (noLimit != null) {
                sql.append(" LIMIT ").append(noLimit);
            }
        }
        if (low > 0) {
            sql.append(" OFFSET ").append(low);
        }
    }
}
