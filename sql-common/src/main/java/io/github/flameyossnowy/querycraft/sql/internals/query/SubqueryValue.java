package io.github.flameyossnowy.querycraft.sql.internals.query;

import java.util.List;
import java.util.Map;

/**
 * A query used as the right-hand side of a filter, rendered as a parenthesised sub-select.
 *
 * <p>The wrapped query is a private copy whose aliases carry the {@code U} prefix,
 * so they never clash with the aliases of the outer statement.</p>
 */
record SubqueryValue(QueryModel query) implements Compilable {
    static final String ALIAS_PREFIX = "U";

    static SubqueryValue of(QueryModel source) {
        QueryModel inner = source.copy();
        if (inner.select().isEmpty() && inner.aggregates().isEmpty() && inner.extraSelect().isEmpty()) {
            inner.addSelect(inner.model().getPrimaryKey().name());
        }
        inner.bumpPrefix(ALIAS_PREFIX);
        return new SubqueryValue(inner);
    }

    @Override
    public ParameterizedSql asSql(CompileContext context) {
        ParameterizedSql compiled = new SelectSqlBuilder(context.operations()).compile(query);
        return new ParameterizedSql("(" + compiled.sql() + ")", compiled.params());
    }

    @Override
    public SubqueryValue relabeledClone(Map<String, String> changeMap) {
        return this;
    }

    @Override
    public List<Col> getCols() {
        return List.of();
    }
}
