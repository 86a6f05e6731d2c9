package io.github.flameyossnowy.querycraft.sql.internals.query;

import java.util.List;
import java.util.Map;

/**
 * Reference to an output column by its alias, used for ordering by an aggregate
 * and for aggregates computed over the output of a grouped subquery.
 */
public record AnnotationRef(String alias) implements Compilable {
    @Override
    public ParameterizedSql asSql(CompileContext context) {
        return new ParameterizedSql(context.quote(alias), List.of());
    }

    @Override
    public AnnotationRef relabeledClone(Map<String, String> changeMap) {
        return this;
    }

    @Override
    public List<Col> getCols() {
        return List.of();
    }
}
