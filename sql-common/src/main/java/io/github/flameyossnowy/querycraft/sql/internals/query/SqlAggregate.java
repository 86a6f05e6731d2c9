package io.github.flameyossnowy.querycraft.sql.internals.query;

import io.github.flameyossnowy.querycraft.api.aggregate.Aggregate;
import io.github.flameyossnowy.querycraft.api.aggregate.AggregateFunction;
import io.github.flameyossnowy.querycraft.api.meta.FieldModel;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An aggregate resolved against a query. A null target stands for {@code *}.
 *
 * <p>With a condition the aggregate renders as
 * {@code FN(CASE WHEN <condition> THEN <target> ELSE NULL END)}, and its parameters
 * are ordered condition first, then target. Counting all rows under a condition
 * uses {@code 1} as the THEN value.</p>
 */
public final class SqlAggregate implements Compilable {
    private final AggregateFunction function;
    private final @Nullable Compilable target;
    private final @Nullable FieldModel source;
    private final boolean summary;
    private final @Nullable WhereNode condition;
    private final boolean distinct;

    SqlAggregate(
        AggregateFunction function,
        @Nullable Compilable target,
        @Nullable FieldModel source,
        boolean summary,
        @Nullable WhereNode condition,
        boolean distinct
    ) {
        this.function = Objects.requireNonNull(function, "function");
        this.target = target;
        this.source = source;
        this.summary = summary;
        this.condition = condition == null || condition.isEmpty() ? null : condition;
        this.distinct = distinct;
    }

    /**
     * Builds the resolved aggregate and registers it on {@code query} under {@code alias}.
     */
    static SqlAggregate addToQuery(
        QueryModel query,
        Aggregate aggregate,
        String alias,
        @Nullable Compilable target,
        @Nullable FieldModel source,
        boolean summary,
        @Nullable WhereNode condition
    ) {
        SqlAggregate resolved = new SqlAggregate(aggregate.function(), target, source, summary, condition, aggregate.isDistinct());
        query.putAggregate(alias, resolved);
        return resolved;
    }

    public AggregateFunction function() {
        return function;
    }

    public @Nullable Compilable target() {
        return target;
    }

    public boolean isSummary() {
        return summary;
    }

    public @Nullable WhereNode condition() {
        return condition;
    }

    public boolean isDistinct() {
        return distinct;
    }

    /**
     * Java type of the computed value: integral for ordinal functions, floating point
     * for computed ones, otherwise the type of the aggregated field.
     */
    public Class<?> outputType() {
        if (function.ordinal()) {
            return Long.class;
        }
        if (function.computed()) {
            return Double.class;
        }
        return source != null ? source.type() : Object.class;
    }

    @Override
    public ParameterizedSql asSql(CompileContext context) {
        ParameterizedSql field = target == null ? new ParameterizedSql("*", List.of()) : target.asSql(context);
        List<Object> params = new ArrayList<>();
        String inner;
        if (condition != null) {
            ParameterizedSql when = condition.asSql(context);
            params.addAll(when.params());
            String then = target == null ? "1" : field.sql();
            if (target != null) {
                params.addAll(field.params());
            }
            inner = "CASE WHEN " + when.sql() + " THEN " + then + " ELSE NULL END";
        } else {
            inner = field.sql();
            params.addAll(field.params());
        }
        return new ParameterizedSql(function.name() + "(" + (distinct ? "DISTINCT " : "") + inner + ")", params);
    }

    @Override
    public SqlAggregate relabeledClone(Map<String, String> changeMap) {
        return new SqlAggregate(
            function,
            target == null ? null : target.relabeledClone(changeMap),
            source,
            summary,
            condition == null ? null : condition.relabeledClone(changeMap),
            distinct
        );
    }

    /**
     * Copy that reads from the output of a grouped subquery: base columns move to
     * {@code subqueryAlias} and references to other aggregates become output column references.
     */
    SqlAggregate forSubquery(Map<String, String> changeMap) {
        Compilable moved = target;
        if (moved instanceof SQLEvaluator evaluator) {
            moved = evaluator.replacingAggregates();
        }
        return new SqlAggregate(
            function,
            moved == null ? null : moved.relabeledClone(changeMap),
            source,
            true,
            condition == null ? null : condition.relabeledClone(changeMap),
            distinct
        );
    }

    @Override
    public List<Col> getCols() {
        List<Col> cols = new ArrayList<>();
        if (condition != null) {
            cols.addAll(condition.getCols());
        }
        if (target != null) {
            cols.addAll(target.getCols());
        }
        return cols;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlAggregate that)) return false;
        return summary == that.summary
            && distinct == that.distinct
            && function.equals(that.function)
            && Objects.equals(target, that.target)
            && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, target, summary, condition, distinct);
    }

    @Override
    public String toString() {
        return function + "(" + (distinct ? "DISTINCT " : "") + (target == null ? "*" : target)
            + (condition != null ? ", when " + condition : "") + ")";
    }
}
