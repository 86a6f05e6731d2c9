package io.github.flameyossnowy.querycraft.sql.internals.query;

import io.github.flameyossnowy.querycraft.api.exceptions.DisallowedJoinReferenceException;
import io.github.flameyossnowy.querycraft.api.expression.CombinedExpression;
import io.github.flameyossnowy.querycraft.api.expression.Connector;
import io.github.flameyossnowy.querycraft.api.expression.Expression;
import io.github.flameyossnowy.querycraft.api.expression.F;
import io.github.flameyossnowy.querycraft.api.expression.Value;
import io.github.flameyossnowy.querycraft.api.filter.LookupPath;
import io.github.flameyossnowy.querycraft.api.meta.FieldModel;
import io.github.flameyossnowy.querycraft.api.utils.Logging;
import io.github.flameyossnowy.querycraft.sql.DatabaseOperations;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An {@link Expression} bound to a query: every {@link F} reference is resolved
 * once, at construction, to a column or to an aggregate already on the query.
 *
 * <p>Resolving may create joins on the query. With {@code allowJoins} unset any
 * multi-segment reference is rejected; with {@code promoteJoins} set the joins a
 * reference walks through become outer joins.</p>
 */
public final class SQLEvaluator implements Compilable {
    private final Expression expression;
    private final Map<F, Compilable> cols;
    private final Set<String> joinsUsed;
    private boolean containsAggregate;
    private @Nullable FieldModel source;

    public SQLEvaluator(Expression expression, QueryModel query, boolean allowJoins, boolean promoteJoins) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.cols = new LinkedHashMap<>();
        this.joinsUsed = new LinkedHashSet<>();
        prepare(expression, query, allowJoins, promoteJoins);
    }

    private SQLEvaluator(
        Expression expression,
        Map<F, Compilable> cols,
        Set<String> joinsUsed,
        boolean containsAggregate,
        @Nullable FieldModel source
    ) {
        this.expression = expression;
        this.cols = cols;
        this.joinsUsed = joinsUsed;
        this.containsAggregate = containsAggregate;
        this.source = source;
    }

    private void prepare(Expression node, QueryModel query, boolean allowJoins, boolean promoteJoins) {
        if (!(node instanceof F reference)) {
            for (Expression child : node.children()) {
                prepare(child, query, allowJoins, promoteJoins);
            }
            return;
        }
        if (cols.containsKey(reference)) {
            return;
        }

        SqlAggregate aggregate = query.aggregates().get(reference.name());
        if (aggregate != null) {
            cols.put(reference, aggregate);
            containsAggregate = true;
            return;
        }

        List<String> path = LookupPath.split(reference.name());
        if (!allowJoins && path.size() > 1) {
            throw new DisallowedJoinReferenceException(reference.name());
        }

        JoinSetup setup = query.setupJoins(path, query.model(), query.getInitialAlias());
        TrimmedJoin trimmed = query.trimJoins(setup);
        if (promoteJoins) {
            query.promoteAliasChain(trimmed.joins(), true);
        }
        if (source == null) {
            source = setup.field();
        }
        List<String> joins = trimmed.joins();
        joinsUsed.addAll(joins.subList(1, joins.size()));
        cols.put(reference, trimmed.toCol());
        Logging.deepInfo(() -> "Resolved " + reference + " to " + trimmed.toCol());
    }

    public Expression expression() {
        return expression;
    }

    /**
     * Aliases of the joins the resolved columns are read through, base table excluded.
     */
    public Set<String> joinsUsed() {
        return Collections.unmodifiableSet(joinsUsed);
    }

    /**
     * Whether any reference resolved to an aggregate, which confines this expression to HAVING.
     */
    public boolean containsAggregate() {
        return containsAggregate;
    }

    /**
     * Aggregates the expression refers to by alias, in reference order.
     */
    public List<SqlAggregate> referencedAggregates() {
        List<SqlAggregate> referenced = new ArrayList<>();
        for (Compilable col : cols.values()) {
            if (col instanceof SqlAggregate aggregate) {
                referenced.add(aggregate);
            }
        }
        return referenced;
    }

    /**
     * First column the expression reads, used to infer the output type of an aggregate over it.
     */
    public @Nullable FieldModel source() {
        return source;
    }

    @Override
    public ParameterizedSql asSql(CompileContext context) {
        return evaluate(expression, context);
    }

    private ParameterizedSql evaluate(Expression node, CompileContext context) {
        DatabaseOperations operations = context.operations();
        if (node instanceof F reference) {
            return cols.get(reference).asSql(context);
        }
        if (node instanceof Value value) {
            if (value.isDuration()) {
                throw new IllegalArgumentException("A duration can only be added to or subtracted from another expression");
            }
            return ParameterizedSql.of(context.placeholder(), value.value());
        }

        CombinedExpression combined = (CombinedExpression) node;
        if (combined.rhs() instanceof Value value && value.isDuration()) {
            ParameterizedSql lhs = evaluate(combined.lhs(), context);
            return new ParameterizedSql(
                operations.dateIntervalSql(lhs.sql(), combined.connector(), (Duration) value.value()), lhs.params());
        }
        if (combined.lhs() instanceof Value value && value.isDuration() && combined.connector() == Connector.ADD) {
            ParameterizedSql rhs = evaluate(combined.rhs(), context);
            return new ParameterizedSql(
                operations.dateIntervalSql(rhs.sql(), Connector.ADD, (Duration) value.value()), rhs.params());
        }

        ParameterizedSql lhs = evaluate(combined.lhs(), context);
        ParameterizedSql rhs = evaluate(combined.rhs(), context);
        List<Object> params = new ArrayList<>(lhs.params());
        params.addAll(rhs.params());
        String sql = operations.combineExpression(combined.connector(), List.of(lhs.sql(), rhs.sql()));
        return new ParameterizedSql("(" + sql + ")", params);
    }

    @Override
    public SQLEvaluator relabeledClone(Map<String, String> changeMap) {
        Map<F, Compilable> relabeled = new LinkedHashMap<>();
        for (Map.Entry<F, Compilable> entry : cols.entrySet()) {
            relabeled.put(entry.getKey(), entry.getValue().relabeledClone(changeMap));
        }
        Set<String> relabeledJoins = new LinkedHashSet<>();
        for (String alias : joinsUsed) {
            relabeledJoins.add(changeMap.getOrDefault(alias, alias));
        }
        return new SQLEvaluator(expression, relabeled, relabeledJoins, containsAggregate, source);
    }

    /**
     * Copy in which aggregate references point at the aggregate's output column instead.
     */
    SQLEvaluator replacingAggregates() {
        Map<F, Compilable> replaced = new LinkedHashMap<>();
        for (Map.Entry<F, Compilable> entry : cols.entrySet()) {
            Compilable col = entry.getValue();
            replaced.put(entry.getKey(), col instanceof SqlAggregate ? new AnnotationRef(entry.getKey().name()) : col);
        }
        return new SQLEvaluator(expression, replaced, joinsUsed, false, source);
    }

    @Override
    public List<Col> getCols() {
        List<Col> out = new ArrayList<>();
        for (Compilable col : cols.values()) {
            out.addAll(col.getCols());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SQLEvaluator that)) return false;
        return expression.equals(that.expression) && cols.equals(that.cols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, cols);
    }

    @Override
    public String toString() {
        return "SQLEvaluator[" + expression + "]";
    }
}
