package io.github.flameyossnowy.querycraft.sql.internals.query;

import io.github.flameyossnowy.querycraft.api.expression.Expression;
import io.github.flameyossnowy.querycraft.api.expression.F;
import io.github.flameyossnowy.querycraft.api.expression.Value;
import io.github.flameyossnowy.querycraft.api.filter.FilterNode;
import io.github.flameyossnowy.querycraft.api.filter.Lookup;
import io.github.flameyossnowy.querycraft.api.filter.LookupPath;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;
import io.github.flameyossnowy.querycraft.api.filter.Q;

import java.util.List;

/**
 * Compiles {@link Q} trees into {@link WhereNode}s against one query, creating
 * and promoting joins on that query as lookups are resolved.
 */
public final class SqlConditionBuilder {
    private final QueryModel query;

    public SqlConditionBuilder(QueryModel query) {
        this.query = query;
    }

    /**
     * ANDs {@code filter} into the query. Trees that reference an aggregate go to HAVING as a whole.
     */
    public void addQ(Q filter) {
        if (filter.isEmpty()) {
            return;
        }
        WhereNode target = referencesAggregate(filter) ? query.having() : query.where();
        target.add(build(filter, false), Q.Connector.AND);
    }

    WhereNode build(Q filter, boolean inOr) {
        boolean branching = inOr || (filter.connector() == Q.Connector.OR && filter.children().size() > 1);
        WhereNode node = new WhereNode(filter.connector(), false);
        for (FilterNode child : filter.children()) {
            WhereChild compiled = child instanceof Lookup lookup
                ? buildConstraint(lookup, branching)
                : build((Q) child, branching);
            node.add(compiled, filter.connector());
        }
        if (filter.negated()) {
            node.negate();
        }
        return node;
    }

    private Constraint buildConstraint(Lookup lookup, boolean inOr) {
        LookupPath path = lookup.path();
        Object value = lookup.value();
        if (value instanceof Value literal) {
            value = literal.value();
        }

        Compilable lhs;
        List<String> joins = List.of();
        SqlAggregate aggregate = path.segments().size() == 1 ? query.aggregates().get(path.first()) : null;
        if (aggregate != null) {
            lhs = aggregate;
        } else {
            JoinSetup setup = query.setupJoins(path.segments(), query.model(), query.getInitialAlias());
            TrimmedJoin trimmed = query.trimJoins(setup);
            lhs = trimmed.toCol();
            joins = trimmed.joins();
        }

        Object rhs = value;
        if (value instanceof Expression expression) {
            rhs = new SQLEvaluator(expression, query, true, false);
        } else if (value instanceof QueryModel subquery) {
            if (path.lookupType() != LookupType.IN && path.lookupType() != LookupType.EXACT) {
                throw new IllegalArgumentException("A query can only be compared with 'in' or 'exact', not '"
                    + path.lookupType().keyword() + "'");
            }
            rhs = SubqueryValue.of(subquery);
        }

        Constraint constraint = Constraint.of(lhs, path.lookupType(), rhs);
        boolean matchesMissing = constraint.lookupType() == LookupType.ISNULL && Boolean.TRUE.equals(constraint.value());
        if (matchesMissing || inOr) {
            // rows without a related row must survive the join to be matched
            query.promoteAliasChain(joins, false);
        }
        return constraint;
    }

    boolean referencesAggregate(FilterNode node) {
        if (node instanceof Q filter) {
            for (FilterNode child : filter.children()) {
                if (referencesAggregate(child)) {
                    return true;
                }
            }
            return false;
        }

        Lookup lookup = (Lookup) node;
        LookupPath path = lookup.path();
        if (path.segments().size() == 1 && query.aggregates().containsKey(path.first())) {
            return true;
        }
        return lookup.value() instanceof Expression expression && namesAggregate(expression);
    }

    private boolean namesAggregate(Expression expression) {
        if (expression instanceof F reference) {
            return query.aggregates().containsKey(reference.name());
        }
        for (Expression child : expression.children()) {
            if (namesAggregate(child)) {
                return true;
            }
        }
        return false;
    }
}
