package io.github.flameyossnowy.querycraft.sql.internals.query;

import io.github.flameyossnowy.querycraft.api.filter.Q;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled boolean tree for WHERE and HAVING clauses and aggregate conditions.
 *
 * <p>Nodes are built up while filters are added to a query; once a node is handed
 * to an aggregate it is never mutated again. An empty node renders to nothing.</p>
 */
public final class WhereNode implements WhereChild {
    private Q.Connector connector;
    private boolean negated;
    private List<WhereChild> children;

    public WhereNode() {
        this(Q.Connector.AND, false);
    }

    public WhereNode(Q.Connector connector, boolean negated) {
        this(connector, negated, new ArrayList<>());
    }

    private WhereNode(Q.Connector connector, boolean negated, List<WhereChild> children) {
        this.connector = connector;
        this.negated = negated;
        this.children = children;
    }

    public Q.Connector connector() {
        return connector;
    }

    public boolean negated() {
        return negated;
    }

    public List<WhereChild> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Adds {@code child} joined by {@code conn}. Nodes with the same connector are
     * flattened; a different connector pushes the current children down one level.
     */
    void add(WhereChild child, Q.Connector conn) {
        if (child.isEmpty()) {
            return;
        }
        if (negated) {
            children = new ArrayList<>(List.of(new WhereNode(connector, true, children)));
            negated = false;
        }
        if (children.size() < 2) {
            connector = conn;
        }

        if (connector == conn) {
            if (child instanceof WhereNode node && !node.negated && (node.connector == conn || node.children.size() == 1)) {
                children.addAll(node.children);
            } else {
                children.add(child);
            }
            return;
        }

        WhereNode pushed = new WhereNode(connector, false, children);
        connector = conn;
        children = new ArrayList<>(List.of(pushed, child));
    }

    void negate() {
        negated = !negated;
    }

    @Override
    public boolean isEmpty() {
        for (WhereChild child : children) {
            if (!child.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public ParameterizedSql asSql(CompileContext context) {
        List<String> parts = new ArrayList<>(children.size());
        List<Object> params = new ArrayList<>();
        for (WhereChild child : children) {
            ParameterizedSql compiled = child.asSql(context);
            if (compiled.isEmpty()) {
                continue;
            }
            parts.add(compiled.sql());
            params.addAll(compiled.params());
        }
        if (parts.isEmpty()) {
            return ParameterizedSql.EMPTY;
        }

        String sql = String.join(" " + connector + " ", parts);
        if (negated) {
            sql = "NOT (" + sql + ")";
        } else if (parts.size() > 1) {
            sql = "(" + sql + ")";
        }
        return new ParameterizedSql(sql, params);
    }

    public WhereNode copy() {
        List<WhereChild> copied = new ArrayList<>(children.size());
        for (WhereChild child : children) {
            copied.add(child instanceof WhereNode node ? node.copy() : child);
        }
        return new WhereNode(connector, negated, copied);
    }

    @Override
    public WhereNode relabeledClone(Map<String, String> changeMap) {
        List<WhereChild> relabeled = new ArrayList<>(children.size());
        for (WhereChild child : children) {
            relabeled.add(child.relabeledClone(changeMap));
        }
        return new WhereNode(connector, negated, relabeled);
    }

    @Override
    public List<Col> getCols() {
        List<Col> cols = new ArrayList<>();
        for (WhereChild child : children) {
            cols.addAll(child.getCols());
        }
        return cols;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WhereNode that)) return false;
        return negated == that.negated && connector == that.connector && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connector, negated, children);
    }

    @Override
    public String toString() {
        return (negated ? "NOT " : "") + "(" + connector + ": " + children + ")";
    }
}
