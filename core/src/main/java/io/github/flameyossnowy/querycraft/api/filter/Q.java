package io.github.flameyossnowy.querycraft.api.filter;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable boolean tree of lookups, used for WHERE/HAVING filters and for the
 * condition of a conditional aggregate.
 *
 * <pre>{@code
 * Q paid = Q.where("status", "PAID");
 * Q bigOrRefunded = Q.where("amount__gt", 100).or(Q.where("refunded", true));
 * Q notCancelled = Q.where("status", "CANCELLED").not();
 * }</pre>
 */
public final class Q implements FilterNode {
    public enum Connector {
        AND,
        OR
    }

    private final Connector connector;
    private final boolean negated;
    private final List<FilterNode> children;

    private Q(Connector connector, boolean negated, List<FilterNode> children) {
        this.connector = connector;
        this.negated = negated;
        this.children = List.copyOf(children);
    }

    @Contract(value = "_, _ -> new", pure = true)
    public static @NotNull Q where(String lookup, Object value) {
        return new Q(Connector.AND, false, List.of(new Lookup(lookup, value)));
    }

    /**
     * All given trees must hold.
     */
    public static @NotNull Q all(Q... trees) {
        return new Q(Connector.AND, false, List.of(trees));
    }

    /**
     * At least one of the given trees must hold.
     */
    public static @NotNull Q any(Q... trees) {
        return new Q(Connector.OR, false, List.of(trees));
    }

    public @NotNull Q and(@NotNull Q other) {
        return combine(other, Connector.AND);
    }

    public @NotNull Q or(@NotNull Q other) {
        return combine(other, Connector.OR);
    }

    public @NotNull Q not() {
        return new Q(Connector.AND, true, List.of(this));
    }

    private Q combine(Q other, Connector conn) {
        Objects.requireNonNull(other, "other");
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }

        List<FilterNode> merged = new ArrayList<>();
        if (connector == conn && !negated) {
            merged.addAll(children);
        } else {
            merged.add(this);
        }
        merged.add(other);
        return new Q(conn, false, merged);
    }

    public Connector connector() {
        return connector;
    }

    public boolean negated() {
        return negated;
    }

    public List<FilterNode> children() {
        return children;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * Every lookup in this tree, depth first.
     */
    public List<Lookup> lookups() {
        List<Lookup> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(Q node, List<Lookup> out) {
        for (FilterNode child : node.children) {
            if (child instanceof Lookup lookup) {
                out.add(lookup);
            } else {
                collect((Q) child, out);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Q q)) return false;
        return negated == q.negated && connector == q.connector && children.equals(q.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connector, negated, children);
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        if (negated) {
            out.append("NOT ");
        }
        out.append('(').append(connector).append(": ");
        boolean seen = false;
        for (FilterNode child : children) {
            if (seen) {
                out.append(", ");
            } else {
                seen = true;
            }
            if (child instanceof Lookup lookup) {
                out.append(lookup.expression()).append('=').append(lookup.value());
            } else {
                out.append(child);
            }
        }
        return out.append(')').toString();
    }
}
