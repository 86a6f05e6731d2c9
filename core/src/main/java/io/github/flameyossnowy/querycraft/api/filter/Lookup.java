package io.github.flameyossnowy.querycraft.api.filter;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Leaf of a {@link Q} tree: a lookup expression such as {@code "amount__gt"} and the value it compares with.
 *
 * <p>The value may be a literal, a collection (for {@code in} and {@code range}),
 * an {@link io.github.flameyossnowy.querycraft.api.expression.Expression}, or a
 * compiled query used as a sub-select.</p>
 */
public record Lookup(String expression, @Nullable Object value) implements FilterNode {
    public Lookup {
        Objects.requireNonNull(expression, "expression");
    }

    public LookupPath path() {
        return LookupPath.parse(expression);
    }
}
