package io.github.flameyossnowy.querycraft.api.aggregate;

import io.github.flameyossnowy.querycraft.api.exceptions.UnaliasedExpressionAggregateException;
import io.github.flameyossnowy.querycraft.api.expression.Expression;
import io.github.flameyossnowy.querycraft.api.expression.F;
import io.github.flameyossnowy.querycraft.api.filter.Q;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * Declarative aggregate: a function, what it aggregates, and optionally the rows it is limited to.
 *
 * <pre>{@code
 * // COUNT(order_id)
 * Aggregate.count("order_id")
 *
 * // COUNT(CASE WHEN status = ? THEN order_id ELSE NULL END)
 * Aggregate.count("order_id").only(Q.where("status", "PAID"))
 *
 * // SUM(price * quantity), needs an explicit alias when added to a query
 * Aggregate.sum(F.of("price").times(F.of("quantity")))
 * }</pre>
 *
 * <p>Instances are immutable; {@link #only(Q)} and {@link #distinct()} return copies.</p>
 */
public final class Aggregate {
    public static final String ALL = "*";

    private final AggregateFunction function;
    private final Object target;
    private final @Nullable Q condition;
    private final boolean distinct;

    private Aggregate(AggregateFunction function, Object target, @Nullable Q condition, boolean distinct) {
        this.function = Objects.requireNonNull(function, "function");
        this.target = Objects.requireNonNull(target, "target");
        this.condition = condition;
        this.distinct = distinct;
    }

    @Contract(value = "_, _ -> new", pure = true)
    public static @NotNull Aggregate of(@NotNull AggregateFunction function, @NotNull String lookup) {
        return new Aggregate(function, lookup, null, false);
    }

    /**
     * Aggregate over an expression. A bare {@link F} is treated as its field path.
     */
    @Contract(value = "_, _ -> new", pure = true)
    public static @NotNull Aggregate of(@NotNull AggregateFunction function, @NotNull Expression expression) {
        if (expression instanceof F field) {
            return new Aggregate(function, field.name(), null, false);
        }
        return new Aggregate(function, expression, null, false);
    }

    public static @NotNull Aggregate count(String lookup) {
        return of(AggregateFunction.COUNT, lookup);
    }

    public static @NotNull Aggregate count(Expression expression) {
        return of(AggregateFunction.COUNT, expression);
    }

    public static @NotNull Aggregate countAll() {
        return of(AggregateFunction.COUNT, ALL);
    }

    public static @NotNull Aggregate sum(String lookup) {
        return of(AggregateFunction.SUM, lookup);
    }

    public static @NotNull Aggregate sum(Expression expression) {
        return of(AggregateFunction.SUM, expression);
    }

    public static @NotNull Aggregate avg(String lookup) {
        return of(AggregateFunction.AVG, lookup);
    }

    public static @NotNull Aggregate avg(Expression expression) {
        return of(AggregateFunction.AVG, expression);
    }

    public static @NotNull Aggregate min(String lookup) {
        return of(AggregateFunction.MIN, lookup);
    }

    public static @NotNull Aggregate min(Expression expression) {
        return of(AggregateFunction.MIN, expression);
    }

    public static @NotNull Aggregate max(String lookup) {
        return of(AggregateFunction.MAX, lookup);
    }

    public static @NotNull Aggregate max(Expression expression) {
        return of(AggregateFunction.MAX, expression);
    }

    public static @NotNull Aggregate stdDev(String lookup, boolean sample) {
        return of(sample ? AggregateFunction.STDDEV_SAMP : AggregateFunction.STDDEV_POP, lookup);
    }

    public static @NotNull Aggregate variance(String lookup, boolean sample) {
        return of(sample ? AggregateFunction.VAR_SAMP : AggregateFunction.VAR_POP, lookup);
    }

    /**
     * Restricts the aggregated rows to those matching {@code condition}.
     */
    @Contract(value = "_ -> new", pure = true)
    public @NotNull Aggregate only(@NotNull Q condition) {
        Objects.requireNonNull(condition, "condition");
        return new Aggregate(function, target, condition.isEmpty() ? null : condition, distinct);
    }

    @Contract(value = " -> new", pure = true)
    public @NotNull Aggregate distinct() {
        return new Aggregate(function, target, condition, true);
    }

    public AggregateFunction function() {
        return function;
    }

    public boolean isExpression() {
        return target instanceof Expression;
    }

    public boolean isAll() {
        return ALL.equals(target);
    }

    /**
     * @throws IllegalStateException if this aggregates over an expression
     */
    public String lookup() {
        if (target instanceof String lookup) {
            return lookup;
        }
        throw new IllegalStateException(function + " aggregates over an expression, not a field path");
    }

    /**
     * @throws IllegalStateException if this aggregates over a field path
     */
    public Expression expression() {
        if (target instanceof Expression expression) {
            return expression;
        }
        throw new IllegalStateException(function + " aggregates over a field path, not an expression");
    }

    public @Nullable Q condition() {
        return condition;
    }

    public boolean isConditional() {
        return condition != null;
    }

    public boolean isDistinct() {
        return distinct;
    }

    /**
     * Alias used when none is supplied, e.g. {@code order_id__count}.
     *
     * @throws UnaliasedExpressionAggregateException for expression targets, which have no natural name
     */
    public String defaultAlias() {
        if (isExpression()) {
            throw new UnaliasedExpressionAggregateException(function.name());
        }
        String name = function.name().toLowerCase(Locale.ROOT);
        return isAll() ? name : lookup() + "__" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Aggregate that)) return false;
        return distinct == that.distinct
            && function.equals(that.function)
            && target.equals(that.target)
            && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, target, condition, distinct);
    }

    @Override
    public String toString() {
        return function + "(" + (distinct ? "DISTINCT " : "") + target + (condition != null ? ", only=" + condition : "") + ")";
    }
}
