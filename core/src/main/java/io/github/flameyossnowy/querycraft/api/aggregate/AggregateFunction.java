package io.github.flameyossnowy.querycraft.api.aggregate;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Objects;

/**
 * SQL aggregate function and the traits needed to infer its output type.
 *
 * <p>{@code ordinal} functions always produce an integral value, {@code computed}
 * ones always produce a float regardless of their input. Anything else takes the
 * type of the aggregated field. Custom functions are declared with {@link #of}.</p>
 */
public final class AggregateFunction {
    public static final AggregateFunction COUNT = new AggregateFunction("COUNT", true, false);
    public static final AggregateFunction SUM = new AggregateFunction("SUM", false, false);
    public static final AggregateFunction AVG = new AggregateFunction("AVG", false, true);
    public static final AggregateFunction MIN = new AggregateFunction("MIN", false, false);
    public static final AggregateFunction MAX = new AggregateFunction("MAX", false, false);
    public static final AggregateFunction STDDEV_POP = new AggregateFunction("STDDEV_POP", false, true);
    public static final AggregateFunction STDDEV_SAMP = new AggregateFunction("STDDEV_SAMP", false, true);
    public static final AggregateFunction VAR_POP = new AggregateFunction("VAR_POP", false, true);
    public static final AggregateFunction VAR_SAMP = new AggregateFunction("VAR_SAMP", false, true);

    private final String name;
    private final boolean ordinal;
    private final boolean computed;

    private AggregateFunction(String name, boolean ordinal, boolean computed) {
        this.name = name;
        this.ordinal = ordinal;
        this.computed = computed;
    }

    @Contract(value = "_, _, _ -> new", pure = true)
    public static @NotNull AggregateFunction of(@NotNull String name, boolean ordinal, boolean computed) {
        Objects.requireNonNull(name, "name");
        if (ordinal && computed) {
            throw new IllegalArgumentException("An aggregate cannot be both ordinal and computed: " + name);
        }
        return new AggregateFunction(name.toUpperCase(Locale.ROOT), ordinal, computed);
    }

    public String name() {
        return name;
    }

    public boolean ordinal() {
        return ordinal;
    }

    public boolean computed() {
        return computed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateFunction that)) return false;
        return ordinal == that.ordinal && computed == that.computed && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, ordinal, computed);
    }

    @Override
    public String toString() {
        return name;
    }
}
