package io.github.flameyossnowy.querycraft.sql.internals.query;

import io.github.flameyossnowy.querycraft.api.filter.LookupType;
import io.github.flameyossnowy.querycraft.sql.DatabaseOperations;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Leaf of a {@link WhereNode}: a left-hand side, a comparison and a right-hand side.
 *
 * <p>The right-hand side is either a literal (a {@link List} for {@code in} and
 * {@code range}, a {@link Boolean} for {@code isnull}) or a {@link Compilable}
 * such as a column expression or a sub-select. Literals are prepared for the
 * dialect only when the constraint is rendered.</p>
 */
public record Constraint(Compilable lhs, LookupType lookupType, @Nullable Object value) implements WhereChild {
    public Constraint {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(lookupType, "lookupType");
    }

    /**
     * Creates a constraint, turning a null right-hand side into {@code IS NULL}.
     */
    @Contract("_, _, _ -> new")
    public static @NotNull Constraint of(Compilable lhs, LookupType lookupType, @Nullable Object value) {
        if (value == null && lookupType != LookupType.ISNULL) {
            return new Constraint(lhs, LookupType.ISNULL, Boolean.TRUE);
        }

        return switch (lookupType) {
            case ISNULL -> {
                if (!(value instanceof Boolean)) {
                    throw new IllegalArgumentException("isnull lookups take true or false, got " + value);
                }
                yield new Constraint(lhs, lookupType, value);
            }
            case IN -> new Constraint(lhs, lookupType, value instanceof Compilable ? value : toList(value, lookupType));
            case RANGE -> {
                List<Object> bounds = toList(value, lookupType);
                if (bounds.size() != 2) {
                    throw new IllegalArgumentException("range lookups take exactly two bounds, got " + bounds.size());
                }
                yield new Constraint(lhs, lookupType, bounds);
            }
            default -> new Constraint(lhs, lookupType, value);
        };
    }

    private static List<Object> toList(Object value, LookupType lookupType) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Object[] array) {
            return new ArrayList<>(Arrays.asList(array));
        }
        throw new IllegalArgumentException(lookupType.keyword() + " lookups take a collection, got " + value.getClass().getName());
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public ParameterizedSql asSql(CompileContext context) {
        DatabaseOperations operations = context.operations();
        ParameterizedSql field = lhs.asSql(context);
        List<Object> params = new ArrayList<>(field.params());

        switch (lookupType) {
            case ISNULL -> {
                return new ParameterizedSql(field.sql() + (Boolean.TRUE.equals(value) ? " IS NULL" : " IS NOT NULL"), params);
            }
            case IN -> {
                if (value instanceof Compilable subquery) {
                    ParameterizedSql compiled = subquery.asSql(context);
                    params.addAll(compiled.params());
                    return new ParameterizedSql(field.sql() + " IN " + compiled.sql(), params);
                }
                List<?> values = (List<?>) value;
                if (values.isEmpty()) {
                    // nothing can match an empty set, the column is not rendered at all
                    return new ParameterizedSql("1 = 0", List.of());
                }
                StringJoiner slots = new StringJoiner(", ", "(", ")");
                for (Object element : values) {
                    slots.add(slot(context, element));
                    params.add(element);
                }
                return new ParameterizedSql(field.sql() + " IN " + slots, params);
            }
            case RANGE -> {
                List<?> bounds = (List<?>) value;
                params.add(bounds.get(0));
                params.add(bounds.get(1));
                return new ParameterizedSql(field.sql() + " BETWEEN " + slot(context, bounds.get(0))
                    + " AND " + slot(context, bounds.get(1)), params);
            }
            default -> {
                String rhs;
                if (value instanceof Compilable compilable) {
                    ParameterizedSql compiled = compilable.asSql(context);
                    rhs = compiled.sql();
                    params.addAll(compiled.params());
                } else {
                    rhs = slot(context, value);
                    params.add(prepare(operations, value));
                }
                String lhsSql = operations.lookupCast(lookupType).replace("%s", field.sql());
                return new ParameterizedSql(lhsSql + " " + operations.operator(lookupType).replace("%s", rhs), params);
            }
        }
    }

    private static String slot(CompileContext context, @Nullable Object value) {
        if (value instanceof Temporal || value instanceof Date) {
            return context.operations().datetimeCastSql().replace("%s", context.placeholder());
        }
        return context.placeholder();
    }

    private Object prepare(DatabaseOperations operations, @Nullable Object raw) {
        if (lookupType == LookupType.IEXACT) {
            return operations.prepForIexactQuery(String.valueOf(raw));
        }
        if (!lookupType.isPatternMatch()) {
            return raw;
        }

        String escaped = operations.prepForLikeQuery(String.valueOf(raw));
        return switch (lookupType) {
            case CONTAINS, ICONTAINS -> "%" + escaped + "%";
            case STARTSWITH, ISTARTSWITH -> escaped + "%";
            default -> "%" + escaped;
        };
    }

    @Override
    public Constraint relabeledClone(Map<String, String> changeMap) {
        Object newValue = value instanceof Compilable compilable ? compilable.relabeledClone(changeMap) : value;
        return new Constraint(lhs.relabeledClone(changeMap), lookupType, newValue);
    }

    @Override
    public List<Col> getCols() {
        List<Col> cols = new ArrayList<>(lhs.getCols());
        if (value instanceof Compilable compilable) {
            cols.addAll(compilable.getCols());
        }
        return cols;
    }
}
