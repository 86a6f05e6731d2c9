package io.github.flameyossnowy.querycraft.sql.internals.query;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A SQL fragment and the bind parameters for its placeholders, in placeholder order.
 * Parameters may contain nulls.
 */
public record ParameterizedSql(String sql, List<Object> params) {
    public static final ParameterizedSql EMPTY = new ParameterizedSql("", List.of());

    public ParameterizedSql {
        Objects.requireNonNull(sql, "sql");
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    @Contract(value = "_, _ -> new", pure = true)
    public static @NotNull ParameterizedSql of(String sql, Object... params) {
        return new ParameterizedSql(sql, Arrays.asList(params));
    }

    public boolean isEmpty() {
        return sql.isEmpty();
    }
}
