package io.github.flameyossnowy.querycraft.sql.internals.query;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A column of a table alias in the FROM clause.
 */
public record Col(@Nullable String alias, String column) implements Compilable {
    public Col {
        Objects.requireNonNull(column, "column");
    }

    @Override
    public ParameterizedSql asSql(CompileContext context) {
        return new ParameterizedSql(context.column(alias, column), List.of());
    }

    @Override
    public Col relabeledClone(Map<String, String> changeMap) {
        if (alias == null || !changeMap.containsKey(alias)) {
            return this;
        }
        return new Col(changeMap.get(alias), column);
    }

    @Override
    public List<Col> getCols() {
        return List.of(this);
    }

    @Override
    public String toString() {
        return alias == null ? column : alias + "." + column;
    }
}
