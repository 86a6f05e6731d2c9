package io.github.flameyossnowy.querycraft.sql.internals.query;

import io.github.flameyossnowy.querycraft.sql.DatabaseOperations;
import org.jetbrains.annotations.Nullable;

/**
 * State shared by every node while one statement is rendered.
 *
 * @param qualifyColumns whether columns are prefixed with their table alias, needed once the statement joins
 */
public record CompileContext(DatabaseOperations operations, boolean qualifyColumns) {
    public String quote(String name) {
        return operations.quoteName(name);
    }

    public String placeholder() {
        return operations.placeholder();
    }

    public String column(@Nullable String alias, String column) {
        if (alias == null || !qualifyColumns) {
            return quote(column);
        }
        return quote(alias) + "." + quote(column);
    }
}
