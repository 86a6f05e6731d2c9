package io.github.flameyossnowy.querycraft.api.meta;

import org.jetbrains.annotations.NotNull;

/**
 * Source of table metadata. Relationship targets are looked up through it lazily,
 * so tables may reference each other in any order.
 */
public interface Schema {
    /**
     * @throws IllegalArgumentException if no table with that name is known
     */
    @NotNull
    TableModel table(String tableName);

    boolean hasTable(String tableName);
}
