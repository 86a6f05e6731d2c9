package io.github.flameyossnowy.querycraft.api.meta;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Represents metadata about a table.
 */
public interface TableModel {
    String tableName();

    /**
     * The concrete columns of this table in declaration order.
     * Reverse relations are not included since they have no column of their own.
     */
    List<FieldModel> fields();

    /**
     * Looks up any field by name, reverse relations included.
     */
    @Nullable
    FieldModel fieldByName(String name);

    FieldModel getPrimaryKey();

    /**
     * Every name {@link #fieldByName(String)} accepts, used for error messages.
     */
    List<String> fieldNames();
}
