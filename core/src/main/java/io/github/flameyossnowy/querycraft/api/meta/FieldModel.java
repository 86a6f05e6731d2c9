package io.github.flameyossnowy.querycraft.api.meta;

import org.jetbrains.annotations.Nullable;

/**
 * Represents metadata about a field of a table.
 *
 * <p>Relationship fields carry a {@link RelationshipModel}; for a forward
 * relation {@link #columnName()} is the foreign key column, for a reverse
 * (one-to-many) relation it is the local column the target refers to.</p>
 */
public interface FieldModel {
    String name();

    String columnName();

    Class<?> type();

    boolean id();

    boolean nullable();

    @Nullable
    RelationshipModel relationshipModel();

    default boolean relationship() {
        return relationshipModel() != null;
    }
}
