package io.github.flameyossnowy.querycraft.api.meta;

/**
 * Describes how a relationship field is joined.
 *
 * <p>The join condition is always {@code owner.localColumn = target.targetColumn}.</p>
 */
public interface RelationshipModel {
    String fieldName();

    RelationshipKind relationshipKind();

    TableModel target();

    String localColumn();

    String targetColumn();

    /**
     * Whether an owner row may have no matching target row.
     */
    boolean nullable();

    default boolean isMultiValued() {
        return relationshipKind().isMultiValued();
    }
}
