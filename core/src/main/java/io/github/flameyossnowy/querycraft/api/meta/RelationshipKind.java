package io.github.flameyossnowy.querycraft.api.meta;

public enum RelationshipKind {
    MANY_TO_ONE,
    ONE_TO_ONE,
    ONE_TO_MANY;

    public boolean isMultiValued() {
        return this == ONE_TO_MANY;
    }
}
