package io.github.flameyossnowy.querycraft.api.exceptions;

import java.util.Collection;

public class FieldResolutionException extends QueryCompilationException {
    private final String fieldName;

    public FieldResolutionException(String fieldName, Collection<String> choices) {
        super("Cannot resolve keyword '" + fieldName + "' into field. Choices are: " + String.join(", ", choices));
        this.fieldName = fieldName;
    }

    public FieldResolutionException(String fieldName, String message) {
        super(message);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
