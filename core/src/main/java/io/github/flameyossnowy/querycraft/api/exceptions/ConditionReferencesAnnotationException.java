package io.github.flameyossnowy.querycraft.api.exceptions;

/**
 * Thrown when the condition of a conditional aggregate compiles to HAVING terms,
 * meaning it referenced an annotated (already aggregated) field.
 */
public class ConditionReferencesAnnotationException extends QueryCompilationException {
    public ConditionReferencesAnnotationException() {
        super("Condition cannot reference annotated fields");
    }
}
