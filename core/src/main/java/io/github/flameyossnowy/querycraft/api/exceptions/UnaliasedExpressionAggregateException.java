package io.github.flameyossnowy.querycraft.api.exceptions;

/**
 * Thrown when an aggregate over a composite expression is added without an output alias.
 */
public class UnaliasedExpressionAggregateException extends QueryCompilationException {
    public UnaliasedExpressionAggregateException(String functionName) {
        super("Aggregating over an expression requires an explicit alias (" + functionName + ")");
    }
}
