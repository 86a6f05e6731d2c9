package io.github.flameyossnowy.querycraft.api.exceptions;

public class AggregateOverAggregateException extends QueryCompilationException {
    public AggregateOverAggregateException(String functionName, String alias) {
        super("Cannot compute " + functionName + "('" + alias + "'): '" + alias + "' is an aggregate");
    }
}
