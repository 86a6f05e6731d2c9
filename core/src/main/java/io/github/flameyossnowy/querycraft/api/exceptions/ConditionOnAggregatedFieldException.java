package io.github.flameyossnowy.querycraft.api.exceptions;

/**
 * Thrown when a conditional aggregate targets an existing annotation.
 * Conditions are evaluated per row, before aggregation, so they cannot apply to an aggregated value.
 */
public class ConditionOnAggregatedFieldException extends QueryCompilationException {
    public ConditionOnAggregatedFieldException(String alias) {
        super("Cannot use aggregated fields in conditional aggregates ('" + alias + "')");
    }
}
