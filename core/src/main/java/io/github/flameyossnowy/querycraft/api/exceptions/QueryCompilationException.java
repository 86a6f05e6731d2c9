package io.github.flameyossnowy.querycraft.api.exceptions;

/**
 * Base type of every failure raised while turning a query into SQL.
 *
 * <p>All compilation failures are synchronous and final, nothing is retried.</p>
 */
public class QueryCompilationException extends RuntimeException {
    public QueryCompilationException(String message) {
        super(message);
    }
}
