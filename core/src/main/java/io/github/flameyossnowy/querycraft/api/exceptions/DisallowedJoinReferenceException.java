package io.github.flameyossnowy.querycraft.api.exceptions;

/**
 * Thrown when a field path needs a join but the resolution context forbids joins.
 */
public class DisallowedJoinReferenceException extends QueryCompilationException {
    private final String path;

    public DisallowedJoinReferenceException(String path) {
        super("Joined field references are not permitted in this query: '" + path + "'");
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
