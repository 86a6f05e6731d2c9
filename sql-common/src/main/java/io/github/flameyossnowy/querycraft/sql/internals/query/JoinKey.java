package io.github.flameyossnowy.querycraft.sql.internals.query;

/**
 * Identity of a join, used to find an existing alias that can be reused:
 * {@code lhsAlias.lhsColumn = tableName.column}.
 */
public record JoinKey(String lhsAlias, String tableName, String lhsColumn, String column) {
    JoinKey relabeled(String newLhsAlias) {
        return new JoinKey(newLhsAlias, tableName, lhsColumn, column);
    }
}
