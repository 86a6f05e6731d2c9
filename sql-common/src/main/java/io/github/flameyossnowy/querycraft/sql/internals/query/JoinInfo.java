package io.github.flameyossnowy.querycraft.sql.internals.query;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * One entry of the FROM clause. The base table has no join type and no left-hand side.
 *
 * @param nullable whether the left-hand row may lack a match, which makes an outer join safe to require
 */
public record JoinInfo(
    String tableName,
    String alias,
    @Nullable JoinType joinType,
    @Nullable String lhsAlias,
    @Nullable String lhsColumn,
    @Nullable String column,
    boolean nullable
) {
    static JoinInfo base(String tableName, String alias) {
        return new JoinInfo(tableName, alias, null, null, null, null, false);
    }

    public boolean isBase() {
        return joinType == null;
    }

    public boolean isOuter() {
        return joinType == JoinType.LOUTER;
    }

    JoinInfo withJoinType(JoinType type) {
        return new JoinInfo(tableName, alias, type, lhsAlias, lhsColumn, column, nullable);
    }

    JoinInfo relabeled(Map<String, String> changeMap) {
        String newAlias = changeMap.getOrDefault(alias, alias);
        String newLhs = lhsAlias == null ? null : changeMap.getOrDefault(lhsAlias, lhsAlias);
        return new JoinInfo(tableName, newAlias, joinType, newLhs, lhsColumn, column, nullable);
    }

    @Nullable
    JoinKey key() {
        if (isBase()) {
            return null;
        }
        return new JoinKey(lhsAlias, tableName, lhsColumn, column);
    }
}
