package io.github.flameyossnowy.querycraft.sql.internals.query;

public enum JoinType {
    INNER("INNER JOIN"),
    LOUTER("LEFT OUTER JOIN");

    private final String sql;

    JoinType(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }
}
