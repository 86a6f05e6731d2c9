package io.github.flameyossnowy.querycraft.sql.dialect;

import io.github.flameyossnowy.querycraft.api.expression.Connector;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * MySQL compares case-insensitively under the default collations, so the
 * case-sensitive lookups force a binary comparison instead.
 */
public class MySQLOperations extends AbstractDatabaseOperations {
    public MySQLOperations() {
        super("MySQL", '`', operators());
    }

    private static Map<LookupType, String> operators() {
        Map<LookupType, String> operators = new EnumMap<>(LookupType.class);
        operators.put(LookupType.EXACT, "= %s");
        operators.put(LookupType.IEXACT, "LIKE %s");
        operators.put(LookupType.CONTAINS, "LIKE BINARY %s");
        operators.put(LookupType.ICONTAINS, "LIKE %s");
        operators.put(LookupType.GT, "> %s");
        operators.put(LookupType.GTE, ">= %s");
        operators.put(LookupType.LT, "< %s");
        operators.put(LookupType.LTE, "<= %s");
        operators.put(LookupType.STARTSWITH, "LIKE BINARY %s");
        operators.put(LookupType.ISTARTSWITH, "LIKE %s");
        operators.put(LookupType.ENDSWITH, "LIKE BINARY %s");
        operators.put(LookupType.IENDSWITH, "LIKE %s");
        return operators;
    }

    @Override
    public String dateIntervalSql(String sql, Connector connector, Duration duration) {
        return "(" + sql + " " + intervalSymbol(connector, duration) + " INTERVAL '" + days(duration) + " 0:0:"
            + secondsOfDay(duration) + ":" + microsOfSecond(duration) + "' DAY_MICROSECOND)";
    }

    @Override
    public String noLimitValue() {
        return "18446744073709551615";
    }
}
