package io.github.flameyossnowy.querycraft.sql.dialect;

import io.github.flameyossnowy.querycraft.api.expression.Connector;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * SQLite has no interval type; date arithmetic goes through {@code datetime()} modifiers.
 */
public class SQLiteOperations extends AbstractDatabaseOperations {
    public SQLiteOperations() {
        super("SQLite", '"', operators());
    }

    private static Map<LookupType, String> operators() {
        Map<LookupType, String> operators = new EnumMap<>(LookupType.class);
        operators.put(LookupType.EXACT, "= %s");
        operators.put(LookupType.IEXACT, "LIKE %s ESCAPE '\\'");
        operators.put(LookupType.CONTAINS, "LIKE %s ESCAPE '\\'");
        operators.put(LookupType.ICONTAINS, "LIKE %s ESCAPE '\\'");
        operators.put(LookupType.GT, "> %s");
        operators.put(LookupType.GTE, ">= %s");
        operators.put(LookupType.LT, "< %s");
        operators.put(LookupType.LTE, "<= %s");
        operators.put(LookupType.STARTSWITH, "LIKE %s ESCAPE '\\'");
        operators.put(LookupType.ISTARTSWITH, "LIKE %s ESCAPE '\\'");
        operators.put(LookupType.ENDSWITH, "LIKE %s ESCAPE '\\'");
        operators.put(LookupType.IENDSWITH, "LIKE %s ESCAPE '\\'");
        return operators;
    }

    @Override
    public String datetimeCastSql() {
        return "datetime(%s)";
    }

    @Override
    public String dateIntervalSql(String sql, Connector connector, Duration duration) {
        String sign = intervalSymbol(connector, duration);
        return "datetime(" + sql + ", '" + sign + days(duration) + " days', '"
            + sign + secondsOfDay(duration) + "." + String.format("%06d", microsOfSecond(duration)) + " seconds')";
    }

    @Override
    public String noLimitValue() {
        return "-1";
    }
}
