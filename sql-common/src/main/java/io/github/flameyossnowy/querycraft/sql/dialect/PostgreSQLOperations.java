package io.github.flameyossnowy.querycraft.sql.dialect;

import io.github.flameyossnowy.querycraft.api.expression.Connector;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class PostgreSQLOperations extends AbstractDatabaseOperations {
    public PostgreSQLOperations() {
        super("PostgreSQL", '"', operators());
    }

    private static Map<LookupType, String> operators() {
        Map<LookupType, String> operators = new EnumMap<>(LookupType.class);
        operators.put(LookupType.EXACT, "= %s");
        operators.put(LookupType.IEXACT, "= UPPER(%s)");
        operators.put(LookupType.CONTAINS, "LIKE %s");
        operators.put(LookupType.ICONTAINS, "LIKE UPPER(%s)");
        operators.put(LookupType.GT, "> %s");
        operators.put(LookupType.GTE, ">= %s");
        operators.put(LookupType.LT, "< %s");
        operators.put(LookupType.LTE, "<= %s");
        operators.put(LookupType.STARTSWITH, "LIKE %s");
        operators.put(LookupType.ISTARTSWITH, "LIKE UPPER(%s)");
        operators.put(LookupType.ENDSWITH, "LIKE %s");
        operators.put(LookupType.IENDSWITH, "LIKE UPPER(%s)");
        return operators;
    }

    @Override
    public String lookupCast(LookupType lookupType) {
        // text comparisons work on any column type once cast
        return switch (lookupType) {
            case IEXACT, ICONTAINS, ISTARTSWITH, IENDSWITH -> "UPPER(%s::text)";
            case CONTAINS, STARTSWITH, ENDSWITH -> "%s::text";
            default -> "%s";
        };
    }

    @Override
    public String prepForIexactQuery(String value) {
        return value;
    }

    @Override
    public String dateIntervalSql(String sql, Connector connector, Duration duration) {
        return ansiInterval(sql, intervalSymbol(connector, duration), duration);
    }
}
