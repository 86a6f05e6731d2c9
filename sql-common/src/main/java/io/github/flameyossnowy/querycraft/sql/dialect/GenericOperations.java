package io.github.flameyossnowy.querycraft.sql.dialect;

import io.github.flameyossnowy.querycraft.api.expression.Connector;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Dialect-neutral rendering for format-style drivers.
 *
 * <p>Bind markers are {@code %s}, so a literal {@code %} operator is doubled.
 * Simple lower-case identifiers are left unquoted, which keeps the output readable in logs.</p>
 */
public class GenericOperations extends AbstractDatabaseOperations {
    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    public GenericOperations() {
        super("Generic", '"', operators());
    }

    private static Map<LookupType, String> operators() {
        Map<LookupType, String> operators = new EnumMap<>(LookupType.class);
        operators.put(LookupType.EXACT, "= %s");
        operators.put(LookupType.IEXACT, "LIKE UPPER(%s) ESCAPE '\\'");
        operators.put(LookupType.CONTAINS, "LIKE %s ESCAPE '\\'");
        operators.put(LookupType.ICONTAINS, "LIKE UPPER(%s) ESCAPE '\\'");
        operators.put(LookupType.GT, "> %s");
        operators.put(LookupType.GTE, ">= %s");
        operators.put(LookupType.LT, "< %s");
        operators.put(LookupType.LTE, "<= %s");
        operators.put(LookupType.STARTSWITH, "LIKE %s ESCAPE '\\'");
        operators.put(LookupType.ISTARTSWITH, "LIKE UPPER(%s) ESCAPE '\\'");
        operators.put(LookupType.ENDSWITH, "LIKE %s ESCAPE '\\'");
        operators.put(LookupType.IENDSWITH, "LIKE UPPER(%s) ESCAPE '\\'");
        return operators;
    }

    @Override
    public String quoteName(String name) {
        if (SIMPLE_IDENTIFIER.matcher(name).matches()) {
            return name;
        }
        return super.quoteName(name);
    }

    @Override
    public String placeholder() {
        return "%s";
    }

    @Override
    public String lookupCast(LookupType lookupType) {
        return switch (lookupType) {
            case IEXACT, ICONTAINS, ISTARTSWITH, IENDSWITH -> "UPPER(%s)";
            default -> "%s";
        };
    }

    @Override
    public String combineExpression(Connector connector, List<String> subExpressions) {
        String symbol = connector == Connector.MOD ? "%%" : connector.symbol();
        return String.join(" " + symbol + " ", subExpressions);
    }

    @Override
    public String dateIntervalSql(String sql, Connector connector, Duration duration) {
        return ansiInterval(sql, intervalSymbol(connector, duration), duration);
    }
}
