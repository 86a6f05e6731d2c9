package io.github.flameyossnowy.querycraft.sql.dialect;

import io.github.flameyossnowy.querycraft.api.expression.Connector;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;
import io.github.flameyossnowy.querycraft.sql.DatabaseOperations;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Shared operator table and identifier quoting for the bundled dialects.
 */
public abstract class AbstractDatabaseOperations implements DatabaseOperations {
    private final String name;
    private final char quoteChar;
    private final Map<LookupType, String> operators;

    protected AbstractDatabaseOperations(String name, char quoteChar, Map<LookupType, String> operators) {
        this.name = name;
        this.quoteChar = quoteChar;
        this.operators = new EnumMap<>(operators);
    }

    @Override
    public String getName() {
        return name;
    }

    public char quoteChar() {
        return quoteChar;
    }

    @Override
    public String quoteName(String name) {
        if (name.length() > 1 && name.charAt(0) == quoteChar && name.charAt(name.length() - 1) == quoteChar) {
            return name;
        }
        String escaped = name.replace(String.valueOf(quoteChar), String.valueOf(quoteChar) + quoteChar);
        return quoteChar + escaped + quoteChar;
    }

    @Override
    public String placeholder() {
        return "?";
    }

    @Override
    public String operator(LookupType lookupType) {
        String operator = operators.get(lookupType);
        if (operator == null) {
            throw new UnsupportedOperationException(name + " has no operator template for '" + lookupType.keyword() + "'");
        }
        return operator;
    }

    /**
     * Renders {@code (sql op INTERVAL '...')} using the ANSI day/second/microsecond literal.
     */
    protected static String ansiInterval(String sql, String symbol, Duration duration) {
        return "(" + sql + " " + symbol + " INTERVAL '" + days(duration) + " days "
            + secondsOfDay(duration) + " seconds " + microsOfSecond(duration) + " microseconds')";
    }

    /**
     * Operator applied to the magnitude of {@code duration}; a negative duration flips it,
     * so the interval parts below are never negative.
     */
    protected static String intervalSymbol(Connector connector, Duration duration) {
        if (connector != Connector.ADD && connector != Connector.SUB) {
            throw new IllegalArgumentException("Durations can only be added or subtracted, not combined with " + connector.symbol());
        }
        if (!duration.isNegative()) {
            return connector.symbol();
        }
        return (connector == Connector.ADD ? Connector.SUB : Connector.ADD).symbol();
    }

    protected static long days(Duration duration) {
        return duration.abs().toDays();
    }

    protected static long secondsOfDay(Duration duration) {
        Duration magnitude = duration.abs();
        return magnitude.minusDays(magnitude.toDays()).getSeconds();
    }

    protected static long microsOfSecond(Duration duration) {
        return duration.abs().getNano() / 1_000L;
    }

    @Override
    public String toString() {
        return name;
    }
}
