package io.github.flameyossnowy.querycraft.sql;

import io.github.flameyossnowy.querycraft.api.expression.Connector;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Dialect-specific SQL fragment builders.
 *
 * <p>Templates returned by {@link #operator}, {@link #lookupCast} and
 * {@link #datetimeCastSql} contain a single {@code %s} slot that the caller
 * fills with the compiled operand. The slot marker is independent of
 * {@link #placeholder()}, the bind marker written into the final SQL.</p>
 */
public interface DatabaseOperations {
    String getName();

    String quoteName(String name);

    /**
     * Positional bind marker, {@code ?} for JDBC drivers, {@code %s} for format-style drivers.
     */
    String placeholder();

    /**
     * Operator template for the right-hand side of a comparison, e.g. {@code "= %s"}.
     *
     * @throws UnsupportedOperationException for lookups rendered structurally ({@code in}, {@code range}, {@code isnull})
     */
    String operator(LookupType lookupType);

    /**
     * Template applied to the left-hand side of a comparison.
     */
    default String lookupCast(LookupType lookupType) {
        return "%s";
    }

    /**
     * Template wrapped around the bind marker of a temporal literal.
     */
    default String datetimeCastSql() {
        return "%s";
    }

    default String combineExpression(Connector connector, List<String> subExpressions) {
        return String.join(" " + connector.symbol() + " ", subExpressions);
    }

    String dateIntervalSql(String sql, Connector connector, Duration duration);

    /**
     * Value for LIMIT when only an offset is wanted, or null if OFFSET may stand alone.
     */
    @Nullable
    default String noLimitValue() {
        return null;
    }

    default String prepForLikeQuery(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    default String prepForIexactQuery(String value) {
        return prepForLikeQuery(value);
    }
}
