package io.github.flameyossnowy.querycraft.sql.internals;

import io.github.flameyossnowy.querycraft.api.aggregate.Aggregate;
import io.github.flameyossnowy.querycraft.api.expression.Connector;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;
import io.github.flameyossnowy.querycraft.api.meta.Schema;
import io.github.flameyossnowy.querycraft.api.utils.Logging;
import io.github.flameyossnowy.querycraft.sql.DatabaseOperations;
import io.github.flameyossnowy.querycraft.sql.dialect.GenericOperations;
import io.github.flameyossnowy.querycraft.sql.dialect.MySQLOperations;
import io.github.flameyossnowy.querycraft.sql.dialect.PostgreSQLOperations;
import io.github.flameyossnowy.querycraft.sql.dialect.SQLiteOperations;
import io.github.flameyossnowy.querycraft.sql.internals.query.ParameterizedSql;
import io.github.flameyossnowy.querycraft.sql.internals.query.QueryModel;
import io.github.flameyossnowy.querycraft.sql.internals.query.SelectSqlBuilder;
import io.github.flameyossnowy.querycraft.sql.internals.query.SqlAggregate;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for building and compiling queries against one schema and dialect.
 *
 * <pre>{@code
 * QueryEngine engine = QueryEngine.builder(schema)
 *     .withDialect(QueryEngine.SQLType.POSTGRESQL)
 *     .build();
 *
 * QueryModel query = engine.query("orders");
 * engine.addAggregate(query, Aggregate.count("id").only(Q.where("status", "PAID")), "paid", true);
 * ParameterizedSql sql = engine.compileAggregation(query);
 * }</pre>
 */
public class QueryEngine {
    private final Schema schema;
    private final SQLType sqlType;
    private final SelectSqlBuilder selectSqlBuilder;

    private QueryEngine(Schema schema, SQLType sqlType) {
        this.schema = schema;
        this.sqlType = sqlType;
        this.selectSqlBuilder = new SelectSqlBuilder(sqlType);
    }

    @Contract("_ -> new")
    public static @NotNull Builder builder(@NotNull Schema schema) {
        return new Builder(schema);
    }

    public SQLType getSqlType() {
        return sqlType;
    }

    public Schema getSchema() {
        return schema;
    }

    /**
     * A new, empty query over {@code tableName}.
     *
     * @throws IllegalArgumentException if the schema has no such table
     */
    public @NotNull QueryModel query(String tableName) {
        return new QueryModel(schema.table(tableName));
    }

    public SqlAggregate addAggregate(QueryModel query, Aggregate aggregate, @Nullable String alias, boolean isSummary) {
        return query.addAggregate(aggregate, alias, isSummary);
    }

    public @NotNull ParameterizedSql compile(QueryModel query) {
        ParameterizedSql compiled = selectSqlBuilder.compile(query);
        Logging.info(() -> "Compiled " + sqlType.getName() + " query: " + compiled.sql() + " " + compiled.params());
        return compiled;
    }

    public @NotNull ParameterizedSql compileAggregation(QueryModel query) {
        ParameterizedSql compiled = selectSqlBuilder.compileAggregation(query);
        Logging.info(() -> "Compiled " + sqlType.getName() + " aggregation: " + compiled.sql() + " " + compiled.params());
        return compiled;
    }

    public static final class Builder {
        private final Schema schema;
        private SQLType sqlType = SQLType.GENERIC;

        Builder(Schema schema) {
            this.schema = Objects.requireNonNull(schema, "schema");
        }

        public Builder withDialect(@NotNull SQLType sqlType) {
            this.sqlType = Objects.requireNonNull(sqlType, "sqlType");
            return this;
        }

        public QueryEngine build() {
            return new QueryEngine(schema, sqlType);
        }
    }

    public enum SQLType implements DatabaseOperations {
        GENERIC(new GenericOperations()),
        POSTGRESQL(new PostgreSQLOperations()),
        MYSQL(new MySQLOperations()),
        SQLITE(new SQLiteOperations());

        private final DatabaseOperations operations;

        SQLType(DatabaseOperations operations) {
            this.operations = operations;
        }

        @Override
        public String getName() {
            return operations.getName();
        }

        @Override
        public String quoteName(String name) {
            return operations.quoteName(name);
        }

        @Override
        public String placeholder() {
            return operations.placeholder();
        }

        @Override
        public String operator(LookupType lookupType) {
            return operations.operator(lookupType);
        }

        @Override
        public String lookupCast(LookupType lookupType) {
            return operations.lookupCast(lookupType);
        }

        @Override
        public String datetimeCastSql() {
            return operations.datetimeCastSql();
        }

        @Override
        public String combineExpression(Connector connector, List<String> subExpressions) {
            return operations.combineExpression(connector, subExpressions);
        }

        @Override
        public String dateIntervalSql(String sql, Connector connector, Duration duration) {
            return operations.dateIntervalSql(sql, connector, duration);
        }

        @Override
        public @Nullable String noLimitValue() {
            return operations.noLimitValue();
        }

        @Override
        public String prepForLikeQuery(String value) {
            return operations.prepForLikeQuery(value);
        }

        @Override
        public String prepForIexactQuery(String value) {
            return operations.prepForIexactQuery(value);
        }
    }
}
