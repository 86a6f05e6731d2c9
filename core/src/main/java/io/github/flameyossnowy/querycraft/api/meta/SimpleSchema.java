package io.github.flameyossnowy.querycraft.api.meta;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Hand-built {@link Schema} for callers that do not derive metadata from entity classes.
 *
 * <pre>{@code
 * Schema schema = SimpleSchema.builder()
 *     .table("orders", t -> t
 *         .id("id", Long.class)
 *         .column("status", String.class)
 *         .manyToOne("customer", "customer_id", "customers", true)
 *         .oneToMany("items", "order_items", "order_id"))
 *     .table("customers", t -> t
 *         .id("id", Long.class)
 *         .column("name", String.class))
 *     .build();
 * }</pre>
 */
public final class SimpleSchema implements Schema {
    private final Map<String, TableModel> tables;

    private SimpleSchema(Map<String, TableModel> tables) {
        this.tables = tables;
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    @Override
    public @NotNull TableModel table(String tableName) {
        TableModel table = tables.get(tableName);
        if (table == null) {
            throw new IllegalArgumentException("Unknown table '" + tableName + "'. Known tables: " + tables.keySet());
        }
        return table;
    }

    @Override
    public boolean hasTable(String tableName) {
        return tables.containsKey(tableName);
    }

    public Collection<TableModel> tables() {
        return Collections.unmodifiableCollection(tables.values());
    }

    public static final class Builder {
        private final Map<String, TableBuilder> tables = new LinkedHashMap<>();

        Builder() {}

        public Builder table(String tableName, Consumer<TableBuilder> definition) {
            TableBuilder builder = tables.computeIfAbsent(tableName, TableBuilder::new);
            definition.accept(builder);
            return this;
        }

        public SimpleSchema build() {
            Map<String, TableModel> built = new LinkedHashMap<>();
            SimpleSchema schema = new SimpleSchema(built);
            for (TableBuilder table : tables.values()) {
                built.put(table.tableName, table.build(schema));
            }
            return schema;
        }
    }

    public static final class TableBuilder {
        private final String tableName;
        private final List<FieldSpec> fields = new ArrayList<>();
        private String primaryKey;

        TableBuilder(String tableName) {
            this.tableName = tableName;
        }

        public TableBuilder id(String name, Class<?> type) {
            this.primaryKey = name;
            fields.add(new FieldSpec(name, name, type, false, null, null, null));
            return this;
        }

        public TableBuilder column(String name, Class<?> type) {
            return column(name, name, type, false);
        }

        public TableBuilder column(String name, Class<?> type, boolean nullable) {
            return column(name, name, type, nullable);
        }

        public TableBuilder column(String name, String columnName, Class<?> type, boolean nullable) {
            fields.add(new FieldSpec(name, columnName, type, nullable, null, null, null));
            return this;
        }

        /**
         * Forward foreign key joined against the target's primary key.
         */
        public TableBuilder manyToOne(String name, String columnName, String targetTable, boolean nullable) {
            fields.add(new FieldSpec(name, columnName, Object.class, nullable, RelationshipKind.MANY_TO_ONE, targetTable, null));
            return this;
        }

        public TableBuilder oneToOne(String name, String columnName, String targetTable, boolean nullable) {
            fields.add(new FieldSpec(name, columnName, Object.class, nullable, RelationshipKind.ONE_TO_ONE, targetTable, null));
            return this;
        }

        /**
         * Reverse relation: rows of {@code targetTable} whose {@code targetColumn} points at this table's primary key.
         */
        public TableBuilder oneToMany(String name, String targetTable, String targetColumn) {
            fields.add(new FieldSpec(name, null, Collection.class, true, RelationshipKind.ONE_TO_MANY, targetTable, targetColumn));
            return this;
        }

        TableModel build(SimpleSchema schema) {
            if (primaryKey == null) {
                throw new IllegalStateException("Table '" + tableName + "' has no primary key");
            }

            SimpleTableModel table = new SimpleTableModel(tableName);
            String pkColumn = null;
            for (FieldSpec spec : fields) {
                if (spec.name.equals(primaryKey)) {
                    pkColumn = spec.columnName;
                }
            }

            for (FieldSpec spec : fields) {
                RelationshipModel relationship = null;
                String columnName = spec.columnName;
                if (spec.kind != null) {
                    if (spec.kind.isMultiValued()) {
                        columnName = pkColumn;
                        relationship = new SimpleRelationshipModel(schema, spec.name, spec.kind, spec.targetTable, pkColumn, spec.targetColumn, true);
                    } else {
                        relationship = new SimpleRelationshipModel(schema, spec.name, spec.kind, spec.targetTable, spec.columnName, null, spec.nullable);
                    }
                }
                table.add(new SimpleFieldModel(spec.name, columnName, spec.type, spec.name.equals(primaryKey), spec.nullable, relationship));
            }
            return table;
        }
    }

    private record FieldSpec(
        String name,
        String columnName,
        Class<?> type,
        boolean nullable,
        @Nullable RelationshipKind kind,
        @Nullable String targetTable,
        @Nullable String targetColumn
    ) {}

    private static final class SimpleTableModel implements TableModel {
        private final String tableName;
        private final Map<String, FieldModel> byName = new LinkedHashMap<>();
        private final List<FieldModel> columns = new ArrayList<>();
        private FieldModel primaryKey;

        SimpleTableModel(String tableName) {
            this.tableName = tableName;
        }

        void add(FieldModel field) {
            byName.put(field.name(), field);
            RelationshipModel relationship = field.relationshipModel();
            if (relationship == null || !relationship.isMultiValued()) {
                columns.add(field);
            }
            if (field.id()) {
                primaryKey = field;
            }
        }

        @Override
        public String tableName() {
            return tableName;
        }

        @Override
        public List<FieldModel> fields() {
            return Collections.unmodifiableList(columns);
        }

        @Override
        public @Nullable FieldModel fieldByName(String name) {
            return byName.get(name);
        }

        @Override
        public FieldModel getPrimaryKey() {
            return primaryKey;
        }

        @Override
        public List<String> fieldNames() {
            return List.copyOf(byName.keySet());
        }

        @Override
        public String toString() {
            return "TableModel[" + tableName + "]";
        }
    }

    private record SimpleFieldModel(
        String name,
        String columnName,
        Class<?> type,
        boolean id,
        boolean nullable,
        @Nullable RelationshipModel relationshipModel
    ) implements FieldModel {}

    private static final class SimpleRelationshipModel implements RelationshipModel {
        private final Schema schema;
        private final String fieldName;
        private final RelationshipKind kind;
        private final String targetTable;
        private final String localColumn;
        private final @Nullable String targetColumn;
        private final boolean nullable;

        SimpleRelationshipModel(
            Schema schema,
            String fieldName,
            RelationshipKind kind,
            String targetTable,
            String localColumn,
            @Nullable String targetColumn,
            boolean nullable
        ) {
            this.schema = schema;
            this.fieldName = fieldName;
            this.kind = kind;
            this.targetTable = targetTable;
            this.localColumn = localColumn;
            this.targetColumn = targetColumn;
            this.nullable = nullable;
        }

        @Override
        public String fieldName() {
            return fieldName;
        }

        @Override
        public RelationshipKind relationshipKind() {
            return kind;
        }

        @Override
        public TableModel target() {
            return schema.table(targetTable);
        }

        @Override
        public String localColumn() {
            return localColumn;
        }

        @Override
        public String targetColumn() {
            // forward relations point at the target's primary key
            return targetColumn != null ? targetColumn : target().getPrimaryKey().columnName();
        }

        @Override
        public boolean nullable() {
            return nullable;
        }

        @Override
        public String toString() {
            return "Relationship[" + fieldName + " -> " + targetTable + "]";
        }
    }
}
