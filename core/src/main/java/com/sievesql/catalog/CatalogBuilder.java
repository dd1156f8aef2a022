package com.sievesql.catalog;

import com.sievesql.types.Domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent builder of {@link Catalog} instances.
 *
 * <p>Example usage:
 * <pre>
 *   CatalogBuilder builder = new CatalogBuilder();
 *   builder.table("school")
 *       .column("code", new TextDomain(), false)
 *       .column("name", new TextDomain(), false)
 *       .primaryKey("code");
 *   builder.table("department")
 *       .column("code", new TextDomain(), false)
 *       .column("school_code", new TextDomain(), true)
 *       .primaryKey("code")
 *       .foreignKey("school_code", "school", "code");
 *   Catalog catalog = builder.build();
 * </pre>
 *
 * <p>Tables are added to the current schema, which is an unnamed schema
 * until {@link #schema(String, int)} is called. Foreign key targets are
 * resolved when the catalog is built, so tables may be declared in any order.
 */
public final class CatalogBuilder {

    private final Map<String, SchemaSpec> schemas = new LinkedHashMap<>();
    private SchemaSpec current;

    private static final class SchemaSpec {
        final String name;
        int priority;
        final List<TableBuilder> tables = new ArrayList<>();

        SchemaSpec(String name, int priority) {
            this.name = name;
            this.priority = priority;
        }
    }

    private record ColumnSpec(String name, Domain domain, boolean isNullable, boolean hasDefault) {
    }

    private record KeySpec(List<String> columns, boolean isPrimary) {
    }

    private record ForeignKeySpec(List<String> columns, String target, List<String> targetColumns) {
    }

    /**
     * Builder of a single table; obtained from {@link CatalogBuilder#table(String)}.
     */
    public static final class TableBuilder {
        private final String name;
        private final List<ColumnSpec> columns = new ArrayList<>();
        private final List<KeySpec> keys = new ArrayList<>();
        private final List<ForeignKeySpec> foreignKeys = new ArrayList<>();

        private TableBuilder(String name) {
            this.name = name;
        }

        /**
         * Adds a nullable column.
         */
        public TableBuilder column(String columnName, Domain domain) {
            return column(columnName, domain, true);
        }

        public TableBuilder column(String columnName, Domain domain, boolean isNullable) {
            return column(columnName, domain, isNullable, false);
        }

        public TableBuilder column(String columnName, Domain domain, boolean isNullable, boolean hasDefault) {
            Objects.requireNonNull(columnName, "columnName must not be null");
            Objects.requireNonNull(domain, "domain must not be null");
            for (ColumnSpec column : columns) {
                if (column.name().equals(columnName)) {
                    throw new IllegalArgumentException(
                        "Duplicate column '" + columnName + "' in table '" + name + "'");
                }
            }
            columns.add(new ColumnSpec(columnName, domain, isNullable, hasDefault));
            return this;
        }

        public TableBuilder primaryKey(String... columnNames) {
            for (KeySpec key : keys) {
                if (key.isPrimary()) {
                    throw new IllegalArgumentException("Table '" + name + "' already has a primary key");
                }
            }
            keys.add(new KeySpec(List.of(columnNames), true));
            return this;
        }

        public TableBuilder uniqueKey(String... columnNames) {
            keys.add(new KeySpec(List.of(columnNames), false));
            return this;
        }

        /**
         * Adds a single-column foreign key.
         *
         * @param columnName the referring column
         * @param target the referred table, as {@code name} or {@code schema.name}
         * @param targetColumn the referred column
         */
        public TableBuilder foreignKey(String columnName, String target, String targetColumn) {
            return foreignKey(List.of(columnName), target, List.of(targetColumn));
        }

        public TableBuilder foreignKey(List<String> columnNames, String target, List<String> targetColumns) {
            foreignKeys.add(new ForeignKeySpec(List.copyOf(columnNames), target, List.copyOf(targetColumns)));
            return this;
        }
    }

    /**
     * Makes the given schema current, creating it if necessary.
     *
     * @param name the schema name
     * @param priority the schema priority; higher wins bare table names
     * @return this builder
     */
    public CatalogBuilder schema(String name, int priority) {
        Objects.requireNonNull(name, "name must not be null");
        current = schemas.computeIfAbsent(name, n -> new SchemaSpec(n, priority));
        current.priority = priority;
        return this;
    }

    /**
     * Starts a new table in the current schema.
     *
     * @param name the table name
     * @return the table builder
     */
    public TableBuilder table(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (current == null) {
            schema("", 0);
        }
        for (TableBuilder table : current.tables) {
            if (table.name.equals(name)) {
                throw new IllegalArgumentException("Duplicate table '" + name + "'");
            }
        }
        TableBuilder table = new TableBuilder(name);
        current.tables.add(table);
        return table;
    }

    /**
     * Builds the catalog.
     *
     * @return the catalog
     * @throws IllegalArgumentException if a key refers to an unknown table or column
     */
    public Catalog build() {
        List<Schema> result = new ArrayList<>();
        Map<TableBuilder, Table> tables = new LinkedHashMap<>();
        for (SchemaSpec spec : schemas.values()) {
            Schema schema = new Schema(spec.name, spec.priority);
            for (TableBuilder builder : spec.tables) {
                Table table = new Table(schema, builder.name);
                for (ColumnSpec column : builder.columns) {
                    table.addColumn(new Column(table, column.name(), column.domain(),
                                               column.isNullable(), column.hasDefault()));
                }
                for (KeySpec key : builder.keys) {
                    table.addUniqueKey(new UniqueKey(table, columns(table, key.columns()), key.isPrimary(), false));
                }
                schema.add(table);
                tables.put(builder, table);
            }
            result.add(schema);
        }
        for (Map.Entry<TableBuilder, Table> entry : tables.entrySet()) {
            Table origin = entry.getValue();
            for (ForeignKeySpec spec : entry.getKey().foreignKeys) {
                Table target = resolve(result, origin.schema(), spec.target());
                ForeignKey key = new ForeignKey(origin, columns(origin, spec.columns()),
                                                target, columns(target, spec.targetColumns()), false);
                origin.addForeignKey(key);
                target.addReferringForeignKey(key);
                for (Column column : key.originColumns()) {
                    column.addForeignKey(key);
                }
            }
        }
        return new Catalog(result);
    }

    private static List<Column> columns(Table table, List<String> names) {
        List<Column> columns = new ArrayList<>();
        for (String name : names) {
            Column column = table.column(name);
            if (column == null) {
                throw new IllegalArgumentException("Unknown column '" + name + "' in table '" + table + "'");
            }
            columns.add(column);
        }
        return columns;
    }

    private static Table resolve(List<Schema> schemas, Schema home, String name) {
        int dot = name.indexOf('.');
        if (dot >= 0) {
            String schemaName = name.substring(0, dot);
            String tableName = name.substring(dot + 1);
            for (Schema schema : schemas) {
                if (schema.name().equals(schemaName) && schema.table(tableName) != null) {
                    return schema.table(tableName);
                }
            }
        } else {
            if (home.table(name) != null) {
                return home.table(name);
            }
            for (Schema schema : schemas) {
                if (schema.table(name) != null) {
                    return schema.table(name);
                }
            }
        }
        throw new IllegalArgumentException("Unknown table '" + name + "'");
    }
}
