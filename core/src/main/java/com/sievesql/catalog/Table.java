package com.sievesql.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A table of the catalog.
 *
 * <p>Tables are compared by identity: the catalog contains exactly one
 * instance per table. Keys are attached by {@link CatalogBuilder} before
 * the catalog is published and never change afterwards.
 */
public final class Table {

    private final Schema schema;
    private final String name;
    private final List<Column> columns = new ArrayList<>();
    private UniqueKey primaryKey;
    private final List<UniqueKey> uniqueKeys = new ArrayList<>();
    private final List<ForeignKey> foreignKeys = new ArrayList<>();
    private final List<ForeignKey> referringForeignKeys = new ArrayList<>();

    Table(Schema schema, String name) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public Schema schema() {
        return schema;
    }

    public String name() {
        return name;
    }

    public List<Column> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Finds a column by name.
     *
     * @param columnName the column name
     * @return the column, or null if the table has no such column
     */
    public Column column(String columnName) {
        for (Column column : columns) {
            if (column.name().equals(columnName)) {
                return column;
            }
        }
        return null;
    }

    /**
     * Returns the primary key, or null if the table has none.
     */
    public UniqueKey primaryKey() {
        return primaryKey;
    }

    /**
     * Returns the unique keys other than the primary key.
     */
    public List<UniqueKey> uniqueKeys() {
        return Collections.unmodifiableList(uniqueKeys);
    }

    /**
     * Returns the foreign keys originating from this table.
     */
    public List<ForeignKey> foreignKeys() {
        return Collections.unmodifiableList(foreignKeys);
    }

    /**
     * Returns the foreign keys targeting this table.
     */
    public List<ForeignKey> referringForeignKeys() {
        return Collections.unmodifiableList(referringForeignKeys);
    }

    void addColumn(Column column) {
        columns.add(column);
    }

    void addUniqueKey(UniqueKey key) {
        if (key.isPrimary()) {
            primaryKey = key;
        } else {
            uniqueKeys.add(key);
        }
    }

    void addForeignKey(ForeignKey key) {
        foreignKeys.add(key);
    }

    void addReferringForeignKey(ForeignKey key) {
        referringForeignKeys.add(key);
    }

    @Override
    public String toString() {
        return schema.name().isEmpty() ? name : schema.name() + "." + name;
    }
}
