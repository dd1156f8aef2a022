package com.sievesql.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A database schema: a named collection of tables.
 *
 * <p>The priority orders schemas the way the database search path does;
 * when two tables share a name, the one from the schema with the higher
 * priority is referred to by its bare name.
 */
public final class Schema {

    private final String name;
    private final int priority;
    private final List<Table> tables = new ArrayList<>();

    Schema(String name, int priority) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.priority = priority;
    }

    /**
     * Returns the schema name; an empty name denotes the default namespace.
     */
    public String name() {
        return name;
    }

    public int priority() {
        return priority;
    }

    public List<Table> tables() {
        return Collections.unmodifiableList(tables);
    }

    /**
     * Finds a table by name.
     *
     * @param tableName the table name
     * @return the table, or null if the schema has no such table
     */
    public Table table(String tableName) {
        for (Table table : tables) {
            if (table.name().equals(tableName)) {
                return table;
            }
        }
        return null;
    }

    void add(Table table) {
        tables.add(table);
    }

    @Override
    public String toString() {
        return name.isEmpty() ? "<default>" : name;
    }
}
