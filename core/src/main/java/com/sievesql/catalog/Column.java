package com.sievesql.catalog;

import com.sievesql.types.Domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A table column.
 */
public final class Column {

    private final Table table;
    private final String name;
    private final Domain domain;
    private final boolean isNullable;
    private final boolean hasDefault;
    private final List<ForeignKey> foreignKeys = new ArrayList<>();

    Column(Table table, String name, Domain domain, boolean isNullable, boolean hasDefault) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.isNullable = isNullable;
        this.hasDefault = hasDefault;
    }

    public Table table() {
        return table;
    }

    public String name() {
        return name;
    }

    public Domain domain() {
        return domain;
    }

    public boolean isNullable() {
        return isNullable;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    /**
     * Returns the foreign keys this column is an origin column of.
     */
    public List<ForeignKey> foreignKeys() {
        return Collections.unmodifiableList(foreignKeys);
    }

    void addForeignKey(ForeignKey key) {
        foreignKeys.add(key);
    }

    @Override
    public String toString() {
        return table + "." + name;
    }
}
