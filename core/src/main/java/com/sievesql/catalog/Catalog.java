package com.sievesql.catalog;

import com.sievesql.types.Domain;
import com.sievesql.types.IdentityDomain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable snapshot of the database structure: schemas, tables,
 * columns and keys, together with the attribute names derived from them.
 *
 * <p>Catalogs are built with {@link CatalogBuilder} or loaded from a JSON
 * description with {@link CatalogLoader}. Attribute names and row
 * identities are computed once, when the catalog is created, so a catalog
 * can be shared by concurrent translations.
 */
public final class Catalog {

    private final List<Schema> schemas;
    private final List<Label> homeLabels;
    private final Map<Table, List<Label>> labelsByTable;
    private final Map<Table, List<Arc>> identityByTable;

    Catalog(List<Schema> schemas) {
        this.schemas = List.copyOf(Objects.requireNonNull(schemas, "schemas must not be null"));
        this.homeLabels = List.copyOf(Classifier.classifyHome(this.schemas));
        Map<Table, List<Label>> labels = new HashMap<>();
        for (Table table : tables()) {
            labels.put(table, List.copyOf(Classifier.classifyTable(table)));
        }
        this.labelsByTable = Collections.unmodifiableMap(labels);
        Map<Table, List<Arc>> identities = new HashMap<>();
        for (Table table : tables()) {
            List<Arc> identity = Classifier.identify(table, labels, new HashSet<>());
            if (identity != null) {
                identities.put(table, List.copyOf(identity));
            }
        }
        this.identityByTable = Collections.unmodifiableMap(identities);
    }

    /**
     * Normalizes an attribute name the way catalog labels are normalized:
     * NFC form, lower case, non-word characters replaced with underscores.
     *
     * @param name a name as written in a query
     * @return the lookup key
     */
    public static String normalize(String name) {
        return Classifier.normalize(name);
    }

    public List<Schema> schemas() {
        return schemas;
    }

    /**
     * Finds a schema by name.
     *
     * @param name the schema name
     * @return the schema, or null if there is no such schema
     */
    public Schema schema(String name) {
        for (Schema schema : schemas) {
            if (schema.name().equals(name)) {
                return schema;
            }
        }
        return null;
    }

    /**
     * Returns all tables of all schemas.
     */
    public List<Table> tables() {
        List<Table> tables = new ArrayList<>();
        for (Schema schema : schemas) {
            tables.addAll(schema.tables());
        }
        return tables;
    }

    /**
     * Returns the names of the tables reachable from the home scope.
     */
    public List<Label> homeLabels() {
        return homeLabels;
    }

    /**
     * Returns the attribute names of a table: columns, then links.
     *
     * @param table a table of this catalog
     * @return the table labels
     */
    public List<Label> labels(Table table) {
        List<Label> labels = labelsByTable.get(table);
        if (labels == null) {
            throw new IllegalArgumentException("Table " + table + " does not belong to the catalog");
        }
        return labels;
    }

    /**
     * Returns the arcs forming the identity of the table rows.
     *
     * @param table a table of this catalog
     * @return the identity arcs, or null if the table rows cannot be identified
     */
    public List<Arc> identity(Table table) {
        return identityByTable.get(table);
    }

    /**
     * Returns the domain of the identity of the table rows.
     *
     * @param table a table of this catalog
     * @return the identity domain, or null if the table rows cannot be identified
     */
    public IdentityDomain identityDomain(Table table) {
        List<Arc> identity = identity(table);
        if (identity == null) {
            return null;
        }
        List<Domain> labels = new ArrayList<>();
        for (Arc arc : identity) {
            if (arc instanceof ColumnArc columnArc) {
                labels.add(columnArc.column().domain());
            } else if (arc instanceof ChainArc chainArc) {
                labels.add(identityDomain(chainArc.target()));
            }
        }
        return new IdentityDomain(labels);
    }

    @Override
    public String toString() {
        return String.format("Catalog(schemas=%s, tables=%d)", schemas, tables().size());
    }
}
