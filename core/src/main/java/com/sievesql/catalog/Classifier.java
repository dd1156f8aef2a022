package com.sievesql.catalog;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Assigns attribute names to the arcs of the home scope and of each table.
 *
 * <p>Every arc bids on one or more names, each with a weight. Names are
 * awarded in order of decreasing weight and, within a weight, shortest
 * name first. A name bid on by several arcs at once is not awarded to any of
 * them and becomes ambiguous, as does a name won by an arc that already has
 * one. Bids:
 * <ul>
 *   <li>a table: its name (weight is the schema priority), and
 *       {@code schema_table} (weight -1);</li>
 *   <li>a column: its name (weight 10);</li>
 *   <li>a direct link: the referring column name without the referred column
 *       name suffix (5), then the target table name (4 when the referring
 *       columns belong to the primary key, 3 otherwise);</li>
 *   <li>a reverse link: the target table name (4 or 3), then
 *       {@code target_via_prefix} (2) and {@code target_via_column} (1).</li>
 * </ul>
 */
final class Classifier {

    private static final Pattern UNSAFE = Pattern.compile("(?U)^(?=\\d)|\\W");

    private record Bid(String name, int weight) {
    }

    private Classifier() {
    }

    /**
     * Normalizes a name: NFC form, lower case, non-word characters replaced
     * with underscores, and an underscore prepended to a leading digit.
     */
    static String normalize(String name) {
        String normal = Normalizer.normalize(name, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        return UNSAFE.matcher(normal).replaceAll("_");
    }

    static List<Label> classifyHome(List<Schema> schemas) {
        List<Arc> arcs = new ArrayList<>();
        for (Schema schema : schemas) {
            for (Table table : schema.tables()) {
                arcs.add(new TableArc(table));
            }
        }
        return classify(arcs, false);
    }

    static List<Label> classifyTable(Table table) {
        Set<Arc> arcs = new LinkedHashSet<>();
        for (Column column : table.columns()) {
            arcs.add(new ColumnArc(table, column, findLink(table, column)));
        }
        for (ForeignKey key : table.foreignKeys()) {
            arcs.add(new ChainArc(table, List.of(new DirectJoin(key))));
        }
        for (ForeignKey key : table.referringForeignKeys()) {
            arcs.add(new ChainArc(table, List.of(new ReverseJoin(key))));
        }
        return classify(new ArrayList<>(arcs), true);
    }

    private static Arc findLink(Table table, Column column) {
        List<Arc> alternatives = new ArrayList<>();
        for (ForeignKey key : column.foreignKeys()) {
            if (key.originColumns().size() == 1) {
                alternatives.add(new ChainArc(table, List.of(new DirectJoin(key))));
            }
        }
        if (alternatives.isEmpty()) {
            return null;
        }
        return alternatives.size() == 1 ? alternatives.get(0) : new AmbiguousArc(alternatives);
    }

    private static List<Label> classify(List<Arc> arcs, boolean publicColumns) {
        Map<Integer, Set<String>> namesByWeight = new TreeMap<>(Comparator.reverseOrder());
        Map<Bid, List<Arc>> arcsByBid = new HashMap<>();
        for (Arc arc : arcs) {
            for (Bid bid : bids(arc)) {
                namesByWeight.computeIfAbsent(bid.weight(), w -> new HashSet<>()).add(bid.name());
                arcsByBid.computeIfAbsent(bid, b -> new ArrayList<>()).add(arc);
            }
        }

        Map<String, Arc> arcByName = new HashMap<>();
        Map<Arc, String> nameByArc = new HashMap<>();
        Map<String, List<Arc>> rejections = new TreeMap<>();
        for (Map.Entry<Integer, Set<String>> entry : namesByWeight.entrySet()) {
            List<String> names = new ArrayList<>(entry.getValue());
            names.sort(Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()));
            for (String name : names) {
                if (arcByName.containsKey(name)) {
                    continue;
                }
                List<Arc> contenders = arcsByBid.get(new Bid(name, entry.getKey()));
                if (contenders.size() > 1 || rejections.containsKey(name)) {
                    rejections.computeIfAbsent(name, n -> new ArrayList<>()).addAll(contenders);
                    continue;
                }
                Arc arc = contenders.get(0);
                if (nameByArc.containsKey(arc)) {
                    rejections.put(name, new ArrayList<>(List.of(arc)));
                    continue;
                }
                arcByName.put(name, arc);
                nameByArc.put(arc, name);
            }
        }

        List<Label> labels = new ArrayList<>();
        for (Arc arc : arcs) {
            String name = nameByArc.get(arc);
            if (name != null) {
                labels.add(new Label(name, arc, publicColumns && arc instanceof ColumnArc));
            }
        }
        for (Map.Entry<String, List<Arc>> entry : rejections.entrySet()) {
            List<Arc> alternatives = new ArrayList<>(new LinkedHashSet<>(entry.getValue()));
            labels.add(new Label(entry.getKey(), new AmbiguousArc(alternatives), false));
        }
        return labels;
    }

    private static List<Bid> bids(Arc arc) {
        List<Bid> bids = new ArrayList<>();
        if (arc instanceof TableArc tableArc) {
            Table table = tableArc.table();
            bids.add(new Bid(table.name(), table.schema().priority()));
            if (!table.schema().name().isEmpty()) {
                bids.add(new Bid(table.schema().name() + " " + table.name(), -1));
            }
        } else if (arc instanceof ColumnArc columnArc) {
            bids.add(new Bid(columnArc.column().name(), 10));
        } else if (arc instanceof ChainArc chainArc) {
            bids.addAll(chainBids(chainArc));
        }
        List<Bid> normalized = new ArrayList<>();
        for (Bid bid : bids) {
            Bid normal = new Bid(normalize(bid.name()), bid.weight());
            if (!normalized.contains(normal)) {
                normalized.add(normal);
            }
        }
        return normalized;
    }

    private static List<Bid> chainBids(ChainArc arc) {
        boolean isPrimary = true;
        for (Join join : arc.joins()) {
            ForeignKey key = join.foreignKey();
            UniqueKey primaryKey = key.origin().primaryKey();
            if (primaryKey == null || !primaryKey.originColumns().containsAll(key.originColumns())) {
                isPrimary = false;
                break;
            }
        }
        boolean isDirect = arc.joins().stream().allMatch(Join::isDirect);
        String target = arc.target().name();
        String prefix = null;
        String column = null;
        if (arc.joins().size() == 1) {
            ForeignKey key = arc.joins().get(0).foreignKey();
            String originName = key.originColumns().get(key.originColumns().size() - 1).name();
            String targetName = key.targetColumns().get(key.targetColumns().size() - 1).name();
            if (originName.endsWith(targetName)) {
                prefix = stripTrailing(originName.substring(0, originName.length() - targetName.length()));
                if (prefix.isEmpty()) {
                    prefix = target;
                }
            }
            column = originName;
        }
        List<Bid> bids = new ArrayList<>();
        if (isDirect && prefix != null) {
            bids.add(new Bid(prefix, 5));
        }
        bids.add(new Bid(target, isPrimary ? 4 : 3));
        if (!isDirect && prefix != null) {
            bids.add(new Bid(target + " via " + prefix, 2));
        }
        if (!isDirect && column != null) {
            bids.add(new Bid(target + " via " + column, 1));
        }
        return bids;
    }

    private static String stripTrailing(String name) {
        int end = name.length();
        while (end > 0 && " _-".indexOf(name.charAt(end - 1)) >= 0) {
            end--;
        }
        return name.substring(0, end);
    }

    /**
     * Finds the arcs that identify a row of the table: the columns of the
     * first non-nullable total unique key, where a prefix of the key columns
     * that forms a foreign key to an identifiable table is replaced by the link.
     *
     * @return the identity arcs, or null if the table has no usable key
     */
    static List<Arc> identify(Table table, Map<Table, List<Label>> labelsByTable, Set<Table> visiting) {
        if (!visiting.add(table)) {
            return null;
        }
        try {
            Set<Arc> arcs = new HashSet<>();
            for (Label label : labelsByTable.get(table)) {
                Arc arc = label.arc();
                if (arc instanceof ColumnArc columnArc) {
                    arcs.add(columnArc);
                    if (columnArc.link() instanceof ChainArc) {
                        arcs.add(columnArc.link());
                    }
                    arcs.add(columnArc.withoutLink());
                } else if (arc instanceof ChainArc) {
                    arcs.add(arc);
                }
            }
            List<UniqueKey> keys = new ArrayList<>();
            if (table.primaryKey() != null) {
                keys.add(table.primaryKey());
            }
            keys.addAll(table.uniqueKeys());
            for (UniqueKey key : keys) {
                if (key.isPartial() || key.originColumns().stream().anyMatch(Column::isNullable)) {
                    continue;
                }
                List<Column> columns = new ArrayList<>(key.originColumns());
                List<Arc> identity = new ArrayList<>();
                while (!columns.isEmpty()) {
                    Arc next = null;
                    int width = 0;
                    for (ForeignKey foreignKey : table.foreignKeys()) {
                        if (foreignKey.isPartial()) {
                            continue;
                        }
                        int size = foreignKey.originColumns().size();
                        if (size <= columns.size() && foreignKey.originColumns().equals(columns.subList(0, size))) {
                            ChainArc link = new ChainArc(table, List.of(new DirectJoin(foreignKey)));
                            if (!arcs.contains(link)
                                    || identify(link.target(), labelsByTable, visiting) == null) {
                                continue;
                            }
                            next = link;
                            width = size;
                            break;
                        }
                    }
                    if (next == null) {
                        ColumnArc columnArc = new ColumnArc(table, columns.get(0), null);
                        if (!arcs.contains(columnArc)) {
                            break;
                        }
                        next = columnArc;
                        width = 1;
                    }
                    identity.add(next);
                    columns.subList(0, width).clear();
                }
                if (columns.isEmpty()) {
                    return identity;
                }
            }
            return null;
        } finally {
            visiting.remove(table);
        }
    }
}
