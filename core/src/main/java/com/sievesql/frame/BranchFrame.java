package com.sievesql.frame;

import com.sievesql.compiler.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A {@code SELECT} statement.
 *
 * <p>Every item of {@code order} is a {@code SORT_DIRECTION} formula
 * wrapping the sort key. {@code where} and {@code having} are conditions
 * or null.
 */
public abstract class BranchFrame extends Frame {

    private final List<Anchor> include;
    private final List<NestedFrame> embed;
    private final List<Phrase> select;
    private final Phrase where;
    private final List<Phrase> group;
    private final Phrase having;
    private final List<Phrase> order;
    private final Integer limit;
    private final Integer offset;

    protected BranchFrame(List<Anchor> include, List<NestedFrame> embed, List<Phrase> select, Phrase where,
                          List<Phrase> group, Phrase having, List<Phrase> order, Integer limit, Integer offset,
                          int tag, Term term) {
        super(tag, term);
        Objects.requireNonNull(select, "select must not be null");
        if (select.isEmpty()) {
            throw new IllegalArgumentException("a frame must select at least one phrase");
        }
        if (!include.isEmpty() && !include.get(0).isLeading()) {
            throw new IllegalArgumentException("the first anchor must be leading");
        }
        this.include = List.copyOf(include);
        this.embed = List.copyOf(embed);
        this.select = List.copyOf(select);
        this.where = where;
        this.group = List.copyOf(group);
        this.having = having;
        this.order = List.copyOf(order);
        this.limit = limit;
        this.offset = offset;
    }

    public List<Anchor> include() {
        return include;
    }

    /**
     * Returns the correlated subqueries used by the phrases of this frame.
     */
    public List<NestedFrame> embed() {
        return embed;
    }

    public List<Phrase> select() {
        return select;
    }

    public Phrase where() {
        return where;
    }

    public List<Phrase> group() {
        return group;
    }

    public Phrase having() {
        return having;
    }

    public List<Phrase> order() {
        return order;
    }

    public Integer limit() {
        return limit;
    }

    public Integer offset() {
        return offset;
    }

    public boolean isGrouped() {
        return !group.isEmpty() || having != null;
    }

    public boolean isSliced() {
        return limit != null || offset != null;
    }

    @Override
    public List<Frame> kids() {
        List<Frame> kids = new ArrayList<>();
        for (Anchor anchor : include) {
            kids.add(anchor.frame());
        }
        kids.addAll(embed);
        return kids;
    }

    /**
     * Returns a frame of the same kind and tag with the given clauses.
     */
    public abstract BranchFrame with(List<Anchor> include, List<NestedFrame> embed, List<Phrase> select,
                                     Phrase where, List<Phrase> group, Phrase having, List<Phrase> order,
                                     Integer limit, Integer offset);

    @Override
    protected Object[] basis() {
        return new Object[] {include, embed, select, where, group, having, order, limit, offset};
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("(").append(tag()).append(") SELECT ").append(select);
        if (!include.isEmpty()) {
            sb.append(" ").append(include);
        }
        if (where != null) {
            sb.append(" WHERE ").append(where);
        }
        if (!group.isEmpty()) {
            sb.append(" GROUP BY ").append(group);
        }
        if (having != null) {
            sb.append(" HAVING ").append(having);
        }
        if (!order.isEmpty()) {
            sb.append(" ORDER BY ").append(order);
        }
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        if (offset != null) {
            sb.append(" OFFSET ").append(offset);
        }
        return sb.toString();
    }
}
