package com.sievesql.compiler;

import com.sievesql.binding.Binding;
import com.sievesql.mark.Mark;
import com.sievesql.mark.Marked;
import com.sievesql.space.Space;
import com.sievesql.space.Unit;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the term tree: a relational operation that becomes a SQL
 * subquery, a join or a clause once assembled.
 *
 * <p>Every term carries:
 * <ul>
 *   <li>a unique {@code tag} assigned by the compiler;</li>
 *   <li>the {@code space} whose rows it produces;</li>
 *   <li>the {@code baseline}, the lowest axis of the space it covers; the
 *       axes below the baseline must be supplied by a parent term;</li>
 *   <li>the {@code routes}, mapping each unit the term can export to the
 *       tag of the descendant term that evaluates it.</li>
 * </ul>
 */
public abstract class Term implements Marked {

    private final int tag;
    private final List<Term> kids;
    private final Space space;
    private final Space backbone;
    private final Space baseline;
    private final Map<Unit, Integer> routes;
    private final Map<Integer, Integer> offsprings;

    protected Term(int tag, List<Term> kids, Space space, Space baseline, Map<Unit, Integer> routes) {
        Objects.requireNonNull(space, "space must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");
        if (!space.concludes(baseline) || !baseline.isInflated()) {
            throw new IllegalArgumentException("invalid baseline " + baseline + " for " + space);
        }
        this.tag = tag;
        this.kids = List.copyOf(kids);
        this.space = space;
        this.backbone = space.inflate();
        this.baseline = baseline;
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
        Map<Integer, Integer> offsprings = new HashMap<>();
        for (Term kid : this.kids) {
            offsprings.put(kid.tag, kid.tag);
            for (Integer offspring : kid.offsprings.keySet()) {
                offsprings.put(offspring, kid.tag);
            }
        }
        this.offsprings = Collections.unmodifiableMap(offsprings);
    }

    public int tag() {
        return tag;
    }

    public List<Term> kids() {
        return kids;
    }

    public Space space() {
        return space;
    }

    public Space backbone() {
        return backbone;
    }

    public Space baseline() {
        return baseline;
    }

    public Map<Unit, Integer> routes() {
        return routes;
    }

    /**
     * Maps the tag of every descendant to the tag of the kid it descends
     * from.
     */
    public Map<Integer, Integer> offsprings() {
        return offsprings;
    }

    public boolean isNullary() {
        return kids.isEmpty();
    }

    public Binding binding() {
        return space.binding();
    }

    @Override
    public Mark mark() {
        return space.mark();
    }

    /**
     * Returns a mutable copy of the routes, to extend in a parent term.
     */
    public Map<Unit, Integer> copyRoutes() {
        return new LinkedHashMap<>(routes);
    }
}
