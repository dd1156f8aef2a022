package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A set of rows: the input of a SQL subquery before it is turned into terms.
 *
 * <p>Spaces form chains through {@link #base()}. Each link is either an
 * <em>axis</em>, which changes the row set (a table, a join, a quotient), or
 * an operation that keeps the rows of its base but may drop or reorder
 * them (a filter, a sort). The chain always ends in a {@link RootSpace}.
 *
 * <p>Two flags describe how a link relates to its base:
 * <ul>
 *   <li><b>contracting</b>: every base row yields at most one row;</li>
 *   <li><b>expanding</b>: every base row yields at least one row.</li>
 * </ul>
 * The lattice relations below ({@link #spans}, {@link #conforms},
 * {@link #dominates}) are derived from these flags only; they decide where
 * units can be evaluated and how terms are joined.
 */
public abstract class Space extends Expression {

    private final Space base;
    private final Family family;
    private final boolean isContracting;
    private final boolean isExpanding;
    private final boolean isInflated;

    protected Space(Space base, Family family, boolean isContracting, boolean isExpanding, Binding binding) {
        super(binding);
        this.base = base;
        this.family = family;
        this.isContracting = isContracting;
        this.isExpanding = isExpanding;
        this.isInflated = isRoot() || (base.isInflated() && isAxis());
    }

    // ==================== Properties ====================

    public Space base() {
        return base;
    }

    public Family family() {
        return family;
    }

    public boolean isContracting() {
        return isContracting;
    }

    public boolean isExpanding() {
        return isExpanding;
    }

    public boolean isAxis() {
        return false;
    }

    public boolean isRoot() {
        return false;
    }

    /**
     * Returns false when the operation does not commute with filtering,
     * which is the case for a sort carrying a limit or an offset.
     */
    public boolean isCommutative() {
        return true;
    }

    /**
     * Returns true if the chain consists of axes only.
     */
    public boolean isInflated() {
        return isInflated;
    }

    /**
     * Returns a copy of this link attached to another base.
     */
    public abstract Space withBase(Space base);

    /**
     * Returns the basis without the base, used by {@link #resembles}.
     */
    protected Object[] ownBasis() {
        Object[] basis = basis();
        return Arrays.copyOfRange(basis, 1, basis.length);
    }

    // ==================== Lattice ====================

    /**
     * Returns the chain from this space down to the root.
     */
    public List<Space> unfold() {
        List<Space> ancestors = new ArrayList<>();
        for (Space ancestor = this; ancestor != null; ancestor = ancestor.base) {
            ancestors.add(ancestor);
        }
        return ancestors;
    }

    /**
     * Returns true if both links are the same operation, ignoring their bases.
     */
    public boolean resembles(Space other) {
        return other.getClass() == getClass() && Arrays.equals(ownBasis(), other.ownBasis());
    }

    /**
     * Returns the chain with all non-axis links removed.
     */
    public Space inflate() {
        if (isInflated) {
            return this;
        }
        Space space = null;
        List<Space> ancestors = unfold();
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            Space ancestor = ancestors.get(i);
            if (ancestor.isAxis()) {
                space = ancestor.withBase(space);
            }
        }
        return space;
    }

    /**
     * Removes the non-axis links that are already enforced by the mask.
     */
    public Space prune(Space mask) {
        if (isInflated) {
            return this;
        }
        List<Space> mine = unfold();
        List<Space> theirs = mask.unfold();
        Space space = null;
        while (!mine.isEmpty() && !theirs.isEmpty()) {
            Space my = last(mine);
            Space their = last(theirs);
            if (my.resembles(their)) {
                if (!(my.isCommutative() || my.equals(their))) {
                    return this;
                }
                if (my.isAxis()) {
                    space = my.withBase(space);
                }
                pop(mine);
                pop(theirs);
            } else if (!their.isAxis()) {
                pop(theirs);
            } else if (!my.isAxis()) {
                if (!my.isCommutative()) {
                    return this;
                }
                space = my.withBase(space);
                pop(mine);
            } else {
                break;
            }
        }
        while (!mine.isEmpty()) {
            Space my = pop(mine);
            if (!my.isCommutative()) {
                return this;
            }
            space = my.withBase(space);
        }
        return space;
    }

    /**
     * Returns true if every row of this space has at most one matching row
     * in {@code other}, so a code over {@code other} is singular here.
     */
    public boolean spans(Space other) {
        if (equals(other)) {
            return true;
        }
        List<Space> mine = axes(this);
        List<Space> theirs = axes(other);
        while (!mine.isEmpty() && !theirs.isEmpty() && last(mine).resembles(last(theirs))) {
            pop(mine);
            pop(theirs);
        }
        for (Space axis : theirs) {
            if (!axis.isContracting()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if both spaces produce the same rows.
     */
    public boolean conforms(Space other) {
        if (equals(other)) {
            return true;
        }
        List<Space> mine = unfold();
        List<Space> theirs = other.unfold();
        while (!mine.isEmpty() && !theirs.isEmpty()) {
            Space my = last(mine);
            Space their = last(theirs);
            if (my.resembles(their)) {
                pop(mine);
                pop(theirs);
            } else if (my.isContracting() && my.isExpanding() && !my.isAxis()) {
                pop(mine);
            } else if (their.isContracting() && their.isExpanding() && !their.isAxis()) {
                pop(theirs);
            } else {
                break;
            }
        }
        for (Space ancestor : mine) {
            if (!(ancestor.isContracting() && ancestor.isExpanding())) {
                return false;
            }
        }
        for (Space ancestor : theirs) {
            if (!(ancestor.isContracting() && ancestor.isExpanding())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if every row of {@code other} has a matching row here.
     */
    public boolean dominates(Space other) {
        if (equals(other)) {
            return true;
        }
        List<Space> mine = unfold();
        List<Space> theirs = other.unfold();
        while (!mine.isEmpty() && !theirs.isEmpty()) {
            Space my = last(mine);
            Space their = last(theirs);
            if (my.resembles(their)) {
                pop(mine);
                pop(theirs);
            } else if (their.isContracting() && !their.isAxis()) {
                pop(theirs);
            } else {
                break;
            }
        }
        for (Space ancestor : mine) {
            if (!ancestor.isExpanding()) {
                return false;
            }
        }
        for (Space ancestor : theirs) {
            if (!ancestor.isContracting()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if {@code other} is this space or one of its bases.
     */
    public boolean concludes(Space other) {
        for (Space space = this; space != null; space = space.base) {
            if (space.equals(other)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the nearest axis of the chain, this space included.
     */
    public Space axis() {
        Space axis = this;
        while (!axis.isAxis()) {
            axis = axis.base;
        }
        return axis;
    }

    private static List<Space> axes(Space space) {
        List<Space> axes = new ArrayList<>();
        for (Space ancestor : space.unfold()) {
            if (ancestor.isAxis()) {
                axes.add(ancestor);
            }
        }
        return axes;
    }

    private static Space last(List<Space> spaces) {
        return spaces.get(spaces.size() - 1);
    }

    private static Space pop(List<Space> spaces) {
        return spaces.remove(spaces.size() - 1);
    }
}
