package com.sievesql.space;

import com.sievesql.binding.Binding;

import java.util.List;

/**
 * An axis whose rows are the rows of another space, the seed, reattached
 * to a new base.
 *
 * <p>Companions are extra codes over the seed that should be computed in
 * the same subquery. They do not take part in equality.
 */
public abstract class CoveringSpace extends Space {

    private final Space seed;
    private final Space ground;
    private final List<Code> companions;

    protected CoveringSpace(Space base, Family family, Space seed, Space ground,
                            boolean isContracting, boolean isExpanding,
                            List<Code> companions, Binding binding) {
        super(base, family, isContracting, isExpanding, binding);
        this.seed = seed;
        this.ground = ground;
        this.companions = List.copyOf(companions);
    }

    /**
     * Finds the topmost axis of the seed that is not spanned by the base.
     */
    protected static Space groundOf(Space base, Space seed) {
        Space ground = seed.axis();
        if (!base.spans(ground)) {
            while (!base.spans(ground.base())) {
                ground = ground.base();
            }
        }
        return ground;
    }

    public Space seed() {
        return seed;
    }

    public Space ground() {
        return ground;
    }

    public List<Code> companions() {
        return companions;
    }

    @Override
    public boolean isAxis() {
        return true;
    }

    /**
     * Returns a copy carrying the given companion codes.
     */
    public abstract CoveringSpace withCompanions(List<Code> companions);
}
