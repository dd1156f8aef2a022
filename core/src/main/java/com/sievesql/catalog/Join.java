package com.sievesql.catalog;

import java.util.List;

/**
 * A step of navigation from one table to another along a foreign key.
 *
 * <p>A join is <em>expanding</em> when every origin row has at least one
 * matching target row, and <em>contracting</em> when every origin row has
 * at most one. A join that is both expanding and contracting preserves the
 * number of rows.
 */
public sealed interface Join permits DirectJoin, ReverseJoin {

    ForeignKey foreignKey();

    Table origin();

    Table target();

    List<Column> originColumns();

    List<Column> targetColumns();

    boolean isExpanding();

    boolean isContracting();

    /**
     * Returns true if the join follows the foreign key from the referring table.
     */
    boolean isDirect();

    /**
     * Returns the join going in the opposite direction.
     */
    Join reverse();
}
