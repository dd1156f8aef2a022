package com.sievesql.compiler;

import com.sievesql.catalog.Column;
import com.sievesql.catalog.Join;
import com.sievesql.catalog.Table;
import com.sievesql.catalog.UniqueKey;
import com.sievesql.exception.CompileError;
import com.sievesql.space.Code;
import com.sievesql.space.ColumnUnit;
import com.sievesql.space.ComplementSpace;
import com.sievesql.space.CoveringSpace;
import com.sievesql.space.CoveringUnit;
import com.sievesql.space.FiberTableSpace;
import com.sievesql.space.KernelUnit;
import com.sievesql.space.LocatorSpace;
import com.sievesql.space.MonikerSpace;
import com.sievesql.space.Order;
import com.sievesql.space.OrderedSpace;
import com.sievesql.space.QuotientSpace;
import com.sievesql.space.Space;
import com.sievesql.space.TableSpace;
import com.sievesql.space.Unit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural queries on spaces used to connect terms.
 *
 * <ul>
 *   <li>{@link #arrange} lists the codes that order the rows of a space;</li>
 *   <li>{@link #spread} lists the units a term for the space exports;</li>
 *   <li>{@link #sew} lists the joints that attach a space to a copy of
 *       itself;</li>
 *   <li>{@link #tie} lists the joints that attach an axis to its base.</li>
 * </ul>
 */
public final class Stitcher {

    private Stitcher() {
    }

    // ==================== Arrange ====================

    public static List<Order> arrange(Space space) {
        return arrange(space, true, true);
    }

    /**
     * Returns the ordering of a space without duplicate codes.
     *
     * @param withStrong include explicit sort keys
     * @param withWeak include the implicit keys that make the order total
     */
    public static List<Order> arrange(Space space, boolean withStrong, boolean withWeak) {
        List<Order> order = new ArrayList<>();
        Set<Code> duplicates = new HashSet<>();
        for (Order item : doArrange(space, withStrong, withWeak)) {
            if (duplicates.add(item.code())) {
                order.add(item);
            }
        }
        return order;
    }

    private static List<Order> doArrange(Space space, boolean withStrong, boolean withWeak) {
        if (space.base() == null) {
            return List.of();
        }
        List<Order> order = new ArrayList<>();
        if (space instanceof OrderedSpace ordered) {
            if (withStrong) {
                order.addAll(arrange(ordered.base(), true, false));
                order.addAll(ordered.order());
            }
            if (withWeak) {
                order.addAll(arrange(ordered.base(), false, true));
            }
            return order;
        }
        order.addAll(arrange(space.base(), withStrong, withWeak));
        if (!withWeak) {
            return order;
        }
        if (space instanceof TableSpace tableSpace) {
            if (!tableSpace.isContracting()) {
                Space backbone = tableSpace.inflate();
                for (Column column : identifyingColumns(tableSpace.table())) {
                    order.add(new Order(new ColumnUnit(column, backbone, space.binding()), 1));
                }
            }
        } else if (space instanceof QuotientSpace quotient) {
            Space backbone = quotient.inflate();
            for (Code kernel : quotient.kernels()) {
                order.add(new Order(new KernelUnit(kernel, backbone, kernel.binding()), 1));
            }
        } else if (space instanceof CoveringSpace covering) {
            Space backbone = covering.inflate();
            Space groundBase = covering.ground().base();
            for (Order item : arrange(covering.seed())) {
                if (groundBase == null || !isSpanned(groundBase, item.code())) {
                    order.add(new Order(new CoveringUnit(item.code(), backbone, item.code().binding()),
                            item.direction()));
                }
            }
        }
        return order;
    }

    private static boolean isSpanned(Space space, Code code) {
        for (Unit unit : code.units()) {
            if (!space.spans(unit.space())) {
                return false;
            }
        }
        return true;
    }

    // ==================== Spread ====================

    /**
     * Returns the units a term compiled for the space routes natively.
     */
    public static List<Unit> spread(Space space) {
        List<Unit> units = new ArrayList<>();
        if (!space.isAxis()) {
            for (Unit unit : spread(space.base())) {
                units.add(unit.withSpace(space));
            }
        } else if (space instanceof TableSpace tableSpace) {
            for (Column column : tableSpace.table().columns()) {
                units.add(new ColumnUnit(column, space, space.binding()));
            }
        } else if (space instanceof QuotientSpace quotient) {
            for (Joint joint : tie(quotient.ground())) {
                units.add(new KernelUnit(joint.rop(), space, joint.rop().binding()));
            }
            for (Code kernel : quotient.kernels()) {
                units.add(new KernelUnit(kernel, space, kernel.binding()));
            }
        } else if (space instanceof CoveringSpace covering) {
            for (Unit unit : spread(covering.seed().inflate())) {
                units.add(unit.withSpace(space));
            }
        }
        return units;
    }

    // ==================== Sew ====================

    /**
     * Returns the joints identifying rows of the space with rows of
     * another term over the same space.
     */
    public static List<Joint> sew(Space space) {
        List<Joint> joints = new ArrayList<>();
        if (!space.isAxis()) {
            return sew(space.base());
        }
        if (space instanceof TableSpace tableSpace) {
            List<Column> columns = connectingColumns(tableSpace.table());
            if (columns == null) {
                throw new CompileError("unable to connect a table lacking a primary key", space.mark());
            }
            Space backbone = space.inflate();
            for (Column column : columns) {
                ColumnUnit unit = new ColumnUnit(column, backbone, space.binding());
                joints.add(new Joint(unit, unit));
            }
        } else if (space instanceof QuotientSpace quotient) {
            Space backbone = quotient.inflate();
            for (Joint joint : tie(quotient.ground())) {
                KernelUnit unit = new KernelUnit(joint.rop(), backbone, joint.rop().binding());
                joints.add(new Joint(unit, unit));
            }
            for (Code kernel : quotient.kernels()) {
                KernelUnit unit = new KernelUnit(kernel, backbone, kernel.binding());
                joints.add(new Joint(unit, unit));
            }
        } else if (space instanceof CoveringSpace covering) {
            Space backbone = covering.inflate();
            Space baseline = covering.ground().inflate();
            List<Space> axes = new ArrayList<>();
            for (Space axis = covering.seed().inflate(); axis != null && axis.concludes(baseline); axis = axis.base()) {
                axes.add(axis);
            }
            Collections.reverse(axes);
            for (Space axis : axes) {
                if (!axis.isContracting() || axis.equals(baseline)) {
                    for (Joint joint : sew(axis)) {
                        CoveringUnit unit = new CoveringUnit(joint.lop(), backbone, joint.lop().binding());
                        joints.add(new Joint(unit, unit));
                    }
                }
            }
        }
        return joints;
    }

    // ==================== Tie ====================

    /**
     * Returns the joints attaching an axis to its base: {@code lop} is
     * evaluated on the base, {@code rop} on the axis.
     */
    public static List<Joint> tie(Space space) {
        if (!space.isAxis()) {
            return tie(space.base());
        }
        List<Joint> joints = new ArrayList<>();
        Space backbone = space.inflate();
        if (backbone instanceof FiberTableSpace fiber) {
            Join join = fiber.join();
            for (int i = 0; i < join.originColumns().size(); i++) {
                joints.add(new Joint(
                        new ColumnUnit(join.originColumns().get(i), fiber.base(), space.binding()),
                        new ColumnUnit(join.targetColumns().get(i), fiber, space.binding())));
            }
        } else if (backbone instanceof QuotientSpace quotient) {
            for (Joint joint : tie(quotient.ground())) {
                joints.add(joint.withRop(new KernelUnit(joint.rop(), quotient, joint.rop().binding())));
            }
        } else if (backbone instanceof ComplementSpace complement) {
            for (Joint joint : tie(complement.ground())) {
                Code op = joint.rop();
                joints.add(new Joint(new KernelUnit(op, complement.base(), op.binding()),
                        new CoveringUnit(op, complement, op.binding())));
            }
            for (Code kernel : complement.kernels()) {
                joints.add(new Joint(new KernelUnit(kernel, complement.base(), kernel.binding()),
                        new CoveringUnit(kernel, complement, kernel.binding())));
            }
        } else if (backbone instanceof MonikerSpace moniker) {
            List<Joint> groundJoints = moniker.isContracting() ? sew(moniker.ground()) : tie(moniker.ground());
            for (Joint joint : groundJoints) {
                joints.add(joint.withRop(new CoveringUnit(joint.rop(), moniker, joint.rop().binding())));
            }
        } else if (backbone instanceof LocatorSpace locator) {
            for (Joint joint : tie(locator.ground())) {
                joints.add(joint.withRop(new CoveringUnit(joint.rop(), locator, joint.rop().binding())));
            }
        }
        return joints;
    }

    // ==================== Keys ====================

    /**
     * Returns the columns that identify a row: the primary key, else the
     * first total unique key, else null.
     */
    static List<Column> connectingColumns(Table table) {
        if (table.primaryKey() != null) {
            return table.primaryKey().originColumns();
        }
        for (UniqueKey key : table.uniqueKeys()) {
            if (key.isPartial()) {
                continue;
            }
            if (key.originColumns().stream().noneMatch(Column::isNullable)) {
                return key.originColumns();
            }
        }
        return null;
    }

    private static List<Column> identifyingColumns(Table table) {
        List<Column> columns = connectingColumns(table);
        return columns != null ? columns : table.columns();
    }
}
