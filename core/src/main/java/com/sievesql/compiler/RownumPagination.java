package com.sievesql.compiler;

import com.sievesql.functions.Arguments;
import com.sievesql.functions.Signature;
import com.sievesql.functions.SignatureKind;
import com.sievesql.space.Code;
import com.sievesql.space.Codes;
import com.sievesql.space.FormulaCode;
import com.sievesql.space.Order;
import com.sievesql.space.OrderedSpace;
import com.sievesql.space.ScalarUnit;
import com.sievesql.space.Unit;
import com.sievesql.types.IntegerDomain;

import java.util.List;
import java.util.Map;

/**
 * Slices rows by filtering on {@code ROWNUM}, for backends without
 * {@code LIMIT}/{@code OFFSET}.
 *
 * <p>{@code ROWNUM} is assigned before {@code ORDER BY} runs, so the sorted
 * rows are wrapped in a subquery first. The upper bound is applied to the
 * row number of that subquery. A lower bound needs a second pass: the row
 * number is exported as a column and filtered one level up, since
 * {@code ROWNUM > n} never holds in the query that assigns it.
 */
public final class RownumPagination implements PaginationStrategy {

    @Override
    public Term compile(OrderedSpace space, Compiler compiler) {
        Integer leftBound = space.offset() != null ? space.offset() + 1 : null;
        Integer rightBound = null;
        if (space.limit() != null) {
            rightBound = space.limit() + (space.offset() != null ? space.offset() : 0) + 1;
        }
        List<Order> order = Stitcher.arrange(space);
        Term kid = compiler.compileSlicedBase(space, order);
        kid = new OrderTerm(compiler.tag(), kid, order, null, null, space, kid.baseline(),
                compiler.routesOf(kid, space));
        kid = new PermanentTerm(compiler.tag(), kid, kid.space(), kid.baseline(), kid.routes());
        Code rownum = new FormulaCode(Signature.of(SignatureKind.ROWNUM), new IntegerDomain(),
                Arguments.empty(), space.binding());
        if (rightBound != null) {
            Code filter = Codes.compare("<", rownum, Codes.integer(rightBound, space.binding()), space.binding());
            kid = new FilterTerm(compiler.tag(), kid, filter, kid.space(), kid.baseline(), kid.routes());
        } else {
            kid = new WrapperTerm(compiler.tag(), kid, kid.space(), kid.baseline(), kid.routes());
        }
        if (leftBound == null) {
            return new PermanentTerm(compiler.tag(), kid, kid.space(), kid.baseline(), kid.routes());
        }
        ScalarUnit rownumUnit = new ScalarUnit(rownum, space.base(), space.binding());
        Map<Unit, Integer> routes = kid.copyRoutes();
        routes.put(rownumUnit, kid.tag());
        kid = new PermanentTerm(compiler.tag(), kid, kid.space(), kid.baseline(), routes);
        Code filter = Codes.compare(">=", rownumUnit, Codes.integer(leftBound, space.binding()), space.binding());
        return new FilterTerm(compiler.tag(), kid, filter, kid.space(), kid.baseline(), kid.routes());
    }
}
