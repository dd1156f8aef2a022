package com.sievesql.functions;

import com.sievesql.binding.Binding;
import com.sievesql.binding.FormulaBinding;
import com.sievesql.binding.ImplicitCastBinding;
import com.sievesql.binding.RecipeItem;
import com.sievesql.exception.BindError;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.UntypedDomain;

import java.util.List;

/**
 * Aggregates and quantifiers: {@code count}, {@code exists}, {@code every},
 * {@code min}, {@code max}, {@code sum} and {@code avg}.
 *
 * <p>The argument is a plural expression. When it is a selection such as
 * {@code count(course{credits})}, the selection becomes the plural base and
 * its only element the aggregated value.
 */
public final class AggregateBinder extends FunctionBinder {

    private enum Mode { QUANTIFY, COUNT, POLY }

    private final Mode mode;
    private final CorrelationTable correlations;

    private AggregateBinder(Signature signature, Mode mode, CorrelationTable correlations) {
        super(signature);
        this.mode = mode;
        this.correlations = correlations;
    }

    /**
     * {@code exists} for polarity {@code +1}, {@code every} for {@code -1}.
     */
    public static AggregateBinder quantify(int polarity) {
        return new AggregateBinder(Signature.polar(SignatureKind.EXISTS, polarity), Mode.QUANTIFY, null);
    }

    public static AggregateBinder count() {
        return new AggregateBinder(Signature.of(SignatureKind.COUNT), Mode.COUNT, null);
    }

    /**
     * An aggregate whose result domain depends on the argument domain.
     */
    public static AggregateBinder poly(Signature signature, CorrelationTable correlations) {
        return new AggregateBinder(signature, Mode.POLY, correlations);
    }

    @Override
    protected Binding correlate(FunctionCall call, Arguments<Binding> arguments) {
        Binding op = arguments.get("op");
        Binding pluralBase = null;
        List<RecipeItem> items = call.state().lookup().expand(op, true, false, false, false);
        if (items != null) {
            if (items.size() != 1) {
                throw new BindError("function '" + call.name() + "' expects 1 argument; got " + items.size(),
                        op.mark());
            }
            pluralBase = op;
            op = call.state().use(items.get(0).recipe(), items.get(0).syntax());
        }
        Binding scope = call.state().scope();
        Binding aggregate;
        if (mode == Mode.QUANTIFY) {
            op = new ImplicitCastBinding(op, new BooleanDomain(), op.syntax());
            Signature signature = Signature.polar(SignatureKind.QUANTIFY, signature().polarity());
            return new FormulaBinding(scope, signature, op.domain(), call.syntax(), aggregateArguments(pluralBase, op));
        } else if (mode == Mode.COUNT) {
            op = new ImplicitCastBinding(op, new BooleanDomain(), op.syntax());
            aggregate = new FormulaBinding(scope, signature(), new IntegerDomain(), call.syntax(),
                    Arguments.<Binding>builder().put("op", op).build());
        } else {
            FormulaBinding formula = new FormulaBinding(scope, signature(), new UntypedDomain(), call.syntax(),
                    Arguments.<Binding>builder().put("op", op).build());
            aggregate = correlations.correlate(formula);
        }
        return new FormulaBinding(scope, Signature.of(SignatureKind.AGGREGATE), aggregate.domain(),
                aggregate.syntax(), aggregateArguments(pluralBase, aggregate));
    }

    private static Arguments<Binding> aggregateArguments(Binding pluralBase, Binding op) {
        return Arguments.<Binding>builder()
            .put("plural_base", pluralBase)
            .put("op", op)
            .build();
    }
}
