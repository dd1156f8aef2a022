package com.sievesql.functions;

import com.sievesql.binding.Binding;
import com.sievesql.binding.BindingState;
import com.sievesql.binding.RecipeItem;
import com.sievesql.exception.BindError;
import com.sievesql.mark.Mark;
import com.sievesql.syntax.Syntax;
import com.sievesql.types.Domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Binds the application of one function.
 *
 * <p>Binding goes in three steps:
 * <ol>
 *   <li>{@link #match} distributes the argument nodes over the slots of
 *       the signature and checks the number of arguments;</li>
 *   <li>{@link #bindArguments} binds every node; a lone argument of a
 *       plural slot is expanded into its selector elements;</li>
 *   <li>{@link #correlate} casts the bound arguments and builds the result.</li>
 * </ol>
 * Macros skip the second step and work on the syntax directly.
 */
public abstract class FunctionBinder {

    private final Signature signature;

    protected FunctionBinder(Signature signature) {
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
    }

    public Signature signature() {
        return signature;
    }

    /**
     * Binds a call.
     *
     * @throws BindError if the arguments do not fit the function
     */
    public Binding bind(FunctionCall call) {
        Arguments<Syntax> arguments = match(call);
        return correlate(call, bindArguments(call, arguments));
    }

    protected abstract Binding correlate(FunctionCall call, Arguments<Binding> arguments);

    protected Arguments<Syntax> match(FunctionCall call) {
        List<Slot> slots = signature.slots();
        List<Syntax> operands = new ArrayList<>(call.operands());
        int minArgs = (int) slots.stream().filter(Slot::isMandatory).count();
        Integer maxArgs = slots.size();
        if (!slots.isEmpty() && !slots.get(slots.size() - 1).isSingular()) {
            maxArgs = null;
        }
        if (operands.size() < minArgs || (maxArgs != null && operands.size() > maxArgs)) {
            String message;
            if (maxArgs != null && minArgs == maxArgs && minArgs == 1) {
                message = "1 argument";
            } else if (maxArgs != null && minArgs == maxArgs) {
                message = minArgs + " arguments";
            } else if (maxArgs != null && maxArgs == 1) {
                message = minArgs + " to " + maxArgs + " argument";
            } else if (maxArgs != null) {
                message = minArgs + " to " + maxArgs + " arguments";
            } else {
                message = minArgs + " or more arguments";
            }
            throw new BindError("function '" + call.name() + "' expects " + message + "; got " + operands.size(),
                    call.mark());
        }
        Arguments.Builder<Syntax> builder = Arguments.builder();
        for (int index = 0; index < slots.size(); index++) {
            Slot slot = slots.get(index);
            if (operands.isEmpty()) {
                if (slot.isSingular()) {
                    builder.put(slot.name(), null);
                } else {
                    builder.putList(slot.name(), List.of());
                }
            } else if (slot.isSingular()) {
                builder.put(slot.name(), operands.remove(0));
            } else if (index == slots.size() - 1) {
                builder.putList(slot.name(), operands);
                operands = new ArrayList<>();
            } else {
                builder.putList(slot.name(), List.of(operands.remove(0)));
            }
        }
        return builder.build();
    }

    protected Arguments<Binding> bindArguments(FunctionCall call, Arguments<Syntax> arguments) {
        BindingState state = call.state();
        Arguments.Builder<Binding> builder = Arguments.builder();
        for (Slot slot : signature.slots()) {
            if (slot.isSingular()) {
                Syntax value = arguments.get(slot.name());
                builder.put(slot.name(), value != null ? state.bind(value) : null);
                continue;
            }
            List<Syntax> values = arguments.list(slot.name());
            List<Binding> bound = new ArrayList<>();
            if (values.size() == 1) {
                Syntax value = values.get(0);
                Binding binding = state.bind(value);
                List<RecipeItem> items = state.lookup().expand(binding, true, false, false, false);
                if (slot.isMandatory() && items != null && items.isEmpty()) {
                    throw new BindError("at least one element is expected", value.mark());
                }
                if (items == null) {
                    bound.add(binding);
                } else {
                    for (RecipeItem item : items) {
                        bound.add(state.use(item.recipe(), item.syntax()));
                    }
                }
            } else {
                for (Syntax value : values) {
                    bound.add(state.bind(value));
                }
            }
            builder.putList(slot.name(), bound);
        }
        return builder.build();
    }

    // ==================== Error helpers ====================

    /**
     * Returns the error raised when values cannot be brought to a common domain.
     */
    protected static BindError cannotCoerce(List<Domain> domains, Mark mark) {
        String families = domains.stream()
            .map(domain -> "'" + domain.family() + "'")
            .collect(Collectors.joining(", "));
        return new BindError("cannot coerce values of types (" + families + ") to a common type", mark);
    }

    protected static List<Domain> domainsOf(List<Binding> bindings) {
        List<Domain> domains = new ArrayList<>();
        for (Binding binding : bindings) {
            domains.add(binding.domain());
        }
        return domains;
    }
}
