package com.sievesql.functions;

import com.sievesql.binding.AssignmentBinding;
import com.sievesql.binding.Binding;
import com.sievesql.binding.BindingRecipe;
import com.sievesql.binding.BindingState;
import com.sievesql.binding.ClosedRecipe;
import com.sievesql.binding.CommandBinding;
import com.sievesql.binding.CoverBinding;
import com.sievesql.binding.DefinitionBinding;
import com.sievesql.binding.DirectionBinding;
import com.sievesql.binding.HomeBinding;
import com.sievesql.binding.ImplicitCastBinding;
import com.sievesql.binding.LiteralBinding;
import com.sievesql.binding.Lookup;
import com.sievesql.binding.Recipe;
import com.sievesql.binding.RecipeItem;
import com.sievesql.binding.RescopingBinding;
import com.sievesql.binding.SegmentBinding;
import com.sievesql.binding.SelectionBinding;
import com.sievesql.binding.SieveBinding;
import com.sievesql.binding.SortBinding;
import com.sievesql.binding.SubstitutionRecipe;
import com.sievesql.binding.TitleBinding;
import com.sievesql.binding.WrappingBinding;
import com.sievesql.exception.BindError;
import com.sievesql.syntax.GroupSyntax;
import com.sievesql.syntax.IdentifierSyntax;
import com.sievesql.syntax.NumberSyntax;
import com.sievesql.syntax.SpecifierSyntax;
import com.sievesql.syntax.StringSyntax;
import com.sievesql.syntax.Syntax;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.DomainCoercion;
import com.sievesql.types.Profile;
import com.sievesql.types.RecordDomain;
import com.sievesql.types.UntypedDomain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Expansions of the built-in macros.
 */
final class Macros {

    private Macros() {
        // Utility class
    }

    // ==================== Literals and scopes ====================

    static Binding nullValue(FunctionCall call, Arguments<Syntax> arguments) {
        return new LiteralBinding(call.state().scope(), null, new UntypedDomain(), call.syntax());
    }

    static MacroBinder.Expansion booleanValue(boolean value) {
        return (call, arguments) ->
            new LiteralBinding(call.state().scope(), value, new BooleanDomain(), call.syntax());
    }

    static Binding root(FunctionCall call, Arguments<Syntax> arguments) {
        return new WrappingBinding(call.state().root(), call.syntax());
    }

    static Binding self(FunctionCall call, Arguments<Syntax> arguments) {
        return new WrappingBinding(call.state().scope(), call.syntax());
    }

    static Binding home(FunctionCall call, Arguments<Syntax> arguments) {
        return new HomeBinding(call.state().scope(), call.syntax());
    }

    static Binding id(FunctionCall call, Arguments<Syntax> arguments) {
        Recipe recipe = call.state().lookup().identify(call.state().scope());
        if (recipe == null) {
            throw new BindError("cannot determine identity", call.mark());
        }
        return call.state().use(recipe, call.syntax());
    }

    // ==================== Navigation ====================

    static Binding distinct(FunctionCall call, Arguments<Syntax> arguments) {
        BindingState state = call.state();
        Syntax op = arguments.get("op");
        Binding seed = state.bind(op);
        List<RecipeItem> items = state.lookup().expand(seed, true, false, false, false);
        if (items == null) {
            throw new BindError("function '" + call.name() + "' expects an argument with a selector", op.mark());
        }
        List<Binding> elements = new ArrayList<>();
        for (RecipeItem item : items) {
            Binding element = state.use(item.recipe(), item.syntax(), seed);
            elements.add(new RescopingBinding(element, seed, element.syntax()));
        }
        return state.project(seed, elements, call.syntax());
    }

    static Binding title(FunctionCall call, Arguments<Syntax> arguments) {
        Syntax title = arguments.get("title");
        String value;
        if (title instanceof StringSyntax string) {
            value = string.value();
        } else if (title instanceof IdentifierSyntax identifier) {
            value = identifier.value();
        } else {
            throw new BindError("function '" + call.name() + "' expects a string literal or an identifier",
                    title.mark());
        }
        Binding base = call.state().bind(arguments.get("base"));
        return new TitleBinding(base, value, call.syntax());
    }

    static Binding filter(FunctionCall call, Arguments<Syntax> arguments) {
        Binding filter = call.state().bind(arguments.get("op"));
        filter = new ImplicitCastBinding(filter, new BooleanDomain(), filter.syntax());
        return new SieveBinding(call.state().scope(), filter, call.syntax());
    }

    static Binding select(FunctionCall call, Arguments<Syntax> arguments) {
        BindingState state = call.state();
        List<Binding> elements = new ArrayList<>();
        for (Syntax op : arguments.list("ops")) {
            Binding element = state.bind(op);
            List<RecipeItem> items = state.lookup().expand(element, true, false, false, false);
            if (items == null) {
                elements.add(element);
                continue;
            }
            for (RecipeItem item : items) {
                Syntax syntax = item.syntax();
                if (!(syntax instanceof IdentifierSyntax || syntax instanceof GroupSyntax)) {
                    syntax = new GroupSyntax(syntax, syntax.mark());
                }
                syntax = new SpecifierSyntax(element.syntax(), syntax, syntax.mark());
                elements.add(state.use(item.recipe(), syntax));
            }
        }
        List<Binding> order = new ArrayList<>();
        for (Binding element : elements) {
            if (Lookup.direct(element) != null) {
                order.add(element);
            }
        }
        Binding base = state.scope();
        if (!order.isEmpty()) {
            base = new SortBinding(base, order, null, null, base.syntax());
        }
        List<Profile> fields = new ArrayList<>();
        for (Binding element : elements) {
            fields.add(state.decorate(element));
        }
        return new SelectionBinding(base, elements, new RecordDomain(fields), base.syntax());
    }

    static Binding moniker(FunctionCall call, Arguments<Syntax> arguments) {
        Binding seed = call.state().bind(arguments.get("seed"));
        return new CoverBinding(call.state().scope(), seed, call.syntax());
    }

    static MacroBinder.Expansion direction(int direction) {
        return (call, arguments) -> {
            Binding base = call.state().bind(arguments.get("base"));
            return new DirectionBinding(base, direction, call.syntax());
        };
    }

    static Binding limit(FunctionCall call, Arguments<Syntax> arguments) {
        int limit = nonNegative(call, arguments.get("limit"));
        Integer offset = arguments.get("offset") != null ? nonNegative(call, arguments.get("offset")) : null;
        return new SortBinding(call.state().scope(), List.of(), limit, offset, call.syntax());
    }

    private static int nonNegative(FunctionCall call, Syntax argument) {
        if (argument instanceof NumberSyntax number && number.isInteger() && number.value().length() <= 9) {
            return Integer.parseInt(number.value());
        }
        throw new BindError("function '" + call.name() + "' expects a non-negative integer", argument.mark());
    }

    static Binding sort(FunctionCall call, Arguments<Syntax> arguments) {
        BindingState state = call.state();
        List<Binding> order = new ArrayList<>();
        for (Syntax item : arguments.list("order")) {
            Binding binding = state.bind(item);
            List<RecipeItem> items = state.lookup().expand(binding, true, false, false, false);
            if (items == null) {
                Optional<Domain> domain = DomainCoercion.coerce(binding.domain());
                if (domain.isEmpty()) {
                    throw new BindError("function '" + call.name() + "' expects a scalar expression", binding.mark());
                }
                order.add(new ImplicitCastBinding(binding, domain.get(), binding.syntax()));
            } else {
                for (RecipeItem recipeItem : items) {
                    order.add(state.use(recipeItem.recipe(), recipeItem.syntax()));
                }
            }
        }
        return new SortBinding(state.scope(), order, null, null, call.syntax());
    }

    // ==================== Definitions ====================

    static Binding define(FunctionCall call, Arguments<Syntax> arguments) {
        return defineAll(call, arguments.list("ops"));
    }

    static Binding where(FunctionCall call, Arguments<Syntax> arguments) {
        Binding scope = defineAll(call, arguments.list("rops"));
        return call.state().bind(arguments.get("lop"), scope);
    }

    private static Binding defineAll(FunctionCall call, List<Syntax> ops) {
        BindingState state = call.state();
        Binding binding = state.scope();
        for (Syntax op : ops) {
            Binding bound = state.bind(op, binding);
            if (!(bound instanceof AssignmentBinding assignment)) {
                throw new BindError("function '" + call.name() + "' expects an assignment expression", op.mark());
            }
            AssignmentBinding.Term term = assignment.terms().get(0);
            Integer arity = null;
            Recipe recipe;
            if (term.isReference()) {
                recipe = new BindingRecipe(state.bind(assignment.body(), binding));
            } else {
                if (assignment.terms().size() == 1 && assignment.parameters() != null) {
                    arity = assignment.parameters().size();
                }
                recipe = new SubstitutionRecipe(binding, assignment.terms().subList(1, assignment.terms().size()),
                        assignment.parameters(), assignment.body());
            }
            binding = new DefinitionBinding(binding, term.name(), term.isReference(), arity,
                    new ClosedRecipe(recipe), call.syntax());
        }
        return binding;
    }

    // ==================== Output formats ====================

    static MacroBinder.Expansion format(String format) {
        return (call, arguments) -> {
            Binding op = call.state().bind(arguments.get("op"));
            CommandBinding producer = call.state().lookup().command(op);
            SegmentBinding segment;
            if (producer != null) {
                segment = producer.segment();
            } else if (op instanceof SegmentBinding bound) {
                segment = bound;
            } else {
                throw new BindError("function '" + call.name() + "' expects a segment argument", op.mark());
            }
            return new CommandBinding(call.state().scope(), format, segment, call.syntax());
        };
    }
}
