package com.sievesql.binding;

import com.sievesql.catalog.Catalog;
import com.sievesql.catalog.Join;
import com.sievesql.exception.BindError;
import com.sievesql.functions.FunctionBinder;
import com.sievesql.functions.FunctionCall;
import com.sievesql.functions.FunctionRegistry;
import com.sievesql.syntax.ApplicationSyntax;
import com.sievesql.syntax.AssignmentSyntax;
import com.sievesql.syntax.CommandSyntax;
import com.sievesql.syntax.ComplementSyntax;
import com.sievesql.syntax.FunctionSyntax;
import com.sievesql.syntax.GroupSyntax;
import com.sievesql.syntax.HomeSyntax;
import com.sievesql.syntax.IdentifierSyntax;
import com.sievesql.syntax.LinkSyntax;
import com.sievesql.syntax.LocationSyntax;
import com.sievesql.syntax.LocatorSyntax;
import com.sievesql.syntax.MappingSyntax;
import com.sievesql.syntax.NumberSyntax;
import com.sievesql.syntax.OperatorSyntax;
import com.sievesql.syntax.QuerySyntax;
import com.sievesql.syntax.QuotientSyntax;
import com.sievesql.syntax.ReferenceSyntax;
import com.sievesql.syntax.SegmentSyntax;
import com.sievesql.syntax.SelectorSyntax;
import com.sievesql.syntax.SieveSyntax;
import com.sievesql.syntax.SpecifierSyntax;
import com.sievesql.syntax.StringSyntax;
import com.sievesql.syntax.Syntax;
import com.sievesql.syntax.WildcardSyntax;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.DecimalDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.DomainCoercion;
import com.sievesql.types.EntityDomain;
import com.sievesql.types.FloatDomain;
import com.sievesql.types.IdentityDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.ListDomain;
import com.sievesql.types.Profile;
import com.sievesql.types.RecordDomain;
import com.sievesql.types.UntypedDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves the names of a parsed query against the catalog and the
 * function registry, producing a {@link QueryBinding}.
 *
 * <p>Each syntax node is bound in the current scope of a
 * {@link BindingState}. Identifiers and function calls are first looked up
 * as attributes of the scope (columns, links, calculated attributes) and
 * then as functions. Expressions get their domains here; operands are
 * coerced to the domains their functions expect.
 *
 * <pre>
 *   Binder binder = new Binder(catalog, FunctionRegistry.builtins());
 *   QueryBinding binding = binder.bind(QueryParser.parse("/course{title}"));
 * </pre>
 */
public final class Binder {

    private static final Logger logger = LoggerFactory.getLogger(Binder.class);

    private final Lookup lookup;
    private final FunctionRegistry functions;

    public Binder(Catalog catalog, FunctionRegistry functions) {
        this.lookup = new Lookup(catalog);
        this.functions = Objects.requireNonNull(functions, "functions must not be null");
    }

    Lookup lookup() {
        return lookup;
    }

    FunctionRegistry functions() {
        return functions;
    }

    /**
     * Binds a query.
     *
     * @param syntax the parsed query
     * @return the query binding
     * @throws BindError if a name cannot be resolved or types do not agree
     */
    public QueryBinding bind(QuerySyntax syntax) {
        RootBinding root = new RootBinding(syntax);
        BindingState state = new BindingState(this, root);
        Binding result = state.bind(syntax.segment());
        String format = "default";
        SegmentBinding segment;
        CommandBinding command = lookup.command(result);
        if (command != null) {
            segment = command.segment();
            format = command.format();
        } else if (result instanceof SegmentBinding bound) {
            segment = bound;
        } else {
            Binding seed = state.select(result);
            segment = new SegmentBinding(root, seed, new ListDomain(seed.domain()), seed.syntax());
        }
        if (!state.isBalanced()) {
            throw new IllegalStateException("unbalanced scope stack");
        }
        Profile profile = decorate(segment);
        logger.debug("Bound query {} with output {}", syntax, profile.domain());
        return new QueryBinding(root, segment, profile, format, syntax);
    }

    // ==================== Syntax dispatch ====================

    Binding bindSyntax(Syntax syntax, BindingState state) {
        if (syntax instanceof SegmentSyntax segment) {
            return bindSegment(segment, state);
        }
        if (syntax instanceof CommandSyntax command) {
            String name = command.identifier().value().toLowerCase(Locale.ROOT);
            if (!FunctionRegistry.FORMATS.contains(name)) {
                throw new BindError("unrecognized command '" + command.identifier() + "'", command.mark());
            }
            return state.call(command);
        }
        if (syntax instanceof SelectorSyntax selector) {
            Binding scope = selector.lbranch() != null ? state.bind(selector.lbranch()) : state.scope();
            return bindRecord(selector, scope, state);
        }
        if (syntax instanceof QuotientSyntax quotient) {
            return bindQuotient(quotient, state);
        }
        if (syntax instanceof SieveSyntax sieve) {
            Binding base = state.bind(sieve.lbranch());
            Binding filter = state.bind(sieve.rbranch(), base);
            filter = new ImplicitCastBinding(filter, new BooleanDomain(), filter.syntax());
            return new SieveBinding(base, filter, sieve);
        }
        if (syntax instanceof SpecifierSyntax specifier) {
            Binding scope = state.bind(specifier.lbranch());
            return state.bind(specifier.rbranch(), scope);
        }
        if (syntax instanceof HomeSyntax home) {
            return state.bind(home.rbranch(), new HomeBinding(state.scope(), home));
        }
        if (syntax instanceof AssignmentSyntax assignment) {
            return bindAssignment(assignment, state);
        }
        if (syntax instanceof LinkSyntax) {
            throw new BindError("link expressions are not supported", syntax.mark());
        }
        if (syntax instanceof LocatorSyntax locator) {
            return bindLocator(locator, state);
        }
        if (syntax instanceof LocationSyntax location) {
            List<Binding> elements = new ArrayList<>();
            for (Syntax branch : location.branches()) {
                elements.add(state.bind(branch));
            }
            return new IdentityBinding(state.scope(), elements, location);
        }
        if (syntax instanceof OperatorSyntax) {
            return state.call(syntax);
        }
        if (syntax instanceof FunctionSyntax || syntax instanceof MappingSyntax) {
            ApplicationSyntax application = (ApplicationSyntax) syntax;
            Recipe recipe = lookup.attribute(state.scope(), application.name(), application.arguments().size());
            return recipe != null ? state.use(recipe, syntax) : state.call(syntax);
        }
        if (syntax instanceof GroupSyntax group) {
            return new WrappingBinding(state.bind(group.branch()), group);
        }
        if (syntax instanceof IdentifierSyntax identifier) {
            Recipe recipe = lookup.attribute(state.scope(), identifier.value(), null);
            return recipe != null ? state.use(recipe, identifier) : state.call(identifier);
        }
        if (syntax instanceof WildcardSyntax wildcard) {
            return bindWildcard(wildcard, state);
        }
        if (syntax instanceof ReferenceSyntax reference) {
            return bindReference(reference, state);
        }
        if (syntax instanceof ComplementSyntax) {
            Recipe recipe = lookup.complement(state.scope());
            if (recipe == null) {
                throw new BindError("'^' could only be used in a quotient scope", syntax.mark());
            }
            return state.use(recipe, syntax);
        }
        if (syntax instanceof StringSyntax string) {
            return new LiteralBinding(state.scope(), string.value(), new UntypedDomain(), string);
        }
        if (syntax instanceof NumberSyntax number) {
            Binding literal = new LiteralBinding(state.scope(), number.value(), new UntypedDomain(), number);
            Domain domain;
            if (number.isExponential()) {
                domain = new FloatDomain();
            } else if (number.isDecimal()) {
                domain = new DecimalDomain();
            } else {
                domain = new IntegerDomain();
            }
            return new ImplicitCastBinding(literal, domain, number);
        }
        throw new BindError("unable to bind a node", syntax.mark());
    }

    private Binding bindSegment(SegmentSyntax syntax, BindingState state) {
        Binding seed;
        if (syntax.branch() != null) {
            seed = state.bind(syntax.branch());
            if (seed instanceof AssignmentBinding assignment) {
                Recipe recipe = closedAssignment(assignment, state.scope(), "segment", state);
                seed = state.use(recipe, assignmentName(assignment));
            }
        } else {
            seed = state.scope();
        }
        if (lookup.command(seed) != null) {
            return seed;
        }
        seed = state.select(seed);
        return new SegmentBinding(state.scope(), seed, new ListDomain(seed.domain()), syntax);
    }

    private Binding bindRecord(SelectorSyntax syntax, Binding base, BindingState state) {
        List<Binding> elements = new ArrayList<>();
        Binding scope = base;
        state.pushScope(scope);
        try {
            for (Syntax branch : syntax.rbranches()) {
                Binding binding = state.bind(branch);
                if (binding instanceof AssignmentBinding assignment) {
                    Recipe recipe = closedAssignment(assignment, scope, "selector", state);
                    AssignmentBinding.Term term = assignment.terms().get(0);
                    binding = state.use(recipe, assignmentName(assignment));
                    scope = new DefinitionBinding(scope, term.name(), term.isReference(), null, recipe,
                            scope.syntax());
                    state.popScope();
                    state.pushScope(scope);
                }
                List<Binding> bindings = new ArrayList<>();
                List<RecipeItem> items = lookup.expand(binding, false, true, false, false);
                if (items != null) {
                    Binding seed = binding;
                    for (RecipeItem item : items) {
                        Binding element = state.use(item.recipe(), item.syntax());
                        bindings.add(new RescopingBinding(element, seed, element.syntax()));
                    }
                } else {
                    bindings.add(binding);
                }
                List<Binding> order = new ArrayList<>();
                for (Binding element : bindings) {
                    if (Lookup.direct(element) != null) {
                        order.add(element);
                    }
                }
                if (!order.isEmpty()) {
                    scope = new SortBinding(scope, order, null, null, scope.syntax());
                    state.popScope();
                    state.pushScope(scope);
                }
                elements.addAll(bindings);
            }
        } finally {
            state.popScope();
        }
        return new SelectionBinding(scope, elements, recordDomain(elements), syntax);
    }

    private Recipe closedAssignment(AssignmentBinding assignment, Binding scope, String place, BindingState state) {
        if (assignment.terms().size() != 1) {
            throw new BindError("qualified definition is not allowed for an in-" + place + " assignment",
                    assignment.mark());
        }
        if (assignment.parameters() != null) {
            throw new BindError("parameterized definition is not allowed for an in-" + place + " assignment",
                    assignment.mark());
        }
        Recipe recipe;
        if (assignment.terms().get(0).isReference()) {
            recipe = new BindingRecipe(state.bind(assignment.body()));
        } else {
            recipe = new SubstitutionRecipe(scope, List.of(), null, assignment.body());
        }
        return new ClosedRecipe(recipe);
    }

    private static Syntax assignmentName(AssignmentBinding assignment) {
        Syntax syntax = assignment.syntax();
        if (syntax instanceof AssignmentSyntax assignmentSyntax) {
            return assignmentSyntax.lbranch();
        }
        return syntax;
    }

    private Binding bindQuotient(QuotientSyntax syntax, BindingState state) {
        Binding seed = state.bind(syntax.lbranch());
        Binding binding = state.bind(syntax.rbranch(), seed);
        List<Binding> elements = new ArrayList<>();
        List<RecipeItem> items = lookup.expand(binding, true, false, false, false);
        if (items != null) {
            for (RecipeItem item : items) {
                Binding element = state.use(item.recipe(), item.syntax(), binding);
                elements.add(new RescopingBinding(element, binding, element.syntax()));
            }
        } else {
            elements.add(binding);
        }
        return project(seed, elements, syntax, state);
    }

    Binding project(Binding seed, List<Binding> elements, Syntax syntax, BindingState state) {
        List<Binding> kernels = new ArrayList<>();
        for (Binding element : elements) {
            Optional<Domain> domain = DomainCoercion.coerce(element.domain());
            if (domain.isEmpty()) {
                throw new BindError("quotient column must be scalar", element.mark());
            }
            kernels.add(new ImplicitCastBinding(element, domain.get(), element.syntax()));
        }
        QuotientBinding quotient = new QuotientBinding(state.scope(), seed, kernels, syntax);
        Binding binding = quotient;
        String name = lookup.guessTag(seed);
        if (name != null) {
            binding = new DefinitionBinding(binding, name, false, null,
                    new ClosedRecipe(new ComplementRecipe(quotient)), syntax);
        }
        for (int index = 0; index < kernels.size(); index++) {
            String kernelName = lookup.guessTag(kernels.get(index));
            if (kernelName != null) {
                binding = new DefinitionBinding(binding, kernelName, false, null,
                        new ClosedRecipe(new KernelRecipe(quotient, index)), syntax);
            }
        }
        return binding;
    }

    private Binding bindAssignment(AssignmentSyntax syntax, BindingState state) {
        List<Syntax> names = new ArrayList<>();
        flatten(syntax.lbranch(), names);
        List<AssignmentBinding.Term> terms = new ArrayList<>();
        List<AssignmentBinding.Term> parameters = null;
        for (int index = 0; index < names.size(); index++) {
            Syntax name = names.get(index);
            boolean isLast = index == names.size() - 1;
            if (name instanceof IdentifierSyntax identifier) {
                terms.add(new AssignmentBinding.Term(identifier.value(), false));
            } else if (name instanceof ReferenceSyntax reference && isLast) {
                terms.add(new AssignmentBinding.Term(reference.identifier().value(), true));
            } else if (name instanceof FunctionSyntax function && isLast) {
                terms.add(new AssignmentBinding.Term(function.identifier().value(), false));
                parameters = new ArrayList<>();
                for (Syntax parameter : function.branches()) {
                    if (parameter instanceof IdentifierSyntax identifier) {
                        parameters.add(new AssignmentBinding.Term(identifier.value(), false));
                    } else if (parameter instanceof ReferenceSyntax reference) {
                        parameters.add(new AssignmentBinding.Term(reference.identifier().value(), true));
                    } else {
                        throw new BindError("an identifier is expected", parameter.mark());
                    }
                }
            } else {
                throw new BindError("an identifier is expected", name.mark());
            }
        }
        return new AssignmentBinding(state.scope(), terms, parameters, syntax.rbranch(), syntax);
    }

    private static void flatten(Syntax syntax, List<Syntax> names) {
        if (syntax instanceof SpecifierSyntax specifier) {
            flatten(specifier.lbranch(), names);
            flatten(specifier.rbranch(), names);
        } else {
            names.add(syntax);
        }
    }

    private Binding bindLocator(LocatorSyntax syntax, BindingState state) {
        Binding seed = state.bind(syntax.lbranch());
        Recipe recipe = lookup.identify(seed);
        if (recipe == null) {
            throw new BindError("cannot determine identity", seed.mark());
        }
        Binding identity = state.use(recipe, syntax.rbranch(), seed);
        if (!(identity instanceof IdentityBinding identityBinding)) {
            throw new BindError("cannot determine identity", seed.mark());
        }
        IdentityBinding location = (IdentityBinding) state.bind(syntax.rbranch(), seed);
        if (identityBinding.width() != location.width()) {
            throw new BindError("ill-formed locator", syntax.rbranch().mark());
        }
        List<Binding> elements = new ArrayList<>(location.elements());
        while (elements.size() == 1 && elements.get(0) instanceof IdentityBinding nested) {
            elements = new ArrayList<>(nested.elements());
        }
        List<Object> value = convertLocation(identityBinding.domain(), elements, syntax);
        return new LocatorBinding(state.scope(), seed, identityBinding, value, syntax);
    }

    private List<Object> convertLocation(IdentityDomain identity, List<Binding> elements, LocatorSyntax syntax) {
        List<Object> value = new ArrayList<>();
        for (Domain field : identity.labels()) {
            if (field instanceof IdentityDomain nested) {
                int fieldWidth = nested.arity();
                int totalWidth = 0;
                List<Binding> items = new ArrayList<>();
                while (totalWidth < fieldWidth) {
                    Binding element = elements.remove(0);
                    if (totalWidth == 0 && element instanceof IdentityBinding group
                            && group.width() == fieldWidth) {
                        items = new ArrayList<>(group.elements());
                        totalWidth = group.width();
                    } else if (element instanceof IdentityBinding group) {
                        items.add(group);
                        totalWidth += group.width();
                    } else {
                        items.add(element);
                        totalWidth += 1;
                    }
                }
                if (totalWidth > fieldWidth) {
                    throw new BindError("ill-formed locator", syntax.rbranch().mark());
                }
                value.add(convertLocation(nested, items, syntax));
            } else {
                Binding element = elements.remove(0);
                if (element instanceof IdentityBinding) {
                    throw new BindError("ill-formed locator", syntax.lbranch().mark());
                }
                value.add(new ImplicitCastBinding(element, field, element.syntax()));
            }
        }
        return value;
    }

    private Binding bindWildcard(WildcardSyntax syntax, BindingState state) {
        List<RecipeItem> items = lookup.expand(state.scope(), true, true, true, true);
        if (items == null) {
            throw new BindError("cannot expand '*' since output columns are not defined", syntax.mark());
        }
        if (syntax.index() != null) {
            int index;
            try {
                index = Integer.parseInt(syntax.index().value()) - 1;
            } catch (NumberFormatException exc) {
                index = -1;
            }
            if (index < 0 || index >= items.size()) {
                throw new BindError("value in range 1-" + items.size() + " is required", syntax.mark());
            }
            RecipeItem item = items.get(index);
            return state.use(item.recipe(), remark(item.syntax(), syntax));
        }
        List<Binding> elements = new ArrayList<>();
        for (RecipeItem item : items) {
            elements.add(state.use(item.recipe(), remark(item.syntax(), syntax)));
        }
        return new WildSelectionBinding(state.scope(), elements, recordDomain(elements), syntax);
    }

    private static Syntax remark(Syntax syntax, Syntax source) {
        if (syntax instanceof IdentifierSyntax identifier) {
            return new IdentifierSyntax(identifier.value(), source.mark());
        }
        return syntax;
    }

    private Binding bindReference(ReferenceSyntax syntax, BindingState state) {
        String name = syntax.identifier().value();
        Recipe recipe = lookup.reference(state.scope(), name);
        if (recipe == null) {
            String model = name.toLowerCase(Locale.ROOT);
            List<String> choices = new ArrayList<>();
            for (String candidate : new TreeSet<>(lookup.referenceSet(state.scope()))) {
                if (Hints.isSimilar(model, candidate)) {
                    choices.add("$" + candidate);
                }
            }
            throw new BindError("unrecognized reference '" + syntax + "'", syntax.mark(), Hints.choices(choices));
        }
        return state.use(recipe, syntax);
    }

    // ==================== Output columns ====================

    Binding select(Binding binding, BindingState state) {
        Domain domain = binding.domain();
        if (domain instanceof EntityDomain || domain instanceof RecordDomain) {
            List<RecipeItem> items = lookup.expand(binding, true, true, true, false);
            if (items != null) {
                List<Binding> elements = new ArrayList<>();
                for (RecipeItem item : items) {
                    Binding element = state.use(item.recipe(), item.syntax(), binding);
                    elements.add(state.select(element));
                }
                return new SelectionBinding(binding, elements, recordDomain(elements), binding.syntax());
            }
        }
        if (domain instanceof ListDomain || domain instanceof IdentityDomain || domain instanceof UntypedDomain) {
            return binding;
        }
        Optional<Domain> coerced = DomainCoercion.coerce(domain);
        if (coerced.isEmpty()) {
            throw new BindError("output column must be scalar", binding.mark());
        }
        return new ImplicitCastBinding(binding, coerced.get(), binding.syntax());
    }

    Profile decorate(Binding binding) {
        return new Profile(binding.domain(), lookup.guessTag(binding), lookup.guessHeader(binding));
    }

    private RecordDomain recordDomain(List<Binding> elements) {
        List<Profile> fields = new ArrayList<>();
        for (Binding element : elements) {
            fields.add(decorate(element));
        }
        return new RecordDomain(fields);
    }

    // ==================== Recipes ====================

    Binding useRecipe(Recipe recipe, Syntax syntax, BindingState state) {
        Binding scope = state.scope();
        if (recipe instanceof LiteralRecipe literal) {
            return new LiteralBinding(scope, literal.value(), literal.domain(), syntax);
        }
        if (recipe instanceof SelectionRecipe selection) {
            List<Binding> elements = new ArrayList<>();
            for (Recipe item : selection.recipes()) {
                elements.add(state.use(item, syntax));
            }
            return new SelectionBinding(scope, elements, recordDomain(elements), syntax);
        }
        if (recipe instanceof FreeTableRecipe table) {
            return new FreeTableBinding(scope, table.table(), syntax);
        }
        if (recipe instanceof AttachedTableRecipe attached) {
            Binding binding = scope;
            for (Join join : attached.joins()) {
                binding = new AttachedTableBinding(binding, join, syntax);
            }
            return binding;
        }
        if (recipe instanceof ColumnRecipe column) {
            Binding link = column.link() != null ? state.use(column.link(), syntax) : null;
            return new ColumnBinding(scope, column.column(), link, syntax);
        }
        if (recipe instanceof KernelRecipe kernel) {
            return new KernelBinding(scope, kernel.quotient(), kernel.index(), syntax);
        }
        if (recipe instanceof ComplementRecipe complement) {
            return new ComplementBinding(scope, complement.quotient(), syntax);
        }
        if (recipe instanceof IdentityRecipe identity) {
            List<Binding> elements = new ArrayList<>();
            for (Recipe element : identity.elements()) {
                elements.add(state.use(element, syntax));
            }
            return new IdentityBinding(scope, elements, syntax);
        }
        if (recipe instanceof SubstitutionRecipe substitution) {
            return substitute(substitution, syntax, state);
        }
        if (recipe instanceof BindingRecipe binding) {
            return binding.binding();
        }
        if (recipe instanceof ClosedRecipe closed) {
            return new AliasBinding(state.use(closed.recipe(), syntax), syntax);
        }
        if (recipe instanceof ChainRecipe chain) {
            Binding binding = scope;
            for (Recipe item : chain.recipes()) {
                binding = state.use(item, syntax, binding);
            }
            return binding;
        }
        if (recipe instanceof PinnedRecipe pinned) {
            return state.use(pinned.recipe(), syntax, pinned.scope());
        }
        AmbiguousRecipe ambiguous = (AmbiguousRecipe) recipe;
        Syntax name = syntax instanceof FunctionSyntax function ? function.identifier() : syntax;
        String hint = null;
        List<String> alternatives = ambiguous.alternatives();
        if (!alternatives.isEmpty()) {
            StringBuilder choices = new StringBuilder("try ");
            for (int i = 0; i < alternatives.size(); i++) {
                if (i > 0) {
                    choices.append(i == alternatives.size() - 1 ? " or " : ", ");
                }
                choices.append('\'').append(alternatives.get(i)).append('\'');
            }
            hint = choices.toString();
        }
        throw new BindError("ambiguous name '" + name + "'", syntax.mark(), hint);
    }

    private Binding substitute(SubstitutionRecipe recipe, Syntax syntax, BindingState state) {
        if (!recipe.terms().isEmpty()) {
            if (!(syntax instanceof IdentifierSyntax identifier)) {
                throw new BindError("an identifier is expected", syntax.mark());
            }
            AssignmentBinding.Term term = recipe.terms().get(0);
            Integer arity = null;
            if (recipe.terms().size() == 1 && recipe.parameters() != null) {
                arity = recipe.parameters().size();
            }
            Recipe qualifier = lookup.attribute(recipe.base(), identifier.value(), null);
            if (qualifier == null) {
                throw new BindError("unrecognized attribute '" + identifier + "'", identifier.mark());
            }
            Binding binding = state.use(qualifier, identifier);
            Recipe inner;
            if (term.isReference()) {
                inner = new BindingRecipe(state.bind(recipe.body(), binding));
            } else {
                inner = new SubstitutionRecipe(binding, recipe.terms().subList(1, recipe.terms().size()),
                        recipe.parameters(), recipe.body());
            }
            return new DefinitionBinding(binding, term.name(), term.isReference(), arity,
                    new ClosedRecipe(inner), identifier);
        }
        Binding scope = new RerouteBinding(state.scope(), recipe.base(), state.scope().syntax());
        if (recipe.parameters() != null) {
            List<Syntax> arguments = ((ApplicationSyntax) syntax).arguments();
            for (int index = 0; index < recipe.parameters().size(); index++) {
                AssignmentBinding.Term parameter = recipe.parameters().get(index);
                Binding argument = state.bind(arguments.get(index));
                scope = new DefinitionBinding(scope, parameter.name(), parameter.isReference(), null,
                        new ClosedRecipe(new BindingRecipe(argument)), scope.syntax());
            }
        }
        Binding binding = state.bind(recipe.body(), scope);
        return new ReferenceRerouteBinding(binding, state.scope(), binding.syntax());
    }

    // ==================== Functions ====================

    Binding callByName(Syntax syntax, BindingState state) {
        String name;
        List<Syntax> arguments;
        if (syntax instanceof ApplicationSyntax application) {
            name = application.name();
            arguments = application.arguments();
        } else if (syntax instanceof IdentifierSyntax identifier) {
            name = identifier.value();
            arguments = null;
        } else {
            throw new BindError("unable to bind a node", syntax.mark());
        }
        Integer arity = arguments != null ? arguments.size() : null;
        FunctionBinder binder = functions.find(name, arity);
        if (binder != null) {
            return binder.bind(new FunctionCall(state, syntax, name, arguments));
        }
        throw unrecognized(syntax, name, arity, state);
    }

    private BindError unrecognized(Syntax syntax, String name, Integer arity, BindingState state) {
        String model = name.toLowerCase(Locale.ROOT);
        Set<AttributeKey> all = new TreeSet<>(Comparator.comparing(AttributeKey::name)
                .thenComparing(AttributeKey::arity, Comparator.nullsFirst(Comparator.naturalOrder())));
        all.addAll(lookup.attributeSet(state.scope()));
        all.addAll(functions.names());
        String hint = null;
        if (arity == null) {
            if (lookup.referenceSet(state.scope()).contains(model)) {
                hint = "did you mean: a reference '$" + model + "'";
            }
            if (hint == null && all.stream().anyMatch(key -> key.arity() != null && key.name().equals(model))) {
                hint = "did you mean: a function '" + model + "'";
            }
            if (hint == null) {
                List<String> choices = new ArrayList<>();
                for (AttributeKey key : all) {
                    if (key.arity() == null && !key.name().equals(model) && Hints.isSimilar(model, key.name())
                            && !choices.contains(key.name())) {
                        choices.add(key.name());
                    }
                }
                hint = Hints.choices(choices);
            }
        } else {
            if (!(syntax instanceof OperatorSyntax)) {
                List<Integer> arities = new ArrayList<>();
                for (AttributeKey key : all) {
                    if (key.name().equals(model) && key.arity() != null && key.arity() != FunctionRegistry.ANY_ARITY
                            && !key.arity().equals(arity) && !arities.contains(key.arity())) {
                        arities.add(key.arity());
                    }
                }
                if (!arities.isEmpty()) {
                    arities.sort(Comparator.naturalOrder());
                    StringBuilder required = new StringBuilder();
                    for (int i = 0; i < arities.size(); i++) {
                        if (i > 0) {
                            required.append(i == arities.size() - 1 ? " or " : ", ");
                        }
                        required.append(arities.get(i));
                    }
                    required.append(arities.get(arities.size() - 1) == 1 ? " argument" : " arguments");
                    throw new BindError("function '" + functionName(syntax, name) + "' requires " + required
                            + "; got " + arity, syntax.mark());
                }
            }
            if (all.stream().anyMatch(key -> key.arity() == null && key.name().equals(model))) {
                hint = "did you mean: an attribute '" + model + "'";
            }
            if (hint == null) {
                List<String> choices = new ArrayList<>();
                for (AttributeKey key : all) {
                    boolean fits = key.arity() != null
                            && (key.arity() == FunctionRegistry.ANY_ARITY || key.arity().equals(arity));
                    if (fits && !key.name().equals(model) && Hints.isSimilar(model, key.name())
                            && !choices.contains(key.name())) {
                        choices.add(key.name());
                    }
                }
                hint = Hints.choices(choices);
            }
        }
        if (syntax instanceof OperatorSyntax operator) {
            if (operator.lbranch() == null) {
                return new BindError("unrecognized unary operator '" + operator.symbol() + "'", syntax.mark(), hint);
            }
            return new BindError("unrecognized operator '" + operator.symbol() + "'", syntax.mark(), hint);
        }
        if (syntax instanceof ApplicationSyntax) {
            return new BindError("unrecognized function '" + functionName(syntax, name) + "'", syntax.mark(), hint);
        }
        String scopeName = lookup.guessTag(state.scope());
        String detail = "unrecognized attribute '" + syntax + "'"
                + (scopeName != null ? " in scope of '" + scopeName + "'" : "");
        return new BindError(detail, syntax.mark(), hint);
    }

    private static String functionName(Syntax syntax, String name) {
        if (syntax instanceof FunctionSyntax function) {
            return function.identifier().toString();
        }
        if (syntax instanceof MappingSyntax mapping) {
            return mapping.identifier().toString();
        }
        return name;
    }
}
