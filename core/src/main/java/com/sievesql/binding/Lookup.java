package com.sievesql.binding;

import com.sievesql.catalog.AmbiguousArc;
import com.sievesql.catalog.Arc;
import com.sievesql.catalog.Catalog;
import com.sievesql.catalog.ChainArc;
import com.sievesql.catalog.ColumnArc;
import com.sievesql.catalog.Label;
import com.sievesql.catalog.Table;
import com.sievesql.catalog.TableArc;
import com.sievesql.syntax.IdentifierSyntax;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Name resolution over the binding graph.
 *
 * <p>Every probe walks from a binding towards the scope that can answer it:
 * chaining bindings defer to their base, complements and covers to their
 * seed, reroutes to their target, and tables and the home scope consult
 * the catalog. Probes:
 * <ul>
 *   <li>{@link #attribute}, {@link #attributeSet}: plain and parameterized names;</li>
 *   <li>{@link #reference}, {@link #referenceSet}: {@code $names};</li>
 *   <li>{@link #complement}: the {@code ^} of a quotient;</li>
 *   <li>{@link #expand}: the output columns of a scope;</li>
 *   <li>{@link #identify}: the identity of table rows;</li>
 *   <li>{@link #guessTag}, {@link #guessTitle}, {@link #guessHeader},
 *       {@link #direct}, {@link #command}: decorations.</li>
 * </ul>
 */
public final class Lookup {

    private final Catalog catalog;

    public Lookup(Catalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    public Catalog catalog() {
        return catalog;
    }

    // ==================== Attributes ====================

    /**
     * Finds an attribute by name.
     *
     * @param binding the scope
     * @param name the name as written
     * @param arity the number of arguments, or null for a plain name
     * @return the recipe, or null if the scope has no such attribute
     */
    public Recipe attribute(Binding binding, String name, Integer arity) {
        return attribute(binding, new AttributeKey(Catalog.normalize(name), arity));
    }

    private Recipe attribute(Binding binding, AttributeKey key) {
        if (binding instanceof HomeBinding) {
            return key.arity() == null ? labelRecipe(catalog.homeLabels(), key.name()) : null;
        }
        if (binding instanceof TableBinding table) {
            return key.arity() == null ? labelRecipe(catalog.labels(table.table()), key.name()) : null;
        }
        if (binding instanceof ColumnBinding column) {
            return column.link() != null ? attribute(column.link(), key) : null;
        }
        if (binding instanceof ComplementBinding complement) {
            return attribute(complement.quotient().seed(), key);
        }
        if (binding instanceof CoverBinding cover) {
            return attribute(cover.seed(), key);
        }
        if (binding instanceof LocatorBinding locator) {
            return attribute(locator.seed(), key);
        }
        if (binding instanceof DefinitionBinding definition) {
            if (!definition.isReference()
                    && Objects.equals(definition.arity(), key.arity())
                    && Catalog.normalize(definition.name()).equals(key.name())) {
                return definition.recipe();
            }
            return attribute(definition.base(), key);
        }
        if (binding instanceof RerouteBinding reroute) {
            return attribute(reroute.target(), key);
        }
        if (binding instanceof ChainingBinding) {
            return attribute(binding.base(), key);
        }
        return null;
    }

    /**
     * Returns all attribute names visible in the scope.
     */
    public Set<AttributeKey> attributeSet(Binding binding) {
        if (binding instanceof HomeBinding) {
            return labelKeys(catalog.homeLabels());
        }
        if (binding instanceof TableBinding table) {
            return labelKeys(catalog.labels(table.table()));
        }
        if (binding instanceof ColumnBinding column) {
            return column.link() != null ? attributeSet(column.link()) : new LinkedHashSet<>();
        }
        if (binding instanceof ComplementBinding complement) {
            return attributeSet(complement.quotient().seed());
        }
        if (binding instanceof CoverBinding cover) {
            return attributeSet(cover.seed());
        }
        if (binding instanceof LocatorBinding locator) {
            return attributeSet(locator.seed());
        }
        if (binding instanceof DefinitionBinding definition) {
            Set<AttributeKey> attributes = attributeSet(definition.base());
            if (!definition.isReference()) {
                attributes.add(new AttributeKey(Catalog.normalize(definition.name()), definition.arity()));
            }
            return attributes;
        }
        if (binding instanceof RerouteBinding reroute) {
            return attributeSet(reroute.target());
        }
        if (binding instanceof ChainingBinding) {
            return attributeSet(binding.base());
        }
        return new LinkedHashSet<>();
    }

    // ==================== References ====================

    /**
     * Finds a reference ({@code $name}) visible in the scope.
     */
    public Recipe reference(Binding binding, String name) {
        String key = Catalog.normalize(name);
        Binding current = binding;
        while (current != null) {
            if (current instanceof DefinitionBinding definition
                    && definition.isReference()
                    && Catalog.normalize(definition.name()).equals(key)) {
                return definition.recipe();
            }
            current = referenceParent(current);
        }
        return null;
    }

    /**
     * Returns the names of all references visible in the scope.
     */
    public Set<String> referenceSet(Binding binding) {
        List<String> names = new ArrayList<>();
        Binding current = binding;
        while (current != null) {
            if (current instanceof DefinitionBinding definition && definition.isReference()) {
                names.add(Catalog.normalize(definition.name()));
            }
            current = referenceParent(current);
        }
        Set<String> references = new LinkedHashSet<>();
        for (int i = names.size() - 1; i >= 0; i--) {
            references.add(names.get(i));
        }
        return references;
    }

    private static Binding referenceParent(Binding binding) {
        if (binding instanceof RerouteBinding reroute) {
            return reroute.target();
        }
        if (binding instanceof ReferenceRerouteBinding reroute) {
            return reroute.target();
        }
        if (binding instanceof ChainingBinding || binding instanceof ScopingBinding) {
            return binding.base();
        }
        return null;
    }

    // ==================== Complement ====================

    /**
     * Finds the complement of the nearest quotient scope.
     */
    public Recipe complement(Binding binding) {
        if (binding instanceof QuotientBinding quotient) {
            return new ComplementRecipe(quotient);
        }
        if (binding instanceof ComplementBinding complement) {
            return complement(complement.quotient().seed());
        }
        if (binding instanceof CoverBinding cover) {
            return complement(cover.seed());
        }
        if (binding instanceof LocatorBinding locator) {
            return complement(locator.seed());
        }
        if (binding instanceof RerouteBinding reroute) {
            return complement(reroute.target());
        }
        if (binding instanceof ChainingBinding) {
            return complement(binding.base());
        }
        return null;
    }

    // ==================== Expansion ====================

    /**
     * Lists the elements a scope expands to.
     *
     * @param withSyntax include elements of an explicit selector
     * @param withWild include elements of a wildcard selection
     * @param withClass include the public attributes of a table or home
     * @param withLink expand a link column to the referred table
     * @return the elements, or null if the binding does not expand
     */
    public List<RecipeItem> expand(Binding binding, boolean withSyntax, boolean withWild,
                                   boolean withClass, boolean withLink) {
        if (binding instanceof HomeBinding) {
            return withClass ? labelItems(binding, catalog.homeLabels()) : null;
        }
        if (binding instanceof TableBinding table) {
            return withClass ? labelItems(binding, catalog.labels(table.table())) : null;
        }
        if (binding instanceof ColumnBinding column) {
            if (withLink && column.link() != null) {
                return expand(column.link(), withSyntax, withWild, withClass, withLink);
            }
            return null;
        }
        if (binding instanceof QuotientBinding quotient) {
            if (!withClass) {
                return null;
            }
            List<RecipeItem> items = new ArrayList<>();
            for (int index = 0; index < quotient.kernels().size(); index++) {
                items.add(new RecipeItem(quotient.kernels().get(index).syntax(),
                        new KernelRecipe(quotient, index)));
            }
            return items;
        }
        if (binding instanceof ComplementBinding complement) {
            return withClass ? expand(complement.quotient().seed(), false, false, true, withLink) : null;
        }
        if (binding instanceof CoverBinding cover) {
            return withClass ? expand(cover.seed(), false, false, true, withLink) : null;
        }
        if (binding instanceof LocatorBinding locator) {
            return withClass ? expand(locator.seed(), false, false, true, withLink) : null;
        }
        if (binding instanceof WildSelectionBinding selection) {
            if (!withWild) {
                return expand(selection.base(), false, false, withClass, withLink);
            }
            return selectionItems(selection);
        }
        if (binding instanceof SelectionBinding selection) {
            if (!withSyntax) {
                return expand(selection.base(), false, false, withClass, withLink);
            }
            return selectionItems(selection);
        }
        if (binding instanceof RerouteBinding reroute) {
            return expand(reroute.target(), withSyntax, withWild, withClass, withLink);
        }
        if (binding instanceof ChainingBinding) {
            return expand(binding.base(), withSyntax, withWild, withClass, withLink);
        }
        return null;
    }

    private static List<RecipeItem> selectionItems(SelectionBinding selection) {
        List<RecipeItem> items = new ArrayList<>();
        for (Binding element : selection.elements()) {
            items.add(new RecipeItem(element.syntax(), new BindingRecipe(element)));
        }
        return items;
    }

    // ==================== Identity ====================

    /**
     * Returns the recipe of the identity of the scope rows, or null.
     */
    public Recipe identify(Binding binding) {
        if (binding instanceof TableBinding table) {
            return identityRecipe(table.table(), catalog.labels(table.table()));
        }
        if (binding instanceof ColumnBinding column) {
            return column.link() != null ? identify(column.link()) : null;
        }
        if (binding instanceof ComplementBinding complement) {
            return identify(complement.quotient().seed());
        }
        if (binding instanceof CoverBinding cover) {
            return identify(cover.seed());
        }
        if (binding instanceof LocatorBinding locator) {
            return identify(locator.seed());
        }
        if (binding instanceof ChainingBinding) {
            return identify(binding.base());
        }
        return null;
    }

    private IdentityRecipe identityRecipe(Table table, List<Label> labels) {
        List<Arc> arcs = catalog.identity(table);
        if (arcs == null) {
            return null;
        }
        List<Recipe> recipes = new ArrayList<>();
        for (Arc arc : arcs) {
            Recipe recipe = prescribe(arc, labels);
            if (arc instanceof ChainArc chain) {
                IdentityRecipe target = identityRecipe(chain.target(), catalog.labels(chain.target()));
                if (target != null) {
                    recipe = new ChainRecipe(List.of(recipe, target));
                }
            }
            recipes.add(recipe);
        }
        return new IdentityRecipe(recipes);
    }

    // ==================== Decorations ====================

    /**
     * Guesses the name an output column could be referred to by.
     */
    public String guessTag(Binding binding) {
        if (binding instanceof ImplicitCastBinding) {
            return guessTag(binding.base());
        }
        if (binding instanceof SegmentBinding segment) {
            return guessTag(segment.seed());
        }
        if (binding instanceof LocatorBinding locator) {
            return guessTag(locator.seed());
        }
        if (binding.syntax() instanceof IdentifierSyntax identifier) {
            return identifier.value();
        }
        if (binding instanceof AliasBinding) {
            return null;
        }
        if (binding instanceof ChainingBinding) {
            return guessTag(binding.base());
        }
        return null;
    }

    /**
     * Guesses the title path of a binding: the chain of scope titles that
     * leads to it.
     */
    public List<String> guessTitle(Binding binding) {
        if (binding instanceof TitleBinding title) {
            return List.of(title.title());
        }
        if (binding instanceof AliasBinding) {
            return List.of(binding.syntax().toString());
        }
        if (binding instanceof RescopingBinding rescoping) {
            List<String> child = guessTitle(rescoping.base());
            List<String> parent = new ArrayList<>(guessTitle(rescoping.scope()));
            if (!parent.isEmpty() && !child.isEmpty() && parent.get(parent.size() - 1).equals(child.get(0))) {
                parent.remove(parent.size() - 1);
            }
            parent.addAll(child);
            return parent;
        }
        if (binding instanceof ImplicitCastBinding) {
            return guessTitle(binding.base());
        }
        if (binding instanceof SegmentBinding segment) {
            return guessTitle(segment.seed());
        }
        if (binding instanceof HomeBinding) {
            return List.of();
        }
        if (binding instanceof ChainingBinding) {
            return guessTitle(binding.base());
        }
        return List.of(binding.syntax().toString());
    }

    /**
     * Guesses the display header of an output column.
     */
    public String guessHeader(Binding binding) {
        if (binding instanceof TitleBinding title) {
            return title.title();
        }
        if (binding instanceof AliasBinding) {
            return binding.syntax().toString();
        }
        if (binding instanceof QuotientBinding quotient) {
            String seedHeader = guessHeader(quotient.seed());
            List<String> kernelHeaders = new ArrayList<>();
            for (Binding kernel : quotient.kernels()) {
                kernelHeaders.add(guessHeader(kernel));
            }
            if (seedHeader == null || kernelHeaders.contains(null)) {
                return syntaxHeader(binding);
            }
            if (kernelHeaders.size() == 1) {
                return seedHeader + "^" + kernelHeaders.get(0);
            }
            return seedHeader + "^{" + String.join(",", kernelHeaders) + "}";
        }
        if (binding instanceof LocatorBinding locator) {
            return guessHeader(locator.seed());
        }
        if (binding instanceof ImplicitCastBinding) {
            return guessHeader(binding.base());
        }
        if (binding instanceof SegmentBinding segment) {
            return guessHeader(segment.seed());
        }
        if (binding instanceof HomeBinding) {
            return null;
        }
        if (binding instanceof ChainingBinding) {
            return guessHeader(binding.base());
        }
        return syntaxHeader(binding);
    }

    private static String syntaxHeader(Binding binding) {
        String value = binding.syntax().toString();
        return value.isEmpty() ? null : value;
    }

    /**
     * Returns the sort direction of a binding, or null if it has none.
     */
    public static Integer direct(Binding binding) {
        if (binding instanceof DirectionBinding direction) {
            return direction.direction();
        }
        if (binding instanceof RescopingBinding rescoping) {
            Integer baseDirection = direct(rescoping.base());
            Integer scopeDirection = direct(rescoping.scope());
            if (scopeDirection == null) {
                return baseDirection;
            }
            if (baseDirection == null) {
                return scopeDirection;
            }
            return baseDirection * scopeDirection;
        }
        if (binding instanceof ImplicitCastBinding) {
            return direct(binding.base());
        }
        if (binding instanceof ChainingBinding) {
            return direct(binding.base());
        }
        return null;
    }

    /**
     * Returns the format command the binding produces, or null.
     */
    public CommandBinding command(Binding binding) {
        if (binding instanceof CommandBinding command) {
            return command;
        }
        if (binding instanceof WrappingBinding) {
            return command(binding.base());
        }
        return null;
    }

    // ==================== Catalog arcs ====================

    private Recipe labelRecipe(List<Label> labels, String name) {
        for (Label label : labels) {
            if (label.name().equals(name)) {
                return prescribe(label.arc(), labels);
            }
        }
        return null;
    }

    private static Set<AttributeKey> labelKeys(List<Label> labels) {
        Set<AttributeKey> keys = new LinkedHashSet<>();
        for (Label label : labels) {
            keys.add(new AttributeKey(label.name(), null));
        }
        return keys;
    }

    private List<RecipeItem> labelItems(Binding binding, List<Label> labels) {
        List<RecipeItem> items = new ArrayList<>();
        for (Label label : labels) {
            if (label.isPublic()) {
                items.add(new RecipeItem(new IdentifierSyntax(label.name(), binding.mark()),
                        prescribe(label.arc(), labels)));
            }
        }
        return items;
    }

    /**
     * Converts a catalog arc to a recipe. The labels of the node owning the
     * arc are used to name the alternatives of an ambiguous arc.
     */
    static Recipe prescribe(Arc arc, List<Label> labels) {
        if (arc instanceof TableArc table) {
            return new FreeTableRecipe(table.table());
        }
        if (arc instanceof ColumnArc column) {
            Recipe link = column.link() != null ? prescribe(column.link(), labels) : null;
            return new ColumnRecipe(column.column(), link);
        }
        if (arc instanceof ChainArc chain) {
            return new AttachedTableRecipe(chain.joins());
        }
        AmbiguousArc ambiguous = (AmbiguousArc) arc;
        List<String> alternatives = new ArrayList<>();
        for (Arc alternative : ambiguous.alternatives()) {
            for (Label label : labels) {
                if (label.arc().equals(alternative)) {
                    alternatives.add(label.name());
                    break;
                }
            }
        }
        return new AmbiguousRecipe(alternatives);
    }
}
