package com.sievesql.binding;

import com.sievesql.functions.FunctionRegistry;
import com.sievesql.syntax.Syntax;
import com.sievesql.types.Profile;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * The mutable state of one binding pass: the root scope, the current scope
 * and the stack of enclosing scopes.
 *
 * <p>Function binders receive the state to bind their arguments:
 * <pre>
 *   Binding op = state.bind(argument);
 *   Binding element = state.use(recipe, syntax, op);
 * </pre>
 */
public final class BindingState {

    private final Binder binder;
    private final RootBinding root;
    private Binding scope;
    private final Deque<Binding> scopeStack = new ArrayDeque<>();

    BindingState(Binder binder, RootBinding root) {
        this.binder = Objects.requireNonNull(binder, "binder must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.scope = root;
    }

    public RootBinding root() {
        return root;
    }

    /**
     * Returns the scope names are currently resolved in.
     */
    public Binding scope() {
        return scope;
    }

    public Lookup lookup() {
        return binder.lookup();
    }

    public FunctionRegistry functions() {
        return binder.functions();
    }

    public void pushScope(Binding newScope) {
        scopeStack.push(scope);
        scope = Objects.requireNonNull(newScope, "scope must not be null");
    }

    public void popScope() {
        scope = scopeStack.pop();
    }

    boolean isBalanced() {
        return scopeStack.isEmpty();
    }

    /**
     * Binds a syntax node in the current scope.
     */
    public Binding bind(Syntax syntax) {
        return binder.bindSyntax(syntax, this);
    }

    /**
     * Binds a syntax node in the given scope.
     */
    public Binding bind(Syntax syntax, Binding newScope) {
        pushScope(newScope);
        try {
            return binder.bindSyntax(syntax, this);
        } finally {
            popScope();
        }
    }

    /**
     * Produces a binding from a recipe in the current scope.
     */
    public Binding use(Recipe recipe, Syntax syntax) {
        return binder.useRecipe(recipe, syntax, this);
    }

    /**
     * Produces a binding from a recipe in the given scope.
     */
    public Binding use(Recipe recipe, Syntax syntax, Binding newScope) {
        pushScope(newScope);
        try {
            return binder.useRecipe(recipe, syntax, this);
        } finally {
            popScope();
        }
    }

    /**
     * Binds a function call, an operator or a bare identifier by name.
     */
    public Binding call(Syntax syntax) {
        return binder.callByName(syntax, this);
    }

    /**
     * Converts a binding to an output column: expands records and tables to
     * their columns, casts scalars to their canonical domain.
     */
    public Binding select(Binding binding) {
        return binder.select(binding, this);
    }

    /**
     * Describes an output column.
     */
    public Profile decorate(Binding binding) {
        return binder.decorate(binding);
    }

    /**
     * Builds a quotient of the seed by the given kernel elements, together
     * with definitions naming the complement and the kernels.
     */
    public Binding project(Binding seed, List<Binding> elements, Syntax syntax) {
        return binder.project(seed, elements, syntax, this);
    }
}
