package com.sievesql.functions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Arguments of a formula, keyed by slot name.
 *
 * <p>A singular slot maps to a node or null; a plural slot maps to an
 * immutable list. The same container is used at every stage: syntax nodes
 * during matching, bindings, codes, and phrases.
 *
 * <pre>
 *   Arguments&lt;Binding&gt; args = Arguments.&lt;Binding&gt;builder()
 *       .put("lop", left)
 *       .put("rop", right)
 *       .build();
 *   Arguments&lt;Code&gt; codes = args.map(encoder::encode);
 * </pre>
 *
 * @param <T> the node type
 */
public final class Arguments<T> {

    private final Map<String, Object> values;

    private Arguments(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public static <T> Arguments<T> empty() {
        return new Arguments<>(new LinkedHashMap<>());
    }

    /**
     * Returns the node in a singular slot.
     *
     * @throws IllegalArgumentException if there is no such slot or it is plural
     */
    @SuppressWarnings("unchecked")
    public T get(String name) {
        Object value = slot(name);
        if (value instanceof List) {
            throw new IllegalArgumentException("slot '" + name + "' is plural");
        }
        return (T) value;
    }

    /**
     * Returns the nodes in a plural slot.
     *
     * @throws IllegalArgumentException if there is no such slot or it is singular
     */
    @SuppressWarnings("unchecked")
    public List<T> list(String name) {
        Object value = slot(name);
        if (value != null && !(value instanceof List)) {
            throw new IllegalArgumentException("slot '" + name + "' is singular");
        }
        return value == null ? List.of() : (List<T>) value;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public List<String> names() {
        return new ArrayList<>(values.keySet());
    }

    /**
     * Returns all nodes in slot order, flattening plural slots and skipping
     * empty singular ones.
     */
    @SuppressWarnings("unchecked")
    public List<T> cells() {
        List<T> cells = new ArrayList<>();
        for (Object value : values.values()) {
            if (value instanceof List<?> items) {
                cells.addAll((List<T>) items);
            } else if (value != null) {
                cells.add((T) value);
            }
        }
        return cells;
    }

    /**
     * Applies a function to every node, preserving the slot structure.
     */
    @SuppressWarnings("unchecked")
    public <R> Arguments<R> map(Function<? super T, ? extends R> method) {
        Map<String, Object> mapped = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof List<?> items) {
                List<R> results = new ArrayList<>();
                for (Object item : items) {
                    results.add(method.apply((T) item));
                }
                mapped.put(entry.getKey(), List.copyOf(results));
            } else if (value != null) {
                mapped.put(entry.getKey(), method.apply((T) value));
            } else {
                mapped.put(entry.getKey(), null);
            }
        }
        return new Arguments<>(mapped);
    }

    /**
     * Returns a copy with one slot replaced.
     */
    public Arguments<T> with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, value instanceof List<?> items ? List.copyOf(items) : value);
        return new Arguments<>(copy);
    }

    /**
     * Returns true if the slots match the signature: same names, mandatory
     * slots filled, node types as expected.
     */
    public boolean admits(Class<?> type, Signature signature) {
        Set<String> names = new HashSet<>();
        for (Slot slot : signature.slots()) {
            names.add(slot.name());
        }
        if (!values.keySet().equals(names)) {
            return false;
        }
        for (Slot slot : signature.slots()) {
            Object value = values.get(slot.name());
            if (slot.isSingular()) {
                if (value == null) {
                    if (slot.isMandatory()) {
                        return false;
                    }
                } else if (!type.isInstance(value)) {
                    return false;
                }
            } else {
                if (!(value instanceof List<?> items)) {
                    return false;
                }
                if (slot.isMandatory() && items.isEmpty()) {
                    return false;
                }
                for (Object item : items) {
                    if (!type.isInstance(item)) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    private Object slot(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("no slot named '" + name + "'");
        }
        return values.get(name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Arguments<?> other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /**
     * Collects slot values in declaration order.
     */
    public static final class Builder<T> {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder<T> put(String name, T value) {
            values.put(name, value);
            return this;
        }

        public Builder<T> putList(String name, List<? extends T> items) {
            values.put(name, List.copyOf(items));
            return this;
        }

        public Arguments<T> build() {
            return new Arguments<>(new LinkedHashMap<>(values));
        }
    }
}
