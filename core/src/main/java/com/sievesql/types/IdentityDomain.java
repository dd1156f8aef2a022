package com.sievesql.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The domain of record identities, the values a locator {@code table[...]}
 * is compared against.
 *
 * <p>An identity is a tuple of labels, where a label is either a scalar
 * domain or a nested identity (for a primary key that contains a foreign key).
 * The literal form joins labels with {@code .}; a nested identity is
 * enclosed in parentheses unless it can be flattened unambiguously.
 * Native values are lists whose items are label values or nested lists.
 *
 * @param labels the label domains
 */
public record IdentityDomain(List<Domain> labels) implements Domain {

    private static final Pattern TOKEN =
        Pattern.compile("(\\s+)|([\\[\\]().])|('(?:[^'\\x00]|'')*')|([\\w-]+)");
    private static final Pattern PLAIN = Pattern.compile("[\\w-]+");

    public IdentityDomain {
        Objects.requireNonNull(labels, "labels must not be null");
        labels = List.copyOf(labels);
    }

    @Override
    public String family() {
        return "identity";
    }

    /**
     * Returns the number of scalar labels, counting nested identities flat.
     */
    public int arity() {
        int arity = 0;
        for (Domain label : labels) {
            arity += label instanceof IdentityDomain identity ? identity.arity() : 1;
        }
        return arity;
    }

    @Override
    public Object parse(String data) {
        if (data == null) {
            return null;
        }
        List<String> tokens = new ArrayList<>();
        int start = 0;
        Matcher matcher = TOKEN.matcher(data);
        while (start < data.length()) {
            if (!matcher.find(start) || matcher.start() != start) {
                throw new IllegalArgumentException("unexpected character '" + data.charAt(start) + "'");
            }
            start = matcher.end();
            if (matcher.group(1) == null) {
                tokens.add(matcher.group());
            }
        }
        Group root = new Group();
        List<Group> stack = new ArrayList<>();
        Group current = root;
        int index = 0;
        boolean expectLabel = true;
        while (index < tokens.size()) {
            String token = tokens.get(index++);
            if (expectLabel) {
                if (token.equals("[") || token.equals("(")) {
                    Group group = new Group();
                    group.bracket = token;
                    current.items.add(group);
                    stack.add(current);
                    current = group;
                    continue;
                }
                if (token.equals("]") || token.equals(")") || token.equals(".")) {
                    throw new IllegalArgumentException("ill-formed locator");
                }
                if (token.startsWith("'")) {
                    token = token.substring(1, token.length() - 1).replace("''", "'");
                }
                current.items.add(token);
                expectLabel = false;
            } else if (token.equals(".")) {
                expectLabel = true;
            } else if (token.equals("]") || token.equals(")")) {
                String open = token.equals("]") ? "[" : "(";
                if (stack.isEmpty() || !open.equals(current.bracket)) {
                    throw new IllegalArgumentException("ill-formed locator");
                }
                current = stack.remove(stack.size() - 1);
            } else {
                throw new IllegalArgumentException("ill-formed locator");
            }
        }
        if (expectLabel || !stack.isEmpty()) {
            throw new IllegalArgumentException("ill-formed locator");
        }
        List<Object> raw = new ArrayList<>(root.items);
        return collect(raw, this);
    }

    private static List<Object> collect(List<Object> raw, IdentityDomain identity) {
        if (width(raw) != identity.arity()) {
            throw new IllegalArgumentException("ill-formed locator");
        }
        List<Object> value = new ArrayList<>();
        for (Domain field : identity.labels) {
            if (raw.isEmpty()) {
                throw new IllegalArgumentException("ill-formed locator");
            }
            if (field instanceof IdentityDomain nested) {
                Object first = raw.get(0);
                List<Object> items = new ArrayList<>();
                if (first instanceof Group group && width(group.items) == nested.arity()) {
                    raw.remove(0);
                    items.addAll(group.items);
                } else {
                    int total = 0;
                    while (total < nested.arity()) {
                        if (raw.isEmpty()) {
                            throw new IllegalArgumentException("ill-formed locator");
                        }
                        Object item = raw.remove(0);
                        total += width(List.of(item));
                        items.add(item);
                    }
                    if (total > nested.arity()) {
                        throw new IllegalArgumentException("ill-formed locator");
                    }
                }
                value.add(collect(items, nested));
            } else {
                Object item = raw.remove(0);
                if (!(item instanceof String label)) {
                    throw new IllegalArgumentException("ill-formed locator");
                }
                value.add(field.parse(label));
            }
        }
        return value;
    }

    private static int width(List<Object> items) {
        int width = 0;
        for (Object item : items) {
            width += item instanceof Group group ? width(group.items) : 1;
        }
        return width;
    }

    @Override
    public String dump(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> items)) {
            throw new IllegalArgumentException("not an identity value: " + value);
        }
        return convert(items, labels, true);
    }

    private static String convert(List<?> value, List<Domain> fields, boolean isFlattened) {
        if (value.size() != fields.size()) {
            throw new IllegalArgumentException("identity value does not match its labels");
        }
        boolean isSimple = true;
        for (Domain field : fields.subList(1, fields.size())) {
            if (field instanceof IdentityDomain) {
                isSimple = false;
            }
        }
        List<String> chunks = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            Domain field = fields.get(i);
            if (field instanceof IdentityDomain nested) {
                boolean flatten = nested.labels.size() == 1 || isSimple;
                chunks.add(convert((List<?>) value.get(i), nested.labels, flatten));
            } else {
                String chunk = field.dump(value.get(i));
                if (!PLAIN.matcher(chunk).matches()) {
                    chunk = "'" + chunk.replace("'", "''") + "'";
                }
                chunks.add(chunk);
            }
        }
        String data = String.join(".", chunks);
        return isFlattened ? data : "(" + data + ")";
    }

    private static final class Group {
        private String bracket;
        private final List<Object> items = new ArrayList<>();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(labels.get(i));
        }
        return sb.append(']').toString();
    }
}
