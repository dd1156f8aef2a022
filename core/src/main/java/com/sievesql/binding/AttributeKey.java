package com.sievesql.binding;

/**
 * A normalized attribute name with its arity (null for a plain attribute).
 */
public record AttributeKey(String name, Integer arity) {
}
