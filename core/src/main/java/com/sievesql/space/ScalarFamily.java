package com.sievesql.space;

/**
 * The family of the root and home spaces.
 */
public record ScalarFamily() implements Family {
}
