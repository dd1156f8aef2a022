package com.sievesql.space;

/**
 * What kind of rows a space produces: a single scalar row, table rows, or
 * the distinct kernel values of a quotient.
 */
public sealed interface Family permits ScalarFamily, TableFamily, QuotientFamily {
}
