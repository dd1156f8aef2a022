package com.sievesql.runtime;

import java.util.List;
import java.util.Objects;

/**
 * The result of translating a query.
 *
 * @param sql the SQL text, or null if the query produces no database query
 * @param placeholders names of the statement parameters; literals are
 *        inlined, so this is empty for now
 * @param outputShape the columns of the output rows
 * @param format the requested output format command
 */
public record CompiledSql(String sql, List<String> placeholders, List<OutputColumn> outputShape, String format) {

    public CompiledSql {
        placeholders = List.copyOf(Objects.requireNonNull(placeholders, "placeholders must not be null"));
        outputShape = List.copyOf(Objects.requireNonNull(outputShape, "outputShape must not be null"));
        Objects.requireNonNull(format, "format must not be null");
    }

    public boolean hasSql() {
        return sql != null;
    }
}
