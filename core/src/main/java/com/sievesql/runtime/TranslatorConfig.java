package com.sievesql.runtime;

import com.sievesql.generator.Dialect;
import com.sievesql.generator.Dialects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Translator settings: the target dialect, the row-limit ceiling applied to
 * every query and whether translated queries are cached.
 *
 * <p>Values come from the defaults, then from the system properties
 * {@code sievesql.dialect}, {@code sievesql.rowLimit} and
 * {@code sievesql.cache}, then from explicit builder calls.
 *
 * <p>Example usage:
 * <pre>
 *   TranslatorConfig config = TranslatorConfig.builder()
 *       .dialect("oracle")
 *       .rowLimit(1000)
 *       .build();
 * </pre>
 */
public final class TranslatorConfig {

    private static final Logger logger = LoggerFactory.getLogger(TranslatorConfig.class);

    public static final String DIALECT_PROPERTY = "sievesql.dialect";
    public static final String ROW_LIMIT_PROPERTY = "sievesql.rowLimit";
    public static final String CACHE_PROPERTY = "sievesql.cache";

    public static final String DEFAULT_DIALECT = "postgresql";

    private final String dialectName;
    private final Integer rowLimit;
    private final boolean cacheEnabled;

    private TranslatorConfig(String dialectName, Integer rowLimit, boolean cacheEnabled) {
        this.dialectName = dialectName;
        this.rowLimit = rowLimit;
        this.cacheEnabled = cacheEnabled;
    }

    /**
     * Returns the configuration from the defaults and the system properties.
     */
    public static TranslatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String dialectName() {
        return dialectName;
    }

    /**
     * Returns a new instance of the configured dialect.
     */
    public Dialect dialect() {
        return Dialects.forName(dialectName);
    }

    /**
     * Returns the maximum number of rows a query may produce, or null if
     * there is no ceiling.
     */
    public Integer rowLimit() {
        return rowLimit;
    }

    public boolean cacheEnabled() {
        return cacheEnabled;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.dialectName = dialectName;
        builder.rowLimit = rowLimit;
        builder.cacheEnabled = cacheEnabled;
        return builder;
    }

    // ==================== Parsing ====================

    /**
     * Validates a dialect name and returns it in canonical form.
     *
     * @throws IllegalArgumentException if no dialect has that name
     */
    public static String parseDialect(String value) {
        return Dialects.forName(value).name();
    }

    /**
     * Parses a row-limit ceiling. A blank value, {@code none} or {@code 0}
     * means no ceiling.
     *
     * @throws IllegalArgumentException if the value is not a non-negative integer
     */
    public static Integer parseRowLimit(String value) {
        if (value == null) {
            return null;
        }
        String text = value.trim();
        if (text.isEmpty() || text.toLowerCase(Locale.ROOT).equals("none")) {
            return null;
        }
        int limit;
        try {
            limit = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid row limit: '%s'. Expected a non-negative integer or 'none'".formatted(value), e);
        }
        if (limit < 0) {
            throw new IllegalArgumentException(
                    "Invalid row limit: '%s'. Expected a non-negative integer or 'none'".formatted(value));
        }
        return limit == 0 ? null : limit;
    }

    static boolean parseFlag(String name, String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "on", "yes", "1":
                return true;
            case "false", "off", "no", "0":
                return false;
            default:
                throw new IllegalArgumentException(
                        "Invalid value for %s: '%s'. Valid values: true, false".formatted(name, value));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TranslatorConfig)) return false;
        TranslatorConfig that = (TranslatorConfig) o;
        return cacheEnabled == that.cacheEnabled
                && dialectName.equals(that.dialectName)
                && Objects.equals(rowLimit, that.rowLimit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dialectName, rowLimit, cacheEnabled);
    }

    @Override
    public String toString() {
        return "TranslatorConfig(dialect=" + dialectName + ", rowLimit=" + rowLimit
                + ", cache=" + cacheEnabled + ")";
    }

    /**
     * Builder seeded from the defaults and the system properties.
     */
    public static final class Builder {

        private String dialectName = DEFAULT_DIALECT;
        private Integer rowLimit;
        private boolean cacheEnabled = true;

        private Builder() {
            String dialect = System.getProperty(DIALECT_PROPERTY);
            if (dialect != null) {
                this.dialectName = parseDialect(dialect);
            }
            String limit = System.getProperty(ROW_LIMIT_PROPERTY);
            if (limit != null) {
                this.rowLimit = parseRowLimit(limit);
            }
            String cache = System.getProperty(CACHE_PROPERTY);
            if (cache != null) {
                this.cacheEnabled = parseFlag(CACHE_PROPERTY, cache);
            }
        }

        public Builder dialect(String name) {
            this.dialectName = parseDialect(Objects.requireNonNull(name, "name must not be null"));
            return this;
        }

        /**
         * Sets the row-limit ceiling; null or 0 removes it.
         */
        public Builder rowLimit(Integer limit) {
            if (limit != null && limit < 0) {
                throw new IllegalArgumentException("rowLimit must be non-negative, got " + limit);
            }
            this.rowLimit = limit == null || limit == 0 ? null : limit;
            return this;
        }

        public Builder cacheEnabled(boolean enabled) {
            this.cacheEnabled = enabled;
            return this;
        }

        public TranslatorConfig build() {
            TranslatorConfig config = new TranslatorConfig(dialectName, rowLimit, cacheEnabled);
            logger.info("Translator configuration: {}", config);
            return config;
        }
    }
}
