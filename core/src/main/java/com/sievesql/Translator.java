package com.sievesql;

import com.sievesql.binding.Binder;
import com.sievesql.binding.QueryBinding;
import com.sievesql.compiler.Compiler;
import com.sievesql.compiler.QueryTerm;
import com.sievesql.exception.AssembleError;
import com.sievesql.exception.BindError;
import com.sievesql.exception.CompileError;
import com.sievesql.exception.EncodeError;
import com.sievesql.exception.ParseError;
import com.sievesql.exception.SerializeError;
import com.sievesql.exception.TranslateError;
import com.sievesql.frame.Assembler;
import com.sievesql.frame.QueryFrame;
import com.sievesql.generator.Dialect;
import com.sievesql.generator.Serializer;
import com.sievesql.mark.Mark;
import com.sievesql.parser.QueryParser;
import com.sievesql.reducer.Reducer;
import com.sievesql.runtime.CompiledSql;
import com.sievesql.runtime.OutputColumn;
import com.sievesql.runtime.QueryPlanCache;
import com.sievesql.runtime.RootScope;
import com.sievesql.space.Arena;
import com.sievesql.space.Encoder;
import com.sievesql.space.QueryExpr;
import com.sievesql.space.Rewriter;
import com.sievesql.syntax.QuerySyntax;
import com.sievesql.types.Domain;
import com.sievesql.types.ListDomain;
import com.sievesql.types.Profile;
import com.sievesql.types.RecordDomain;
import com.sievesql.types.TextDomain;
import com.sievesql.types.UntypedDomain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Translates query text into SQL.
 *
 * <p>A query goes through the pipeline: parse, bind, encode, rewrite,
 * compile, assemble, reduce and serialize. Each stage fails fast with its
 * own {@link TranslateError} subclass pointing at the offending fragment of
 * the query.
 *
 * <p>Example usage:
 * <pre>
 *   Catalog catalog = CatalogLoader.read(input);
 *   Translator translator = new Translator();
 *   CompiledSql result = translator.translate("/school{name}", RootScope.of(catalog));
 *   System.out.println(result.sql());
 * </pre>
 *
 * <p>Instances are thread-safe; translations that share a cache are
 * computed once per query text, dialect, row-limit ceiling, catalog and
 * function registry.
 */
public final class Translator {

    private static final Logger logger = LoggerFactory.getLogger(Translator.class);

    private static final String UNNAMED = "!";

    private final QueryPlanCache cache;

    public Translator() {
        this(new QueryPlanCache());
    }

    public Translator(QueryPlanCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    public QueryPlanCache cache() {
        return cache;
    }

    /**
     * Translates a query.
     *
     * @param query the query text
     * @param scope the catalog, functions and settings to translate against
     * @return the SQL text and the output shape
     * @throws TranslateError if the query is invalid or cannot be expressed in SQL
     */
    public CompiledSql translate(String query, RootScope scope) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        if (!scope.config().cacheEnabled()) {
            return translateUncached(query, scope);
        }
        return cache.get(QueryPlanCache.Key.of(query, scope), key -> translateUncached(query, scope));
    }

    private CompiledSql translateUncached(String query, RootScope scope) {
        long start = System.nanoTime();
        Dialect dialect = scope.config().dialect();
        try {
            QuerySyntax syntax = stage("parse", () -> QueryParser.parse(query),
                    cause -> new ParseError("unexpected failure: " + cause.getMessage(), Mark.EMPTY, cause));
            Mark mark = syntax.mark();

            QueryBinding binding = stage("bind",
                    () -> new Binder(scope.catalog(), scope.functions()).bind(syntax),
                    cause -> new BindError("unexpected failure: " + cause.getMessage(), mark, cause));

            Arena arena = new Arena();
            QueryExpr expression = stage("encode", () -> {
                QueryExpr encoded = new Encoder(arena, scope.config().rowLimit()).encode(binding);
                return new Rewriter(arena).rewrite(encoded);
            }, cause -> new EncodeError("unexpected failure: " + cause.getMessage(), mark, cause));

            QueryTerm term = stage("compile",
                    () -> new Compiler(dialect.paginationStrategy()).compile(expression),
                    cause -> new CompileError("unexpected failure: " + cause.getMessage(), mark, cause));

            QueryFrame frame = stage("assemble", () -> new Reducer(dialect).reduce(new Assembler().assemble(term)),
                    cause -> new AssembleError("unexpected failure: " + cause.getMessage(), mark, cause));

            String sql = stage("serialize", () -> new Serializer(dialect).serialize(frame),
                    cause -> new SerializeError("unexpected failure: " + cause.getMessage(), mark, cause));

            CompiledSql result = new CompiledSql(sql, List.of(), outputShape(binding.profile()), binding.format());
            logger.debug("Translated query in {} ms ({})", (System.nanoTime() - start) / 1_000_000, dialect.name());
            return result;
        } catch (TranslateError e) {
            logger.debug("Failed to translate query: {}", e.getUserMessage());
            throw e;
        }
    }

    private static <T> T stage(String name, Supplier<T> body,
                               Function<RuntimeException, TranslateError> wrapper) {
        long start = System.nanoTime();
        T result;
        try {
            result = body.get();
        } catch (TranslateError e) {
            throw e;
        } catch (RuntimeException e) {
            throw wrapper.apply(e);
        }
        logger.debug("Stage {} took {} us", name, (System.nanoTime() - start) / 1_000);
        return result;
    }

    // ==================== Output shape ====================

    /**
     * Lists the output columns: the fields of a record output, or a single
     * column otherwise.
     */
    static List<OutputColumn> outputShape(Profile profile) {
        Domain domain = profile.domain();
        if (domain instanceof ListDomain list) {
            domain = list.item();
        }
        List<OutputColumn> columns = new ArrayList<>();
        if (domain instanceof RecordDomain record) {
            for (Profile field : record.fields()) {
                columns.add(new OutputColumn(title(field), outputDomain(field.domain())));
            }
        } else {
            columns.add(new OutputColumn(title(profile), outputDomain(domain)));
        }
        return columns;
    }

    // A string literal in the output is text.
    private static Domain outputDomain(Domain domain) {
        return domain instanceof UntypedDomain ? new TextDomain() : domain;
    }

    private static String title(Profile profile) {
        if (profile.header() != null && !profile.header().isEmpty()) {
            return profile.header();
        }
        if (profile.tag() != null && !profile.tag().isEmpty()) {
            return profile.tag();
        }
        return UNNAMED;
    }
}
