package com.sievesql.generator;

import com.sievesql.binding.Binding;
import com.sievesql.exception.SerializeError;
import com.sievesql.frame.Anchor;
import com.sievesql.frame.BranchFrame;
import com.sievesql.frame.ColumnPhrase;
import com.sievesql.frame.EmbeddingPhrase;
import com.sievesql.frame.Frame;
import com.sievesql.frame.NestedFrame;
import com.sievesql.frame.Phrase;
import com.sievesql.frame.QueryFrame;
import com.sievesql.frame.ReferencePhrase;
import com.sievesql.frame.SegmentFrame;
import com.sievesql.space.TableFamily;
import com.sievesql.syntax.ApplicationSyntax;
import com.sievesql.syntax.IdentifierSyntax;
import com.sievesql.syntax.LiteralSyntax;
import com.sievesql.syntax.Syntax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Serializes a reduced frame tree to SQL text.
 *
 * <p>Serialization runs in two passes over the tree. The aliasing pass
 * names every {@code SELECT} item of a subquery and every frame in a
 * {@code FROM} clause after the query element it came from (the column,
 * the function, the table); clashing names get a numeric suffix and all
 * names are truncated to the dialect limit. The dump pass then writes the
 * SQL text through the dialect.
 *
 * <p>Example usage:
 * <pre>
 *   Serializer serializer = new Serializer(new PostgresDialect());
 *   String sql = serializer.serialize(frame);
 * </pre>
 */
public final class Serializer {

    private static final Logger logger = LoggerFactory.getLogger(Serializer.class);

    private static final String UNNAMED = "!";

    private final Dialect dialect;

    public Serializer(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    /**
     * Returns the SQL text of a query, or null if the query does not need
     * the database.
     *
     * @throws SerializeError if a value cannot be represented in SQL
     */
    public String serialize(QueryFrame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        if (frame.segment() == null) {
            return null;
        }
        return serialize(frame.segment());
    }

    public String serialize(SegmentFrame segment) {
        SerializationContext context = new SerializationContext(dialect);
        context.setTree(segment);
        aliasing(segment, context, new HashSet<>(), new HashSet<>());
        context.dump(segment);
        String sql = context.flush();
        logger.debug("Serialized SQL ({}):\n{}", dialect.name(), sql);
        return sql;
    }

    // ==================== Aliasing ====================

    private void aliasing(BranchFrame frame, SerializationContext context,
                          Set<String> takenSelectAliases, Set<String> takenIncludeAliases) {
        List<String> selectNames = new ArrayList<>();
        for (Phrase phrase : frame.select()) {
            selectNames.add(dub(phrase, context));
        }
        context.setSelectAliases(frame.tag(), namesToAliases(selectNames, takenSelectAliases));
        List<String> includeNames = new ArrayList<>();
        for (Anchor anchor : frame.include()) {
            includeNames.add(dub(anchor.frame()));
        }
        List<String> includeAliases = namesToAliases(includeNames, takenIncludeAliases);
        for (int i = 0; i < includeAliases.size(); i++) {
            context.setFrameAlias(frame.include().get(i).frame().tag(), includeAliases.get(i));
        }
        for (Anchor anchor : frame.include()) {
            if (anchor.frame() instanceof BranchFrame branch) {
                aliasing(branch, context, new HashSet<>(), new HashSet<>());
            }
        }
        for (NestedFrame embedded : frame.embed()) {
            aliasing(embedded, context, new HashSet<>(takenSelectAliases), new HashSet<>(takenIncludeAliases));
        }
    }

    /**
     * Makes the names unique and fit for the dialect. A name that occurs
     * more than once gets the suffixes {@code _1}, {@code _2} and so on.
     */
    List<String> namesToAliases(List<String> names, Set<String> takenAliases) {
        int maxLength = dialect.maxAliasLength();
        Map<String, Integer> nextNumberByName = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                nextNumberByName.put(name, 1);
            }
        }
        List<String> aliases = new ArrayList<>();
        for (String name : names) {
            String alias = null;
            while (alias == null) {
                Integer number = nextNumberByName.get(name);
                if (number == null) {
                    alias = truncate(name, maxLength);
                    number = 1;
                } else {
                    String suffix = String.valueOf(number);
                    alias = truncate(name, maxLength - suffix.length() - 1) + "_" + suffix;
                    number++;
                }
                nextNumberByName.put(name, number);
                if (takenAliases.contains(alias)) {
                    alias = null;
                }
            }
            aliases.add(alias);
            takenAliases.add(alias);
        }
        return aliases;
    }

    private static String truncate(String name, int length) {
        return name.length() > length ? name.substring(0, Math.max(length, 0)) : name;
    }

    private static String dub(Frame frame) {
        if (frame.term().space().family() instanceof TableFamily family) {
            return family.table().name();
        }
        return UNNAMED;
    }

    private static String dub(Phrase phrase, SerializationContext context) {
        if (phrase instanceof ColumnPhrase column) {
            return column.column().name();
        }
        if (phrase instanceof ReferencePhrase reference) {
            Frame frame = context.frame(reference.tag());
            return dub(((BranchFrame) frame).select().get(reference.index()), context);
        }
        if (phrase instanceof EmbeddingPhrase embedding) {
            Frame frame = context.frame(embedding.tag());
            return dub(((BranchFrame) frame).select().get(0), context);
        }
        Binding binding = phrase.expression().binding();
        Syntax syntax = binding != null ? binding.syntax() : null;
        String name = null;
        if (syntax instanceof IdentifierSyntax identifier) {
            name = identifier.value();
        } else if (syntax instanceof ApplicationSyntax application) {
            name = application.name();
        } else if (syntax instanceof LiteralSyntax literal) {
            name = literal.value();
        }
        return name == null || name.isEmpty() ? UNNAMED : name;
    }
}
