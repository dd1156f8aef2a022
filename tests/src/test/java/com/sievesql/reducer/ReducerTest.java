package com.sievesql.reducer;

import com.sievesql.binding.Binder;
import com.sievesql.binding.QueryBinding;
import com.sievesql.compiler.Compiler;
import com.sievesql.compiler.QueryTerm;
import com.sievesql.frame.Anchor;
import com.sievesql.frame.Assembler;
import com.sievesql.frame.LiteralPhrase;
import com.sievesql.frame.Phrase;
import com.sievesql.frame.QueryFrame;
import com.sievesql.frame.ScalarFrame;
import com.sievesql.frame.TableFrame;
import com.sievesql.functions.FunctionRegistry;
import com.sievesql.generator.Dialect;
import com.sievesql.generator.OracleDialect;
import com.sievesql.generator.PostgresDialect;
import com.sievesql.parser.QueryParser;
import com.sievesql.space.Arena;
import com.sievesql.space.Encoder;
import com.sievesql.space.QueryExpr;
import com.sievesql.space.Rewriter;
import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import com.sievesql.test.UniversityCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the stages up to assembly by hand and checks the reduced frames.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Reducer Tests")
public class ReducerTest extends TestBase {

    private static QueryFrame assemble(String query, Dialect dialect) {
        QueryBinding binding = new Binder(UniversityCatalog.catalog(), FunctionRegistry.builtins())
            .bind(QueryParser.parse(query));
        Arena arena = new Arena();
        QueryExpr expression = new Rewriter(arena).rewrite(new Encoder(arena, null).encode(binding));
        QueryTerm term = new Compiler(dialect.paginationStrategy()).compile(expression);
        return new Assembler().assemble(term);
    }

    @Test
    @DisplayName("TC-RED-001: constant addition is folded")
    void testFolding() {
        QueryFrame reduced = new Reducer(new PostgresDialect()).reduce(assemble("/{1+1}", new PostgresDialect()));
        logData("frame", reduced.segment());

        Phrase phrase = reduced.segment().select().get(0);
        assertThat(phrase).isInstanceOf(LiteralPhrase.class);
        assertThat(((LiteralPhrase) phrase).value()).isEqualTo(BigInteger.valueOf(2));
    }

    @Test
    @DisplayName("TC-RED-002: Oracle keeps DUAL when no table is read")
    void testOracleScalar() {
        QueryFrame reduced = new Reducer(new OracleDialect()).reduce(assemble("/{1+1}", new OracleDialect()));

        assertThat(reduced.segment().include()).hasSize(1);
    }

    @Test
    @DisplayName("TC-RED-005: Oracle drops the scalar anchor in front of a table")
    void testOracleTable() {
        QueryFrame reduced = new Reducer(new OracleDialect()).reduce(assemble("/school", new OracleDialect()));
        logData("frame", reduced.segment());

        assertThat(reduced.segment().include()).hasSize(1);
        assertThat(reduced.segment().include())
            .extracting(Anchor::frame)
            .noneMatch(frame -> frame instanceof ScalarFrame)
            .allMatch(frame -> frame instanceof TableFrame);
    }

    @Test
    @DisplayName("TC-RED-006: a subquery of constants is merged away")
    void testConstantSubquery() {
        QueryFrame reduced = new Reducer(new PostgresDialect()).reduce(assemble("/{1+}", new PostgresDialect()));
        logData("frame", reduced.segment());

        assertThat(reduced.segment().include()).isEmpty();
        assertThat(reduced.segment().select()).hasSize(1);
        assertThat(reduced.segment().select().get(0)).isInstanceOf(LiteralPhrase.class);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
        "/{1+1}",
        "/{1+}",
        "/school",
        "/school?campus='old'",
        "/school{name-}",
        "/department{name, count(course)}",
        "/school{name, count(department?exists(course))}",
    })
    @DisplayName("TC-RED-003: reduction is idempotent")
    void testIdempotent(String query) {
        Reducer reducer = new Reducer(new PostgresDialect());
        QueryFrame once = reducer.reduce(assemble(query, new PostgresDialect()));
        QueryFrame twice = new Reducer(new PostgresDialect()).reduce(once);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    @DisplayName("TC-RED-004: a TRUE filter is dropped")
    void testTrueFilter() {
        QueryFrame reduced = new Reducer(new PostgresDialect())
            .reduce(assemble("/school?true", new PostgresDialect()));

        assertThat(reduced.segment().where()).isNull();
    }
}
