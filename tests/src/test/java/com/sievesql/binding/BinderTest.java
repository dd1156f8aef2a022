package com.sievesql.binding;

import com.sievesql.catalog.Catalog;
import com.sievesql.exception.BindError;
import com.sievesql.functions.FunctionRegistry;
import com.sievesql.functions.SignatureKind;
import com.sievesql.parser.QueryParser;
import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import com.sievesql.test.UniversityCatalog;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.ListDomain;
import com.sievesql.types.Profile;
import com.sievesql.types.RecordDomain;
import com.sievesql.types.TextDomain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Binder}: name resolution, overload selection, output
 * profiles and bind errors.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Binder Tests")
public class BinderTest extends TestBase {

    private Binder binder;

    @BeforeEach
    void setUp() {
        Catalog catalog = UniversityCatalog.catalog();
        binder = new Binder(catalog, FunctionRegistry.builtins());
    }

    private QueryBinding bind(String query) {
        return binder.bind(QueryParser.parse(query));
    }

    private static List<Profile> fields(QueryBinding binding) {
        assertThat(binding.profile().domain()).isInstanceOf(ListDomain.class);
        ListDomain list = (ListDomain) binding.profile().domain();
        assertThat(list.item()).isInstanceOf(RecordDomain.class);
        return ((RecordDomain) list.item()).fields();
    }

    /**
     * Finds the outermost formula under a selected column, looking through
     * casts and wrappers.
     */
    private static FormulaBinding formula(Binding binding) {
        Binding current = binding;
        for (int depth = 0; current != null && depth < 16; depth++) {
            if (current instanceof FormulaBinding formula) {
                return formula;
            }
            current = current.base();
        }
        throw new AssertionError("no formula under " + binding);
    }

    private static Binding firstElement(QueryBinding binding) {
        Binding seed = binding.segment().seed();
        assertThat(seed).isInstanceOf(SelectionBinding.class);
        return ((SelectionBinding) seed).elements().get(0);
    }

    @Nested
    @DisplayName("Formulas")
    class Formulas {

        @Test
        @DisplayName("TC-BIND-001: integer addition has an integer codomain")
        void testIntegerAddition() {
            logStep("Bind /{1+1}");
            QueryBinding binding = bind("/{1+1}");

            List<Profile> fields = fields(binding);
            assertThat(fields).hasSize(1);
            assertThat(fields.get(0).domain()).isInstanceOf(IntegerDomain.class);
            assertThat(formula(firstElement(binding)).signature().kind()).isEqualTo(SignatureKind.ADD);
        }

        @Test
        @DisplayName("TC-BIND-002: addition of untyped strings is concatenation")
        void testConcatenation() {
            QueryBinding binding = bind("/{'a'+'b'}");

            assertThat(fields(binding).get(0).domain()).isInstanceOf(TextDomain.class);
            assertThat(formula(firstElement(binding)).signature().kind()).isEqualTo(SignatureKind.CONCATENATE);
        }

        @Test
        @DisplayName("TC-BIND-003: count wraps the counted condition in an aggregate")
        void testCount() {
            QueryBinding binding = bind("/{count(school)}");

            FormulaBinding aggregate = formula(firstElement(binding));
            assertThat(aggregate.signature().kind()).isEqualTo(SignatureKind.AGGREGATE);
            assertThat(aggregate.domain()).isInstanceOf(IntegerDomain.class);
            Binding op = aggregate.arguments().get("op");
            assertThat(op).isInstanceOf(FormulaBinding.class);
            assertThat(((FormulaBinding) op).signature().kind()).isEqualTo(SignatureKind.COUNT);
        }

        @Test
        @DisplayName("TC-BIND-004: comparisons produce Boolean values")
        void testComparison() {
            QueryBinding binding = bind("/{1<2}");

            assertThat(fields(binding).get(0).domain()).isInstanceOf(BooleanDomain.class);
        }
    }

    @Nested
    @DisplayName("Output profiles")
    class Profiles {

        @Test
        @DisplayName("TC-BIND-005: a table expands to its columns")
        void testTableExpansion() {
            QueryBinding binding = bind("/school");

            assertThat(fields(binding)).extracting(Profile::tag).containsExactly("code", "name", "campus");
        }

        @Test
        @DisplayName("TC-BIND-006: selector columns keep their names")
        void testSelectorHeaders() {
            QueryBinding binding = bind("/department{name, school.name}");

            List<Profile> fields = fields(binding);
            assertThat(fields).hasSize(2);
            assertThat(fields.get(0).header()).isEqualTo("name");
            assertThat(fields).allSatisfy(field -> assertThat(field.domain()).isInstanceOf(TextDomain.class));
        }

        @Test
        @DisplayName("TC-BIND-007: format command is recorded")
        void testFormat() {
            assertThat(bind("/school").format()).isEqualTo("default");
            assertThat(bind("/school/:json").format()).isEqualTo("json");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("TC-BIND-008: unknown identifier is marked exactly")
        void testUnknownIdentifier() {
            BindError error = catchThrowableOfType(() -> bind("/{nosuchcolumn}"), BindError.class);

            assertThat(error).isNotNull();
            assertThat(error.detail()).startsWith("unrecognized attribute 'nosuchcolumn'");
            assertThat(error.mark().start()).isEqualTo(2);
            assertThat(error.mark().end()).isEqualTo(14);
            assertThat(error.mark().text()).isEqualTo("nosuchcolumn");
        }

        @Test
        @DisplayName("TC-BIND-009: unknown column names its scope")
        void testUnknownColumnInScope() {
            assertThatThrownBy(() -> bind("/school{nosuch}"))
                .isInstanceOf(BindError.class)
                .hasMessage("unrecognized attribute 'nosuch' in scope of 'school'");
        }

        @Test
        @DisplayName("TC-BIND-010: misspelled table gets a hint")
        void testMisspelledTable() {
            BindError error = catchThrowableOfType(() -> bind("/schol"), BindError.class);

            assertThat(error).isNotNull();
            assertThat(error.hint()).isEqualTo("did you mean: 'school'");
        }

        @Test
        @DisplayName("TC-BIND-011: incompatible operand types name both domains")
        void testIncompatibleTypes() {
            BindError error = catchThrowableOfType(() -> bind("/{1 + 'text'}"), BindError.class);

            assertThat(error).isNotNull();
            assertThat(error.detail())
                .isEqualTo("operator '+' cannot be applied to values of types ('integer', 'untyped')");
            assertThat(error.mark().text()).isEqualTo("1 + 'text'");
        }

        @Test
        @DisplayName("TC-BIND-012: unknown format command")
        void testUnknownCommand() {
            assertThatThrownBy(() -> bind("/school/:pdf"))
                .isInstanceOf(BindError.class)
                .hasMessage("unrecognized command 'pdf'");
        }

        @Test
        @DisplayName("TC-BIND-013: wrong number of function arguments")
        void testArity() {
            assertThatThrownBy(() -> bind("/{round(1, 2, 3)}"))
                .isInstanceOf(BindError.class)
                .hasMessageStartingWith("function 'round'");
        }

        @Test
        @DisplayName("TC-BIND-014: wildcard outside a selector of a table")
        void testWildcardIndexOutOfRange() {
            assertThatThrownBy(() -> bind("/school{*9}"))
                .isInstanceOf(BindError.class)
                .hasMessage("value in range 1-3 is required");
        }
    }
}
