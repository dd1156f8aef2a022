package com.sievesql.functions;

import com.sievesql.binding.Binder;
import com.sievesql.exception.BindError;
import com.sievesql.parser.QueryParser;
import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import com.sievesql.test.UniversityCatalog;
import com.sievesql.types.DecimalDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.TextDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("CorrelationTable Tests")
public class CorrelationTableTest extends TestBase {

    private static final Domain INT = new IntegerDomain();
    private static final Domain DEC = new DecimalDomain();

    private static BindError bindError(FunctionRegistry registry, String query) {
        Binder binder = new Binder(UniversityCatalog.catalog(), registry);
        return catchThrowableOfType(() -> binder.bind(QueryParser.parse(query)), BindError.class);
    }

    @Test
    @DisplayName("TC-CORR-001: overload matches on the exact domain classes")
    void testMatches() {
        Correlation correlation = new Correlation(SignatureKind.ADD, List.of(List.of(INT, INT)),
                null, List.of(INT, INT), INT);

        assertThat(correlation.matches(SignatureKind.ADD, List.of(INT, INT))).isTrue();
        assertThat(correlation.matches(SignatureKind.ADD, List.of(INT, DEC))).isFalse();
        assertThat(correlation.matches(SignatureKind.SUBTRACT, List.of(INT, INT))).isFalse();
        assertThat(correlation.arity()).isEqualTo(2);
    }

    @Test
    @DisplayName("TC-CORR-002: domain vectors must have the same length")
    void testVectorLength() {
        assertThatThrownBy(() -> new Correlation(SignatureKind.ADD, List.of(List.of(INT), List.of(INT, INT)),
                null, List.of(INT), INT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("domain vectors must have equal length");
    }

    @Test
    @DisplayName("TC-CORR-003: no overload lists the valid types")
    void testNoOverload() {
        BindError error = bindError(FunctionRegistry.builtins(), "/{true+1}");

        assertThat(error).isNotNull();
        assertThat(error.detail())
            .isEqualTo("operator '+' cannot be applied to values of types ('boolean', 'integer')");
        assertThat(error.hint()).startsWith("valid types: ").contains("('integer', 'integer')");
    }

    @Test
    @DisplayName("TC-CORR-004: ambiguous overloads list the matching types")
    void testAmbiguous() {
        CorrelationTable table = new CorrelationTable()
            .add(new Correlation(SignatureKind.ADD, List.of(List.of(INT, INT)), null, List.of(INT, INT), INT))
            .add(new Correlation(SignatureKind.ADD, List.of(List.of(INT, INT)), null, List.of(DEC, DEC), DEC));
        FunctionRegistry registry = new FunctionRegistry(table)
            .register("+", new PolyFunctionBinder(Signature.of(SignatureKind.ADD), table));

        BindError error = bindError(registry, "/{1+2}");

        assertThat(error).isNotNull();
        assertThat(error.detail()).isEqualTo("operator '+' is ambiguous for ('integer', 'integer')");
        assertThat(error.hint())
            .isEqualTo("matching types: ('integer', 'integer'), ('decimal', 'decimal')");
    }

    @Test
    @DisplayName("TC-CORR-005: text addition concatenates")
    void testConcatenate() {
        Correlation concatenate = CorrelationTable.builtins().correlations().stream()
            .filter(correlation -> correlation.target() == SignatureKind.CONCATENATE)
            .findFirst()
            .orElseThrow();

        assertThat(concatenate.codomain()).isEqualTo(new TextDomain());
    }
}
