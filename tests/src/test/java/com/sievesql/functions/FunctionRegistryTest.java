package com.sievesql.functions;

import com.sievesql.binding.AttributeKey;
import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import com.sievesql.types.DateDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.TextDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FunctionRegistry Tests")
public class FunctionRegistryTest extends TestBase {

    private final FunctionRegistry registry = FunctionRegistry.builtins();

    @Test
    @DisplayName("TC-FUNC-001: exact arity wins over the catch-all entry")
    void testExactArity() {
        assertThat(registry.find("round", 1).signature().kind()).isEqualTo(SignatureKind.ROUND);
        assertThat(registry.find("round", 2).signature().kind()).isEqualTo(SignatureKind.ROUND_TO);
        assertThat(registry.find("datetime", 2).signature().kind()).isEqualTo(SignatureKind.COMBINE_DATETIME);
        assertThat(registry.find("datetime", 5).signature().kind()).isEqualTo(SignatureKind.MAKE_DATETIME);
    }

    @Test
    @DisplayName("TC-FUNC-002: casts share one binder per domain")
    void testCasts() {
        assertThat(registry.find("int", 1)).isInstanceOf(CastBinder.class);
        assertThat(((CastBinder) registry.find("integer", 1)).domain()).isEqualTo(new IntegerDomain());
        assertThat(registry.find("str", 1)).isSameAs(registry.find("string", 1));
        assertThat(((CastBinder) registry.find("date", 1)).domain()).isEqualTo(new DateDomain());
        assertThat(registry.find("date", 3).signature().kind()).isEqualTo(SignatureKind.MAKE_DATE);
    }

    @Test
    @DisplayName("TC-FUNC-003: bare identifiers only find nullary constants")
    void testBareIdentifiers() {
        assertThat(registry.find("true", null)).isNotNull();
        assertThat(registry.find("null", null)).isNotNull();
        assertThat(registry.find("count", null)).isNull();
        assertThat(registry.find("nosuch", 1)).isNull();
    }

    @Test
    @DisplayName("TC-FUNC-004: lookup ignores case")
    void testCaseInsensitive() {
        assertThat(registry.find("COUNT", 1)).isSameAs(registry.find("count", 1));
    }

    @Test
    @DisplayName("TC-FUNC-005: operators and formats are registered")
    void testOperatorsAndFormats() {
        for (String symbol : List.of("+", "-", "*", "/", "=", "!=", "==", "~", "&", "|", "!_", "_-")) {
            assertThat(registry.find(symbol, 2)).as(symbol).isNotNull();
        }
        for (String format : FunctionRegistry.FORMATS) {
            assertThat(registry.names()).contains(new AttributeKey(format, FunctionRegistry.ANY_ARITY));
        }
    }

    @Test
    @DisplayName("TC-FUNC-006: later registration replaces the earlier one")
    void testOverride() {
        FunctionRegistry custom = FunctionRegistry.builtins();
        int size = custom.size();
        CastBinder binder = new CastBinder(new TextDomain());

        custom.register("Upper", binder);

        assertThat(custom.find("upper", 1)).isSameAs(binder);
        assertThat(custom.size()).isEqualTo(size);
    }
}
