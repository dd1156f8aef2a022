package com.sievesql.generator;

import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SqlQuoting Tests")
public class SqlQuotingTest extends TestBase {

    @Test
    @DisplayName("TC-QUOTE-001: names are double-quoted")
    void testQuoteName() {
        assertThat(SqlQuoting.quoteName("school")).isEqualTo("\"school\"");
        assertThat(SqlQuoting.quoteName("a\"b")).isEqualTo("\"a\"\"b\"");
    }

    @Test
    @DisplayName("TC-QUOTE-002: literals are single-quoted")
    void testQuoteLiteral() {
        assertThat(SqlQuoting.quoteLiteral("O'Reilly")).isEqualTo("'O''Reilly'");
        assertThat(SqlQuoting.quoteLiteral("")).isEqualTo("''");
    }

    @Test
    @DisplayName("TC-QUOTE-003: empty names and NUL characters are rejected")
    void testRejected() {
        assertThatThrownBy(() -> SqlQuoting.quoteName(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Identifier cannot be null or empty");
        assertThatThrownBy(() -> SqlQuoting.quoteLiteral("a\0"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("NUL character is not allowed in SQL text");
        assertThatThrownBy(() -> SqlQuoting.quoteLiteral(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
