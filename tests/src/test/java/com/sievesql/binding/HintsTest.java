package com.sievesql.binding;

import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Hints Tests")
public class HintsTest extends TestBase {

    @ParameterizedTest(name = "{0} ~ {1} = {2}")
    @CsvSource({
        "school, schol, true",
        "school, shcool, true",
        "school, schools, true",
        "department, departmnet, true",
        "department, dept, false",
        "code, name, false",
        "a, ab, true",
        "ab, ba, true",
    })
    @DisplayName("TC-HINT-001: misspellings are similar")
    void testIsSimilar(String model, String sample, boolean expected) {
        assertThat(Hints.isSimilar(model, sample)).isEqualTo(expected);
    }

    @Test
    @DisplayName("TC-HINT-002: empty names are never similar")
    void testEmpty() {
        assertThat(Hints.isSimilar("", "x")).isFalse();
        assertThat(Hints.isSimilar("x", "")).isFalse();
    }

    @Test
    @DisplayName("TC-HINT-003: choices are joined with 'or'")
    void testChoices() {
        assertThat(Hints.choices(List.of())).isNull();
        assertThat(Hints.choices(List.of("school"))).isEqualTo("did you mean: 'school'");
        assertThat(Hints.choices(List.of("a", "b", "c"))).isEqualTo("did you mean: 'a', 'b' or 'c'");
    }
}
