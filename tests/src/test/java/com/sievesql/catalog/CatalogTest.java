package com.sievesql.catalog;

import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import com.sievesql.test.UniversityCatalog;
import com.sievesql.types.EnumDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.OpaqueDomain;
import com.sievesql.types.TextDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CatalogBuilder}, {@link CatalogLoader} and attribute
 * naming.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Catalog Tests")
public class CatalogTest extends TestBase {

    private static List<String> names(List<Label> labels) {
        return labels.stream().map(Label::name).toList();
    }

    private static Table table(Catalog catalog, String name) {
        return catalog.tables().stream()
            .filter(table -> table.name().equals(name))
            .findFirst()
            .orElseThrow();
    }

    @Nested
    @DisplayName("Attribute naming")
    class Naming {

        @Test
        @DisplayName("TC-CAT-001: home scope names every table")
        void testHomeLabels() {
            Catalog catalog = UniversityCatalog.catalog();

            assertThat(names(catalog.homeLabels()))
                .containsExactly("school", "department", "program", "course");
        }

        @Test
        @DisplayName("TC-CAT-002: columns, direct links and reverse links")
        void testTableLabels() {
            Catalog catalog = UniversityCatalog.catalog();

            assertThat(names(catalog.labels(table(catalog, "department"))))
                .containsExactly("code", "name", "school_code", "school", "course",
                    "course_via_department", "course_via_department_code");
            assertThat(names(catalog.labels(table(catalog, "school"))))
                .containsExactly("code", "name", "campus", "department", "program",
                    "department_via_school", "department_via_school_code",
                    "program_via_school", "program_via_school_code");
        }

        @Test
        @DisplayName("TC-CAT-011: a link named already leaves its other names ambiguous")
        void testSecondaryNamesAmbiguous() {
            Catalog catalog = UniversityCatalog.catalog();

            List<Label> labels = catalog.labels(table(catalog, "department"));
            assertThat(labels)
                .filteredOn(label -> label.arc() instanceof AmbiguousArc)
                .extracting(Label::name)
                .containsExactly("course_via_department", "course_via_department_code");
            assertThat(labels)
                .filteredOn(label -> label.arc() instanceof AmbiguousArc)
                .allSatisfy(label -> assertThat(label.isPublic()).isFalse());
        }

        @Test
        @DisplayName("TC-CAT-003: only columns are public")
        void testPublicLabels() {
            Catalog catalog = UniversityCatalog.catalog();

            List<String> visible = catalog.labels(table(catalog, "school")).stream()
                .filter(Label::isPublic)
                .map(Label::name)
                .toList();
            assertThat(visible).containsExactly("code", "name", "campus");
        }

        @Test
        @DisplayName("TC-CAT-004: identity goes through the parent link")
        void testIdentity() {
            Catalog catalog = UniversityCatalog.catalog();

            List<Arc> identity = catalog.identity(table(catalog, "course"));
            assertThat(identity).hasSize(2);
            assertThat(identity.get(0)).isInstanceOf(ChainArc.class);
            assertThat(identity.get(1)).isInstanceOf(ColumnArc.class);
            assertThat(catalog.identityDomain(table(catalog, "course")).labels()).hasSize(2);
        }

        @Test
        @DisplayName("TC-CAT-005: names are normalized")
        void testNormalize() {
            assertThat(Catalog.normalize("Course Title")).isEqualTo("course_title");
            assertThat(Catalog.normalize("2nd")).isEqualTo("_2nd");
        }

        @Test
        @DisplayName("TC-CAT-006: clashing names become ambiguous")
        void testAmbiguousName() {
            CatalogBuilder builder = new CatalogBuilder();
            builder.table("person")
                .column("id", new IntegerDomain(), false)
                .primaryKey("id");
            builder.table("message")
                .column("id", new IntegerDomain(), false)
                .column("sender_id", new IntegerDomain(), false)
                .column("receiver_id", new IntegerDomain(), false)
                .primaryKey("id")
                .foreignKey("sender_id", "person", "id")
                .foreignKey("receiver_id", "person", "id");
            Catalog catalog = builder.build();

            List<Label> labels = catalog.labels(table(catalog, "message"));
            assertThat(names(labels)).contains("sender", "receiver", "person");
            Label person = labels.stream().filter(label -> label.name().equals("person")).findFirst().orElseThrow();
            assertThat(person.arc()).isInstanceOf(AmbiguousArc.class);
        }
    }

    @Nested
    @DisplayName("Builder")
    class Builder {

        @Test
        @DisplayName("TC-CAT-007: duplicate table is rejected")
        void testDuplicateTable() {
            CatalogBuilder builder = new CatalogBuilder();
            builder.table("school");

            assertThatThrownBy(() -> builder.table("school"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate table 'school'");
        }

        @Test
        @DisplayName("TC-CAT-008: foreign key to an unknown table is rejected")
        void testUnknownTarget() {
            CatalogBuilder builder = new CatalogBuilder();
            builder.table("department")
                .column("school_code", new TextDomain())
                .foreignKey("school_code", "school", "code");

            assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown table 'school'");
        }
    }

    @Nested
    @DisplayName("Loader")
    class Loader {

        @Test
        @DisplayName("TC-CAT-009: JSON description with parameterized types")
        void testLoadJson() throws IOException {
            Catalog catalog;
            try (InputStream input = getClass().getResourceAsStream("/university.json")) {
                assertThat(input).isNotNull();
                catalog = CatalogLoader.read(input);
            }

            assertThat(names(catalog.homeLabels())).containsExactly("school", "department", "course");
            Table school = table(catalog, "school");
            assertThat(school.column("campus").domain()).isInstanceOf(EnumDomain.class);
            assertThat(((EnumDomain) school.column("campus").domain()).labels()).containsExactly("old", "north", "south");
            assertThat(school.column("name").isNullable()).isFalse();
            Table course = table(catalog, "course");
            assertThat(course.column("extra").domain()).isInstanceOf(OpaqueDomain.class);
            assertThat(course.primaryKey().originColumns()).extracting(Column::name)
                .containsExactly("department_code", "no");
        }

        @Test
        @DisplayName("TC-CAT-010: malformed descriptions are rejected")
        void testMalformed() {
            assertThatThrownBy(() -> CatalogLoader.parse("{}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'schemas'");
            assertThatThrownBy(() -> CatalogLoader.parse("{\"schemas\": [{\"tables\": [{\"columns\": []}]}]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Missing required field 'name'");
            assertThatThrownBy(() -> CatalogLoader.parse("{not json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to parse catalog description");
        }
    }
}
