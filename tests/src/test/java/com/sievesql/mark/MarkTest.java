package com.sievesql.mark;

import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Mark Tests")
public class MarkTest extends TestBase {

    private static final String QUERY = "/school{name, code}";

    @Test
    @DisplayName("TC-MARK-001: union covers every mark")
    void testUnion() {
        Mark name = new Mark(QUERY, 8, 12);
        Mark code = new Mark(QUERY, 14, 18);

        Mark union = Mark.union(code, null, List.of(name, Mark.EMPTY));

        assertThat(union.start()).isEqualTo(8);
        assertThat(union.end()).isEqualTo(18);
        assertThat(union.text()).isEqualTo("name, code");
    }

    @Test
    @DisplayName("TC-MARK-002: union of nothing is empty")
    void testEmptyUnion() {
        assertThat(Mark.union()).isSameAs(Mark.EMPTY);
        assertThat(Mark.union(Mark.EMPTY, null)).isSameAs(Mark.EMPTY);
        assertThatThrownBy(() -> Mark.union("text"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("TC-MARK-003: excerpt underlines the marked line")
    void testExcerpt() {
        Mark mark = new Mark("/school\n?nosuch", 9, 15);

        assertThat(mark.excerpt()).containsExactly("?nosuch", " ^^^^^^");
        assertThat(Mark.EMPTY.excerpt()).isEmpty();
    }
}
