package com.sievesql.exception;

import com.sievesql.mark.Mark;
import com.sievesql.test.TestBase;
import com.sievesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TranslateError Tests")
public class TranslateErrorTest extends TestBase {

    @Test
    @DisplayName("TC-ERR-001: user message points at the fragment")
    void testUserMessage() {
        BindError error = new BindError("unrecognized attribute 'x'", new Mark("/{1+x}", 4, 5),
                "did you mean: 'y'");

        assertThat(error.getUserMessage()).isEqualTo(
            "bind: unrecognized attribute 'x' (did you mean: 'y')\n"
            + "While translating:\n"
            + "    /{1+x}\n"
            + "        ^");
        assertThat(error.getMessage()).isEqualTo("unrecognized attribute 'x'");
    }

    @Test
    @DisplayName("TC-ERR-002: error without a mark has no excerpt")
    void testWithoutMark() {
        CompileError error = new CompileError("cannot compile", null);

        assertThat(error.mark()).isSameAs(Mark.EMPTY);
        assertThat(error.getUserMessage()).isEqualTo("compile: cannot compile");
    }

    @Test
    @DisplayName("TC-ERR-003: wrapped failure keeps its cause")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        EncodeError error = new EncodeError("unexpected failure: boom", Mark.EMPTY, cause);

        assertThat(error).hasCause(cause).isInstanceOf(TranslateError.class);
        assertThat(error.kind()).isEqualTo("encode");
        assertThat(error.hint()).isNull();
    }
}
