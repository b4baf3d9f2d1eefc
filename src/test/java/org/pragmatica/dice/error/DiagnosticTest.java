package org.pragmatica.dice.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticTest {

    @Test
    void format_putsCaretUnderOffset() {
        var diagnostic = Diagnostic.error("Unopened parenthesis detected.", "1+4)", 3);

        assertThat(diagnostic.format()).isEqualTo("Unopened parenthesis detected.\n    1+4)\n       ^");
    }

    @Test
    void format_offsetAtEnd_caretAfterSource() {
        var diagnostic = Diagnostic.error("Unexpectedly terminated expression.", "1+", 2);

        assertThat(diagnostic.format()).endsWith("\n    1+\n      ^");
    }

    @Test
    void format_offsetOutOfRange_isClamped() {
        assertThat(Diagnostic.error("x", "12", 10).format()).endsWith("\n      ^");
        assertThat(Diagnostic.error("x", "12", -3).format()).endsWith("\n    ^");
    }

    @Test
    void formatRich_includesLocationAndNotes() {
        var diagnostic = Diagnostic.error("Unclosed parenthesis detected.", "(1d4", 0)
                                   .withHelp("add ')' to close the group");

        var rich = diagnostic.formatRich("attack");

        assertThat(rich).isEqualTo("""
            error: Unclosed parenthesis detected.
              --> attack:1:1
              |
            1 | (1d4
              | ^
              |
              = help: add ')' to close the group
            """);
    }

    @Test
    void formatRich_withoutNotes_endsAtGutter() {
        var rich = Diagnostic.error("Unexpected value.", "2 3", 2).formatRich("expression");

        assertThat(rich).startsWith("error: Unexpected value.\n  --> expression:1:3\n")
                        .endsWith("  |   ^\n  |\n");
    }

    @Test
    void withHelp_leavesOriginalUnchanged() {
        var original = Diagnostic.error("x", "1", 0);

        var helped = original.withHelp("first").withHelp("second");

        assertThat(original.notes()).isEmpty();
        assertThat(helped.notes()).containsExactly("help: first", "help: second");
    }
}
