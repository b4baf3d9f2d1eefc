package org.pragmatica.dice.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.dice.tree.EvalTree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ParseExceptionTest {

    @Test
    void message_rendersSourceWithCaret() {
        var error = new ParseException("Unexpected value.", 2, "2 3");

        assertThat(error.getMessage()).isEqualTo("Unexpected value.\n    2 3\n      ^");
        assertThat(error.reason()).isEqualTo("Unexpected value.");
        assertThat(error.offset()).isEqualTo(2);
        assertThat(error.source()).isEqualTo("2 3");
    }

    @Test
    void diagnostic_matchesException() {
        var error = new ParseException("Invalid operator.", 1, "2z3");

        var diagnostic = error.diagnostic();

        assertThat(diagnostic.format()).isEqualTo(error.getMessage());
        assertThat(diagnostic.notes()).isEmpty();
        assertThat(error.help()).isEmpty();
    }

    @Test
    void unbalancedParentheses_carryHelp() {
        var unclosed = catchThrowableOfType(() -> EvalTree.parse("(1)+(2"), ParseException.class);
        var unopened = catchThrowableOfType(() -> EvalTree.parse("1+4)"), ParseException.class);

        assertThat(unclosed.getMessage()).isEqualTo("Unclosed parenthesis detected.\n    (1)+(2\n        ^");
        assertThat(unclosed.diagnostic().formatRich("attack")).isEqualTo("""
            error: Unclosed parenthesis detected.
              --> attack:1:5
              |
            1 | (1)+(2
              |     ^
              |
              = help: add a matching ')'
            """);
        assertThat(unopened.help()).contains("remove it or add a matching '(' before it");
    }

    @Test
    void parseFailure_isADiceException() {
        var error = catchThrowableOfType(() -> EvalTree.parse("(1d4"), ParseException.class);

        assertThat(error).isInstanceOf(DiceException.class);
        assertThat(error.reason()).isEqualTo("Unclosed parenthesis detected.");
        assertThat(error.offset()).isZero();
    }
}
