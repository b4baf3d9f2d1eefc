package org.pragmatica.dice.operator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperatorsTest {

    @Test
    void table_hasExpectedPrecedenceLevels() {
        assertThat(Operators.get("!").precedence()).isEqualTo(8);
        assertThat(Operators.get("dc").precedence()).isEqualTo(7);
        assertThat(Operators.get("Rh").precedence()).isEqualTo(Operators.OPAQUE_PRECEDENCE);
        assertThat(Operators.get("^").precedence()).isEqualTo(5);
        assertThat(Operators.NEGATE.precedence()).isEqualTo(4);
        assertThat(Operators.get("%").precedence()).isEqualTo(3);
        assertThat(Operators.MINUS.precedence()).isEqualTo(2);
        assertThat(Operators.get("&").precedence()).isEqualTo(1);
    }

    @Test
    void table_codesAreUnique() {
        var codes = Operators.all()
                             .stream()
                             .map(Operator::code)
                             .toList();

        assertThat(codes).doesNotHaveDuplicates();
    }

    @Test
    void lookupWritten_excludesSignCodes() {
        assertThat(Operators.lookup("m")).contains(Operators.NEGATE);
        assertThat(Operators.lookupWritten("m")).isEmpty();
        assertThat(Operators.lookupWritten("-")).contains(Operators.MINUS);
    }

    @Test
    void isPrefix_recognizesStartsOfCodes() {
        assertThat(Operators.isPrefix("r")).isTrue();
        assertThat(Operators.isPrefix("g")).isTrue();
        assertThat(Operators.isPrefix("rhl")).isFalse();
        assertThat(Operators.isPrefix("m")).isFalse();
    }

    @Test
    void isDice_onlyRollingOperators() {
        assertThat(Operators.isDice(Operators.ROLL_MAX)).isTrue();
        assertThat(Operators.isDice(Operators.get("h"))).isFalse();
    }

    @Test
    void get_unknownCode_isRejected() {
        assertThatThrownBy(() -> Operators.get("x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown operator: x");
    }
}
