package org.pragmatica.dice;

import org.junit.jupiter.api.Test;
import org.pragmatica.dice.error.DiceException;
import org.pragmatica.dice.value.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiceTest {

    @Test
    void basic_withoutDice() {
        assertThat(Dice.basic("2+3*4")).isEqualTo(Scalar.of(14));
        assertThat(Dice.basic("7/2")).isEqualTo(Scalar.of(3.5));
        assertThat(Dice.basic("3!", 1)).isEqualTo(Scalar.of(7));
    }

    @Test
    void basic_rollStaysInRange() {
        for (int i = 0; i < 200; i++) {
            var total = Dice.basic("2d6").asLong();

            assertThat(total).isBetween(2L, 12L);
        }
    }

    @Test
    void basic_maxMode_isDeterministic() {
        assertThat(Dice.basic("4d6", Mode.MAX)).isEqualTo(Scalar.of(24));
        assertThat(Dice.basic("4d6", Mode.fromString("Maximum"), 2)).isEqualTo(Scalar.of(26));
    }

    @Test
    void verbose_withoutDice() {
        assertThat(Dice.verbose("1+2*4")).isEqualTo("1+2*4 = 9");
        assertThat(Dice.verbose("2d6", Mode.MAX)).isEqualTo("[d6: 6, 6] = 12");
    }

    @Test
    void compile_andRollAgain() {
        var tree = Dice.compile("1d1+1");

        assertThat(Dice.basic(tree)).isEqualTo(Scalar.of(2));
        assertThat(Dice.basic(tree, Mode.CRIT)).isEqualTo(Scalar.of(3));
    }

    @Test
    void tokenize_returnsTokens() {
        assertThat(Dice.tokenize("1d20")).hasSize(3);
        assertThat(Dice.tokenize("1d20", 5)).hasSize(7);
    }

    @Test
    void failures_shareOneBaseType() {
        assertThatThrownBy(() -> Dice.basic("1d")).isInstanceOf(DiceException.class);
        assertThatThrownBy(() -> Dice.basic("(0-1)d6")).isInstanceOf(DiceException.class);
        assertThatThrownBy(() -> Dice.basic(new Object())).isInstanceOf(DiceException.class);
    }
}
