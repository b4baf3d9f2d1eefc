package org.pragmatica.dice.value;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RollTest {
    private static final Die D6 = Die.sided(6);

    @Test
    void constructor_unsortedValues_areSorted() {
        var roll = Roll.of(D6, 5, 1, 3);

        assertThat(roll.rolls()).containsExactly(Scalar.of(1), Scalar.of(3), Scalar.of(5));
    }

    @Test
    void set_keepsRollsSorted() {
        var roll = Roll.of(D6, 1, 3, 5);

        roll.set(0, Scalar.of(6));

        assertThat(roll.rolls()).containsExactly(Scalar.of(3), Scalar.of(5), Scalar.of(6));
    }

    @Test
    void discard_range_movesValuesToDiscards() {
        var roll = Roll.of(D6, 1, 2, 3, 4);

        roll.discard(0, 2);

        assertThat(roll.rolls()).containsExactly(Scalar.of(3), Scalar.of(4));
        assertThat(roll.discards()).containsExactly(Scalar.of(1), Scalar.of(2));
        assertThat(roll.total()).isEqualTo(Scalar.of(7));
    }

    @Test
    void replace_single_discardsOldValue() {
        var roll = Roll.of(D6, 2, 4);

        roll.replace(0, Scalar.of(6));

        assertThat(roll.rolls()).containsExactly(Scalar.of(4), Scalar.of(6));
        assertThat(roll.discards()).containsExactly(Scalar.of(2));
    }

    @Test
    void replace_rangeOfDifferentLength_isRejected() {
        var roll = Roll.of(D6, 2, 4, 6);

        assertThatThrownBy(() -> roll.replace(0, 2, List.of(Scalar.ONE)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("You have to replace a range with the same number of items.");
    }

    @Test
    void suspendSorting_keepsPositionsUntilClosed() {
        var roll = Roll.of(D6, 1, 2, 3);

        try (var unsorted = roll.suspendSorting()) {
            roll.replace(0, Scalar.of(6));
            assertThat(roll.get(0)).isEqualTo(Scalar.of(6));
        }

        assertThat(roll.rolls()).containsExactly(Scalar.of(2), Scalar.of(3), Scalar.of(6));
    }

    @Test
    void copy_isIndependent() {
        var roll = Roll.of(D6, 1, 2, 3);
        var copy = roll.copy();

        copy.discard(0);

        assertThat(roll.rolls()).hasSize(3);
        assertThat(roll.discards()).isEmpty();
        assertThat(copy.rolls()).hasSize(2);
    }

    @Test
    void contains_matchesNumerically() {
        var roll = new Roll(List.of(Scalar.of(20.0)), Die.sided(20));

        assertThat(roll.contains(Scalar.of(20))).isTrue();
        assertThat(roll.contains(Scalar.ONE)).isFalse();
    }

    @Test
    void total_emptyRoll_isZero() {
        assertThat(new Roll(List.of(), D6).total()).isEqualTo(Scalar.ZERO);
    }

    @Test
    void toString_showsDieValuesAndDiscards() {
        var roll = Roll.of(Die.sided(20), 1, 20);

        assertThat(roll).hasToString("[d20: 1, 20]");

        roll.discard(0);

        assertThat(roll).hasToString("[d20: 20; (1)]");
    }

    @Test
    void toString_listedDie_showsFaces() {
        var roll = new Roll(List.of(Scalar.of(4.0)), Die.of(Faces.of(1, 4)));

        assertThat(roll).hasToString("[d(1.0, 4.0): 4.0]");
    }
}
