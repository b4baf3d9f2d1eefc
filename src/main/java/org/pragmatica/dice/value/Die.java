package org.pragmatica.dice.value;

import java.util.Collections;
import java.util.List;

/**
 * What a single die looks like: a number of sides, an explicit list of faces,
 * or a previous roll whose total serves as the side count (as in {@code 2d(1d4)}).
 */
public sealed interface Die {

    static Die sided(long sides) {
        return new Sided(sides);
    }

    /**
     * Interpret an evaluated operand as a die specification.
     */
    static Die of(Value sides) {
        if (sides instanceof Scalar.Int count) {
            return new Sided(count.value());
        }
        if (sides instanceof Faces faces) {
            return new Listed(faces);
        }
        if (sides instanceof Roll roll) {
            return new Nested(roll.copy());
        }
        throw new IllegalArgumentException("You can't roll a die with sides: " + sides);
    }

    Scalar draw(RandomSource random);

    Scalar maximum();

    Scalar minimum();

    Scalar average();

    /**
     * Lowest value {@link #draw(RandomSource)} can return.
     */
    Scalar drawMinimum();

    /**
     * Highest value {@link #draw(RandomSource)} can return.
     */
    Scalar drawMaximum();

    record Sided(long sides) implements Die {
        public Sided {
            if (sides < 1) {
                throw new IllegalArgumentException("A die must have at least one side, got " + sides + ".");
            }
        }

        @Override
        public Scalar draw(RandomSource random) {
            return Scalar.of(random.uniformInt(1, sides));
        }

        @Override
        public Scalar maximum() {
            return Scalar.of(sides);
        }

        @Override
        public Scalar minimum() {
            return Scalar.ONE;
        }

        @Override
        public Scalar average() {
            return Scalar.of((sides + 1) / 2.0);
        }

        @Override
        public Scalar drawMinimum() {
            return minimum();
        }

        @Override
        public Scalar drawMaximum() {
            return maximum();
        }

        @Override
        public String toString() {
            return Long.toString(sides);
        }
    }

    record Listed(Faces faces) implements Die {
        @Override
        public Scalar draw(RandomSource random) {
            return random.choice(faces.values());
        }

        @Override
        public Scalar maximum() {
            return Collections.max(faces.values());
        }

        @Override
        public Scalar minimum() {
            return Collections.min(faces.values());
        }

        @Override
        public Scalar average() {
            return Scalar.of(faces.total().asDouble() / faces.values().size());
        }

        @Override
        public Scalar drawMinimum() {
            return minimum();
        }

        @Override
        public Scalar drawMaximum() {
            return maximum();
        }

        @Override
        public String toString() {
            return faces.toString();
        }
    }

    /**
     * A die shaped by an earlier roll. Draws are uniform over {@code [1, total]};
     * the extremes and average come from the values that were actually rolled.
     */
    record Nested(Roll roll) implements Die {
        @Override
        public Scalar draw(RandomSource random) {
            return Scalar.of(random.uniformInt(1, sides()));
        }

        @Override
        public Scalar drawMinimum() {
            return Scalar.ONE;
        }

        @Override
        public Scalar drawMaximum() {
            return Scalar.of(sides());
        }

        private long sides() {
            var sides = roll.total().asLong();
            if (sides < 1) {
                throw new IllegalArgumentException("A die must have at least one side, got " + sides + ".");
            }
            return sides;
        }

        @Override
        public Scalar maximum() {
            return Collections.max(nonEmpty());
        }

        @Override
        public Scalar minimum() {
            return Collections.min(nonEmpty());
        }

        @Override
        public Scalar average() {
            return Scalar.of(roll.total().asDouble() / nonEmpty().size());
        }

        private List<Scalar> nonEmpty() {
            if (roll.size() == 0) {
                throw new IllegalArgumentException("A die made from an empty roll has no faces.");
            }
            return roll.rolls();
        }

        @Override
        public String toString() {
            return roll.toString();
        }
    }
}
