package org.pragmatica.dice;

import org.pragmatica.dice.lexer.Token;
import org.pragmatica.dice.tree.EvalTree;
import org.pragmatica.dice.value.RandomSource;
import org.pragmatica.dice.value.Scalar;

import java.util.List;

/**
 * Main entry point for rolling dice expressions.
 *
 * <p>The static methods use {@link DiceConfig#DEFAULT}:
 * <pre>{@code
 * Dice.basic("2d20h1+5");                  // 17
 * Dice.verbose("2d20h1+5");                // "[d20: 12; (3)]+5 = 17"
 * Dice.basic("1d8+3", Mode.CRIT);          // two d8 are rolled
 * var attack = Dice.compile("1d20", 4);    // parse once, roll often
 * }</pre>
 *
 * <p>For a different random source or dice limit, build a {@link Roller}:
 * <pre>{@code
 * var roller = Dice.builder()
 *                  .random(RandomSource.seeded(42))
 *                  .maxDice(500)
 *                  .build();
 * }</pre>
 */
public final class Dice {
    private static final Roller DEFAULT = new Roller(DiceConfig.DEFAULT);

    private Dice() {}

    public static Scalar basic(Object expression) {
        return DEFAULT.basic(expression);
    }

    public static Scalar basic(Object expression, long modifiers) {
        return DEFAULT.basic(expression, modifiers);
    }

    public static Scalar basic(Object expression, Mode mode) {
        return DEFAULT.basic(expression, mode);
    }

    public static Scalar basic(Object expression, Mode mode, long modifiers) {
        return DEFAULT.basic(expression, mode, modifiers);
    }

    public static String verbose(Object expression) {
        return DEFAULT.verbose(expression);
    }

    public static String verbose(Object expression, Mode mode) {
        return DEFAULT.verbose(expression, mode);
    }

    public static String verbose(Object expression, Mode mode, long modifiers) {
        return DEFAULT.verbose(expression, mode, modifiers);
    }

    public static EvalTree compile(Object expression) {
        return DEFAULT.compile(expression);
    }

    public static EvalTree compile(Object expression, long modifiers) {
        return DEFAULT.compile(expression, modifiers);
    }

    public static List<Token> tokenize(Object expression) {
        return DEFAULT.tokenize(expression);
    }

    public static List<Token> tokenize(Object expression, long modifiers) {
        return DEFAULT.tokenize(expression, modifiers);
    }

    /**
     * Create a builder for a roller with its own configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RandomSource random = DiceConfig.DEFAULT.random();
        private int maxDice = DiceConfig.DEFAULT_MAX_DICE;

        private Builder() {}

        public Builder random(RandomSource random) {
            this.random = random;
            return this;
        }

        public Builder seed(long seed) {
            this.random = RandomSource.seeded(seed);
            return this;
        }

        public Builder maxDice(int maxDice) {
            this.maxDice = maxDice;
            return this;
        }

        public Roller build() {
            return new Roller(new DiceConfig(random, maxDice));
        }
    }
}
