package org.pragmatica.dice;

import org.pragmatica.dice.value.RandomSource;

import java.util.Objects;

/**
 * Evaluation settings: where die draws come from and how many dice a single roll may ask for.
 */
public record DiceConfig(
 RandomSource random,
 int maxDice) {
    public static final int DEFAULT_MAX_DICE = 10_000;

    public static final DiceConfig DEFAULT = new DiceConfig(RandomSource.system(), DEFAULT_MAX_DICE);

    public DiceConfig {
        Objects.requireNonNull(random, "random");
        if (maxDice < 0) {
            throw new IllegalArgumentException("maxDice must not be negative, got " + maxDice);
        }
    }
}
