package org.pragmatica.dice.value;

import java.util.List;
import java.util.Random;

/**
 * Source of uniformly distributed choices used for every die draw.
 * Substitute a deterministic implementation to make rolls reproducible.
 */
public interface RandomSource {
    /**
     * A uniform integer between {@code low} and {@code high}, both inclusive.
     */
    long uniformInt(long low, long high);

    /**
     * One of the given options, picked uniformly.
     */
    <T> T choice(List<T> options);

    /**
     * Randomness backed by a freshly seeded {@link Random}.
     */
    static RandomSource system() {
        return new JdkRandomSource(new Random());
    }

    /**
     * Reproducible randomness from a fixed seed.
     */
    static RandomSource seeded(long seed) {
        return new JdkRandomSource(new Random(seed));
    }
}
