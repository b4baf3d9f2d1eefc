package org.pragmatica.dice.value;

import java.util.List;
import java.util.Random;

final class JdkRandomSource implements RandomSource {
    private final Random random;

    JdkRandomSource(Random random) {
        this.random = random;
    }

    @Override
    public long uniformInt(long low, long high) {
        if (high < low) {
            throw new IllegalArgumentException("Empty range [" + low + ", " + high + "]");
        }
        if (high == Long.MAX_VALUE) {
            return random.nextLong(low - 1, high) + 1;
        }
        return random.nextLong(low, high + 1);
    }

    @Override
    public <T> T choice(List<T> options) {
        if (options.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty list");
        }
        return options.get(random.nextInt(options.size()));
    }
}
