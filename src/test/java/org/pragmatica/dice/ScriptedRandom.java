package org.pragmatica.dice;

import org.pragmatica.dice.value.RandomSource;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Random source for tests: hands out the scripted draws in order, then the fallback forever.
 * Draws are returned as given, even when outside the requested range.
 * {@link #choice(List)} uses the next draw as an index into the options.
 */
public final class ScriptedRandom implements RandomSource {
    private final Deque<Long> draws = new ArrayDeque<>();
    private final long fallback;

    private ScriptedRandom(long fallback, long... draws) {
        this.fallback = fallback;
        for (var draw : draws) {
            this.draws.add(draw);
        }
    }

    public static ScriptedRandom always(long value) {
        return new ScriptedRandom(value);
    }

    public static ScriptedRandom of(long... draws) {
        return new ScriptedRandom(1, draws);
    }

    public static DiceConfig config(long... draws) {
        return new DiceConfig(of(draws), DiceConfig.DEFAULT_MAX_DICE);
    }

    public static DiceConfig fixed(long value) {
        return new DiceConfig(always(value), DiceConfig.DEFAULT_MAX_DICE);
    }

    @Override
    public long uniformInt(long low, long high) {
        return next();
    }

    @Override
    public <T> T choice(List<T> options) {
        return options.get((int) next());
    }

    public int remaining() {
        return draws.size();
    }

    private long next() {
        return draws.isEmpty() ? fallback : draws.poll();
    }
}
