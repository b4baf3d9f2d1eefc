package org.pragmatica.dice.operator;

import org.pragmatica.dice.DiceConfig;
import org.pragmatica.dice.value.Die;
import org.pragmatica.dice.value.RandomSource;
import org.pragmatica.dice.value.Roll;
import org.pragmatica.dice.value.Scalar;
import org.pragmatica.dice.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Implementations of the dice operators: producing rolls and post-processing them.
 * None of the functions modify their input roll; each returns a fresh one.
 */
public final class RollFunctions {
    private static final BiPredicate<Scalar, Scalar> EQUAL = Scalar::sameAs;
    private static final BiPredicate<Scalar, Scalar> HIGHER = (value, target) -> value.compareTo(target) > 0;
    private static final BiPredicate<Scalar, Scalar> LOWER = (value, target) -> value.compareTo(target) < 0;

    private RollFunctions() {}

    /**
     * Roll {@code number} dice of the given kind.
     */
    public static Roll rollBasic(Value number, Value sides, DiceConfig config) {
        var die = Die.of(sides);
        var count = diceCount(number, config);
        var values = new ArrayList<Scalar>(count);
        for (int i = 0; i < count; i++) {
            values.add(die.draw(config.random()));
        }
        return new Roll(values, die);
    }

    /**
     * Roll twice the requested number of dice, as for a critical hit.
     */
    public static Roll rollCritical(Value number, Value sides, DiceConfig config) {
        var die = Die.of(sides);
        var count = diceCount(number, config);
        var doubled = Math.multiplyExact(count, 2);
        var values = new ArrayList<Scalar>(doubled);
        for (int i = 0; i < doubled; i++) {
            values.add(die.draw(config.random()));
        }
        return new Roll(values, die);
    }

    /**
     * Every die shows its highest face.
     */
    public static Roll rollMax(Value number, Value sides, DiceConfig config) {
        var die = Die.of(sides);
        return new Roll(Collections.nCopies(diceCount(number, config), die.maximum()), die);
    }

    /**
     * Every die shows its average face, which on most dice is a half.
     */
    public static Roll rollAverage(Value number, Value sides, DiceConfig config) {
        var die = Die.of(sides);
        return new Roll(Collections.nCopies(diceCount(number, config), die.average()), die);
    }

    /**
     * Keep the highest {@code number} values; the rest are discarded.
     */
    public static Roll takeHigh(Value roll, Value number) {
        var result = roll(roll).copy();
        var keep = keepCount(number, result);
        result.discard(0, result.size() - keep);
        return result;
    }

    /**
     * Keep the lowest {@code number} values; the rest are discarded.
     */
    public static Roll takeLow(Value roll, Value number) {
        var result = roll(roll).copy();
        var keep = keepCount(number, result);
        result.discard(keep, result.size());
        return result;
    }

    /**
     * Raise every value below {@code bottom} to {@code bottom}.
     */
    public static Roll floor(Value roll, Value bottom) {
        var limit = Arithmetic.scalar(bottom);
        return clamp(roll(roll), value -> value.compareTo(limit) < 0, limit);
    }

    /**
     * Lower every value above {@code top} to {@code top}.
     */
    public static Roll ceil(Value roll, Value top) {
        var limit = Arithmetic.scalar(top);
        return clamp(roll(roll), value -> value.compareTo(limit) > 0, limit);
    }

    private static Roll clamp(Roll original, Predicate<Scalar> outside, Scalar limit) {
        var result = original.copy();
        try (var unsorted = result.suspendSorting()) {
            for (int i = 0; i < result.size(); i++) {
                if (outside.test(result.get(i))) {
                    result.replace(i, limit);
                }
            }
        }
        return result;
    }

    /**
     * Count values at or above the threshold: each becomes 1 or 0 and every original value is discarded.
     */
    public static Roll thresholdLower(Value roll, Value threshold) {
        var source = roll(roll);
        var target = Arithmetic.integer(threshold, "threshold");
        return source.transformed(source.rolls()
                                        .stream()
                                        .map(value -> Scalar.bool(value.asDouble() >= target))
                                        .toList());
    }

    /**
     * Count values at or below the threshold: each becomes 1 or 0 and every original value is discarded.
     */
    public static Roll thresholdUpper(Value roll, Value threshold) {
        var source = roll(roll);
        var target = Arithmetic.integer(threshold, "threshold");
        return source.transformed(source.rolls()
                                        .stream()
                                        .map(value -> Scalar.bool(value.asDouble() <= target))
                                        .toList());
    }

    public static Roll rerollOnceOn(Value roll, Value target, DiceConfig config) {
        return rerollOnce(roll(roll), Arithmetic.scalar(target), EQUAL, config.random());
    }

    public static Roll rerollOnceHigher(Value roll, Value target, DiceConfig config) {
        return rerollOnce(roll(roll), Arithmetic.scalar(target), HIGHER, config.random());
    }

    public static Roll rerollOnceLower(Value roll, Value target, DiceConfig config) {
        return rerollOnce(roll(roll), Arithmetic.scalar(target), LOWER, config.random());
    }

    /**
     * Reroll values equal to the target until they no longer are.
     *
     * @throws IllegalArgumentException when the die can only ever draw the target
     */
    public static Roll rerollUnconditionalOn(Value roll, Value target, DiceConfig config) {
        var original = roll(roll);
        var value = Arithmetic.scalar(target);
        var die = original.die();
        if (original.size() > 0 && die.drawMinimum().sameAs(value) && die.drawMaximum().sameAs(value)) {
            throw infiniteLoop(die, "always be", value);
        }
        return rerollUnconditional(original, value, EQUAL, config.random());
    }

    /**
     * Reroll values above the target until they are not.
     *
     * @throws IllegalArgumentException when the target is below the lowest possible draw
     */
    public static Roll rerollUnconditionalHigher(Value roll, Value target, DiceConfig config) {
        var original = roll(roll);
        var value = Arithmetic.scalar(target);
        if (value.compareTo(original.die().drawMinimum()) < 0) {
            throw infiniteLoop(original.die(), "never be less than", value);
        }
        return rerollUnconditional(original, value, HIGHER, config.random());
    }

    /**
     * Reroll values below the target until they are not.
     *
     * @throws IllegalArgumentException when the target is above the highest possible draw
     */
    public static Roll rerollUnconditionalLower(Value roll, Value target, DiceConfig config) {
        var original = roll(roll);
        var value = Arithmetic.scalar(target);
        if (value.compareTo(original.die().drawMaximum()) > 0) {
            throw infiniteLoop(original.die(), "never be greater than", value);
        }
        return rerollUnconditional(original, value, LOWER, config.random());
    }

    private static Roll rerollOnce(Roll original, Scalar target, BiPredicate<Scalar, Scalar> matches, RandomSource random) {
        var result = original.copy();
        try (var unsorted = result.suspendSorting()) {
            for (int i = 0; i < result.size(); i++) {
                if (matches.test(result.get(i), target)) {
                    result.replace(i, result.die().draw(random));
                }
            }
        }
        return result;
    }

    private static Roll rerollUnconditional(Roll original, Scalar target, BiPredicate<Scalar, Scalar> matches, RandomSource random) {
        var result = original.copy();
        try (var unsorted = result.suspendSorting()) {
            for (int i = 0; i < result.size(); i++) {
                while (matches.test(result.get(i), target)) {
                    result.replace(i, result.die().draw(random));
                }
            }
        }
        return result;
    }

    private static IllegalArgumentException infiniteLoop(Die die, String relation, Scalar target) {
        return new IllegalArgumentException("A die with sides " + die + " can " + relation + " " + target
                                            + ". This would create an infinite loop.");
    }

    private static int diceCount(Value number, DiceConfig config) {
        var count = Arithmetic.integer(number, "the number of dice");
        if (count < 0) {
            throw new IllegalArgumentException("Cannot roll a negative number of dice: " + count + ".");
        }
        if (count > config.maxDice()) {
            throw new IllegalArgumentException("Cannot roll " + count + " dice at once, the limit is "
                                               + config.maxDice() + ".");
        }
        return (int) count;
    }

    private static int keepCount(Value number, Roll roll) {
        var count = Arithmetic.integer(number, "the number of dice to keep");
        return (int) Math.max(0, Math.min(count, roll.size()));
    }

    private static Roll roll(Value value) {
        if (value instanceof Roll roll) {
            return roll;
        }
        throw new IllegalArgumentException("Expecting a roll of dice, got " + value + " instead.");
    }
}
