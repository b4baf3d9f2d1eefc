package org.pragmatica.dice.value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A set of rolled dice.
 *
 * <p>Tracks the active values (those that count towards the total), the die that produced them, and every
 * value that was dropped along the way by keep, reroll, clamp or threshold operations.
 *
 * <p>Active values are kept sorted ascending after every change. Operations that walk the values by position
 * while replacing them suspend the sorting for the duration of the walk:
 * <pre>{@code
 * try (var unsorted = roll.suspendSorting()) {
 *     for (int i = 0; i < roll.size(); i++) {
 *         if (roll.get(i).compareTo(target) == 0) {
 *             roll.replace(i, roll.die().draw(random));
 *         }
 *     }
 * }
 * }</pre>
 */
public final class Roll implements Value {
    private final List<Scalar> rolls;
    private final List<Scalar> discards;
    private final Die die;
    private boolean sortingSuspended;

    public Roll(Collection<Scalar> rolls, Die die) {
        this(rolls, List.of(), die);
    }

    public Roll(Collection<Scalar> rolls, Collection<Scalar> discards, Die die) {
        this.rolls = new ArrayList<>(rolls);
        this.discards = new ArrayList<>(discards);
        this.die = Objects.requireNonNull(die, "die");
        Collections.sort(this.rolls);
    }

    /**
     * Convenience for building integral rolls by hand.
     */
    public static Roll of(Die die, long... values) {
        var list = new ArrayList<Scalar>(values.length);
        for (var value : values) {
            list.add(Scalar.of(value));
        }
        return new Roll(list, die);
    }

    public List<Scalar> rolls() {
        return Collections.unmodifiableList(rolls);
    }

    public List<Scalar> discards() {
        return Collections.unmodifiableList(discards);
    }

    public Die die() {
        return die;
    }

    public int size() {
        return rolls.size();
    }

    public Scalar get(int index) {
        return rolls.get(index);
    }

    public void set(int index, Scalar value) {
        rolls.set(index, value);
        sortIfEnabled();
    }

    /**
     * Whether an active value numerically equals the given one.
     */
    public boolean contains(Scalar value) {
        return rolls.stream().anyMatch(value::sameAs);
    }

    /**
     * Move the value at {@code index} to the discards.
     */
    public void discard(int index) {
        Objects.checkIndex(index, rolls.size());
        discards.add(rolls.remove(index));
    }

    /**
     * Move the values in {@code [from, to)} to the discards.
     */
    public void discard(int from, int to) {
        Objects.checkFromToIndex(from, to, rolls.size());
        var range = rolls.subList(from, to);
        discards.addAll(range);
        range.clear();
    }

    /**
     * Discard the value at {@code index} and put {@code value} in its place.
     */
    public void replace(int index, Scalar value) {
        Objects.checkIndex(index, rolls.size());
        discards.add(rolls.get(index));
        rolls.set(index, value);
        sortIfEnabled();
    }

    /**
     * Discard the values in {@code [from, to)} and put the same number of new values in their place.
     */
    public void replace(int from, int to, List<Scalar> values) {
        Objects.checkFromToIndex(from, to, rolls.size());
        if (to - from != values.size()) {
            throw new IllegalArgumentException("You have to replace a range with the same number of items.");
        }
        for (int i = from; i < to; i++) {
            discards.add(rolls.get(i));
            rolls.set(i, values.get(i - from));
        }
        sortIfEnabled();
    }

    void addDiscards(Collection<Scalar> values) {
        discards.addAll(values);
    }

    /**
     * Stop re-sorting on each change until the returned scope is closed, which sorts once.
     */
    public SortSuspension suspendSorting() {
        sortingSuspended = true;
        return new SortSuspension();
    }

    @Override
    public Scalar total() {
        return Scalar.sum(rolls);
    }

    /**
     * Independent copy; changes to either roll do not show in the other.
     */
    public Roll copy() {
        return new Roll(rolls, discards, die);
    }

    /**
     * A new roll from the same die with the given active values; every current value is kept as a discard.
     */
    public Roll transformed(List<Scalar> values) {
        var result = new Roll(values, discards, die);
        result.addDiscards(rolls);
        return result;
    }

    private void sortIfEnabled() {
        if (!sortingSuspended) {
            Collections.sort(rolls);
        }
    }

    @Override
    public String toString() {
        var active = rolls.stream()
                          .map(Scalar::toString)
                          .collect(Collectors.joining(", "));
        if (discards.isEmpty()) {
            return "[d" + die + ": " + active + "]";
        }
        var dropped = discards.stream()
                              .map(Scalar::toString)
                              .collect(Collectors.joining(", "));
        return "[d" + die + ": " + active + "; (" + dropped + ")]";
    }

    public final class SortSuspension implements AutoCloseable {
        private SortSuspension() {}

        @Override
        public void close() {
            sortingSuspended = false;
            Collections.sort(rolls);
        }
    }
}
