package org.pragmatica.dice.operator;

import org.pragmatica.dice.DiceConfig;
import org.pragmatica.dice.value.Value;

import java.util.Optional;

/**
 * An operator such as {@code +} or {@code d}.
 *
 * @param code          key in the operator table; unary signs use {@code m} and {@code p}
 * @param precedence    higher binds tighter
 * @param function      the operation itself
 * @param arity         which operand slot(s) the operator consumes
 * @param associativity tie-breaker between operators of equal precedence
 * @param cajole        which operand(s) are collapsed to their total before the function runs
 * @param display       printed form when it differs from the code
 */
public record Operator(
 String code,
 int precedence,
 OperatorFunction function,
 Side arity,
 Side associativity,
 Side cajole,
 Optional<String> display) {

    public static Operator binary(String code, int precedence, OperatorFunction function) {
        return new Operator(code, precedence, function, Side.BOTH, Side.LEFT, Side.BOTH, Optional.empty());
    }

    public Operator withAssociativity(Side associativity) {
        return new Operator(code, precedence, function, arity, associativity, cajole, display);
    }

    public Operator withArity(Side arity) {
        return new Operator(code, precedence, function, arity, associativity, cajole, display);
    }

    public Operator withCajole(Side cajole) {
        return new Operator(code, precedence, function, arity, associativity, cajole, display);
    }

    public Operator displayedAs(String text) {
        return new Operator(code, precedence, function, arity, associativity, cajole, Optional.of(text));
    }

    /**
     * Apply this operator. Cajoled operands are replaced by their totals; operands outside the arity are dropped.
     *
     * @throws IllegalArgumentException when an operand required by the arity is missing
     */
    public Value apply(Value left, Value right, DiceConfig config) {
        if (arity.hasLeft() && left == null) {
            throw new IllegalArgumentException("Operator " + symbol() + " is missing its left operand.");
        }
        if (arity.hasRight() && right == null) {
            throw new IllegalArgumentException("Operator " + symbol() + " is missing its right operand.");
        }
        var actualLeft = arity.hasLeft() ? cajoled(left, cajole.hasLeft()) : null;
        var actualRight = arity.hasRight() ? cajoled(right, cajole.hasRight()) : null;
        return function.apply(actualLeft, actualRight, config);
    }

    private static Value cajoled(Value operand, boolean collapse) {
        return collapse ? operand.total() : operand;
    }

    /**
     * Whether this operator, sitting on the stack, must be applied before {@code incoming} is pushed.
     */
    public boolean reducesBefore(Operator incoming) {
        return precedence > incoming.precedence
               || (precedence == incoming.precedence && associativity == Side.LEFT);
    }

    public boolean isPrefix() {
        return arity == Side.RIGHT;
    }

    public boolean isPostfix() {
        return arity == Side.LEFT;
    }

    public String symbol() {
        return display.orElse(code);
    }

    /**
     * Operators are identified by their code alone.
     */
    @Override
    public boolean equals(Object other) {
        return other instanceof Operator operator && code.equals(operator.code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        return symbol();
    }
}
