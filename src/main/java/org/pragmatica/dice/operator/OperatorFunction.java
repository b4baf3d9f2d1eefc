package org.pragmatica.dice.operator;

import org.pragmatica.dice.DiceConfig;
import org.pragmatica.dice.value.Value;

import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * The computation behind an operator. Slots the operator does not consume are passed as {@code null}.
 */
@FunctionalInterface
public interface OperatorFunction {
    Value apply(Value left, Value right, DiceConfig config);

    static OperatorFunction binary(BiFunction<Value, Value, Value> function) {
        return (left, right, config) -> function.apply(left, right);
    }

    static OperatorFunction prefix(UnaryOperator<Value> function) {
        return (left, right, config) -> function.apply(right);
    }

    static OperatorFunction postfix(UnaryOperator<Value> function) {
        return (left, right, config) -> function.apply(left);
    }
}
