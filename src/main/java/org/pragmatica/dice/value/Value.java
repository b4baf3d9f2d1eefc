package org.pragmatica.dice.value;

/**
 * Anything an expression node can hold once evaluated: a plain number, an explicit list of die faces,
 * or a set of rolled dice.
 */
public sealed interface Value permits Scalar, Faces, Roll {
    /**
     * Collapse this value into a single number. Compound values contribute the sum of their active members.
     */
    Scalar total();
}
