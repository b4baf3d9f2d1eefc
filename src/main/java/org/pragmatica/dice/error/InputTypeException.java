package org.pragmatica.dice.error;

/**
 * An entry point received something other than an expression string, a number or a compiled tree.
 */
public final class InputTypeException extends DiceException {
    public InputTypeException(String message) {
        super(message);
    }
}
