package org.pragmatica.dice.error;

/**
 * Base of every failure raised by this library; catch it to handle all of them at once.
 */
public abstract sealed class DiceException extends RuntimeException
 permits ParseException, EvaluationException, InputTypeException {

    protected DiceException(String message) {
        super(message);
    }

    protected DiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
