package org.pragmatica.dice.error;

/**
 * The expression parsed but could not be evaluated, for instance a negative factorial or a reroll that could
 * never finish. The operator-level failure is available as the cause.
 */
public final class EvaluationException extends DiceException {
    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
