package org.pragmatica.dice.operator;

import org.pragmatica.dice.value.Scalar;
import org.pragmatica.dice.value.Value;

/**
 * Number crunching for the arithmetic, comparison and boolean operators.
 * Integral operands give integral results wherever the operation allows it; overflow is reported, not wrapped.
 */
public final class Arithmetic {
    private Arithmetic() {}

    public static Scalar add(Value left, Value right) {
        var a = scalar(left);
        var b = scalar(right);
        if (bothIntegral(a, b)) {
            return Scalar.of(Math.addExact(a.asLong(), b.asLong()));
        }
        return Scalar.of(a.asDouble() + b.asDouble());
    }

    public static Scalar subtract(Value left, Value right) {
        var a = scalar(left);
        var b = scalar(right);
        if (bothIntegral(a, b)) {
            return Scalar.of(Math.subtractExact(a.asLong(), b.asLong()));
        }
        return Scalar.of(a.asDouble() - b.asDouble());
    }

    public static Scalar multiply(Value left, Value right) {
        var a = scalar(left);
        var b = scalar(right);
        if (bothIntegral(a, b)) {
            return Scalar.of(Math.multiplyExact(a.asLong(), b.asLong()));
        }
        return Scalar.of(a.asDouble() * b.asDouble());
    }

    /**
     * True division; the result is always real.
     */
    public static Scalar divide(Value left, Value right) {
        var a = scalar(left);
        var b = scalar(right);
        if (b.asDouble() == 0) {
            throw new ArithmeticException("Division by zero.");
        }
        return Scalar.of(a.asDouble() / b.asDouble());
    }

    /**
     * Floored modulo: the result takes the sign of the divisor.
     */
    public static Scalar modulo(Value left, Value right) {
        var a = scalar(left);
        var b = scalar(right);
        if (b.asDouble() == 0) {
            throw new ArithmeticException("Modulo by zero.");
        }
        if (bothIntegral(a, b)) {
            return Scalar.of(Math.floorMod(a.asLong(), b.asLong()));
        }
        var x = a.asDouble();
        var y = b.asDouble();
        return Scalar.of(x - Math.floor(x / y) * y);
    }

    public static Scalar power(Value left, Value right) {
        var base = scalar(left);
        var exponent = scalar(right);
        if (bothIntegral(base, exponent) && exponent.asLong() >= 0) {
            return Scalar.of(exactPower(base.asLong(), exponent.asLong()));
        }
        if (base.asDouble() == 0 && exponent.asDouble() < 0) {
            throw new ArithmeticException("Zero cannot be raised to a negative power.");
        }
        var result = Math.pow(base.asDouble(), exponent.asDouble());
        if (Double.isNaN(result)) {
            throw new ArithmeticException("The power " + base + "^" + exponent + " is not a real number.");
        }
        return Scalar.of(result);
    }

    private static long exactPower(long base, long exponent) {
        long result = 1;
        long factor = base;
        long remaining = exponent;
        while (remaining > 0) {
            if ((remaining & 1) == 1) {
                result = Math.multiplyExact(result, factor);
            }
            remaining >>= 1;
            if (remaining > 0) {
                factor = Math.multiplyExact(factor, factor);
            }
        }
        return result;
    }

    public static Scalar negate(Value operand) {
        var value = scalar(operand);
        if (value.isIntegral()) {
            return Scalar.of(Math.negateExact(value.asLong()));
        }
        return Scalar.of(-value.asDouble());
    }

    public static Scalar identity(Value operand) {
        return scalar(operand);
    }

    public static Scalar factorial(Value operand) {
        var value = integer(operand, "number");
        if (value < 0) {
            throw new IllegalArgumentException("Factorial is undefined for negative numbers.");
        }
        long result = 1;
        for (long i = 2; i <= value; i++) {
            result = Math.multiplyExact(result, i);
        }
        return Scalar.of(result);
    }

    public static Scalar greater(Value left, Value right) {
        return Scalar.bool(scalar(left).compareTo(scalar(right)) > 0);
    }

    public static Scalar greaterOrEqual(Value left, Value right) {
        return Scalar.bool(scalar(left).compareTo(scalar(right)) >= 0);
    }

    public static Scalar less(Value left, Value right) {
        return Scalar.bool(scalar(left).compareTo(scalar(right)) < 0);
    }

    public static Scalar lessOrEqual(Value left, Value right) {
        return Scalar.bool(scalar(left).compareTo(scalar(right)) <= 0);
    }

    public static Scalar equal(Value left, Value right) {
        return Scalar.bool(scalar(left).sameAs(scalar(right)));
    }

    public static Scalar or(Value left, Value right) {
        return Scalar.bool(scalar(left).isTruthy() || scalar(right).isTruthy());
    }

    public static Scalar and(Value left, Value right) {
        return Scalar.bool(scalar(left).isTruthy() && scalar(right).isTruthy());
    }

    static Scalar scalar(Value value) {
        if (value instanceof Scalar scalar) {
            return scalar;
        }
        throw new IllegalArgumentException("Expecting a number, got " + value + " instead.");
    }

    static long integer(Value value, String name) {
        if (value instanceof Scalar.Int integer) {
            return integer.value();
        }
        throw new IllegalArgumentException("Expecting " + name + " to be an integer, got " + value + " instead.");
    }

    private static boolean bothIntegral(Scalar a, Scalar b) {
        return a.isIntegral() && b.isIntegral();
    }
}
