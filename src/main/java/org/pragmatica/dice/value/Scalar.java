package org.pragmatica.dice.value;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * A single number. Integral and real numbers are kept apart so that integer-only operations
 * (keep counts, factorial, die sizes) can reject fractional input.
 */
public sealed interface Scalar extends Value, Comparable<Scalar> {
    Scalar ZERO = new Int(0);
    Scalar ONE = new Int(1);

    static Scalar of(long value) {
        return new Int(value);
    }

    static Scalar of(double value) {
        return new Real(value);
    }

    static Scalar bool(boolean value) {
        return value ? ONE : ZERO;
    }

    /**
     * Sum of the given numbers; integral as long as every member is integral.
     */
    static Scalar sum(Collection<Scalar> values) {
        long exact = 0;
        double real = 0;
        boolean integral = true;
        for (var value : values) {
            if (integral && value instanceof Int integer) {
                exact = Math.addExact(exact, integer.value());
            } else {
                if (integral) {
                    real = exact;
                    integral = false;
                }
                real += value.asDouble();
            }
        }
        return integral ? of(exact) : of(real);
    }

    double asDouble();

    boolean isIntegral();

    /**
     * The value as an integer.
     *
     * @throws IllegalArgumentException if this number is not integral
     */
    long asLong();

    default boolean isTruthy() {
        return asDouble() != 0;
    }

    /**
     * Numeric equality, so that {@code 4} and {@code 4.0} match.
     */
    default boolean sameAs(Scalar other) {
        return compareTo(other) == 0;
    }

    @Override
    default Scalar total() {
        return this;
    }

    @Override
    default int compareTo(Scalar other) {
        if (this instanceof Int left && other instanceof Int right) {
            return Long.compare(left.value(), right.value());
        }
        return Double.compare(asDouble(), other.asDouble());
    }

    record Int(long value) implements Scalar {
        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean isIntegral() {
            return true;
        }

        @Override
        public long asLong() {
            return value;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Real(double value) implements Scalar {
        private static final double PLAIN_LOWER = 1e-4;
        private static final double PLAIN_UPPER = 1e16;

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean isIntegral() {
            return false;
        }

        @Override
        public long asLong() {
            throw new IllegalArgumentException("Expecting an integer, got " + this + " instead.");
        }

        @Override
        public String toString() {
            var magnitude = Math.abs(value);
            if (Double.isFinite(value) && (magnitude == 0 || (magnitude >= PLAIN_LOWER && magnitude < PLAIN_UPPER))) {
                var plain = BigDecimal.valueOf(value).toPlainString();
                return plain.indexOf('.') < 0 ? plain + ".0" : plain;
            }
            return Double.toString(value);
        }
    }
}
