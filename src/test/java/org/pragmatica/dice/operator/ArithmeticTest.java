package org.pragmatica.dice.operator;

import org.junit.jupiter.api.Test;
import org.pragmatica.dice.value.Die;
import org.pragmatica.dice.value.Roll;
import org.pragmatica.dice.value.Scalar;

import static org.junit.jupiter.api.Assertions.*;

class ArithmeticTest {

    @Test
    void divide_integers_givesReal() {
        assertEquals(Scalar.of(3.5), Arithmetic.divide(Scalar.of(7), Scalar.of(2)));
        assertEquals(Scalar.of(2.0), Arithmetic.divide(Scalar.of(4), Scalar.of(2)));
    }

    @Test
    void divide_byZero_fails() {
        assertThrows(ArithmeticException.class, () -> Arithmetic.divide(Scalar.ONE, Scalar.ZERO));
    }

    @Test
    void modulo_takesSignOfDivisor() {
        assertEquals(Scalar.of(2), Arithmetic.modulo(Scalar.of(-1), Scalar.of(3)));
        assertEquals(Scalar.of(-2), Arithmetic.modulo(Scalar.of(1), Scalar.of(-3)));
        assertEquals(Scalar.of(0.5), Arithmetic.modulo(Scalar.of(2.5), Scalar.of(2)));
    }

    @Test
    void power_integers_staysExact() {
        assertEquals(Scalar.of(1024), Arithmetic.power(Scalar.of(2), Scalar.of(10)));
        assertEquals(Scalar.ONE, Arithmetic.power(Scalar.of(5), Scalar.ZERO));
    }

    @Test
    void power_negativeExponent_givesReal() {
        assertEquals(Scalar.of(0.5), Arithmetic.power(Scalar.of(2), Scalar.of(-1)));
    }

    @Test
    void power_overflow_fails() {
        assertThrows(ArithmeticException.class, () -> Arithmetic.power(Scalar.of(10), Scalar.of(30)));
    }

    @Test
    void power_zeroToNegative_fails() {
        assertThrows(ArithmeticException.class, () -> Arithmetic.power(Scalar.ZERO, Scalar.of(-2)));
    }

    @Test
    void factorial_computesProduct() {
        assertEquals(Scalar.of(120), Arithmetic.factorial(Scalar.of(5)));
        assertEquals(Scalar.ONE, Arithmetic.factorial(Scalar.ZERO));
    }

    @Test
    void factorial_negative_fails() {
        var error = assertThrows(IllegalArgumentException.class, () -> Arithmetic.factorial(Scalar.of(-4)));
        assertEquals("Factorial is undefined for negative numbers.", error.getMessage());
    }

    @Test
    void factorial_real_fails() {
        assertThrows(IllegalArgumentException.class, () -> Arithmetic.factorial(Scalar.of(2.5)));
    }

    @Test
    void comparisons_returnOneOrZero() {
        assertEquals(Scalar.ONE, Arithmetic.greaterOrEqual(Scalar.of(10), Scalar.of(5)));
        assertEquals(Scalar.ZERO, Arithmetic.less(Scalar.of(10), Scalar.of(5)));
        assertEquals(Scalar.ONE, Arithmetic.equal(Scalar.of(4), Scalar.of(4.0)));
        assertEquals(Scalar.ONE, Arithmetic.or(Scalar.ZERO, Scalar.of(3)));
        assertEquals(Scalar.ZERO, Arithmetic.and(Scalar.ZERO, Scalar.of(3)));
    }

    @Test
    void negate_minimum_overflows() {
        assertThrows(ArithmeticException.class, () -> Arithmetic.negate(Scalar.of(Long.MIN_VALUE)));
    }

    @Test
    void add_roll_isRejected() {
        var roll = Roll.of(Die.sided(6), 3);

        assertThrows(IllegalArgumentException.class, () -> Arithmetic.add(roll, Scalar.ONE));
    }
}
