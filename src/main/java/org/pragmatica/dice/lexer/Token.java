package org.pragmatica.dice.lexer;

import org.pragmatica.dice.operator.Operator;
import org.pragmatica.dice.value.Faces;
import org.pragmatica.dice.value.Scalar;

/**
 * Token types for dice expressions.
 */
public sealed interface Token {
    /**
     * Zero-based character offset of the token in its source.
     */
    int offset();

    /**
     * Printed form of the token.
     */
    String text();

    // Values
    record Literal(Scalar value, int offset) implements Token {
        @Override
        public String text() {
            return value.toString();
        }
    }

    // [1, 3, 5] or F
    record SideList(Faces faces, int offset) implements Token {
        @Override
        public String text() {
            return faces.toString();
        }
    }

    record Op(Operator operator, int offset) implements Token {
        @Override
        public String text() {
            return operator.symbol();
        }
    }

    // Delimiters
    record OpenParen(int offset) implements Token {
        @Override
        public String text() {
            return "(";
        }
    }

    record CloseParen(int offset) implements Token {
        @Override
        public String text() {
            return ")";
        }
    }

    static Literal literal(long value, int offset) {
        return new Literal(Scalar.of(value), offset);
    }

    static Op op(Operator operator, int offset) {
        return new Op(operator, offset);
    }
}
