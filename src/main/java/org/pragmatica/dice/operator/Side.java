package org.pragmatica.dice.operator;

/**
 * Which operand slot(s) an operator property applies to.
 */
public enum Side {
    NEITHER(0b00),
    RIGHT(0b01),
    LEFT(0b10),
    BOTH(0b11);

    private final int mask;

    Side(int mask) {
        this.mask = mask;
    }

    public boolean hasLeft() {
        return (mask & LEFT.mask) != 0;
    }

    public boolean hasRight() {
        return (mask & RIGHT.mask) != 0;
    }
}
