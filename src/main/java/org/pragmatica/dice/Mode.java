package org.pragmatica.dice;

import org.pragmatica.dice.tree.EvalTree;

import java.util.Locale;

/**
 * How the dice in an expression are rolled. Higher modes win over lower ones: MAX over CRIT over AVERAGE.
 */
public enum Mode {
    /**
     * Dice are rolled normally.
     */
    NORMAL,
    /**
     * Every die shows its average, usually a half on even-sided dice.
     */
    AVERAGE,
    /**
     * Twice as many dice are rolled, as for the damage of a critical hit.
     */
    CRIT,
    /**
     * Every die shows its highest face.
     */
    MAX;

    /**
     * Mode named {@code average}, {@code critical} or {@code maximum}, ignoring case; anything else is NORMAL.
     */
    public static Mode fromString(String name) {
        if (name == null) {
            return NORMAL;
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "average" -> AVERAGE;
            case "critical" -> CRIT;
            case "maximum" -> MAX;
            default -> NORMAL;
        };
    }

    /**
     * Rewrite the dice of {@code tree} for this mode, in place.
     */
    public EvalTree applyTo(EvalTree tree) {
        return switch (this) {
            case NORMAL -> tree;
            case AVERAGE -> tree.averageify();
            case CRIT -> tree.critify();
            case MAX -> tree.maxify();
        };
    }
}
