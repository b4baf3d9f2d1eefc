package org.pragmatica.dice.tree;

import org.pragmatica.dice.DiceConfig;
import org.pragmatica.dice.operator.Operator;
import org.pragmatica.dice.value.Roll;
import org.pragmatica.dice.value.Value;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Node of an expression tree.
 *
 * <p>A leaf holds a concrete value; an interior node holds an operator and the children its arity asks for.
 * The value computed by the latest evaluation is kept on every node so it can be inspected afterwards.
 */
public final class EvalTreeNode {
    private final Value literal;
    private Operator operator;
    private final EvalTreeNode left;
    private final EvalTreeNode right;
    private Value value;

    private EvalTreeNode(Value literal, Operator operator, EvalTreeNode left, EvalTreeNode right, Value value) {
        this.literal = literal;
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.value = value;
    }

    public static EvalTreeNode leaf(Value literal) {
        return new EvalTreeNode(Objects.requireNonNull(literal, "literal"), null, null, null, null);
    }

    /**
     * Interior node; {@code left} and {@code right} must match the operator's arity.
     *
     * @throws IllegalArgumentException when the children do not match the arity
     */
    public static EvalTreeNode operator(Operator operator, EvalTreeNode left, EvalTreeNode right) {
        var arity = operator.arity();
        if (arity.hasLeft() != (left != null) || arity.hasRight() != (right != null)) {
            throw new IllegalArgumentException("Operator " + operator.symbol() + " expects "
                                               + arity.name()
                                                      .toLowerCase(Locale.ROOT) + " operand(s).");
        }
        return new EvalTreeNode(null, operator, left, right, null);
    }

    /**
     * Evaluate this subtree, storing the value on every node along the way. Each call evaluates afresh, so
     * dice are rolled again.
     */
    public Value evaluate(DiceConfig config) {
        if (isLeaf()) {
            value = literal;
            return value;
        }
        var leftValue = left == null ? null : left.evaluate(config);
        var rightValue = right == null ? null : right.evaluate(config);
        value = operator.apply(leftValue, rightValue, config);
        return value;
    }

    public boolean isLeaf() {
        return operator == null;
    }

    public Optional<Operator> operator() {
        return Optional.ofNullable(operator);
    }

    public Optional<Value> literal() {
        return Optional.ofNullable(literal);
    }

    public Optional<EvalTreeNode> left() {
        return Optional.ofNullable(left);
    }

    public Optional<EvalTreeNode> right() {
        return Optional.ofNullable(right);
    }

    /**
     * Value from the latest evaluation, empty before the first one.
     */
    public Optional<Value> value() {
        return Optional.ofNullable(value);
    }

    /**
     * Precedence of the operator held, or {@link Integer#MAX_VALUE} for a leaf.
     */
    public int precedence() {
        return isLeaf() ? Integer.MAX_VALUE : operator.precedence();
    }

    void replaceOperator(Operator replacement) {
        if (isLeaf()) {
            throw new IllegalStateException("A leaf holds no operator.");
        }
        if (replacement.arity() != operator.arity()) {
            throw new IllegalArgumentException("Cannot replace " + operator.symbol() + " with " + replacement.symbol()
                                               + ", their arity differs.");
        }
        operator = replacement;
    }

    /**
     * Deep copy, including the values of the latest evaluation.
     */
    public EvalTreeNode copy() {
        return new EvalTreeNode(copyValue(literal),
                                operator,
                                left == null ? null : left.copy(),
                                right == null ? null : right.copy(),
                                copyValue(value));
    }

    private static Value copyValue(Value value) {
        return value instanceof Roll roll ? roll.copy() : value;
    }

    @Override
    public String toString() {
        return isLeaf() ? literal.toString() : operator.symbol();
    }
}
