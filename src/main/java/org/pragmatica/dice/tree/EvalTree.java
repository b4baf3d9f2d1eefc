package org.pragmatica.dice.tree;

import org.pragmatica.dice.DiceConfig;
import org.pragmatica.dice.error.EvaluationException;
import org.pragmatica.dice.error.ParseException;
import org.pragmatica.dice.lexer.Token;
import org.pragmatica.dice.lexer.Tokenizer;
import org.pragmatica.dice.operator.Operator;
import org.pragmatica.dice.operator.Operators;
import org.pragmatica.dice.value.Die;
import org.pragmatica.dice.value.Roll;
import org.pragmatica.dice.value.Scalar;
import org.pragmatica.dice.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * An expression tree for a dice expression.
 *
 * <p>Leaves hold concrete values and interior nodes hold operators. After {@link #evaluate()} every node carries
 * the value computed for its subtree, which is what {@link #verboseResult()}, {@link #isCritical()} and
 * {@link #isFail()} inspect. Each evaluation rolls the dice again.
 *
 * <p>The mode rewrites ({@link #critify()}, {@link #averageify()}, {@link #maxify()}) change dice operators in
 * place and return this tree. Maximum wins over critical, and critical wins over average, whatever the order
 * they are applied in.
 *
 * <p>Trees are not thread-safe.
 */
public final class EvalTree {
    private static final Die.Sided D20 = new Die.Sided(20);
    private static final Scalar NATURAL_20 = Scalar.of(20);
    private static final Scalar NATURAL_1 = Scalar.ONE;

    private static final Set<Operator> CRITIFIED = Set.of(Operators.ROLL, Operators.ROLL_AVERAGE);
    private static final Set<Operator> AVERAGED = Set.of(Operators.ROLL);
    private static final Set<Operator> MAXIMIZED = Set.of(Operators.ROLL, Operators.ROLL_AVERAGE, Operators.ROLL_CRITICAL);

    private EvalTreeNode root;

    private EvalTree(EvalTreeNode root) {
        this.root = root;
    }

    /**
     * Parse an expression such as {@code 2d20h1+5}.
     *
     * @throws ParseException when the expression is malformed
     */
    public static EvalTree parse(String expression) {
        return new EvalTree(TreeBuilder.build(Tokenizer.tokenize(expression), expression));
    }

    /**
     * Build from a token list, for instance one returned by {@link Tokenizer#tokenize(String)}.
     *
     * @throws ParseException when the tokens do not form an expression
     */
    public static EvalTree fromTokens(List<Token> tokens) {
        return new EvalTree(TreeBuilder.build(tokens));
    }

    /**
     * A tree holding a single value.
     */
    public static EvalTree of(Value value) {
        return new EvalTree(EvalTreeNode.leaf(value));
    }

    /**
     * A tree with no root, which evaluates to zero.
     */
    public static EvalTree empty() {
        return new EvalTree(null);
    }

    public Optional<EvalTreeNode> root() {
        return Optional.ofNullable(root);
    }

    public boolean isEmpty() {
        return root == null;
    }

    public Scalar evaluate() {
        return evaluate(DiceConfig.DEFAULT);
    }

    /**
     * Evaluate the tree. A roll at the root is reduced to its total.
     *
     * @throws EvaluationException when any operator fails
     */
    public Scalar evaluate(DiceConfig config) {
        if (root == null) {
            return Scalar.ZERO;
        }
        try {
            return root.evaluate(config)
                       .total();
        } catch (RuntimeException e) {
            throw new EvaluationException("Failed to evaluate expression.", e);
        }
    }

    public String verboseResult() {
        return verboseResult(DiceConfig.DEFAULT);
    }

    /**
     * The expression with every roll shown, followed by {@code " = "} and the result, e.g.
     * {@code 1+[d20: 1, 1, 20, 20] = 43}. The tree is evaluated first if it has not been yet.
     *
     * @throws EvaluationException when evaluation is needed and fails
     */
    public String verboseResult(DiceConfig config) {
        if (root == null) {
            return "";
        }
        if (root.value()
                .isEmpty()) {
            evaluate(config);
        }
        var total = root.value()
                        .orElseThrow()
                        .total();
        return VerboseRenderer.render(root) + " = " + total;
    }

    /**
     * Turn normal and average rolls into critical rolls.
     */
    public EvalTree critify() {
        return rewriteDice(CRITIFIED, Operators.ROLL_CRITICAL);
    }

    /**
     * Turn normal rolls into average rolls.
     */
    public EvalTree averageify() {
        return rewriteDice(AVERAGED, Operators.ROLL_AVERAGE);
    }

    /**
     * Turn every roll into a maximum roll.
     */
    public EvalTree maxify() {
        return rewriteDice(MAXIMIZED, Operators.ROLL_MAX);
    }

    private EvalTree rewriteDice(Set<Operator> from, Operator to) {
        for (var node : preOrder()) {
            if (node.operator()
                    .filter(from::contains)
                    .isPresent()) {
                node.replaceOperator(to);
            }
        }
        return this;
    }

    /**
     * Deep copy; evaluating either tree leaves the other untouched.
     */
    public EvalTree copy() {
        return new EvalTree(root == null ? null : root.copy());
    }

    /**
     * {@code (this) + (other)} built from copies of both trees.
     */
    public EvalTree plus(EvalTree other) {
        return copy().combineInPlace(Operators.PLUS, other.copy());
    }

    /**
     * {@code (this) - (other)} built from copies of both trees.
     */
    public EvalTree minus(EvalTree other) {
        return copy().combineInPlace(Operators.MINUS, other.copy());
    }

    /**
     * Make this tree {@code (this) + (other)} without copying. {@code other} becomes part of this tree and must
     * not be used afterwards.
     */
    public EvalTree plusInPlace(EvalTree other) {
        return combineInPlace(Operators.PLUS, other);
    }

    /**
     * Make this tree {@code (this) - (other)} without copying. {@code other} becomes part of this tree and must
     * not be used afterwards.
     */
    public EvalTree minusInPlace(EvalTree other) {
        return combineInPlace(Operators.MINUS, other);
    }

    private EvalTree combineInPlace(Operator operator, EvalTree other) {
        if (other == this) {
            throw new IllegalArgumentException("Cannot combine a tree with itself in place, use a copy.");
        }
        root = EvalTreeNode.operator(operator, orZero(root), orZero(other.root));
        other.root = null;
        return this;
    }

    private static EvalTreeNode orZero(EvalTreeNode node) {
        return node == null ? EvalTreeNode.leaf(Scalar.ZERO) : node;
    }

    public List<EvalTreeNode> preOrder() {
        return preOrder(node -> false);
    }

    /**
     * Nodes in pre-order. The children of a node matching {@code abort} are skipped; the node itself is not.
     */
    public List<EvalTreeNode> preOrder(Predicate<EvalTreeNode> abort) {
        var nodes = new ArrayList<EvalTreeNode>();
        if (root != null) {
            preOrder(root, abort, nodes);
        }
        return nodes;
    }

    private static void preOrder(EvalTreeNode node, Predicate<EvalTreeNode> abort, List<EvalTreeNode> nodes) {
        nodes.add(node);
        if (abort.test(node)) {
            return;
        }
        node.left()
            .ifPresent(left -> preOrder(left, abort, nodes));
        node.right()
            .ifPresent(right -> preOrder(right, abort, nodes));
    }

    public List<EvalTreeNode> inOrder() {
        return inOrder(node -> false);
    }

    /**
     * Nodes in in-order. The children of a node matching {@code abort} are skipped; the node itself is not.
     */
    public List<EvalTreeNode> inOrder(Predicate<EvalTreeNode> abort) {
        var nodes = new ArrayList<EvalTreeNode>();
        if (root != null) {
            inOrder(root, abort, nodes);
        }
        return nodes;
    }

    private static void inOrder(EvalTreeNode node, Predicate<EvalTreeNode> abort, List<EvalTreeNode> nodes) {
        if (abort.test(node)) {
            nodes.add(node);
            return;
        }
        node.left()
            .ifPresent(left -> inOrder(left, abort, nodes));
        nodes.add(node);
        node.right()
            .ifPresent(right -> inOrder(right, abort, nodes));
    }

    /**
     * Whether the last evaluation rolled a natural 20 on some d20.
     */
    public boolean isCritical() {
        return anyD20Showing(NATURAL_20);
    }

    /**
     * Whether the last evaluation rolled a natural 1 on some d20.
     */
    public boolean isFail() {
        return anyD20Showing(NATURAL_1);
    }

    // The outermost d20 roll on each path decides; rolls feeding into it are not looked at.
    private boolean anyD20Showing(Scalar face) {
        return preOrder(EvalTree::holdsD20Roll).stream()
                                               .filter(EvalTree::holdsD20Roll)
                                               .anyMatch(node -> ((Roll) node.value()
                                                                             .orElseThrow()).contains(face));
    }

    private static boolean holdsD20Roll(EvalTreeNode node) {
        return node.value()
                   .filter(value -> value instanceof Roll roll && roll.die()
                                                                      .equals(D20))
                   .isPresent();
    }
}
