package org.pragmatica.dice.tree;

import org.pragmatica.dice.operator.Operator;
import org.pragmatica.dice.operator.Operators;
import org.pragmatica.dice.operator.Side;

/**
 * Renders an evaluated tree back to infix text with the rolled values in place of the dice.
 *
 * <p>Dice and roll post-processing nodes are opaque: they print their value, never their parts. Parentheses
 * appear only where the tree shape would otherwise be lost.
 */
final class VerboseRenderer {
    private VerboseRenderer() {}

    static String render(EvalTreeNode root) {
        var sb = new StringBuilder();
        render(root, null, Side.NEITHER, sb);
        return sb.toString();
    }

    private static void render(EvalTreeNode node, EvalTreeNode parent, Side side, StringBuilder sb) {
        if (node.isLeaf() || node.precedence() >= Operators.OPAQUE_PRECEDENCE) {
            sb.append(node.value()
                          .orElseThrow(() -> new IllegalStateException("Node " + node + " has not been evaluated.")));
            return;
        }
        var operator = node.operator()
                           .orElseThrow();
        boolean parens = parent != null && needsParentheses(parent.operator()
                                                                  .orElseThrow(),
                                                            operator,
                                                            side);
        if (parens) {
            sb.append('(');
        }
        node.left()
            .ifPresent(left -> render(left, node, Side.LEFT, sb));
        sb.append(operator.symbol());
        node.right()
            .ifPresent(right -> render(right, node, Side.RIGHT, sb));
        if (parens) {
            sb.append(')');
        }
    }

    private static boolean needsParentheses(Operator parent, Operator child, Side side) {
        if (child.precedence() < parent.precedence()) {
            return true;
        }
        if (child.precedence() > parent.precedence()) {
            return false;
        }
        if (parent.arity() != Side.BOTH || child.arity() != Side.BOTH) {
            return false;
        }
        return side == Side.RIGHT
               ? parent.associativity() == Side.LEFT
               : parent.associativity() == Side.RIGHT;
    }
}
