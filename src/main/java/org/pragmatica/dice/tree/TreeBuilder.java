package org.pragmatica.dice.tree;

import org.pragmatica.dice.error.ParseException;
import org.pragmatica.dice.lexer.Token;
import org.pragmatica.dice.operator.Operator;
import org.pragmatica.dice.value.Scalar;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds an expression tree from infix tokens with the shunting-yard algorithm.
 *
 * <p>Subtrees collect on an operand stack and operators wait on an operator stack until something binding
 * more loosely arrives. Prefix operators are pushed without reducing anything, since their operand has not
 * been seen yet; this is what makes {@code 2^-1} mean {@code 2^(-1)}.
 */
public final class TreeBuilder {
    private final List<Token> tokens;
    private final String source;
    private final int[] offsets;
    private final Deque<EvalTreeNode> operands = new ArrayDeque<>();
    private final Deque<Pending> operators = new ArrayDeque<>();
    private boolean expectOperand = true;

    /**
     * Operator stack entry; a null operator marks an open parenthesis.
     */
    private record Pending(Operator operator, int offset) {
        boolean isParen() {
            return operator == null;
        }
    }

    private TreeBuilder(List<Token> tokens, String source, int[] offsets) {
        this.tokens = tokens;
        this.source = source;
        this.offsets = offsets;
    }

    /**
     * Build from tokens produced by tokenizing {@code source}; errors point into {@code source}.
     *
     * @throws ParseException when the tokens do not form an expression
     */
    public static EvalTreeNode build(List<Token> tokens, String source) {
        var offsets = tokens.stream()
                            .mapToInt(Token::offset)
                            .toArray();
        return new TreeBuilder(tokens, source, offsets).buildAll();
    }

    /**
     * Build from a hand-made token list. Errors point into the tokens' texts joined by spaces.
     *
     * @throws ParseException when the tokens do not form an expression
     */
    public static EvalTreeNode build(List<Token> tokens) {
        var text = new StringBuilder();
        var offsets = new int[tokens.size()];
        for (int i = 0; i < tokens.size(); i++) {
            if (i > 0) {
                text.append(' ');
            }
            offsets[i] = text.length();
            text.append(tokens.get(i)
                              .text());
        }
        return new TreeBuilder(tokens, text.toString(), offsets).buildAll();
    }

    private EvalTreeNode buildAll() {
        if (tokens.isEmpty()) {
            return EvalTreeNode.leaf(Scalar.ZERO);
        }
        for (int i = 0; i < tokens.size(); i++) {
            accept(tokens.get(i), offsets[i]);
        }
        if (expectOperand) {
            throw error("Unexpectedly terminated expression.", source.length());
        }
        while (!operators.isEmpty()) {
            var top = operators.peek();
            if (top.isParen()) {
                throw error("Unclosed parenthesis detected.", top.offset());
            }
            reduce();
        }
        if (operands.size() != 1) {
            throw error("Failed to construct an expression from the token list.", 0);
        }
        return operands.pop();
    }

    private void accept(Token token, int offset) {
        if (token instanceof Token.Literal literal) {
            operand(EvalTreeNode.leaf(literal.value()), offset);
        } else if (token instanceof Token.SideList sides) {
            operand(EvalTreeNode.leaf(sides.faces()), offset);
        } else if (token instanceof Token.OpenParen) {
            if (!expectOperand) {
                throw error("Unexpected value.", offset);
            }
            operators.push(new Pending(null, offset));
        } else if (token instanceof Token.CloseParen) {
            closeParen(offset);
        } else if (token instanceof Token.Op op) {
            operator(op.operator(), offset);
        }
    }

    private void operand(EvalTreeNode leaf, int offset) {
        if (!expectOperand) {
            throw error("Unexpected value.", offset);
        }
        operands.push(leaf);
        expectOperand = false;
    }

    private void closeParen(int offset) {
        if (expectOperand) {
            throw error("Unexpectedly terminated expression.", offset);
        }
        while (!operators.isEmpty() && !operators.peek()
                                                 .isParen()) {
            reduce();
        }
        if (operators.isEmpty()) {
            throw error("Unopened parenthesis detected.", offset);
        }
        operators.pop();
    }

    private void operator(Operator incoming, int offset) {
        if (incoming.arity()
                    .hasLeft() == expectOperand) {
            throw error(incoming.symbol() + " is not allowed in this position.", offset);
        }
        if (!incoming.isPrefix()) {
            while (!operators.isEmpty() && !operators.peek()
                                                     .isParen() && operators.peek()
                                                                            .operator()
                                                                            .reducesBefore(incoming)) {
                reduce();
            }
        }
        operators.push(new Pending(incoming, offset));
        expectOperand = incoming.arity()
                                .hasRight();
    }

    private void reduce() {
        var pending = operators.pop();
        var operator = pending.operator();
        EvalTreeNode right = null;
        EvalTreeNode left = null;
        if (operator.arity()
                    .hasRight()) {
            right = popOperand(pending);
        }
        if (operator.arity()
                    .hasLeft()) {
            left = popOperand(pending);
        }
        operands.push(EvalTreeNode.operator(operator, left, right));
    }

    private EvalTreeNode popOperand(Pending pending) {
        if (operands.isEmpty()) {
            throw error("Operator " + pending.operator()
                                             .symbol() + " is missing an operand.", pending.offset());
        }
        return operands.pop();
    }

    private ParseException error(String reason, int offset) {
        return new ParseException(reason, offset, source);
    }
}
