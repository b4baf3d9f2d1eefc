package org.pragmatica.dice;

import org.pragmatica.dice.error.EvaluationException;
import org.pragmatica.dice.error.InputTypeException;
import org.pragmatica.dice.error.ParseException;
import org.pragmatica.dice.lexer.Token;
import org.pragmatica.dice.lexer.Tokenizer;
import org.pragmatica.dice.operator.Operators;
import org.pragmatica.dice.tree.EvalTree;
import org.pragmatica.dice.value.Scalar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rolls expressions with a fixed {@link DiceConfig}.
 *
 * <p>Expressions may be given as source text, as a number, or as a tree from {@link #compile(Object, long)}.
 * A compiled tree is copied before it is rolled, so the same tree can be rolled any number of times and in any
 * mode. Modifiers are added last, as in {@code (expression)+modifiers}.
 */
public final class Roller {
    private static final String ROLLABLE = "This function can only take a rollable string, a number, or a compiled evaluation tree.";

    private final DiceConfig config;

    public Roller(DiceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public DiceConfig config() {
        return config;
    }

    public Scalar basic(Object expression) {
        return basic(expression, Mode.NORMAL, 0);
    }

    public Scalar basic(Object expression, long modifiers) {
        return basic(expression, Mode.NORMAL, modifiers);
    }

    public Scalar basic(Object expression, Mode mode) {
        return basic(expression, mode, 0);
    }

    /**
     * Roll an expression and return only the result.
     *
     * @throws InputTypeException  for an expression of an unsupported type
     * @throws ParseException      for malformed source text
     * @throws EvaluationException when rolling fails
     */
    public Scalar basic(Object expression, Mode mode, long modifiers) {
        return withModifiers(mode.applyTo(rollable(expression)), modifiers).evaluate(config);
    }

    public String verbose(Object expression) {
        return verbose(expression, Mode.NORMAL, 0);
    }

    public String verbose(Object expression, Mode mode) {
        return verbose(expression, mode, 0);
    }

    /**
     * Roll an expression and show every roll alongside the result, e.g. {@code [d20: 3, 17; (1)]+5 = 25}.
     *
     * @throws InputTypeException  for an expression of an unsupported type
     * @throws ParseException      for malformed source text
     * @throws EvaluationException when rolling fails
     */
    public String verbose(Object expression, Mode mode, long modifiers) {
        var tree = withModifiers(mode.applyTo(rollable(expression)), modifiers);
        tree.evaluate(config);
        return tree.verboseResult(config);
    }

    public EvalTree compile(Object expression) {
        return compile(expression, 0);
    }

    /**
     * Parse an expression once for repeated rolling.
     *
     * @throws InputTypeException for anything but source text or a number
     * @throws ParseException     for malformed source text
     */
    public EvalTree compile(Object expression, long modifiers) {
        if (expression instanceof String text) {
            return withModifiers(EvalTree.parse(text), modifiers);
        }
        if (expression instanceof Number number) {
            return withModifiers(EvalTree.of(scalar(number)), modifiers);
        }
        throw new InputTypeException("You can only compile a string or a number into an EvalTree.");
    }

    public List<Token> tokenize(Object expression) {
        return tokenize(expression, 0);
    }

    /**
     * Tokenize an expression. With non-zero modifiers the tokens read as {@code (expression)+modifiers}; a number
     * gives {@code number+modifiers}.
     *
     * @throws InputTypeException for anything but source text or a number
     * @throws ParseException     for malformed source text
     */
    public List<Token> tokenize(Object expression, long modifiers) {
        if (expression instanceof Number number) {
            var value = scalar(number);
            var tokens = new ArrayList<Token>();
            tokens.add(new Token.Literal(value, 0));
            if (modifiers != 0) {
                int end = value.toString()
                               .length();
                tokens.add(Token.op(Operators.PLUS, end));
                tokens.add(Token.literal(modifiers, end + 1));
            }
            return List.copyOf(tokens);
        }
        if (!(expression instanceof String text)) {
            throw new InputTypeException("You can only tokenize a string expression or a number.");
        }
        var tokens = Tokenizer.tokenize(text);
        if (modifiers == 0) {
            return tokens;
        }
        var wrapped = new ArrayList<Token>(tokens.size() + 4);
        wrapped.add(new Token.OpenParen(0));
        wrapped.addAll(tokens);
        wrapped.add(new Token.CloseParen(text.length()));
        wrapped.add(Token.op(Operators.PLUS, text.length()));
        wrapped.add(Token.literal(modifiers, text.length()));
        return List.copyOf(wrapped);
    }

    private EvalTree rollable(Object expression) {
        if (expression instanceof String text) {
            return EvalTree.parse(text);
        }
        if (expression instanceof Number number) {
            return EvalTree.of(scalar(number));
        }
        if (expression instanceof Scalar value) {
            return EvalTree.of(value);
        }
        if (expression instanceof EvalTree tree) {
            return tree.copy();
        }
        throw new InputTypeException(ROLLABLE);
    }

    private static EvalTree withModifiers(EvalTree tree, long modifiers) {
        if (modifiers == 0) {
            return tree;
        }
        return tree.plusInPlace(EvalTree.of(Scalar.of(modifiers)));
    }

    private static Scalar scalar(Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return Scalar.of(number.longValue());
        }
        return Scalar.of(number.doubleValue());
    }
}
