package org.pragmatica.dice.lexer;

import org.pragmatica.dice.error.ParseException;
import org.pragmatica.dice.operator.Operator;
import org.pragmatica.dice.operator.Operators;
import org.pragmatica.dice.value.Faces;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a dice expression into tokens.
 *
 * <p>The scan keeps two runs: a run of digits and a run of operator characters. A run of operator characters
 * grows only while it is still the start of some operator code, so {@code <=} becomes one operator while
 * {@code rhl} becomes {@code rh} followed by {@code l}. A {@code +} or {@code -} is a sign whenever an operand
 * is expected: at the start, after {@code (} and after an operator that takes a right operand.
 *
 * <p>Every token is checked against its position as it is emitted, so the first misplaced token is the one
 * reported. A {@code )} without a match is reported where it stands; a {@code (} left open is reported once
 * the input ends, at the innermost one.
 */
public final class Tokenizer {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private final StringBuilder digits = new StringBuilder();
    private final StringBuilder operator = new StringBuilder();
    private final Deque<Integer> openParens = new ArrayDeque<>();
    private int pos;
    private int digitsStart;
    private int operatorStart;

    private Tokenizer(String input) {
        this.input = input;
    }

    /**
     * Tokenize an expression.
     *
     * @throws ParseException on the first lexical or positional problem
     */
    public static List<Token> tokenize(String input) {
        return new Tokenizer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        while (pos < input.length()) {
            scan(input.charAt(pos));
            pos++ ;
        }
        flushDigits();
        flushOperator();
        if (!openParens.isEmpty()) {
            throw ParseException.withHelp("Unclosed parenthesis detected.", "add a matching ')'", openParens.peek(), input);
        }
        if (!tokens.isEmpty() && expectsOperand()) {
            throw error("Unexpectedly terminated expression.", input.length());
        }
        return List.copyOf(tokens);
    }

    private void scan(char c) {
        if (isDigit(c)) {
            flushOperator();
            if (digits.length() == 0) {
                digitsStart = pos;
            }
            digits.append(c);
            return;
        }
        if (c == '+' || c == '-') {
            flushDigits();
            flushOperator();
            scanSign(c);
            return;
        }
        if (Operators.isOperatorChar(c)) {
            flushDigits();
            scanOperatorChar(c);
            return;
        }
        flushDigits();
        flushOperator();
        if (Character.isWhitespace(c)) {
            return;
        }
        switch (c) {
            case '(' -> openParen();
            case ')' -> closeParen();
            case '[' -> sideList();
            case 'F' -> fudge();
            default -> throw error("Unrecognized character detected.", pos);
        }
    }

    private void scanSign(char c) {
        if (expectsOperand()) {
            var sign = c == '+' ? Operators.POSITIVE : Operators.NEGATE;
            tokens.add(Token.op(sign, pos));
        } else {
            emitOperator(c == '+' ? Operators.PLUS : Operators.MINUS, pos);
        }
    }

    private void scanOperatorChar(char c) {
        if (operator.length() > 0 && Operators.isPrefix(operator.toString() + c)) {
            operator.append(c);
            return;
        }
        flushOperator();
        if (!Operators.isPrefix(String.valueOf(c))) {
            throw error("Invalid operator.", pos);
        }
        operatorStart = pos;
        operator.append(c);
    }

    private void openParen() {
        if (!expectsOperand()) {
            throw error(lastIsPostfix() ? "Unexpectedly terminated expression." : "Unexpected value.", pos);
        }
        openParens.push(pos);
        tokens.add(new Token.OpenParen(pos));
    }

    private void closeParen() {
        if (openParens.isEmpty()) {
            throw ParseException.withHelp("Unopened parenthesis detected.",
                                          "remove it or add a matching '(' before it",
                                          pos,
                                          input);
        }
        if (expectsOperand()) {
            throw error("Unexpectedly terminated expression.", pos);
        }
        openParens.pop();
        tokens.add(new Token.CloseParen(pos));
    }

    private void sideList() {
        if (!afterDiceOperator()) {
            throw error("A list can only appear as the sides of a die.", pos);
        }
        int begin = pos;
        int end = input.indexOf(']', begin);
        if (end < 0) {
            throw error("Unterminated die side list.", begin);
        }
        var values = new ArrayList<Double>();
        int elementStart = begin + 1;
        for (var element : input.substring(begin + 1, end)
                                .split(",", -1)) {
            values.add(parseSide(element, elementStart));
            elementStart += element.length() + 1;
        }
        emitValue(new Token.SideList(Faces.of(values.stream()
                                                    .mapToDouble(Double::doubleValue)
                                                    .toArray()),
                                     begin));
        pos = end;
    }

    private double parseSide(String element, int elementStart) {
        var text = element.strip();
        int offset = elementStart + leadingWhitespace(element);
        if (text.isEmpty()) {
            throw error("Die side lists cannot have empty elements.", offset);
        }
        if (!DECIMAL.matcher(text)
                    .matches()) {
            throw error(text + " cannot be interpreted as a decimal number.", offset);
        }
        return Double.parseDouble(text);
    }

    private void fudge() {
        if (!afterDiceOperator()) {
            throw error("F is the 'fudge dice' value, and must appear as the side specifier of a roll.", pos);
        }
        emitValue(new Token.SideList(Faces.FUDGE, pos));
    }

    private void flushDigits() {
        if (digits.length() == 0) {
            return;
        }
        var text = digits.toString();
        digits.setLength(0);
        try {
            emitValue(Token.literal(Long.parseLong(text), digitsStart));
        } catch (NumberFormatException e) {
            throw new ParseException(text + " is too large to be an integer.", digitsStart, input, e);
        }
    }

    private void flushOperator() {
        if (operator.length() == 0) {
            return;
        }
        var code = operator.toString();
        operator.setLength(0);
        var resolved = Operators.lookupWritten(code)
                                .orElseThrow(() -> error("Invalid operator.", operatorStart));
        emitOperator(resolved, operatorStart);
    }

    private void emitOperator(Operator op, int offset) {
        if (op.arity()
              .hasLeft() && expectsOperand()) {
            throw error(op.code() + " is not allowed in this position.", offset);
        }
        tokens.add(Token.op(op, offset));
    }

    private void emitValue(Token token) {
        if (!expectsOperand()) {
            throw error("Unexpected value.", token.offset());
        }
        tokens.add(token);
    }

    private boolean expectsOperand() {
        if (tokens.isEmpty()) {
            return true;
        }
        var last = tokens.get(tokens.size() - 1);
        if (last instanceof Token.OpenParen) {
            return true;
        }
        return last instanceof Token.Op op && op.operator()
                                                .arity()
                                                .hasRight();
    }

    private boolean lastIsPostfix() {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1) instanceof Token.Op op && op.operator()
                                                                                              .isPostfix();
    }

    private boolean afterDiceOperator() {
        flushOperator();
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1) instanceof Token.Op op && Operators.isDice(op.operator());
    }

    private int leadingWhitespace(String text) {
        int count = 0;
        while (count < text.length() && Character.isWhitespace(text.charAt(count))) {
            count++ ;
        }
        return count;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private ParseException error(String reason, int offset) {
        return new ParseException(reason, offset, input);
    }
}
