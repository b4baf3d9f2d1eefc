package org.pragmatica.dice.operator;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.pragmatica.dice.operator.OperatorFunction.binary;
import static org.pragmatica.dice.operator.OperatorFunction.postfix;
import static org.pragmatica.dice.operator.OperatorFunction.prefix;

/**
 * The fixed operator table, keyed by operator code and listed in descending precedence.
 *
 * <p>Precedence levels:
 * <ul>
 *   <li>8: {@code !} factorial (postfix)</li>
 *   <li>7: {@code d da dc dm} dice rolls</li>
 *   <li>6: {@code h l f c r R t T} and the reroll variants, roll post-processing</li>
 *   <li>5: {@code ^} exponent (right associative)</li>
 *   <li>4: unary {@code -} and {@code +}</li>
 *   <li>3: {@code * / %}</li>
 *   <li>2: {@code + -}</li>
 *   <li>1: comparisons, {@code |} and {@code &}</li>
 * </ul>
 */
public final class Operators {
    /**
     * Operators at or above this precedence are shown by their value in verbose output, never taken apart.
     */
    public static final int OPAQUE_PRECEDENCE = 6;

    public static final Operator FACTORIAL = Operator.binary("!", 8, postfix(Arithmetic::factorial))
                                                     .withArity(Side.LEFT)
                                                     .withCajole(Side.LEFT);

    public static final Operator ROLL = dice("d", RollFunctions::rollBasic);
    public static final Operator ROLL_AVERAGE = dice("da", RollFunctions::rollAverage);
    public static final Operator ROLL_CRITICAL = dice("dc", RollFunctions::rollCritical);
    public static final Operator ROLL_MAX = dice("dm", RollFunctions::rollMax);

    public static final Operator NEGATE = Operator.binary("m", 4, prefix(Arithmetic::negate))
                                                  .withArity(Side.RIGHT)
                                                  .withCajole(Side.RIGHT)
                                                  .displayedAs("-");
    public static final Operator POSITIVE = Operator.binary("p", 4, prefix(Arithmetic::identity))
                                                    .withArity(Side.RIGHT)
                                                    .withCajole(Side.RIGHT)
                                                    .displayedAs("+");

    public static final Operator PLUS = Operator.binary("+", 2, binary(Arithmetic::add));
    public static final Operator MINUS = Operator.binary("-", 2, binary(Arithmetic::subtract));

    private static final Map<String, Operator> OPERATORS = buildTable();

    private static final Set<Operator> DICE = Set.of(ROLL, ROLL_AVERAGE, ROLL_CRITICAL, ROLL_MAX);

    private static final Set<Operator> SIGNS = Set.of(NEGATE, POSITIVE);

    private static final Set<Character> OPERATOR_CHARS = OPERATORS.values()
                                                                  .stream()
                                                                  .filter(op -> !SIGNS.contains(op))
                                                                  .flatMap(op -> op.code()
                                                                                   .chars()
                                                                                   .mapToObj(c -> (char) c))
                                                                  .collect(Collectors.toUnmodifiableSet());

    private Operators() {}

    private static Map<String, Operator> buildTable() {
        var table = new LinkedHashMap<String, Operator>();
        register(table, FACTORIAL);
        register(table, ROLL);
        register(table, ROLL_AVERAGE);
        register(table, ROLL_CRITICAL);
        register(table, ROLL_MAX);
        register(table, postProcess("h", binary(RollFunctions::takeHigh)));
        register(table, postProcess("l", binary(RollFunctions::takeLow)));
        register(table, postProcess("f", binary(RollFunctions::floor)));
        register(table, postProcess("c", binary(RollFunctions::ceil)));
        register(table, postProcess("r", RollFunctions::rerollOnceOn));
        register(table, postProcess("R", RollFunctions::rerollUnconditionalOn));
        register(table, postProcess("r<", RollFunctions::rerollOnceLower));
        register(table, postProcess("R<", RollFunctions::rerollUnconditionalLower));
        register(table, postProcess("rl", RollFunctions::rerollOnceLower));
        register(table, postProcess("Rl", RollFunctions::rerollUnconditionalLower));
        register(table, postProcess("r>", RollFunctions::rerollOnceHigher));
        register(table, postProcess("R>", RollFunctions::rerollUnconditionalHigher));
        register(table, postProcess("rh", RollFunctions::rerollOnceHigher));
        register(table, postProcess("Rh", RollFunctions::rerollUnconditionalHigher));
        register(table, postProcess("t", binary(RollFunctions::thresholdLower)));
        register(table, postProcess("T", binary(RollFunctions::thresholdUpper)));
        register(table, Operator.binary("^", 5, binary(Arithmetic::power)).withAssociativity(Side.RIGHT));
        register(table, NEGATE);
        register(table, POSITIVE);
        register(table, Operator.binary("*", 3, binary(Arithmetic::multiply)));
        register(table, Operator.binary("/", 3, binary(Arithmetic::divide)));
        register(table, Operator.binary("%", 3, binary(Arithmetic::modulo)));
        register(table, MINUS);
        register(table, PLUS);
        register(table, Operator.binary(">", 1, binary(Arithmetic::greater)));
        register(table, Operator.binary("gt", 1, binary(Arithmetic::greater)));
        register(table, Operator.binary(">=", 1, binary(Arithmetic::greaterOrEqual)));
        register(table, Operator.binary("ge", 1, binary(Arithmetic::greaterOrEqual)));
        register(table, Operator.binary("<", 1, binary(Arithmetic::less)));
        register(table, Operator.binary("lt", 1, binary(Arithmetic::less)));
        register(table, Operator.binary("<=", 1, binary(Arithmetic::lessOrEqual)));
        register(table, Operator.binary("le", 1, binary(Arithmetic::lessOrEqual)));
        register(table, Operator.binary("=", 1, binary(Arithmetic::equal)));
        register(table, Operator.binary("|", 1, binary(Arithmetic::or)));
        register(table, Operator.binary("&", 1, binary(Arithmetic::and)));
        return Collections.unmodifiableMap(table);
    }

    private static void register(Map<String, Operator> table, Operator operator) {
        if (table.putIfAbsent(operator.code(), operator) != null) {
            throw new IllegalStateException("Duplicate operator code: " + operator.code());
        }
    }

    private static Operator dice(String code, OperatorFunction function) {
        return Operator.binary(code, 7, function)
                       .withCajole(Side.LEFT);
    }

    private static Operator postProcess(String code, OperatorFunction function) {
        return Operator.binary(code, OPAQUE_PRECEDENCE, function)
                       .withCajole(Side.RIGHT);
    }

    /**
     * Find an operator by code, including the internal sign codes.
     */
    public static Optional<Operator> lookup(String code) {
        return Optional.ofNullable(OPERATORS.get(code));
    }

    /**
     * Get an operator that is known to exist.
     *
     * @throws IllegalArgumentException for an unknown code
     */
    public static Operator get(String code) {
        return lookup(code).orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + code));
    }

    /**
     * Find an operator that may be written in an expression. The internal sign codes are excluded,
     * since signs are written as {@code +} and {@code -}.
     */
    public static Optional<Operator> lookupWritten(String code) {
        return lookup(code).filter(op -> !SIGNS.contains(op));
    }

    /**
     * Whether some writable operator code starts with {@code run}.
     */
    public static boolean isPrefix(String run) {
        return OPERATORS.values()
                        .stream()
                        .filter(op -> !SIGNS.contains(op))
                        .anyMatch(op -> op.code().startsWith(run));
    }

    public static boolean isOperatorChar(char c) {
        return OPERATOR_CHARS.contains(c);
    }

    public static boolean isDice(Operator operator) {
        return DICE.contains(operator);
    }

    public static Collection<Operator> all() {
        return OPERATORS.values();
    }
}
