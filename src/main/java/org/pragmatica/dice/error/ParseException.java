package org.pragmatica.dice.error;

import java.util.Optional;

/**
 * The expression text or token list cannot be turned into an expression tree.
 *
 * <p>The message renders the source with a caret under the offending character:
 * <pre>
 * Unopened parenthesis detected.
 *     1+4)
 *        ^
 * </pre>
 */
public final class ParseException extends DiceException {
    private final String reason;
    private final int offset;
    private final String source;
    private final String help;

    public ParseException(String reason, int offset, String source) {
        this(reason, offset, source, null, null);
    }

    public ParseException(String reason, int offset, String source, Throwable cause) {
        this(reason, offset, source, null, cause);
    }

    private ParseException(String reason, int offset, String source, String help, Throwable cause) {
        super(Diagnostic.error(reason, source, offset).format(), cause);
        this.reason = reason;
        this.offset = offset;
        this.source = source;
        this.help = help;
    }

    /**
     * Parse error with a suggestion, shown as a help note by {@link Diagnostic#formatRich(String)}.
     */
    public static ParseException withHelp(String reason, String help, int offset, String source) {
        return new ParseException(reason, offset, source, help, null);
    }

    /**
     * What went wrong, without the source excerpt.
     */
    public String reason() {
        return reason;
    }

    /**
     * Zero-based character offset of the problem within {@link #source()}.
     */
    public int offset() {
        return offset;
    }

    public String source() {
        return source;
    }

    public Optional<String> help() {
        return Optional.ofNullable(help);
    }

    public Diagnostic diagnostic() {
        var diagnostic = Diagnostic.error(reason, source, offset);
        return help == null ? diagnostic : diagnostic.withHelp(help);
    }
}
