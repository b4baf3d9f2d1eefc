package org.pragmatica.dice.error;

import java.util.ArrayList;
import java.util.List;

/**
 * A located problem in an expression, renderable for humans.
 *
 * <p>Compact form, used as the exception message:
 * <pre>
 * Unclosed parenthesis detected.
 *     (1d4d2
 *     ^
 * </pre>
 *
 * <p>Rust-style form:
 * <pre>
 * error: Unclosed parenthesis detected.
 *   --> expression:1:1
 *   |
 * 1 | (1d4d2
 *   | ^
 *   |
 *   = help: add a matching ')'
 * </pre>
 *
 * @param message  Primary message
 * @param source   The expression the offset refers to
 * @param offset   Zero-based character offset
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
 String message,
 String source,
 int offset,
 List<String> notes) {
    private static final int INDENT = 4;

    public static Diagnostic error(String message, String source, int offset) {
        return new Diagnostic(message, source, offset, List.of());
    }

    public Diagnostic withHelp(String help) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add("help: " + help);
        return new Diagnostic(message, source, offset, List.copyOf(newNotes));
    }

    /**
     * Message, then the source indented by four spaces, then a caret under the offset.
     */
    public String format() {
        var indent = " ".repeat(INDENT);
        return message + "\n" + indent + source + "\n" + indent + " ".repeat(caretColumn()) + "^";
    }

    /**
     * Format in Rust style.
     *
     * @param filename Name shown in the location line
     */
    public String formatRich(String filename) {
        var sb = new StringBuilder();
        sb.append("error: ").append(message).append("\n");
        sb.append("  --> ").append(filename).append(":1:").append(caretColumn() + 1).append("\n");
        sb.append("  |\n");
        sb.append("1 | ").append(source).append("\n");
        sb.append("  | ").append(" ".repeat(caretColumn())).append("^\n");
        sb.append("  |\n");
        for (var note : notes) {
            sb.append("  = ").append(note).append("\n");
        }
        return sb.toString();
    }

    private int caretColumn() {
        return Math.max(0, Math.min(offset, source.length()));
    }
}
