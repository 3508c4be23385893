package org.pragmatica.txt2tex.error;

import org.pragmatica.txt2tex.tree.SourceLocation;
import org.pragmatica.txt2tex.tree.SourceSpan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rich diagnostic message for Rust-style error reporting.
 *
 * <p>Example output:
 * <pre>
 * error: Unexpected end of line, expected 'end'
 *   --> exercise.txt:4:12
 *    |
 *  3 | where
 *  4 |   x > 0
 *    |        ^
 *    |
 *    = help: did you forget 'end' before starting a new block?
 * </pre>
 *
 * @param severity Error severity level
 * @param message  Primary error message
 * @param span     Source span where error occurred
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(Severity severity, String message, SourceSpan span, List<String> notes) {
    private static final int CONTEXT_LINES = 1;

    private static final Map<String, String> HINTS = new LinkedHashMap<>();

    static {
        HINTS.put("expected 'end'", "did you forget 'end' before starting a new block?");
        HINTS.put("expected 'where' or 'end'", "a definition body closes with 'end', predicates follow 'where'");
        HINTS.put("Unexpected character", "this character is not valid in whiteboard notation");
        HINTS.put("expected ':'", "declarations need a colon between name and type");
        HINTS.put("expected identifier", "a variable or type name is required here");
        HINTS.put("expected ')'", "make sure all brackets, braces and parentheses are balanced");
        HINTS.put("expected ']'", "make sure all brackets, braces and parentheses are balanced");
        HINTS.put("expected '}'", "make sure all brackets, braces and parentheses are balanced");
        HINTS.put("expected end of line", "only one expression is allowed per line; join with an operator");
        HINTS.put("non-associative", "add parentheses to state which comparison applies first");
        HINTS.put("already introduced", "every assumption label must be unique within one proof");
    }

    /**
     * Error severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, message, span, List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, message, span, List.of());
    }

    /**
     * Build a diagnostic for a conversion failure, attaching a help note when one is known.
     */
    public static Diagnostic of(ConversionException error) {
        var span = spanOf(error);
        var diagnostic = error(error.reason(), span);
        for (var entry : HINTS.entrySet()) {
            if (error.reason().contains(entry.getKey())) {
                return diagnostic.withHelp(entry.getValue());
            }
        }
        return diagnostic;
    }

    private static SourceSpan spanOf(ConversionException error) {
        if (error instanceof ParseError parseError) {
            return parseError.token().span();
        }
        if (error instanceof GenerationError generationError) {
            return generationError.span();
        }
        var start = error.location();
        return SourceSpan.of(start, SourceLocation.at(start.line(), start.column() + 1, start.offset() + 1));
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, span, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with the offending line, one line of context before it and a caret
     * underline.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var loc = span.start();

        sb.append(severity.display()).append(": ").append(message).append("\n");
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int firstLine = Math.max(1, loc.line() - CONTEXT_LINES);
        int gutterWidth = String.valueOf(loc.line()).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append(gutter).append("|\n");
        for (int lineNum = firstLine; lineNum <= loc.line() && lineNum <= lines.length; lineNum++) {
            var content = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum)).append(" | ").append(content).append("\n");
            if (lineNum == loc.line()) {
                sb.append(" ".repeat(gutterWidth)).append(" | ");
                sb.append(" ".repeat(Math.max(0, loc.column() - 1)));
                sb.append("^".repeat(underlineLength(content)));
                sb.append("\n");
            }
        }
        sb.append(gutter).append("|\n");

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    private int underlineLength(String lineContent) {
        var start = span.start();
        var end = span.end();
        if (end.line() != start.line()) {
            return Math.max(1, lineContent.codePointCount(0, lineContent.length()) - start.column() + 1);
        }
        return Math.max(1, end.column() - start.column());
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s",
            filename == null ? "input" : filename, loc.line(), loc.column(), severity.display(), message);
    }
}
