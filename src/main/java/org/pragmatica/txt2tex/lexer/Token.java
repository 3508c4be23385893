package org.pragmatica.txt2tex.lexer;

import org.pragmatica.txt2tex.tree.SourceSpan;

/**
 * One lexical unit.
 *
 * @param kind        token kind
 * @param text        raw lexeme as written, or the captured body for structural tokens
 * @param span        source range
 * @param spaceBefore whether whitespace separates this token from the previous one on the same line
 */
public record Token(TokenKind kind, String text, SourceSpan span, boolean spaceBefore) {

    public int line() {
        return span.start().line();
    }

    public int column() {
        return span.start().column();
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public boolean isIdentifier(String name) {
        return kind == TokenKind.IDENTIFIER && text.equals(name);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + span.start();
    }
}
