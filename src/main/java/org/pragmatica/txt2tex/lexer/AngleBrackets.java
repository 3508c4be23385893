package org.pragmatica.txt2tex.lexer;

/**
 * Decides whether an angle bracket delimits a sequence literal or is a comparison operator.
 *
 * <p>Opening {@code <}, after no longer operator matched:
 * <table>
 *   <caption>Opening bracket decisions</caption>
 *   <tr><th>next char</th><th>previous token</th><th>space before</th><th>closer ahead</th><th>result</th></tr>
 *   <tr><td>{@code >}</td><td>any</td><td>any</td><td>-</td><td>SEQ_OPEN (empty sequence)</td></tr>
 *   <tr><td>whitespace</td><td>any</td><td>any</td><td>-</td><td>LESS</td></tr>
 *   <tr><td>other</td><td>ends an operand</td><td>no</td><td>-</td><td>LESS</td></tr>
 *   <tr><td>other</td><td>ends an operand</td><td>yes</td><td>yes</td><td>SEQ_OPEN</td></tr>
 *   <tr><td>other</td><td>operator, opener, comma, line start</td><td>any</td><td>yes</td><td>SEQ_OPEN</td></tr>
 *   <tr><td>other</td><td>any</td><td>any</td><td>no</td><td>LESS</td></tr>
 * </table>
 * A closer ahead is a {@code >} later on the same line whose preceding character is neither
 * whitespace nor part of an arrow ({@code -}, {@code |}, {@code =}).
 *
 * <p>Closing {@code >}: a sequence close iff the innermost open bracket is a sequence and the
 * preceding character is not whitespace.
 *
 * <p>Known divergence: {@code a<b,c>d} lexes as two comparisons.
 */
final class AngleBrackets {
    private AngleBrackets() {}

    static TokenKind classifyOpen(String input, int pos, TokenKind previous, boolean spaceBefore) {
        char next = pos + 1 < input.length() ? input.charAt(pos + 1) : '\n';
        if (next == '>') {
            return TokenKind.SEQ_OPEN;
        }
        if (Character.isWhitespace(next)) {
            return TokenKind.LESS;
        }
        if (previous.endsOperand() && !spaceBefore) {
            return TokenKind.LESS;
        }
        return hasCloserAhead(input, pos + 1) ? TokenKind.SEQ_OPEN : TokenKind.LESS;
    }

    static boolean closesSequence(TokenKind innermost, String input, int pos) {
        if (innermost != TokenKind.SEQ_OPEN || pos == 0) {
            return false;
        }
        return !Character.isWhitespace(input.charAt(pos - 1));
    }

    private static boolean hasCloserAhead(String input, int from) {
        for (int i = from; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '\n') {
                return false;
            }
            if (c == '>' && isCloserContext(input.charAt(i - 1))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCloserContext(char before) {
        return !Character.isWhitespace(before) && before != '-' && before != '|' && before != '=';
    }
}
