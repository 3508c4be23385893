package org.pragmatica.txt2tex.error;

import org.pragmatica.txt2tex.lexer.Token;
import org.pragmatica.txt2tex.lexer.TokenKind;

/**
 * Grammar violation. Carries the offending token and a description of what was expected there.
 */
public final class ParseError extends ConversionException {
    private final String reason;
    private final Token token;
    private final String expected;

    private ParseError(String reason, Token token, String expected) {
        super(reason, token.span().start());
        this.reason = reason;
        this.token = token;
        this.expected = expected;
    }

    public static ParseError unexpected(Token token, String expected) {
        return new ParseError("Unexpected " + describe(token) + ", expected " + expected, token, expected);
    }

    public static ParseError semantic(Token token, String reason) {
        return new ParseError(reason, token, "");
    }

    public Token token() {
        return token;
    }

    public String expected() {
        return expected;
    }

    @Override
    public String reason() {
        return reason;
    }

    public static String describe(Token token) {
        if (token.kind() == TokenKind.EOF) {
            return "end of input";
        }
        if (token.kind() == TokenKind.NEWLINE) {
            return "end of line";
        }
        return "'" + token.text() + "'";
    }
}
