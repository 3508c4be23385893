package org.pragmatica.txt2tex.parser;

import org.pragmatica.txt2tex.error.ParseError;
import org.pragmatica.txt2tex.lexer.Token;
import org.pragmatica.txt2tex.lexer.TokenKind;
import org.pragmatica.txt2tex.tree.SourceSpan;

import java.util.List;

/**
 * Position in a token list shared by the expression, document and proof parsers.
 */
final class TokenCursor {
    private final List<Token> tokens;
    private int pos;

    TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    Token peek() {
        return tokens.get(Math.min(pos, tokens.size() - 1));
    }

    /**
     * Token {@code offset} places ahead, not skipping anything.
     */
    Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    Token previous() {
        return tokens.get(Math.max(0, pos - 1));
    }

    Token advance() {
        var token = peek();
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    boolean check(TokenKind kind) {
        return peek().kind() == kind;
    }

    boolean match(TokenKind kind) {
        if (check(kind)) {
            advance();
            return true;
        }
        return false;
    }

    Token expect(TokenKind kind, String expected) {
        if (!check(kind)) {
            throw ParseError.unexpected(peek(), expected);
        }
        return advance();
    }

    boolean isAtEnd() {
        return check(TokenKind.EOF);
    }

    boolean atLineEnd() {
        return check(TokenKind.NEWLINE) || check(TokenKind.EOF);
    }

    void expectLineEnd() {
        if (!atLineEnd()) {
            throw ParseError.unexpected(peek(), "end of line");
        }
        match(TokenKind.NEWLINE);
    }

    /**
     * Skip newline tokens and report how many were skipped.
     */
    int skipNewlines() {
        int count = 0;
        while (check(TokenKind.NEWLINE)) {
            advance();
            count++;
        }
        return count;
    }

    SourceSpan spanFrom(Token start) {
        var end = previous();
        if (end.span().end().isBefore(start.span().start())) {
            return start.span();
        }
        return SourceSpan.of(start.span().start(), end.span().end());
    }
}
