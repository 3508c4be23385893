package org.pragmatica.txt2tex.parser;

import org.pragmatica.txt2tex.ast.Document;
import org.pragmatica.txt2tex.ast.Expr;
import org.pragmatica.txt2tex.error.ParseError;
import org.pragmatica.txt2tex.lexer.Lexer;
import org.pragmatica.txt2tex.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points of the parsing stage.
 *
 * <p>Both methods tokenize their input first, so a {@link org.pragmatica.txt2tex.error.LexError}
 * may surface from either of them. Parsing stops at the first error.
 */
public final class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private Parser() {}

    public static Document parse(String input) {
        return parse(input, ParserConfig.DEFAULT);
    }

    /**
     * Parse a whole whiteboard document.
     */
    public static Document parse(String input, ParserConfig config) {
        var tokens = Lexer.tokenize(input);
        log.debug("Tokenized {} characters into {} tokens", input.length(), tokens.size());
        var document = new DocumentParser(new TokenCursor(tokens), config).parseDocument();
        log.debug("Parsed document with {} top-level items", document.items().size());
        return document;
    }

    /**
     * Parse a single expression. Surrounding blank lines are allowed, any other trailing input is
     * an error.
     */
    public static Expr parseExpression(String input) {
        var cursor = new TokenCursor(Lexer.tokenize(input));
        cursor.skipNewlines();
        var expression = new ExpressionParser(cursor).parseExpression();
        cursor.skipNewlines();
        if (!cursor.check(TokenKind.EOF)) {
            throw ParseError.unexpected(cursor.peek(), "end of input");
        }
        return expression;
    }
}
