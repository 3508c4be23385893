package org.pragmatica.txt2tex.parser;

import org.pragmatica.txt2tex.ast.ApplicationStyle;
import org.pragmatica.txt2tex.ast.BinaryOperator;
import org.pragmatica.txt2tex.ast.BinderGroup;
import org.pragmatica.txt2tex.ast.ClosureKind;
import org.pragmatica.txt2tex.ast.CollectionKind;
import org.pragmatica.txt2tex.ast.Expr;
import org.pragmatica.txt2tex.ast.Precedence;
import org.pragmatica.txt2tex.ast.QuantifierKind;
import org.pragmatica.txt2tex.ast.UnaryOperator;
import org.pragmatica.txt2tex.error.ParseError;
import org.pragmatica.txt2tex.lexer.Token;
import org.pragmatica.txt2tex.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for expressions, one method per precedence level (see
 * {@link Precedence}). Newlines end an expression except inside brackets and after an infix
 * operator, where they are skipped.
 */
final class ExpressionParser {
    private final TokenCursor cursor;
    private int nesting;

    ExpressionParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    Expr parseExpression() {
        return parseIff();
    }

    /**
     * Parse a type expression: arrows and everything tighter, stopping before comparisons,
     * separators and closing angle brackets.
     */
    Expr parseType() {
        return parseArrow();
    }

    // === Precedence ladder ===

    private Expr parseIff() {
        var left = parseImplies();
        while (check(TokenKind.IFF)) {
            cursor.advance();
            var right = operand(this::parseImplies);
            left = binary(BinaryOperator.IFF, left, right);
        }
        return left;
    }

    private Expr parseImplies() {
        var left = parseOr();
        if (check(TokenKind.IMPLIES)) {
            cursor.advance();
            var right = operand(this::parseImplies);
            return binary(BinaryOperator.IMPLIES, left, right);
        }
        return left;
    }

    private Expr parseOr() {
        var left = parseAnd();
        while (check(TokenKind.OR)) {
            cursor.advance();
            var right = operand(this::parseAnd);
            left = binary(BinaryOperator.OR, left, right);
        }
        return left;
    }

    private Expr parseAnd() {
        var left = parseNot();
        while (check(TokenKind.AND)) {
            cursor.advance();
            var right = operand(this::parseNot);
            left = binary(BinaryOperator.AND, left, right);
        }
        return left;
    }

    private Expr parseNot() {
        if (check(TokenKind.NOT)) {
            var start = cursor.advance();
            var operand = parseNot();
            return new Expr.UnaryOp(start.span().to(operand.span()), UnaryOperator.NOT, operand);
        }
        return parseBinderTier();
    }

    private Expr parseBinderTier() {
        if (startsBinderForm(peek().kind())) {
            return parseBinderForm();
        }
        return parseRelational();
    }

    private Expr parseRelational() {
        var left = parseArrow();
        var operator = operatorAt(Precedence.RELATIONAL);
        if (operator.isEmpty()) {
            return left;
        }
        cursor.advance();
        var right = operand(this::parseArrow);
        if (operator.get() == BinaryOperator.EQUALS && check(TokenKind.IF)) {
            right = parseGuardedCases(right);
        }
        var result = binary(operator.get(), left, right);
        if (operatorAt(Precedence.RELATIONAL).isPresent()) {
            throw ParseError.semantic(peek(), "Comparison operators are non-associative; '"
                                              + peek().text() + "' cannot follow another comparison");
        }
        return result;
    }

    private Expr parseArrow() {
        var left = parseMaplet();
        var operator = operatorAt(Precedence.ARROW);
        if (operator.isPresent()) {
            cursor.advance();
            var right = operand(this::parseArrow);
            return binary(operator.get(), left, right);
        }
        return left;
    }

    private Expr parseMaplet() {
        var left = parseRange();
        while (check(TokenKind.MAPLET)) {
            cursor.advance();
            var right = operand(this::parseRange);
            left = binary(BinaryOperator.MAPLET, left, right);
        }
        return left;
    }

    private Expr parseRange() {
        var left = parseAdditive();
        if (!check(TokenKind.RANGE)) {
            return left;
        }
        cursor.advance();
        var right = operand(this::parseAdditive);
        if (check(TokenKind.RANGE)) {
            throw ParseError.semantic(peek(), "Range operator '..' is non-associative");
        }
        return new Expr.Range(left.span().to(right.span()), left, right);
    }

    private Expr parseAdditive() {
        var left = parseMultiplicative();
        var operator = operatorAt(Precedence.ADDITIVE);
        while (operator.isPresent()) {
            cursor.advance();
            var right = operand(this::parseMultiplicative);
            left = binary(operator.get(), left, right);
            operator = operatorAt(Precedence.ADDITIVE);
        }
        return left;
    }

    private Expr parseMultiplicative() {
        var left = parsePrefix();
        var operator = operatorAt(Precedence.MULTIPLICATIVE);
        while (operator.isPresent()) {
            cursor.advance();
            var right = operand(this::parsePrefix);
            left = binary(operator.get(), left, right);
            operator = operatorAt(Precedence.MULTIPLICATIVE);
        }
        return left;
    }

    private Expr parsePrefix() {
        if (check(TokenKind.MINUS) || check(TokenKind.HASH)) {
            var start = cursor.advance();
            var operator = start.is(TokenKind.MINUS) ? UnaryOperator.NEGATE : UnaryOperator.CARDINALITY;
            var operand = parsePrefix();
            return new Expr.UnaryOp(start.span().to(operand.span()), operator, operand);
        }
        return parsePostfix(parsePrimary(), true);
    }

    // === Postfix forms ===

    private Expr parsePostfix(Expr base, boolean allowJuxtaposition) {
        var expr = base;
        while (true) {
            var token = peek();
            switch (token.kind()) {
                case LPAREN -> {
                    if (token.spaceBefore()) {
                        if (!allowJuxtaposition || !applicable(expr)) {
                            return expr;
                        }
                        expr = juxtapose(expr);
                    }else {
                        expr = parseCall(expr);
                    }
                }
                case LBRACKET -> {
                    if (token.spaceBefore()) {
                        return expr;
                    }
                    expr = parseInstantiation(expr);
                }
                case DOT -> {
                    cursor.advance();
                    var component = peek();
                    if (!component.is(TokenKind.IDENTIFIER) && !component.is(TokenKind.NUMBER)) {
                        throw ParseError.unexpected(component, "component name or number");
                    }
                    cursor.advance();
                    expr = new Expr.TupleProjection(expr.span().to(component.span()), expr, component.text());
                }
                case SUPERSCRIPT -> {
                    cursor.advance();
                    var exponent = parseScriptOperand();
                    expr = new Expr.Superscript(expr.span().to(exponent.span()), expr, exponent);
                }
                case SUBSCRIPT -> {
                    cursor.advance();
                    var index = parseScriptOperand();
                    expr = new Expr.Subscript(expr.span().to(index.span()), expr, index);
                }
                case IMAGE_OPEN -> {
                    cursor.advance();
                    nesting++;
                    var set = parseExpression();
                    var close = expect(TokenKind.IMAGE_CLOSE, "'|)'");
                    nesting--;
                    expr = new Expr.RelationalImage(expr.span().to(close.span()), expr, set);
                }
                case INVERSE, PLUS_CLOSURE, STAR_CLOSURE -> {
                    var closure = cursor.advance();
                    expr = new Expr.Closure(expr.span().to(closure.span()), closureKind(closure.kind()), expr);
                }
                case IDENTIFIER, NUMBER, LBRACE, SEQ_OPEN, BAG_OPEN -> {
                    if (!allowJuxtaposition || !applicable(expr)) {
                        return expr;
                    }
                    expr = juxtapose(expr);
                }
                default -> {
                    return expr;
                }
            }
        }
    }

    /**
     * Curried application {@code f x}. The argument takes only unspaced postfix forms, so
     * {@code f s(i)} applies {@code f} to {@code s(i)} and {@code f x y} groups as {@code (f x) y}.
     */
    private Expr juxtapose(Expr function) {
        var argument = parsePostfix(parsePrimary(), false);
        return new Expr.Application(function.span().to(argument.span()), function, List.of(argument),
                                    ApplicationStyle.JUXTAPOSED);
    }

    private static boolean applicable(Expr expr) {
        return !(expr instanceof Expr.Numeral);
    }

    private Expr parseCall(Expr function) {
        cursor.advance();
        nesting++;
        var arguments = check(TokenKind.RPAREN) ? List.<Expr>of() : parseExpressionList();
        var close = expect(TokenKind.RPAREN, "')'");
        nesting--;
        return new Expr.Application(function.span().to(close.span()), function, arguments,
                                    ApplicationStyle.PARENTHESIZED);
    }

    private Expr parseInstantiation(Expr base) {
        cursor.advance();
        nesting++;
        var arguments = parseExpressionList();
        var close = expect(TokenKind.RBRACKET, "']'");
        nesting--;
        return new Expr.GenericInstantiation(base.span().to(close.span()), base, arguments);
    }

    private Expr parseScriptOperand() {
        if (check(TokenKind.MINUS)) {
            var start = cursor.advance();
            var operand = parsePrimary();
            return new Expr.UnaryOp(start.span().to(operand.span()), UnaryOperator.NEGATE, operand);
        }
        return parsePrimary();
    }

    private static ClosureKind closureKind(TokenKind kind) {
        return switch (kind) {
            case INVERSE -> ClosureKind.INVERSE;
            case PLUS_CLOSURE -> ClosureKind.TRANSITIVE;
            default -> ClosureKind.REFLEXIVE_TRANSITIVE;
        };
    }

    // === Atoms ===

    private Expr parsePrimary() {
        var token = peek();
        return switch (token.kind()) {
            case IDENTIFIER -> {
                cursor.advance();
                yield new Expr.Identifier(token.span(), token.text());
            }
            case NUMBER -> {
                cursor.advance();
                yield new Expr.Numeral(token.span(), token.text());
            }
            case LPAREN -> parseParenthesized();
            case LBRACE -> parseCollection(CollectionKind.SET, TokenKind.RBRACE, "'}'");
            case SEQ_OPEN -> parseCollection(CollectionKind.SEQUENCE, TokenKind.SEQ_CLOSE, "'>'");
            case BAG_OPEN -> parseCollection(CollectionKind.BAG, TokenKind.BAG_CLOSE, "']]'");
            case FORALL, EXISTS, EXISTS1, MU, LAMBDA, IF -> parseBinderForm();
            case NOT -> parseNot();
            default -> throw ParseError.unexpected(token, "expression");
        };
    }

    private Expr parseParenthesized() {
        var open = cursor.advance();
        nesting++;
        var first = parseExpression();
        if (check(TokenKind.COMMA)) {
            var elements = new ArrayList<Expr>();
            elements.add(first);
            while (match(TokenKind.COMMA)) {
                elements.add(parseExpression());
            }
            var close = expect(TokenKind.RPAREN, "')'");
            nesting--;
            return new Expr.Tuple(open.span().to(close.span()), elements);
        }
        expect(TokenKind.RPAREN, "')'");
        nesting--;
        return first;
    }

    private Expr parseCollection(CollectionKind kind, TokenKind closer, String closerText) {
        var open = cursor.advance();
        nesting++;
        Expr result;
        if (startsBinderGroups()) {
            var binders = parseBinderGroups();
            var predicate = match(TokenKind.PIPE) ? Optional.of(continued()) : Optional.<Expr>empty();
            var term = match(TokenKind.BULLET) ? Optional.of(continued()) : Optional.<Expr>empty();
            var close = expect(closer, closerText);
            result = new Expr.Comprehension(open.span().to(close.span()), kind, binders, predicate, term);
        }else {
            var elements = check(closer) ? List.<Expr>of() : parseExpressionList();
            var close = expect(closer, closerText);
            var span = open.span().to(close.span());
            result = switch (kind) {
                case SET -> new Expr.SetLiteral(span, elements);
                case SEQUENCE -> new Expr.SequenceLiteral(span, elements);
                case BAG -> new Expr.BagLiteral(span, elements);
            };
        }
        nesting--;
        return result;
    }

    /**
     * Lookahead for {@code x, y :} or {@code x |} at the start of a comprehension.
     */
    private boolean startsBinderGroups() {
        int offset = skipLookaheadNewlines(0);
        if (cursor.peekAt(offset).kind() != TokenKind.IDENTIFIER) {
            return false;
        }
        offset = skipLookaheadNewlines(offset + 1);
        while (cursor.peekAt(offset).kind() == TokenKind.COMMA
               && cursor.peekAt(skipLookaheadNewlines(offset + 1)).kind() == TokenKind.IDENTIFIER) {
            offset = skipLookaheadNewlines(skipLookaheadNewlines(offset + 1) + 1);
        }
        var next = cursor.peekAt(offset).kind();
        return next == TokenKind.COLON || next == TokenKind.PIPE;
    }

    private int skipLookaheadNewlines(int offset) {
        while (cursor.peekAt(offset).kind() == TokenKind.NEWLINE) {
            offset++;
        }
        return offset;
    }

    // === Binder forms ===

    private static boolean startsBinderForm(TokenKind kind) {
        return switch (kind) {
            case FORALL, EXISTS, EXISTS1, MU, LAMBDA, IF -> true;
            default -> false;
        };
    }

    private Expr parseBinderForm() {
        var start = cursor.advance();
        return switch (start.kind()) {
            case FORALL -> parseQuantifier(start, QuantifierKind.FORALL);
            case EXISTS -> parseQuantifier(start, QuantifierKind.EXISTS);
            case EXISTS1 -> parseQuantifier(start, QuantifierKind.EXISTS_UNIQUE);
            case MU -> parseMu(start);
            case LAMBDA -> parseLambda(start);
            default -> parseConditional(start);
        };
    }

    private Expr parseQuantifier(Token start, QuantifierKind kind) {
        var binders = parseBinderGroups();
        if (match(TokenKind.PIPE)) {
            var first = continued();
            if (match(TokenKind.BULLET)) {
                var body = continued();
                return new Expr.Quantifier(start.span().to(body.span()), kind, binders, Optional.of(first), body);
            }
            return new Expr.Quantifier(start.span().to(first.span()), kind, binders, Optional.empty(), first);
        }
        if (match(TokenKind.BULLET)) {
            var body = continued();
            return new Expr.Quantifier(start.span().to(body.span()), kind, binders, Optional.empty(), body);
        }
        throw ParseError.unexpected(peek(), "'|' or '.' after quantifier declarations");
    }

    private Expr parseMu(Token start) {
        var binders = parseBinderGroups();
        expect(TokenKind.PIPE, "'|' after mu declarations");
        var predicate = continued();
        if (match(TokenKind.BULLET)) {
            var term = continued();
            return new Expr.Mu(start.span().to(term.span()), binders, predicate, Optional.of(term));
        }
        return new Expr.Mu(start.span().to(predicate.span()), binders, predicate, Optional.empty());
    }

    private Expr parseLambda(Token start) {
        var binders = parseBinderGroups();
        expect(TokenKind.BULLET, "'.' after lambda declarations");
        var body = continued();
        return new Expr.Lambda(start.span().to(body.span()), binders, body);
    }

    private Expr parseConditional(Token start) {
        var condition = parseExpression();
        cursor.skipNewlines();
        expect(TokenKind.THEN, "'then'");
        var thenBranch = continued();
        cursor.skipNewlines();
        expect(TokenKind.ELSE, "'else'");
        var elseBranch = continued();
        return new Expr.Conditional(start.span().to(elseBranch.span()), condition, thenBranch, elseBranch);
    }

    /**
     * Branches of a piecewise definition. Each branch after the first sits on its own line, starting
     * in the same column as the first branch.
     */
    private Expr parseGuardedCases(Expr first) {
        int column = first.span().start().column();
        var branches = new ArrayList<Expr.GuardedBranch>();
        var expression = first;
        while (true) {
            expect(TokenKind.IF, "'if'");
            var guard = parseExpression();
            branches.add(new Expr.GuardedBranch(expression.span().to(guard.span()), expression, guard));
            if (!guardedBranchFollows(column)) {
                break;
            }
            cursor.skipNewlines();
            expression = parseArrow();
        }
        var last = branches.get(branches.size() - 1);
        return new Expr.GuardedCases(first.span().to(last.span()), branches);
    }

    private boolean guardedBranchFollows(int column) {
        int offset = 0;
        while (cursor.peekAt(offset).is(TokenKind.NEWLINE)) {
            offset++;
        }
        if (nesting == 0 && offset != 1) {
            return false;
        }
        var start = cursor.peekAt(offset);
        if (start.span().start().column() != column || start.is(TokenKind.IF)) {
            return false;
        }
        int depth = 0;
        for (int index = offset; ; index++) {
            switch (cursor.peekAt(index).kind()) {
                case NEWLINE, EOF -> {
                    return false;
                }
                case IF -> {
                    if (depth == 0) {
                        return true;
                    }
                }
                case LPAREN, LBRACKET, LBRACE, SEQ_OPEN, BAG_OPEN, IMAGE_OPEN -> depth++;
                case RPAREN, RBRACKET, RBRACE, SEQ_CLOSE, BAG_CLOSE, IMAGE_CLOSE -> depth--;
                default -> {
                }
            }
        }
    }

    /**
     * One or more binder groups separated by semicolons: {@code x, y : N; s : seq N}.
     */
    List<BinderGroup> parseBinderGroups() {
        var groups = new ArrayList<BinderGroup>();
        do {
            groups.add(parseBinderGroup());
        } while (match(TokenKind.SEMICOLON));
        return groups;
    }

    private BinderGroup parseBinderGroup() {
        var first = expect(TokenKind.IDENTIFIER, "identifier");
        var names = new ArrayList<String>();
        names.add(first.text());
        while (match(TokenKind.COMMA)) {
            names.add(expect(TokenKind.IDENTIFIER, "identifier").text());
        }
        if (match(TokenKind.COLON)) {
            var domain = parseType();
            return new BinderGroup(first.span().to(domain.span()), names, Optional.of(domain));
        }
        return new BinderGroup(cursor.spanFrom(first), names, Optional.empty());
    }

    // === Helper methods ===

    List<Expr> parseExpressionList() {
        var elements = new ArrayList<Expr>();
        elements.add(parseExpression());
        while (match(TokenKind.COMMA)) {
            elements.add(parseExpression());
        }
        return elements;
    }

    /**
     * Parse an operand that may start on the next line.
     */
    private Expr operand(Supplier<Expr> level) {
        cursor.skipNewlines();
        return level.get();
    }

    private Expr continued() {
        cursor.skipNewlines();
        return parseExpression();
    }

    private Optional<BinaryOperator> operatorAt(Precedence level) {
        return BinaryOperator.forToken(peek().kind())
                             .filter(operator -> operator.precedence() == level);
    }

    private static Expr binary(BinaryOperator operator, Expr left, Expr right) {
        return new Expr.BinaryOp(left.span().to(right.span()), operator, left, right);
    }

    private Token peek() {
        if (nesting > 0) {
            cursor.skipNewlines();
        }
        return cursor.peek();
    }

    private boolean check(TokenKind kind) {
        return peek().kind() == kind;
    }

    private boolean match(TokenKind kind) {
        if (check(kind)) {
            cursor.advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenKind kind, String expected) {
        if (!check(kind)) {
            throw ParseError.unexpected(peek(), expected);
        }
        return cursor.advance();
    }
}
