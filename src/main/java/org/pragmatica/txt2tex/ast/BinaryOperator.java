package org.pragmatica.txt2tex.ast;

import org.pragmatica.txt2tex.ast.Precedence.Associativity;
import org.pragmatica.txt2tex.lexer.TokenKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Infix operators, each bound to its token kind, precedence level and associativity.
 */
public enum BinaryOperator {
    IFF(TokenKind.IFF, Precedence.IFF, Associativity.LEFT),
    IMPLIES(TokenKind.IMPLIES, Precedence.IMPLIES, Associativity.RIGHT),
    OR(TokenKind.OR, Precedence.OR, Associativity.LEFT),
    AND(TokenKind.AND, Precedence.AND, Associativity.LEFT),

    EQUALS(TokenKind.EQUALS, Precedence.RELATIONAL, Associativity.NONE),
    NOT_EQUAL(TokenKind.NOT_EQUAL, Precedence.RELATIONAL, Associativity.NONE),
    LESS(TokenKind.LESS, Precedence.RELATIONAL, Associativity.NONE),
    GREATER(TokenKind.GREATER, Precedence.RELATIONAL, Associativity.NONE),
    LESS_EQUAL(TokenKind.LESS_EQUAL, Precedence.RELATIONAL, Associativity.NONE),
    GREATER_EQUAL(TokenKind.GREATER_EQUAL, Precedence.RELATIONAL, Associativity.NONE),
    IN(TokenKind.IN, Precedence.RELATIONAL, Associativity.NONE),
    NOT_IN(TokenKind.NOT_IN, Precedence.RELATIONAL, Associativity.NONE),
    SUBSET(TokenKind.SUBSET, Precedence.RELATIONAL, Associativity.NONE),
    PROPER_SUBSET(TokenKind.PROPER_SUBSET, Precedence.RELATIONAL, Associativity.NONE),

    RELATION(TokenKind.RELATION, Precedence.ARROW, Associativity.RIGHT),
    TOTAL_FUN(TokenKind.TOTAL_FUN, Precedence.ARROW, Associativity.RIGHT),
    PARTIAL_FUN(TokenKind.PARTIAL_FUN, Precedence.ARROW, Associativity.RIGHT),
    TOTAL_INJ(TokenKind.TOTAL_INJ, Precedence.ARROW, Associativity.RIGHT),
    PARTIAL_INJ(TokenKind.PARTIAL_INJ, Precedence.ARROW, Associativity.RIGHT),
    TOTAL_SURJ(TokenKind.TOTAL_SURJ, Precedence.ARROW, Associativity.RIGHT),
    PARTIAL_SURJ(TokenKind.PARTIAL_SURJ, Precedence.ARROW, Associativity.RIGHT),
    BIJECTION(TokenKind.BIJECTION, Precedence.ARROW, Associativity.RIGHT),
    FINITE_FUN(TokenKind.FINITE_FUN, Precedence.ARROW, Associativity.RIGHT),

    MAPLET(TokenKind.MAPLET, Precedence.MAPLET, Associativity.LEFT),

    PLUS(TokenKind.PLUS, Precedence.ADDITIVE, Associativity.LEFT),
    MINUS(TokenKind.MINUS, Precedence.ADDITIVE, Associativity.LEFT),
    UNION(TokenKind.UNION, Precedence.ADDITIVE, Associativity.LEFT),
    SET_MINUS(TokenKind.SET_MINUS, Precedence.ADDITIVE, Associativity.LEFT),
    OVERRIDE(TokenKind.OVERRIDE, Precedence.ADDITIVE, Associativity.LEFT),
    CONCAT(TokenKind.CONCAT, Precedence.ADDITIVE, Associativity.LEFT),
    BAG_UNION(TokenKind.BAG_UNION, Precedence.ADDITIVE, Associativity.LEFT),

    TIMES(TokenKind.TIMES, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    DIV(TokenKind.DIV, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    MOD(TokenKind.MOD, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    INTERSECT(TokenKind.INTERSECT, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    CROSS(TokenKind.CROSS, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    COMPOSE(TokenKind.COMPOSE, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    CIRCLE(TokenKind.CIRCLE, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    FILTER(TokenKind.FILTER, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    DOM_RESTRICT(TokenKind.DOM_RESTRICT, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    RAN_RESTRICT(TokenKind.RAN_RESTRICT, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    DOM_SUBTRACT(TokenKind.DOM_SUBTRACT, Precedence.MULTIPLICATIVE, Associativity.LEFT),
    RAN_SUBTRACT(TokenKind.RAN_SUBTRACT, Precedence.MULTIPLICATIVE, Associativity.LEFT);

    private static final Map<TokenKind, BinaryOperator> BY_TOKEN = new EnumMap<>(TokenKind.class);

    static {
        for (var operator : values()) {
            BY_TOKEN.put(operator.token, operator);
        }
    }

    private final TokenKind token;
    private final Precedence precedence;
    private final Associativity associativity;

    BinaryOperator(TokenKind token, Precedence precedence, Associativity associativity) {
        this.token = token;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    public static Optional<BinaryOperator> forToken(TokenKind kind) {
        return Optional.ofNullable(BY_TOKEN.get(kind));
    }

    public TokenKind token() {
        return token;
    }

    public Precedence precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    /**
     * Minimal precedence the left operand must have to be written without parentheses.
     */
    public Precedence leftOperandPrecedence() {
        return associativity == Associativity.LEFT ? precedence : precedence.tighter();
    }

    /**
     * Minimal precedence the right operand must have to be written without parentheses.
     */
    public Precedence rightOperandPrecedence() {
        return associativity == Associativity.RIGHT ? precedence : precedence.tighter();
    }
}
