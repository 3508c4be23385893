package org.pragmatica.txt2tex.ast;

/**
 * Prefix operators.
 */
public enum UnaryOperator {
    NOT(Precedence.NOT),
    NEGATE(Precedence.PREFIX),
    CARDINALITY(Precedence.PREFIX);

    private final Precedence precedence;

    UnaryOperator(Precedence precedence) {
        this.precedence = precedence;
    }

    public Precedence precedence() {
        return precedence;
    }
}
