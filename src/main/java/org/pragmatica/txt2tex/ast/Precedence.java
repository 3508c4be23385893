package org.pragmatica.txt2tex.ast;

/**
 * Binding strength of expression forms, loosest first. The parser climbs this ladder and the
 * generator consults it to decide where grouping parentheses are needed.
 */
public enum Precedence {
    IFF,
    IMPLIES,
    OR,
    AND,
    NOT,
    /** Quantifiers, mu, lambda and conditionals: bodies extend as far right as possible. */
    BINDER,
    /** Comparison, membership and subset. Non-associative. */
    RELATIONAL,
    /** Function and relation type arrows. Right-associative. */
    ARROW,
    MAPLET,
    RANGE,
    ADDITIVE,
    MULTIPLICATIVE,
    PREFIX,
    /** Application, instantiation, projection, scripts, closures and relational image. */
    POSTFIX,
    ATOM;

    public boolean bindsTighterThan(Precedence other) {
        return compareTo(other) > 0;
    }

    public boolean bindsLooserThan(Precedence other) {
        return compareTo(other) < 0;
    }

    /**
     * The next tighter level. {@link #ATOM} is its own successor.
     */
    public Precedence tighter() {
        var values = values();
        return this == ATOM ? ATOM : values[ordinal() + 1];
    }

    /**
     * How a chain of operators on one level groups.
     */
    public enum Associativity {
        LEFT,
        RIGHT,
        NONE
    }
}
