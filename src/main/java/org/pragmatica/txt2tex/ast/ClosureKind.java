package org.pragmatica.txt2tex.ast;

/**
 * Postfix relation operators: inverse, transitive closure, reflexive-transitive closure.
 */
public enum ClosureKind {
    INVERSE,
    TRANSITIVE,
    REFLEXIVE_TRANSITIVE
}
