package org.pragmatica.txt2tex.ast;

/**
 * Bracket family of a collection literal or comprehension.
 */
public enum CollectionKind {
    SET,
    SEQUENCE,
    BAG
}
