package org.pragmatica.txt2tex.ast;

/**
 * Treatment of a text block.
 */
public enum TextKind {
    /** {@code TEXT:} prose with formula detection. */
    SMART,
    /** {@code PURETEXT:} prose with special characters escaped only. */
    ESCAPED,
    /** {@code LATEX:} copied to the output untouched. */
    RAW
}
