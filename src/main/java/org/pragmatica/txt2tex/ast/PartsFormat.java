package org.pragmatica.txt2tex.ast;

/**
 * Layout of solution parts, chosen by a {@code PARTS:} line.
 */
public enum PartsFormat {
    /** Bold label at the start of a paragraph. */
    INLINE,
    /** Unnumbered subsection heading. */
    SUBSECTION
}
