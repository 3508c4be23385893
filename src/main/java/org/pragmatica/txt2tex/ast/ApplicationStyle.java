package org.pragmatica.txt2tex.ast;

/**
 * How a function application was written: {@code f(x, y)} or {@code f x}.
 */
public enum ApplicationStyle {
    PARENTHESIZED,
    JUXTAPOSED
}
