package org.pragmatica.txt2tex.ast;

import org.pragmatica.txt2tex.tree.SourceSpan;

import java.util.List;

/**
 * Declaration line of a schema or definition: {@code a, b : T}
 */
public record Declaration(SourceSpan span, List<String> names, Expr type) {
    public Declaration {
        names = List.copyOf(names);
    }
}
