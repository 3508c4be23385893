package org.pragmatica.txt2tex.ast;

import org.pragmatica.txt2tex.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Variables sharing one domain: {@code x, y : N}. Groups separated by semicolons scope
 * independently. The domain may be omitted in comprehensions such as {@code { x | x in A }}.
 */
public record BinderGroup(SourceSpan span, List<String> names, Optional<Expr> domain) {
    public BinderGroup {
        names = List.copyOf(names);
    }
}
