package org.pragmatica.txt2tex.error;

import org.pragmatica.txt2tex.tree.SourceSpan;

/**
 * Internal invariant violation inside the generator. Never caused by user input.
 */
public final class GenerationError extends ConversionException {
    private final String reason;
    private final SourceSpan span;

    public GenerationError(String reason, SourceSpan span) {
        super(reason, span.start());
        this.reason = reason;
        this.span = span;
    }

    public SourceSpan span() {
        return span;
    }

    @Override
    public String reason() {
        return reason;
    }
}
