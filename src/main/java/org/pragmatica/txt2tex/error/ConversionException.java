package org.pragmatica.txt2tex.error;

import org.pragmatica.txt2tex.tree.SourceLocation;

/**
 * Failure of a conversion run. Lexing and parsing errors abort the run, a generation error
 * signals a defect in the generator itself.
 */
public abstract sealed class ConversionException extends RuntimeException
    permits LexError, ParseError, GenerationError {

    private final SourceLocation location;

    protected ConversionException(String message, SourceLocation location) {
        super(message + " at " + location);
        this.location = location;
    }

    public SourceLocation location() {
        return location;
    }

    /**
     * Message without the trailing location.
     */
    public abstract String reason();
}
