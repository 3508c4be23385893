package org.pragmatica.txt2tex.error;

import org.pragmatica.txt2tex.tree.SourceLocation;

/**
 * Input the tokenizer cannot scan: a character no token can start with, or a document over the
 * size limit.
 */
public final class LexError extends ConversionException {
    private final String character;
    private final String reason;

    public LexError(SourceLocation location, String character) {
        this(location, character, "Unexpected character '" + character + "'");
    }

    private LexError(SourceLocation location, String character, String reason) {
        super(reason, location);
        this.character = character;
        this.reason = reason;
    }

    /**
     * The document is longer than {@code limit} characters; {@code location} is the first one past it.
     */
    public static LexError inputTooLarge(SourceLocation location, String character, int limit) {
        return new LexError(location, character, "Input exceeds maximum size of " + limit + " characters");
    }

    public String character() {
        return character;
    }

    public int line() {
        return location().line();
    }

    public int column() {
        return location().column();
    }

    @Override
    public String reason() {
        return reason;
    }
}
