package org.pragmatica.txt2tex.parser;

/**
 * Parser configuration options.
 *
 * @param strictIndentation require each proof child to be indented exactly {@code indentUnit}
 *                          columns deeper than its parent; otherwise any deeper column nests
 * @param indentUnit        columns per proof nesting level in strict mode
 */
public record ParserConfig(boolean strictIndentation, int indentUnit) {
    public static final ParserConfig DEFAULT = new ParserConfig(false, 2);

    public ParserConfig {
        if (indentUnit < 1) {
            throw new IllegalArgumentException("Indent unit must be positive, got " + indentUnit);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for parser configuration.
     */
    public static final class Builder {
        private boolean strictIndentation = DEFAULT.strictIndentation();
        private int indentUnit = DEFAULT.indentUnit();

        private Builder() {}

        public Builder strictIndentation(boolean strict) {
            this.strictIndentation = strict;
            return this;
        }

        public Builder indentUnit(int columns) {
            this.indentUnit = columns;
            return this;
        }

        public ParserConfig build() {
            return new ParserConfig(strictIndentation, indentUnit);
        }
    }
}
