package org.pragmatica.txt2tex.generator;

import java.util.Objects;

/**
 * Generator configuration options.
 *
 * @param notationMode      symbol dialect of the output
 * @param overflowThreshold output lines longer than this many characters produce a warning; below 1
 *                          the check is off
 * @param standalone        wrap the body in a preamble and {@code document} environment
 */
public record GeneratorConfig(NotationMode notationMode, int overflowThreshold, boolean standalone) {
    public static final int DEFAULT_OVERFLOW_THRESHOLD = 100;
    public static final GeneratorConfig DEFAULT = new GeneratorConfig(NotationMode.STANDARD,
                                                                      DEFAULT_OVERFLOW_THRESHOLD,
                                                                      true);

    public GeneratorConfig {
        Objects.requireNonNull(notationMode, "notationMode");
    }


    public GeneratorConfig withNotationMode(NotationMode mode) {
        return new GeneratorConfig(mode, overflowThreshold, standalone);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private NotationMode notationMode = DEFAULT.notationMode();
        private int overflowThreshold = DEFAULT.overflowThreshold();
        private boolean standalone = DEFAULT.standalone();

        private Builder() {}

        public Builder notationMode(NotationMode mode) {
            this.notationMode = mode;
            return this;
        }

        public Builder overflowThreshold(int columns) {
            this.overflowThreshold = columns;
            return this;
        }

        public Builder standalone(boolean standalone) {
            this.standalone = standalone;
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(notationMode, overflowThreshold, standalone);
        }
    }
}
