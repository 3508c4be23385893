package org.pragmatica.txt2tex.generator;

/**
 * Advisory findings collected during generation. Warnings never change the output.
 */
public sealed interface GenerationWarning {

    /**
     * Human-readable one-line description.
     */
    String message();

    /**
     * An output line longer than the configured threshold.
     *
     * @param line      1-based line number in the generated text
     * @param length    line length in characters
     * @param threshold configured maximum
     */
    record LineOverflow(int line, int length, int threshold) implements GenerationWarning {
        @Override
        public String message() {
            return "Output line " + line + " has " + length + " characters (limit " + threshold + ")";
        }
    }

    /**
     * A proof step cites an assumption label that does not label one of its ancestors.
     *
     * @param label  cited label as written
     * @param nodeId preorder id of the citing step
     * @param line   source line of the citing step
     * @param reason why the citation does not resolve
     */
    record UnresolvedDischarge(String label, int nodeId, int line, String reason) implements GenerationWarning {
        @Override
        public String message() {
            return "Line " + line + ": discharge of [" + label + "] " + reason;
        }
    }
}
