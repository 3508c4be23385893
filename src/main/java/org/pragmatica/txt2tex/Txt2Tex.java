package org.pragmatica.txt2tex;

import org.pragmatica.txt2tex.ast.Document;
import org.pragmatica.txt2tex.error.ConversionException;
import org.pragmatica.txt2tex.error.Diagnostic;
import org.pragmatica.txt2tex.generator.GenerationResult;
import org.pragmatica.txt2tex.generator.GeneratorConfig;
import org.pragmatica.txt2tex.generator.LatexGenerator;
import org.pragmatica.txt2tex.generator.NotationMode;
import org.pragmatica.txt2tex.parser.Parser;
import org.pragmatica.txt2tex.parser.ParserConfig;

/**
 * Entry point for converting whiteboard notation to LaTeX.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = Txt2Tex.convert("""
 *     === Exercise 1 ===
 *     forall x : N | x >= 0
 *     """);
 * result.warnings().forEach(w -> System.err.println(w.message()));
 * }</pre>
 *
 * <p>Lexing and parsing failures are thrown as {@link ConversionException}s; no output is produced
 * for a document that fails to parse. Use {@link #diagnose(ConversionException, String)} to
 * format one for display.
 */
public final class Txt2Tex {
    private Txt2Tex() {}

    /**
     * Parse a whole document with the default configuration.
     */
    public static Document parse(String source) {
        return Parser.parse(source);
    }

    /**
     * Generate LaTeX for a parsed document.
     *
     * @param overflowThreshold output lines longer than this produce a warning
     */
    public static GenerationResult generate(Document document, NotationMode mode, int overflowThreshold) {
        return LatexGenerator.generate(document, GeneratorConfig.builder()
                                                                .notationMode(mode)
                                                                .overflowThreshold(overflowThreshold)
                                                                .build());
    }

    /**
     * Parse and generate with default settings.
     */
    public static GenerationResult convert(String source) {
        return builder().build().convert(source);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Format a conversion error against the source it came from.
     */
    public static String diagnose(ConversionException error, String source) {
        return diagnose(error, source, "input");
    }

    public static String diagnose(ConversionException error, String source, String filename) {
        return Diagnostic.of(error).format(source, filename);
    }

    /**
     * Fluent builder for a reusable {@link Converter}.
     */
    public static final class Builder {
        private final ParserConfig.Builder parser = ParserConfig.builder();
        private final GeneratorConfig.Builder generator = GeneratorConfig.builder();

        private Builder() {}

        public Builder notationMode(NotationMode mode) {
            generator.notationMode(mode);
            return this;
        }

        public Builder overflowThreshold(int columns) {
            generator.overflowThreshold(columns);
            return this;
        }

        public Builder standalone(boolean standalone) {
            generator.standalone(standalone);
            return this;
        }

        public Builder strictIndentation(boolean strict) {
            parser.strictIndentation(strict);
            return this;
        }

        public Builder indentUnit(int columns) {
            parser.indentUnit(columns);
            return this;
        }

        public Converter build() {
            return new Converter(parser.build(), generator.build());
        }
    }
}
