package org.pragmatica.txt2tex;

import org.pragmatica.txt2tex.ast.Document;
import org.pragmatica.txt2tex.generator.GenerationResult;
import org.pragmatica.txt2tex.generator.GeneratorConfig;
import org.pragmatica.txt2tex.generator.LatexGenerator;
import org.pragmatica.txt2tex.parser.Parser;
import org.pragmatica.txt2tex.parser.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser and generator settings bound together. Immutable and safe to reuse; every call is an
 * independent conversion run.
 */
public final class Converter {
    private static final Logger log = LoggerFactory.getLogger(Converter.class);

    private final ParserConfig parserConfig;
    private final GeneratorConfig generatorConfig;

    Converter(ParserConfig parserConfig, GeneratorConfig generatorConfig) {
        this.parserConfig = parserConfig;
        this.generatorConfig = generatorConfig;
    }

    public ParserConfig parserConfig() {
        return parserConfig;
    }

    public GeneratorConfig generatorConfig() {
        return generatorConfig;
    }

    public Document parse(String source) {
        return Parser.parse(source, parserConfig);
    }

    public GenerationResult generate(Document document) {
        return LatexGenerator.generate(document, generatorConfig);
    }

    public GenerationResult convert(String source) {
        var result = generate(parse(source));
        if (result.hasWarnings()) {
            log.debug("Conversion finished with {} warnings", result.warnings().size());
        }
        return result;
    }
}
