package org.pragmatica.txt2tex.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-run generator state: the configuration, read-only for every emission routine, and the
 * warning accumulator. One instance per conversion, never shared.
 */
final class GenerationContext {
    private final GeneratorConfig config;
    private final List<GenerationWarning> warnings = new ArrayList<>();

    GenerationContext(GeneratorConfig config) {
        this.config = config;
    }

    GeneratorConfig config() {
        return config;
    }

    NotationMode mode() {
        return config.notationMode();
    }

    String symbol(Symbol symbol) {
        return symbol.latex(config.notationMode());
    }

    void warn(GenerationWarning warning) {
        warnings.add(warning);
    }

    List<GenerationWarning> warnings() {
        return List.copyOf(warnings);
    }
}
