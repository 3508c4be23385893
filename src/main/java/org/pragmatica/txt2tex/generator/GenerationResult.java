package org.pragmatica.txt2tex.generator;

import java.util.List;

/**
 * Generated LaTeX text together with the warnings collected while producing it.
 */
public record GenerationResult(String output, List<GenerationWarning> warnings) {
    public GenerationResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
