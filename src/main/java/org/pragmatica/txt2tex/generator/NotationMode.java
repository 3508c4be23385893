package org.pragmatica.txt2tex.generator;

import java.util.List;

/**
 * Output symbol dialect. The two dialects are mutually exclusive for one document.
 */
public enum NotationMode {
    /**
     * Spivey's {@code fuzz} package: {@code \nat}, {@code \spot}, {@code \IF ... \THEN ... \ELSE}.
     */
    FUZZ(List.of("fuzz")),
    /**
     * The {@code zed-cm} and {@code zed-maths} packages with AMS symbols: {@code \mathbb{N}},
     * {@code \bullet}, {@code \colon}.
     */
    STANDARD(List.of("zed-cm", "zed-maths"));

    private final List<String> packages;

    NotationMode(List<String> packages) {
        this.packages = packages;
    }

    /**
     * LaTeX packages the generated document must load for this dialect.
     */
    public List<String> packages() {
        return packages;
    }
}
