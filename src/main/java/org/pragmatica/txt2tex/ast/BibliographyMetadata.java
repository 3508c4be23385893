package org.pragmatica.txt2tex.ast;

import java.util.Optional;

/**
 * Bibliography database and style given by {@code BIBLIOGRAPHY:} and {@code BIBLIOGRAPHY_STYLE:} lines.
 * A style without a file produces no bibliography.
 */
public record BibliographyMetadata(Optional<String> file, Optional<String> style) {
    public static final BibliographyMetadata EMPTY = new BibliographyMetadata(Optional.empty(), Optional.empty());

    public BibliographyMetadata withFile(String value) {
        return new BibliographyMetadata(Optional.of(value), style);
    }

    public BibliographyMetadata withStyle(String value) {
        return new BibliographyMetadata(file, Optional.of(value));
    }
}
