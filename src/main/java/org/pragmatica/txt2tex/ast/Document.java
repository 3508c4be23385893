package org.pragmatica.txt2tex.ast;

import org.pragmatica.txt2tex.tree.SourceSpan;

import java.util.List;

/**
 * Root of a parsed document.
 */
public record Document(SourceSpan span,
                       DocumentMetadata metadata,
                       BibliographyMetadata bibliography,
                       List<DocumentItem> items) {
    public Document {
        items = List.copyOf(items);
    }
}
