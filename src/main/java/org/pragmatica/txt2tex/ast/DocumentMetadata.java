package org.pragmatica.txt2tex.ast;

import java.util.Optional;

/**
 * Title page fields given by {@code TITLE:}, {@code SUBTITLE:}, {@code AUTHOR:}, {@code DATE:} and
 * {@code INSTITUTION:} lines.
 */
public record DocumentMetadata(Optional<String> title,
                               Optional<String> subtitle,
                               Optional<String> author,
                               Optional<String> date,
                               Optional<String> institution) {
    public static final DocumentMetadata EMPTY = new DocumentMetadata(
        Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    public boolean isEmpty() {
        return title.isEmpty() && subtitle.isEmpty() && author.isEmpty() && date.isEmpty() && institution.isEmpty();
    }

    public DocumentMetadata withTitle(String value) {
        return new DocumentMetadata(Optional.of(value), subtitle, author, date, institution);
    }

    public DocumentMetadata withSubtitle(String value) {
        return new DocumentMetadata(title, Optional.of(value), author, date, institution);
    }

    public DocumentMetadata withAuthor(String value) {
        return new DocumentMetadata(title, subtitle, Optional.of(value), date, institution);
    }

    public DocumentMetadata withDate(String value) {
        return new DocumentMetadata(title, subtitle, author, Optional.of(value), institution);
    }

    public DocumentMetadata withInstitution(String value) {
        return new DocumentMetadata(title, subtitle, author, date, Optional.of(value));
    }
}
