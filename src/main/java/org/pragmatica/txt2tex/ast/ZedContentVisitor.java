package org.pragmatica.txt2tex.ast;

/**
 * Exhaustive dispatch over the paragraphs a {@code zed ... end} block may hold.
 */
public interface ZedContentVisitor<R> {
    R visitGivenType(DocumentItem.GivenType givenType);

    R visitFreeType(DocumentItem.FreeType freeType);

    R visitAbbreviation(DocumentItem.Abbreviation abbreviation);

    R visitExpression(DocumentItem.ExpressionItem item);
}
