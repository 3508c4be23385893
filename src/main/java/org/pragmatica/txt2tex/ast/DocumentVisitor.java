package org.pragmatica.txt2tex.ast;

/**
 * Exhaustive dispatch over {@link DocumentItem} variants.
 */
public interface DocumentVisitor<R> {
    R visitSection(DocumentItem.Section section);

    R visitSolution(DocumentItem.Solution solution);

    R visitPart(DocumentItem.Part part);

    R visitPageBreak(DocumentItem.PageBreak pageBreak);

    R visitContents(DocumentItem.Contents contents);

    R visitTextBlock(DocumentItem.TextBlock textBlock);

    R visitExpression(DocumentItem.ExpressionItem item);

    R visitGivenType(DocumentItem.GivenType givenType);

    R visitFreeType(DocumentItem.FreeType freeType);

    R visitAbbreviation(DocumentItem.Abbreviation abbreviation);

    R visitAxiomaticDefinition(DocumentItem.AxiomaticDefinition definition);

    R visitGenericDefinition(DocumentItem.GenericDefinition definition);

    R visitSchema(DocumentItem.Schema schema);

    R visitZedBlock(DocumentItem.ZedBlock zedBlock);

    R visitSyntaxBlock(DocumentItem.SyntaxBlock syntaxBlock);

    R visitTruthTable(DocumentItem.TruthTable truthTable);

    R visitEquivalenceChain(DocumentItem.EquivalenceChain chain);

    R visitInferenceRule(DocumentItem.InferenceRule rule);

    R visitProofTree(DocumentItem.ProofTree proofTree);
}
