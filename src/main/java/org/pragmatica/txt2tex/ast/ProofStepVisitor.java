package org.pragmatica.txt2tex.ast;

/**
 * Exhaustive dispatch over {@link ProofStep} variants.
 */
public interface ProofStepVisitor<R> {
    R visitNode(ProofStep.ProofNode node);

    R visitCaseAnalysis(ProofStep.CaseAnalysis analysis);
}
