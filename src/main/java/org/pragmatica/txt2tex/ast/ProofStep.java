package org.pragmatica.txt2tex.ast;

import org.pragmatica.txt2tex.tree.SourceSpan;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Children of a proof node: further derivation steps or an or-elimination case split.
 */
public sealed interface ProofStep {

    SourceSpan span();

    <R> R accept(ProofStepVisitor<R> visitor);

    /**
     * One derivation step.
     *
     * @param id            preorder index within the tree, 0 for the root
     * @param expression    derived formula, absent only for a synthesized conclusion
     * @param justification rule or reason, without brackets
     * @param label         assumption label introduced by this node
     * @param sibling       written with a leading {@code ::} marker
     * @param children      premises, in source order
     */
    record ProofNode(SourceSpan span,
                     int id,
                     Optional<Expr> expression,
                     Optional<String> justification,
                     Optional<Integer> label,
                     boolean sibling,
                     List<ProofStep> children) implements ProofStep {
        public ProofNode {
            children = List.copyOf(children);
        }

        public boolean isSynthetic() {
            return expression.isEmpty();
        }

        public boolean isAssumption() {
            return justification.map(text -> text.strip().equalsIgnoreCase("assumption")).orElse(false);
        }

        @Override
        public <R> R accept(ProofStepVisitor<R> visitor) {
            return visitor.visitNode(this);
        }

        @Override
        public void forEachNode(Consumer<ProofNode> action) {
            action.accept(this);
            for (var child : children) {
                child.forEachNode(action);
            }
        }
    }

    /**
     * Or-elimination: one branch per case, each an independent derivation.
     */
    record CaseAnalysis(SourceSpan span, List<CaseBranch> branches) implements ProofStep {
        public CaseAnalysis {
            branches = List.copyOf(branches);
        }

        @Override
        public <R> R accept(ProofStepVisitor<R> visitor) {
            return visitor.visitCaseAnalysis(this);
        }

        @Override
        public void forEachNode(Consumer<ProofNode> action) {
            for (var branch : branches) {
                for (var step : branch.steps()) {
                    step.forEachNode(action);
                }
            }
        }
    }

    /**
     * {@code case p:} followed by the steps derived under hypothesis {@code p}.
     */
    record CaseBranch(SourceSpan span, Expr hypothesis, List<ProofStep> steps) {
        public CaseBranch {
            steps = List.copyOf(steps);
        }
    }

    /**
     * Visit every proof node at or below this step in preorder.
     */
    void forEachNode(Consumer<ProofNode> action);
}
