package org.pragmatica.txt2tex.generator;

import org.pragmatica.txt2tex.ast.DocumentItem;
import org.pragmatica.txt2tex.ast.ProofStep;
import org.pragmatica.txt2tex.ast.ProofStepVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks that every label cited by a discharge justification ({@code [=> intro from 1]},
 * {@code [or elim from 2, 3]}) is introduced by a proper ancestor of the citing step.
 */
final class DischargeChecker implements ProofStepVisitor<Void> {
    private static final Logger log = LoggerFactory.getLogger(DischargeChecker.class);
    private static final Pattern CITATION = Pattern.compile("\\bfrom\\s+(\\d+(?:\\s*(?:,|and)\\s*\\d+)*)");
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final int MAX_LABEL_DIGITS = 9;

    private final DocumentItem.ProofTree tree;
    private final Set<Integer> ancestors = new HashSet<>();
    private final List<GenerationWarning> warnings = new ArrayList<>();

    private DischargeChecker(DocumentItem.ProofTree tree) {
        this.tree = tree;
    }

    static List<GenerationWarning> check(DocumentItem.ProofTree tree) {
        var checker = new DischargeChecker(tree);
        tree.root().accept(checker);
        checker.warnings.forEach(warning -> log.debug("{}", warning.message()));
        return checker.warnings;
    }

    /**
     * Labels cited by a justification as written, in order of appearance.
     */
    static List<String> citedLabels(String justification) {
        var labels = new ArrayList<String>();
        var matcher = CITATION.matcher(justification);
        while (matcher.find()) {
            var numbers = NUMBER.matcher(matcher.group(1));
            while (numbers.find()) {
                labels.add(numbers.group());
            }
        }
        return labels;
    }

    @Override
    public Void visitCaseAnalysis(ProofStep.CaseAnalysis analysis) {
        for (var branch : analysis.branches()) {
            for (var child : branch.steps()) {
                child.accept(this);
            }
        }
        return null;
    }

    @Override
    public Void visitNode(ProofStep.ProofNode node) {
        node.justification().ifPresent(text -> verify(node, text));
        ancestors.add(node.id());
        for (var child : node.children()) {
            child.accept(this);
        }
        ancestors.remove(node.id());
        return null;
    }

    private void verify(ProofStep.ProofNode node, String justification) {
        for (var label : citedLabels(justification)) {
            // a proof label always fits nine digits, so a longer citation cannot resolve
            var target = label.length() > MAX_LABEL_DIGITS ? null : tree.labels().get(Integer.parseInt(label));
            String reason = null;
            if (target == null) {
                reason = "cites a label no step in this proof introduces";
            }else if (target == node.id()) {
                reason = "cites the label introduced by the same step";
            }else if (!ancestors.contains(target)) {
                reason = "cites a label that is not introduced by an enclosing step";
            }
            if (reason != null) {
                warnings.add(new GenerationWarning.UnresolvedDischarge(label, node.id(), node.span().line(), reason));
            }
        }
    }
}
