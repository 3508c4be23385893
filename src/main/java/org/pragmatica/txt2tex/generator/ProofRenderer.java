package org.pragmatica.txt2tex.generator;

import org.pragmatica.txt2tex.ast.DocumentItem;
import org.pragmatica.txt2tex.ast.ProofStep;
import org.pragmatica.txt2tex.ast.ProofStepVisitor;

import java.util.ArrayList;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders natural-deduction trees with the {@code proof} package: a step with premises becomes
 * {@code \infer[rule]{conclusion}{premises}}, a case branch {@code \deduce{steps}{[hypothesis]}}.
 */
final class ProofRenderer implements ProofStepVisitor<String> {
    private static final Map<String, Symbol> RULE_WORDS = Map.of(
        "=>", Symbol.IMPLIES,
        "<=>", Symbol.IFF,
        "and", Symbol.AND,
        "or", Symbol.OR,
        "not", Symbol.NOT,
        "forall", Symbol.FORALL,
        "exists", Symbol.EXISTS,
        "false", Symbol.FALSE,
        "true", Symbol.TRUE);

    private final ExpressionRenderer expressions;
    private final NotationMode mode;

    ProofRenderer(ExpressionRenderer expressions, NotationMode mode) {
        this.expressions = expressions;
        this.mode = mode;
    }

    String render(DocumentItem.ProofTree tree) {
        return tree.root().accept(this);
    }

    @Override
    public String visitCaseAnalysis(ProofStep.CaseAnalysis analysis) {
        return analysis.branches()
                       .stream()
                       .map(this::branch)
                       .collect(Collectors.joining(" & "));
    }

    @Override
    public String visitNode(ProofStep.ProofNode node) {
        var formula = formula(node);
        if (node.children().isEmpty() && (node.justification().isEmpty() || node.isAssumption())) {
            return formula;
        }
        var premises = node.children()
                           .stream()
                           .map(step -> step.accept(this))
                           .collect(Collectors.joining(" & "));
        var rule = node.justification()
                       .filter(text -> !node.isAssumption())
                       .map(text -> "[" + justification(text, mode) + "]")
                       .orElse("");
        return "\\infer" + rule + "{" + formula + "}{" + premises + "}";
    }

    private String formula(ProofStep.ProofNode node) {
        var text = node.expression()
                       .map(expressions::render)
                       .orElse(Symbol.ELLIPSIS.latex(mode));
        if (!node.isAssumption() && node.label().isEmpty()) {
            return text;
        }
        var discharged = "[" + text + "]";
        return node.label()
                   .map(label -> discharged + "^{" + label + "}")
                   .orElse(discharged);
    }

    private String branch(ProofStep.CaseBranch branch) {
        var hypothesis = "[" + expressions.render(branch.hypothesis()) + "]";
        if (branch.steps().isEmpty()) {
            return hypothesis;
        }
        var steps = new ArrayList<String>();
        for (var step : branch.steps()) {
            steps.add(step.accept(this));
        }
        return "\\deduce{" + String.join(" \\quad ", steps) + "}{" + hypothesis + "}";
    }

    /**
     * Justification text as math: connective spellings become symbols, other words upright.
     */
    static String justification(String text, NotationMode mode) {
        var parts = new ArrayList<String>();
        for (var word : text.strip().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            var symbol = RULE_WORDS.get(word);
            if (symbol != null) {
                parts.add(symbol.latex(mode));
            }else if (word.chars().allMatch(Character::isDigit)) {
                parts.add(word);
            }else {
                parts.add("\\mathrm{" + escapeWord(word) + "}");
            }
        }
        return String.join("\\ ", parts);
    }

    private static String escapeWord(String word) {
        var sb = new StringBuilder(word.length());
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            switch (c) {
                case '_', '#', '%', '&', '$', '{', '}' -> sb.append('\\').append(c);
                case '\\' -> sb.append("\\backslash{}");
                case '^' -> sb.append("\\text{\\textasciicircum}");
                case '~' -> sb.append("\\text{\\textasciitilde}");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
