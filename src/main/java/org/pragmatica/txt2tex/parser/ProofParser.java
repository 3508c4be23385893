package org.pragmatica.txt2tex.parser;

import org.pragmatica.txt2tex.ast.DocumentItem;
import org.pragmatica.txt2tex.ast.Expr;
import org.pragmatica.txt2tex.ast.ProofStep;
import org.pragmatica.txt2tex.error.ParseError;
import org.pragmatica.txt2tex.lexer.Token;
import org.pragmatica.txt2tex.lexer.TokenKind;
import org.pragmatica.txt2tex.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parser for indented natural-deduction proofs.
 *
 * <p>Lines are nested with an explicit stack of (column, open step) frames: a line closes every
 * frame at its own column or deeper and becomes a child of the frame left on top. A {@code case}
 * line starts or extends the case analysis of its parent. When the first line is a case, a
 * synthetic conclusion at column -1 becomes the root.
 */
final class ProofParser {
    private static final int SYNTHETIC_COLUMN = -1;
    private static final int MAX_LABEL_DIGITS = 9;

    private final TokenCursor cursor;
    private final ExpressionParser expressions;
    private final ParserConfig config;

    ProofParser(TokenCursor cursor, ExpressionParser expressions, ParserConfig config) {
        this.cursor = cursor;
        this.expressions = expressions;
        this.config = config;
    }

    /**
     * Parse the lines following a {@code PROOF:} directive up to the end of input, the next
     * structural line or a blank line followed by a line that is not indented below the first step.
     */
    DocumentItem.ProofTree parse(Token directive) {
        cursor.expectLineEnd();
        var frames = new ArrayDeque<Frame>();
        var labels = new LinkedHashMap<Integer, NodeBuilder>();
        NodeBuilder root = null;
        int rootColumn = SYNTHETIC_COLUMN;

        while (continuesProof(root == null ? SYNTHETIC_COLUMN : rootColumn)) {
            var line = parseLine();
            if (root == null) {
                rootColumn = line.column();
                if (line.isCase()) {
                    root = new NodeBuilder(line.start(), Optional.empty(), Optional.empty(), Optional.empty(), false);
                    frames.push(new Frame(SYNTHETIC_COLUMN, root, null));
                }else {
                    if (line.sibling()) {
                        throw ParseError.semantic(line.start(), "The conclusion of a proof cannot carry a sibling marker");
                    }
                    root = line.toNode();
                    register(labels, line, root);
                    frames.push(new Frame(line.column(), root, null));
                    continue;
                }
            }
            attach(frames, line, labels);
        }
        if (root == null) {
            throw ParseError.unexpected(cursor.peek(), "proof conclusion");
        }
        var ids = new int[]{0};
        var node = root.build(ids);
        var index = new LinkedHashMap<Integer, Integer>();
        labels.forEach((label, builder) -> index.put(label, builder.id));
        return new DocumentItem.ProofTree(directive.span().to(node.span()), node, index);
    }

    private boolean continuesProof(int rootColumn) {
        if (cursor.check(TokenKind.NEWLINE)) {
            if (rootColumn == SYNTHETIC_COLUMN || !deeperLineFollows(rootColumn)) {
                return false;
            }
            cursor.skipNewlines();
        }
        if (cursor.isAtEnd()) {
            return false;
        }
        var kind = cursor.peek().kind();
        return !kind.isDirective() && !kind.isStructural() && !DocumentParser.startsParagraph(kind);
    }

    /**
     * Whether the first line after the blank lines at the cursor is indented below the first step.
     */
    private boolean deeperLineFollows(int rootColumn) {
        int offset = 0;
        while (cursor.peekAt(offset).is(TokenKind.NEWLINE)) {
            offset++;
        }
        var next = cursor.peekAt(offset);
        return !next.is(TokenKind.EOF) && next.column() > rootColumn;
    }

    private void attach(Deque<Frame> frames, ProofLine line, Map<Integer, NodeBuilder> labels) {
        int column = line.column();
        while (!frames.isEmpty() && frames.peek().column() >= column) {
            frames.pop();
        }
        if (frames.isEmpty()) {
            throw ParseError.semantic(line.start(),
                                      "A proof has exactly one conclusion; this line is not indented below it");
        }
        var parent = frames.peek();
        checkIndentation(parent, line);
        if (line.isCase()) {
            var analysis = parent.owner().openCaseAnalysis(column, line.start());
            var branch = new BranchBuilder(line.start(), line.caseHypothesis().orElseThrow());
            analysis.branches.add(branch);
            frames.push(new Frame(column, null, branch));
            return;
        }
        var node = line.toNode();
        register(labels, line, node);
        parent.owner().addStep(node);
        frames.push(new Frame(column, node, null));
    }

    private void checkIndentation(Frame parent, ProofLine line) {
        if (!config.strictIndentation() || parent.column() == SYNTHETIC_COLUMN) {
            return;
        }
        int expected = parent.column() + config.indentUnit();
        if (line.column() != expected) {
            throw ParseError.semantic(line.start(), "Expected proof step at column " + expected
                                                    + " but found column " + line.column());
        }
    }

    private static void register(Map<Integer, NodeBuilder> labels, ProofLine line, NodeBuilder node) {
        if (line.label().isEmpty()) {
            return;
        }
        int label = line.label().get();
        if (labels.containsKey(label)) {
            throw ParseError.semantic(line.start(), "Label [" + label + "] already introduced in this proof");
        }
        labels.put(label, node);
    }

    // === Line syntax ===

    private ProofLine parseLine() {
        var start = cursor.peek();
        Optional<Integer> label = Optional.empty();
        boolean sibling = false;
        while (true) {
            if (cursor.check(TokenKind.DOUBLE_COLON) && !sibling) {
                cursor.advance();
                sibling = true;
            }else if (cursor.check(TokenKind.LBRACKET) && cursor.peekAt(1).is(TokenKind.NUMBER)
                      && cursor.peekAt(2).is(TokenKind.RBRACKET) && label.isEmpty()) {
                cursor.advance();
                label = Optional.of(label(cursor.advance()));
                cursor.advance();
            }else {
                break;
            }
        }
        if (cursor.peek().isIdentifier("case") && !cursor.peekAt(1).is(TokenKind.NEWLINE)) {
            cursor.advance();
            var hypothesis = expressions.parseExpression();
            cursor.expect(TokenKind.COLON, "':' after case hypothesis");
            cursor.expectLineEnd();
            return new ProofLine(start, label, sibling, Optional.empty(), Optional.of(hypothesis), Optional.empty());
        }
        var expression = expressions.parseExpression();
        var justification = cursor.check(TokenKind.JUSTIFICATION)
                            ? Optional.of(cursor.advance().text())
                            : Optional.<String>empty();
        cursor.expectLineEnd();
        return new ProofLine(start, label, sibling, Optional.of(expression), Optional.empty(), justification);
    }

    private static int label(Token number) {
        var digits = number.text();
        if (digits.length() > MAX_LABEL_DIGITS) {
            throw ParseError.semantic(number, "Proof label [" + digits + "] must be a number of at most "
                                              + MAX_LABEL_DIGITS + " digits");
        }
        return Integer.parseInt(digits);
    }

    private record ProofLine(Token start,
                             Optional<Integer> label,
                             boolean sibling,
                             Optional<Expr> expression,
                             Optional<Expr> caseHypothesis,
                             Optional<String> justification) {
        int column() {
            return start.column();
        }

        boolean isCase() {
            return caseHypothesis.isPresent();
        }

        NodeBuilder toNode() {
            return new NodeBuilder(start, expression, justification, label, sibling);
        }
    }

    // === Builders ===

    private record Frame(int column, NodeBuilder node, BranchBuilder branch) {
        StepOwner owner() {
            return node != null ? node : branch;
        }
    }

    private interface StepOwner {
        void addStep(Object step);

        CaseBuilder openCaseAnalysis(int column, Token start);
    }

    private static List<ProofStep> buildSteps(List<Object> steps, int[] ids) {
        var built = new ArrayList<ProofStep>();
        for (var step : steps) {
            if (step instanceof NodeBuilder node) {
                built.add(node.build(ids));
            }else if (step instanceof CaseBuilder analysis) {
                built.add(analysis.build(ids));
            }
        }
        return built;
    }

    private static CaseBuilder openCaseAnalysis(List<Object> steps, int column, Token start) {
        if (!steps.isEmpty() && steps.get(steps.size() - 1) instanceof CaseBuilder last && last.column == column) {
            return last;
        }
        var analysis = new CaseBuilder(column, start);
        steps.add(analysis);
        return analysis;
    }

    private static final class NodeBuilder implements StepOwner {
        private final Token start;
        private final Optional<Expr> expression;
        private final Optional<String> justification;
        private final Optional<Integer> label;
        private final boolean sibling;
        private final List<Object> steps = new ArrayList<>();
        private int id;

        NodeBuilder(Token start, Optional<Expr> expression, Optional<String> justification,
                    Optional<Integer> label, boolean sibling) {
            this.start = start;
            this.expression = expression;
            this.justification = justification;
            this.label = label;
            this.sibling = sibling;
        }

        @Override
        public void addStep(Object step) {
            steps.add(step);
        }

        @Override
        public CaseBuilder openCaseAnalysis(int column, Token caseStart) {
            return ProofParser.openCaseAnalysis(steps, column, caseStart);
        }

        ProofStep.ProofNode build(int[] ids) {
            id = ids[0]++;
            var children = buildSteps(steps, ids);
            var span = expression.map(Expr::span).orElse(start.span());
            for (var child : children) {
                span = span.to(child.span());
            }
            return new ProofStep.ProofNode(span, id, expression, justification, label, sibling, children);
        }
    }

    private static final class CaseBuilder {
        private final int column;
        private final Token start;
        private final List<BranchBuilder> branches = new ArrayList<>();

        CaseBuilder(int column, Token start) {
            this.column = column;
            this.start = start;
        }

        ProofStep.CaseAnalysis build(int[] ids) {
            var built = new ArrayList<ProofStep.CaseBranch>();
            SourceSpan span = start.span();
            for (var branch : branches) {
                var caseBranch = branch.build(ids);
                built.add(caseBranch);
                span = span.to(caseBranch.span());
            }
            return new ProofStep.CaseAnalysis(span, built);
        }
    }

    private static final class BranchBuilder implements StepOwner {
        private final Token start;
        private final Expr hypothesis;
        private final List<Object> steps = new ArrayList<>();

        BranchBuilder(Token start, Expr hypothesis) {
            this.start = start;
            this.hypothesis = hypothesis;
        }

        @Override
        public void addStep(Object step) {
            steps.add(step);
        }

        @Override
        public CaseBuilder openCaseAnalysis(int column, Token caseStart) {
            return ProofParser.openCaseAnalysis(steps, column, caseStart);
        }

        ProofStep.CaseBranch build(int[] ids) {
            var children = buildSteps(steps, ids);
            var span = start.span().to(hypothesis.span());
            for (var child : children) {
                span = span.to(child.span());
            }
            return new ProofStep.CaseBranch(span, hypothesis, children);
        }
    }
}
