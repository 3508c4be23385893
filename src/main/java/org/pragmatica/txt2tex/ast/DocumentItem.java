package org.pragmatica.txt2tex.ast;

import org.pragmatica.txt2tex.tree.SourceSpan;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level and nested document items: structure markers, Z paragraphs, text and derivations.
 */
public sealed interface DocumentItem {

    SourceSpan span();

    <R> R accept(DocumentVisitor<R> visitor);

    // === Structure ===

    /**
     * {@code === Title ===} and everything up to the next section.
     */
    record Section(SourceSpan span, String title, List<DocumentItem> items) implements DocumentItem {
        public Section {
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitSection(this);
        }
    }

    /**
     * {@code ** Solution 3 **} and everything up to the next solution or section.
     */
    record Solution(SourceSpan span, String label, List<DocumentItem> items) implements DocumentItem {
        public Solution {
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitSolution(this);
        }
    }

    /**
     * {@code (a)} part of a solution, laid out by the {@code PARTS:} format in force where it starts.
     */
    record Part(SourceSpan span, String label, PartsFormat format, List<DocumentItem> items) implements DocumentItem {
        public Part {
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitPart(this);
        }
    }

    record PageBreak(SourceSpan span) implements DocumentItem {
        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitPageBreak(this);
        }
    }

    record Contents(SourceSpan span, ContentsDepth depth) implements DocumentItem {
        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitContents(this);
        }
    }

    /**
     * Prose selected by {@code TEXT:}, {@code PURETEXT:} or {@code LATEX:}.
     */
    record TextBlock(SourceSpan span, TextKind kind, String text) implements DocumentItem {
        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitTextBlock(this);
        }
    }

    /**
     * A standalone expression line.
     */
    record ExpressionItem(SourceSpan span, Expr expression) implements ZedContent {
        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitExpression(this);
        }

        @Override
        public <R> R accept(ZedContentVisitor<R> visitor) {
            return visitor.visitExpression(this);
        }
    }

    // === Z paragraphs ===

    /**
     * Paragraphs that may stand alone or be grouped in a {@code zed ... end} block.
     */
    sealed interface ZedContent extends DocumentItem {
        <R> R accept(ZedContentVisitor<R> visitor);
    }

    /**
     * {@code given A, B}
     */
    record GivenType(SourceSpan span, List<String> names) implements ZedContent {
        public GivenType {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitGivenType(this);
        }

        @Override
        public <R> R accept(ZedContentVisitor<R> visitor) {
            return visitor.visitGivenType(this);
        }
    }

    /**
     * {@code Tree ::= leaf | node<Tree, Tree>}
     */
    record FreeType(SourceSpan span, String name, List<String> parameters, List<FreeBranch> branches)
        implements ZedContent {
        public FreeType {
            parameters = List.copyOf(parameters);
            branches = List.copyOf(branches);
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitFreeType(this);
        }

        @Override
        public <R> R accept(ZedContentVisitor<R> visitor) {
            return visitor.visitFreeType(this);
        }
    }

    /**
     * Constructor of a free type. A nullary constructor has no payload.
     */
    record FreeBranch(SourceSpan span, String constructor, Optional<Expr> payload) {}

    /**
     * {@code Name == E} or generic {@code [X] Name == E}
     */
    record Abbreviation(SourceSpan span, String name, List<String> parameters, Expr definition)
        implements ZedContent {
        public Abbreviation {
            parameters = List.copyOf(parameters);
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitAbbreviation(this);
        }

        @Override
        public <R> R accept(ZedContentVisitor<R> visitor) {
            return visitor.visitAbbreviation(this);
        }
    }

    /**
     * {@code axdef ... where ... end}
     */
    record AxiomaticDefinition(SourceSpan span, List<Declaration> declarations, List<List<Expr>> predicates)
        implements DocumentItem {
        public AxiomaticDefinition {
            declarations = List.copyOf(declarations);
            predicates = predicates.stream().map(List::copyOf).toList();
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitAxiomaticDefinition(this);
        }
    }

    /**
     * {@code gendef [X] ... where ... end}
     */
    record GenericDefinition(SourceSpan span,
                             List<String> parameters,
                             List<Declaration> declarations,
                             List<List<Expr>> predicates) implements DocumentItem {
        public GenericDefinition {
            parameters = List.copyOf(parameters);
            declarations = List.copyOf(declarations);
            predicates = predicates.stream().map(List::copyOf).toList();
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitGenericDefinition(this);
        }
    }

    /**
     * {@code schema Name[X] ... where ... end}. Anonymous when the name is absent. Predicate groups
     * are separated by blank lines in the source.
     */
    record Schema(SourceSpan span,
                  Optional<String> name,
                  List<String> parameters,
                  List<Declaration> declarations,
                  List<List<Expr>> predicates) implements DocumentItem {
        public Schema {
            parameters = List.copyOf(parameters);
            declarations = List.copyOf(declarations);
            predicates = predicates.stream().map(List::copyOf).toList();
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitSchema(this);
        }
    }

    /**
     * {@code zed ... end} holding predicates, given types, abbreviations and free types.
     */
    record ZedBlock(SourceSpan span, List<ZedContent> contents) implements DocumentItem {
        public ZedBlock {
            contents = List.copyOf(contents);
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitZedBlock(this);
        }
    }

    /**
     * {@code syntax ... end}: free types aligned on their {@code ::=}. Groups are separated by blank lines.
     */
    record SyntaxBlock(SourceSpan span, List<List<SyntaxDefinition>> groups) implements DocumentItem {
        public SyntaxBlock {
            groups = groups.stream().map(List::copyOf).toList();
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitSyntaxBlock(this);
        }
    }

    /**
     * One definition of a syntax block. Each row holds the branches written on one source line.
     */
    record SyntaxDefinition(SourceSpan span, String name, List<List<FreeBranch>> rows) {
        public SyntaxDefinition {
            rows = rows.stream().map(List::copyOf).toList();
        }
    }

    // === Derivations ===

    /**
     * {@code TRUTH TABLE:} with a header of expressions and rows of truth values.
     */
    record TruthTable(SourceSpan span, List<Expr> headers, List<List<Boolean>> rows) implements DocumentItem {
        public TruthTable {
            headers = List.copyOf(headers);
            rows = rows.stream().map(List::copyOf).toList();
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitTruthTable(this);
        }
    }

    /**
     * {@code EQUIV:} chain of equivalent expressions.
     */
    record EquivalenceChain(SourceSpan span, Expr first, List<EquivalenceStep> steps) implements DocumentItem {
        public EquivalenceChain {
            steps = List.copyOf(steps);
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitEquivalenceChain(this);
        }
    }

    record EquivalenceStep(SourceSpan span, Expr expression, Optional<String> justification) {}

    /**
     * {@code INFRULE:} premises over a rule line over a conclusion.
     */
    record InferenceRule(SourceSpan span, List<Expr> premises, Expr conclusion, Optional<String> name)
        implements DocumentItem {
        public InferenceRule {
            premises = List.copyOf(premises);
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitInferenceRule(this);
        }
    }

    /**
     * One {@code PROOF:} block. {@code labels} maps each assumption label to the preorder id of the
     * node that introduces it; it indexes the tree and owns nothing.
     */
    record ProofTree(SourceSpan span, ProofStep.ProofNode root, Map<Integer, Integer> labels)
        implements DocumentItem {
        public ProofTree {
            labels = Map.copyOf(labels);
        }

        @Override
        public <R> R accept(DocumentVisitor<R> visitor) {
            return visitor.visitProofTree(this);
        }
    }
}
