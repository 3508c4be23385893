package org.pragmatica.txt2tex.ast;

import org.pragmatica.txt2tex.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Mathematical terms and predicates. Immutable; every node keeps its source span.
 */
public sealed interface Expr {

    /**
     * Source location of this expression.
     */
    SourceSpan span();

    /**
     * Binding strength of the outermost construct of this expression.
     */
    Precedence precedence();

    <R> R accept(ExprVisitor<R> visitor);

    // === Atoms ===

    /**
     * Variable, type or toolkit name, possibly with decorations: {@code x}, {@code count_s}, {@code x'}
     */
    record Identifier(SourceSpan span, String name) implements Expr {
        @Override
        public Precedence precedence() {
            return Precedence.ATOM;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /**
     * Natural number literal.
     */
    record Numeral(SourceSpan span, String value) implements Expr {
        @Override
        public Precedence precedence() {
            return Precedence.ATOM;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumeral(this);
        }
    }

    /**
     * Set display: {@code {a, b}}, {@code {}}
     */
    record SetLiteral(SourceSpan span, List<Expr> elements) implements Expr {
        public SetLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public Precedence precedence() {
            return Precedence.ATOM;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetLiteral(this);
        }
    }

    /**
     * Sequence display: {@code <a, b>}, {@code ⟨⟩}
     */
    record SequenceLiteral(SourceSpan span, List<Expr> elements) implements Expr {
        public SequenceLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public Precedence precedence() {
            return Precedence.ATOM;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSequenceLiteral(this);
        }
    }

    /**
     * Bag display: {@code [[a, a, b]]}
     */
    record BagLiteral(SourceSpan span, List<Expr> elements) implements Expr {
        public BagLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public Precedence precedence() {
            return Precedence.ATOM;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBagLiteral(this);
        }
    }

    /**
     * Comprehension: {@code { x : N | x > 0 . x * x }}. Predicate and yield are both optional.
     */
    record Comprehension(SourceSpan span,
                         CollectionKind kind,
                         List<BinderGroup> binders,
                         Optional<Expr> predicate,
                         Optional<Expr> yield) implements Expr {
        public Comprehension {
            binders = List.copyOf(binders);
        }

        @Override
        public Precedence precedence() {
            return Precedence.ATOM;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitComprehension(this);
        }
    }

    /**
     * Tuple of two or more components: {@code (a, b)}
     */
    record Tuple(SourceSpan span, List<Expr> elements) implements Expr {
        public Tuple {
            elements = List.copyOf(elements);
        }

        @Override
        public Precedence precedence() {
            return Precedence.ATOM;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    // === Operators ===

    /**
     * Prefix operator: {@code not p}, {@code -x}, {@code # s}
     */
    record UnaryOp(SourceSpan span, UnaryOperator operator, Expr operand) implements Expr {
        @Override
        public Precedence precedence() {
            return operator.precedence();
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    /**
     * Infix operator application.
     */
    record BinaryOp(SourceSpan span, BinaryOperator operator, Expr left, Expr right) implements Expr {
        @Override
        public Precedence precedence() {
            return operator.precedence();
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    /**
     * Range of integers: {@code 1 .. n}
     */
    record Range(SourceSpan span, Expr from, Expr to) implements Expr {
        @Override
        public Precedence precedence() {
            return Precedence.RANGE;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRange(this);
        }
    }

    // === Binder forms ===

    /**
     * {@code forall g | P}, {@code exists g | C . P}. Constraint is present only in the two-part form.
     */
    record Quantifier(SourceSpan span,
                      QuantifierKind kind,
                      List<BinderGroup> binders,
                      Optional<Expr> constraint,
                      Expr body) implements Expr {
        public Quantifier {
            binders = List.copyOf(binders);
        }

        @Override
        public Precedence precedence() {
            return Precedence.BINDER;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitQuantifier(this);
        }
    }

    /**
     * Definite description {@code mu g | P . E}. Without a yield expression the bound variable itself
     * is denoted.
     */
    record Mu(SourceSpan span, List<BinderGroup> binders, Expr predicate, Optional<Expr> yield) implements Expr {
        public Mu {
            binders = List.copyOf(binders);
        }

        @Override
        public Precedence precedence() {
            return Precedence.BINDER;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMu(this);
        }
    }

    /**
     * {@code lambda g . E}
     */
    record Lambda(SourceSpan span, List<BinderGroup> binders, Expr body) implements Expr {
        public Lambda {
            binders = List.copyOf(binders);
        }

        @Override
        public Precedence precedence() {
            return Precedence.BINDER;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLambda(this);
        }
    }

    /**
     * {@code if c then a else b}
     */
    record Conditional(SourceSpan span, Expr condition, Expr thenBranch, Expr elseBranch) implements Expr {
        @Override
        public Precedence precedence() {
            return Precedence.BINDER;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    /**
     * Piecewise right-hand side of an equation, one {@code expression if guard} line per branch.
     */
    record GuardedCases(SourceSpan span, List<GuardedBranch> branches) implements Expr {
        public GuardedCases {
            branches = List.copyOf(branches);
        }

        @Override
        public Precedence precedence() {
            return Precedence.ATOM;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGuardedCases(this);
        }
    }

    record GuardedBranch(SourceSpan span, Expr expression, Expr guard) {}

    // === Postfix forms ===

    /**
     * {@code f(a, b)} or curried {@code f a}.
     */
    record Application(SourceSpan span, Expr function, List<Expr> arguments, ApplicationStyle style) implements Expr {
        public Application {
            arguments = List.copyOf(arguments);
        }

        @Override
        public Precedence precedence() {
            return Precedence.POSTFIX;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitApplication(this);
        }
    }

    /**
     * Generic instantiation, brackets written without a preceding space: {@code seq[N]}
     */
    record GenericInstantiation(SourceSpan span, Expr base, List<Expr> arguments) implements Expr {
        public GenericInstantiation {
            arguments = List.copyOf(arguments);
        }

        @Override
        public Precedence precedence() {
            return Precedence.POSTFIX;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGenericInstantiation(this);
        }
    }

    /**
     * Component selection: {@code p.1}, {@code e.name}
     */
    record TupleProjection(SourceSpan span, Expr tuple, String component) implements Expr {
        @Override
        public Precedence precedence() {
            return Precedence.POSTFIX;
        }

        public boolean isPositional() {
            return !component.isEmpty() && component.chars().allMatch(Character::isDigit);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTupleProjection(this);
        }
    }

    /**
     * {@code R(| S |)}
     */
    record RelationalImage(SourceSpan span, Expr relation, Expr set) implements Expr {
        @Override
        public Precedence precedence() {
            return Precedence.POSTFIX;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRelationalImage(this);
        }
    }

    /**
     * Postfix closure or inverse: {@code R~}, {@code R+}, {@code R*}
     */
    record Closure(SourceSpan span, ClosureKind kind, Expr operand) implements Expr {
        @Override
        public Precedence precedence() {
            return Precedence.POSTFIX;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitClosure(this);
        }
    }

    /**
     * Superscript, used for powers and relation iteration: {@code x^2}
     */
    record Superscript(SourceSpan span, Expr base, Expr exponent) implements Expr {
        @Override
        public Precedence precedence() {
            return Precedence.POSTFIX;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSuperscript(this);
        }
    }

    /**
     * Subscript with a bracketed index: {@code x_(i + 1)}
     */
    record Subscript(SourceSpan span, Expr base, Expr index) implements Expr {
        @Override
        public Precedence precedence() {
            return Precedence.POSTFIX;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSubscript(this);
        }
    }
}
