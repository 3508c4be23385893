package org.pragmatica.txt2tex.parser;

import org.pragmatica.txt2tex.ast.BinderGroup;
import org.pragmatica.txt2tex.ast.Expr;
import org.pragmatica.txt2tex.ast.ExprVisitor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Compact, span-free rendering of an expression tree for structural assertions.
 */
final class Shapes implements ExprVisitor<String> {
    private static final Shapes INSTANCE = new Shapes();

    private Shapes() {}

    static String shape(Expr expr) {
        return expr.accept(INSTANCE);
    }

    @Override
    public String visitIdentifier(Expr.Identifier identifier) {
        return identifier.name();
    }

    @Override
    public String visitNumeral(Expr.Numeral numeral) {
        return numeral.value();
    }

    @Override
    public String visitSetLiteral(Expr.SetLiteral literal) {
        return "{" + list(literal.elements()) + "}";
    }

    @Override
    public String visitSequenceLiteral(Expr.SequenceLiteral literal) {
        return "<" + list(literal.elements()) + ">";
    }

    @Override
    public String visitBagLiteral(Expr.BagLiteral literal) {
        return "[[" + list(literal.elements()) + "]]";
    }

    @Override
    public String visitComprehension(Expr.Comprehension comprehension) {
        return comprehension.kind() + "{" + binders(comprehension.binders())
               + comprehension.predicate().map(p -> " | " + shape(p)).orElse("")
               + comprehension.yield().map(t -> " . " + shape(t)).orElse("") + "}";
    }

    @Override
    public String visitTuple(Expr.Tuple tuple) {
        return "(" + list(tuple.elements()) + ")";
    }

    @Override
    public String visitUnaryOp(Expr.UnaryOp unaryOp) {
        return "(" + unaryOp.operator() + " " + shape(unaryOp.operand()) + ")";
    }

    @Override
    public String visitBinaryOp(Expr.BinaryOp binaryOp) {
        return "(" + shape(binaryOp.left()) + " " + binaryOp.operator() + " " + shape(binaryOp.right()) + ")";
    }

    @Override
    public String visitRange(Expr.Range range) {
        return "(" + shape(range.from()) + " .. " + shape(range.to()) + ")";
    }

    @Override
    public String visitQuantifier(Expr.Quantifier quantifier) {
        return "(" + quantifier.kind() + " " + binders(quantifier.binders())
               + quantifier.constraint().map(c -> " | " + shape(c) + " .").orElse(" |")
               + " " + shape(quantifier.body()) + ")";
    }

    @Override
    public String visitMu(Expr.Mu mu) {
        return "(MU " + binders(mu.binders()) + " | " + shape(mu.predicate())
               + mu.yield().map(t -> " . " + shape(t)).orElse("") + ")";
    }

    @Override
    public String visitLambda(Expr.Lambda lambda) {
        return "(LAMBDA " + binders(lambda.binders()) + " . " + shape(lambda.body()) + ")";
    }

    @Override
    public String visitConditional(Expr.Conditional conditional) {
        return "(IF " + shape(conditional.condition()) + " THEN " + shape(conditional.thenBranch())
               + " ELSE " + shape(conditional.elseBranch()) + ")";
    }

    @Override
    public String visitGuardedCases(Expr.GuardedCases cases) {
        return cases.branches()
                    .stream()
                    .map(branch -> shape(branch.expression()) + " IF " + shape(branch.guard()))
                    .collect(Collectors.joining(" | ", "(CASES ", ")"));
    }

    @Override
    public String visitApplication(Expr.Application application) {
        return "(" + shape(application.function()) + " " + application.arguments()
                                                                     .stream()
                                                                     .map(Shapes::shape)
                                                                     .collect(Collectors.joining(" ")) + ")";
    }

    @Override
    public String visitGenericInstantiation(Expr.GenericInstantiation instantiation) {
        return shape(instantiation.base()) + "[" + list(instantiation.arguments()) + "]";
    }

    @Override
    public String visitTupleProjection(Expr.TupleProjection projection) {
        return shape(projection.tuple()) + "." + projection.component();
    }

    @Override
    public String visitRelationalImage(Expr.RelationalImage image) {
        return shape(image.relation()) + "(|" + shape(image.set()) + "|)";
    }

    @Override
    public String visitClosure(Expr.Closure closure) {
        return "(" + shape(closure.operand()) + " " + closure.kind() + ")";
    }

    @Override
    public String visitSuperscript(Expr.Superscript superscript) {
        return shape(superscript.base()) + "^" + shape(superscript.exponent());
    }

    @Override
    public String visitSubscript(Expr.Subscript subscript) {
        return shape(subscript.base()) + "_" + shape(subscript.index());
    }

    private static String list(List<Expr> elements) {
        return elements.stream()
                       .map(Shapes::shape)
                       .collect(Collectors.joining(", "));
    }

    private static String binders(List<BinderGroup> groups) {
        return groups.stream()
                     .map(group -> String.join(", ", group.names())
                                   + group.domain().map(d -> " : " + shape(d)).orElse(""))
                     .collect(Collectors.joining("; "));
    }
}
