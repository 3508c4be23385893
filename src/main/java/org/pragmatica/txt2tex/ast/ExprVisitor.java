package org.pragmatica.txt2tex.ast;

/**
 * Exhaustive dispatch over {@link Expr} variants. Adding a variant breaks every implementation
 * until it handles the new case.
 */
public interface ExprVisitor<R> {
    R visitIdentifier(Expr.Identifier identifier);

    R visitNumeral(Expr.Numeral numeral);

    R visitSetLiteral(Expr.SetLiteral literal);

    R visitSequenceLiteral(Expr.SequenceLiteral literal);

    R visitBagLiteral(Expr.BagLiteral literal);

    R visitComprehension(Expr.Comprehension comprehension);

    R visitTuple(Expr.Tuple tuple);

    R visitUnaryOp(Expr.UnaryOp unaryOp);

    R visitBinaryOp(Expr.BinaryOp binaryOp);

    R visitRange(Expr.Range range);

    R visitQuantifier(Expr.Quantifier quantifier);

    R visitMu(Expr.Mu mu);

    R visitLambda(Expr.Lambda lambda);

    R visitConditional(Expr.Conditional conditional);

    R visitGuardedCases(Expr.GuardedCases cases);

    R visitApplication(Expr.Application application);

    R visitGenericInstantiation(Expr.GenericInstantiation instantiation);

    R visitTupleProjection(Expr.TupleProjection projection);

    R visitRelationalImage(Expr.RelationalImage image);

    R visitClosure(Expr.Closure closure);

    R visitSuperscript(Expr.Superscript superscript);

    R visitSubscript(Expr.Subscript subscript);
}
