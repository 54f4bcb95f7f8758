package com.gridcalc.app.formula.ast;

/**
 * One method per node kind, so every consumer handles every kind.
 */
public interface ExprVisitor<R> {

    R visitReference(ReferenceExpr expr);

    R visitRange(RangeExpr expr);

    R visitNumber(NumberLiteral expr);

    R visitString(StringLiteral expr);

    R visitBinary(BinaryExpr expr);

    R visitUnary(UnaryExpr expr);

    R visitGrouping(GroupingExpr expr);

    R visitCall(CallExpr expr);
}
