package com.gridcalc.app.formula.ast;

/**
 * A node of a parsed formula. Trees are immutable and live only as long
 * as the evaluation or extraction call that parsed them.
 */
public interface Expr {

    <R> R accept(ExprVisitor<R> visitor);
}
