package com.gridcalc.app.formula.ast;

public final class GroupingExpr implements Expr {
    private final Expr inner;

    public GroupingExpr(Expr inner) {
        this.inner = inner;
    }

    public Expr getInner() {
        return inner;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitGrouping(this);
    }

    @Override
    public String toString() {
        return "(" + inner + ")";
    }
}
