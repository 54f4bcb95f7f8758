package com.gridcalc.app.formula.ast;

/**
 * A rectangular block given by two corner identifiers, "A1:B3".
 */
public final class RangeExpr implements Expr {
    private final String start;
    private final String end;

    public RangeExpr(String start, String end) {
        this.start = start;
        this.end = end;
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
