package com.gridcalc.app.formula.ast;

/**
 * A numeric literal, kept as source text until evaluation.
 */
public final class NumberLiteral implements Expr {
    private final String text;

    public NumberLiteral(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return text;
    }
}
