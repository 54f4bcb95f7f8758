package com.gridcalc.app.formula.ast;

/**
 * Prefix "+" or "-". The operator is ADD or SUBTRACT.
 */
public final class UnaryExpr implements Expr {
    private final Operator operator;
    private final Expr operand;

    public UnaryExpr(Operator operator, Expr operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return operator.getSymbol() + operand;
    }
}
