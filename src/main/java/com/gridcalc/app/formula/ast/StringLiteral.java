package com.gridcalc.app.formula.ast;

/**
 * A double-quoted string with the quotes already stripped.
 * Only meaningful as the criteria argument of COUNTIF/SUMIF.
 */
public final class StringLiteral implements Expr {
    private final String value;

    public StringLiteral(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
