package com.gridcalc.app.formula.ast;

/**
 * A bare identifier such as "B5". Decoding into coordinates happens at
 * evaluation time, so an undecodable name still parses.
 */
public final class ReferenceExpr implements Expr {
    private final String identifier;

    public ReferenceExpr(String identifier) {
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public String toString() {
        return identifier;
    }
}
