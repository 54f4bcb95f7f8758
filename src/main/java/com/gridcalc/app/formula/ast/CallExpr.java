package com.gridcalc.app.formula.ast;

import java.util.List;

/**
 * A function call NAME(arg, ...). The name is kept exactly as written;
 * matching against known functions is case-sensitive.
 */
public final class CallExpr implements Expr {
    private final String name;
    private final List<Expr> arguments;

    public CallExpr(String name, List<Expr> arguments) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Expr> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}
