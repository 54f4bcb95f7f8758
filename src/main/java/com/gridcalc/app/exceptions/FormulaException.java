package com.gridcalc.app.exceptions;

/**
 * Thrown while parsing or evaluating a single formula.
 * The evaluator catches it at the cell boundary and stores the message
 * in the cell, so it never aborts a whole grid evaluation.
 */
public class FormulaException extends RuntimeException {
    private final FormulaErrorKind kind;

    public FormulaException(FormulaErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FormulaException(FormulaErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FormulaErrorKind getKind() {
        return kind;
    }
}
