package com.gridcalc.app.formula;

import com.gridcalc.app.exceptions.FormulaErrorKind;
import com.gridcalc.app.exceptions.FormulaException;

/**
 * Outcome of evaluating one formula: a value, or a value of 0 plus an error.
 * An empty error string means success.
 */
public final class EvaluationResult {
    private final double value;
    private final String error;
    private final FormulaErrorKind errorKind;

    private EvaluationResult(double value, String error, FormulaErrorKind errorKind) {
        this.value = value;
        this.error = error;
        this.errorKind = errorKind;
    }

    public static EvaluationResult success(double value) {
        return new EvaluationResult(value, "", null);
    }

    public static EvaluationResult failure(FormulaException e) {
        return new EvaluationResult(0, e.getMessage(), e.getKind());
    }

    public double getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    /**
     * Null when the evaluation succeeded.
     */
    public FormulaErrorKind getErrorKind() {
        return errorKind;
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    @Override
    public String toString() {
        return isSuccess() ? Double.toString(value) : errorKind + ": " + error;
    }
}
