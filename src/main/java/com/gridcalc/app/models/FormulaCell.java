package com.gridcalc.app.models;

import java.util.Objects;

/**
 * A cell holding a formula such as "=SUM(A1:B2)".
 * Stores:
 * - the formula text, including the leading "="
 * - value: the result of the most recent grid evaluation pass
 * - error: the error message of that pass, empty when there was none
 *
 * value and error are stale between an edit and the next pass.
 */
public final class FormulaCell extends Cell {
    private final String formula;
    private double value;
    private String error = "";

    FormulaCell(String formula) {
        this.formula = Objects.requireNonNull(formula, "formula");
    }

    public String getFormula() {
        return formula;
    }

    public double getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    public boolean hasError() {
        return !error.isEmpty();
    }

    /**
     * Stores the outcome of an evaluation pass. A null error is stored as "".
     */
    public void setResult(double value, String error) {
        this.value = value;
        this.error = error == null ? "" : error;
    }

    @Override
    public CellKind getKind() {
        return CellKind.FORMULA;
    }

    @Override
    public String getRawValue() {
        return formula;
    }
}
