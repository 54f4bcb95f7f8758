package com.gridcalc.app.models;

public final class NumericCell extends Cell {
    private final double value;

    NumericCell(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public CellKind getKind() {
        return CellKind.NUMERIC;
    }

    @Override
    public String getRawValue() {
        // Whole numbers print without the trailing ".0"
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
