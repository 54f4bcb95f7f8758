package com.gridcalc.app.models;

import java.util.regex.Pattern;

/**
 * Represents a single grid cell.
 * The set of subclasses is closed: {@link NumericCell}, {@link TextCell},
 * {@link FormulaCell} and {@link EmptyCell}. Callers branch on {@link #getKind()}.
 */
public abstract class Cell {
    // plain decimal notation with an optional exponent
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    Cell() {
    }

    public abstract CellKind getKind();

    /**
     * The text the user typed to produce this cell, e.g. "42", "hello" or "=A1+1".
     */
    public abstract String getRawValue();

    public boolean isEmpty() {
        return getKind() == CellKind.EMPTY;
    }

    // Factories
    public static NumericCell numeric(double value) {
        return new NumericCell(value);
    }

    public static TextCell text(String value) {
        return new TextCell(value);
    }

    public static FormulaCell formula(String formula) {
        return new FormulaCell(formula);
    }

    public static EmptyCell empty() {
        return EmptyCell.INSTANCE;
    }

    /**
     * Converts raw editor input into a cell:
     * blank -> Empty, leading "=" -> Formula, a number -> Numeric, anything else -> Text.
     */
    public static Cell fromInput(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return empty();
        }
        String trimmed = rawValue.trim();
        if (trimmed.startsWith("=")) {
            return formula(trimmed);
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            double parsed = Double.parseDouble(trimmed);
            if (Double.isFinite(parsed)) {
                return numeric(parsed);
            }
        }
        return text(rawValue);
    }
}
