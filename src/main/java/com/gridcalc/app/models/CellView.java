package com.gridcalc.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Read-only snapshot of one cell as returned to clients:
 * {
 *   "id": "B1",
 *   "kind": "FORMULA",
 *   "rawValue": "=A1+1",
 *   "value": 2.0
 * }
 * "error" is only present for a formula whose last evaluation failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellView {
    private final String id;
    private final CellKind kind;
    private final String rawValue;
    private final Object value;
    private final String error;

    private CellView(String id, CellKind kind, String rawValue, Object value, String error) {
        this.id = id;
        this.kind = kind;
        this.rawValue = rawValue;
        this.value = value;
        this.error = error;
    }

    public static CellView of(String id, Cell cell) {
        switch (cell.getKind()) {
            case NUMERIC:
                return new CellView(id, CellKind.NUMERIC, cell.getRawValue(), ((NumericCell) cell).getValue(), null);
            case TEXT:
                return new CellView(id, CellKind.TEXT, cell.getRawValue(), ((TextCell) cell).getValue(), null);
            case FORMULA: {
                FormulaCell formula = (FormulaCell) cell;
                return new CellView(id, CellKind.FORMULA, formula.getFormula(), formula.getValue(),
                        formula.hasError() ? formula.getError() : null);
            }
            case EMPTY:
            default:
                return new CellView(id, CellKind.EMPTY, "", null, null);
        }
    }

    /**
     * What a renderer shows for the cell: the number, the text, or the
     * formula's error in place of its value. Null for an empty cell.
     */
    public Object displayValue() {
        return error != null ? error : value;
    }

    public String getId() {
        return id;
    }
    public CellKind getKind() {
        return kind;
    }
    public String getRawValue() {
        return rawValue;
    }
    public Object getValue() {
        return value;
    }
    public String getError() {
        return error;
    }
}
