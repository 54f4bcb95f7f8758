package com.gridcalc.app.exceptions;

/**
 * Categories of per-cell formula failures.
 * None of these stop an evaluation pass; they end up in the
 * affected formula cell's error field.
 */
public enum FormulaErrorKind {
    PARSE_FAILURE,
    UNKNOWN_TOKEN,
    UNKNOWN_REFERENCE,
    OUT_OF_BOUNDS,
    RANGE_OUT_OF_BOUNDS,
    DIVISION_BY_ZERO,
    TYPE_MISMATCH,
    UNSUPPORTED_OPERATION,
    INVALID_CRITERIA,
    CYCLIC_DEPENDENCY
}
