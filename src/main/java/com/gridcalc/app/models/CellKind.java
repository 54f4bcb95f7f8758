package com.gridcalc.app.models;

/**
 * The four shapes a grid cell can take.
 * NUMERIC, TEXT and EMPTY are plain inputs; FORMULA also caches
 * the result of the last evaluation pass.
 */
public enum CellKind {
    NUMERIC,
    TEXT,
    FORMULA,
    EMPTY
}
